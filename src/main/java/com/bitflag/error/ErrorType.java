package com.bitflag.error;

/**
 * Types of errors that can occur while parsing flags text.
 */
public enum ErrorType {
    EMPTY_FLAG,
    INVALID_NAMED_FLAG,
    INVALID_HEX_FLAG
}
