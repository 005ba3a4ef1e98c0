package com.bitflag;

public final class Constants {
    public static final char DELIMITER = '|';
    public static final String SEPARATOR = " | ";
    public static final String HEX_PREFIX = "0x";
    public static final String BINARY_PREFIX = "0b";
    public static final String OCTAL_PREFIX = "0o";

    private Constants() {}
}
