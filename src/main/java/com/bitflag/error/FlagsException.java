package com.bitflag.error;

import lombok.Getter;

/**
 * Exception thrown when flags text cannot be parsed.
 */
@Getter
public class FlagsException extends Exception {
    private final ErrorType errorType;
    /**
     * The offending segment, already trimmed. Empty for {@link ErrorType#EMPTY_FLAG}.
     */
    private final String flag;

    public FlagsException(ErrorType errorType, String flag, String message) {
        super(message);
        this.errorType = errorType;
        this.flag = flag;
    }

    public FlagsException(ErrorType errorType, String flag, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.flag = flag;
    }

    public static FlagsException emptyFlag() {
        return new FlagsException(ErrorType.EMPTY_FLAG, "", "encountered empty flag");
    }

    public static FlagsException invalidNamedFlag(String flag) {
        return new FlagsException(ErrorType.INVALID_NAMED_FLAG, flag, "unrecognized named flag `" + flag + "`");
    }

    public static FlagsException invalidHexFlag(String flag) {
        return new FlagsException(ErrorType.INVALID_HEX_FLAG, flag, "invalid hex flag `" + flag + "`");
    }

    public static FlagsException invalidHexFlag(String flag, Throwable cause) {
        return new FlagsException(ErrorType.INVALID_HEX_FLAG, flag, "invalid hex flag `" + flag + "`", cause);
    }

    @Override
    public String toString() {
        return String.format("FlagsException{type=%s, message='%s'}", errorType, getMessage());
    }
}
