package com.bitflag.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FlagsExceptionTest {

    @Test
    void shouldDescribeEachErrorType() {
        var empty = FlagsException.emptyFlag();
        assertThat(empty.getErrorType()).isEqualTo(ErrorType.EMPTY_FLAG);
        assertThat(empty.getFlag()).isEmpty();
        assertThat(empty).hasMessage("encountered empty flag");

        var named = FlagsException.invalidNamedFlag("Nope");
        assertThat(named.getErrorType()).isEqualTo(ErrorType.INVALID_NAMED_FLAG);
        assertThat(named.getFlag()).isEqualTo("Nope");
        assertThat(named).hasMessage("unrecognized named flag `Nope`");

        var hex = FlagsException.invalidHexFlag("0xzz");
        assertThat(hex.getErrorType()).isEqualTo(ErrorType.INVALID_HEX_FLAG);
        assertThat(hex).hasMessage("invalid hex flag `0xzz`").hasNoCause();
    }

    @Test
    void shouldKeepCauseOfHexFailure() {
        var cause = new NumberFormatException("Invalid hex digit 'z'");

        var error = FlagsException.invalidHexFlag("0xz", cause);

        assertThat(error).hasCause(cause);
        assertThat(error.toString())
            .isEqualTo("FlagsException{type=INVALID_HEX_FLAG, message='invalid hex flag `0xz`'}");
    }
}
