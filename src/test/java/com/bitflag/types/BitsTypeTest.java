package com.bitflag.types;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

class BitsTypeTest {

    @Test
    void shouldReportWidthAndSignedness() {
        assertThat(BitsType.U8.width()).isEqualTo(8);
        assertThat(BitsType.I16.width()).isEqualTo(16);
        assertThat(BitsType.U32.width()).isEqualTo(32);
        assertThat(BitsType.I64.width()).isEqualTo(64);
        assertThat(BitsType.U128.width()).isEqualTo(128);

        assertThat(BitsType.U8.isSigned()).isFalse();
        assertThat(BitsType.I8.isSigned()).isTrue();
        assertThat(BitsType.I128.isSigned()).isTrue();
        assertThat(BitsType.U64.name()).isEqualTo("u64");
    }

    @Test
    void shouldApplyBitwiseOperations() {
        var u8 = BitsType.U8;
        byte a = 0b0101;
        byte b = 0b0011;

        assertThat(u8.and(a, b)).isEqualTo((byte) 0b0001);
        assertThat(u8.or(a, b)).isEqualTo((byte) 0b0111);
        assertThat(u8.xor(a, b)).isEqualTo((byte) 0b0110);
        assertThat(u8.not(a)).isEqualTo((byte) 0b1111_1010);
        assertThat(u8.not(u8.zero())).isEqualTo(u8.allOnes());
        assertThat(u8.isZero(u8.zero())).isTrue();
        assertThat(u8.isZero(a)).isFalse();
    }

    @Test
    void shouldRenderTwoComplementPatterns() {
        assertThat(BitsType.I8.toHexString((byte) -1)).isEqualTo("FF");
        assertThat(BitsType.U8.toHexString((byte) 0x0B)).isEqualTo("B");
        assertThat(BitsType.U8.toLowerHexString((byte) 0x0B)).isEqualTo("b");
        assertThat(BitsType.U8.toOctalString((byte) 0xFF)).isEqualTo("377");
        assertThat(BitsType.U8.toBinaryString((byte) 0x0B)).isEqualTo("1011");
        assertThat(BitsType.I32.toHexString(Integer.MIN_VALUE)).isEqualTo("80000000");
        assertThat(BitsType.U64.toHexString(-1L)).isEqualTo("FFFFFFFFFFFFFFFF");
        assertThat(BitsType.I128.toHexString(BigInteger.valueOf(-1))).isEqualTo("F".repeat(32));
    }

    @Test
    void shouldParseHexWithinWidth() {
        assertThat(BitsType.U8.parseHex("ff")).isEqualTo((byte) 0xFF);
        assertThat(BitsType.U8.parseHex("000000FF")).isEqualTo((byte) 0xFF);
        assertThat(BitsType.U8.parseHex("0")).isEqualTo((byte) 0);
        assertThat(BitsType.I8.parseHex("80")).isEqualTo((byte) -128);
        assertThat(BitsType.U16.parseHex("BEEF")).isEqualTo((short) 0xBEEF);
        assertThat(BitsType.U64.parseHex("FFFFFFFFFFFFFFFF")).isEqualTo(-1L);
        assertThat(BitsType.U128.parseHex("1" + "0".repeat(31))).isEqualTo(BigInteger.ONE.shiftLeft(124));
        assertThat(BitsType.I128.parseHex("8" + "0".repeat(31))).isEqualTo(BigInteger.ONE.shiftLeft(127).negate());
    }

    @Test
    void shouldRejectMalformedHex() {
        assertThatThrownBy(() -> BitsType.U8.parseHex("")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U8.parseHex("g")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U8.parseHex("+1")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.I8.parseHex("-1")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U8.parseHex("100")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U8.parseHex("ffffffffffff")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U64.parseHex("1" + "0".repeat(16))).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> BitsType.U128.parseHex("1" + "0".repeat(32))).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void shouldCompareBySignedness() {
        assertThat(BitsType.U8.compare((byte) 0x80, (byte) 0x01)).isPositive();
        assertThat(BitsType.I8.compare((byte) 0x80, (byte) 0x01)).isNegative();
        assertThat(BitsType.U128.compare(BitsType.U128.allOnes(), BigInteger.ONE)).isPositive();
        assertThat(BitsType.I128.compare(BitsType.I128.allOnes(), BigInteger.ONE)).isNegative();
    }

    @Test
    void shouldKeepWideCarriersNormalized() {
        var u128 = BitsType.U128;
        var i128 = BitsType.I128;

        assertThat(u128.allOnes()).isEqualTo(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE));
        assertThat(i128.allOnes()).isEqualTo(BigInteger.valueOf(-1));
        assertThat(u128.not(BigInteger.ZERO)).isEqualTo(u128.allOnes());
        assertThat(u128.fromLong(-1L)).isEqualTo(u128.allOnes());
        assertThat(u128.or(BigInteger.ONE.shiftLeft(200), BigInteger.ONE)).isEqualTo(BigInteger.ONE);
        assertThat(i128.xor(i128.allOnes(), BigInteger.ONE)).isEqualTo(BigInteger.valueOf(-2));
    }

    @Test
    void shouldTruncateLongsToWidth() {
        assertThat(BitsType.U8.fromLong(0x1FF)).isEqualTo((byte) 0xFF);
        assertThat(BitsType.I16.fromLong(0x18000)).isEqualTo((short) 0x8000);
        assertThat(BitsType.U32.fromLong(1L << 32)).isEqualTo(0);
    }

    @Test
    void shouldNeedOctalDigitsForFullWidth() {
        assertThat(BitsType.U8.octalDigits()).isEqualTo(3);
        assertThat(BitsType.U16.octalDigits()).isEqualTo(6);
        assertThat(BitsType.U32.octalDigits()).isEqualTo(11);
        assertThat(BitsType.U64.octalDigits()).isEqualTo(22);
        assertThat(BitsType.U128.octalDigits()).isEqualTo(43);
    }
}
