package com.bitflag.types;

import com.bitflag.util.HexDigits;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * 128-bit bits types.
 * <p>
 * Carriers are kept normalized: unsigned values in {@code [0, 2^128)}, signed values in
 * {@code [-2^127, 2^127)}. {@link BigInteger#equals} is then bit equality.
 */
final class BigIntegerBitsType implements BitsType<BigInteger> {
    private static final int WIDTH = 128;
    private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(WIDTH);
    private static final BigInteger MASK = MODULUS.subtract(BigInteger.ONE);

    private final String name;
    private final boolean signed;
    private final BigInteger allOnes;

    BigIntegerBitsType(String name, boolean signed) {
        this.name = name;
        this.signed = signed;
        this.allOnes = normalize(MASK);
    }

    @Override
    public String name() { return name; }

    @Override
    public int width() { return WIDTH; }

    @Override
    public boolean isSigned() { return signed; }

    @Override
    public BigInteger zero() { return BigInteger.ZERO; }

    @Override
    public BigInteger allOnes() { return allOnes; }

    // BigInteger bit operations act on an infinite two's-complement expansion
    @Override
    public BigInteger and(BigInteger a, BigInteger b) {
        return normalize(a.and(b));
    }

    @Override
    public BigInteger or(BigInteger a, BigInteger b) {
        return normalize(a.or(b));
    }

    @Override
    public BigInteger xor(BigInteger a, BigInteger b) {
        return normalize(a.xor(b));
    }

    @Override
    public BigInteger not(BigInteger a) {
        return normalize(a.not());
    }

    @Override
    public boolean isZero(BigInteger a) {
        return a.signum() == 0;
    }

    @Override
    public BigInteger fromLong(long value) {
        return normalize(BigInteger.valueOf(value));
    }

    @Override
    public BigInteger parseHex(String digits) {
        Objects.requireNonNull(digits, "Digits cannot be null");
        return normalize(new BigInteger(HexDigits.significant(digits, WIDTH), 16));
    }

    @Override
    public String toHexString(BigInteger a) {
        return a.and(MASK).toString(16).toUpperCase(Locale.ROOT);
    }

    @Override
    public String toOctalString(BigInteger a) {
        return a.and(MASK).toString(8);
    }

    @Override
    public String toBinaryString(BigInteger a) {
        return a.and(MASK).toString(2);
    }

    @Override
    public int compare(BigInteger a, BigInteger b) {
        return signed ? a.compareTo(b) : a.and(MASK).compareTo(b.and(MASK));
    }

    private BigInteger normalize(BigInteger value) {
        var bits = value.and(MASK);
        if (signed && bits.testBit(WIDTH - 1)) {
            return bits.subtract(MODULUS);
        }
        return bits;
    }

    @Override
    public String toString() {
        return name;
    }
}
