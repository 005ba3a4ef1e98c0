package com.bitflag.types;

import com.bitflag.util.HexDigits;

import java.util.Locale;
import java.util.Objects;
import java.util.function.LongFunction;

/**
 * Bits types of up to 64 bits, computed on {@code long} and narrowed back to the carrier.
 */
final class LongBitsType<B extends Number> implements BitsType<B> {
    private final String name;
    private final int width;
    private final boolean signed;
    private final long mask;
    private final LongFunction<B> narrow;
    private final B zero;
    private final B allOnes;

    LongBitsType(String name, int width, boolean signed, LongFunction<B> narrow) {
        this.name = name;
        this.width = width;
        this.signed = signed;
        this.mask = width == Long.SIZE ? -1L : (1L << width) - 1;
        this.narrow = narrow;
        this.zero = narrow.apply(0L);
        this.allOnes = narrow.apply(-1L);
    }

    @Override
    public String name() { return name; }

    @Override
    public int width() { return width; }

    @Override
    public boolean isSigned() { return signed; }

    @Override
    public B zero() { return zero; }

    @Override
    public B allOnes() { return allOnes; }

    @Override
    public B and(B a, B b) {
        return narrow.apply(a.longValue() & b.longValue());
    }

    @Override
    public B or(B a, B b) {
        return narrow.apply(a.longValue() | b.longValue());
    }

    @Override
    public B xor(B a, B b) {
        return narrow.apply(a.longValue() ^ b.longValue());
    }

    @Override
    public B not(B a) {
        return narrow.apply(~a.longValue());
    }

    @Override
    public boolean isZero(B a) {
        return a.longValue() == 0L;
    }

    @Override
    public B fromLong(long value) {
        return narrow.apply(value);
    }

    @Override
    public B parseHex(String digits) {
        Objects.requireNonNull(digits, "Digits cannot be null");
        return narrow.apply(Long.parseUnsignedLong(HexDigits.significant(digits, width), 16));
    }

    @Override
    public String toHexString(B a) {
        return Long.toHexString(unsigned(a)).toUpperCase(Locale.ROOT);
    }

    @Override
    public String toOctalString(B a) {
        return Long.toOctalString(unsigned(a));
    }

    @Override
    public String toBinaryString(B a) {
        return Long.toBinaryString(unsigned(a));
    }

    @Override
    public int compare(B a, B b) {
        return signed
                ? Long.compare(a.longValue(), b.longValue())
                : Long.compareUnsigned(unsigned(a), unsigned(b));
    }

    private long unsigned(B a) {
        return a.longValue() & mask;
    }

    @Override
    public String toString() {
        return name;
    }
}
