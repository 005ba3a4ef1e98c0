package com.bitflag.types;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Fixed-width integer backing a flags value.
 * <p>
 * Each instance is a stateless strategy over a boxed carrier type. Bit operations and the
 * radix renderings always work on the two's-complement bit pattern of {@link #width()} bits,
 * so signed and unsigned types of the same width only differ in how they {@link #compare}.
 *
 * @param <B> the carrier type holding the bits
 */
public interface BitsType<B> {

    /**
     * @return short type name such as {@code u8} or {@code i128}
     */
    String name();

    int width();

    boolean isSigned();

    B zero();

    B allOnes();

    B and(B a, B b);

    B or(B a, B b);

    B xor(B a, B b);

    B not(B a);

    boolean isZero(B a);

    /**
     * Convert a {@code long} to this type, keeping its low {@link #width()} bits.
     */
    B fromLong(long value);

    /**
     * Parse hexadecimal digits (no prefix, no sign) into this type.
     *
     * @throws NumberFormatException if the digits are empty, not hexadecimal, or need more than {@link #width()} bits
     */
    B parseHex(String digits);

    /**
     * @return the bits as unpadded uppercase hexadecimal
     */
    String toHexString(B a);

    String toOctalString(B a);

    String toBinaryString(B a);

    int compare(B a, B b);

    default String toLowerHexString(B a) {
        return toHexString(a).toLowerCase(Locale.ROOT);
    }

    /**
     * @return number of octal digits needed for every value of this width
     */
    default int octalDigits() {
        return (width() + 2) / 3;
    }

    BitsType<Byte> U8 = new LongBitsType<>("u8", 8, false, value -> (byte) value);
    BitsType<Byte> I8 = new LongBitsType<>("i8", 8, true, value -> (byte) value);
    BitsType<Short> U16 = new LongBitsType<>("u16", 16, false, value -> (short) value);
    BitsType<Short> I16 = new LongBitsType<>("i16", 16, true, value -> (short) value);
    BitsType<Integer> U32 = new LongBitsType<>("u32", 32, false, value -> (int) value);
    BitsType<Integer> I32 = new LongBitsType<>("i32", 32, true, value -> (int) value);
    BitsType<Long> U64 = new LongBitsType<>("u64", 64, false, value -> value);
    BitsType<Long> I64 = new LongBitsType<>("i64", 64, true, value -> value);
    BitsType<BigInteger> U128 = new BigIntegerBitsType("u128", false);
    BitsType<BigInteger> I128 = new BigIntegerBitsType("i128", true);
}
