package com.bitflag.core;

import com.bitflag.Constants;
import com.bitflag.iter.FlagIterator;
import com.bitflag.iter.FlagNameIterator;
import com.bitflag.text.FlagsWriter;
import com.bitflag.types.BitsType;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Iterator;
import java.util.Objects;

/**
 * An immutable flags value: raw bits interpreted through a {@link FlagSet}.
 * <p>
 * Values are created through their flag set ({@link FlagSet#fromBits}, {@link FlagSet#fromFlagName}, ...).
 * Operations never change a value; the "mutating" ones ({@link #set}, {@link #unset}, {@link #toggle},
 * {@link #truncate}, {@link #extend}, {@link #clear}) return the replacement value.
 * <p>
 * Unless the method says otherwise, results are not truncated: bits outside {@link FlagSet#all()}
 * survive every operation. Mixing values of two different flag sets is an {@link IllegalArgumentException}.
 *
 * @param <B> the carrier type of the bits
 */
@Getter
@EqualsAndHashCode
public final class Flags<B> implements Iterable<Flags<B>> {
    private final FlagSet<B> flagSet;
    /**
     * The raw stored bits, unknown bits included.
     */
    private final B bits;

    Flags(FlagSet<B> flagSet, B bits) {
        this.flagSet = flagSet;
        this.bits = bits;
    }

    public boolean isEmpty() {
        return type().isZero(bits);
    }

    public boolean isAllBits() {
        return bits.equals(type().allOnes());
    }

    /**
     * @return {@code true} if every known bit is set. Unknown bits may be set as well.
     */
    public boolean isAll() {
        return contains(flagSet.all());
    }

    /**
     * Like {@link #isAll()}, ignoring the extra valid bits.
     */
    public boolean isAllNamed() {
        return contains(flagSet.allNamed());
    }

    public boolean containsUnknownBits() {
        return !type().isZero(type().and(bits, type().not(flagSet.all().bits)));
    }

    /**
     * @return this value without its unknown bits
     */
    public Flags<B> truncate() {
        return with(type().and(bits, flagSet.all().bits));
    }

    /**
     * @return {@code true} if any bit of {@code other} is set here; never for a zero-bit flag
     */
    public boolean intersects(Flags<B> other) {
        return !type().isZero(type().and(bits, same(other).bits));
    }

    /**
     * @return {@code true} if every bit of {@code other} is set here; always for a zero-bit flag
     */
    public boolean contains(Flags<B> other) {
        return type().and(bits, same(other).bits).equals(other.bits);
    }

    /**
     * Bitwise NOT over the full width. Unknown bits become set.
     *
     * @see #complement()
     */
    public Flags<B> not() {
        return with(type().not(bits));
    }

    /**
     * Bitwise NOT restricted to the known bits.
     */
    public Flags<B> complement() {
        return not().truncate();
    }

    public Flags<B> and(Flags<B> other) {
        return with(type().and(bits, same(other).bits));
    }

    public Flags<B> intersection(Flags<B> other) {
        return and(other);
    }

    public Flags<B> or(Flags<B> other) {
        return with(type().or(bits, same(other).bits));
    }

    public Flags<B> union(Flags<B> other) {
        return or(other);
    }

    public Flags<B> xor(Flags<B> other) {
        return with(type().xor(bits, same(other).bits));
    }

    public Flags<B> symmetricDifference(Flags<B> other) {
        return xor(other);
    }

    /**
     * The bits set here and not in {@code other}. Uses the untruncated {@link #not()} of
     * {@code other}, so unknown bits of {@code other} are removed too.
     */
    public Flags<B> difference(Flags<B> other) {
        return with(type().and(bits, type().not(same(other).bits)));
    }

    /**
     * @return the empty value of this flag set
     */
    public Flags<B> clear() {
        return flagSet.empty();
    }

    public Flags<B> set(Flags<B> other) {
        return union(other);
    }

    public Flags<B> unset(Flags<B> other) {
        return difference(other);
    }

    public Flags<B> toggle(Flags<B> other) {
        return symmetricDifference(other);
    }

    /**
     * @return the union of this value and every given value
     */
    public Flags<B> extend(Iterable<Flags<B>> others) {
        var result = this;
        for (var other : others) {
            result = result.set(other);
        }
        return result;
    }

    /**
     * Decompose into contained named flags, followed by one value holding any bits those
     * flags do not explain. The union of everything yielded is this value.
     */
    public FlagIterator<B> iter() {
        return new FlagIterator<>(this);
    }

    /**
     * Decompose into contained named flags only.
     */
    public FlagNameIterator<B> iterNames() {
        return new FlagNameIterator<>(this);
    }

    @Override
    public Iterator<Flags<B>> iterator() {
        return iter();
    }

    public String toHexString() {
        return type().toHexString(bits);
    }

    public String toLowerHexString() {
        return type().toLowerHexString(bits);
    }

    public String toOctalString() {
        return type().toOctalString(bits);
    }

    public String toBinaryString() {
        return type().toBinaryString(bits);
    }

    @Override
    public String toString() {
        var type = type();
        return flagSet.getTypeName() + " { flags: "
                + (isEmpty() ? Constants.HEX_PREFIX + "0" : FlagsWriter.toText(this))
                + ", bits: " + Constants.BINARY_PREFIX + zeroPad(type.toBinaryString(bits), type.width())
                + ", octal: " + Constants.OCTAL_PREFIX + zeroPad(type.toOctalString(bits), type.octalDigits())
                + ", hex: " + Constants.HEX_PREFIX + zeroPad(type.toHexString(bits), type.width() / 4)
                + " }";
    }

    private BitsType<B> type() {
        return flagSet.getBitsType();
    }

    private Flags<B> with(B newBits) {
        return new Flags<>(flagSet, newBits);
    }

    private Flags<B> same(Flags<B> other) {
        Objects.requireNonNull(other, "Other flags cannot be null");
        if (other.flagSet != flagSet) {
            throw new IllegalArgumentException("Cannot combine " + flagSet.getTypeName()
                    + " with " + other.flagSet.getTypeName());
        }
        return other;
    }

    private static String zeroPad(String digits, int width) {
        return digits.length() >= width ? digits : "0".repeat(width - digits.length()) + digits;
    }
}
