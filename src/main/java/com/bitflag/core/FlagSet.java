package com.bitflag.core;

import com.bitflag.error.FlagsException;
import com.bitflag.text.FlagsParser;
import com.bitflag.types.BitsType;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The descriptor of one kind of flags: an ordered table of named flags over a {@link BitsType},
 * plus bits that are known without being named.
 * <p>
 * A flag set is immutable once built and is meant to be declared once, as a constant, then shared.
 * Every {@link Flags} value points at the flag set it belongs to; values of different flag sets
 * never mix.
 * <p>
 * Usage:
 * <pre>
 *   static final FlagSet&lt;Byte&gt; PERMISSIONS = FlagSet.builder("Permissions", BitsType.U8)
 *       .flag("READ", 0b001)
 *       .flag("WRITE", 0b010)
 *       .flag("EXECUTE", 0b100)
 *       .flagOf("ALL", "READ", "WRITE", "EXECUTE")
 *       .build();
 * </pre>
 *
 * @param <B> the carrier type of the bits
 */
public final class FlagSet<B> {
    private static final Logger log = LoggerFactory.getLogger(FlagSet.class);

    @Getter
    private final String typeName;
    @Getter
    private final BitsType<B> bitsType;
    /**
     * The named flags, in declaration order.
     */
    @Getter
    private final List<FlagDefinition<B>> knownFlags;
    /**
     * Bits treated as known although no flag names them.
     */
    @Getter
    private final B extraValidBits;

    private final Object2IntOpenHashMap<String> firstIndexByName;
    private final Flags<B> empty;
    private final Flags<B> allBits;
    private final Flags<B> allNamed;
    private final Flags<B> all;
    private final Flags<B> defaultValue;
    private final Comparator<Flags<B>> ordering;

    private FlagSet(Builder<B> builder) {
        this.typeName = builder.typeName;
        this.bitsType = builder.bitsType;
        this.extraValidBits = builder.extraValidBits != null ? builder.extraValidBits : bitsType.zero();

        var definitions = new ArrayList<FlagDefinition<B>>(builder.declared.size());
        this.firstIndexByName = new Object2IntOpenHashMap<>(builder.declared.size());
        firstIndexByName.defaultReturnValue(-1);

        var named = bitsType.zero();
        for (var declared : builder.declared) {
            var previous = firstIndexByName.putIfAbsent(declared.getName(), definitions.size());
            if (previous != -1) {
                log.warn("Duplicate flag name '{}' in {}, lookups resolve to the first declaration",
                        declared.getName(), typeName);
            }
            definitions.add(new FlagDefinition<>(declared.getName(), new Flags<>(this, declared.getBits())));
            named = bitsType.or(named, declared.getBits());
        }
        this.knownFlags = Collections.unmodifiableList(definitions);

        this.empty = new Flags<>(this, bitsType.zero());
        this.allBits = new Flags<>(this, bitsType.allOnes());
        this.allNamed = new Flags<>(this, named);
        this.all = new Flags<>(this, bitsType.or(named, extraValidBits));
        this.defaultValue = builder.defaultValue != null ? new Flags<>(this, builder.defaultValue) : empty;
        this.ordering = (a, b) -> bitsType.compare(a.getBits(), b.getBits());
    }

    public static <B> Builder<B> builder(String typeName, BitsType<B> bitsType) {
        return new Builder<>(typeName, bitsType);
    }

    /**
     * @return the value with no bits set
     */
    public Flags<B> empty() {
        return empty;
    }

    /**
     * @return the value with every bit of the bits type set, known or not
     */
    public Flags<B> allBits() {
        return allBits;
    }

    /**
     * @return the value with the bits of every named flag set, extra valid bits left out
     */
    public Flags<B> allNamed() {
        return allNamed;
    }

    /**
     * @return the value with every known bit set: all named flags plus the extra valid bits
     */
    public Flags<B> all() {
        return all;
    }

    /**
     * @return the declared default value, or {@link #empty()} when none was declared
     */
    public Flags<B> defaultValue() {
        return defaultValue;
    }

    /**
     * Convert from raw bits, rejecting any unknown bit.
     */
    public Optional<Flags<B>> fromBits(B bits) {
        var value = fromBitsRetain(bits);
        return value.containsUnknownBits() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Convert from raw bits, dropping unknown bits.
     */
    public Flags<B> fromBitsTruncate(B bits) {
        return fromBitsRetain(bits).truncate();
    }

    /**
     * Convert from raw bits exactly, unknown bits included.
     */
    public Flags<B> fromBitsRetain(B bits) {
        Objects.requireNonNull(bits, "Bits cannot be null");
        // normalizes carriers that can hold more than the type's width
        return new Flags<>(this, bitsType.and(bits, bitsType.allOnes()));
    }

    /**
     * Look up a flag by its exact, case-sensitive name. The first declaration wins.
     *
     * @return the flag's full value, or empty if the name is empty or unknown
     */
    public Optional<Flags<B>> fromFlagName(String name) {
        Objects.requireNonNull(name, "Name cannot be null");
        if (name.isEmpty())
            return Optional.empty();
        int index = firstIndexByName.getInt(name);
        return index < 0 ? Optional.empty() : Optional.of(knownFlags.get(index).getValue());
    }

    /**
     * Like {@link #fromFlagName(String)}, for names known to exist.
     *
     * @throws IllegalArgumentException if no flag has this name
     */
    public Flags<B> flag(String name) {
        return fromFlagName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown flag '" + name + "' in " + typeName));
    }

    /**
     * @return the union of all given values
     */
    public Flags<B> fromIterable(Iterable<Flags<B>> values) {
        return empty.extend(values);
    }

    /**
     * Orders values of this flag set by their bits, as signed or unsigned integers depending
     * on the bits type.
     */
    public Comparator<Flags<B>> ordering() {
        return ordering;
    }

    /**
     * Parse the text form, keeping hex literals as they are.
     *
     * @see FlagsParser#fromText(FlagSet, CharSequence)
     */
    public Flags<B> parse(CharSequence text) throws FlagsException {
        return FlagsParser.fromText(this, text);
    }

    @Override
    public String toString() {
        var names = new ArrayList<String>(knownFlags.size());
        for (var definition : knownFlags) {
            names.add(definition.getName());
        }
        return "FlagSet{" + typeName + ": " + bitsType.name() + " " + names + "}";
    }

    @Value
    private static class DeclaredFlag<B> {
        String name;
        B bits;
    }

    /**
     * Declares the flags of a {@link FlagSet} in order. Declaration order matters: it is the
     * order in which values are decomposed and therefore the order of names in the text form.
     */
    public static final class Builder<B> {
        private final String typeName;
        private final BitsType<B> bitsType;
        private final List<DeclaredFlag<B>> declared = new ArrayList<>();
        private B extraValidBits;
        private B defaultValue;

        private Builder(String typeName, BitsType<B> bitsType) {
            this.typeName = Objects.requireNonNull(typeName, "Type name cannot be null");
            this.bitsType = Objects.requireNonNull(bitsType, "Bits type cannot be null");
        }

        public Builder<B> flag(String name, B bits) {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(bits, "Bits cannot be null");
            declared.add(new DeclaredFlag<>(name, normalize(bits)));
            return this;
        }

        public Builder<B> flag(String name, long bits) {
            return flag(name, bitsType.fromLong(bits));
        }

        /**
         * Declare a flag as the union of flags declared before it, such as a shorthand for a
         * group of single-bit flags.
         *
         * @throws IllegalArgumentException if a part has not been declared yet
         */
        public Builder<B> flagOf(String name, String... parts) {
            var bits = bitsType.zero();
            for (var part : parts) {
                bits = bitsType.or(bits, declaredBits(part));
            }
            return flag(name, bits);
        }

        public Builder<B> extraValidBits(B bits) {
            this.extraValidBits = normalize(Objects.requireNonNull(bits, "Bits cannot be null"));
            return this;
        }

        /**
         * Treat every bit as known, for flags mirroring a source that may define more bits later.
         */
        public Builder<B> nonExhaustive() {
            return extraValidBits(bitsType.allOnes());
        }

        public Builder<B> defaultValue(B bits) {
            this.defaultValue = normalize(Objects.requireNonNull(bits, "Bits cannot be null"));
            return this;
        }

        public FlagSet<B> build() {
            var flagSet = new FlagSet<>(this);
            log.debug("Built flag set {} over {} with {} flags, extra valid bits 0x{}",
                    typeName, bitsType.name(), declared.size(), bitsType.toHexString(flagSet.extraValidBits));
            return flagSet;
        }

        private B declaredBits(String name) {
            for (var flag : declared) {
                if (flag.getName().equals(name))
                    return flag.getBits();
            }
            throw new IllegalArgumentException("Flag '" + name + "' must be declared before it is used in " + typeName);
        }

        private B normalize(B bits) {
            return bitsType.and(bits, bitsType.allOnes());
        }
    }
}
