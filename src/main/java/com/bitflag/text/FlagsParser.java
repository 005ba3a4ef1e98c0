package com.bitflag.text;

import com.bitflag.Constants;
import com.bitflag.core.FlagSet;
import com.bitflag.core.Flags;
import com.bitflag.error.FlagsException;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Parses the text form written by {@link FlagsWriter}.
 * <p>
 * The input is split on {@code |} and each segment is trimmed of surrounding Unicode whitespace
 * (including no-break space and next line).
 * A segment is either a {@code 0x} hex literal or the exact, case-sensitive name of a flag.
 * Blank input parses to the empty value.
 */
@UtilityClass
public final class FlagsParser {
    private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
    // empty segments are kept so they can be reported
    private static final Splitter SEGMENTS = Splitter.on(Constants.DELIMITER).trimResults(WHITESPACE);

    /**
     * Parse names and hex literals. Bits from hex literals are kept even when unknown.
     *
     * @throws FlagsException on an empty segment, an unknown name or a malformed hex literal
     */
    public static <B> Flags<B> fromText(FlagSet<B> flagSet, CharSequence input) throws FlagsException {
        return parse(flagSet, input, false);
    }

    /**
     * Like {@link #fromText}, then drop unknown bits.
     */
    public static <B> Flags<B> fromTextTruncate(FlagSet<B> flagSet, CharSequence input) throws FlagsException {
        return fromText(flagSet, input).truncate();
    }

    /**
     * Parse names only. Any hex literal is rejected, so the result never holds unknown bits.
     */
    public static <B> Flags<B> fromTextStrict(FlagSet<B> flagSet, CharSequence input) throws FlagsException {
        return parse(flagSet, input, true);
    }

    private static <B> Flags<B> parse(FlagSet<B> flagSet, CharSequence input, boolean strict) throws FlagsException {
        Objects.requireNonNull(flagSet, "Flag set cannot be null");
        Objects.requireNonNull(input, "Input cannot be null");

        var parsed = flagSet.empty();
        if (WHITESPACE.matchesAllOf(input))
            return parsed;

        for (var segment : SEGMENTS.split(input)) {
            parsed = parsed.union(parseSegment(flagSet, segment, strict));
        }
        return parsed;
    }

    private static <B> Flags<B> parseSegment(FlagSet<B> flagSet, String segment, boolean strict) throws FlagsException {
        if (segment.isEmpty())
            throw FlagsException.emptyFlag();

        if (segment.startsWith(Constants.HEX_PREFIX)) {
            if (strict)
                throw FlagsException.invalidHexFlag(segment);
            try {
                var digits = segment.substring(Constants.HEX_PREFIX.length());
                return flagSet.fromBitsRetain(flagSet.getBitsType().parseHex(digits));
            } catch (NumberFormatException e) {
                throw FlagsException.invalidHexFlag(segment, e);
            }
        }

        return flagSet.fromFlagName(segment).orElseThrow(() -> FlagsException.invalidNamedFlag(segment));
    }
}
