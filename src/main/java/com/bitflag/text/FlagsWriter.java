package com.bitflag.text;

import com.bitflag.Constants;
import com.bitflag.core.Flags;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.io.IOException;

/**
 * Writes flags values in their text form: contained flag names joined by {@code " | "},
 * optionally followed by the unexplained bits as an uppercase hex literal, e.g. {@code A | B | 0x8}.
 * The empty value writes as the empty string.
 */
@UtilityClass
public final class FlagsWriter {

    /**
     * Write the names of contained flags, then any remaining bits (unknown bits included) as hex.
     * The output parses back to the same value with {@link FlagsParser#fromText}.
     */
    public static <B> void write(Flags<B> flags, Appendable out) throws IOException {
        writeNames(flags, out, true);
    }

    /**
     * Like {@link #write}, after dropping unknown bits.
     */
    public static <B> void writeTruncate(Flags<B> flags, Appendable out) throws IOException {
        writeNames(flags.truncate(), out, true);
    }

    /**
     * Write the names of contained flags only. Bits not explained by a named flag are not written.
     */
    public static <B> void writeStrict(Flags<B> flags, Appendable out) throws IOException {
        writeNames(flags, out, false);
    }

    @SneakyThrows
    public static <B> String toText(Flags<B> flags) {
        var sb = new StringBuilder();
        write(flags, sb);
        return sb.toString();
    }

    @SneakyThrows
    public static <B> String toTextTruncate(Flags<B> flags) {
        var sb = new StringBuilder();
        writeTruncate(flags, sb);
        return sb.toString();
    }

    @SneakyThrows
    public static <B> String toTextStrict(Flags<B> flags) {
        var sb = new StringBuilder();
        writeStrict(flags, sb);
        return sb.toString();
    }

    private static <B> void writeNames(Flags<B> flags, Appendable out, boolean withRemaining) throws IOException {
        var names = flags.iterNames();
        boolean first = true;
        while (names.hasNext()) {
            if (!first)
                out.append(Constants.SEPARATOR);
            first = false;
            out.append(names.next().getName());
        }

        if (!withRemaining)
            return;
        var remaining = names.remaining();
        if (!remaining.isEmpty()) {
            if (!first)
                out.append(Constants.SEPARATOR);
            out.append(Constants.HEX_PREFIX).append(remaining.toHexString());
        }
    }
}
