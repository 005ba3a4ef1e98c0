package com.bitflag.iter;

import com.bitflag.core.FlagDefinition;
import com.bitflag.core.Flags;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterates the named flags contained in a source value, in declaration order.
 * <p>
 * A flag is yielded when the source contains all of its bits and at least one of those bits
 * has not been explained by a flag yielded earlier. The yielded entry always carries the
 * flag's full bit pattern. So of two partially overlapping flags both are yielded, while a
 * shorthand flag declared after the flags it combines is skipped.
 * <p>
 * Bits never explained by a yielded flag are left in {@link #remaining()}. A zero-bit flag
 * is never yielded.
 */
public final class FlagNameIterator<B> implements Iterator<FlagDefinition<B>> {
    private final List<FlagDefinition<B>> flags;
    private final Flags<B> source;
    private Flags<B> remaining;
    private int index;
    private FlagDefinition<B> next;

    public FlagNameIterator(Flags<B> source) {
        this.source = Objects.requireNonNull(source, "Source flags cannot be null");
        this.flags = source.getFlagSet().getKnownFlags();
        this.remaining = source;
    }

    /**
     * Bits of the source not yet explained by a yielded flag.
     * Only final once {@link #hasNext()} has returned {@code false}.
     */
    public Flags<B> remaining() {
        return remaining;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public FlagDefinition<B> next() {
        if (!hasNext())
            throw new NoSuchElementException("No more named flags in " + source.getFlagSet().getTypeName());
        var result = next;
        next = null;
        return result;
    }

    private FlagDefinition<B> advance() {
        while (index < flags.size()) {
            if (remaining.isEmpty())
                return null;

            var candidate = flags.get(index++);
            var flag = candidate.getValue();
            if (source.contains(flag) && remaining.intersects(flag)) {
                remaining = remaining.difference(flag);
                return candidate;
            }
        }
        return null;
    }
}
