package com.bitflag.iter;

import com.bitflag.core.Flags;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates a source value as the values of its contained named flags (see {@link FlagNameIterator}),
 * then, if any bits are left unexplained, one last value holding exactly those bits.
 * <p>
 * The union of all yielded values is always the source value.
 */
public final class FlagIterator<B> implements Iterator<Flags<B>> {
    private final FlagNameIterator<B> names;
    private boolean done;

    public FlagIterator(Flags<B> source) {
        this.names = new FlagNameIterator<>(source);
    }

    @Override
    public boolean hasNext() {
        if (names.hasNext())
            return true;
        return !done && !names.remaining().isEmpty();
    }

    @Override
    public Flags<B> next() {
        if (names.hasNext())
            return names.next().getValue();
        if (!done) {
            done = true;
            var remaining = names.remaining();
            if (!remaining.isEmpty())
                return remaining;
        }
        throw new NoSuchElementException("No more flags");
    }
}
