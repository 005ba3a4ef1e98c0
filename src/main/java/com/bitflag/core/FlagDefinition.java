package com.bitflag.core;

import lombok.Value;

/**
 * A named entry of a {@link FlagSet}, in declaration order.
 * <p>
 * The value may be zero, may alias another entry's bits, or may span several bits.
 */
@Value
public class FlagDefinition<B> {
    String name;
    Flags<B> value;

    public B getBits() {
        return value.getBits();
    }
}
