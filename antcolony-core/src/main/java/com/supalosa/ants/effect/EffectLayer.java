package com.supalosa.ants.effect;

import org.immutables.value.Value;

/**
 * One status effect applied to an insect, with the number of action invocations it still affects.
 */
@Value.Immutable
public interface EffectLayer {

    @Value.Parameter
    StatusEffect effect();

    @Value.Parameter
    int remaining();

    default boolean isActive() {
        return remaining() > 0;
    }

    static EffectLayer of(StatusEffect effect, int remaining) {
        return ImmutableEffectLayer.of(effect, remaining);
    }
}
