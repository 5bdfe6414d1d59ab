package com.supalosa.ants.insect;

import com.supalosa.ants.effect.StatusEffect;

/**
 * Thrower that slows bees instead of damaging them.
 */
public class SlowThrower extends ThrowerAnt {

    public SlowThrower() {
        super(AntType.SLOW_THROWER, DEFAULT_MIN_RANGE, DEFAULT_MAX_RANGE);
    }

    @Override
    protected void throwAt(Bee target) {
        target.applyEffect(StatusEffect.SLOW, StatusEffect.SLOW.getDefaultDuration());
    }
}
