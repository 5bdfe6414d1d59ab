package com.supalosa.ants.insect;

import com.supalosa.ants.effect.StatusEffect;

/**
 * Thrower that stuns bees instead of damaging them.
 */
public class StunThrower extends ThrowerAnt {

    public StunThrower() {
        super(AntType.STUN_THROWER, DEFAULT_MIN_RANGE, DEFAULT_MAX_RANGE);
    }

    @Override
    protected void throwAt(Bee target) {
        target.applyEffect(StatusEffect.STUN, StatusEffect.STUN.getDefaultDuration());
    }
}
