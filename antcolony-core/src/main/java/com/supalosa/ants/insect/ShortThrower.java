package com.supalosa.ants.insect;

/**
 * A thrower that only throws leaves at bees within 2 places.
 */
public class ShortThrower extends ThrowerAnt {

    public ShortThrower() {
        super(AntType.SHORT_THROWER, DEFAULT_MIN_RANGE, 2);
    }
}
