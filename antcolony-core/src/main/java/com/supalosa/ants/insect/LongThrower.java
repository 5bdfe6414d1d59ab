package com.supalosa.ants.insect;

/**
 * A thrower that only throws leaves at bees at least 4 places away.
 */
public class LongThrower extends ThrowerAnt {

    public LongThrower() {
        super(AntType.LONG_THROWER, 4, DEFAULT_MAX_RANGE);
    }
}
