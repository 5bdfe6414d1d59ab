package com.supalosa.ants.insect;

public class ScubaThrower extends ThrowerAnt {

    public ScubaThrower() {
        this(AntType.SCUBA_THROWER);
    }

    protected ScubaThrower(AntType type) {
        super(type, DEFAULT_MIN_RANGE, DEFAULT_MAX_RANGE);
    }

    @Override
    public boolean isWatersafe() {
        return true;
    }
}
