package com.supalosa.ants.insect;

import com.google.common.base.Preconditions;
import com.supalosa.ants.colony.AntColony;

import java.util.Optional;

/**
 * BodyguardAnt shelters one other (non-container) ant in its place and acts on its behalf.
 */
public class BodyguardAnt extends Ant {

    public static final int ARMOR = 2;

    private Ant containedAnt;

    public BodyguardAnt() {
        super(AntType.BODYGUARD, ARMOR, 0);
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    @Override
    public boolean canContain(Ant other) {
        return containedAnt == null && !other.isContainer();
    }

    @Override
    public void containAnt(Ant other) {
        Preconditions.checkState(canContain(other), "%s cannot contain %s", this, other);
        this.containedAnt = other;
    }

    @Override
    public Optional<Ant> getContainedAnt() {
        return Optional.ofNullable(containedAnt);
    }

    @Override
    public Optional<Ant> releaseContainedAnt() {
        Optional<Ant> released = Optional.ofNullable(containedAnt);
        containedAnt = null;
        return released;
    }

    @Override
    protected void act(AntColony colony) {
        if (containedAnt != null && containedAnt.isAlive()) {
            containedAnt.action(colony);
        }
    }
}
