package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.place.Place;
import org.apache.commons.lang3.NotImplementedException;

import java.util.Optional;

/**
 * An Ant occupies a place and does work for the colony.
 */
public abstract class Ant extends Insect {

    public static final int DEFAULT_ARMOR = 1;

    private final AntType type;
    private int damage;

    protected Ant(AntType type, int armor, int damage) {
        super(armor);
        this.type = type;
        this.damage = damage;
    }

    protected Ant(AntType type) {
        this(type, DEFAULT_ARMOR, 0);
    }

    /**
     * Ants do nothing by default.
     */
    @Override
    protected void act(AntColony colony) {
    }

    /**
     * Puts this ant into the given place. Called by the colony once the food cost has been checked.
     */
    public void deployTo(Place place) {
        place.addInsect(this);
    }

    /**
     * Whether bees in the same place are stopped by this ant.
     */
    public boolean blocksPath() {
        return true;
    }

    /**
     * Whether this ant can hold another ant inside it.
     */
    public boolean isContainer() {
        return false;
    }

    /**
     * Whether this ant can currently take {@code other} inside it.
     */
    public boolean canContain(Ant other) {
        return false;
    }

    public void containAnt(Ant other) {
        throw new NotImplementedException(getName() + " cannot contain other ants.");
    }

    public Optional<Ant> getContainedAnt() {
        return Optional.empty();
    }

    /**
     * Empties the containment slot, returning the ant that was held.
     */
    public Optional<Ant> releaseContainedAnt() {
        return Optional.empty();
    }

    /**
     * Whether {@link Place#removeInsect} is allowed to take this ant out of its place.
     */
    public boolean isRemovable() {
        return true;
    }

    public AntType getType() {
        return type;
    }

    public int getFoodCost() {
        return type.getFoodCost();
    }

    public int getDamage() {
        return damage;
    }

    public void setDamage(int damage) {
        this.damage = damage;
    }

    @Override
    public String getName() {
        return type.getDisplayName();
    }
}
