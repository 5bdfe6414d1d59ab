package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;

import java.util.function.Function;

/**
 * Every kind of ant that a strategy can deploy, with its display name and food cost.
 */
public enum AntType {
    HARVESTER("Harvester", 2, colony -> new HarvesterAnt()),
    THROWER("Thrower", 4, colony -> new ThrowerAnt()),
    LONG_THROWER("Long", 3, colony -> new LongThrower()),
    SHORT_THROWER("Short", 3, colony -> new ShortThrower()),
    SCUBA_THROWER("Scuba", 5, colony -> new ScubaThrower()),
    SLOW_THROWER("Slow", 4, colony -> new SlowThrower()),
    STUN_THROWER("Stun", 6, colony -> new StunThrower()),
    FIRE("Fire", 4, colony -> new FireAnt()),
    WALL("Wall", 4, colony -> new WallAnt()),
    NINJA("Ninja", 6, colony -> new NinjaAnt()),
    HUNGRY("Hungry", 4, colony -> new HungryAnt()),
    BODYGUARD("Bodyguard", 4, colony -> new BodyguardAnt()),
    // Only the first queen created in a colony is the true queen.
    QUEEN("Queen", 6, colony -> new QueenAnt(colony.claimQueen())),
    REMOVER("Remover", 0, colony -> new AntRemover());

    private final String displayName;
    private final int foodCost;
    private final Function<AntColony, Ant> constructor;

    AntType(String displayName, int foodCost, Function<AntColony, Ant> constructor) {
        this.displayName = displayName;
        this.foodCost = foodCost;
        this.constructor = constructor;
    }

    /**
     * Creates a new ant of this type for the given colony.
     */
    public Ant create(AntColony colony) {
        return constructor.apply(colony);
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getFoodCost() {
        return foodCost;
    }
}
