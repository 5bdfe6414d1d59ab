package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.place.Place;

import java.util.Optional;

/**
 * ThrowerAnt throws a leaf each turn at the nearest bee in its range.
 */
public class ThrowerAnt extends Ant {

    public static final int DEFAULT_MIN_RANGE = 0;
    public static final int DEFAULT_MAX_RANGE = 10;

    private final int minRange;
    private final int maxRange;

    public ThrowerAnt() {
        this(AntType.THROWER, DEFAULT_MIN_RANGE, DEFAULT_MAX_RANGE);
    }

    protected ThrowerAnt(AntType type, int minRange, int maxRange) {
        this(type, DEFAULT_ARMOR, minRange, maxRange);
    }

    protected ThrowerAnt(AntType type, int armor, int minRange, int maxRange) {
        super(type, armor, 1);
        this.minRange = minRange;
        this.maxRange = maxRange;
    }

    /**
     * Returns a random bee from the nearest place (following entrances, stopping before the hive) that has
     * bees and is within range. The thrower's own place is at distance 0.
     */
    public Optional<Bee> nearestBee(AntColony colony) {
        Place place = getPlace();
        int distance = 0;
        while (place != null && place != colony.getHive()) {
            if (distance > maxRange) {
                break;
            }
            if (distance >= minRange && !place.getBees().isEmpty()) {
                return place.randomBee(colony.getRandom());
            }
            distance++;
            place = place.getEntrance();
        }
        return Optional.empty();
    }

    /**
     * Throw a leaf at the target bee, reducing its armor.
     */
    protected void throwAt(Bee target) {
        target.reduceArmor(getDamage());
    }

    @Override
    protected void act(AntColony colony) {
        nearestBee(colony).ifPresent(this::throwAt);
    }
}
