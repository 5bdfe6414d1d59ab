package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.place.Hive;
import com.supalosa.ants.place.Place;

/**
 * A Bee moves from place to place, following exits and stinging ants.
 */
public class Bee extends Insect {

    public static final int DEFAULT_ARMOR = 3;
    public static final int STING_DAMAGE = 1;

    public Bee() {
        this(DEFAULT_ARMOR);
    }

    public Bee(int armor) {
        super(armor);
    }

    /**
     * Attack an ant, reducing its armor by 1.
     */
    public void sting(Ant ant) {
        ant.reduceArmor(STING_DAMAGE);
    }

    /**
     * Move from the current place to a new place.
     */
    public void moveTo(Place destination) {
        getPlace().removeInsect(this);
        destination.addInsect(this);
    }

    /**
     * Return true if this bee cannot advance to the next place.
     */
    public boolean isBlocked() {
        Ant ant = getPlace().getAnt();
        return ant != null && ant.blocksPath();
    }

    /**
     * Stings the ant that blocks the exit, or moves to the exit of the current place otherwise.
     */
    @Override
    protected void act(AntColony colony) {
        Place place = getPlace();
        if (place == null) {
            return;
        }
        if (isBlocked()) {
            sting(place.getAnt());
        } else if (!(place instanceof Hive) && isAlive() && place.getExit() != null) {
            moveTo(place.getExit());
        }
    }

    @Override
    public boolean isWatersafe() {
        return true;
    }

    @Override
    public String getName() {
        return "Bee";
    }
}
