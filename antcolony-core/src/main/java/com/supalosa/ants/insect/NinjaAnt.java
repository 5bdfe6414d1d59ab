package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;

import java.util.ArrayList;
import java.util.List;

/**
 * NinjaAnt does not block the path and does 1 damage to all bees in the exact same place.
 */
public class NinjaAnt extends Ant {

    public NinjaAnt() {
        super(AntType.NINJA, DEFAULT_ARMOR, 1);
    }

    @Override
    public boolean blocksPath() {
        return false;
    }

    @Override
    protected void act(AntColony colony) {
        List<Bee> bees = new ArrayList<>(getPlace().getBees());
        for (Bee bee : bees) {
            bee.reduceArmor(getDamage());
        }
    }
}
