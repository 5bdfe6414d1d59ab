package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;

/**
 * Produces 1 additional food per turn for the colony.
 */
public class HarvesterAnt extends Ant {

    public HarvesterAnt() {
        super(AntType.HARVESTER);
    }

    @Override
    protected void act(AntColony colony) {
        colony.increaseFood(1);
    }
}
