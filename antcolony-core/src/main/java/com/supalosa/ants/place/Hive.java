package com.supalosa.ants.place;

import com.google.common.base.Preconditions;
import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.AssaultPlan;
import com.supalosa.ants.insect.Ant;
import com.supalosa.ants.insect.Bee;
import com.supalosa.ants.insect.Insect;

import java.util.List;
import java.util.Random;

/**
 * The place from which the bees launch their assault. It holds every bee of the assault plan until its
 * wave is due, never holds an ant, and has no exit or entrance.
 */
public class Hive extends Place {

    public static final String NAME = "Hive";

    private final AssaultPlan assaultPlan;

    public Hive(AssaultPlan assaultPlan) {
        super(NAME);
        this.assaultPlan = assaultPlan;
        assaultPlan.allBees().forEach(this::addInsect);
    }

    @Override
    public void addInsect(Insect insect) {
        Preconditions.checkState(!(insect instanceof Ant), "The hive cannot hold %s", insect);
        super.addInsect(insect);
    }

    @Override
    public void linkEntrance(Place entrance) {
        throw new IllegalStateException("The hive cannot have an entrance, tried to link " + entrance);
    }

    /**
     * Moves every bee scheduled for the colony's current time into a randomly chosen bee entrance.
     */
    public void releaseWave(AntColony colony) {
        List<Place> exits = colony.getBeeEntrances();
        List<Bee> wave = assaultPlan.getWave(colony.getTime());
        if (wave.isEmpty()) {
            return;
        }
        Preconditions.checkState(!exits.isEmpty(), "The colony has no bee entrances");
        Random random = colony.getRandom();
        for (Bee bee : wave) {
            if (bee.getPlace() == this) {
                bee.moveTo(exits.get(random.nextInt(exits.size())));
            }
        }
    }
}
