package com.supalosa.ants.place;

import com.supalosa.ants.insect.Insect;

/**
 * Water is a place that can only hold watersafe insects. Anything else expires as soon as it is added.
 */
public class Water extends Place {

    public Water(String name, Place exit) {
        super(name, exit);
    }

    @Override
    public void addInsect(Insect insect) {
        super.addInsect(insect);
        if (!insect.isWatersafe()) {
            insect.reduceArmor(insect.getArmor());
        }
    }
}
