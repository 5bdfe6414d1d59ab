package com.supalosa.ants.insect;

import com.supalosa.ants.place.Place;

/**
 * Not a real ant: deploying it removes whichever ant occupies the target place.
 */
public class AntRemover extends Ant {

    public AntRemover() {
        super(AntType.REMOVER, 0, 0);
    }

    @Override
    public void deployTo(Place place) {
        Ant occupant = place.getAnt();
        if (occupant != null) {
            place.removeInsect(occupant);
        }
    }
}
