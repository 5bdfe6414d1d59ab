package com.supalosa.ants.insect;

import java.util.ArrayList;
import java.util.List;

/**
 * FireAnt cooks every bee in its place when it expires.
 */
public class FireAnt extends Ant {

    public static final int DAMAGE = 3;

    public FireAnt() {
        super(AntType.FIRE, DEFAULT_ARMOR, DAMAGE);
    }

    @Override
    protected void expire() {
        // Bees that expire are removed from the place while we iterate.
        List<Bee> bees = new ArrayList<>(getPlace().getBees());
        for (Bee bee : bees) {
            bee.reduceArmor(getDamage());
        }
        super.expire();
    }
}
