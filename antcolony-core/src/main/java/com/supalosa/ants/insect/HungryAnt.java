package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;

/**
 * HungryAnt eats a random bee in its place, then spends {@link #TIME_TO_DIGEST} turns digesting before it can
 * eat again.
 */
public class HungryAnt extends Ant {

    public static final int TIME_TO_DIGEST = 3;

    private int digesting;

    public HungryAnt() {
        super(AntType.HUNGRY);
        this.digesting = 0;
    }

    public void eatBee(Bee bee) {
        bee.reduceArmor(bee.getArmor());
    }

    @Override
    protected void act(AntColony colony) {
        if (digesting > 0) {
            digesting--;
        } else {
            getPlace().randomBee(colony.getRandom()).ifPresent(bee -> {
                digesting = TIME_TO_DIGEST;
                eatBee(bee);
            });
        }
    }

    public int getDigesting() {
        return digesting;
    }
}
