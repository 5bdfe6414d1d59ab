package com.supalosa.ants.insect;

/**
 * An ant with a large amount of armor and no action.
 */
public class WallAnt extends Ant {

    public static final int ARMOR = 4;

    public WallAnt() {
        super(AntType.WALL, ARMOR, 0);
    }
}
