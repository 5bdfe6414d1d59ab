package com.supalosa.ants.place;

/**
 * The place at the end of every tunnel. Bees that reach it win the game.
 * <p>
 * Several tunnels share it as their exit, so only the first tunnel is kept as its entrance.
 */
public class ColonyBase extends Place {

    public ColonyBase(String name) {
        super(name);
    }

    @Override
    public void linkEntrance(Place entrance) {
        if (getEntrance() == null) {
            super.linkEntrance(entrance);
        }
    }
}
