package com.supalosa.ants.place;

/**
 * Creates the tunnels of a colony. Called once, before the simulation starts.
 */
@FunctionalInterface
public interface LayoutBuilder {

    /**
     * @param queenPlace The colony base at the end of every tunnel. Bees entering it win the game.
     * @param registrar Registers each created place with the colony.
     */
    void createPlaces(Place queenPlace, PlaceRegistrar registrar);
}
