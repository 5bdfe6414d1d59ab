package com.supalosa.ants.colony;

/**
 * Receives the colony at the start of the game, after each turn and at the end, e.g. to render it.
 * Observers must not modify the colony.
 */
public interface ColonyObserver {

    void initialise(AntColony colony);

    void onStep(AntColony colony);

    void stop(AntColony colony);
}
