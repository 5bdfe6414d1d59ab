package com.supalosa.ants.colony;

/**
 * Deploys and removes ants at the start of each turn, after the bees of that turn have entered the colony.
 * It may call {@link AntColony#deployAnt} and {@link AntColony#removeAnt} any number of times, including zero.
 */
@FunctionalInterface
public interface ColonyStrategy {

    void onTurn(AntColony colony);
}
