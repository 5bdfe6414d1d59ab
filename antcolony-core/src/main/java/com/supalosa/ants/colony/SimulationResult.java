package com.supalosa.ants.colony;

import org.immutables.value.Value;

/**
 * Summary of a colony at a point in time.
 */
@Value.Immutable
public interface SimulationResult {
    GameState state();
    int turns();
    int foodRemaining();
    int antsRemaining();
    int beesRemaining();
}
