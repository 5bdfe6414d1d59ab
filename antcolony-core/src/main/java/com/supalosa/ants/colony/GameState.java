package com.supalosa.ants.colony;

public enum GameState {
    /**
     * Bees remain and none has reached a protected place.
     */
    RUNNING(false),
    /**
     * All bees have been vanquished.
     */
    WON(true),
    /**
     * A bee has reached the colony base or the queen's place.
     */
    LOST(true);

    private final boolean terminal;

    GameState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
