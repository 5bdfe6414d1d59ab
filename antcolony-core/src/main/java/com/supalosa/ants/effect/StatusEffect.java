package com.supalosa.ants.effect;

import com.supalosa.ants.colony.AntColony;

/**
 * A temporary modification of an insect's action.
 */
public enum StatusEffect {
    /**
     * The action only happens on even turns.
     */
    SLOW(3) {
        @Override
        public void apply(AntColony colony, Runnable action) {
            if (colony.getTime() % 2 == 0) {
                action.run();
            }
        }
    },
    /**
     * No action at all.
     */
    STUN(1) {
        @Override
        public void apply(AntColony colony, Runnable action) {
        }
    };

    private final int defaultDuration;

    StatusEffect(int defaultDuration) {
        this.defaultDuration = defaultDuration;
    }

    /**
     * Runs the effect-modified version of {@code action} for one turn.
     *
     * @param colony The colony, for the current time.
     * @param action The action being modified. It may itself be wrapped by older effects.
     */
    public abstract void apply(AntColony colony, Runnable action);

    /**
     * Number of action invocations this effect lasts when thrown by an ant.
     */
    public int getDefaultDuration() {
        return defaultDuration;
    }
}
