package com.supalosa.ants.place;

import org.apache.commons.lang3.Validate;

import java.util.Locale;

/**
 * The built-in colony layouts. Each tunnel is a chain of places starting at a bee entrance and ending at
 * the colony base.
 */
public class Layouts {

    public static final int DEFAULT_LENGTH = 8;

    /**
     * Creates {@code tunnels} tunnels of {@code length} places each. If {@code moatFrequency} is non-zero,
     * every {@code moatFrequency}th step is water.
     */
    public static LayoutBuilder mixed(int length, int tunnels, int moatFrequency) {
        Validate.isTrue(length > 0, "Tunnel length must be positive, was %d", length);
        Validate.isTrue(tunnels > 0, "Tunnel count must be positive, was %d", tunnels);
        Validate.isTrue(moatFrequency >= 0, "Moat frequency cannot be negative, was %d", moatFrequency);
        return (queenPlace, registrar) -> {
            for (int tunnel = 0; tunnel < tunnels; ++tunnel) {
                Place exit = queenPlace;
                for (int step = 0; step < length; ++step) {
                    if (moatFrequency != 0 && (step + 1) % moatFrequency == 0) {
                        exit = new Water(String.format(Locale.ROOT, "water_%d_%d", tunnel, step), exit);
                    } else {
                        exit = new Place(String.format(Locale.ROOT, "tunnel_%d_%d", tunnel, step), exit);
                    }
                    registrar.register(exit, step == length - 1);
                }
            }
        };
    }

    /**
     * Three tunnels with water at every third step.
     */
    public static LayoutBuilder wet() {
        return mixed(DEFAULT_LENGTH, 3, 3);
    }

    public static LayoutBuilder dry() {
        return mixed(DEFAULT_LENGTH, 3, 0);
    }

    public static LayoutBuilder test() {
        return mixed(DEFAULT_LENGTH, 1, 0);
    }

    public static LayoutBuilder testMultiTunnels() {
        return mixed(DEFAULT_LENGTH, 2, 0);
    }
}
