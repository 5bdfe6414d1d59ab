package com.supalosa.ants.console;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.ColonyObserver;
import com.supalosa.ants.insect.Ant;
import com.supalosa.ants.place.Place;
import com.supalosa.ants.place.Water;
import org.apache.commons.lang3.StringUtils;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints each tunnel of the colony, from the bee entrance to the base, after every turn.
 */
public class ConsoleRenderer implements ColonyObserver {

    private static final int CELL_WIDTH = 14;

    private final PrintStream output;

    public ConsoleRenderer(PrintStream output) {
        this.output = output;
    }

    @Override
    public void initialise(AntColony colony) {
        output.println("Starting with " + colony.getFood() + " food, "
                + colony.getHive().getBees().size() + " bees in the hive.");
        render(colony);
    }

    @Override
    public void onStep(AntColony colony) {
        output.println("Time " + colony.getTime() + ", food " + colony.getFood());
        render(colony);
    }

    @Override
    public void stop(AntColony colony) {
        output.println("Finished: " + colony.getResult());
    }

    void render(AntColony colony) {
        output.println(StringUtils.rightPad("Hive", CELL_WIDTH) + "bees=" + colony.getHive().getBees().size());
        for (List<Place> tunnel : colony.getPlaceGraph().getTunnels()) {
            StringBuilder line = new StringBuilder();
            for (Place place : tunnel) {
                line.append(StringUtils.rightPad(describe(place), CELL_WIDTH));
            }
            output.println(StringUtils.stripEnd(line.toString(), null));
        }
    }

    /**
     * Short description of a place, e.g. {@code ~Thrower/2} for water holding a thrower and two bees.
     */
    static String describe(Place place) {
        StringBuilder description = new StringBuilder();
        if (place instanceof Water) {
            description.append('~');
        }
        Ant ant = place.getAnt();
        if (ant == null) {
            description.append('.');
        } else {
            description.append(ant.getName());
            ant.getContainedAnt().ifPresent(contained -> description.append('+').append(contained.getName()));
        }
        if (!place.getBees().isEmpty()) {
            description.append('/').append(place.getBees().size());
        }
        return description.toString();
    }
}
