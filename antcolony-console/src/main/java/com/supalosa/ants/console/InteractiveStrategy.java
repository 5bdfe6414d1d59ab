package com.supalosa.ants.console;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.ColonyStrategy;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.stream.Collectors;

/**
 * A strategy that reads commands from the player each turn until they finish the turn.
 * <p>
 * Once the input is exhausted every later turn ends immediately, so the game plays out without further deployments.
 */
public class InteractiveStrategy implements ColonyStrategy {

    private static final String HELP = String.join("\n",
            "deploy <place> <type>   Deploy an ant, e.g. deploy tunnel_0_0 Thrower",
            "remove <place>          Remove the ant from a place",
            "status                  Show the colony",
            "types                   List the ant types and their cost",
            "done                    End the turn (or end of input)");

    private final BufferedReader input;
    private final PrintStream output;
    private boolean inputExhausted;

    public InteractiveStrategy(BufferedReader input, PrintStream output) {
        this.input = input;
        this.output = output;
        this.inputExhausted = false;
    }

    @Override
    public void onTurn(AntColony colony) {
        if (inputExhausted) {
            return;
        }
        output.println("colony: " + colony);
        output.println("Enter commands, 'help' for a list. 'done' completes a turn.");
        while (true) {
            String line = readLine();
            if (line == null) {
                inputExhausted = true;
                return;
            }
            if (!handleCommand(colony, line.trim())) {
                return;
            }
        }
    }

    /**
     * Runs one command.
     *
     * @return false if the turn is over.
     */
    boolean handleCommand(AntColony colony, String line) {
        if (StringUtils.isBlank(line)) {
            return true;
        }
        String[] parts = StringUtils.split(line);
        String command = parts[0].toLowerCase();
        try {
            switch (command) {
                case "done":
                    return false;
                case "deploy":
                    if (parts.length != 3) {
                        output.println("Usage: deploy <place> <type>");
                    } else if (colony.deployAnt(parts[1], parts[2])) {
                        output.println("Deployed " + parts[2] + " to " + parts[1] + ", food remaining " + colony.getFood());
                    }
                    return true;
                case "remove":
                    if (parts.length != 2) {
                        output.println("Usage: remove <place>");
                    } else {
                        colony.removeAnt(parts[1]);
                    }
                    return true;
                case "status":
                    output.println("colony: " + colony);
                    return true;
                case "types":
                    output.println(colony.getAntTypes().values().stream()
                            .map(type -> type.getDisplayName() + " (" + type.getFoodCost() + ")")
                            .collect(Collectors.joining(", ")));
                    return true;
                case "help":
                    output.println(HELP);
                    return true;
                default:
                    output.println("Unknown command: " + command);
                    return true;
            }
        } catch (IllegalArgumentException | IllegalStateException ex) {
            // A rejected command (unknown names, occupied place) does not end the game.
            output.println("Error: " + ex.getMessage());
            return true;
        }
    }

    private String readLine() {
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read command", e);
        }
    }
}
