package com.supalosa.ants.console;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.GameState;
import com.supalosa.ants.insect.AntType;
import com.supalosa.ants.place.Hive;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

public class ConsoleMain {

    public static void main(String[] args) {
        GameOptions options = GameOptions.parse(args);
        if (options.showHelp()) {
            System.out.println(GameOptions.USAGE);
            return;
        }
        GameState result = run(options, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        System.exit(result == GameState.WON ? 0 : 1);
    }

    static GameState run(GameOptions options, BufferedReader input) {
        InteractiveStrategy strategy = new InteractiveStrategy(input, System.out);
        AntColony colony = new AntColony(strategy,
                new Hive(options.plan().create()),
                Arrays.asList(AntType.values()),
                options.layout().create(),
                options.food(),
                new Random(),
                new ConsoleRenderer(System.out));
        return colony.simulate();
    }
}
