package com.supalosa.ants.console;

import com.supalosa.ants.colony.AntColony;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InteractiveStrategyTest {

    private AntColony colony;
    private ByteArrayOutputStream outputBytes;
    private PrintStream output;

    @BeforeEach
    void setUp() {
        colony = mock(AntColony.class);
        outputBytes = new ByteArrayOutputStream();
        output = new PrintStream(outputBytes, true, StandardCharsets.UTF_8);
    }

    private InteractiveStrategy strategyWithInput(String input) {
        return new InteractiveStrategy(new BufferedReader(new StringReader(input)), output);
    }

    private String output() {
        return outputBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testDeployAndRemove() {
        when(colony.deployAnt("tunnel_0_0", "Thrower")).thenReturn(true);
        InteractiveStrategy strategy = strategyWithInput("deploy tunnel_0_0 Thrower\nremove tunnel_0_1\ndone\n");
        strategy.onTurn(colony);
        verify(colony).deployAnt("tunnel_0_0", "Thrower");
        verify(colony).removeAnt("tunnel_0_1");
        assertThat(output()).contains("Deployed Thrower to tunnel_0_0");
    }

    @Test
    void testDoneEndsTurn() {
        InteractiveStrategy strategy = strategyWithInput("done\ndeploy tunnel_0_0 Thrower\ndone\n");
        strategy.onTurn(colony);
        verify(colony, never()).deployAnt(anyString(), anyString());
        strategy.onTurn(colony);
        verify(colony).deployAnt("tunnel_0_0", "Thrower");
    }

    @Test
    void testEndOfInputEndsEveryLaterTurn() {
        InteractiveStrategy strategy = strategyWithInput("");
        strategy.onTurn(colony);
        outputBytes.reset();
        strategy.onTurn(colony);
        assertThat(output()).isEmpty();
    }

    @Test
    void testBadCommandsDoNotEndTurn() {
        when(colony.deployAnt("Hive", "Thrower")).thenThrow(new IllegalStateException("The hive cannot hold ants"));
        InteractiveStrategy strategy = strategyWithInput("dance\ndeploy tunnel_0_0\ndeploy Hive Thrower\n\ndone\n");
        strategy.onTurn(colony);
        assertThat(output())
                .contains("Unknown command: dance")
                .contains("Usage: deploy <place> <type>")
                .contains("Error: The hive cannot hold ants");
    }
}
