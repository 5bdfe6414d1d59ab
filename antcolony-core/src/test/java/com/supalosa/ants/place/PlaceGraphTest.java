package com.supalosa.ants.place;

import com.supalosa.ants.ColonyTestUtils;
import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.AssaultPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaceGraphTest {

    @Test
    void testTunnels() {
        AntColony colony = ColonyTestUtils.createColony(new AssaultPlan(), Layouts.testMultiTunnels(), 0, c -> {});
        PlaceGraph graph = colony.getPlaceGraph();

        List<List<Place>> tunnels = graph.getTunnels();
        assertThat(tunnels).hasSize(2);
        assertThat(tunnels.get(0).stream().map(Place::getName).collect(Collectors.toList())).containsExactly(
                "tunnel_0_7", "tunnel_0_6", "tunnel_0_5", "tunnel_0_4",
                "tunnel_0_3", "tunnel_0_2", "tunnel_0_1", "tunnel_0_0", AntColony.QUEEN_PLACE_NAME);
        assertThat(tunnels.get(1).get(0).getName()).isEqualTo("tunnel_1_7");
        assertThat(graph.outgoingEdgesOf(colony.getHive())).hasSize(2);
    }

    @Test
    void testDistanceToQueen() {
        AntColony colony = ColonyTestUtils.createTestColony();
        PlaceGraph graph = colony.getPlaceGraph();
        assertThat(graph.distanceToQueen(colony.getPlace("tunnel_0_0"))).isEqualTo(1);
        assertThat(graph.distanceToQueen(colony.getPlace("tunnel_0_7"))).isEqualTo(8);
        assertThat(graph.distanceToQueen(colony.getQueenPlace())).isEqualTo(0);
        assertThat(graph.distanceToQueen(colony.getHive())).isEqualTo(9);
        assertThat(graph.distanceToQueen(new Place("elsewhere"))).isEqualTo(-1);
    }

    @Test
    void testUnregisteredExitIsRejected() {
        Place queenPlace = new Place("AntQueen");
        Place hidden = new Place("hidden", queenPlace);
        Place entrance = new Place("entrance", hidden);
        Hive hive = new Hive(new AssaultPlan());
        assertThatThrownBy(() -> PlaceGraph.create(hive, queenPlace, List.of(entrance), List.of(entrance)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("never registered");
    }

    @Test
    void testEntranceMustReachQueen() {
        Place queenPlace = new Place("AntQueen");
        Place deadEnd = new Place("dead_end");
        Hive hive = new Hive(new AssaultPlan());
        assertThatThrownBy(() -> PlaceGraph.create(hive, queenPlace, List.of(deadEnd), List.of(deadEnd)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not lead to");
    }
}
