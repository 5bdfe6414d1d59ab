package com.supalosa.ants.place;

import org.jgrapht.GraphPath;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Directed view of the colony layout. Each place has an edge to its exit, and the hive has an edge to every
 * bee entrance. The graph is only read by the engine; the places themselves hold the live links.
 */
public class PlaceGraph extends DirectedAcyclicGraph<Place, DefaultEdge> {

    private final Place hive;
    private final Place queenPlace;
    private final List<Place> beeEntrances;

    private PlaceGraph(Place hive, Place queenPlace, List<Place> beeEntrances) {
        super(DefaultEdge.class);
        this.hive = hive;
        this.queenPlace = queenPlace;
        this.beeEntrances = beeEntrances;
    }

    /**
     * Builds the graph of the given places and checks that every bee entrance leads to the colony base.
     *
     * @throws IllegalStateException if the layout contains a tunnel that does not reach the base.
     */
    public static PlaceGraph create(Place hive, Place queenPlace, Collection<Place> places, List<Place> beeEntrances) {
        PlaceGraph g = new PlaceGraph(hive, queenPlace, List.copyOf(beeEntrances));
        g.addVertex(hive);
        g.addVertex(queenPlace);
        places.forEach(g::addVertex);
        places.forEach(place -> {
            if (place.getExit() != null) {
                if (!g.containsVertex(place.getExit())) {
                    throw new IllegalStateException("Exit " + place.getExit() + " of " + place + " was never registered");
                }
                g.addEdge(place, place.getExit());
            }
        });
        beeEntrances.forEach(entrance -> g.addEdge(hive, entrance));
        beeEntrances.forEach(entrance -> {
            if (g.findTunnel(entrance).isEmpty()) {
                throw new IllegalStateException("Bee entrance " + entrance + " does not lead to " + queenPlace);
            }
        });
        return g;
    }

    /**
     * Returns the places from the given place to the colony base, inclusive, if the base can be reached.
     */
    public Optional<List<Place>> findTunnel(Place start) {
        if (!containsVertex(start)) {
            return Optional.empty();
        }
        GraphPath<Place, DefaultEdge> path = new BFSShortestPath<>(this).getPath(start, queenPlace);
        if (path == null || path.getEndVertex() == null || !path.getEndVertex().equals(queenPlace)) {
            return Optional.empty();
        }
        return Optional.of(path.getVertexList());
    }

    /**
     * Returns every tunnel, from its bee entrance to the colony base, in registration order.
     */
    public List<List<Place>> getTunnels() {
        List<List<Place>> tunnels = new ArrayList<>();
        beeEntrances.forEach(entrance -> findTunnel(entrance).ifPresent(tunnels::add));
        return tunnels;
    }

    /**
     * Number of exits to follow from the given place to reach the colony base, or -1 if it cannot be reached.
     */
    public int distanceToQueen(Place place) {
        return findTunnel(place).map(tunnel -> tunnel.size() - 1).orElse(-1);
    }

    public Place getHive() {
        return hive;
    }

    public Place getQueenPlace() {
        return queenPlace;
    }
}
