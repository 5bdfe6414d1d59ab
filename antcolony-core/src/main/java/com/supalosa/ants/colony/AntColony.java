package com.supalosa.ants.colony;

import com.google.common.base.Preconditions;
import com.supalosa.ants.insect.Ant;
import com.supalosa.ants.insect.AntType;
import com.supalosa.ants.insect.Bee;
import com.supalosa.ants.insect.Insect;
import com.supalosa.ants.place.ColonyBase;
import com.supalosa.ants.place.Hive;
import com.supalosa.ants.place.LayoutBuilder;
import com.supalosa.ants.place.Place;
import com.supalosa.ants.place.PlaceGraph;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ant collective that manages global game state and simulates time.
 * <p>
 * Each turn: bees of the current wave leave the hive, the strategy deploys ants, every ant acts, every bee acts,
 * and time advances. The game is lost as soon as a bee is in a protected place (the colony base, or the place of
 * the true queen once she has acted) and won when no bees remain.
 */
public class AntColony {

    public static final String QUEEN_PLACE_NAME = "AntQueen";
    public static final int DEFAULT_FOOD = 2;

    private final ColonyStrategy strategy;
    private final ColonyObserver observer;
    private final Hive hive;
    private final Place queenPlace;
    private final Random random;
    private final Map<String, AntType> antTypes;
    // Places in registration order, starting with the hive.
    private final Map<String, Place> places;
    private final List<Place> beeEntrances;
    private final Set<Place> protectedPlaces;
    private final PlaceGraph placeGraph;

    private int time;
    private int food;
    private int queensCreated;
    private GameState state;

    public AntColony(ColonyStrategy strategy, Hive hive, Collection<AntType> antTypes, LayoutBuilder layout,
                     int food) {
        this(strategy, hive, antTypes, layout, food, new Random(), new NoOpColonyObserver());
    }

    /**
     * @param strategy Deploys ants each turn.
     * @param hive The hive full of bees.
     * @param antTypes The ant types that the strategy may deploy.
     * @param layout Creates the places of the colony.
     * @param food Starting food.
     * @param random Source of randomness for wave entry and target selection.
     * @param observer Receives the colony as the game progresses.
     */
    public AntColony(ColonyStrategy strategy, Hive hive, Collection<AntType> antTypes, LayoutBuilder layout,
                     int food, Random random, ColonyObserver observer) {
        Validate.isTrue(food >= 0, "Starting food cannot be negative, was %d", food);
        this.strategy = strategy;
        this.observer = observer;
        this.hive = hive;
        this.random = random;
        this.food = food;
        this.time = 0;
        this.queensCreated = 0;
        this.antTypes = new LinkedHashMap<>();
        antTypes.forEach(type -> this.antTypes.put(type.getDisplayName(), type));
        this.places = new LinkedHashMap<>();
        this.beeEntrances = new ArrayList<>();
        this.queenPlace = new ColonyBase(QUEEN_PLACE_NAME);
        this.protectedPlaces = new LinkedHashSet<>();
        this.protectedPlaces.add(queenPlace);
        this.placeGraph = configure(layout);
        this.state = evaluateState();
    }

    private PlaceGraph configure(LayoutBuilder layout) {
        registerPlace(hive, false);
        layout.createPlaces(queenPlace, this::registerPlace);
        return PlaceGraph.create(hive, queenPlace, places.values(), beeEntrances);
    }

    private void registerPlace(Place place, boolean isBeeEntrance) {
        Validate.isTrue(!places.containsKey(place.getName()), "Duplicate place name %s", place.getName());
        Validate.isTrue(!place.getName().equals(QUEEN_PLACE_NAME), "%s is reserved for the colony base",
                QUEEN_PLACE_NAME);
        places.put(place.getName(), place);
        if (isBeeEntrance) {
            place.linkEntrance(hive);
            beeEntrances.add(place);
        }
    }

    /**
     * Simulate an attack on the ant colony (i.e. play the game).
     *
     * @return The final state, either WON or LOST.
     */
    public GameState simulate() {
        observer.initialise(this);
        while (evaluateState() == GameState.RUNNING) {
            step();
        }
        if (state == GameState.LOST) {
            System.out.println("The ant queen has perished. Please try again.");
        } else {
            System.out.println("All bees are vanquished. You win!");
        }
        observer.stop(this);
        return state;
    }

    /**
     * Runs a single turn. Ants and bees that act are captured before their phase starts, since acting moves and
     * removes insects.
     */
    public void step() {
        Preconditions.checkState(!state.isTerminal(), "The game is already over (%s)", state);
        hive.releaseWave(this);
        strategy.onTurn(this);
        for (Ant ant : getAnts()) {
            if (ant.isAlive()) {
                ant.action(this);
            }
        }
        for (Bee bee : getBees()) {
            if (bee.isAlive()) {
                bee.action(this);
            }
        }
        time++;
        evaluateState();
        observer.onStep(this);
    }

    private GameState evaluateState() {
        if (isQueenInvaded()) {
            state = GameState.LOST;
        } else if (getBees().isEmpty()) {
            state = GameState.WON;
        } else {
            state = GameState.RUNNING;
        }
        return state;
    }

    private boolean isQueenInvaded() {
        return protectedPlaces.stream().anyMatch(place -> !place.getBees().isEmpty());
    }

    /**
     * Place an ant if enough food is available. Called by the strategy.
     *
     * @return Whether the ant was deployed.
     * @throws IllegalArgumentException if the place or ant type is unknown.
     */
    public boolean deployAnt(String placeName, String antTypeName) {
        AntType type = antTypes.get(antTypeName);
        Validate.isTrue(type != null, "Unknown ant type %s", antTypeName);
        Place place = getPlace(placeName);
        if (food < type.getFoodCost()) {
            System.out.println("Not enough food remains to place " + antTypeName);
            return false;
        }
        Ant ant = type.create(this);
        ant.deployTo(place);
        food -= type.getFoodCost();
        return true;
    }

    /**
     * Remove the visible ant from a place, if there is one.
     */
    public void removeAnt(String placeName) {
        Place place = getPlace(placeName);
        Ant ant = place.getAnt();
        if (ant != null) {
            place.removeInsect(ant);
        }
    }

    /**
     * Returns true for the first queen created in this colony, false afterwards.
     */
    public boolean claimQueen() {
        return queensCreated++ == 0;
    }

    /**
     * Marks a place as one where an invading bee loses the game.
     */
    public void protectPlace(Place place) {
        protectedPlaces.add(place);
    }

    public void increaseFood(int amount) {
        Validate.isTrue(amount >= 0, "Cannot increase food by %d", amount);
        food += amount;
    }

    /**
     * The visible ant of every place, in registration order.
     */
    public List<Ant> getAnts() {
        return places.values().stream()
                .map(Place::getAnt)
                .filter(ant -> ant != null)
                .collect(Collectors.toList());
    }

    /**
     * Every bee in a registered place (the hive included), in registration order.
     */
    public List<Bee> getBees() {
        return places.values().stream()
                .flatMap(place -> place.getBees().stream())
                .collect(Collectors.toList());
    }

    public List<Insect> getInsects() {
        List<Insect> insects = new ArrayList<>(getAnts());
        insects.addAll(getBees());
        return insects;
    }

    public Place getPlace(String placeName) {
        Place place = places.get(placeName);
        Validate.isTrue(place != null, "Unknown place %s", placeName);
        return place;
    }

    public Map<String, Place> getPlaces() {
        return Collections.unmodifiableMap(places);
    }

    public List<Place> getBeeEntrances() {
        return Collections.unmodifiableList(beeEntrances);
    }

    public Set<Place> getProtectedPlaces() {
        return Collections.unmodifiableSet(protectedPlaces);
    }

    public Map<String, AntType> getAntTypes() {
        return Collections.unmodifiableMap(antTypes);
    }

    public Hive getHive() {
        return hive;
    }

    public Place getQueenPlace() {
        return queenPlace;
    }

    public PlaceGraph getPlaceGraph() {
        return placeGraph;
    }

    public Random getRandom() {
        return random;
    }

    public int getTime() {
        return time;
    }

    public int getFood() {
        return food;
    }

    public GameState getState() {
        return state;
    }

    public SimulationResult getResult() {
        return ImmutableSimulationResult.builder()
                .state(state)
                .turns(time)
                .foodRemaining(food)
                .antsRemaining(getAnts().size())
                .beesRemaining(getBees().size())
                .build();
    }

    @Override
    public String toString() {
        List<String> insects = getInsects().stream().map(Insect::toString).collect(Collectors.toList());
        return insects + " (Food: " + food + ", Time: " + time + ")";
    }
}
