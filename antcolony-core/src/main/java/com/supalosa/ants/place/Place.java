package com.supalosa.ants.place;

import com.google.common.base.Preconditions;
import com.supalosa.ants.insect.Ant;
import com.supalosa.ants.insect.Bee;
import com.supalosa.ants.insect.Insect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * A Place holds insects and has an exit to another Place.
 * At most one ant is visible in a place; a container ant (bodyguard) may hold one more inside it.
 */
public class Place {

    private final String name;
    private final Place exit;
    private final List<Bee> bees;
    private Place entrance;
    private Ant ant;

    public Place(String name) {
        this(name, null);
    }

    /**
     * @param name Unique name of the place.
     * @param exit The place reached by exiting this place, or null. Its entrance is linked to this place.
     */
    public Place(String name, Place exit) {
        this.name = name;
        this.exit = exit;
        this.bees = new ArrayList<>();
        if (exit != null) {
            exit.linkEntrance(this);
        }
    }

    /**
     * Sets the entrance of this place. The entrance of an ordinary place can only be linked once.
     */
    public void linkEntrance(Place entrance) {
        Preconditions.checkState(this.entrance == null,
                "%s already has entrance %s, cannot link %s", this, this.entrance, entrance);
        this.entrance = entrance;
    }

    /**
     * Adds an insect to this place.
     * There can be any number of bees in a place, but only one ant unless exactly one of the two ants is
     * able to contain the other.
     *
     * @throws IllegalStateException if the place already holds an ant that cannot be combined with this one.
     */
    public void addInsect(Insect insect) {
        if (insect instanceof Ant) {
            addAnt((Ant) insect);
        } else {
            bees.add((Bee) insect);
        }
        insect.setPlace(this);
    }

    private void addAnt(Ant incoming) {
        if (ant == null) {
            ant = incoming;
        } else if (ant.canContain(incoming)) {
            ant.containAnt(incoming);
        } else if (incoming.canContain(ant)) {
            incoming.containAnt(ant);
            ant = incoming;
        } else {
            throw new IllegalStateException("Two ants in " + this);
        }
    }

    /**
     * Removes an insect from this place.
     * Removing a container promotes the ant it was holding. Removing a non-removable ant does nothing.
     *
     * @throws IllegalStateException if the insect is not in this place.
     */
    public void removeInsect(Insect insect) {
        if (insect instanceof Ant) {
            Ant removed = (Ant) insect;
            boolean contained = ant != null && ant.getContainedAnt().filter(held -> held == removed).isPresent();
            if (ant != removed && !contained) {
                throw new IllegalStateException(removed + " is not in " + this);
            }
            if (!removed.isRemovable()) {
                return;
            }
            if (ant == removed) {
                ant = removed.releaseContainedAnt().orElse(null);
                if (ant != null) {
                    ant.setPlace(this);
                }
            } else {
                ant.releaseContainedAnt();
            }
        } else {
            Preconditions.checkState(bees.remove(insect), "%s is not in %s", insect, this);
        }
        insect.setPlace(null);
    }

    public String getName() {
        return name;
    }

    public Place getExit() {
        return exit;
    }

    public Place getEntrance() {
        return entrance;
    }

    /**
     * The visible ant in this place, if any. A contained ant is reached through its container.
     */
    public Ant getAnt() {
        return ant;
    }

    /**
     * Returns a read-only view of the bees in this place. Copy it before damaging bees, as expired bees
     * are removed from the underlying list.
     */
    public List<Bee> getBees() {
        return Collections.unmodifiableList(bees);
    }

    /**
     * Returns a bee chosen uniformly at random from this place, or empty if there are none.
     */
    public Optional<Bee> randomBee(Random random) {
        if (bees.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(bees.get(random.nextInt(bees.size())));
    }

    @Override
    public String toString() {
        return name;
    }
}
