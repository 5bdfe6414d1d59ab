package com.supalosa.ants.insect;

import com.google.common.collect.Sets;
import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.place.Place;

import java.util.Collections;
import java.util.Set;

/**
 * The queen of the colony. She throws leaves like a scuba thrower and doubles the damage of every other ant in
 * her tunnel, once per ant. Once she has acted, a bee entering her place ends the game.
 * <p>
 * Only the first queen of a colony is the true queen; any other queen expires on its first action.
 */
public class QueenAnt extends ScubaThrower {

    private final boolean trueQueen;
    // Ants that have had their damage doubled, by identity.
    private final Set<Ant> boostedAnts;

    public QueenAnt(boolean trueQueen) {
        super(AntType.QUEEN);
        this.trueQueen = trueQueen;
        this.boostedAnts = Sets.newIdentityHashSet();
    }

    @Override
    protected void act(AntColony colony) {
        if (!trueQueen) {
            reduceArmor(getArmor());
            return;
        }
        colony.protectPlace(getPlace());
        super.act(colony);
        boostTunnel();
    }

    /**
     * Walks from the queen's place towards the hive and towards the colony base, doubling the damage of each
     * ant not boosted before.
     */
    void boostTunnel() {
        Place current = getPlace();
        Ant occupant = current.getAnt();
        if (occupant != null && occupant.isContainer()) {
            // The queen is inside a bodyguard.
            boostedAnts.add(occupant);
        }
        for (Place place = current.getEntrance(); place != null; place = place.getEntrance()) {
            boost(place);
        }
        for (Place place = current.getExit(); place != null; place = place.getExit()) {
            boost(place);
        }
    }

    private void boost(Place place) {
        Ant ant = place.getAnt();
        if (ant == null) {
            return;
        }
        if (ant.isContainer()) {
            // Containers deal no damage of their own; their contained ant is boosted instead.
            boostedAnts.add(ant);
            ant.getContainedAnt().ifPresent(this::doubleDamageOnce);
        } else {
            doubleDamageOnce(ant);
        }
    }

    private void doubleDamageOnce(Ant ant) {
        if (ant != this && boostedAnts.add(ant)) {
            ant.setDamage(ant.getDamage() * 2);
        }
    }

    /**
     * The true queen cannot be removed from her place while she is alive.
     */
    @Override
    public boolean isRemovable() {
        return !trueQueen || !isAlive();
    }

    public boolean isTrueQueen() {
        return trueQueen;
    }

    public Set<Ant> getBoostedAnts() {
        return Collections.unmodifiableSet(boostedAnts);
    }
}
