package com.supalosa.ants.insect;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.effect.ActionState;
import com.supalosa.ants.effect.StatusEffect;
import com.supalosa.ants.place.Place;

/**
 * An Insect, the base class of Ant and Bee, has armor and a Place.
 */
public abstract class Insect {

    private int armor;
    // Set by Place.addInsect and Place.removeInsect only.
    private Place place;
    private ActionState actionState;

    protected Insect(int armor) {
        this.armor = armor;
        this.actionState = ActionState.base();
    }

    /**
     * Reduces armor by the given amount. Once armor reaches zero the insect expires and is removed from its
     * place; this happens at most once.
     */
    public void reduceArmor(int amount) {
        armor -= amount;
        if (armor <= 0 && place != null) {
            System.out.println(this + " ran out of armor and expired");
            expire();
        }
    }

    /**
     * Called when the insect runs out of armor while it is still in a place.
     */
    protected void expire() {
        place.removeInsect(this);
    }

    /**
     * Performs this insect's action for the turn, as modified by any status effects.
     */
    public final void action(AntColony colony) {
        ActionState current = actionState;
        actionState = current.invoke(colony, () -> act(colony));
    }

    /**
     * The unmodified action that this insect takes each turn.
     */
    protected abstract void act(AntColony colony);

    /**
     * Wraps the current action with a status effect for the given number of action invocations.
     */
    public void applyEffect(StatusEffect effect, int duration) {
        actionState = actionState.withEffect(effect, duration);
    }

    public ActionState getActionState() {
        return actionState;
    }

    public boolean isWatersafe() {
        return false;
    }

    public int getArmor() {
        return armor;
    }

    protected void setArmor(int armor) {
        this.armor = armor;
    }

    public Place getPlace() {
        return place;
    }

    /**
     * Only called by {@link Place} when the insect is added or removed.
     */
    public void setPlace(Place place) {
        this.place = place;
    }

    public boolean isAlive() {
        return armor > 0;
    }

    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + armor + ", " + place + ")";
    }
}
