package com.supalosa.ants.colony;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.supalosa.ants.insect.Bee;
import org.apache.commons.lang3.Validate;

import java.util.List;

/**
 * The bees' plan of attack for the colony. Attacks come in timed waves: each time maps to the bees that leave
 * the hive at that time.
 */
public class AssaultPlan {

    private final int beeArmor;
    private final ListMultimap<Integer, Bee> waves;

    public AssaultPlan() {
        this(Bee.DEFAULT_ARMOR);
    }

    public AssaultPlan(int beeArmor) {
        Validate.isTrue(beeArmor > 0, "Bee armor must be positive, was %d", beeArmor);
        this.beeArmor = beeArmor;
        this.waves = ArrayListMultimap.create();
    }

    /**
     * Add a wave at {@code time} with {@code count} bees of this plan's armor.
     */
    public AssaultPlan addWave(int time, int count) {
        Validate.isTrue(time >= 0, "Wave time cannot be negative, was %d", time);
        Validate.isTrue(count >= 0, "Wave size cannot be negative, was %d", count);
        for (int i = 0; i < count; ++i) {
            waves.put(time, new Bee(beeArmor));
        }
        return this;
    }

    /**
     * Add pre-made bees to the wave at {@code time}.
     */
    public AssaultPlan addBees(int time, List<Bee> bees) {
        Validate.isTrue(time >= 0, "Wave time cannot be negative, was %d", time);
        waves.putAll(time, bees);
        return this;
    }

    public List<Bee> getWave(int time) {
        return ImmutableList.copyOf(waves.get(time));
    }

    /**
     * Every bee in the plan, in order of wave time.
     */
    public List<Bee> allBees() {
        ImmutableList.Builder<Bee> builder = ImmutableList.builder();
        waves.keySet().stream().sorted().forEach(time -> builder.addAll(waves.get(time)));
        return builder.build();
    }

    public int getBeeArmor() {
        return beeArmor;
    }

    @Override
    public String toString() {
        return waves.toString();
    }
}
