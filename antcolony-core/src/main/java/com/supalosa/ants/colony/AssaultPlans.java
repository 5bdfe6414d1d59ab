package com.supalosa.ants.colony;

/**
 * The built-in assault plans.
 */
public class AssaultPlans {

    public static AssaultPlan test() {
        return new AssaultPlan().addWave(2, 1).addWave(3, 1);
    }

    public static AssaultPlan full() {
        AssaultPlan plan = new AssaultPlan().addWave(2, 1);
        for (int time = 3; time < 15; time += 2) {
            plan.addWave(time, 1);
        }
        return plan.addWave(15, 8);
    }

    public static AssaultPlan insane() {
        AssaultPlan plan = new AssaultPlan(4).addWave(1, 2);
        for (int time = 3; time < 15; ++time) {
            plan.addWave(time, 1);
        }
        return plan.addWave(15, 20);
    }
}
