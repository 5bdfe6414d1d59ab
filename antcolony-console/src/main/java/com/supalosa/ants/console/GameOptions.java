package com.supalosa.ants.console;

import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.colony.AssaultPlan;
import com.supalosa.ants.colony.AssaultPlans;
import com.supalosa.ants.place.LayoutBuilder;
import com.supalosa.ants.place.Layouts;
import org.immutables.value.Value;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Options for a console game, read from the command line.
 */
@Value.Immutable
public interface GameOptions {

    String USAGE = String.join("\n",
            "antcolony [OPTIONS]",
            "Run the Ants vs. SomeBees game.",
            "",
            "-h, --help      Prints this help message",
            "-t, --ten       Start with ten food",
            "-f, --full      Loads a full layout and assault plan",
            "-w, --water     Loads a full layout with water",
            "-i, --insane    Loads a difficult assault plan");

    enum LayoutChoice {
        TEST(Layouts::test),
        DRY(Layouts::dry),
        WET(Layouts::wet);

        private final Supplier<LayoutBuilder> layout;

        LayoutChoice(Supplier<LayoutBuilder> layout) {
            this.layout = layout;
        }

        public LayoutBuilder create() {
            return layout.get();
        }
    }

    enum PlanChoice {
        TEST(AssaultPlans::test),
        FULL(AssaultPlans::full),
        INSANE(AssaultPlans::insane);

        private final Supplier<AssaultPlan> plan;

        PlanChoice(Supplier<AssaultPlan> plan) {
            this.plan = plan;
        }

        /**
         * Creates a new plan. Bees are mutable, so every game needs its own.
         */
        public AssaultPlan create() {
            return plan.get();
        }
    }

    @Value.Default
    default boolean showHelp() {
        return false;
    }

    @Value.Default
    default int food() {
        return AntColony.DEFAULT_FOOD;
    }

    @Value.Default
    default LayoutChoice layout() {
        return LayoutChoice.TEST;
    }

    @Value.Default
    default PlanChoice plan() {
        return PlanChoice.TEST;
    }

    /**
     * Reads the options. Later flags override earlier ones where they overlap, e.g. {@code -f -w} is a full plan
     * on the wet layout. Unknown arguments are ignored.
     */
    static GameOptions parse(String[] args) {
        List<String> argList = Arrays.asList(args);
        ImmutableGameOptions.Builder builder = ImmutableGameOptions.builder();
        if (argList.contains("-h") || argList.contains("--help")) {
            builder.showHelp(true);
        }
        if (argList.contains("-t") || argList.contains("--ten")) {
            builder.food(10);
        }
        LayoutChoice layout = LayoutChoice.TEST;
        PlanChoice plan = PlanChoice.TEST;
        if (argList.contains("-f") || argList.contains("--full")) {
            plan = PlanChoice.FULL;
            layout = LayoutChoice.DRY;
        }
        if (argList.contains("-w") || argList.contains("--water")) {
            layout = LayoutChoice.WET;
        }
        if (argList.contains("-i") || argList.contains("--insane")) {
            plan = PlanChoice.INSANE;
        }
        return builder.layout(layout).plan(plan).build();
    }
}
