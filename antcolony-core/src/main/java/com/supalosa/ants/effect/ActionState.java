package com.supalosa.ants.effect;

import com.supalosa.ants.colony.AntColony;
import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * The stack of status effects wrapping an insect's own action, innermost first.
 * <p>
 * Invoking the state runs the outermost layer. An active layer uses up one invocation and applies its effect to
 * "invoke the next layer in"; an exhausted layer invokes the next layer in directly. The insect's own action is
 * reached once all layers have been passed. A new effect is always added on the outside, so it modifies the
 * effects that were already present.
 */
@Value.Immutable
public abstract class ActionState {

    public abstract List<EffectLayer> layers();

    public static ActionState base() {
        return ImmutableActionState.builder().build();
    }

    /**
     * Returns this state with {@code effect} wrapped around it for {@code duration} invocations.
     */
    public ActionState withEffect(StatusEffect effect, int duration) {
        Validate.isTrue(duration >= 0, "Effect duration cannot be negative, was %d", duration);
        return ImmutableActionState.builder()
                .from(this)
                .addLayers(EffectLayer.of(effect, duration))
                .build();
    }

    /**
     * Performs one invocation of the action and returns the state for the next invocation.
     *
     * @param colony The colony, passed to the effects.
     * @param baseAction The insect's unmodified action.
     */
    public ActionState invoke(AntColony colony, Runnable baseAction) {
        List<EffectLayer> next = new ArrayList<>(layers());
        invokeLayer(next, next.size() - 1, colony, baseAction);
        next.removeIf(layer -> !layer.isActive());
        return ImmutableActionState.builder().addAllLayers(next).build();
    }

    private static void invokeLayer(List<EffectLayer> layers, int index, AntColony colony, Runnable baseAction) {
        if (index < 0) {
            baseAction.run();
            return;
        }
        EffectLayer layer = layers.get(index);
        if (layer.isActive()) {
            layers.set(index, EffectLayer.of(layer.effect(), layer.remaining() - 1));
            layer.effect().apply(colony, () -> invokeLayer(layers, index - 1, colony, baseAction));
        } else {
            invokeLayer(layers, index - 1, colony, baseAction);
        }
    }

    /**
     * Whether no effect is currently modifying the action.
     */
    public boolean isUnmodified() {
        return layers().stream().noneMatch(EffectLayer::isActive);
    }
}
