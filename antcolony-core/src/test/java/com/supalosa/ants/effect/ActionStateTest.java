package com.supalosa.ants.effect;

import com.supalosa.ants.colony.AntColony;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActionStateTest {

    private AntColony colony;
    private AtomicInteger actions;

    @BeforeEach
    void setUp() {
        colony = mock(AntColony.class);
        actions = new AtomicInteger();
    }

    private ActionState invokeAt(ActionState state, int time) {
        when(colony.getTime()).thenReturn(time);
        return state.invoke(colony, actions::incrementAndGet);
    }

    @Test
    void testBaseStateRunsAction() {
        ActionState state = ActionState.base();
        state = invokeAt(state, 1);
        state = invokeAt(state, 2);
        assertThat(actions.get()).isEqualTo(2);
        assertThat(state.isUnmodified()).isTrue();
    }

    @Test
    void testStunLastsForDuration() {
        ActionState state = ActionState.base().withEffect(StatusEffect.STUN, 2);
        state = invokeAt(state, 0);
        state = invokeAt(state, 1);
        assertThat(actions.get()).isEqualTo(0);
        assertThat(state.isUnmodified()).isTrue();

        for (int time = 2; time < 6; ++time) {
            state = invokeAt(state, time);
        }
        assertThat(actions.get()).isEqualTo(4);
        assertThat(state.layers()).isEmpty();
    }

    @Test
    void testSlowOnlyActsOnEvenTurns() {
        ActionState state = ActionState.base().withEffect(StatusEffect.SLOW, 3);
        state = invokeAt(state, 1);
        assertThat(actions.get()).isEqualTo(0);
        state = invokeAt(state, 2);
        assertThat(actions.get()).isEqualTo(1);
        state = invokeAt(state, 3);
        assertThat(actions.get()).isEqualTo(1);
        assertThat(state.isUnmodified()).isTrue();

        // Odd turns no longer matter once the effect has expired.
        state = invokeAt(state, 5);
        state = invokeAt(state, 7);
        assertThat(actions.get()).isEqualTo(3);
    }

    @Test
    void testEffectsNest() {
        ActionState state = ActionState.base()
                .withEffect(StatusEffect.SLOW, 2)
                .withEffect(StatusEffect.STUN, 1);
        // The stun wraps the slow, so the slow is not used up while stunned.
        state = invokeAt(state, 2);
        assertThat(actions.get()).isEqualTo(0);
        assertThat(state.layers()).containsExactly(EffectLayer.of(StatusEffect.SLOW, 2));

        state = invokeAt(state, 3);
        assertThat(actions.get()).isEqualTo(0);
        state = invokeAt(state, 4);
        assertThat(actions.get()).isEqualTo(1);
        assertThat(state.isUnmodified()).isTrue();
    }

    @Test
    void testStatesAreImmutable() {
        ActionState base = ActionState.base();
        ActionState stunned = base.withEffect(StatusEffect.STUN, 1);
        assertThat(base.layers()).isEmpty();
        invokeAt(stunned, 0);
        assertThat(stunned.layers()).containsExactly(EffectLayer.of(StatusEffect.STUN, 1));
    }

    @Test
    void testNegativeDuration() {
        assertThatThrownBy(() -> ActionState.base().withEffect(StatusEffect.SLOW, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDefaultDurations() {
        assertThat(StatusEffect.SLOW.getDefaultDuration()).isEqualTo(3);
        assertThat(StatusEffect.STUN.getDefaultDuration()).isEqualTo(1);
    }
}
