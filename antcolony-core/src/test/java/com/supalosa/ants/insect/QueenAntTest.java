package com.supalosa.ants.insect;

import com.supalosa.ants.ColonyTestUtils;
import com.supalosa.ants.colony.AntColony;
import com.supalosa.ants.place.Place;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueenAntTest {

    private AntColony colony;

    @BeforeEach
    void setUp() {
        colony = ColonyTestUtils.createTestColony();
    }

    private Ant antAt(String placeName) {
        return colony.getPlace(placeName).getAnt();
    }

    @Test
    void testOnlyFirstQueenIsTrue() {
        colony.deployAnt("tunnel_0_3", "Queen");
        colony.deployAnt("tunnel_0_6", "Queen");
        QueenAnt queen = (QueenAnt) antAt("tunnel_0_3");
        QueenAnt impostor = (QueenAnt) antAt("tunnel_0_6");
        assertThat(queen.isTrueQueen()).isTrue();
        assertThat(impostor.isTrueQueen()).isFalse();

        impostor.action(colony);
        assertThat(impostor.getArmor()).isEqualTo(0);
        assertThat(impostor.getPlace()).isNull();
        assertThat(antAt("tunnel_0_6")).isNull();
    }

    @Test
    void testDoublesDamageInBothDirectionsOnce() {
        colony.deployAnt("tunnel_0_1", "Thrower");
        colony.deployAnt("tunnel_0_3", "Queen");
        colony.deployAnt("tunnel_0_5", "Fire");
        colony.deployAnt("tunnel_0_6", "Bodyguard");
        colony.deployAnt("tunnel_0_6", "Short");
        QueenAnt queen = (QueenAnt) antAt("tunnel_0_3");
        BodyguardAnt bodyguard = (BodyguardAnt) antAt("tunnel_0_6");
        Ant shortThrower = bodyguard.getContainedAnt().orElseThrow();

        for (int turn = 0; turn < 3; ++turn) {
            queen.action(colony);
        }

        assertThat(antAt("tunnel_0_1").getDamage()).isEqualTo(2);
        assertThat(antAt("tunnel_0_5").getDamage()).isEqualTo(2 * FireAnt.DAMAGE);
        assertThat(shortThrower.getDamage()).isEqualTo(2);
        assertThat(bodyguard.getDamage()).isEqualTo(0);
        assertThat(queen.getDamage()).isEqualTo(1);
        assertThat(queen.getBoostedAnts()).contains(bodyguard, shortThrower);
    }

    @Test
    void testLateAntsAreDoubledOnce() {
        colony.deployAnt("tunnel_0_3", "Queen");
        QueenAnt queen = (QueenAnt) antAt("tunnel_0_3");
        colony.deployAnt("tunnel_0_4", "Bodyguard");
        queen.action(colony);

        colony.deployAnt("tunnel_0_4", "Thrower");
        colony.deployAnt("tunnel_0_0", "Thrower");
        queen.action(colony);
        queen.action(colony);

        Ant contained = ((BodyguardAnt) antAt("tunnel_0_4")).getContainedAnt().orElseThrow();
        assertThat(contained.getDamage()).isEqualTo(2);
        assertThat(antAt("tunnel_0_0").getDamage()).isEqualTo(2);
    }

    @Test
    void testImpostorDoesNotDoubleAgain() {
        colony.deployAnt("tunnel_0_1", "Thrower");
        colony.deployAnt("tunnel_0_3", "Queen");
        QueenAnt queen = (QueenAnt) antAt("tunnel_0_3");
        queen.action(colony);

        colony.deployAnt("tunnel_0_0", "Queen");
        QueenAnt impostor = (QueenAnt) antAt("tunnel_0_0");
        impostor.action(colony);
        queen.action(colony);

        assertThat(antAt("tunnel_0_1").getDamage()).isEqualTo(2);
        assertThat(antAt("tunnel_0_0")).isNull();
    }

    @Test
    void testQueenInsideBodyguard() {
        colony.deployAnt("tunnel_0_3", "Queen");
        colony.deployAnt("tunnel_0_3", "Bodyguard");
        colony.deployAnt("tunnel_0_2", "Thrower");
        BodyguardAnt bodyguard = (BodyguardAnt) antAt("tunnel_0_3");
        QueenAnt queen = (QueenAnt) bodyguard.getContainedAnt().orElseThrow();

        bodyguard.action(colony);
        assertThat(antAt("tunnel_0_2").getDamage()).isEqualTo(2);
        assertThat(queen.getBoostedAnts()).contains(bodyguard);
        assertThat(queen.getDamage()).isEqualTo(1);
    }

    @Test
    void testQueenPlaceBecomesProtected() {
        colony.deployAnt("tunnel_0_3", "Queen");
        Place queenPlace = colony.getPlace("tunnel_0_3");
        assertThat(colony.getProtectedPlaces()).doesNotContain(queenPlace);
        antAt("tunnel_0_3").action(colony);
        assertThat(colony.getProtectedPlaces()).contains(queenPlace, colony.getQueenPlace());
    }

    @Test
    void testTrueQueenRemoval() {
        colony.deployAnt("tunnel_0_3", "Queen");
        QueenAnt queen = (QueenAnt) antAt("tunnel_0_3");
        colony.removeAnt("tunnel_0_3");
        assertThat(antAt("tunnel_0_3")).isSameAs(queen);

        // She can still be killed.
        queen.reduceArmor(1);
        assertThat(antAt("tunnel_0_3")).isNull();
        assertThat(queen.getPlace()).isNull();
    }

    @Test
    void testQueenThrowsLeaves() {
        colony.deployAnt("tunnel_0_3", "Queen");
        Bee bee = new Bee();
        colony.getPlace("tunnel_0_7").addInsect(bee);
        antAt("tunnel_0_3").action(colony);
        assertThat(bee.getArmor()).isEqualTo(2);
    }
}
