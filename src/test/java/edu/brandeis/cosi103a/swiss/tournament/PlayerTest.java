package edu.brandeis.cosi103a.swiss.tournament;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlayerTest {

    @Test
    void newPlayer_isRankedByItsId() {
        Player player = new Player(4, 15, 2100);

        assertTrue(player.isValid());
        assertEquals(4, player.getRankIndex());
        assertEquals(15, player.getScoreWithoutAcceleration());
        assertEquals(2100, player.getRating());
        assertEquals(ColorPreference.NONE, player.getColorPreference());
    }

    @Test
    void hole_isNotValid() {
        Player hole = Player.hole(2);
        assertFalse(hole.isValid());
        assertEquals(2, hole.getId());
    }

    @Test
    void accelerations_areZeroPastTheEndOfTheList() {
        Player player = new Player(0, 0, 0);
        player.setAcceleration(2, 10);

        assertEquals(0, player.getAcceleration(0));
        assertEquals(0, player.getAcceleration(1));
        assertEquals(10, player.getAcceleration(2));
        assertEquals(0, player.getAcceleration(7));
        assertEquals(List.of(0, 0, 10), player.getAccelerations());
    }

    @Test
    void scoreWithAcceleration_addsCurrentAcceleration() {
        Player player = new Player(0, 0, 0);
        player.updateDerivedData(25, 10, ColorPreference.NONE);

        assertEquals(35, player.scoreWithAcceleration());
    }

    @Test
    void addForbiddenOpponent_reportsWhetherItWasNew() {
        Player player = new Player(1, 0, 0);

        assertTrue(player.addForbiddenOpponent(3));
        assertFalse(player.addForbiddenOpponent(3));
        assertTrue(player.isForbidden(3));
        assertEquals(Set.of(3), player.getForbiddenOpponents());
    }

    @Test
    void playerCannotBeForbiddenFromItself() {
        Player player = new Player(1, 0, 0);
        assertThrows(IllegalArgumentException.class, () -> player.addForbiddenOpponent(1));
        assertThrows(IllegalArgumentException.class,
            () -> new Player(1, 0, 0, List.of(), Set.of(1)));
    }

    @Test
    void negativeData_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Player(0, -5, 0));
        assertThrows(IllegalArgumentException.class, () -> new Player(0, 0, -1));
    }
}
