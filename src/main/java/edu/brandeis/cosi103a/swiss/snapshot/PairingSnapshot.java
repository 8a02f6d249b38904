package edu.brandeis.cosi103a.swiss.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import edu.brandeis.cosi103a.swiss.tournament.Color;
import edu.brandeis.cosi103a.swiss.tournament.ColorPreference;
import edu.brandeis.cosi103a.swiss.tournament.Player;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;

import java.util.TreeSet;

/**
 * What the pairing algorithm needs to pair one round, taken from the tournament after the
 * round's player data and ranks have been computed.
 *
 * @param round          one-based number of the round to be paired
 * @param expectedRounds total rounds planned
 * @param pointsForWin   points for a win, times ten
 * @param pointsForDraw  points for a draw, times ten
 * @param initialColor   color of the top board in round one
 * @param players        participants in rank order
 */
public record PairingSnapshot(
    @JsonProperty("round") int round,
    @JsonProperty("expectedRounds") int expectedRounds,
    @JsonProperty("pointsForWin") int pointsForWin,
    @JsonProperty("pointsForDraw") int pointsForDraw,
    @JsonProperty("initialColor") Color initialColor,
    @JsonProperty("players") ImmutableList<Entry> players
) {

    /**
     * One participant's pairing attributes. The effective score is written for readers
     * and ignored when a snapshot is read back.
     */
    @JsonIgnoreProperties(value = {"scoreWithAcceleration"}, allowGetters = true)
    public record Entry(
        @JsonProperty("id") int id,
        @JsonProperty("rankIndex") int rankIndex,
        @JsonProperty("rating") int rating,
        @JsonProperty("scoreWithoutAcceleration") int scoreWithoutAcceleration,
        @JsonProperty("acceleration") int acceleration,
        @JsonProperty("colorPreference") ColorPreference colorPreference,
        @JsonProperty("forbiddenOpponents") ImmutableSet<Integer> forbiddenOpponents
    ) {
        @JsonProperty("scoreWithAcceleration")
        public int scoreWithAcceleration() {
            return scoreWithoutAcceleration + acceleration;
        }
    }

    /**
     * Captures the tournament's current state. Holes are left out.
     */
    public static PairingSnapshot of(Tournament tournament) {
        ImmutableList.Builder<Entry> entries = ImmutableList.builder();
        for (int id : tournament.getPlayersByRank()) {
            Player player = tournament.getPlayer(id);
            entries.add(new Entry(
                player.getId(),
                player.getRankIndex(),
                player.getRating(),
                player.getScoreWithoutAcceleration(),
                player.getAcceleration(),
                player.getColorPreference(),
                ImmutableSet.copyOf(new TreeSet<>(player.getForbiddenOpponents()))));
        }
        return new PairingSnapshot(
            tournament.getPlayedRounds() + 1,
            tournament.getExpectedRounds(),
            tournament.getPointsForWin(),
            tournament.getPointsForDraw(),
            tournament.getInitialColor(),
            entries.build());
    }
}
