package edu.brandeis.cosi103a.swiss.tournament;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * One player's history for a single round.
 *
 * @param opponent              id of the opponent, empty for a bye or an unpaired round
 * @param color                 color played, NONE when no color was assigned
 * @param matchScore            result for this player
 * @param gameWasPlayed         false for byes and forfeits
 * @param participatedInPairing the player was paired or given the pairing-allocated bye
 */
public record Match(
    @JsonProperty("opponent") Optional<Integer> opponent,
    @JsonProperty("color") Color color,
    @JsonProperty("matchScore") MatchScore matchScore,
    @JsonProperty("gameWasPlayed") boolean gameWasPlayed,
    @JsonProperty("participatedInPairing") boolean participatedInPairing
) {

    public Match {
        Objects.requireNonNull(opponent, "opponent");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(matchScore, "matchScore");
        if (gameWasPlayed && (opponent.isEmpty() || color == Color.NONE)) {
            throw new IllegalArgumentException("A played game needs an opponent and a color");
        }
    }

    /**
     * A round in which the player was not paired at all.
     */
    public static Match absent() {
        return new Match(Optional.empty(), Color.NONE, MatchScore.LOSS, false, false);
    }

    /**
     * A game that was actually played over the board.
     */
    public static Match played(int opponent, Color color, MatchScore matchScore) {
        return new Match(Optional.of(opponent), color, matchScore, true, true);
    }

    /**
     * A paired game that was decided without being played.
     */
    public static Match forfeit(int opponent, Color color, MatchScore matchScore) {
        return new Match(Optional.of(opponent), color, matchScore, false, true);
    }

    /**
     * A round without an opponent. The pairing-allocated bye counts as participation,
     * a requested or administrative bye does not.
     */
    public static Match bye(MatchScore matchScore, boolean participatedInPairing) {
        return new Match(Optional.empty(), Color.NONE, matchScore, false, participatedInPairing);
    }

    /**
     * False for byes and for rounds in which the player was not paired.
     */
    @JsonIgnore
    public boolean hasOpponent() {
        return opponent.isPresent();
    }
}
