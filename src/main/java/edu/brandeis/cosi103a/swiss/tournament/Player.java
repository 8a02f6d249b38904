package edu.brandeis.cosi103a.swiss.tournament;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One entry in the tournament's id space: a player's history plus the attributes derived
 * from it for the round about to be paired.
 *
 * <p>An entry whose {@link #isValid()} is false is a hole kept so that ids stay stable, for
 * example a withdrawn player. Holes never take part in ranking or pairing.
 */
public class Player {
    private final List<Match> matches;
    /**
     * Round-indexed accelerations. Rounds past the end of the list have no acceleration.
     */
    private final List<Integer> accelerations;
    private final Set<Integer> forbiddenOpponents;

    private final int id;
    private final int rating;
    private final boolean valid;

    /**
     * The effective pairing number for the current round, used for choosing colors and for
     * breaking ties.
     */
    private int rankIndex;
    private int scoreWithoutAcceleration;
    /**
     * Acceleration for the current round.
     */
    private int acceleration;
    private ColorPreference colorPreference = ColorPreference.NONE;

    /**
     * Creates a participant with no history.
     *
     * @param id     zero-based pairing id used for input and output
     * @param score  starting score, ten times the actual score
     * @param rating rating, zero when unknown
     */
    public Player(int id, int score, int rating) {
        this(id, score, rating, List.of(), Set.of());
    }

    /**
     * Creates a participant with an existing history, as read from a tournament file.
     */
    public Player(int id, int score, int rating, List<Match> matches, Set<Integer> forbiddenOpponents) {
        this(id, score, rating, matches, forbiddenOpponents, true);
    }

    private Player(int id, int score, int rating, List<Match> matches, Set<Integer> forbiddenOpponents,
                   boolean valid) {
        if (id < 0 || score < 0 || rating < 0) {
            throw new IllegalArgumentException(
                "Negative player data: id=" + id + ", score=" + score + ", rating=" + rating);
        }
        if (forbiddenOpponents.contains(id)) {
            throw new IllegalArgumentException("Player " + id + " cannot be forbidden from itself");
        }
        this.matches = new ArrayList<>(matches);
        this.accelerations = new ArrayList<>();
        this.forbiddenOpponents = new HashSet<>(forbiddenOpponents);
        this.id = id;
        this.rankIndex = id;
        this.rating = rating;
        this.scoreWithoutAcceleration = score;
        this.valid = valid;
    }

    /**
     * Creates the tombstone for an id that does not belong to a participant.
     */
    public static Player hole(int id) {
        return new Player(id, 0, 0, List.of(), Set.of(), false);
    }

    /**
     * Checks the stored score and rating against the given limits.
     *
     * @throws BuildLimitExceededException if either is too large
     */
    void checkLimits(BuildLimits limits) {
        limits.checkPoints(scoreWithoutAcceleration);
        limits.checkRating(rating);
        limits.checkRounds(matchCount());
    }

    public int getId() {
        return id;
    }

    public boolean isValid() {
        return valid;
    }

    public int getRating() {
        return rating;
    }

    /**
     * @return the history, oldest round first
     */
    public ImmutableList<Match> getMatches() {
        return ImmutableList.copyOf(matches);
    }

    int matchCount() {
        return matches.size();
    }

    void appendMatch(Match match) {
        matches.add(Objects.requireNonNull(match, "match"));
    }

    public ImmutableSet<Integer> getForbiddenOpponents() {
        return ImmutableSet.copyOf(forbiddenOpponents);
    }

    public boolean isForbidden(int opponent) {
        return forbiddenOpponents.contains(opponent);
    }

    /**
     * Adds an opponent this player may never be paired against.
     *
     * @return true if the opponent was not already forbidden
     */
    public boolean addForbiddenOpponent(int opponent) {
        if (opponent == id) {
            throw new IllegalArgumentException("Player " + id + " cannot be forbidden from itself");
        }
        return forbiddenOpponents.add(opponent);
    }

    /**
     * Returns the acceleration configured for a zero-based round, zero if none was set.
     */
    public int getAcceleration(int round) {
        return round < accelerations.size() ? accelerations.get(round) : 0;
    }

    /**
     * Sets the acceleration for a zero-based round, padding earlier rounds with zero.
     */
    public void setAcceleration(int round, int points) {
        if (round < 0 || points < 0) {
            throw new IllegalArgumentException("Invalid acceleration " + points + " for round " + round);
        }
        while (accelerations.size() <= round) {
            accelerations.add(0);
        }
        accelerations.set(round, points);
    }

    public ImmutableList<Integer> getAccelerations() {
        return ImmutableList.copyOf(accelerations);
    }

    public int getRankIndex() {
        return rankIndex;
    }

    public void setRankIndex(int rankIndex) {
        this.rankIndex = rankIndex;
    }

    public int getScoreWithoutAcceleration() {
        return scoreWithoutAcceleration;
    }

    /**
     * Acceleration applying to the round about to be paired.
     */
    public int getAcceleration() {
        return acceleration;
    }

    /**
     * The score used for pairing: the real score plus the current round's acceleration.
     */
    public int scoreWithAcceleration() {
        return scoreWithoutAcceleration + acceleration;
    }

    public ColorPreference getColorPreference() {
        return colorPreference;
    }

    /**
     * Stores the attributes derived for the next round.
     */
    public void updateDerivedData(int scoreWithoutAcceleration, int acceleration, ColorPreference colorPreference) {
        this.scoreWithoutAcceleration = scoreWithoutAcceleration;
        this.acceleration = acceleration;
        this.colorPreference = Objects.requireNonNull(colorPreference, "colorPreference");
    }

    @Override
    public String toString() {
        return valid
            ? "Player{id=" + id + ", rank=" + rankIndex + ", score=" + scoreWithoutAcceleration + "}"
            : "Player{id=" + id + ", hole}";
    }
}
