package edu.brandeis.cosi103a.swiss.tournament;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The details and history of a tournament.
 *
 * <p>Players are stored densely by id. Ids that do not belong to a participant hold an
 * invalid {@link Player#hole(int) hole}, so ids never move and no player is ever removed.
 * One instance exists per run; it is handed explicitly to every routine that reads or
 * changes it and is not thread-safe.
 */
public class Tournament {

    private final BuildLimits limits;
    /**
     * Players indexed by id.
     */
    private final List<Player> players;
    /**
     * Ids of valid players ordered by rank index.
     */
    private List<Integer> playersByRank;
    private int playedRounds;
    private int expectedRounds;
    private int pointsForWin = 10;
    private int pointsForDraw = 5;
    private Color initialColor = Color.NONE;

    private Tournament(BuildLimits limits, List<Player> players, int playedRounds) {
        this.limits = limits;
        this.players = players;
        this.playedRounds = playedRounds;
        List<Integer> byRank = new ArrayList<>();
        for (Player player : players) {
            if (player.isValid()) {
                byRank.add(player.getId());
            }
        }
        this.playersByRank = byRank;
    }

    public static Builder builder(BuildLimits limits) {
        return new Builder(limits);
    }

    public BuildLimits getLimits() {
        return limits;
    }

    /**
     * @return every entry in the id space, holes included, indexed by id
     */
    public ImmutableList<Player> getPlayers() {
        return ImmutableList.copyOf(players);
    }

    /**
     * @throws IllegalArgumentException if the id is outside the tournament
     */
    public Player getPlayer(int id) {
        if (id < 0 || id >= players.size()) {
            throw new IllegalArgumentException("No player with id " + id);
        }
        return players.get(id);
    }

    /**
     * @return the participants in id order
     */
    public ImmutableList<Player> getValidPlayers() {
        return players.stream().filter(Player::isValid).collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<Integer> getPlayersByRank() {
        return ImmutableList.copyOf(playersByRank);
    }

    /**
     * Replaces the rank order. Every id must belong to a valid player, at most once.
     */
    public void setPlayersByRank(List<Integer> ids) {
        Set<Integer> seen = new HashSet<>();
        for (int id : ids) {
            if (!getPlayer(id).isValid()) {
                throw new IllegalArgumentException("Player " + id + " is not a participant and cannot be ranked");
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Player " + id + " is ranked twice");
            }
        }
        this.playersByRank = new ArrayList<>(ids);
    }

    public int getPlayedRounds() {
        return playedRounds;
    }

    public int getExpectedRounds() {
        return expectedRounds;
    }

    public void setExpectedRounds(int expectedRounds) {
        if (expectedRounds < 0) {
            throw new IllegalArgumentException("Negative expected rounds: " + expectedRounds);
        }
        limits.checkRounds(expectedRounds);
        this.expectedRounds = expectedRounds;
    }

    public int getPointsForWin() {
        return pointsForWin;
    }

    public int getPointsForDraw() {
        return pointsForDraw;
    }

    /**
     * Sets the points, times ten, awarded for a win and a draw. A loss is always worth zero.
     *
     * @throws IllegalArgumentException    if a draw would be worth more than a win
     * @throws BuildLimitExceededException if a win is worth more than the score limit
     */
    public void setPointValues(int pointsForWin, int pointsForDraw) {
        checkPointValues(limits, pointsForWin, pointsForDraw);
        this.pointsForWin = pointsForWin;
        this.pointsForDraw = pointsForDraw;
    }

    private static void checkPointValues(BuildLimits limits, int pointsForWin, int pointsForDraw) {
        if (pointsForDraw < 0 || pointsForDraw > pointsForWin) {
            throw new IllegalArgumentException(
                "Points for a draw must be between 0 and the points for a win: win="
                    + pointsForWin + ", draw=" + pointsForDraw);
        }
        limits.checkPoints(pointsForWin);
    }

    /**
     * The color given to the top board of the first round.
     */
    public Color getInitialColor() {
        return initialColor;
    }

    public void setInitialColor(Color initialColor) {
        this.initialColor = Objects.requireNonNull(initialColor, "initialColor");
    }

    public int getPoints(MatchScore matchScore) {
        return switch (matchScore) {
            case LOSS -> 0;
            case DRAW -> pointsForDraw;
            case WIN -> pointsForWin;
        };
    }

    /**
     * Appends a player's result for the round currently being played.
     *
     * @throws IllegalArgumentException    if the match names the player as its own opponent,
     *                                     or an opponent that is not a participant
     * @throws IllegalStateException       if the player already has a result for this round
     * @throws BuildLimitExceededException if the round would exceed the round limit
     */
    public void recordMatch(int id, Match match) {
        checkRecordable(id, match);
        players.get(id).appendMatch(match);
    }

    /**
     * Records a game played between two players, mirroring the result onto the black player.
     */
    public void recordGame(int white, int black, MatchScore whiteScore) {
        Match whiteMatch = Match.played(black, Color.WHITE, whiteScore);
        Match blackMatch = Match.played(white, Color.WHITE.invert(), whiteScore.invert());
        checkRecordable(white, whiteMatch);
        checkRecordable(black, blackMatch);
        players.get(white).appendMatch(whiteMatch);
        players.get(black).appendMatch(blackMatch);
    }

    /**
     * Records a whole round and closes it. Every result is checked before any is appended,
     * so a rejected round leaves every history as it was and can be submitted again.
     *
     * @param results each player's match, keyed by player id
     * @see #completeRound()
     */
    public void recordRound(Map<Integer, Match> results) {
        SortedMap<Integer, Match> ordered = new TreeMap<>(results);
        for (Map.Entry<Integer, Match> result : ordered.entrySet()) {
            checkRecordable(result.getKey(), result.getValue());
        }
        limits.checkRounds(playedRounds + 1);
        for (Map.Entry<Integer, Match> result : ordered.entrySet()) {
            players.get(result.getKey()).appendMatch(result.getValue());
        }
        completeRound();
    }

    private void checkRecordable(int id, Match match) {
        Player player = getPlayer(id);
        if (!player.isValid()) {
            throw new IllegalArgumentException("Player " + id + " is not a participant");
        }
        if (match.hasOpponent()) {
            int opponent = match.opponent().get();
            if (opponent == id) {
                throw new IllegalArgumentException(
                    "Player " + id + " cannot be its own opponent; record a bye instead");
            }
            if (!getPlayer(opponent).isValid()) {
                throw new IllegalArgumentException(
                    "Player " + id + " cannot be paired against " + opponent + ", which is not a participant");
            }
        }
        if (player.matchCount() != playedRounds) {
            throw new IllegalStateException(
                "Player " + id + " already has a result for round " + (playedRounds + 1));
        }
        limits.checkRounds(playedRounds + 1);
    }

    /**
     * Closes the current round. Participants without a result are recorded as not paired.
     *
     * @throws BuildLimitExceededException if the round would exceed the round limit
     */
    public void completeRound() {
        limits.checkRounds(playedRounds + 1);
        for (Player player : players) {
            if (player.isValid() && player.matchCount() == playedRounds) {
                player.appendMatch(Match.absent());
            }
        }
        playedRounds++;
    }

    /**
     * Assembles a tournament from reader input. Nothing is built until every player and
     * setting has been checked against the limits, so a failed build leaves no state behind.
     */
    public static final class Builder {
        private final BuildLimits limits;
        private final TreeMap<Integer, Player> players = new TreeMap<>();
        private int playedRounds;
        private int expectedRounds;
        private int pointsForWin = 10;
        private int pointsForDraw = 5;
        private Color initialColor = Color.NONE;

        private Builder(BuildLimits limits) {
            this.limits = Objects.requireNonNull(limits, "limits");
        }

        public Builder addPlayer(Player player) {
            if (players.putIfAbsent(player.getId(), player) != null) {
                throw new IllegalArgumentException("Duplicate player id " + player.getId());
            }
            return this;
        }

        public Builder playedRounds(int playedRounds) {
            this.playedRounds = playedRounds;
            return this;
        }

        public Builder expectedRounds(int expectedRounds) {
            this.expectedRounds = expectedRounds;
            return this;
        }

        public Builder pointValues(int pointsForWin, int pointsForDraw) {
            this.pointsForWin = pointsForWin;
            this.pointsForDraw = pointsForDraw;
            return this;
        }

        public Builder initialColor(Color initialColor) {
            this.initialColor = initialColor;
            return this;
        }

        /**
         * @throws BuildLimitExceededException if the input does not fit the limits
         * @throws IllegalArgumentException    if the input is inconsistent
         */
        public Tournament build() {
            int size = players.isEmpty() ? 0 : players.lastKey() + 1;
            limits.checkPlayerCount(size);
            if (playedRounds < 0 || expectedRounds < 0) {
                throw new IllegalArgumentException(
                    "Negative round count: played=" + playedRounds + ", expected=" + expectedRounds);
            }
            limits.checkRounds(playedRounds);
            limits.checkRounds(expectedRounds);
            checkPointValues(limits, pointsForWin, pointsForDraw);
            Objects.requireNonNull(initialColor, "initialColor");
            for (Player player : players.values()) {
                checkPlayer(player, size);
            }

            List<Player> dense = new ArrayList<>(size);
            for (int id = 0; id < size; id++) {
                Player player = players.get(id);
                if (player == null) {
                    dense.add(Player.hole(id));
                    continue;
                }
                if (player.isValid()) {
                    while (player.matchCount() < playedRounds) {
                        player.appendMatch(Match.absent());
                    }
                }
                dense.add(player);
            }

            Tournament tournament = new Tournament(limits, dense, playedRounds);
            tournament.pointsForWin = pointsForWin;
            tournament.pointsForDraw = pointsForDraw;
            tournament.expectedRounds = expectedRounds;
            tournament.initialColor = initialColor;
            return tournament;
        }

        private void checkPlayer(Player player, int size) {
            player.checkLimits(limits);
            if (player.matchCount() > playedRounds) {
                throw new IllegalArgumentException("Player " + player.getId() + " has "
                    + player.matchCount() + " results but only " + playedRounds + " rounds were played");
            }
            for (Match match : player.getMatches()) {
                if (match.hasOpponent() && !isOpponent(player, match.opponent().get())) {
                    throw new IllegalArgumentException(
                        "Player " + player.getId() + " has an invalid opponent " + match.opponent().get());
                }
            }
            for (int opponent : player.getForbiddenOpponents()) {
                if (opponent < 0 || opponent >= size) {
                    throw new IllegalArgumentException(
                        "Player " + player.getId() + " is forbidden from unknown player " + opponent);
                }
            }
        }

        /**
         * An opponent must be another participant added to this builder.
         */
        private boolean isOpponent(Player player, int opponent) {
            Player other = players.get(opponent);
            return opponent != player.getId() && other != null && other.isValid();
        }
    }
}
