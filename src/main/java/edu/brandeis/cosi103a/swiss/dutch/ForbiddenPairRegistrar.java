package edu.brandeis.cosi103a.swiss.dutch;

import edu.brandeis.cosi103a.swiss.tournament.Match;
import edu.brandeis.cosi103a.swiss.tournament.Player;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Records pairs of players that must never be paired together. The relation is symmetric,
 * registering a pair again has no effect, and entries are never removed.
 */
public final class ForbiddenPairRegistrar {

    private static final Logger log = LoggerFactory.getLogger(ForbiddenPairRegistrar.class);

    private ForbiddenPairRegistrar() {}

    /**
     * Two player ids that may not meet.
     */
    public record Pair(int first, int second) {}

    /**
     * Forbids the pairing of {@code a} and {@code b}. A player paired with itself is ignored,
     * since byes are recorded separately.
     *
     * @return true if the pair was not already forbidden
     * @throws IllegalArgumentException if either id is outside the tournament
     */
    public static boolean forbid(Tournament tournament, int a, int b) {
        Player first = tournament.getPlayer(a);
        Player second = tournament.getPlayer(b);
        if (a == b) {
            log.debug("Ignoring forbidden pair of player {} with itself", a);
            return false;
        }
        boolean added = first.addForbiddenOpponent(b);
        added |= second.addForbiddenOpponent(a);
        return added;
    }

    /**
     * Forbids every pair in the collection.
     *
     * @return the number of pairs that were not already forbidden
     */
    public static int forbidPairs(Tournament tournament, Collection<Pair> pairs) {
        int added = 0;
        for (Pair pair : pairs) {
            if (forbid(tournament, pair.first(), pair.second())) {
                added++;
            }
        }
        return added;
    }

    /**
     * Forbids every pair within a group, for example players from the same team.
     *
     * @return the number of pairs that were not already forbidden
     */
    public static int forbidAll(Tournament tournament, Collection<Integer> group) {
        List<Integer> ids = new ArrayList<>(group);
        List<Pair> pairs = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                pairs.add(new Pair(ids.get(i), ids.get(j)));
            }
        }
        return forbidPairs(tournament, pairs);
    }

    /**
     * Forbids a rematch between every two participants who have already played a game
     * against each other. Forfeits and byes do not count as a meeting.
     *
     * @return the number of pairs that were not already forbidden
     */
    public static int forbidRematches(Tournament tournament) {
        List<Pair> pairs = new ArrayList<>();
        for (Player player : tournament.getValidPlayers()) {
            for (Match match : player.getMatches()) {
                if (match.gameWasPlayed() && match.hasOpponent()) {
                    pairs.add(new Pair(player.getId(), match.opponent().get()));
                }
            }
        }
        int added = forbidPairs(tournament, pairs);
        log.info("Registered {} new rematch restrictions", added);
        return added;
    }
}
