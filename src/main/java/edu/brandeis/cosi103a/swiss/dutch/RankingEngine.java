package edu.brandeis.cosi103a.swiss.dutch;

import edu.brandeis.cosi103a.swiss.tournament.Player;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recomputes the rank order used for color allocation and for breaking ties.
 * Must run after {@link PlayerDataComputer} and before anything that reads rank indexes.
 */
public final class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    /**
     * Higher score without acceleration first, then lower previous rank index, then lower id.
     * Acceleration is ignored so that it never moves a player's pairing number.
     */
    public static final Comparator<Player> UNACCELERATED_SCORE_RANK_ORDER =
        Comparator.comparingInt(Player::getScoreWithoutAcceleration).reversed()
            .thenComparingInt(Player::getRankIndex)
            .thenComparingInt(Player::getId);

    private RankingEngine() {}

    /**
     * Sorts the participants and reassigns zero-based rank indexes in the new order.
     * Holes get no rank.
     */
    public static void updateRanks(Tournament tournament) {
        List<Player> ranked = new ArrayList<>(tournament.getValidPlayers());
        ranked.sort(UNACCELERATED_SCORE_RANK_ORDER);

        List<Integer> playersByRank = new ArrayList<>(ranked.size());
        for (int rank = 0; rank < ranked.size(); rank++) {
            Player player = ranked.get(rank);
            player.setRankIndex(rank);
            playersByRank.add(player.getId());
        }
        tournament.setPlayersByRank(playersByRank);
        log.info("Ranked {} players", playersByRank.size());
    }
}
