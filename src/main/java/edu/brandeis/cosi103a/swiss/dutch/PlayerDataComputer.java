package edu.brandeis.cosi103a.swiss.dutch;

import edu.brandeis.cosi103a.swiss.tournament.BuildLimits;
import edu.brandeis.cosi103a.swiss.tournament.Color;
import edu.brandeis.cosi103a.swiss.tournament.ColorPreference;
import edu.brandeis.cosi103a.swiss.tournament.Match;
import edu.brandeis.cosi103a.swiss.tournament.Player;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives each participant's score, acceleration and color preference for the round about
 * to be paired, following the Dutch system color rules.
 *
 * <p>Color preference, first matching rule wins:
 * <ol>
 *   <li>color difference (whites minus blacks, played games only) of 2 or more: BLACK,
 *       absolute; -2 or less: WHITE, absolute</li>
 *   <li>same color in the two latest played games: the other color, absolute</li>
 *   <li>color difference of +1: BLACK, strong; -1: WHITE, strong</li>
 *   <li>any game played: the opposite of the latest played color, mild</li>
 *   <li>nothing played: no preference, except the top ranked player before round one,
 *       who is given the tournament's initial color</li>
 * </ol>
 */
public final class PlayerDataComputer {

    private static final Logger log = LoggerFactory.getLogger(PlayerDataComputer.class);

    private PlayerDataComputer() {}

    /**
     * Recomputes the derived data of every participant. Holes are left untouched.
     * Running it again without new results gives the same values.
     *
     * @throws edu.brandeis.cosi103a.swiss.tournament.BuildLimitExceededException if a score
     *         does not fit the score limit; no player is updated in that case
     */
    public static void computePlayerData(Tournament tournament) {
        BuildLimits limits = tournament.getLimits();
        int round = tournament.getPlayedRounds();
        List<Player> players = tournament.getValidPlayers();
        int topRankIndex = players.stream().mapToInt(Player::getRankIndex).min().orElse(-1);

        // Compute everything first so a limit failure leaves the players as they were
        List<Derived> derived = new ArrayList<>(players.size());
        for (Player player : players) {
            List<Match> history = playedRoundsOf(player, round);
            int score = computeScore(tournament, history);
            int acceleration = player.getAcceleration(round);
            limits.checkPoints(score);
            limits.checkPoints(score + acceleration);

            ColorPreference preference = computeColorPreference(history);
            if (preference.color() == Color.NONE && round == 0 && player.getRankIndex() == topRankIndex) {
                preference = initialPreference(tournament.getInitialColor());
            }
            derived.add(new Derived(player, score, acceleration, preference));
        }

        for (Derived d : derived) {
            d.player().updateDerivedData(d.score(), d.acceleration(), d.preference());
            log.debug("Player {}: score={}, acceleration={}, preference={}",
                d.player().getId(), d.score(), d.acceleration(), d.preference());
        }
        log.info("Computed player data for {} players before round {}", derived.size(), round + 1);
    }

    /**
     * Sum of the points earned over the given history, acceleration excluded.
     */
    static int computeScore(Tournament tournament, List<Match> history) {
        int score = 0;
        for (Match match : history) {
            score += tournament.getPoints(match.matchScore());
        }
        return score;
    }

    /**
     * Applies the color rules to a history, oldest round first. Unplayed rounds are ignored.
     */
    public static ColorPreference computeColorPreference(List<Match> history) {
        int colorDifference = 0;
        Color lastColor = Color.NONE;
        boolean repeatedColor = false;
        for (Match match : history) {
            if (!match.gameWasPlayed()) {
                continue;
            }
            colorDifference += match.color() == Color.WHITE ? 1 : -1;
            repeatedColor = match.color() == lastColor;
            lastColor = match.color();
        }

        if (colorDifference >= 2) {
            return ColorPreference.absoluteFor(Color.BLACK);
        }
        if (colorDifference <= -2) {
            return ColorPreference.absoluteFor(Color.WHITE);
        }
        if (repeatedColor) {
            return ColorPreference.absoluteFor(lastColor.invert());
        }
        if (colorDifference == 1) {
            return ColorPreference.strongFor(Color.BLACK);
        }
        if (colorDifference == -1) {
            return ColorPreference.strongFor(Color.WHITE);
        }
        if (lastColor != Color.NONE) {
            return ColorPreference.mildFor(lastColor.invert());
        }
        return ColorPreference.NONE;
    }

    private static ColorPreference initialPreference(Color initialColor) {
        return initialColor == Color.NONE ? ColorPreference.NONE : ColorPreference.mildFor(initialColor);
    }

    private static List<Match> playedRoundsOf(Player player, int playedRounds) {
        List<Match> matches = player.getMatches();
        return matches.size() > playedRounds ? matches.subList(0, playedRounds) : matches;
    }

    private record Derived(Player player, int score, int acceleration, ColorPreference preference) {}
}
