package edu.brandeis.cosi103a.swiss.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.swiss.config.ObjectMapperFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Capacity of the running configuration. Every count the core stores is checked against
 * these maxima; exceeding one is a {@link BuildLimitExceededException}, never a wraparound.
 *
 * @param maxPlayers largest number of player ids, holes included
 * @param maxPoints  largest score, stored as ten times the actual score
 * @param maxRating  largest rating
 * @param maxRounds  largest number of rounds a player history may hold
 */
public record BuildLimits(
    @JsonProperty("maxPlayers") int maxPlayers,
    @JsonProperty("maxPoints") int maxPoints,
    @JsonProperty("maxRating") int maxRating,
    @JsonProperty("maxRounds") int maxRounds
) {

    public static final BuildLimits DEFAULT = new BuildLimits(9999, 1998, 9999, 255);

    static final String RESOURCE = "/build-limits.json";

    public BuildLimits {
        if (maxPlayers < 1 || maxPoints < 1 || maxRating < 0 || maxRounds < 1) {
            throw new IllegalArgumentException("Build limits must be positive: maxPlayers=" + maxPlayers
                + ", maxPoints=" + maxPoints + ", maxRating=" + maxRating + ", maxRounds=" + maxRounds);
        }
    }

    /**
     * Loads {@code build-limits.json} from the classpath, falling back to {@link #DEFAULT}
     * when the resource is absent.
     */
    public static BuildLimits load() {
        try (InputStream in = BuildLimits.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return DEFAULT;
            }
            return ObjectMapperFactory.create().readValue(in, BuildLimits.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Reads limits from a JSON file.
     */
    public static BuildLimits fromFile(Path path) throws IOException {
        return ObjectMapperFactory.create().readValue(path.toFile(), BuildLimits.class);
    }

    public void checkPlayerCount(int count) {
        check("player count", count, maxPlayers);
    }

    public void checkPoints(int points) {
        check("score", points, maxPoints);
    }

    public void checkRating(int rating) {
        check("rating", rating, maxRating);
    }

    public void checkRounds(int rounds) {
        check("round count", rounds, maxRounds);
    }

    private static void check(String what, int value, int max) {
        if (value > max) {
            throw new BuildLimitExceededException(
                "The " + what + " " + value + " exceeds the configured maximum of " + max);
        }
    }
}
