package edu.brandeis.cosi103a.swiss.tournament;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The outcome of a round from one player's point of view, ordered from worst to best.
 */
public enum MatchScore {
    LOSS("0"),
    DRAW("="),
    WIN("1");

    private final String code;

    MatchScore(String code) {
        this.code = code;
    }

    /**
     * Returns the opponent's result for the same game.
     */
    public MatchScore invert() {
        return values()[WIN.ordinal() - ordinal()];
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException if the code is not one of {@code 0}, {@code =}, {@code 1}
     */
    @JsonCreator
    public static MatchScore fromCode(String code) {
        for (MatchScore score : values()) {
            if (score.code.equals(code)) {
                return score;
            }
        }
        throw new IllegalArgumentException("Unknown match score code: " + code);
    }
}
