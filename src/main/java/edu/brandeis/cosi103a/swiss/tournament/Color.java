package edu.brandeis.cosi103a.swiss.tournament;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The color a player had, or would like to have, in a game.
 */
public enum Color {
    WHITE("w"),
    BLACK("b"),
    NONE("-");

    private final String code;

    Color(String code) {
        this.code = code;
    }

    /**
     * Returns the opposite color. NONE stays NONE.
     */
    public Color invert() {
        return switch (this) {
            case WHITE -> BLACK;
            case BLACK -> WHITE;
            case NONE -> NONE;
        };
    }

    /**
     * Single-character code used in tournament files and snapshots.
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Decodes a wire code.
     *
     * @throws IllegalArgumentException if the code is not one of {@code w}, {@code b}, {@code -}
     */
    @JsonCreator
    public static Color fromCode(String code) {
        for (Color color : values()) {
            if (color.code.equals(code)) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown color code: " + code);
    }
}
