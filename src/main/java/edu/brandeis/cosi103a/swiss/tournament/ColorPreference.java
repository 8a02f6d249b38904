package edu.brandeis.cosi103a.swiss.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The color a player should receive next round and how strongly.
 * An absolute preference must be honored, a strong one should be; with neither flag set the
 * preference is mild and only breaks ties.
 */
public record ColorPreference(
    @JsonProperty("color") Color color,
    @JsonProperty("absolute") boolean absolute,
    @JsonProperty("strong") boolean strong
) {

    public static final ColorPreference NONE = new ColorPreference(Color.NONE, false, false);

    public ColorPreference {
        Objects.requireNonNull(color, "color");
        if (color == Color.NONE && (absolute || strong)) {
            throw new IllegalArgumentException("Cannot have a strong or absolute preference for no color");
        }
    }

    public static ColorPreference absoluteFor(Color color) {
        return new ColorPreference(color, true, false);
    }

    public static ColorPreference strongFor(Color color) {
        return new ColorPreference(color, false, true);
    }

    public static ColorPreference mildFor(Color color) {
        return new ColorPreference(color, false, false);
    }
}
