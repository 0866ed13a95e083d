package io.github.sachinnimbal.filmes.core.enums;

/**
 * Read-time classification of a movie by its running time.
 */
public enum LengthCategory {
    SHORT,
    FEATURE,
    EPIC;

    private static final int FEATURE_MIN_MINUTES = 90;
    private static final int EPIC_MIN_MINUTES = 151;

    public static LengthCategory of(Integer durationMinutes) {
        if (durationMinutes == null) {
            return null;
        }
        if (durationMinutes < FEATURE_MIN_MINUTES) {
            return SHORT;
        }
        if (durationMinutes < EPIC_MIN_MINUTES) {
            return FEATURE;
        }
        return EPIC;
    }
}
