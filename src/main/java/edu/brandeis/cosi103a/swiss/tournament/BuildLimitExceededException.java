package edu.brandeis.cosi103a.swiss.tournament;

/**
 * Thrown when the tournament data does not fit the configured {@link BuildLimits}.
 * This is never recoverable inside the core; callers abort the affected tournament.
 */
public class BuildLimitExceededException extends RuntimeException {
    public BuildLimitExceededException(String message) {
        super(message);
    }
}
