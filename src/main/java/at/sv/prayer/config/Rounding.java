package at.sv.prayer.config;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * How the final prayer instants are rounded. Fractions of a second are always dropped.
 */
public enum Rounding {
    /**
     * Rounds to the nearest minute, 30 seconds and above round up.
     */
    NEAREST,
    /**
     * Rounds up to the next full minute, unless already on a full minute.
     */
    UP,
    /**
     * Keeps the seconds.
     */
    NONE;

    public Instant apply(Instant time) {
        Instant seconds = time.truncatedTo(ChronoUnit.SECONDS);
        long secondOfMinute = Math.floorMod(seconds.getEpochSecond(), 60L);
        return switch (this) {
            case NEAREST -> secondOfMinute >= 30 ? seconds.plusSeconds(60 - secondOfMinute) : seconds.minusSeconds(secondOfMinute);
            case UP -> secondOfMinute > 0 ? seconds.plusSeconds(60 - secondOfMinute) : seconds;
            case NONE -> seconds;
        };
    }
}
