package at.sv.prayer.solar;

import java.time.Instant;
import java.util.Optional;

/**
 * The solar events of a single day at a fixed location.
 */
public interface SolarDay {

    Instant getTransit();

    Instant getSunrise();

    Instant getSunset();

    /**
     * @param shadowFactor the length of an object's shadow beyond its noon shadow, as multiple of its height
     * @return the afternoon time the shadow reaches the given length, empty if it does not on this day
     */
    Optional<Instant> afternoonShadowCrossing(double shadowFactor);

    /**
     * @param angle        the altitude of the sun in degrees, negative below the horizon
     * @param afterTransit true for the crossing after the solar transit, false for the one before
     * @return the time the sun passes the given altitude, empty if it does not on this day
     */
    Optional<Instant> angleCrossing(double angle, boolean afterTransit);
}
