package at.sv.prayer.solar;

import at.sv.prayer.Coordinates;
import lombok.extern.slf4j.Slf4j;
import org.shredzone.commons.suncalc.SunPosition;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Solar geometry backed by commons-suncalc. All searches are limited to the solar day of the date, starting at
 * the local mean midnight of the location.
 */
@Slf4j
public final class SuncalcSolarGeometry implements SolarGeometry {

    private static final int SECONDS_PER_DEGREE_OF_LONGITUDE = 240;

    @Override
    public SolarDay resolve(LocalDate date, Coordinates coordinates) {
        ZonedDateTime start = getLocalMeanMidnight(date, coordinates);
        SunTimes sunTimes = getParametersFor(start, coordinates).twilight(SunTimes.Twilight.VISUAL).execute();
        ZonedDateTime sunrise = sunTimes.getRise();
        ZonedDateTime noon = sunTimes.getNoon();
        ZonedDateTime sunset = sunTimes.getSet();
        if (sunrise == null || noon == null || sunset == null) {
            log.debug("No sunrise, transit or sunset on {} at {}: rise={}, noon={}, set={}", date, coordinates, sunrise,
                    noon, sunset);
            throw new UnresolvableSolarGeometry("Unable to resolve sunrise, transit and sunset on " + date + " at " +
                                                coordinates + getReason(sunTimes));
        }
        return new SuncalcSolarDay(coordinates, start, noon.toInstant(), sunrise.toInstant(), sunset.toInstant());
    }

    private static ZonedDateTime getLocalMeanMidnight(LocalDate date, Coordinates coordinates) {
        long offset = Math.round(coordinates.longitude() * SECONDS_PER_DEGREE_OF_LONGITUDE);
        return date.atStartOfDay(ZoneOffset.UTC).minusSeconds(offset);
    }

    private static SunTimes.Parameters getParametersFor(ZonedDateTime start, Coordinates coordinates) {
        return SunTimes.compute()
                       .at(coordinates.latitude(), coordinates.longitude())
                       .on(start)
                       .oneDay();
    }

    private static String getReason(SunTimes sunTimes) {
        if (sunTimes.isAlwaysUp()) {
            return ": the sun never sets";
        } else if (sunTimes.isAlwaysDown()) {
            return ": the sun never rises";
        }
        return "";
    }

    private static final class SuncalcSolarDay implements SolarDay {

        private final Coordinates coordinates;
        private final ZonedDateTime start;
        private final Instant transit;
        private final Instant sunrise;
        private final Instant sunset;

        private SuncalcSolarDay(Coordinates coordinates, ZonedDateTime start, Instant transit, Instant sunrise,
                                Instant sunset) {
            this.coordinates = coordinates;
            this.start = start;
            this.transit = transit;
            this.sunrise = sunrise;
            this.sunset = sunset;
        }

        @Override
        public Instant getTransit() {
            return transit;
        }

        @Override
        public Instant getSunrise() {
            return sunrise;
        }

        @Override
        public Instant getSunset() {
            return sunset;
        }

        @Override
        public Optional<Instant> afternoonShadowCrossing(double shadowFactor) {
            double noonAltitude = SunPosition.compute()
                                             .at(coordinates.latitude(), coordinates.longitude())
                                             .on(transit.atZone(ZoneOffset.UTC))
                                             .execute()
                                             .getTrueAltitude();
            if (noonAltitude <= 0) {
                return Optional.empty();
            }
            double noonShadow = 1.0 / Math.tan(Math.toRadians(noonAltitude));
            double altitude = Math.toDegrees(Math.atan(1.0 / (shadowFactor + noonShadow)));
            return angleCrossing(altitude, true);
        }

        @Override
        public Optional<Instant> angleCrossing(double angle, boolean afterTransit) {
            SunTimes sunTimes = getParametersFor(start, coordinates).twilight(angle).execute();
            ZonedDateTime crossing = afterTransit ? sunTimes.getSet() : sunTimes.getRise();
            if (crossing == null) {
                log.trace("Sun does not pass {}° {} transit on {}", angle, afterTransit ? "after" : "before", start);
                return Optional.empty();
            }
            Instant time = crossing.toInstant();
            if (afterTransit ? time.isBefore(transit) : time.isAfter(transit)) {
                return Optional.empty();
            }
            return Optional.of(time);
        }
    }
}
