package at.sv.prayer;

import at.sv.prayer.config.CalculationParameters;
import at.sv.prayer.config.Rounding;
import at.sv.prayer.solar.SeasonalTwilight;
import at.sv.prayer.solar.SolarDay;
import at.sv.prayer.solar.SolarGeometry;
import at.sv.prayer.solar.UnresolvableSolarGeometry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static at.sv.prayer.Prayer.ASR;
import static at.sv.prayer.Prayer.DHUHR;
import static at.sv.prayer.Prayer.FAJR;
import static at.sv.prayer.Prayer.ISHA;
import static at.sv.prayer.Prayer.MAGHRIB;
import static at.sv.prayer.Prayer.MIDNIGHT;
import static at.sv.prayer.Prayer.SUNRISE;
import static at.sv.prayer.Prayer.SUNSET;
import static at.sv.prayer.Prayer.TWO_THIRD_NIGHT;

/**
 * Derives the prayer times of a day from its solar events.
 * <p>
 * Fajr is never earlier than a safe value derived from the night length (or the seasonal twilight for the
 * Moonsighting Committee), isha is never later than its safe counterpart. Midnight and the last third of the night
 * need the fajr of the following day, which is computed once without its own midnight.
 */
@Slf4j
public final class PrayerTimeEngine {

    private static final double MOONSIGHTING_HIGH_LATITUDE = 55;

    private final SolarGeometry solarGeometry;

    public PrayerTimeEngine(SolarGeometry solarGeometry) {
        this.solarGeometry = solarGeometry;
    }

    public PrayerTimes compute(Coordinates coordinates, LocalDate date, CalculationParameters parameters) {
        return compute(coordinates, date, parameters, true);
    }

    /**
     * @param includeExtendedNight if {@link Prayer#MIDNIGHT} and {@link Prayer#TWO_THIRD_NIGHT} should be calculated
     * @throws UnresolvableSolarGeometry if sunrise, sunset or transit do not exist on the date or the day after
     */
    public PrayerTimes compute(Coordinates coordinates, LocalDate date, CalculationParameters parameters,
                               boolean includeExtendedNight) {
        LocalDate tomorrow = date.plusDays(1);
        SolarDay solarDay = solarGeometry.resolve(date, coordinates);
        SolarDay nextSolarDay = solarGeometry.resolve(tomorrow, coordinates);

        Instant sunset = solarDay.getSunset();
        Duration night = Duration.between(sunset, nextSolarDay.getSunrise());

        Map<Prayer, Instant> times = new EnumMap<>(Prayer.class);
        times.put(SUNRISE, solarDay.getSunrise());
        times.put(SUNSET, sunset);
        times.put(MAGHRIB, sunset);
        times.put(DHUHR, solarDay.getTransit());
        solarDay.afternoonShadowCrossing(parameters.getMadhab().getShadowLength())
                .ifPresent(asr -> times.put(ASR, asr));
        times.put(FAJR, calculateFajr(solarDay, coordinates, date, parameters, night));
        times.put(ISHA, calculateIsha(solarDay, coordinates, date, parameters, night, times.get(MAGHRIB)));
        times.put(MAGHRIB, calculateMaghrib(solarDay, date, parameters, times.get(MAGHRIB), times.get(ISHA)));
        if (includeExtendedNight) {
            addExtendedNight(coordinates, tomorrow, parameters, times);
        }

        PrayerTimes prayerTimes = new PrayerTimes(coordinates, date, parameters, finalizeTimes(times, parameters));
        log.trace("Computed {}", prayerTimes);
        return prayerTimes;
    }

    private Instant calculateFajr(SolarDay solarDay, Coordinates coordinates, LocalDate date,
                                  CalculationParameters parameters, Duration night) {
        Instant sunrise = solarDay.getSunrise();
        Optional<Instant> fajr = solarDay.angleCrossing(-parameters.getFajrAngle(), false);
        if (isMoonsightingHighLatitude(coordinates, parameters)) {
            fajr = Optional.of(sunrise.minus(night.dividedBy(7)));
        }
        Instant safeFajr;
        if (parameters.isMoonsightingCommittee()) {
            safeFajr = SeasonalTwilight.morning(coordinates.latitude(), date.getDayOfYear(), date.getYear(), sunrise);
        } else {
            safeFajr = sunrise.minus(portionOf(night, parameters.nightPortions(coordinates).fajr()));
        }
        if (fajr.isEmpty() || fajr.get().isBefore(safeFajr)) {
            log.debug("Fajr {} on {} earlier than safe value. Using {}", fajr.orElse(null), date, safeFajr);
            return safeFajr;
        }
        return fajr.get();
    }

    private Instant calculateIsha(SolarDay solarDay, Coordinates coordinates, LocalDate date,
                                  CalculationParameters parameters, Duration night, Instant maghrib) {
        if (parameters.getIshaInterval() > 0) {
            return maghrib.plus(Duration.ofMinutes(parameters.getIshaInterval()));
        }
        Instant sunset = solarDay.getSunset();
        Optional<Instant> isha = solarDay.angleCrossing(-parameters.getIshaAngle(), true);
        if (isMoonsightingHighLatitude(coordinates, parameters)) {
            isha = Optional.of(sunset.plus(night.dividedBy(7)));
        }
        Instant safeIsha;
        if (parameters.isMoonsightingCommittee()) {
            safeIsha = SeasonalTwilight.evening(coordinates.latitude(), date.getDayOfYear(), date.getYear(), sunset,
                    parameters.getShafaq());
        } else {
            safeIsha = sunset.plus(portionOf(night, parameters.nightPortions(coordinates).isha()));
        }
        if (isha.isEmpty() || isha.get().isAfter(safeIsha)) {
            log.debug("Isha {} on {} later than safe value. Using {}", isha.orElse(null), date, safeIsha);
            return safeIsha;
        }
        return isha.get();
    }

    /**
     * Maghrib by angle is only accepted if it falls between sunset and isha.
     */
    private Instant calculateMaghrib(SolarDay solarDay, LocalDate date, CalculationParameters parameters,
                                     Instant maghrib, Instant isha) {
        Double maghribAngle = parameters.getMaghribAngle();
        if (maghribAngle == null) {
            return maghrib;
        }
        Optional<Instant> candidate = solarDay.angleCrossing(-maghribAngle, true);
        if (candidate.isPresent() && candidate.get().isAfter(solarDay.getSunset()) &&
            (isha == null || candidate.get().isBefore(isha))) {
            return candidate.get();
        }
        log.debug("Ignore maghrib {} for angle {} on {}: Not between sunset {} and isha {}", candidate.orElse(null),
                maghribAngle, date, solarDay.getSunset(), isha);
        return maghrib;
    }

    private void addExtendedNight(Coordinates coordinates, LocalDate tomorrow, CalculationParameters parameters,
                                  Map<Prayer, Instant> times) {
        Instant maghrib = times.get(MAGHRIB);
        if (maghrib == null) {
            return;
        }
        PrayerTimes tomorrowTimes;
        try {
            tomorrowTimes = compute(coordinates, tomorrow, parameters, false);
        } catch (UnresolvableSolarGeometry e) {
            log.debug("Skip midnight: {}", e.getMessage());
            return;
        }
        Optional<Instant> tomorrowFajr = tomorrowTimes.get(FAJR);
        if (tomorrowFajr.isEmpty()) {
            return;
        }
        Duration night = Duration.between(maghrib, tomorrowFajr.get());
        times.put(MIDNIGHT, Rounding.NEAREST.apply(maghrib.plus(night.dividedBy(2))));
        times.put(TWO_THIRD_NIGHT, Rounding.NEAREST.apply(maghrib.plus(night.multipliedBy(2).dividedBy(3))));
    }

    private static Map<Prayer, Instant> finalizeTimes(Map<Prayer, Instant> times, CalculationParameters parameters) {
        Map<Prayer, Instant> result = new EnumMap<>(Prayer.class);
        times.forEach((prayer, time) -> {
            int minutes = parameters.getAdjustments().minutes(prayer) + parameters.getMethodAdjustments().minutes(prayer);
            result.put(prayer, parameters.getRounding().apply(time.plus(Duration.ofMinutes(minutes))));
        });
        return result;
    }

    private static boolean isMoonsightingHighLatitude(Coordinates coordinates, CalculationParameters parameters) {
        return parameters.isMoonsightingCommittee() && Math.abs(coordinates.latitude()) >= MOONSIGHTING_HIGH_LATITUDE;
    }

    private static Duration portionOf(Duration duration, double portion) {
        return Duration.ofNanos(Math.round(duration.toNanos() * portion));
    }
}
