package at.sv.prayer;

import at.sv.prayer.config.CalculationParameters;
import at.sv.prayer.solar.UnresolvableSolarGeometry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Finds the first prayer after a given instant within the day before, the day of, and the day after a reference
 * date. The previous day is included, as its late night prayers may still be ahead shortly after midnight.
 */
@Slf4j
public final class NextPrayerFinder {

    private final PrayerTimeEngine engine;

    public NextPrayerFinder(PrayerTimeEngine engine) {
        this.engine = engine;
    }

    /**
     * Uses the UTC date of {@code after} as reference date.
     *
     * @see #next(Instant, List, Coordinates, LocalDate, CalculationParameters)
     */
    public Optional<PrayerTime> next(Instant after, List<Prayer> prayerOrder, Coordinates coordinates,
                                     CalculationParameters parameters) {
        return next(after, prayerOrder, coordinates, LocalDate.ofInstant(after, ZoneOffset.UTC), parameters);
    }

    /**
     * @param after         the returned prayer is strictly after this instant
     * @param prayerOrder   the prayers to consider, each day is searched in this order
     * @param referenceDate the date of the middle day of the searched window
     * @return the first matching prayer, or empty if no prayer in the window is after the given instant
     * @throws UnresolvableSolarGeometry if the prayer times of one of the three days could not be computed
     */
    public Optional<PrayerTime> next(Instant after, List<Prayer> prayerOrder, Coordinates coordinates,
                                     LocalDate referenceDate, CalculationParameters parameters) {
        List<PrayerTimes> window = List.of(
                engine.compute(coordinates, referenceDate.minusDays(1), parameters),
                engine.compute(coordinates, referenceDate, parameters),
                engine.compute(coordinates, referenceDate.plusDays(1), parameters)
        );
        for (PrayerTimes prayerTimes : window) {
            for (Prayer prayer : prayerOrder) {
                Optional<Instant> time = prayerTimes.get(prayer);
                if (time.isPresent() && time.get().isAfter(after)) {
                    PrayerTime next = new PrayerTime(prayer, time.get());
                    log.trace("Next prayer after {}: {} of {}", after, next, prayerTimes.getDate());
                    return Optional.of(next);
                }
            }
        }
        log.debug("No prayer after {} between {} and {}", after, referenceDate.minusDays(1), referenceDate.plusDays(1));
        return Optional.empty();
    }
}
