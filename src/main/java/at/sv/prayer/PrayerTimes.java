package at.sv.prayer;

import at.sv.prayer.config.CalculationParameters;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The prayer times of one date and location. Not every prayer is guaranteed to be present, e.g. asr does not exist
 * if the sun never gets high enough.
 */
@Getter
public final class PrayerTimes {

    private final Coordinates coordinates;
    private final LocalDate date;
    private final CalculationParameters parameters;
    @Getter(AccessLevel.NONE)
    private final Map<Prayer, Instant> times;

    PrayerTimes(Coordinates coordinates, LocalDate date, CalculationParameters parameters, Map<Prayer, Instant> times) {
        this.coordinates = coordinates;
        this.date = date;
        this.parameters = parameters;
        Map<Prayer, Instant> copy = new EnumMap<>(Prayer.class);
        copy.putAll(times);
        this.times = Collections.unmodifiableMap(copy);
    }

    public Optional<Instant> get(Prayer prayer) {
        return Optional.ofNullable(times.get(prayer));
    }

    public boolean contains(Prayer prayer) {
        return times.containsKey(prayer);
    }

    /**
     * @param prayers the prayers to return, in the order to return them
     * @return one element per requested prayer, empty if the prayer has no time on this date
     */
    public List<Optional<PrayerTime>> prayerTimes(List<Prayer> prayers) {
        return prayers.stream()
                      .map(prayer -> get(prayer).map(time -> new PrayerTime(prayer, time)))
                      .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PrayerTimes{" +
               "date=" + date +
               ", coordinates=" + coordinates +
               ", method=" + parameters.getMethod() +
               ", times=" + times.entrySet()
                                 .stream()
                                 .map(entry -> entry.getKey().getKey() + "=" + entry.getValue())
                                 .collect(Collectors.joining(", ", "{", "}")) +
               '}';
    }
}
