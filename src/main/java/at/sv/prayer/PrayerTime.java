package at.sv.prayer;

import java.time.Instant;
import java.util.Objects;

public record PrayerTime(Prayer prayer, Instant time) {
    public PrayerTime {
        Objects.requireNonNull(prayer, "prayer");
        Objects.requireNonNull(time, "time");
    }

    @Override
    public String toString() {
        return prayer.getKey() + "=" + time;
    }
}
