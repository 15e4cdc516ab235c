package at.sv.prayer;

import java.util.List;
import java.util.Locale;

public enum Prayer {
    FAJR,
    SUNRISE,
    DHUHR,
    ASR,
    SUNSET,
    MAGHRIB,
    ISHA,
    MIDNIGHT,
    TWO_THIRD_NIGHT;

    /**
     * The five daily prayers together with sunrise, in the order they occur on a regular day.
     */
    public static final List<Prayer> DAILY = List.of(FAJR, SUNRISE, DHUHR, ASR, MAGHRIB, ISHA);

    public String getKey() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
