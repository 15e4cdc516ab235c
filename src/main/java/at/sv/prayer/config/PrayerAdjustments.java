package at.sv.prayer.config;

import at.sv.prayer.Prayer;
import lombok.Builder;
import lombok.Value;

/**
 * Signed minute offsets added to the computed prayer times. Unset prayers are not adjusted.
 */
@Value
@Builder(toBuilder = true)
public class PrayerAdjustments {

    public static final PrayerAdjustments NONE = PrayerAdjustments.builder().build();

    int fajr;
    int sunrise;
    int dhuhr;
    int asr;
    int sunset;
    int maghrib;
    int isha;
    int midnight;
    int twoThirdNight;

    public int minutes(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case SUNSET -> sunset;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
            case MIDNIGHT -> midnight;
            case TWO_THIRD_NIGHT -> twoThirdNight;
        };
    }

    public PrayerAdjustments with(Prayer prayer, int minutes) {
        PrayerAdjustmentsBuilder builder = toBuilder();
        switch (prayer) {
            case FAJR -> builder.fajr(minutes);
            case SUNRISE -> builder.sunrise(minutes);
            case DHUHR -> builder.dhuhr(minutes);
            case ASR -> builder.asr(minutes);
            case SUNSET -> builder.sunset(minutes);
            case MAGHRIB -> builder.maghrib(minutes);
            case ISHA -> builder.isha(minutes);
            case MIDNIGHT -> builder.midnight(minutes);
            case TWO_THIRD_NIGHT -> builder.twoThirdNight(minutes);
        }
        return builder.build();
    }
}
