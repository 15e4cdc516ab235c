package at.sv.prayer.config;

import at.sv.prayer.Coordinates;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * The convention used to derive prayer times from the solar events of a day.
 * Use {@link CalculationMethod#getParameters()} for the common presets and {@link #toBuilder()} to customize them.
 */
@Value
public class CalculationParameters {

    private static final double TWILIGHT_ANGLE_MAX = 60;

    CalculationMethod method;
    /**
     * Depression of the sun below the horizon at fajr, in degrees.
     */
    double fajrAngle;
    /**
     * Depression of the sun below the horizon at isha, in degrees. Ignored if {@link #ishaInterval} is set.
     */
    double ishaAngle;
    /**
     * Minutes after maghrib for isha. 0 uses {@link #ishaAngle} instead.
     */
    int ishaInterval;
    /**
     * Optional depression of the sun below the horizon at maghrib, in degrees. Null for maghrib at sunset.
     */
    Double maghribAngle;
    Madhab madhab;
    /**
     * Null to use the {@link HighLatitudeRule#recommended(Coordinates) recommended} rule of the location.
     */
    HighLatitudeRule highLatitudeRule;
    Shafaq shafaq;
    PrayerAdjustments adjustments;
    PrayerAdjustments methodAdjustments;
    Rounding rounding;

    @Builder(toBuilder = true)
    private CalculationParameters(CalculationMethod method, double fajrAngle, double ishaAngle, int ishaInterval,
                                  Double maghribAngle, Madhab madhab, HighLatitudeRule highLatitudeRule, Shafaq shafaq,
                                  PrayerAdjustments adjustments, PrayerAdjustments methodAdjustments, Rounding rounding) {
        this.method = Objects.requireNonNull(method, "method");
        this.fajrAngle = assertValidAngle(fajrAngle, "fajr");
        this.ishaAngle = assertValidAngle(ishaAngle, "isha");
        this.ishaInterval = assertValidIshaInterval(ishaInterval);
        this.maghribAngle = maghribAngle == null ? null : assertValidAngle(maghribAngle, "maghrib");
        this.madhab = Objects.requireNonNull(madhab, "madhab");
        this.highLatitudeRule = highLatitudeRule;
        if (highLatitudeRule == HighLatitudeRule.TWILIGHT_ANGLE) {
            assertValidTwilightAngle(fajrAngle, "fajr");
            assertValidTwilightAngle(ishaAngle, "isha");
        }
        this.shafaq = Objects.requireNonNull(shafaq, "shafaq");
        this.adjustments = Objects.requireNonNull(adjustments, "adjustments");
        this.methodAdjustments = Objects.requireNonNull(methodAdjustments, "methodAdjustments");
        this.rounding = Objects.requireNonNull(rounding, "rounding");
    }

    public static CalculationParametersBuilder builder() {
        return new CalculationParametersBuilder().method(CalculationMethod.OTHER)
                                                 .madhab(Madhab.SHAFI)
                                                 .shafaq(Shafaq.GENERAL)
                                                 .adjustments(PrayerAdjustments.NONE)
                                                 .methodAdjustments(PrayerAdjustments.NONE)
                                                 .rounding(Rounding.NEAREST);
    }

    public boolean isMoonsightingCommittee() {
        return method == CalculationMethod.MOONSIGHTING_COMMITTEE;
    }

    public NightPortions nightPortions(Coordinates coordinates) {
        HighLatitudeRule rule = highLatitudeRule != null ? highLatitudeRule : HighLatitudeRule.recommended(coordinates);
        return rule.nightPortions(fajrAngle, ishaAngle);
    }

    private static double assertValidAngle(double angle, String name) {
        if (!Double.isFinite(angle) || angle < 0 || angle > 90) {
            throw new IllegalArgumentException("Invalid " + name + " angle '" + angle + "'. Allowed range: [0..90]");
        }
        return angle;
    }

    /**
     * The twilight angle rule uses a sixtieth of the angle as night portion, which must not exceed the whole night.
     */
    private static void assertValidTwilightAngle(double angle, String name) {
        if (angle > TWILIGHT_ANGLE_MAX) {
            throw new IllegalArgumentException("Invalid " + name + " angle '" + angle + "' for " +
                                               HighLatitudeRule.TWILIGHT_ANGLE + ". Allowed range: [0..60]");
        }
    }

    private static int assertValidIshaInterval(int ishaInterval) {
        if (ishaInterval < 0) {
            throw new IllegalArgumentException("Invalid isha interval '" + ishaInterval + "'. Must not be negative.");
        }
        return ishaInterval;
    }
}
