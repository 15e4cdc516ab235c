package at.sv.prayer.solar;

import at.sv.prayer.config.Shafaq;

import java.time.Instant;
import java.time.Year;

/**
 * Seasonal approximation of fajr and isha as used by the Moonsighting Committee. Instead of a twilight angle the
 * interval to sunrise or sunset is interpolated between four latitude dependent values over the course of the year.
 */
public final class SeasonalTwilight {

    private static final int NORTHERN_SOLSTICE_OFFSET = 10;
    private static final int SOUTHERN_SOLSTICE_OFFSET = 172;

    private SeasonalTwilight() {
    }

    /**
     * @return the approximate fajr time before the given sunrise
     */
    public static Instant morning(double latitude, int dayOfYear, int year, Instant sunrise) {
        double a = 75 + 28.65 / 55.0 * Math.abs(latitude);
        double b = 75 + 19.44 / 55.0 * Math.abs(latitude);
        double c = 75 + 32.74 / 55.0 * Math.abs(latitude);
        double d = 75 + 48.10 / 55.0 * Math.abs(latitude);
        double minutes = interpolate(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        return sunrise.minusSeconds(Math.round(minutes * 60));
    }

    /**
     * @return the approximate isha time after the given sunset
     */
    public static Instant evening(double latitude, int dayOfYear, int year, Instant sunset, Shafaq shafaq) {
        double lat = Math.abs(latitude);
        double a;
        double b;
        double c;
        double d;
        switch (shafaq) {
            case AHMER -> {
                a = 62 + 17.40 / 55.0 * lat;
                b = 62 - 7.16 / 55.0 * lat;
                c = 62 + 5.12 / 55.0 * lat;
                d = 62 + 19.44 / 55.0 * lat;
            }
            case ABYAD -> {
                a = 75 + 25.60 / 55.0 * lat;
                b = 75 + 7.16 / 55.0 * lat;
                c = 75 + 36.84 / 55.0 * lat;
                d = 75 + 81.84 / 55.0 * lat;
            }
            default -> {
                a = 75 + 25.60 / 55.0 * lat;
                b = 75 + 2.050 / 55.0 * lat;
                c = 75 - 9.21 / 55.0 * lat;
                d = 75 + 6.14 / 55.0 * lat;
            }
        }
        double minutes = interpolate(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        return sunset.plusSeconds(Math.round(minutes * 60));
    }

    /**
     * Days since the winter solstice of the hemisphere, i.e. 0 is around 21 December in the north and
     * around 21 June in the south.
     */
    static int daysSinceSolstice(int dayOfYear, int year, double latitude) {
        boolean leapYear = Year.isLeap(year);
        int daysInYear = leapYear ? 366 : 365;
        int days;
        if (latitude >= 0) {
            days = dayOfYear + NORTHERN_SOLSTICE_OFFSET;
            if (days >= daysInYear) {
                days -= daysInYear;
            }
        } else {
            days = dayOfYear - (leapYear ? SOUTHERN_SOLSTICE_OFFSET + 1 : SOUTHERN_SOLSTICE_OFFSET);
            if (days < 0) {
                days += daysInYear;
            }
        }
        return days;
    }

    private static double interpolate(double a, double b, double c, double d, int days) {
        if (days < 91) {
            return a + (b - a) / 91.0 * days;
        } else if (days < 137) {
            return b + (c - b) / 46.0 * (days - 91);
        } else if (days < 183) {
            return c + (d - c) / 46.0 * (days - 137);
        } else if (days < 229) {
            return d + (c - d) / 46.0 * (days - 183);
        } else if (days < 275) {
            return c + (b - c) / 46.0 * (days - 229);
        }
        return b + (a - b) / 91.0 * (days - 275);
    }
}
