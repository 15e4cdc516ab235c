package at.sv.prayer.config;

import at.sv.prayer.Coordinates;

public enum HighLatitudeRule {
    /**
     * Fajr is never earlier than the middle of the night, isha never later.
     */
    MIDDLE_OF_THE_NIGHT,
    /**
     * Fajr is never earlier than the last seventh of the night, isha never later than the first seventh.
     */
    SEVENTH_OF_THE_NIGHT,
    /**
     * The night portion is the twilight angle divided by 60.
     */
    TWILIGHT_ANGLE;

    private static final double SEVENTH_OF_THE_NIGHT_LATITUDE = 48;

    public static HighLatitudeRule recommended(Coordinates coordinates) {
        if (coordinates.latitude() > SEVENTH_OF_THE_NIGHT_LATITUDE) {
            return SEVENTH_OF_THE_NIGHT;
        }
        return MIDDLE_OF_THE_NIGHT;
    }

    public NightPortions nightPortions(double fajrAngle, double ishaAngle) {
        return switch (this) {
            case MIDDLE_OF_THE_NIGHT -> new NightPortions(1.0 / 2.0, 1.0 / 2.0);
            case SEVENTH_OF_THE_NIGHT -> new NightPortions(1.0 / 7.0, 1.0 / 7.0);
            case TWILIGHT_ANGLE -> new NightPortions(fajrAngle / 60.0, ishaAngle / 60.0);
        };
    }
}
