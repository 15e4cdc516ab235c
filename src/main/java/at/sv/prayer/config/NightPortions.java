package at.sv.prayer.config;

/**
 * The fractions of the night (sunset to next sunrise) used as the latest fajr and earliest isha.
 */
public record NightPortions(double fajr, double isha) {
    public NightPortions {
        assertValidPortion(fajr, "fajr");
        assertValidPortion(isha, "isha");
    }

    private static void assertValidPortion(double portion, String name) {
        if (!Double.isFinite(portion) || portion < 0 || portion > 1) {
            throw new IllegalArgumentException("Invalid " + name + " night portion '" + portion + "'. Allowed range: [0..1]");
        }
    }
}
