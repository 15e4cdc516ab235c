package at.sv.prayer;

/**
 * A geographic location in degrees.
 *
 * @param latitude  north positive, [-90..90]
 * @param longitude east positive, [-180..180]
 */
public record Coordinates(double latitude, double longitude) {
    public Coordinates {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Invalid latitude '" + latitude + "'. Allowed range: [-90..90]");
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Invalid longitude '" + longitude + "'. Allowed range: [-180..180]");
        }
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
