package at.sv.prayer.solar;

/**
 * Exception to signal that sunrise, sunset or the solar transit do not exist for a date and location,
 * e.g. during the polar day or night. Repeating the calculation with the same input fails again.
 */
public final class UnresolvableSolarGeometry extends RuntimeException {

    public UnresolvableSolarGeometry(String message) {
        super(message);
    }
}
