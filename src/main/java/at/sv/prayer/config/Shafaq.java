package at.sv.prayer.config;

/**
 * The twilight color used by the seasonal evening twilight of the moonsighting committee.
 */
public enum Shafaq {
    /**
     * Combination of ahmer and abyad.
     */
    GENERAL,
    /**
     * Red twilight, the earlier isha.
     */
    AHMER,
    /**
     * White twilight, the later isha.
     */
    ABYAD
}
