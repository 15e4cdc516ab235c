package at.sv.prayer.solar;

import at.sv.prayer.Coordinates;

import java.time.LocalDate;

public interface SolarGeometry {
    /**
     * @param date        the calendar date; the solar day around the local noon of this date is used
     * @param coordinates the location
     * @return the solar events of the day
     * @throws UnresolvableSolarGeometry if the transit, sunrise or sunset could not be found for the given day
     */
    SolarDay resolve(LocalDate date, Coordinates coordinates);
}
