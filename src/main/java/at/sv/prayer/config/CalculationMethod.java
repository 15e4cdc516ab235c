package at.sv.prayer.config;

/**
 * The calculation methods in common use, each with its preset {@link CalculationParameters}.
 */
public enum CalculationMethod {
    /**
     * Muslim World League.
     */
    MUSLIM_WORLD_LEAGUE,
    /**
     * Egyptian General Authority of Survey.
     */
    EGYPTIAN,
    /**
     * University of Islamic Sciences, Karachi.
     */
    KARACHI,
    /**
     * Umm al-Qura University, Makkah. Isha is a fixed interval after maghrib.
     */
    UMM_AL_QURA,
    DUBAI,
    /**
     * Moonsighting Committee. Uses seasonal twilight approximations and special rules above 55° latitude.
     */
    MOONSIGHTING_COMMITTEE,
    /**
     * ISNA.
     */
    NORTH_AMERICA,
    KUWAIT,
    QATAR,
    /**
     * Majlis Ugama Islam Singapura. Rounds up to the next minute.
     */
    SINGAPORE,
    /**
     * Institute of Geophysics, University of Tehran. Maghrib is defined by an angle.
     */
    TEHRAN,
    /**
     * Diyanet İşleri Başkanlığı.
     */
    TURKEY,
    /**
     * No preset angles. Meant to be customized.
     */
    OTHER;

    public CalculationParameters getParameters() {
        CalculationParameters.CalculationParametersBuilder builder = CalculationParameters.builder().method(this);
        return switch (this) {
            case MUSLIM_WORLD_LEAGUE -> builder.fajrAngle(18).ishaAngle(17)
                                               .methodAdjustments(PrayerAdjustments.builder().dhuhr(1).build())
                                               .build();
            case EGYPTIAN -> builder.fajrAngle(19.5).ishaAngle(17.5)
                                    .methodAdjustments(PrayerAdjustments.builder().dhuhr(1).build())
                                    .build();
            case KARACHI -> builder.fajrAngle(18).ishaAngle(18)
                                   .methodAdjustments(PrayerAdjustments.builder().dhuhr(1).build())
                                   .build();
            case UMM_AL_QURA -> builder.fajrAngle(18.5).ishaInterval(90).build();
            case DUBAI -> builder.fajrAngle(18.2).ishaAngle(18.2)
                                 .methodAdjustments(PrayerAdjustments.builder().sunrise(-3).dhuhr(3).asr(3).maghrib(3).build())
                                 .build();
            case MOONSIGHTING_COMMITTEE -> builder.fajrAngle(18).ishaAngle(18)
                                                  .methodAdjustments(PrayerAdjustments.builder().dhuhr(5).maghrib(3).build())
                                                  .build();
            case NORTH_AMERICA -> builder.fajrAngle(15).ishaAngle(15)
                                         .methodAdjustments(PrayerAdjustments.builder().dhuhr(1).build())
                                         .build();
            case KUWAIT -> builder.fajrAngle(18).ishaAngle(17.5).build();
            case QATAR -> builder.fajrAngle(18).ishaInterval(90).build();
            case SINGAPORE -> builder.fajrAngle(20).ishaAngle(18)
                                     .methodAdjustments(PrayerAdjustments.builder().dhuhr(1).build())
                                     .rounding(Rounding.UP)
                                     .build();
            case TEHRAN -> builder.fajrAngle(17.7).ishaAngle(14).maghribAngle(4.5).build();
            case TURKEY -> builder.fajrAngle(18).ishaAngle(17)
                                  .methodAdjustments(PrayerAdjustments.builder().sunrise(-7).dhuhr(5).asr(4).maghrib(7).build())
                                  .build();
            case OTHER -> builder.build();
        };
    }
}
