package at.sv.prayer;

import at.sv.prayer.config.CalculationMethod;
import at.sv.prayer.config.CalculationParameters;
import at.sv.prayer.config.HighLatitudeRule;
import at.sv.prayer.config.Rounding;
import at.sv.prayer.solar.FixedSolarGeometry;
import at.sv.prayer.solar.SuncalcSolarGeometry;
import at.sv.prayer.solar.UnresolvableSolarGeometry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static at.sv.prayer.solar.FixedSolarGeometry.time;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class NextPrayerFinderTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 10);
    private static final Coordinates COORDINATES = new Coordinates(35, 0);
    private static final Duration FAJR_TIME = time(4, 31).plusSeconds(10);

    private FixedSolarGeometry geometry;
    private NextPrayerFinder finder;
    private CalculationParameters parameters;
    private List<Prayer> allPrayers;

    @BeforeEach
    void setUp() {
        geometry = new FixedSolarGeometry().morning(-18, FAJR_TIME)
                                           .evening(-17, time(19, 30))
                                           .shadow(1, time(15, 30));
        finder = new NextPrayerFinder(new PrayerTimeEngine(geometry));
        parameters = CalculationMethod.OTHER.getParameters()
                                            .toBuilder()
                                            .fajrAngle(18)
                                            .ishaAngle(17)
                                            .highLatitudeRule(HighLatitudeRule.MIDDLE_OF_THE_NIGHT)
                                            .rounding(Rounding.NONE)
                                            .build();
        allPrayers = new ArrayList<>(Prayer.DAILY);
        allPrayers.add(Prayer.MIDNIGHT);
        allPrayers.add(Prayer.TWO_THIRD_NIGHT);
    }

    private static Instant at(LocalDate date, Duration offset) {
        return FixedSolarGeometry.at(date, offset);
    }

    private Optional<PrayerTime> next(Instant after, List<Prayer> prayerOrder) {
        return finder.next(after, prayerOrder, COORDINATES, DATE, parameters);
    }

    @Test
    void next_beforeFajr_returnsFajrOfToday() {
        Optional<PrayerTime> next = next(at(DATE, FAJR_TIME).minus(Duration.ofMinutes(1)), Prayer.DAILY);

        assertThat(next).contains(new PrayerTime(Prayer.FAJR, at(DATE, FAJR_TIME)));
    }

    @Test
    void next_afterIsha_returnsFajrOfTomorrow() {
        Optional<PrayerTime> next = next(at(DATE, time(19, 31)), Prayer.DAILY);

        assertThat(next).contains(new PrayerTime(Prayer.FAJR, at(DATE.plusDays(1), FAJR_TIME)));
    }

    @Test
    void next_exactlyAtPrayer_returnsFollowingPrayer() {
        Optional<PrayerTime> next = next(at(DATE, time(12, 0)), Prayer.DAILY);

        assertThat(next).contains(new PrayerTime(Prayer.ASR, at(DATE, time(15, 30))));
    }

    @Test
    void next_afterMidnight_returnsLastThirdOfYesterdaysNight() {
        Optional<PrayerTime> next = next(at(DATE, time(0, 30)), allPrayers);

        assertThat(next).contains(new PrayerTime(Prayer.TWO_THIRD_NIGHT, at(DATE, time(1, 1))));
    }

    @Test
    void next_afterIsha_withExtendedNight_returnsMidnight() {
        Optional<PrayerTime> next = next(at(DATE, time(20, 0)), allPrayers);

        assertThat(next).contains(new PrayerTime(Prayer.MIDNIGHT, at(DATE, time(23, 16))));
    }

    @Test
    void next_searchesEachDayInGivenOrder() {
        Optional<PrayerTime> next = next(at(DATE, time(3, 0)), List.of(Prayer.ISHA, Prayer.FAJR));

        assertThat(next).contains(new PrayerTime(Prayer.ISHA, at(DATE, time(19, 30))));
    }

    @Test
    void next_duplicatePrayers_areHarmless() {
        Optional<PrayerTime> next = next(at(DATE, time(13, 0)), List.of(Prayer.DHUHR, Prayer.DHUHR, Prayer.MAGHRIB));

        assertThat(next).contains(new PrayerTime(Prayer.MAGHRIB, at(DATE, time(18, 0))));
    }

    @Test
    void next_absentPrayer_isSkipped() {
        geometry = new FixedSolarGeometry();
        finder = new NextPrayerFinder(new PrayerTimeEngine(geometry));

        Optional<PrayerTime> next = next(at(DATE, time(13, 0)), List.of(Prayer.ASR, Prayer.SUNSET));

        assertThat(next).contains(new PrayerTime(Prayer.SUNSET, at(DATE, time(18, 0))));
    }

    @Test
    void next_onlyAbsentPrayers_empty() {
        geometry = new FixedSolarGeometry();
        finder = new NextPrayerFinder(new PrayerTimeEngine(geometry));

        assertThat(next(at(DATE, time(13, 0)), List.of(Prayer.ASR))).isEmpty();
    }

    @Test
    void next_noPrayerLaterInWindow_empty() {
        assertThat(next(at(DATE.plusDays(2), time(12, 0)), allPrayers)).isEmpty();
    }

    @Test
    void next_emptyPrayerOrder_empty() {
        assertThat(next(at(DATE, time(12, 0)), List.of())).isEmpty();
    }

    @Test
    void next_previousDayUnresolvable_throws() {
        geometry.unresolvable(DATE.minusDays(1));

        assertThatThrownBy(() -> next(at(DATE, time(12, 0)), Prayer.DAILY))
                .isInstanceOf(UnresolvableSolarGeometry.class);
    }

    @Test
    void next_dayAfterUnresolvable_throws() {
        geometry.unresolvable(DATE.plusDays(2));

        assertThatThrownBy(() -> next(at(DATE, time(12, 0)), Prayer.DAILY))
                .isInstanceOf(UnresolvableSolarGeometry.class);
    }

    @Test
    void next_withoutReferenceDate_usesUtcDateOfInstant() {
        FixedSolarGeometry spyGeometry = spy(geometry);
        finder = new NextPrayerFinder(new PrayerTimeEngine(spyGeometry));
        Instant after = at(DATE, time(23, 59));

        Optional<PrayerTime> next = finder.next(after, Prayer.DAILY, COORDINATES, parameters);

        assertThat(next).contains(new PrayerTime(Prayer.FAJR, at(DATE.plusDays(1), FAJR_TIME)));
        verify(spyGeometry).resolve(eq(DATE.minusDays(1)), any());
    }

    @Test
    void next_sameInput_sameResult() {
        Coordinates raleigh = new Coordinates(35.7750, -78.6336);
        LocalDate date = LocalDate.of(2015, 7, 12);
        CalculationParameters northAmerica = CalculationMethod.NORTH_AMERICA.getParameters();
        NextPrayerFinder realFinder = new NextPrayerFinder(new PrayerTimeEngine(new SuncalcSolarGeometry()));
        List<Prayer> prayerOrder = new ArrayList<>(allPrayers);

        for (Instant after = Instant.parse("2015-07-12T00:00:00Z"); after.isBefore(Instant.parse("2015-07-13T00:00:00Z"));
             after = after.plus(Duration.ofHours(3))) {
            Optional<PrayerTime> first = realFinder.next(after, prayerOrder, raleigh, date, northAmerica);
            Optional<PrayerTime> second = realFinder.next(after, prayerOrder, raleigh, date, northAmerica);

            assertThat(first).as("after " + after).isPresent().isEqualTo(second);
        }
    }

    @Test
    void next_realSolarGeometry_raleigh_afterDhuhr_returnsAsr() {
        Coordinates raleigh = new Coordinates(35.7750, -78.6336);
        LocalDate date = LocalDate.of(2015, 7, 12);
        CalculationParameters northAmerica = CalculationMethod.NORTH_AMERICA.getParameters();
        PrayerTimeEngine engine = new PrayerTimeEngine(new SuncalcSolarGeometry());
        PrayerTimes prayerTimes = engine.compute(raleigh, date, northAmerica);

        Optional<PrayerTime> next = new NextPrayerFinder(engine).next(Instant.parse("2015-07-12T18:00:00Z"),
                Prayer.DAILY, raleigh, date, northAmerica);

        assertThat(next).contains(new PrayerTime(Prayer.ASR, prayerTimes.get(Prayer.ASR).orElseThrow()));
    }

    @Test
    void next_realSolarGeometry_raleigh_afterIshaInUtc_returnsFajrOfNextDay() {
        Coordinates raleigh = new Coordinates(35.7750, -78.6336);
        LocalDate date = LocalDate.of(2015, 7, 12);
        CalculationParameters northAmerica = CalculationMethod.NORTH_AMERICA.getParameters();
        PrayerTimeEngine engine = new PrayerTimeEngine(new SuncalcSolarGeometry());
        PrayerTimes tomorrow = engine.compute(raleigh, date.plusDays(1), northAmerica);

        // isha of July 12 is already on July 13 in UTC
        Optional<PrayerTime> next = new NextPrayerFinder(engine).next(Instant.parse("2015-07-13T03:00:00Z"),
                Prayer.DAILY, raleigh, northAmerica);

        assertThat(next).contains(new PrayerTime(Prayer.FAJR, tomorrow.get(Prayer.FAJR).orElseThrow()));
    }
}
