package at.sv.prayer.cli;

import at.sv.prayer.Coordinates;
import at.sv.prayer.NextPrayerFinder;
import at.sv.prayer.Prayer;
import at.sv.prayer.PrayerTime;
import at.sv.prayer.PrayerTimeEngine;
import at.sv.prayer.PrayerTimes;
import at.sv.prayer.config.CalculationMethod;
import at.sv.prayer.config.CalculationParameters;
import at.sv.prayer.config.HighLatitudeRule;
import at.sv.prayer.config.Madhab;
import at.sv.prayer.config.PrayerAdjustments;
import at.sv.prayer.config.Rounding;
import at.sv.prayer.config.Shafaq;
import at.sv.prayer.solar.SolarGeometry;
import at.sv.prayer.solar.SuncalcSolarGeometry;
import at.sv.prayer.solar.UnresolvableSolarGeometry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Slf4j
@Command(name = "PrayerTimes", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the prayer times of a date and location. All times are in UTC.")
public final class PrayerTimesCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-mm-dd>",
            description = "The date to print the prayer times for. Default: today (UTC).")
    LocalDate date;
    @Option(names = "--method",
            defaultValue = "${env:METHOD:-MUSLIM_WORLD_LEAGUE}",
            description = "The calculation method. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    CalculationMethod method;
    @Option(names = "--madhab",
            defaultValue = "${env:MADHAB:-SHAFI}",
            description = "The madhab used for asr. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Madhab madhab;
    @Option(names = "--high-latitude-rule",
            description = "The rule limiting fajr and isha on short nights. Valid values: ${COMPLETION-CANDIDATES}. " +
                          "Default: recommended rule for the latitude.")
    HighLatitudeRule highLatitudeRule;
    @Option(names = "--shafaq",
            description = "The twilight used by the moonsighting committee for isha. Valid values: ${COMPLETION-CANDIDATES}. " +
                          "Default: the one of the method.")
    Shafaq shafaq;
    @Option(names = "--rounding",
            description = "How times are rounded to the minute. Valid values: ${COMPLETION-CANDIDATES}. " +
                          "Default: the one of the method.")
    Rounding rounding;
    @Option(names = "--adjust", paramLabel = "<prayer=minutes>",
            description = "Manual adjustment in minutes added to a prayer, e.g. --adjust fajr=2 --adjust isha=-3.")
    Map<Prayer, Integer> adjustments;
    @Option(names = "--next",
            description = "Also print the next prayer from now.")
    boolean next;
    @Option(names = "--json",
            description = "Print the prayer times as JSON.")
    boolean json;

    private final SolarGeometry solarGeometry;
    private final Supplier<Instant> currentTime;
    private final ObjectMapper mapper;

    public PrayerTimesCommand() {
        this(new SuncalcSolarGeometry(), Instant::now);
    }

    public PrayerTimesCommand(SolarGeometry solarGeometry, Supplier<Instant> currentTime) {
        this.solarGeometry = solarGeometry;
        this.currentTime = currentTime;
        this.mapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        int execute = createCommandLine(new PrayerTimesCommand()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    public static CommandLine createCommandLine(PrayerTimesCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        Coordinates coordinates = getCoordinates();
        CalculationParameters parameters = getCalculationParameters();
        Instant now = currentTime.get();
        LocalDate day = date != null ? date : LocalDate.ofInstant(now, ZoneOffset.UTC);
        log.debug("Compute {} at {} with {}", day, coordinates, parameters);

        PrayerTimeEngine engine = new PrayerTimeEngine(solarGeometry);
        PrayerTimes prayerTimes;
        Optional<PrayerTime> nextPrayer = Optional.empty();
        try {
            prayerTimes = engine.compute(coordinates, day, parameters);
            if (next) {
                nextPrayer = new NextPrayerFinder(engine).next(now, Prayer.DAILY, coordinates, parameters);
            }
        } catch (UnresolvableSolarGeometry e) {
            log.warn("Unable to compute prayer times: {}", e.getMessage());
            spec.commandLine().getErr().println("Unable to compute prayer times: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(prayerTimes, nextPrayer));
        } else {
            printText(out, prayerTimes, nextPrayer);
        }
        out.flush();
        return 0;
    }

    private Coordinates getCoordinates() {
        try {
            return new Coordinates(latitude, longitude);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    private CalculationParameters getCalculationParameters() {
        CalculationParameters.CalculationParametersBuilder builder = method.getParameters().toBuilder().madhab(madhab);
        if (highLatitudeRule != null) {
            builder.highLatitudeRule(highLatitudeRule);
        }
        if (shafaq != null) {
            builder.shafaq(shafaq);
        }
        if (rounding != null) {
            builder.rounding(rounding);
        }
        if (adjustments != null) {
            PrayerAdjustments manual = PrayerAdjustments.NONE;
            for (Map.Entry<Prayer, Integer> entry : adjustments.entrySet()) {
                manual = manual.with(entry.getKey(), entry.getValue());
            }
            builder.adjustments(manual);
        }
        return builder.build();
    }

    private void printText(PrintWriter out, PrayerTimes prayerTimes, Optional<PrayerTime> nextPrayer) {
        out.println(prayerTimes.getDate() + " " + prayerTimes.getCoordinates() + " " + prayerTimes.getParameters().getMethod());
        for (Prayer prayer : Prayer.values()) {
            out.printf("%-16s%s%n", prayer.getKey() + ":", prayerTimes.get(prayer).map(Instant::toString).orElse("-"));
        }
        nextPrayer.ifPresent(prayerTime -> out.printf("%-16s%s %s%n", "next:", prayerTime.prayer().getKey(),
                prayerTime.time()));
    }

    private String toJson(PrayerTimes prayerTimes, Optional<PrayerTime> nextPrayer) {
        ObjectNode root = mapper.createObjectNode();
        root.put("date", prayerTimes.getDate().toString());
        root.put("latitude", prayerTimes.getCoordinates().latitude());
        root.put("longitude", prayerTimes.getCoordinates().longitude());
        root.put("method", prayerTimes.getParameters().getMethod().name());
        ObjectNode times = root.putObject("times");
        for (Prayer prayer : Prayer.values()) {
            prayerTimes.get(prayer).ifPresentOrElse(time -> times.put(prayer.getKey(), time.toString()),
                    () -> times.putNull(prayer.getKey()));
        }
        nextPrayer.ifPresent(prayerTime -> {
            ObjectNode nextNode = root.putObject("next");
            nextNode.put("prayer", prayerTime.prayer().getKey());
            nextNode.put("time", prayerTime.time().toString());
        });
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize prayer times", e);
        }
    }
}
