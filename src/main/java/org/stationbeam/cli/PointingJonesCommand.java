package org.stationbeam.cli;

import lombok.extern.slf4j.Slf4j;
import org.stationbeam.beam.BeamModelRegistry;
import org.stationbeam.data.CelestialDirection;
import org.stationbeam.data.Config;
import org.stationbeam.data.JonesResult;
import org.stationbeam.data.ObservationRequest;
import org.stationbeam.data.OutputFormat;
import org.stationbeam.exceptions.InvalidArgumentException;
import org.stationbeam.exceptions.StationBeamException;
import org.stationbeam.formatters.ChannelPowerWriter;
import org.stationbeam.formatters.JonesGridFormatter;
import org.stationbeam.generators.TrackingJonesGridGenerator;
import org.stationbeam.geometry.PointingCalculator;
import org.stationbeam.loaders.TelescopeCatalog;
import org.stationbeam.resolvers.FrequencySelector;
import org.stationbeam.resolvers.StationGeometryResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Slf4j
@Command(name = "pointing-jones",
        mixinStandardHelpOptions = true,
        description = "Prints the Jones matrices of a station tracking a celestial direction, "
                + "e.g. pointing-jones print LOFAR LBA SE607 Hamaker 2012-04-01T01:02:03 60 1 6.11 1.02 60E6")
public class PointingJonesCommand implements Callable<Integer> {
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_FAILURE = 1;
    public static final String USAGE = "Usage:\n  pointing-jones print|plot telescope band stnID beammodel beginUTC "
            + "duration timeStep pointingRA pointingDEC [frequency]";

    @Option(names = "--frmt", description = "Output format: csv, pac.")
    private String format;

    @Option(names = "--pararot", negatable = true, defaultValue = "true",
            description = "Apply the parallactic rotation (default), or not with --no-pararot.")
    private boolean parallacticRotation;

    @Option(names = "--data-root", description = "Directory holding the telescope reference data.")
    private Path dataRoot;

    @Parameters(arity = "0..*", paramLabel = "ARG", description = "action telescope band stnID beammodel "
            + "beginUTC duration timeStep pointingRA pointingDEC [frequency]")
    private List<String> arguments = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    private final Config config;
    private final BeamModelRegistry beamModels;

    public PointingJonesCommand(Config config) {
        this(config, BeamModelRegistry.defaultRegistry());
    }

    public PointingJonesCommand(Config config, BeamModelRegistry beamModels) {
        this.config = config;
        this.beamModels = beamModels;
    }

    @Override
    public Integer call() {
        final var out = spec.commandLine().getOut();
        final var err = spec.commandLine().getErr();
        final var telescopesPath = dataRoot != null ? dataRoot : config.getTelescopesPath();
        final var resolver = new StationGeometryResolver(telescopesPath);

        final PointingJob job;
        final OutputFormat outputFormat;
        try {
            outputFormat = format == null ? config.getOutputFormat() : OutputFormat.of(format);
            job = parse(resolver);
        } catch (InvalidArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            err.flush();
            return EXIT_USAGE;
        }

        log.info("Running {} with data from {}", job, telescopesPath.toAbsolutePath());
        try {
            run(job, outputFormat, resolver, new TelescopeCatalog(telescopesPath), out);
            return 0;
        } catch (StationBeamException e) {
            log.error("{} failed: {}", job.getAction(), e.getMessage(), e);
            err.println(e.getKind() + ": " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    private void run(PointingJob job, OutputFormat outputFormat, StationGeometryResolver resolver,
                     TelescopeCatalog catalog, PrintWriter out) {
        final var generator = new TrackingJonesGridGenerator(resolver, catalog, beamModels, new PointingCalculator());
        final JonesResult result = generator.generate(job.getRequest());
        final var selector = new FrequencySelector(config.getFrequencyTolerance());
        final var grid = result.getGrid();

        if (job.getAction() == Action.PLOT) {
            result.getDiagnostics().forEach(d -> log.info("{} pa={} az={} el={}",
                    d.getTime(), d.getParallacticAngle(), d.getAzimuth(), d.getElevation()));
            final var writer = new ChannelPowerWriter(selector);
            if (job.getFrequency() == null) {
                writer.writeAll(grid, out);
            } else {
                writer.writeAtFrequency(grid, job.getFrequency(), out);
            }
            return;
        }

        final var formatter = new JonesGridFormatter(selector);
        if (job.getFrequency() == null) {
            formatter.writeAll(grid, outputFormat, out);
        } else {
            formatter.writeAtFrequency(grid, job.getFrequency(), outputFormat, out);
        }
    }

    PointingJob parse(StationGeometryResolver resolver) {
        final var args = new ArrayList<>(arguments);

        final var action = Action.of(pop(args, () -> "Specify output-type:\n  'print' or 'plot'"));
        final var telescope = pop(args, () -> "Specify telescope:\n  " + listOrEmpty(resolver::listTelescopes));
        final var band = pop(args, () -> "Specify band/feed:\n  " + listOrEmpty(() -> resolver.listBands(telescope)));
        final var station = pop(args, () -> "Specify station-ID:\n  "
                + listOrEmpty(() -> resolver.listStations(telescope, band)));
        final var beamModel = pop(args, () -> "Specify beam-model:\n  " + String.join(", ", beamModels.getNames()));

        final Instant begin;
        try {
            begin = LocalDateTime.parse(pop(args, () -> "Specify start-time (UTC in ISO format: yyyy-mm-ddTHH:MM:SS )"),
                    config.getTimeFormatter()).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Wrong start-time format (yyyy-mm-ddTHH:MM:SS).", e);
        }
        final var duration = seconds(popNumber(args, "Specify duration (in seconds)."));
        final var step = seconds(popNumber(args, "Specify step-time (in seconds)."));
        if (duration.isNegative()) {
            throw new InvalidArgumentException("Duration must not be negative.");
        }
        if (step.isZero() || step.isNegative()) {
            throw new InvalidArgumentException("Step-time must be positive.");
        }
        final var pointingMessage = "Specify pointing direction (in radians): RA DEC";
        final var ra = popNumber(args, pointingMessage);
        final var dec = popNumber(args, pointingMessage);
        final Double frequency = args.isEmpty() ? null : popNumber(args, "Specify frequency (in Hz).");
        if (!args.isEmpty()) {
            throw new InvalidArgumentException("Unexpected arguments: " + String.join(" ", args));
        }

        final var request = ObservationRequest.builder()
                .telescope(telescope)
                .station(station)
                .band(band)
                .beamModel(beamModel)
                .begin(begin)
                .duration(duration)
                .step(step)
                .direction(new CelestialDirection(ra, dec, config.getReferenceFrame()))
                .parallacticRotation(parallacticRotation)
                .build();
        return new PointingJob(action, request, frequency);
    }

    private static String pop(List<String> args, Supplier<String> missingMessage) {
        if (args.isEmpty()) {
            throw new InvalidArgumentException(missingMessage.get());
        }
        return args.remove(0);
    }

    private static double popNumber(List<String> args, String message) {
        final var token = pop(args, () -> message);
        try {
            final var value = Double.parseDouble(token);
            if (!Double.isFinite(value)) {
                throw new InvalidArgumentException(message + " Got '" + token + "'.");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(message + " Got '" + token + "'.", e);
        }
    }

    private static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1e9));
    }

    // Listings only decorate the usage prompt, an unreadable data root leaves them empty.
    private static String listOrEmpty(Supplier<List<String>> listing) {
        try {
            return String.join(", ", listing.get());
        } catch (StationBeamException e) {
            log.debug("No listing available: {}", e.getMessage());
            return "";
        }
    }
}
