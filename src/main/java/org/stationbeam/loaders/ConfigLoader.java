package org.stationbeam.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.Main;
import org.stationbeam.data.CelestialDirection;
import org.stationbeam.data.Config;
import org.stationbeam.data.OutputFormat;
import org.stationbeam.exceptions.ConfigLoadException;
import org.stationbeam.exceptions.StationBeamException;

import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.Properties;

import static org.stationbeam.data.Config.*;

/**
 * Loads {@code application.properties} from the directory of the running jar,
 * falling back to the copy on the classpath.
 */
@Slf4j
@UtilityClass
public class ConfigLoader {
    private static final String DEFAULT_TELESCOPES_PATH = "telescopes";
    private static final String DEFAULT_FREQUENCY_TOLERANCE = "190000";
    private static final String DEFAULT_TIME_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";

    public static Config loadConfig() {
        final var currentFolder = getCurrentFolder();
        if (currentFolder != null) {
            final var config = loadPropsFromCurrentDirectory(currentFolder);
            if (config != null) return config;
        }

        final var loader = Thread.currentThread().getContextClassLoader();
        final var props = new Properties();
        try (final var resourceStream = loader.getResourceAsStream(CONFIG_FILE_NAME)) {
            if (resourceStream != null) {
                props.load(resourceStream);
            } else {
                log.warn("No {} on the classpath, using defaults.", CONFIG_FILE_NAME);
            }
        } catch (Exception e) {
            log.error("Failed to load config.", e);
            throw new ConfigLoadException("Failed to load config.", e);
        }
        return getConfig(props);
    }

    private static Config loadPropsFromCurrentDirectory(Path currentFolder) {
        final var configPath = currentFolder.resolve(CONFIG_FILE_NAME);
        log.info("Application properties path: {}", configPath);
        if (configPath.toFile().isFile()) {
            final var props = new Properties();
            try (final var propsReader = Files.newBufferedReader(configPath)) {
                props.load(propsReader);
            } catch (Exception ex) {
                log.warn("Failed to read {} from current directory, will try to use inner.", CONFIG_FILE_NAME, ex);
                return null;
            }
            return getConfig(props);
        }
        return null;
    }

    private static Path getCurrentFolder() {
        final var mainClass = Main.class;
        final var classResource = mainClass.getResource(mainClass.getSimpleName() + ".class");
        if (classResource == null) throw new ConfigLoadException("class resource is null");

        final var url = classResource.toString();
        if (url.startsWith("jar:file:")) {
            final var path = url.replaceAll("^jar:(file:.*[.]jar)!/.*", "$1");
            try {
                return Paths.get(new URL(path).toURI()).getParent();
            } catch (Exception e) {
                throw new ConfigLoadException("Invalid Jar File URL String", e);
            }
        }
        return null;
    }

    static Config getConfig(Properties props) {
        final var tolerance = props.getProperty(FREQUENCY_TOLERANCE, DEFAULT_FREQUENCY_TOLERANCE).trim();
        final double frequencyTolerance;
        try {
            frequencyTolerance = Double.parseDouble(tolerance);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(FREQUENCY_TOLERANCE + " is not a number: " + tolerance, e);
        }
        if (frequencyTolerance < 0) {
            throw new ConfigLoadException(FREQUENCY_TOLERANCE + " must not be negative: " + tolerance);
        }

        final OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.of(props.getProperty(OUTPUT_FORMAT, OutputFormat.CSV.name()));
        } catch (StationBeamException e) {
            throw new ConfigLoadException(OUTPUT_FORMAT + ": " + e.getMessage(), e);
        }
        final var timePattern = props.getProperty(TIME_PATTERN, DEFAULT_TIME_PATTERN);
        final DateTimeFormatter timeFormatter;
        try {
            timeFormatter = DateTimeFormatter.ofPattern(timePattern);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(TIME_PATTERN + " is not a valid pattern: " + timePattern, e);
        }

        return new Config(
                Path.of(props.getProperty(TELESCOPES_PATH, DEFAULT_TELESCOPES_PATH).trim()),
                frequencyTolerance,
                outputFormat,
                props.getProperty(REFERENCE_FRAME, CelestialDirection.J2000).trim(),
                timeFormatter);
    }
}
