package org.stationbeam.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.data.ArrayConfiguration;
import org.stationbeam.exceptions.MalformedReferenceDataException;
import org.stationbeam.utils.FileUtils;

import java.nio.file.Path;

/**
 * Parses CASA-style array configuration files: one {@code X Y Z Diam Name} row per station.
 */
@Slf4j
@UtilityClass
public class ArrayConfigurationLoader {
    public static final int MAX_NAME_LENGTH = 5;
    private static final int FIELD_COUNT = 5;
    private static final String ERROR_TEXT = "Failed to parse array configuration ";

    public static ArrayConfiguration load(Path telescopesPath, String telescope, String band) {
        final var path = FileUtils.arrayConfigurationPath(telescopesPath, telescope, band);
        final var lines = FileUtils.readDataLines(path);

        final var x = new double[lines.size()];
        final var y = new double[lines.size()];
        final var z = new double[lines.size()];
        final var diameters = new double[lines.size()];
        final var names = new String[lines.size()];

        var rowCounter = 0;
        for (final var line : lines) {
            final var fields = FileUtils.splitFields(line);
            if (fields.length != FIELD_COUNT) {
                log.error(ERROR_TEXT + "{}: expected {} fields in row {}, got {}", path, FIELD_COUNT, rowCounter + 1, fields.length);
                throw new MalformedReferenceDataException(ERROR_TEXT + path + ": expected " + FIELD_COUNT
                        + " fields in row " + (rowCounter + 1) + ", got " + fields.length);
            }
            try {
                x[rowCounter] = Double.parseDouble(fields[0]);
                y[rowCounter] = Double.parseDouble(fields[1]);
                z[rowCounter] = Double.parseDouble(fields[2]);
                diameters[rowCounter] = Double.parseDouble(fields[3]);
            } catch (NumberFormatException e) {
                log.error(ERROR_TEXT + path, e);
                throw new MalformedReferenceDataException(ERROR_TEXT + path + ": row " + (rowCounter + 1), e);
            }
            names[rowCounter] = truncate(fields[4]);
            rowCounter++;
        }

        log.debug("Loaded {} stations from {}", rowCounter, path);
        return new ArrayConfiguration(telescope, band, x, y, z, diameters, names);
    }

    // Names are fixed-width in the file format, longer ones are cut silently.
    private static String truncate(String name) {
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }
}
