package org.stationbeam.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.data.AlignmentMatrix;
import org.stationbeam.exceptions.MalformedReferenceDataException;
import org.stationbeam.utils.FileUtils;

import java.nio.file.Path;

/**
 * Reads station alignment matrices. The matrix shape comes from the file; rows
 * only have to agree in length.
 */
@Slf4j
@UtilityClass
public class AlignmentLoader {
    private static final String ERROR_TEXT = "Failed to parse alignment matrix ";

    public static AlignmentMatrix load(Path telescopesPath, String telescope, String station, String band) {
        final var path = FileUtils.alignmentPath(telescopesPath, telescope, station, band);
        final var lines = FileUtils.readDataLines(path);
        if (lines.isEmpty()) {
            log.error(ERROR_TEXT + "{}: no data", path);
            throw new MalformedReferenceDataException(ERROR_TEXT + path + ": no data");
        }

        final var values = new double[lines.size()][];
        for (int row = 0; row < lines.size(); row++) {
            final var fields = FileUtils.splitFields(lines.get(row));
            if (row > 0 && fields.length != values[0].length) {
                log.error(ERROR_TEXT + "{}: row {} has {} columns, expected {}", path, row + 1, fields.length, values[0].length);
                throw new MalformedReferenceDataException(ERROR_TEXT + path + ": ragged row " + (row + 1));
            }
            values[row] = new double[fields.length];
            for (int column = 0; column < fields.length; column++) {
                try {
                    values[row][column] = Double.parseDouble(fields[column]);
                } catch (NumberFormatException e) {
                    log.error(ERROR_TEXT + path, e);
                    throw new MalformedReferenceDataException(ERROR_TEXT + path + ": '" + fields[column] + "' is not numeric", e);
                }
            }
        }

        log.debug("Loaded {}x{} alignment matrix from {}", values.length, values[0].length, path);
        return AlignmentMatrix.of(telescope, station, band, values);
    }
}
