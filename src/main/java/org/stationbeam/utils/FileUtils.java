package org.stationbeam.utils;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.exceptions.MalformedReferenceDataException;
import org.stationbeam.exceptions.ReferenceDataNotFoundException;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Locations of the on-disk reference data below a telescopes root:
 * <pre>
 * &lt;telescope&gt;/share/simmos/&lt;telescope&gt;_&lt;band&gt;.cfg
 * &lt;telescope&gt;/share/alignment/&lt;station&gt;_&lt;band&gt;.txt
 * &lt;telescope&gt;/data/teldat_&lt;telescope&gt;_&lt;beamModel&gt;.p
 * </pre>
 */
@Slf4j
@UtilityClass
public class FileUtils {
    private static final String COMMENT_MARKER = "#";

    public static Path arrayConfigurationPath(Path telescopesPath, String telescope, String band) {
        return telescopesPath.resolve(telescope).resolve("share").resolve("simmos")
                .resolve(telescope + "_" + band + ".cfg");
    }

    public static Path alignmentPath(Path telescopesPath, String telescope, String station, String band) {
        return telescopesPath.resolve(telescope).resolve("share").resolve("alignment")
                .resolve(station + "_" + band + ".txt");
    }

    public static Path telescopeModelPath(Path telescopesPath, String telescope, String beamModel) {
        return telescopesPath.resolve(telescope).resolve("data")
                .resolve("teldat_" + telescope + "_" + beamModel + ".p");
    }

    /**
     * @return matching entries of {@code directoryPath} sorted by name, empty if it is not a directory
     */
    public static List<File> getFilteredFilesFromDirectory(Path directoryPath, Predicate<File> filter) {
        final var entries = directoryPath.toFile().listFiles();
        if (entries == null) {
            return List.of();
        }
        return Stream.of(entries)
                .filter(filter)
                .sorted()
                .toList();
    }

    /**
     * Reads a whitespace-delimited text table, dropping blank lines and {@code #} comments.
     *
     * @throws ReferenceDataNotFoundException if the file does not exist
     * @throws MalformedReferenceDataException if the file is not UTF-8 text
     */
    public static List<String> readDataLines(Path path) {
        if (!Files.isRegularFile(path)) {
            log.error("Reference file not found: {}", path.toAbsolutePath());
            throw new ReferenceDataNotFoundException("Reference file not found: " + path.toAbsolutePath());
        }
        try {
            return Files.readAllLines(path).stream()
                    .map(FileUtils::stripComment)
                    .filter(line -> !line.isBlank())
                    .toList();
        } catch (CharacterCodingException e) {
            log.error("Undecodable bytes in {}", path.toAbsolutePath(), e);
            throw new MalformedReferenceDataException("Reference file is not UTF-8 text: " + path.toAbsolutePath(), e);
        } catch (NoSuchFileException e) {
            throw new ReferenceDataNotFoundException("Reference file not found: " + path.toAbsolutePath(), e);
        } catch (IOException e) {
            log.error("Failed to read {}", path.toAbsolutePath(), e);
            throw new UncheckedIOException("Failed to read " + path.toAbsolutePath(), e);
        }
    }

    public static String[] splitFields(String line) {
        return line.trim().split("\\s+");
    }

    private static String stripComment(String line) {
        final var index = line.indexOf(COMMENT_MARKER);
        return index < 0 ? line : line.substring(0, index);
    }
}
