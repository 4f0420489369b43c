package org.stationbeam.resolvers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.data.StationGeometry;
import org.stationbeam.exceptions.InvalidArgumentException;
import org.stationbeam.exceptions.ReferenceDataNotFoundException;
import org.stationbeam.loaders.AlignmentLoader;
import org.stationbeam.loaders.ArrayConfigurationLoader;
import org.stationbeam.utils.FileUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

/**
 * Joins array configuration and alignment data into a station's geometry.
 * Both sources are read on every call.
 */
@Slf4j
@RequiredArgsConstructor
public class StationGeometryResolver {
    private final Path telescopesPath;

    public StationGeometry resolveStationGeometry(String telescope, String station, String band) {
        requireBand(band);
        final var configuration = ArrayConfigurationLoader.load(telescopesPath, telescope, band);
        final var index = configuration.indexOf(station);
        if (index < 0) {
            log.error("Station {} not listed for {} {}", station, telescope, band);
            throw new ReferenceDataNotFoundException("Station " + station + " not found in " + telescope + " " + band
                    + " array configuration");
        }
        final var position = configuration.getRecord(index).getPosition();
        final var rotation = AlignmentLoader.load(telescopesPath, telescope, station, band);

        log.debug("Resolved {} {} {} at {}", telescope, station, band, position);
        return new StationGeometry(station, position, rotation);
    }

    /**
     * @return every station name of the band's configuration in file order, duplicates included
     */
    public List<String> listStations(String telescope, String band) {
        requireBand(band);
        return ArrayConfigurationLoader.load(telescopesPath, telescope, band).getStationNames();
    }

    /**
     * @return telescopes that have a directory below the telescopes root
     */
    public List<String> listTelescopes() {
        return FileUtils.getFilteredFilesFromDirectory(telescopesPath, File::isDirectory).stream()
                .map(File::getName)
                .toList();
    }

    /**
     * @return bands that have an array configuration file for {@code telescope}
     */
    public List<String> listBands(String telescope) {
        final var prefix = telescope + "_";
        final var suffix = ".cfg";
        final var folder = FileUtils.arrayConfigurationPath(telescopesPath, telescope, "").getParent();
        return FileUtils.getFilteredFilesFromDirectory(folder,
                        file -> file.isFile() && file.getName().startsWith(prefix) && file.getName().endsWith(suffix))
                .stream()
                .map(file -> file.getName().substring(prefix.length(), file.getName().length() - suffix.length()))
                .filter(band -> !band.isEmpty())
                .toList();
    }

    private static void requireBand(String band) {
        if (band == null || band.isBlank()) {
            throw new InvalidArgumentException("A concrete band is required");
        }
    }
}
