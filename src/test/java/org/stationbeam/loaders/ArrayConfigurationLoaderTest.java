package org.stationbeam.loaders;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stationbeam.TestTelescopes;
import org.stationbeam.exceptions.ErrorKind;
import org.stationbeam.exceptions.MalformedReferenceDataException;
import org.stationbeam.exceptions.ReferenceDataNotFoundException;
import org.stationbeam.exceptions.StationBeamException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ArrayConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsRowsInFileOrder() {
        final var configuration = ArrayConfigurationLoader.load(TestTelescopes.root(), "LOFAR", "HBA");

        assertThat(configuration.getStationNames()).containsExactly("CS002", "CS003", "RS106", "DE601", "SE607");
        assertThat(configuration.size()).isEqualTo(5);

        final var se607 = configuration.getRecord(configuration.indexOf("SE607"));
        assertThat(se607.getPosition().getX()).isCloseTo(3370287.366, within(1e-6));
        assertThat(se607.getPosition().getY()).isCloseTo(712053.586, within(1e-6));
        assertThat(se607.getPosition().getZ()).isCloseTo(5349991.228, within(1e-6));
        assertThat(se607.getDiameter()).isEqualTo(56.5);
    }

    @Test
    void missingFileIsNotFound() {
        assertThatThrownBy(() -> ArrayConfigurationLoader.load(TestTelescopes.root(), "LOFAR", "XBA"))
                .isInstanceOfSatisfying(ReferenceDataNotFoundException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void rowWithMissingFieldIsMalformed() throws IOException {
        TestTelescopes.writeArrayConfiguration(tempDir, "T", "B", "1 2 3 4 AA\n1 2 3 BB\n");

        assertThatThrownBy(() -> ArrayConfigurationLoader.load(tempDir, "T", "B"))
                .isInstanceOfSatisfying(MalformedReferenceDataException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED))
                .hasMessageContaining("row 2");
    }

    @Test
    void nonNumericCoordinateIsMalformed() throws IOException {
        TestTelescopes.writeArrayConfiguration(tempDir, "T", "B", "1 two 3 4 AA\n");

        assertThatThrownBy(() -> ArrayConfigurationLoader.load(tempDir, "T", "B"))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED));
    }

    @Test
    void nonUtf8BytesAreMalformed() throws IOException {
        final var path = TestTelescopes.writeArrayConfiguration(tempDir, "T", "B", "");
        Files.write(path, new byte[]{'1', ' ', '2', ' ', '3', ' ', '4', ' ', 'S', (byte) 0xD6, '1', '\n'});

        assertThatThrownBy(() -> ArrayConfigurationLoader.load(tempDir, "T", "B"))
                .isInstanceOfSatisfying(MalformedReferenceDataException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED));
    }

    @Test
    void longNamesAreTruncatedAndDuplicatesKept() throws IOException {
        TestTelescopes.writeArrayConfiguration(tempDir, "T", "B",
                "1 2 3 4 STATION1\n5 6 7 8 AB\n9 10 11 12 AB\n");

        final var configuration = ArrayConfigurationLoader.load(tempDir, "T", "B");

        assertThat(configuration.getStationNames()).containsExactly("STATI", "AB", "AB");
        assertThat(configuration.indexOf("AB")).isEqualTo(1);
        assertThat(configuration.indexOf("STATION1")).isEqualTo(-1);
    }

    @Test
    void commentsAndBlankLinesAreIgnored() throws IOException {
        TestTelescopes.writeArrayConfiguration(tempDir, "T", "B",
                "# header\n\n1 2 3 4 AA # first\n   \n5 6 7 8 BB\n");

        assertThat(ArrayConfigurationLoader.load(tempDir, "T", "B").getStationNames()).containsExactly("AA", "BB");
    }
}
