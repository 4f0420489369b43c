package org.stationbeam.generators;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stationbeam.TestTelescopes;
import org.stationbeam.beam.BeamModelRegistry;
import org.stationbeam.data.CelestialDirection;
import org.stationbeam.data.ObservationRequest;
import org.stationbeam.exceptions.ErrorKind;
import org.stationbeam.exceptions.StationBeamException;
import org.stationbeam.geometry.PointingCalculator;
import org.stationbeam.loaders.TelescopeCatalog;
import org.stationbeam.resolvers.StationGeometryResolver;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Runs the tracking generator against the LOFAR reference data in the test resources.
 */
@Tag("unit")
class TrackingJonesGridGeneratorTest {

    private final TrackingJonesGridGenerator generator = new TrackingJonesGridGenerator(
            new StationGeometryResolver(TestTelescopes.root()),
            new TelescopeCatalog(TestTelescopes.root()),
            BeamModelRegistry.defaultRegistry(),
            new PointingCalculator());

    private static ObservationRequest.ObservationRequestBuilder scenario() {
        return ObservationRequest.builder()
                .telescope("LOFAR")
                .band("HBA")
                .station("SE607")
                .beamModel("Hamaker")
                .begin(TestTelescopes.SCENARIO_BEGIN)
                .duration(Duration.ofSeconds(60))
                .step(Duration.ofSeconds(1))
                .direction(new CelestialDirection(6.11, 1.02, CelestialDirection.J2000));
    }

    @Test
    void scenarioProducesConsistentGrid() {
        final var result = generator.generate(scenario().build());
        final var grid = result.getGrid();

        assertThat(grid.getTimes()).hasSize(61);
        assertThat(grid.getFreqs()).hasSize(16);
        assertThat(grid.shape()).containsExactly(16, 61, 2, 2);
        assertThat(grid.frequencyCount()).isEqualTo(16);
        assertThat(grid.timeCount()).isEqualTo(61);
        assertThat(result.getDiagnostics()).hasSize(61);
        assertThat(grid.get(0, 0)[0][0].abs()).isGreaterThan(0.0);
    }

    @Test
    void frequencyAxisIsTheBandChannelization() {
        final var shortWindow = generator.generate(scenario().duration(Duration.ZERO).build()).getGrid();
        final var longWindow = generator.generate(scenario().duration(Duration.ofMinutes(10)).step(Duration.ofSeconds(30)).build()).getGrid();

        assertThat(shortWindow.getFreqs()).containsExactly(longWindow.getFreqs());
        assertThat(shortWindow.getFreqs()[0]).isEqualTo(110e6);
        assertThat(shortWindow.getTimes()).hasSize(1);
        assertThat(longWindow.getTimes()).hasSize(21);
    }

    @Test
    void parallacticRotationIsAppliedOnTheRight() {
        final var request = scenario().beamModel("Dipole").duration(Duration.ofSeconds(2)).build();
        final var unrotated = generator.generate(scenario().beamModel("Dipole").duration(Duration.ofSeconds(2))
                .parallacticRotation(false).build());
        final var rotated = generator.generate(request);

        for (int ti = 0; ti < rotated.getGrid().timeCount(); ti++) {
            final var angle = rotated.getDiagnostics().get(ti).getParallacticAngle();
            final var expected = JonesMath.rotate(unrotated.getGrid().get(0, ti), angle);
            final var actual = rotated.getGrid().get(0, ti);
            for (int row = 0; row < 2; row++) {
                for (int col = 0; col < 2; col++) {
                    assertThat(actual[row][col].getReal()).isCloseTo(expected[row][col].getReal(), within(1e-12));
                    assertThat(actual[row][col].getImaginary()).isCloseTo(expected[row][col].getImaginary(), within(1e-12));
                }
            }
        }
    }

    @Test
    void beginBeforeModelEpochIsRejected() {
        final var request = scenario().begin(Instant.parse("2005-06-01T00:00:00Z")).build();

        assertThatThrownBy(() -> generator.generate(request))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.EPOCH_UNAVAILABLE));
    }

    @Test
    void unknownBeamModelIsNotFound() {
        assertThatThrownBy(() -> generator.generate(scenario().beamModel("Spherical").build()))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void geometryFailuresPropagateUnchanged() {
        assertThatThrownBy(() -> generator.generate(scenario().station("UK608").build()))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                .hasMessageContaining("UK608");
        assertThatThrownBy(() -> generator.generate(scenario().band("XBA").build()))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void nonRotationAlignmentIsACoordinateFailure() {
        assertThatThrownBy(() -> generator.generate(scenario().station("RS106").build()))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.COORDINATE_TRANSFORM));
    }

    @Test
    void invalidStepIsRejected() {
        assertThatThrownBy(() -> generator.generate(scenario().step(Duration.ZERO).build()))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));
    }
}
