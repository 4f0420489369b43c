package org.stationbeam.beam;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stationbeam.exceptions.ErrorKind;
import org.stationbeam.exceptions.StationBeamException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BeamModelRegistryTest {

    @Test
    void defaultRegistryKnowsBothVariants() {
        final var registry = BeamModelRegistry.defaultRegistry();

        assertThat(registry.getNames()).containsExactly("Hamaker", "Dipole");
        assertThat(registry.forName("Hamaker")).isInstanceOf(HamakerBeamModel.class);
        assertThat(registry.forName("Dipole")).isInstanceOf(DipoleBeamModel.class);
    }

    @Test
    void unknownIdentifierIsNotFound() {
        assertThatThrownBy(() -> BeamModelRegistry.defaultRegistry().forName("hamaker"))
                .isInstanceOfSatisfying(StationBeamException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                .hasMessageContaining("Hamaker");
    }
}
