package org.stationbeam.loaders;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stationbeam.data.TelescopeModel;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CachingTelescopeCatalogTest {

    private final List<String> requests = new ArrayList<>();
    private final TelescopeModelProvider counting = (telescope, beamModel) -> {
        requests.add(telescope + "/" + beamModel);
        final var model = new TelescopeModel();
        model.setTelescope(telescope);
        model.setBeamModel(beamModel);
        return model;
    };

    @Test
    void repeatedRequestsAreServedFromCache() {
        final var cache = new CachingTelescopeCatalog(counting);

        final var first = cache.getTelescopeModel("LOFAR", "Hamaker");
        final var second = cache.getTelescopeModel("LOFAR", "Hamaker");

        assertThat(second).isSameAs(first);
        assertThat(requests).containsExactly("LOFAR/Hamaker");
    }

    @Test
    void keyIncludesBeamModel() {
        final var cache = new CachingTelescopeCatalog(counting);

        cache.getTelescopeModel("LOFAR", "Hamaker");
        cache.getTelescopeModel("LOFAR", "Dipole");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(requests).containsExactly("LOFAR/Hamaker", "LOFAR/Dipole");
    }

    @Test
    void evictForcesReload() {
        final var cache = new CachingTelescopeCatalog(counting);

        final var first = cache.getTelescopeModel("LOFAR", "Hamaker");
        cache.evict("LOFAR", "Hamaker");
        final var second = cache.getTelescopeModel("LOFAR", "Hamaker");

        assertThat(second).isNotSameAs(first);
        assertThat(requests).hasSize(2);

        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
