package org.stationbeam.loaders;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.data.TelescopeModel;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-owned cache in front of another provider, keyed by (telescope, beamModel).
 * Entries live until {@link #evict} or {@link #clear} is called.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingTelescopeCatalog implements TelescopeModelProvider {
    private final TelescopeModelProvider delegate;
    private final Map<List<String>, TelescopeModel> cache = new HashMap<>();

    @Override
    public TelescopeModel getTelescopeModel(String telescope, String beamModel) {
        final var key = List.of(telescope, beamModel);
        final var cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        final var model = delegate.getTelescopeModel(telescope, beamModel);
        cache.put(key, model);
        log.debug("Cached telescope model {}/{}", telescope, beamModel);
        return model;
    }

    public void evict(String telescope, String beamModel) {
        cache.remove(List.of(telescope, beamModel));
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }
}
