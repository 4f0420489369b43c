package org.stationbeam.beam;

import org.stationbeam.exceptions.ReferenceDataNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Beam model variants by identifier.
 */
public class BeamModelRegistry {
    private final Map<String, BeamModel> models = new LinkedHashMap<>();

    public BeamModelRegistry(List<BeamModel> variants) {
        variants.forEach(this::register);
    }

    public static BeamModelRegistry defaultRegistry() {
        return new BeamModelRegistry(List.of(new HamakerBeamModel(), new DipoleBeamModel()));
    }

    public final void register(BeamModel model) {
        models.put(model.getName(), model);
    }

    public BeamModel forName(String name) {
        final var model = models.get(name);
        if (model == null) {
            throw new ReferenceDataNotFoundException("Unknown beam model '" + name + "', known: " + getNames());
        }
        return model;
    }

    public List<String> getNames() {
        return List.copyOf(models.keySet());
    }
}
