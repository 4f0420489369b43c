package org.stationbeam.loaders;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stationbeam.data.TelescopeModel;
import org.stationbeam.exceptions.ReferenceDataNotFoundException;
import org.stationbeam.exceptions.TelescopeModelDeserializeException;
import org.stationbeam.utils.FileUtils;

import java.io.CharConversionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps (telescope, beam model) to the stored telescope model. Every call
 * re-reads the file; wrap in {@link CachingTelescopeCatalog} to amortize.
 */
@Slf4j
@RequiredArgsConstructor
public class TelescopeCatalog implements TelescopeModelProvider {
    private static final String ERROR_TEXT = "Failed to deserialize telescope model ";

    private final Path telescopesPath;
    private final ObjectMapper objectMapper;

    public TelescopeCatalog(Path telescopesPath) {
        this(telescopesPath, new ObjectMapper());
    }

    public Path modelPath(String telescope, String beamModel) {
        return FileUtils.telescopeModelPath(telescopesPath, telescope, beamModel);
    }

    @Override
    public TelescopeModel getTelescopeModel(String telescope, String beamModel) {
        final var path = modelPath(telescope, beamModel);
        if (!Files.isRegularFile(path)) {
            log.error("Telescope model not found: {}", path.toAbsolutePath());
            throw new ReferenceDataNotFoundException("No telescope model for " + telescope + "/" + beamModel
                    + " at " + path.toAbsolutePath());
        }

        final TelescopeModel model;
        try (final var input = Files.newInputStream(path)) {
            model = objectMapper.readValue(input, TelescopeModel.class);
        } catch (JsonProcessingException | CharConversionException e) {
            log.error(ERROR_TEXT + path, e);
            throw new TelescopeModelDeserializeException(ERROR_TEXT + path, e);
        } catch (IOException e) {
            log.error("Failed to read {}", path, e);
            throw new UncheckedIOException("Failed to read " + path, e);
        }

        checkCompatible(model, path);
        log.debug("Loaded telescope model {}/{} with bands {}", telescope, beamModel, model.getBands().keySet());
        return model;
    }

    private static void checkCompatible(TelescopeModel model, Path path) {
        if (model == null || model.getBands() == null || model.getBands().isEmpty()) {
            throw new TelescopeModelDeserializeException(ERROR_TEXT + path + ": no bands defined");
        }
        for (final var entry : model.getBands().entrySet()) {
            final var band = entry.getValue();
            if (band == null || band.getChannelization() == null || band.getChannelization().getCount() <= 0) {
                throw new TelescopeModelDeserializeException(ERROR_TEXT + path + ": band " + entry.getKey()
                        + " has no channelization");
            }
        }
        try {
            model.getEpochInstant();
        } catch (RuntimeException e) {
            throw new TelescopeModelDeserializeException(ERROR_TEXT + path + ": bad epoch '" + model.getEpoch() + "'", e);
        }
    }
}
