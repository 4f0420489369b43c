package org.stationbeam.data;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deserialized content of a {@code teldat_<telescope>_<beamModel>.p} file.
 */
@Getter
@Setter
@NoArgsConstructor
public class TelescopeModel {
    private String telescope;
    private String beamModel;
    /** Earliest UTC instant the model is valid for, ISO-8601. */
    private String epoch;
    private Map<String, BandModel> bands = new LinkedHashMap<>();

    @JsonIgnore
    public Instant getEpochInstant() {
        return epoch == null ? Instant.MIN : Instant.parse(epoch);
    }

    @JsonIgnore
    public BandModel getBand(String band) {
        return bands.get(band);
    }
}
