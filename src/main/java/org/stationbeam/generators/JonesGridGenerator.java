package org.stationbeam.generators;

import org.stationbeam.data.JonesResult;
import org.stationbeam.data.ObservationRequest;

/**
 * Produces the Jones matrices of one station tracking a fixed direction.
 * The frequency axis is the channelization of the beam model's band and does
 * not depend on the requested time window. Failures of geometry resolution
 * and of the telescope catalog propagate unchanged.
 */
public interface JonesGridGenerator {
    JonesResult generate(ObservationRequest request);
}
