package org.stationbeam.generators;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.stationbeam.beam.BeamModelRegistry;
import org.stationbeam.data.JonesGrid;
import org.stationbeam.data.JonesResult;
import org.stationbeam.data.ObservationRequest;
import org.stationbeam.data.PointingDiagnostic;
import org.stationbeam.exceptions.EpochUnavailableException;
import org.stationbeam.exceptions.ReferenceDataNotFoundException;
import org.stationbeam.geometry.PointingCalculator;
import org.stationbeam.loaders.TelescopeModelProvider;
import org.stationbeam.resolvers.StationGeometryResolver;

import java.util.ArrayList;

/**
 * Station on the pointing axis of a tracked source: for every time sample the
 * source direction is converted to the station frame and the beam model is
 * evaluated at every channel of the band.
 */
@Slf4j
@RequiredArgsConstructor
public class TrackingJonesGridGenerator implements JonesGridGenerator {
    private final StationGeometryResolver geometryResolver;
    private final TelescopeModelProvider telescopeModels;
    private final BeamModelRegistry beamModels;
    private final PointingCalculator pointingCalculator;

    @Override
    public JonesResult generate(ObservationRequest request) {
        final var beamModel = beamModels.forName(request.getBeamModel());
        final var geometry = geometryResolver.resolveStationGeometry(
                request.getTelescope(), request.getStation(), request.getBand());
        final var telescopeModel = telescopeModels.getTelescopeModel(request.getTelescope(), request.getBeamModel());

        final var band = telescopeModel.getBand(request.getBand());
        if (band == null) {
            throw new ReferenceDataNotFoundException("Telescope model " + request.getTelescope() + "/"
                    + request.getBeamModel() + " has no band " + request.getBand());
        }
        final var epoch = telescopeModel.getEpochInstant();
        if (request.getBegin().isBefore(epoch)) {
            throw new EpochUnavailableException("Begin time " + request.getBegin() + " precedes the "
                    + request.getTelescope() + " model epoch " + epoch);
        }

        final var times = TimeAxis.of(request.getBegin(), request.getDuration(), request.getStep());
        final var freqs = band.frequencies();
        final var tensor = new Complex[freqs.length][times.size()][][];
        final var diagnostics = new ArrayList<PointingDiagnostic>(times.size());

        for (int ti = 0; ti < times.size(); ti++) {
            final var pointing = pointingCalculator.compute(geometry, times.get(ti), request.getDirection());
            diagnostics.add(pointing.toDiagnostic());
            for (int fi = 0; fi < freqs.length; fi++) {
                final var jones = beamModel.response(band, pointing.getTheta(), pointing.getPhi(), freqs[fi]);
                tensor[fi][ti] = request.isParallacticRotation()
                        ? JonesMath.rotate(jones, pointing.getParallacticAngle())
                        : jones;
            }
        }

        log.debug("Generated {} x {} Jones grid for {} {} {}", freqs.length, times.size(),
                request.getTelescope(), request.getStation(), request.getBand());
        return new JonesResult(new JonesGrid(times, freqs, tensor), diagnostics);
    }
}
