package org.stationbeam.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

@Getter
@Builder
@ToString
public class ObservationRequest {
    private final String telescope;
    private final String station;
    private final String band;
    private final String beamModel;
    private final Instant begin;
    private final Duration duration;
    private final Duration step;
    private final CelestialDirection direction;
    @Builder.Default
    private final boolean parallacticRotation = true;
}
