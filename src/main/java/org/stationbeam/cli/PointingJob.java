package org.stationbeam.cli;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.stationbeam.data.ObservationRequest;

/**
 * A fully parsed command line.
 */
@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class PointingJob {
    private final Action action;
    private final ObservationRequest request;
    /** Pinned frequency in Hz, null for the full grid. */
    private final Double frequency;
}
