package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

@Getter
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class JonesResult {
    private final JonesGrid grid;
    private final List<PointingDiagnostic> diagnostics;
}
