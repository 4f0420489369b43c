package org.stationbeam.cli;

import org.stationbeam.exceptions.InvalidArgumentException;

public enum Action {
    PRINT,
    PLOT;

    public static Action of(String name) {
        return switch (name) {
            case "print" -> PRINT;
            case "plot" -> PLOT;
            default -> throw new InvalidArgumentException("Specify output-type:\n  'print' or 'plot'");
        };
    }
}
