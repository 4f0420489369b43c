package org.stationbeam.data;

import org.stationbeam.exceptions.InvalidArgumentException;

import java.util.Locale;

public enum OutputFormat {
    CSV,
    PAC;

    public static OutputFormat of(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Unknown output format '" + name + "', expected csv or pac", e);
        }
    }
}
