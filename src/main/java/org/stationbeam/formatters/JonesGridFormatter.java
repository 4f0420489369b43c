package org.stationbeam.formatters;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.stationbeam.data.JonesGrid;
import org.stationbeam.data.OutputFormat;
import org.stationbeam.resolvers.FrequencySelector;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a Jones grid either in full or at one pinned frequency.
 * <p>
 * csv: header line, comma delimited, ISO time, one token per complex entry.<br>
 * pac: no header, space delimited, MJD time, {@code re im} per complex entry.
 */
@Slf4j
@RequiredArgsConstructor
public class JonesGridFormatter {
    public static final String FULL_GRID_HEADER = "Time, Freq, J00, J01, J10, J11";
    public static final String PINNED_FREQUENCY_HEADER = "Time, Freq, J11, J12, J21, J22";

    private final FrequencySelector frequencySelector;

    /**
     * One row per (time, frequency), time outer.
     */
    public void writeAll(JonesGrid grid, OutputFormat format, PrintWriter out) {
        if (format == OutputFormat.CSV) {
            out.println(FULL_GRID_HEADER);
        }
        for (int ti = 0; ti < grid.timeCount(); ti++) {
            for (int fi = 0; fi < grid.frequencyCount(); fi++) {
                out.println(row(format, grid.getTimes().get(ti), grid.getFrequency(fi), grid.get(fi, ti)));
            }
        }
        out.flush();
    }

    /**
     * One row per time at the channel serving {@code requestedFrequency}; the
     * requested value, not the channel centre, is printed as frequency.
     */
    public void writeAtFrequency(JonesGrid grid, double requestedFrequency, OutputFormat format, PrintWriter out) {
        final var channel = frequencySelector.select(grid.getFreqs(), requestedFrequency);
        log.debug("Requested {} Hz served by channel {} at {} Hz", requestedFrequency, channel, grid.getFrequency(channel));

        if (format == OutputFormat.CSV) {
            out.println(PINNED_FREQUENCY_HEADER);
        }
        for (int ti = 0; ti < grid.timeCount(); ti++) {
            out.println(row(format, grid.getTimes().get(ti), requestedFrequency, grid.get(channel, ti)));
        }
        out.flush();
    }

    String row(OutputFormat format, Instant time, double frequency, Complex[][] jones) {
        final var tokens = new ArrayList<String>(6);
        if (format == OutputFormat.CSV) {
            tokens.add(Tokens.isoTime(time));
            tokens.add(Tokens.frequency(frequency));
            addEntries(tokens, jones, false);
            return String.join(",", tokens);
        }
        tokens.add(Double.toString(Tokens.modifiedJulianDate(time)));
        tokens.add(Tokens.frequency(frequency));
        addEntries(tokens, jones, true);
        return String.join(" ", tokens);
    }

    private static void addEntries(List<String> tokens, Complex[][] jones, boolean pairs) {
        for (final var matrixRow : jones) {
            for (final var entry : matrixRow) {
                tokens.add(pairs ? Tokens.complexPair(entry) : Tokens.complex(entry));
            }
        }
    }
}
