package org.stationbeam.formatters;

import lombok.RequiredArgsConstructor;
import org.stationbeam.data.JonesGrid;
import org.stationbeam.generators.JonesMath;
import org.stationbeam.resolvers.FrequencySelector;

import java.io.PrintWriter;

/**
 * Data behind the p/q channel plots: power of each dipole channel over time,
 * for all channels or for the one serving a pinned frequency.
 */
@RequiredArgsConstructor
public class ChannelPowerWriter {
    public static final String HEADER = "Time, Freq, P, Q";

    private final FrequencySelector frequencySelector;

    public void writeAll(JonesGrid grid, PrintWriter out) {
        out.println(HEADER);
        for (int ti = 0; ti < grid.timeCount(); ti++) {
            for (int fi = 0; fi < grid.frequencyCount(); fi++) {
                writeRow(grid, ti, fi, grid.getFrequency(fi), out);
            }
        }
        out.flush();
    }

    public void writeAtFrequency(JonesGrid grid, double requestedFrequency, PrintWriter out) {
        final var channel = frequencySelector.select(grid.getFreqs(), requestedFrequency);
        out.println(HEADER);
        for (int ti = 0; ti < grid.timeCount(); ti++) {
            writeRow(grid, ti, channel, requestedFrequency, out);
        }
        out.flush();
    }

    private static void writeRow(JonesGrid grid, int ti, int fi, double frequency, PrintWriter out) {
        final var powers = JonesMath.channelPowers(grid.get(fi, ti));
        out.println(String.join(",",
                Tokens.isoTime(grid.getTimes().get(ti)),
                Tokens.frequency(frequency),
                Double.toString(powers[0]),
                Double.toString(powers[1])));
    }
}
