package org.stationbeam.resolvers;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.stationbeam.exceptions.FrequencyRangeException;
import org.stationbeam.exceptions.NoMatchingChannelException;

/**
 * Picks the channel that serves a requested frequency.
 */
@Getter
@RequiredArgsConstructor
public class FrequencySelector {
    public static final double DEFAULT_TOLERANCE = 190e3;

    private final double tolerance;

    public FrequencySelector() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * Returns the lowest channel index whose frequency lies within the absolute
     * tolerance of {@code requested}. This is the nearest channel whenever the channel
     * spacing exceeds twice the tolerance; with a denser channelization an earlier,
     * farther channel inside the tolerance wins. Requests outside
     * {@code [freqs[0], freqs[last]]} are rejected before any distance is computed.
     *
     * @param freqs ascending channel frequencies in Hz
     * @throws FrequencyRangeException    if the request lies outside the band
     * @throws NoMatchingChannelException if no channel is close enough
     */
    public int select(double[] freqs, double requested) {
        if (freqs.length == 0 || Double.isNaN(requested) || requested < freqs[0] || requested > freqs[freqs.length - 1]) {
            throw new FrequencyRangeException("Requested frequency " + requested + " Hz outside of band "
                    + (freqs.length == 0 ? "(no channels)" : "[" + freqs[0] + ", " + freqs[freqs.length - 1] + "] Hz"));
        }
        for (int i = 0; i < freqs.length; i++) {
            if (Math.abs(freqs[i] - requested) <= tolerance) {
                return i;
            }
        }
        throw new NoMatchingChannelException("No channel within " + tolerance + " Hz of " + requested + " Hz");
    }
}
