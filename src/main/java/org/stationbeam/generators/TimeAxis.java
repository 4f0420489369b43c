package org.stationbeam.generators;

import lombok.experimental.UtilityClass;
import org.stationbeam.exceptions.InvalidArgumentException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class TimeAxis {
    static final int MAX_SAMPLES = Integer.MAX_VALUE - 8;

    /**
     * Samples {@code begin + k * step} for {@code k = 0 .. floor(duration / step)}, so both
     * ends are included when the duration is a whole number of steps.
     */
    public static List<Instant> of(Instant begin, Duration duration, Duration step) {
        if (step == null || step.isZero() || step.isNegative()) {
            throw new InvalidArgumentException("Time step must be positive, got " + step);
        }
        if (duration == null || duration.isNegative()) {
            throw new InvalidArgumentException("Duration must not be negative, got " + duration);
        }
        final var steps = duration.dividedBy(step);
        if (steps >= MAX_SAMPLES) {
            throw new InvalidArgumentException("Duration " + duration + " at step " + step + " gives "
                    + steps + " steps, at most " + (MAX_SAMPLES - 1) + " are supported");
        }
        final var count = (int) steps + 1;
        final var result = new ArrayList<Instant>(count);
        for (int k = 0; k < count; k++) {
            result.add(begin.plus(step.multipliedBy(k)));
        }
        return result;
    }
}
