package org.stationbeam.data;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class JonesGridTest {

    private static final List<Instant> TIMES = List.of(Instant.EPOCH, Instant.EPOCH.plusSeconds(1), Instant.EPOCH.plusSeconds(2));
    private static final double[] FREQS = {1e6, 2e6};

    private static Complex[][][][] tensor(int freqs, int times) {
        final var tensor = new Complex[freqs][times][][];
        for (int fi = 0; fi < freqs; fi++) {
            for (int ti = 0; ti < times; ti++) {
                tensor[fi][ti] = new Complex[][]{{new Complex(fi, ti), Complex.ZERO}, {Complex.ZERO, Complex.ONE}};
            }
        }
        return tensor;
    }

    @Test
    void shapeFollowsAxes() {
        final var grid = new JonesGrid(TIMES, FREQS, tensor(2, 3));

        assertThat(grid.shape()).containsExactly(2, 3, 2, 2);
        assertThat(grid.get(1, 2)[0][0]).isEqualTo(new Complex(1, 2));
    }

    @Test
    void mismatchedTensorIsRejected() {
        assertThatThrownBy(() -> new JonesGrid(TIMES, FREQS, tensor(3, 3))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JonesGrid(TIMES, FREQS, tensor(2, 2))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonSquareJonesMatrixIsRejected() {
        final var tensor = tensor(2, 3);
        tensor[1][1] = new Complex[][]{{Complex.ONE}};

        assertThatThrownBy(() -> new JonesGrid(TIMES, FREQS, tensor)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void callersCannotAlterTheGrid() {
        final var freqs = FREQS.clone();
        final var tensor = tensor(2, 3);
        final var grid = new JonesGrid(TIMES, freqs, tensor);

        freqs[0] = 9e9;
        tensor[0][0][0][0] = Complex.NaN;
        grid.getFreqs()[1] = 0;
        grid.get(1, 2)[0][0] = Complex.INF;

        assertThat(grid.getFreqs()).containsExactly(1e6, 2e6);
        assertThat(grid.getFrequency(1)).isEqualTo(2e6);
        assertThat(grid.get(0, 0)[0][0]).isEqualTo(Complex.ZERO);
        assertThat(grid.get(1, 2)[0][0]).isEqualTo(new Complex(1, 2));
    }
}
