package org.stationbeam.formatters;

import lombok.experimental.UtilityClass;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexFormat;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Text renderings of the values in an output row.
 */
@UtilityClass
public class Tokens {
    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double MJD_OF_UNIX_EPOCH = 40587.0;
    private static final int FRACTION_DIGITS = 17;

    private static final ComplexFormat COMPLEX_FORMAT = new ComplexFormat(numberFormat());

    /**
     * Naive ISO-8601 UTC timestamp, e.g. {@code 2012-04-01T01:02:03}.
     */
    public static String isoTime(Instant time) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.ofInstant(time, ZoneOffset.UTC));
    }

    public static double modifiedJulianDate(Instant time) {
        return time.getEpochSecond() / SECONDS_PER_DAY + time.getNano() / (SECONDS_PER_DAY * 1e9) + MJD_OF_UNIX_EPOCH;
    }

    /**
     * Plain decimal without exponent or trailing zeros, e.g. {@code 60000000}.
     */
    public static String frequency(double hertz) {
        return BigDecimal.valueOf(hertz).stripTrailingZeros().toPlainString();
    }

    /**
     * Single token {@code <re> + <im>i}; never contains a comma.
     */
    public static String complex(Complex value) {
        synchronized (COMPLEX_FORMAT) {
            return COMPLEX_FORMAT.format(value);
        }
    }

    public static Complex parseComplex(String token) {
        synchronized (COMPLEX_FORMAT) {
            return COMPLEX_FORMAT.parse(token.trim());
        }
    }

    /**
     * Two tokens {@code <re> <im>}.
     */
    public static String complexPair(Complex value) {
        return value.getReal() + " " + value.getImaginary();
    }

    private static NumberFormat numberFormat() {
        final var format = NumberFormat.getInstance(Locale.ROOT);
        format.setGroupingUsed(false);
        format.setMinimumFractionDigits(1);
        format.setMaximumFractionDigits(FRACTION_DIGITS);
        return format;
    }
}
