package org.stationbeam.data;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

@Getter
@AllArgsConstructor
@ToString
@SuppressWarnings("ClassCanBeRecord")
public class Config {
    public static final String CONFIG_FILE_NAME = "application.properties";
    public static final String TELESCOPES_PATH = "telescopesPath";
    public static final String FREQUENCY_TOLERANCE = "frequencyTolerance";
    public static final String OUTPUT_FORMAT = "outputFormat";
    public static final String REFERENCE_FRAME = "referenceFrame";
    public static final String TIME_PATTERN = "timePattern";

    private final Path telescopesPath;
    private final double frequencyTolerance;
    private final OutputFormat outputFormat;
    private final String referenceFrame;
    private final DateTimeFormatter timeFormatter;
}
