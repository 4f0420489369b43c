package org.stationbeam;

import lombok.extern.slf4j.Slf4j;
import org.stationbeam.cli.PointingJonesCommand;
import org.stationbeam.loaders.ConfigLoader;
import picocli.CommandLine;

@Slf4j
public class Main {
    public static void main(String[] args) {
        final var config = ConfigLoader.loadConfig();
        log.info("Config: {}", config);

        final var exitCode = new CommandLine(new PointingJonesCommand(config)).execute(args);
        System.exit(exitCode);
    }
}
