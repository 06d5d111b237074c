package io.github.depot2git.config;

import io.github.depot2git.UnrecognizedInputException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** How the processing stage turns retrieved histories into branches. {@code skip} does no processing. */
public enum MergeStrategy {
    NORMAL("normal"),
    ORPHANAGE("orphanage"),
    SKIP("skip");

    private final String configName;

    MergeStrategy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static MergeStrategy fromConfigName(String value) throws UnrecognizedInputException {
        for (var candidate : values()) {
            if (candidate.configName.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new UnrecognizedInputException("Unknown merge strategy '" + value + "', expected one of "
                + Arrays.stream(values()).map(MergeStrategy::configName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
