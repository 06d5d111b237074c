package io.github.depot2git.config;

import io.github.depot2git.UnrecognizedInputException;
import java.util.Arrays;
import java.util.stream.Collectors;

public enum MessageStyle {
    NORMAL("normal"),
    NOTES("notes"),
    CLEAN("clean");

    private final String configName;

    MessageStyle(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static MessageStyle fromConfigName(String value) throws UnrecognizedInputException {
        for (var candidate : values()) {
            if (candidate.configName.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new UnrecognizedInputException("Unknown message style '" + value + "', expected one of "
                + Arrays.stream(values()).map(MessageStyle::configName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
