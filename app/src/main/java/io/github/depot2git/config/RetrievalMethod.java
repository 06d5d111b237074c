package io.github.depot2git.config;

import io.github.depot2git.UnrecognizedInputException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** How the retrieval stage finds the transactions that changed a stream. {@code skip} does no retrieval. */
public enum RetrievalMethod {
    POP("pop"),
    DIFF("diff"),
    DEEP_HIST("deep-hist"),
    SKIP("skip");

    private final String configName;

    RetrievalMethod(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static RetrievalMethod fromConfigName(String value) throws UnrecognizedInputException {
        for (var candidate : values()) {
            if (candidate.configName.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new UnrecognizedInputException("Unknown retrieval method '" + value + "', expected one of "
                + Arrays.stream(values()).map(RetrievalMethod::configName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
