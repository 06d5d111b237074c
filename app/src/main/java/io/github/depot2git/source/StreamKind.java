package io.github.depot2git.source;

import io.github.depot2git.UnrecognizedInputException;

public enum StreamKind {
    NORMAL("normal"),
    WORKSPACE("workspace"),
    SNAPSHOT("snapshot"),
    PASSTHROUGH("passthrough");

    private final String wireName;

    StreamKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StreamKind fromWireName(String name) throws UnrecognizedInputException {
        for (var kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new UnrecognizedInputException("Unrecognized stream kind: " + name);
    }
}
