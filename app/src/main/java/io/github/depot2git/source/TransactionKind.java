package io.github.depot2git.source;

import io.github.depot2git.UnrecognizedInputException;

/**
 * The closed set of transaction kinds the converter understands. Anything else reported by the source is
 * unrecognized input and aborts the run.
 */
public enum TransactionKind {
    MKSTREAM("mkstream"),
    CHSTREAM("chstream"),
    ADD("add"),
    KEEP("keep"),
    CO("co"),
    MOVE("move"),
    PROMOTE("promote"),
    DEFUNCT("defunct"),
    PURGE("purge"),
    DEFCOMP("defcomp");

    private final String wireName;

    TransactionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TransactionKind fromWireName(String name) throws UnrecognizedInputException {
        for (var kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        throw new UnrecognizedInputException("Unrecognized transaction kind: " + name);
    }
}
