package io.github.depot2git.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

/**
 * A stream as listed by the source at some transaction. Streams are identified by number; the name and the basis
 * can change over time. The {@code previous*} fields are only filled on the record stored for the transaction that
 * renamed or re-parented the stream.
 */
public record StreamInfo(
        int number,
        String name,
        String depotName,
        StreamKind kind,
        @Nullable Integer basisNumber,
        @Nullable String basisName,
        @Nullable Long timeLock,
        @Nullable String previousName,
        @Nullable Integer previousBasisNumber,
        @Nullable String previousBasisName) {

    public static StreamInfo of(
            int number,
            String name,
            String depotName,
            StreamKind kind,
            @Nullable Integer basisNumber,
            @Nullable String basisName) {
        return new StreamInfo(number, name, depotName, kind, basisNumber, basisName, null, null, null, null);
    }

    @JsonIgnore
    public boolean isRoot() {
        return basisNumber == null;
    }

    @JsonIgnore
    public boolean isWorkspace() {
        return kind == StreamKind.WORKSPACE;
    }

    public boolean wasRenamed() {
        return previousName != null && !previousName.equals(name);
    }

    public boolean wasReparented() {
        return previousBasisNumber != null && !previousBasisNumber.equals(basisNumber);
    }

    public StreamInfo withPrevious(
            @Nullable String prevName, @Nullable Integer prevBasisNumber, @Nullable String prevBasisName) {
        return new StreamInfo(
                number,
                name,
                depotName,
                kind,
                basisNumber,
                basisName,
                timeLock,
                prevName,
                prevBasisNumber,
                prevBasisName);
    }

    public StreamRef ref() {
        return new StreamRef(number, name);
    }
}
