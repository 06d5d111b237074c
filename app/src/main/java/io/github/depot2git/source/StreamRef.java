package io.github.depot2git.source;

/** The stream a transaction touched, as reported by the source at the time of the transaction. */
public record StreamRef(int number, String name) {
    @Override
    public String toString() {
        return name + " (" + number + ")";
    }
}
