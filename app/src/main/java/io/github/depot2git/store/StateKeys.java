package io.github.depot2git.store;

/**
 * Naming of the converter's state. Everything is keyed by depot and stream number, which never change, rather
 * than by names, which do.
 */
public final class StateKeys {
    private StateKeys() {}

    /** The three keys making up one stream's conversion unit. */
    public record StreamKeys(StateKey metadata, StateKey content, StateKey highWaterMark) {}

    public static String depotPrefix(int depot) {
        return "depots/" + depot + "/";
    }

    public static StreamKeys stream(int depot, int stream) {
        var base = depotPrefix(depot) + "streams/" + stream + "/";
        return new StreamKeys(
                new StateKey(base + "metadata"), new StateKey(base + "content"), new StateKey(base + "hwm"));
    }

    /** Checkpoint of the processing stage: the last transaction fully applied to the branches. */
    public static StateKey processing(int depot) {
        return new StateKey(depotPrefix(depot) + "processing");
    }

    /** The last history rewrite plan produced by the stitching stage. */
    public static StateKey stitchPlan(int depot) {
        return new StateKey(depotPrefix(depot) + "stitch-plan");
    }
}
