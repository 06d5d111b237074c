package io.github.depot2git.store;

import org.eclipse.jgit.lib.Repository;

/** A key in the state store. Each key is backed by one ref under {@value #NAMESPACE}. */
public record StateKey(String name) {
    public static final String NAMESPACE = "refs/depot2git/";

    public StateKey {
        if (!Repository.isValidRefName(NAMESPACE + name)) {
            throw new IllegalArgumentException("Not usable as a state key: " + name);
        }
    }

    public String ref() {
        return NAMESPACE + name;
    }

    @Override
    public String toString() {
        return name;
    }
}
