package io.github.depot2git.source;

/** A depot: stable number, mutable display name. */
public record Depot(int number, String name) {}
