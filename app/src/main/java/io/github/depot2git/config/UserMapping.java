package io.github.depot2git.config;

import org.jetbrains.annotations.Nullable;

/**
 * @param timezone an offset such as {@code +0100} or a zone id such as {@code Europe/London}; null for the system
 *     default
 */
public record UserMapping(String sourceUser, String name, String email, @Nullable String timezone) {}
