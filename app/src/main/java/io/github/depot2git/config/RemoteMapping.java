package io.github.depot2git.config;

import org.jetbrains.annotations.Nullable;

/** A git remote the converted refs are pushed to; without a push URL, pushes go to {@code url}. */
public record RemoteMapping(String name, String url, @Nullable String pushUrl) {

    public String effectivePushUrl() {
        return pushUrl == null ? url : pushUrl;
    }
}
