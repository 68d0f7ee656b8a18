package io.github.jbellis.lazyjira.model;

import org.jetbrains.annotations.Nullable;

/** A tracker account. {@code accountId} is the stable identity; the display name may change. */
public record User(String accountId, String displayName, @Nullable String emailAddress) {

    public User(String accountId, String displayName) {
        this(accountId, displayName, null);
    }
}
