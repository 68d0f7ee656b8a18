package io.github.jbellis.lazyjira.model;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Coarse workflow classification, independent of the tracker's customizable status names. */
public enum StatusCategory {
    TO_DO("new", "To Do"),
    IN_PROGRESS("indeterminate", "In Progress"),
    DONE("done", "Done");

    private final String key;
    private final String displayName;

    StatusCategory(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /** The {@code statusCategory.key} value Jira uses on the wire. */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<StatusCategory> fromKey(@Nullable String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (var category : values()) {
            if (category.key.equals(key)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
