package io.github.jbellis.lazyjira.model;

import java.net.URI;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of a tracker issue. A refetch produces a new instance; nothing mutates an existing one.
 */
public record Issue(
        String id,
        String key, // e.g. "PROJ-123"
        String summary,
        Status status,
        @Nullable User assignee,
        Priority priority,
        String issueType,
        String projectKey,
        @Nullable String description,
        Instant created,
        Instant updated) {

    public boolean isTodo() {
        return status.category() == StatusCategory.TO_DO;
    }

    public boolean isInProgress() {
        return status.category() == StatusCategory.IN_PROGRESS;
    }

    public boolean isDone() {
        return status.category() == StatusCategory.DONE;
    }

    public URI browseUrl(String instance) {
        return URI.create("https://" + instance + "/browse/" + key);
    }
}
