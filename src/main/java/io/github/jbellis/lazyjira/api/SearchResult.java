package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.model.Issue;
import java.util.List;

/**
 * One page of a JQL search. {@code total} is whatever the server reported and is advisory only: pages can shift while
 * paging, and the current search endpoint does not report it reliably.
 *
 * <p>{@code consumed} is how many rows the server handed out for this page. It can exceed {@code issues.size()} when
 * entries were dropped because they failed to parse or fetch, and paging always advances by it.
 */
public record SearchResult(int startAt, int maxResults, int total, List<Issue> issues, int consumed) {

    public SearchResult {
        issues = List.copyOf(issues);
        if (consumed < issues.size()) {
            throw new IllegalArgumentException(
                    "consumed (%d) is less than the number of issues (%d)".formatted(consumed, issues.size()));
        }
    }

    public SearchResult(int startAt, int maxResults, int total, List<Issue> issues) {
        this(startAt, maxResults, total, issues, issues.size());
    }

    public static SearchResult empty(int startAt, int maxResults) {
        return new SearchResult(startAt, maxResults, 0, List.of());
    }

    public boolean hasMore() {
        return startAt + consumed < total;
    }

    public int nextStartAt() {
        return startAt + consumed;
    }
}
