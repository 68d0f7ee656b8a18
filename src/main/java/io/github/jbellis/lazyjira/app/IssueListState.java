package io.github.jbellis.lazyjira.app;

import io.github.jbellis.lazyjira.model.Issue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Loaded issues plus focus, multi-selection and paging position. Selection is tracked by issue key. */
public class IssueListState {
    private final List<Issue> issues = new ArrayList<>();
    private final Set<String> selectedKeys = new LinkedHashSet<>();
    private int focusedIndex = -1;
    private int nextStartAt = 0;
    private boolean hasMore = false;

    /** Replaces the list; focus goes to the first row and the selection is cleared. */
    public void setIssues(List<Issue> newIssues, int nextStartAt, boolean hasMore) {
        issues.clear();
        issues.addAll(newIssues);
        selectedKeys.clear();
        focusedIndex = issues.isEmpty() ? -1 : 0;
        this.nextStartAt = nextStartAt;
        this.hasMore = hasMore;
    }

    /**
     * Appends a further page, skipping keys already present (rows can shift between pages while paging).
     *
     * @return number of issues actually added
     */
    public int appendPage(List<Issue> page, int nextStartAt, boolean hasMore) {
        var known = new LinkedHashSet<String>();
        issues.forEach(i -> known.add(i.key()));
        int added = 0;
        for (var issue : page) {
            if (known.add(issue.key())) {
                issues.add(issue);
                added++;
            }
        }
        if (focusedIndex < 0 && !issues.isEmpty()) {
            focusedIndex = 0;
        }
        this.nextStartAt = nextStartAt;
        this.hasMore = hasMore;
        return added;
    }

    /** Swaps in a refetched copy of an issue already in the list, matched by key. */
    public void replace(Issue refreshed) {
        for (int i = 0; i < issues.size(); i++) {
            if (issues.get(i).key().equals(refreshed.key())) {
                issues.set(i, refreshed);
                return;
            }
        }
    }

    public void stopPaging() {
        hasMore = false;
    }

    public void moveUp() {
        if (focusedIndex > 0) {
            focusedIndex--;
        } else if (focusedIndex < 0 && !issues.isEmpty()) {
            focusedIndex = 0;
        }
    }

    public void moveDown() {
        if (focusedIndex < 0) {
            if (!issues.isEmpty()) {
                focusedIndex = 0;
            }
        } else if (focusedIndex < issues.size() - 1) {
            focusedIndex++;
        }
    }

    public void toggleSelection() {
        focusedIssue().ifPresent(issue -> {
            if (!selectedKeys.remove(issue.key())) {
                selectedKeys.add(issue.key());
            }
        });
    }

    public Optional<Issue> focusedIssue() {
        return focusedIndex >= 0 && focusedIndex < issues.size()
                ? Optional.of(issues.get(focusedIndex))
                : Optional.empty();
    }

    public List<Issue> selectedIssues() {
        return issues.stream().filter(i -> selectedKeys.contains(i.key())).toList();
    }

    public boolean isSelected(Issue issue) {
        return selectedKeys.contains(issue.key());
    }

    public List<Issue> issues() {
        return List.copyOf(issues);
    }

    public int size() {
        return issues.size();
    }

    public int focusedIndex() {
        return focusedIndex;
    }

    public int nextStartAt() {
        return nextStartAt;
    }

    public boolean hasMore() {
        return hasMore;
    }
}
