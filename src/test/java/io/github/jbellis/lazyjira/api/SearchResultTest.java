package io.github.jbellis.lazyjira.api;

import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.lazyjira.testutil.TestIssues;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchResultTest {

    @Test
    void hasMoreWhileTotalExceedsConsumed() {
        var issues = List.of(TestIssues.issue("PROJ-1", "a"), TestIssues.issue("PROJ-2", "b"));

        var first = new SearchResult(0, 2, 5, issues);
        assertTrue(first.hasMore());
        assertEquals(2, first.nextStartAt());

        var last = new SearchResult(4, 2, 5, issues);
        assertFalse(last.hasMore());
        assertEquals(6, last.nextStartAt());
    }

    @Test
    void pagingAdvancesByConsumedRowsNotParsedIssues() {
        var issues = List.of(TestIssues.issue("PROJ-1", "a"));

        var result = new SearchResult(0, 3, 3, issues, 3);

        assertFalse(result.hasMore());
        assertEquals(3, result.nextStartAt());
        assertThrows(IllegalArgumentException.class, () -> new SearchResult(0, 3, 3, issues, 0));
    }

    @Test
    void emptyHasNothingMore() {
        var empty = SearchResult.empty(10, 50);
        assertFalse(empty.hasMore());
        assertEquals(10, empty.nextStartAt());
        assertEquals(0, empty.total());
    }

    @Test
    void issuesAreCopied() {
        var issues = new ArrayList<>(List.of(TestIssues.issue("PROJ-1", "a")));
        var result = new SearchResult(0, 50, 1, issues);
        issues.clear();
        assertEquals(1, result.issues().size());
        assertThrows(UnsupportedOperationException.class, () -> result.issues().clear());
    }
}
