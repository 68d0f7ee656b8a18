package io.github.jbellis.lazyjira.app;

import io.github.jbellis.lazyjira.api.JiraClient;
import io.github.jbellis.lazyjira.api.UpdateIssueData;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.util.ExecutorServiceUtil;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The application state machine. Handles one event at a time against the {@link AppState} it owns.
 *
 * <p>A handler that needs several requests starts them together on the worker pool and joins all of them before
 * touching state, so every merge for an event happens after that event's requests have settled. Handlers never
 * overlap: {@link #handle} rejects a call made while another is running. Failures from the tracker never escape a
 * handler; they end up in {@link AppState#lastError()} and the previous state is kept.
 */
public class AppController implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AppController.class);
    private static final int WORKER_THREADS = 2;

    private final JiraClient client;
    private final AppState state;
    private final String jql;
    private final int pageSize;
    private final Consumer<URI> browserOpener;
    private final Runnable onStateChanged;
    private final ExecutorService workers;
    private final AtomicBoolean handling = new AtomicBoolean(false);

    @FunctionalInterface
    private interface JiraCall<T> {
        T call() throws LazyJiraException;
    }

    /**
     * @param browserOpener opens issue URLs; swapped out in tests
     * @param onStateChanged invoked when a loading flag flips mid-handler, so the view can repaint before the
     *     requests finish
     */
    public AppController(
            JiraClient client,
            AppState state,
            String jql,
            int pageSize,
            Consumer<URI> browserOpener,
            Runnable onStateChanged) {
        this.client = client;
        this.state = state;
        this.jql = jql;
        this.pageSize = pageSize;
        this.browserOpener = browserOpener;
        this.onStateChanged = onStateChanged;
        this.workers = ExecutorServiceUtil.newFixedThreadExecutor(WORKER_THREADS, "lazyjira-worker-");
    }

    public AppState state() {
        return state;
    }

    public void handle(AppEvent event) {
        runExclusive(() -> dispatch(event));
    }

    /** Adds a comment to the issue shown in the detail view, then reloads its comments. */
    public void submitComment(String text) {
        runExclusive(() -> {
            if (state.viewMode() == ViewMode.DETAIL && state.currentIssueKey() != null) {
                addComment(state.currentIssueKey(), text);
            }
        });
    }

    private void runExclusive(Runnable handler) {
        if (!handling.compareAndSet(false, true)) {
            throw new IllegalStateException("An event is already being handled");
        }
        try {
            state.setLastError(null);
            state.setStatusMessage(null);
            handler.run();
        } finally {
            handling.set(false);
        }
    }

    private void dispatch(AppEvent event) {
        logger.debug("Handling {} in {}", event, state.viewMode());
        var view = state.viewMode();
        switch (event) {
            case QUIT -> state.stop();
            case MOVE_UP -> {
                if (view == ViewMode.LIST) {
                    state.issueList().moveUp();
                } else if (view == ViewMode.TRANSITIONS) {
                    state.transitionList().moveUp();
                }
            }
            case MOVE_DOWN -> {
                if (view == ViewMode.LIST) {
                    state.issueList().moveDown();
                } else if (view == ViewMode.TRANSITIONS) {
                    state.transitionList().moveDown();
                }
            }
            case SELECT -> {
                if (view == ViewMode.LIST) {
                    openDetail();
                } else if (view == ViewMode.TRANSITIONS) {
                    confirmTransition();
                }
            }
            case BACK -> {
                if (view != ViewMode.LIST) {
                    exitToList();
                }
            }
            case TOGGLE_SELECTION -> {
                if (view == ViewMode.LIST) {
                    state.issueList().toggleSelection();
                }
            }
            case REFRESH -> {
                if (view == ViewMode.LIST) {
                    refresh();
                } else if (view == ViewMode.DETAIL && state.currentIssueKey() != null) {
                    loadDetail(state.currentIssueKey(), state.detailIssue());
                }
            }
            case LOAD_MORE -> {
                if (view == ViewMode.LIST) {
                    loadMore();
                }
            }
            case SHOW_TRANSITIONS -> {
                if (view == ViewMode.DETAIL) {
                    showTransitions();
                }
            }
            case START_PROGRESS -> {
                if (view == ViewMode.DETAIL) {
                    quickTransition(
                            "Start progress",
                            t -> contains(t.name(), "start") || contains(t.toStatus(), "progress"));
                }
            }
            case RESOLVE -> {
                if (view == ViewMode.DETAIL) {
                    quickTransition(
                            "Resolve",
                            t -> contains(t.name(), "resolve")
                                    || contains(t.name(), "done")
                                    || contains(t.toStatus(), "done"));
                }
            }
            case ASSIGN_TO_ME -> {
                if (view == ViewMode.DETAIL) {
                    assignToMe();
                }
            }
            case CREATE_TICKET -> {
                if (view == ViewMode.LIST) {
                    state.setViewMode(ViewMode.CREATE_TICKET);
                    state.setStatusMessage("Ticket creation is not available yet. Press Esc to go back.");
                }
            }
            case OPEN_IN_BROWSER -> openInBrowser();
            case ADD_COMMENT, RESIZE, UNKNOWN -> {
                // ADD_COMMENT arrives through submitComment once the view has the text
            }
        }
    }

    /** Initial load of the issue list; runs under the same exclusivity as key events. */
    public void loadInitial() {
        runExclusive(this::refresh);
    }

    /** Reloads the first page with the configured JQL. Focus and selection are reset; on failure the old list stays. */
    private void refresh() {
        state.setListLoading(true);
        onStateChanged.run();
        try {
            var result = client.search(jql, 0, pageSize);
            state.issueList()
                    .setIssues(result.issues(), result.nextStartAt(), result.hasMore() && result.consumed() > 0);
            logger.debug("Loaded {} issues (total {})", result.issues().size(), result.total());
        } catch (LazyJiraException e) {
            logger.warn("Failed to load tickets: {}", e.getMessage());
            state.setLastError("Failed to load tickets: " + e.getMessage());
        } finally {
            state.setListLoading(false);
        }
    }

    private void loadMore() {
        var list = state.issueList();
        if (!list.hasMore()) {
            state.setStatusMessage("No more issues");
            return;
        }
        state.setListLoading(true);
        onStateChanged.run();
        try {
            var page = client.search(jql, list.nextStartAt(), pageSize);
            if (page.consumed() == 0) {
                // total is advisory; an empty page ends paging regardless
                list.stopPaging();
                state.setStatusMessage("No more issues");
                return;
            }
            int added = list.appendPage(page.issues(), page.nextStartAt(), page.hasMore());
            state.setStatusMessage("Loaded %d more issue(s)".formatted(added));
        } catch (LazyJiraException e) {
            logger.warn("Failed to load more tickets: {}", e.getMessage());
            state.setLastError("Failed to load more tickets: " + e.getMessage());
        } finally {
            state.setListLoading(false);
        }
    }

    private void openDetail() {
        var focused = state.issueList().focusedIssue();
        if (focused.isEmpty()) {
            logger.debug("No focused issue to open");
            return;
        }
        var rowIssue = focused.get();
        state.clearDetail();
        state.setViewMode(ViewMode.DETAIL);
        state.setCurrentIssueKey(rowIssue.key());
        loadDetail(rowIssue.key(), rowIssue);
    }

    /**
     * Fetches the issue and its comments concurrently. A failed issue fetch falls back to {@code fallback}; failed
     * comments leave the comment list empty.
     */
    private void loadDetail(String key, @Nullable Issue fallback) {
        state.setDetailLoading(true);
        onStateChanged.run();

        var issueFuture = async(() -> client.getIssue(key));
        var commentsFuture = async(() -> client.listComments(key));
        var issue = await(issueFuture, "fetch issue " + key);
        var comments = await(commentsFuture, "load comments for " + key);

        if (issue != null) {
            state.setDetailIssue(issue);
            state.issueList().replace(issue);
        } else {
            state.setDetailIssue(fallback);
            state.setStatusMessage("Showing cached data for " + key);
        }
        state.setDetailComments(comments != null ? comments : List.<Comment>of());
        state.setDetailLoading(false);
    }

    private void exitToList() {
        state.setViewMode(ViewMode.LIST);
        state.clearDetail();
    }

    private void showTransitions() {
        var key = state.currentIssueKey();
        if (key == null) {
            return;
        }
        state.setViewMode(ViewMode.TRANSITIONS);
        state.transitionList().clear();
        state.setTransitionsLoading(true);
        onStateChanged.run();
        try {
            state.transitionList().setTransitions(client.listTransitions(key));
        } catch (LazyJiraException e) {
            logger.warn("Failed to load transitions for {}: {}", key, e.getMessage());
            state.setLastError("Failed to load transitions: " + e.getMessage());
        } finally {
            state.setTransitionsLoading(false);
        }
    }

    private void confirmTransition() {
        var key = state.currentIssueKey();
        var transition = state.transitionList().focusedTransition();
        if (key == null || transition.isEmpty()) {
            return;
        }
        try {
            client.executeTransition(key, transition.get().id(), null);
        } catch (LazyJiraException e) {
            logger.warn("Transition {} on {} failed: {}", transition.get().name(), key, e.getMessage());
            state.setLastError("Transition failed: " + e.getMessage());
            return;
        }
        state.setViewMode(ViewMode.DETAIL);
        state.transitionList().clear();
        afterWorkflowChange(key, "Moved %s via '%s'".formatted(key, transition.get().name()));
    }

    private void quickTransition(String label, Predicate<Transition> matcher) {
        var key = state.currentIssueKey();
        if (key == null) {
            return;
        }
        Transition match;
        try {
            match = client.listTransitions(key).stream().filter(matcher).findFirst().orElse(null);
        } catch (LazyJiraException e) {
            state.setLastError("Failed to load transitions: " + e.getMessage());
            return;
        }
        if (match == null) {
            state.setStatusMessage("No '%s' transition available for %s".formatted(label, key));
            return;
        }
        try {
            client.executeTransition(key, match.id(), null);
        } catch (LazyJiraException e) {
            state.setLastError("%s failed: %s".formatted(label, e.getMessage()));
            return;
        }
        afterWorkflowChange(key, "Moved %s via '%s'".formatted(key, match.name()));
    }

    /** Refetches the issue and reloads the list concurrently, then merges both. */
    private void afterWorkflowChange(String key, String message) {
        state.setDetailLoading(true);
        onStateChanged.run();

        var issueFuture = async(() -> client.getIssue(key));
        var listFuture = async(() -> client.search(jql, 0, pageSize));
        var issue = await(issueFuture, "refetch issue " + key);
        var page = await(listFuture, "reload issue list");

        if (issue != null) {
            state.setDetailIssue(issue);
        }
        if (page != null) {
            state.issueList()
                    .setIssues(page.issues(), page.nextStartAt(), page.hasMore() && page.consumed() > 0);
        }
        state.setDetailLoading(false);
        state.setStatusMessage(message);
    }

    private void assignToMe() {
        var key = state.currentIssueKey();
        if (key == null) {
            return;
        }
        try {
            var me = client.getCurrentUser();
            client.updateIssue(key, UpdateIssueData.assignee(me.accountId()));
            var issue = client.getIssue(key);
            state.setDetailIssue(issue);
            state.issueList().replace(issue);
            state.setStatusMessage("Assigned %s to %s".formatted(key, me.displayName()));
        } catch (LazyJiraException e) {
            logger.warn("Assign to me failed for {}: {}", key, e.getMessage());
            state.setLastError("Assign failed: " + e.getMessage());
        }
    }

    private void addComment(String key, String text) {
        try {
            client.addComment(key, text);
        } catch (LazyJiraException e) {
            logger.warn("Adding comment to {} failed: {}", key, e.getMessage());
            state.setLastError("Comment failed: " + e.getMessage());
            return;
        }
        try {
            state.setDetailComments(client.listComments(key));
            state.setStatusMessage("Comment added");
        } catch (LazyJiraException e) {
            logger.warn("Reloading comments for {} failed: {}", key, e.getMessage());
            state.setStatusMessage("Comment added, but comments could not be reloaded");
        }
    }

    private void openInBrowser() {
        List<Issue> targets = switch (state.viewMode()) {
            case DETAIL -> state.detailIssue() == null ? List.of() : List.of(state.detailIssue());
            case LIST -> {
                var selected = state.issueList().selectedIssues();
                yield selected.isEmpty()
                        ? state.issueList().focusedIssue().stream().toList()
                        : selected;
            }
            default -> List.of();
        };
        for (var issue : targets) {
            var url = issue.browseUrl(state.instance());
            try {
                browserOpener.accept(url);
            } catch (RuntimeException e) {
                logger.error("Failed to open browser for {}", url, e);
                state.setLastError("Failed to open browser: " + e.getMessage());
                return;
            }
        }
        if (targets.size() > 1) {
            state.setStatusMessage("Opened %d issues in the browser".formatted(targets.size()));
        }
    }

    private <T> CompletableFuture<T> async(JiraCall<T> call) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return call.call();
                    } catch (LazyJiraException e) {
                        throw new CompletionException(e);
                    }
                },
                workers);
    }

    /** Joins {@code future}; a failure is logged and yields null. */
    private static <T> @Nullable T await(CompletableFuture<T> future, String what) {
        try {
            return future.join();
        } catch (CompletionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Failed to {}: {}", what, cause.getMessage());
            return null;
        }
    }

    private static boolean contains(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public void close() {
        ExecutorServiceUtil.shutdownQuietly(workers, "controller worker pool");
    }
}
