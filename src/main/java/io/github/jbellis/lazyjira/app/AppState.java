package io.github.jbellis.lazyjira.app;

import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the views render. Only {@link AppController} mutates it, from the single event-handling thread; views
 * read it between events.
 */
public class AppState {
    private final String instance;
    private ViewMode viewMode = ViewMode.LIST;
    private boolean running = true;

    private final IssueListState issueList = new IssueListState();
    private boolean listLoading;

    private @Nullable String currentIssueKey;
    private @Nullable Issue detailIssue;
    private List<Comment> detailComments = List.of();
    private boolean detailLoading;

    private final TransitionListState transitionList = new TransitionListState();
    private boolean transitionsLoading;

    private @Nullable String lastError;
    private @Nullable String statusMessage;

    public AppState(String instance) {
        this.instance = instance;
    }

    public String instance() {
        return instance;
    }

    public ViewMode viewMode() {
        return viewMode;
    }

    void setViewMode(ViewMode viewMode) {
        this.viewMode = viewMode;
    }

    public boolean isRunning() {
        return running;
    }

    void stop() {
        running = false;
    }

    public IssueListState issueList() {
        return issueList;
    }

    public boolean isListLoading() {
        return listLoading;
    }

    void setListLoading(boolean listLoading) {
        this.listLoading = listLoading;
    }

    public @Nullable String currentIssueKey() {
        return currentIssueKey;
    }

    void setCurrentIssueKey(@Nullable String currentIssueKey) {
        this.currentIssueKey = currentIssueKey;
    }

    public @Nullable Issue detailIssue() {
        return detailIssue;
    }

    void setDetailIssue(@Nullable Issue detailIssue) {
        this.detailIssue = detailIssue;
    }

    public List<Comment> detailComments() {
        return detailComments;
    }

    void setDetailComments(List<Comment> detailComments) {
        this.detailComments = List.copyOf(detailComments);
    }

    public boolean isDetailLoading() {
        return detailLoading;
    }

    void setDetailLoading(boolean detailLoading) {
        this.detailLoading = detailLoading;
    }

    public TransitionListState transitionList() {
        return transitionList;
    }

    public boolean isTransitionsLoading() {
        return transitionsLoading;
    }

    void setTransitionsLoading(boolean transitionsLoading) {
        this.transitionsLoading = transitionsLoading;
    }

    public @Nullable String lastError() {
        return lastError;
    }

    void setLastError(@Nullable String lastError) {
        this.lastError = lastError;
    }

    public @Nullable String statusMessage() {
        return statusMessage;
    }

    void setStatusMessage(@Nullable String statusMessage) {
        this.statusMessage = statusMessage;
    }

    /** Drops the current issue, its comments and transitions so nothing leaks into the next selection. */
    void clearDetail() {
        currentIssueKey = null;
        detailIssue = null;
        detailComments = List.of();
        detailLoading = false;
        transitionList.clear();
        transitionsLoading = false;
    }
}
