package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.model.User;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Operations the application needs from the tracker. {@link JiraApiClient} talks HTTP; tests substitute an in-memory
 * implementation.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
public interface JiraClient {

    /** @param key human key ("PROJ-1") or numeric id */
    Issue getIssue(String key) throws LazyJiraException;

    SearchResult search(String jql, int startAt, int maxResults) throws LazyJiraException;

    /** Creates the issue and returns it as the server now reports it. */
    Issue createIssue(CreateIssueData data) throws LazyJiraException;

    void updateIssue(String key, UpdateIssueData data) throws LazyJiraException;

    List<Transition> listTransitions(String key) throws LazyJiraException;

    void executeTransition(String key, String transitionId, @Nullable String comment) throws LazyJiraException;

    void addComment(String key, String text) throws LazyJiraException;

    List<Comment> listComments(String key) throws LazyJiraException;

    User getCurrentUser() throws LazyJiraException;
}
