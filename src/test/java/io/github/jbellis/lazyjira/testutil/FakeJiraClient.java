package io.github.jbellis.lazyjira.testutil;

import io.github.jbellis.lazyjira.api.CreateIssueData;
import io.github.jbellis.lazyjira.api.JiraClient;
import io.github.jbellis.lazyjira.api.SearchResult;
import io.github.jbellis.lazyjira.api.UpdateIssueData;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.model.User;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory {@link JiraClient}. Issues are served in insertion order; failures are injected per operation name.
 * Thread-safe enough for the controller's concurrent sub-requests.
 */
public class FakeJiraClient implements JiraClient {
    private final List<Issue> issues = new CopyOnWriteArrayList<>();
    private final Map<String, List<Comment>> comments = new ConcurrentHashMap<>();
    private final Map<String, List<Transition>> transitions = new ConcurrentHashMap<>();
    private final Map<String, LazyJiraException> failures = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, String> executedTransitions = Collections.synchronizedMap(new HashMap<>());
    private final List<String> addedComments = new CopyOnWriteArrayList<>();
    private final Map<String, UpdateIssueData> updates = new ConcurrentHashMap<>();
    private final User currentUser = TestIssues.ME;
    private final Map<String, CountDownLatch> rendezvous = new ConcurrentHashMap<>();

    public FakeJiraClient withIssues(Issue... toAdd) {
        issues.addAll(List.of(toAdd));
        return this;
    }

    public void setIssues(List<Issue> replacement) {
        issues.clear();
        issues.addAll(replacement);
    }

    public void replaceIssue(Issue issue) {
        for (int i = 0; i < issues.size(); i++) {
            if (issues.get(i).key().equals(issue.key())) {
                issues.set(i, issue);
                return;
            }
        }
        issues.add(issue);
    }

    public FakeJiraClient withComments(String key, Comment... toAdd) {
        comments.put(key, new CopyOnWriteArrayList<>(List.of(toAdd)));
        return this;
    }

    public FakeJiraClient withTransitions(String key, Transition... toAdd) {
        transitions.put(key, List.of(toAdd));
        return this;
    }

    /** Makes every later call of {@code operation} fail with {@code error} until cleared. */
    public void failOn(String operation, LazyJiraException error) {
        failures.put(operation, error);
    }

    /**
     * Makes each listed operation wait until all of them have been entered. An operation that is still waiting after
     * five seconds fails, so callers that issue them one after another see errors instead of results.
     */
    public void meetAt(String... operations) {
        var latch = new CountDownLatch(operations.length);
        for (var operation : operations) {
            rendezvous.put(operation, latch);
        }
    }

    public void clearFailure(String operation) {
        failures.remove(operation);
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public Map<String, String> executedTransitions() {
        return Map.copyOf(executedTransitions);
    }

    public List<String> addedComments() {
        return List.copyOf(addedComments);
    }

    public @Nullable UpdateIssueData updateFor(String key) {
        return updates.get(key);
    }

    private void record(String operation) throws LazyJiraException {
        calls.add(operation);
        var latch = rendezvous.get(operation);
        if (latch != null) {
            latch.countDown();
            try {
                if (!latch.await(5, TimeUnit.SECONDS)) {
                    throw LazyJiraException.api(504, operation + " was never joined by its sibling requests");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw LazyJiraException.network(operation + " interrupted", e);
            }
        }
        var failure = failures.get(operation);
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public Issue getIssue(String key) throws LazyJiraException {
        record("getIssue");
        return issues.stream()
                .filter(issue -> issue.key().equals(key))
                .findFirst()
                .orElseThrow(() -> LazyJiraException.api(404, "Issue does not exist"));
    }

    @Override
    public SearchResult search(String jql, int startAt, int maxResults) throws LazyJiraException {
        record("search");
        var snapshot = List.copyOf(issues);
        int from = Math.min(startAt, snapshot.size());
        int to = Math.min(startAt + maxResults, snapshot.size());
        return new SearchResult(startAt, maxResults, snapshot.size(), snapshot.subList(from, to));
    }

    @Override
    public Issue createIssue(CreateIssueData data) throws LazyJiraException {
        record("createIssue");
        var issue = TestIssues.issue(data.projectKey() + "-" + (issues.size() + 1), data.summary());
        issues.add(issue);
        return issue;
    }

    @Override
    public void updateIssue(String key, UpdateIssueData data) throws LazyJiraException {
        record("updateIssue");
        updates.put(key, data);
        var assignee = data.fields().get("assignee");
        if (assignee != null) {
            replaceIssue(TestIssues.withAssignee(getIssueQuietly(key), currentUser));
        }
    }

    private Issue getIssueQuietly(String key) {
        return issues.stream()
                .filter(issue -> issue.key().equals(key))
                .findFirst()
                .orElseThrow();
    }

    @Override
    public List<Transition> listTransitions(String key) throws LazyJiraException {
        record("listTransitions");
        return transitions.getOrDefault(key, List.of());
    }

    @Override
    public void executeTransition(String key, String transitionId, @Nullable String comment)
            throws LazyJiraException {
        record("executeTransition");
        executedTransitions.put(key, transitionId);
    }

    @Override
    public void addComment(String key, String text) throws LazyJiraException {
        record("addComment");
        addedComments.add(key + ":" + text);
        comments.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>())
                .add(TestIssues.comment("c" + addedComments.size(), text));
    }

    @Override
    public List<Comment> listComments(String key) throws LazyJiraException {
        record("listComments");
        return List.copyOf(comments.getOrDefault(key, List.of()));
    }

    @Override
    public User getCurrentUser() throws LazyJiraException {
        record("getCurrentUser");
        return currentUser;
    }
}
