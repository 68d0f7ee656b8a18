package io.github.jbellis.lazyjira.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.jbellis.lazyjira.config.LazyJiraConfig;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.model.User;
import io.github.jbellis.lazyjira.util.ExecutorServiceUtil;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Jira Cloud REST v3 client.
 *
 * <p>Every attempt of every operation takes one rate-limiter token, and the whole request-plus-decode runs inside the
 * retry loop. A 429 response costs a fixed penalty sleep before the retryable error is raised, on top of the retry
 * backoff.
 */
public class JiraApiClient implements JiraClient, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JiraApiClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int FAN_OUT_THREADS = 4;

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RateLimiter rateLimiter;
    private final RetryConfig retryConfig;
    private final RetryExecutor retryExecutor;
    private final Sleeper sleeper;
    private final SearchApiVersion searchApi;
    private final Duration rateLimitPenalty;
    private final ExecutorService fanOutExecutor;

    public JiraApiClient(
            OkHttpClient httpClient,
            String baseUrl,
            RateLimiter rateLimiter,
            RetryConfig retryConfig,
            Sleeper sleeper,
            SearchApiVersion searchApi,
            Duration rateLimitPenalty) {
        var parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Jira base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.rateLimiter = rateLimiter;
        this.retryConfig = retryConfig;
        this.retryExecutor = new RetryExecutor(sleeper);
        this.sleeper = sleeper;
        this.searchApi = searchApi;
        this.rateLimitPenalty = rateLimitPenalty;
        this.fanOutExecutor = ExecutorServiceUtil.newFixedThreadExecutor(FAN_OUT_THREADS, "jira-fetch-");
    }

    public static JiraApiClient create(LazyJiraConfig config) throws LazyJiraException {
        IssueValidators.validateInstance(config.instance());
        var httpClient = new JiraAuth(config).buildAuthenticatedClient();
        return new JiraApiClient(
                httpClient,
                config.baseUrl(),
                config.newRateLimiter(),
                config.retryConfig(),
                Sleeper.SYSTEM,
                config.searchApi(),
                config.rateLimitPenalty());
    }

    @Override
    public Issue getIssue(String key) throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        return call(() -> get(url("issue", key).build()), JiraResponseParser::parseIssue);
    }

    @Override
    public SearchResult search(String jql, int startAt, int maxResults) throws LazyJiraException {
        logger.debug(
                "Executing Jira JQL query ({}): {} [startAt={}, maxResults={}]", searchApi, jql, startAt, maxResults);
        return switch (searchApi) {
            case LEGACY -> {
                var url = url("search")
                        .addQueryParameter("jql", jql)
                        .addQueryParameter("startAt", Integer.toString(startAt))
                        .addQueryParameter("maxResults", Integer.toString(maxResults))
                        .build();
                yield call(() -> get(url), json -> JiraResponseParser.parseSearchResults(json, startAt, maxResults));
            }
            case JQL -> searchByIds(jql, startAt, maxResults);
        };
    }

    /**
     * The current endpoint returns identifiers only. Issues are fetched concurrently and kept in page order; an issue
     * whose fetch fails is left out of the page.
     */
    private SearchResult searchByIds(String jql, int startAt, int maxResults) throws LazyJiraException {
        var url = url("search", "jql")
                .addQueryParameter("jql", jql)
                .addQueryParameter("startAt", Integer.toString(startAt))
                .addQueryParameter("maxResults", Integer.toString(maxResults))
                .addQueryParameter("fields", "id")
                .build();
        var page = call(() -> get(url), json -> json);
        var ids = JiraResponseParser.parseSearchIds(page);

        var futures = ids.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> fetchForSearch(id), fanOutExecutor))
                .toList();
        var issues = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();
        if (issues.size() < ids.size()) {
            logger.warn("Search page returned {} ids but only {} issues could be fetched", ids.size(), issues.size());
        }

        // total is absent from this endpoint; isLast == false means at least one more id exists
        int total;
        var totalNode = page.get("total");
        if (totalNode != null && totalNode.canConvertToInt()) {
            total = totalNode.asInt();
        } else {
            boolean isLast = page.path("isLast").asBoolean(true);
            total = startAt + ids.size() + (isLast ? 0 : 1);
        }
        return new SearchResult(startAt, maxResults, total, issues, ids.size());
    }

    private Optional<Issue> fetchForSearch(String id) {
        try {
            return Optional.of(getIssue(id));
        } catch (LazyJiraException e) {
            logger.warn("Skipping issue {} from search results: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Issue createIssue(CreateIssueData data) throws LazyJiraException {
        IssueValidators.validateCreateIssue(data);
        var payload = objectMapper.createObjectNode();
        var fields = payload.putObject("fields");
        fields.putObject("project").put("key", data.projectKey());
        fields.putObject("issuetype").put("name", data.issueType());
        fields.put("summary", data.summary());
        if (data.description() != null && !data.description().isBlank()) {
            fields.set("description", AdfDocument.fromPlainText(data.description()));
        }
        if (data.assigneeAccountId() != null) {
            fields.putObject("assignee").put("accountId", data.assigneeAccountId());
        }
        if (data.priority() != null) {
            fields.putObject("priority").put("name", data.priority());
        }

        var created = call(() -> post(url("issue").build(), payload), json -> json);
        var key = created.path("key").asText("");
        if (key.isEmpty()) {
            throw LazyJiraException.parse("key", "Create issue response carried no key: " + created);
        }
        logger.info("Created issue {}", key);
        return getIssue(key);
    }

    @Override
    public void updateIssue(String key, UpdateIssueData data) throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        if (data.isEmpty()) {
            throw LazyJiraException.validation("Nothing to update on " + key);
        }
        var payload = data.toPayload();
        call(() -> put(url("issue", key).build(), payload), json -> json);
    }

    @Override
    public List<Transition> listTransitions(String key) throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        return call(() -> get(url("issue", key, "transitions").build()), JiraResponseParser::parseTransitions);
    }

    @Override
    public void executeTransition(String key, String transitionId, @Nullable String comment)
            throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        if (transitionId.isBlank()) {
            throw LazyJiraException.validation("Transition id cannot be empty");
        }
        var payload = objectMapper.createObjectNode();
        payload.putObject("transition").put("id", transitionId);
        if (comment != null && !comment.isBlank()) {
            payload.putObject("update")
                    .putArray("comment")
                    .addObject()
                    .putObject("add")
                    .set("body", AdfDocument.fromPlainText(comment));
        }
        call(() -> post(url("issue", key, "transitions").build(), payload), json -> json);
        logger.info("Executed transition {} on {}", transitionId, key);
    }

    @Override
    public void addComment(String key, String text) throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        IssueValidators.validateComment(text);
        var payload = objectMapper.createObjectNode();
        payload.set("body", AdfDocument.fromPlainText(text));
        call(() -> post(url("issue", key, "comment").build(), payload), json -> json);
    }

    @Override
    public List<Comment> listComments(String key) throws LazyJiraException {
        IssueValidators.validateIssueKey(key);
        return call(() -> get(url("issue", key, "comment").build()), JiraResponseParser::parseComments);
    }

    @Override
    public User getCurrentUser() throws LazyJiraException {
        return call(() -> get(url("myself").build()), JiraResponseParser::parseUser);
    }

    @Override
    public void close() {
        ExecutorServiceUtil.shutdownQuietly(fanOutExecutor, "jira-fetch pool");
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    @FunctionalInterface
    private interface Decoder<T> {
        T decode(JsonNode json) throws LazyJiraException;
    }

    /** One rate-limited, retried round trip: a fresh request per attempt, decoded inside the attempt. */
    private <T> T call(Supplier<Request> requestFactory, Decoder<T> decoder) throws LazyJiraException {
        return retryExecutor.retry(retryConfig, () -> {
            acquirePermit();
            return decoder.decode(send(requestFactory.get()));
        });
    }

    private void acquirePermit() throws LazyJiraException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LazyJiraException(LazyJiraException.Kind.INTERNAL, "Interrupted while waiting for rate limit", e);
        }
    }

    /** @return the decoded body, or a missing node for empty 2xx bodies (204 on writes) */
    private JsonNode send(Request request) throws LazyJiraException {
        logger.debug("{} {}", request.method(), request.url());
        int code;
        String body;
        try (Response response = httpClient.newCall(request).execute()) {
            code = response.code();
            body = readBody(response, request);
        } catch (IOException e) {
            throw LazyJiraException.network(
                    "%s %s failed: %s".formatted(request.method(), request.url(), e.getMessage()), e);
        }

        if (code >= 200 && code < 300) {
            if (body.isBlank()) {
                return MissingNode.getInstance();
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                logger.error("JSON parsing error for {}. Response body was:\n{}", request.url(), body);
                throw LazyJiraException.parse(
                        "body", "Invalid JSON from " + request.url() + ": " + e.getOriginalMessage(), e);
            }
        }

        logger.warn("Jira request failed. URL: {}. HTTP Status: {}. Body: {}", request.url(), code, body);
        switch (code) {
            case 401 -> throw LazyJiraException.authentication("Unauthorized (401)");
            case 403 -> throw LazyJiraException.authentication("Forbidden (403)");
            case 429 -> {
                penaltySleep();
                throw LazyJiraException.api(code, body);
            }
            default -> throw LazyJiraException.api(code, body);
        }
    }

    private static String readBody(Response response, Request request) throws LazyJiraException {
        ResponseBody responseBody = response.body();
        if (responseBody == null) {
            return "";
        }
        try {
            return responseBody.string();
        } catch (IOException e) {
            throw LazyJiraException.io("Failed to read response body from " + request.url(), e);
        }
    }

    private void penaltySleep() throws LazyJiraException {
        logger.warn("Rate limited by server (429), pausing {} ms", rateLimitPenalty.toMillis());
        try {
            sleeper.sleep(rateLimitPenalty);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LazyJiraException(LazyJiraException.Kind.INTERNAL, "Interrupted during rate-limit penalty", e);
        }
    }

    private HttpUrl.Builder url(String... segments) {
        var builder = baseUrl.newBuilder();
        for (var segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private static Request get(HttpUrl url) {
        return new Request.Builder().url(url).get().build();
    }

    private Request post(HttpUrl url, ObjectNode payload) {
        return new Request.Builder().url(url).post(jsonBody(payload)).build();
    }

    private Request put(HttpUrl url, ObjectNode payload) {
        return new Request.Builder().url(url).put(jsonBody(payload)).build();
    }

    private RequestBody jsonBody(ObjectNode payload) {
        return RequestBody.create(payload.toString(), JSON);
    }
}
