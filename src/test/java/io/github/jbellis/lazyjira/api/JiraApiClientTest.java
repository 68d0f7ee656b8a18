package io.github.jbellis.lazyjira.api;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.jbellis.lazyjira.config.LazyJiraConfig;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Exercises the client against an in-process HTTP server standing in for Jira Cloud. */
class JiraApiClientTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USER = "ada@example.com";
    private static final String TOKEN = "api-token-123";

    private record MockResponse(int status, String body) {}

    private record ReceivedRequest(String method, String path, String query, String authHeader, String body) {}

    private HttpServer mockServer;
    private String baseUrl;
    private OkHttpClient httpClient;
    private final Map<String, Deque<MockResponse>> routes = new ConcurrentHashMap<>();
    private final List<ReceivedRequest> receivedRequests = Collections.synchronizedList(new ArrayList<>());
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final RetryConfig retryConfig = new RetryConfig(2, Duration.ofMillis(1), Duration.ofMillis(5), 2.0);
    private JiraApiClient client;

    @BeforeEach
    void setUp() throws Exception {
        mockServer = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        mockServer.createContext("/", this::handle);
        mockServer.setExecutor(null);
        mockServer.start();
        baseUrl = "http://localhost:" + mockServer.getAddress().getPort() + "/rest/api/3";

        var config = LazyJiraConfig.builder()
                .instance("example.atlassian.net")
                .username(USER)
                .apiToken(TOKEN)
                .requestTimeout(Duration.ofSeconds(5))
                .build();
        httpClient = new JiraAuth(config).buildAuthenticatedClient();
        client = newClient(SearchApiVersion.JQL, sleeps::add, Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        client.close();
        if (mockServer != null) {
            mockServer.stop(0);
        }
    }

    private JiraApiClient newClient(SearchApiVersion searchApi, Sleeper sleeper, Duration penalty) {
        return new JiraApiClient(
                httpClient,
                baseUrl,
                new RateLimiter(100, Duration.ofSeconds(60), 100),
                retryConfig,
                sleeper,
                searchApi,
                penalty);
    }

    /** Queues responses for {@code METHOD path}; the last one queued keeps being served. */
    private void route(String method, String path, MockResponse... responses) {
        routes.put(method + " /rest/api/3" + path, new ArrayDeque<>(List.of(responses)));
    }

    private static MockResponse ok(String body) {
        return new MockResponse(200, body);
    }

    private static MockResponse status(int status, String body) {
        return new MockResponse(status, body);
    }

    private static String issueJson(String id, String key) {
        return JiraResponseParserTest.ISSUE_JSON
                .replace("\"10001\"", "\"" + id + "\"")
                .replace("PROJ-1", key);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var method = exchange.getRequestMethod();
        var path = exchange.getRequestURI().getPath();
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        receivedRequests.add(new ReceivedRequest(
                method,
                path,
                exchange.getRequestURI().getQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                body));

        var queue = routes.get(method + " " + path);
        MockResponse response;
        if (queue == null) {
            response = status(404, "{\"errorMessages\":[\"No route for " + path + "\"]}");
        } else {
            synchronized (queue) {
                response = queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }

        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private long requestsTo(String path) {
        return receivedRequests.stream()
                .filter(r -> r.path().equals("/rest/api/3" + path))
                .count();
    }

    @Test
    void getIssueSendsBasicAuthAndParses() throws Exception {
        route("GET", "/issue/PROJ-1", ok(issueJson("10001", "PROJ-1")));

        var issue = client.getIssue("PROJ-1");

        assertEquals("PROJ-1", issue.key());
        assertEquals("Fix login", issue.summary());
        assertEquals(1, receivedRequests.size());
        assertEquals(Credentials.basic(USER, TOKEN), receivedRequests.get(0).authHeader());
    }

    @Test
    void notFoundIsNotRetried() {
        route("GET", "/issue/PROJ-9", status(404, "{\"errorMessages\":[\"Issue does not exist\"]}"));

        var thrown = assertThrows(LazyJiraException.class, () -> client.getIssue("PROJ-9"));

        assertEquals(LazyJiraException.Kind.API, thrown.getKind());
        assertEquals(Integer.valueOf(404), thrown.getStatusCode());
        assertTrue(thrown.getMessage().startsWith("API error (404)"));
        assertEquals(1, receivedRequests.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void unauthorizedIsAnAuthenticationError() {
        route("GET", "/myself", status(401, ""));

        var thrown = assertThrows(LazyJiraException.class, () -> client.getCurrentUser());

        assertEquals(LazyJiraException.Kind.AUTHENTICATION, thrown.getKind());
        assertTrue(thrown.getMessage().contains("Unauthorized (401)"));
        assertEquals(1, receivedRequests.size());
    }

    @Test
    void serverErrorsAreRetriedUntilSuccess() throws Exception {
        route(
                "GET",
                "/issue/PROJ-1",
                status(500, "oops"),
                status(502, "bad gateway"),
                ok(issueJson("10001", "PROJ-1")));

        var issue = client.getIssue("PROJ-1");

        assertEquals("PROJ-1", issue.key());
        assertEquals(3, receivedRequests.size());
        assertEquals(List.of(Duration.ofMillis(1), Duration.ofMillis(2)), sleeps);
    }

    @Test
    void retryBudgetIsBounded() {
        route("GET", "/issue/PROJ-1", status(503, "unavailable"));

        var thrown = assertThrows(LazyJiraException.class, () -> client.getIssue("PROJ-1"));

        assertEquals(Integer.valueOf(503), thrown.getStatusCode());
        assertEquals(retryConfig.maxRetries() + 1, receivedRequests.size());
    }

    @Test
    void rateLimitedResponseWaitsPenaltyThenRetries() throws Exception {
        client.close();
        client = newClient(SearchApiVersion.JQL, Sleeper.SYSTEM, Duration.ofMillis(50));
        route("GET", "/issue/PROJ-1", status(429, "slow down"), ok(issueJson("10001", "PROJ-1")));

        long start = System.nanoTime();
        var issue = client.getIssue("PROJ-1");
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertEquals("PROJ-1", issue.key());
        assertEquals(2, receivedRequests.size());
        assertTrue(elapsedMillis >= 50, "elapsed " + elapsedMillis + " ms");
    }

    @Test
    void invalidJsonIsAParseError() {
        route("GET", "/issue/PROJ-1", ok("{not json"));

        var thrown = assertThrows(LazyJiraException.class, () -> client.getIssue("PROJ-1"));

        assertEquals(LazyJiraException.Kind.PARSE, thrown.getKind());
    }

    @Test
    void invalidKeyNeverReachesTheServer() {
        var thrown = assertThrows(LazyJiraException.class, () -> client.getIssue("nokey"));

        assertEquals(LazyJiraException.Kind.VALIDATION, thrown.getKind());
        assertTrue(receivedRequests.isEmpty());
    }

    @Test
    void legacySearchReturnsFullPage() throws Exception {
        client.close();
        client = newClient(SearchApiVersion.LEGACY, sleeps::add, Duration.ofMillis(10));
        route(
                "GET",
                "/search",
                ok("{\"startAt\": 0, \"maxResults\": 2, \"total\": 5, \"issues\": [%s, %s]}"
                        .formatted(issueJson("1", "PROJ-1"), issueJson("2", "PROJ-2"))));

        var result = client.search("project = PROJ", 0, 2);

        assertEquals(List.of("PROJ-1", "PROJ-2"), result.issues().stream().map(i -> i.key()).toList());
        assertEquals(5, result.total());
        assertTrue(result.hasMore());
        var query = receivedRequests.get(0).query();
        assertTrue(query.contains("jql=project = PROJ"), query);
        assertTrue(query.contains("startAt=0"));
        assertTrue(query.contains("maxResults=2"));
    }

    @Test
    void jqlSearchFetchesIssuesInOrderAndDropsFailures() throws Exception {
        route(
                "GET",
                "/search/jql",
                ok("{\"issues\": [{\"id\": \"1\"}, {\"id\": \"2\"}, {\"id\": \"3\"}], \"isLast\": false}"));
        route("GET", "/issue/1", ok(issueJson("1", "PROJ-1")));
        route("GET", "/issue/2", status(404, "gone"));
        route("GET", "/issue/3", ok(issueJson("3", "PROJ-3")));

        var result = client.search("project = PROJ", 0, 3);

        assertEquals(List.of("PROJ-1", "PROJ-3"), result.issues().stream().map(i -> i.key()).toList());
        assertEquals(4, result.total());
        assertTrue(result.hasMore());
        assertEquals(3, result.nextStartAt());
        assertEquals(1, requestsTo("/issue/2"));
        assertTrue(receivedRequests.get(0).query().contains("fields=id"));
    }

    @Test
    void jqlSearchFailedFetchKeepsServerPagePosition() throws Exception {
        route(
                "GET",
                "/search/jql",
                ok("{\"issues\": [{\"id\": \"1\"}, {\"id\": \"2\"}, {\"id\": \"3\"}], \"isLast\": true}"));
        route("GET", "/issue/1", ok(issueJson("1", "PROJ-1")));
        route("GET", "/issue/2", status(404, "gone"));
        route("GET", "/issue/3", ok(issueJson("3", "PROJ-3")));

        var result = client.search("project = PROJ", 0, 3);

        assertEquals(2, result.issues().size());
        assertEquals(3, result.total());
        assertEquals(3, result.nextStartAt());
        assertFalse(result.hasMore());
    }

    @Test
    void jqlSearchLastPageHasNoMore() throws Exception {
        route("GET", "/search/jql", ok("{\"issues\": [{\"id\": \"1\"}], \"isLast\": true}"));
        route("GET", "/issue/1", ok(issueJson("1", "PROJ-1")));

        var result = client.search("project = PROJ", 10, 50);

        assertEquals(11, result.total());
        assertFalse(result.hasMore());
    }

    @Test
    void listCommentsAcceptsWrappedShape() throws Exception {
        route(
                "GET",
                "/issue/PROJ-1/comment",
                ok(
                        """
                        {"startAt": 0, "total": 1, "comments": [
                          {"id": "100", "author": {"accountId": "a", "displayName": "Ada"},
                           "body": {"type": "doc", "content": [
                             {"type": "paragraph", "content": [{"type": "text", "text": "Ship it"}]}]},
                           "created": "2024-01-15T10:30:00.000+0000"}
                        ]}
                        """));

        var comments = client.listComments("PROJ-1");

        assertEquals(1, comments.size());
        assertEquals("Ship it", comments.get(0).body());
        assertEquals("Ada", comments.get(0).author().displayName());
    }

    @Test
    void executeTransitionPostsIdAndComment() throws Exception {
        route("POST", "/issue/PROJ-1/transitions", status(204, ""));

        client.executeTransition("PROJ-1", "31", "Closing this");

        var request = receivedRequests.get(0);
        assertEquals("POST", request.method());
        var payload = MAPPER.readTree(request.body());
        assertEquals("31", payload.path("transition").path("id").asText());
        var body = payload.path("update").path("comment").get(0).path("add").path("body");
        assertEquals("doc", body.path("type").asText());
        assertEquals("Closing this", AdfDocument.fromJson(body).toPlainText());
    }

    @Test
    void listTransitionsParsesDestinations() throws Exception {
        route(
                "GET",
                "/issue/PROJ-1/transitions",
                ok("{\"transitions\": [{\"id\": \"11\", \"name\": \"Start\", \"to\": {\"name\": \"In Progress\"}}]}"));

        var transitions = client.listTransitions("PROJ-1");

        assertEquals(1, transitions.size());
        assertEquals("In Progress", transitions.get(0).toStatus());
    }

    @Test
    void addCommentSendsDocumentBody() throws Exception {
        route("POST", "/issue/PROJ-1/comment", new MockResponse(201, "{\"id\": \"100\"}"));

        client.addComment("PROJ-1", "line one\nline two");

        var payload = MAPPER.readTree(receivedRequests.get(0).body());
        assertEquals(2, payload.path("body").path("content").size());
        assertEquals("line one\nline two", AdfDocument.fromJson(payload.get("body")).toPlainText());
    }

    @Test
    void blankCommentIsRejectedLocally() {
        var thrown = assertThrows(LazyJiraException.class, () -> client.addComment("PROJ-1", "  "));
        assertEquals(LazyJiraException.Kind.VALIDATION, thrown.getKind());
        assertTrue(receivedRequests.isEmpty());
    }

    @Test
    void updateIssueSendsFields() throws Exception {
        route("PUT", "/issue/PROJ-1", status(204, ""));

        client.updateIssue("PROJ-1", UpdateIssueData.assignee("acc-1"));

        var request = receivedRequests.get(0);
        assertEquals("PUT", request.method());
        var fields = MAPPER.readTree(request.body()).path("fields");
        assertEquals("acc-1", fields.path("assignee").path("accountId").asText());
    }

    @Test
    void createIssueFetchesTheCreatedIssue() throws Exception {
        route("POST", "/issue", new MockResponse(201, "{\"id\": \"10001\", \"key\": \"PROJ-1\"}"));
        route("GET", "/issue/PROJ-1", ok(issueJson("10001", "PROJ-1")));

        var issue = client.createIssue(new CreateIssueData("PROJ", "Bug", "Fix login", "Details", null, "High"));

        assertEquals("PROJ-1", issue.key());
        var fields = MAPPER.readTree(receivedRequests.get(0).body()).path("fields");
        assertEquals("PROJ", fields.path("project").path("key").asText());
        assertEquals("Bug", fields.path("issuetype").path("name").asText());
        assertEquals("High", fields.path("priority").path("name").asText());
        assertEquals("Details", AdfDocument.fromJson(fields.get("description")).toPlainText());
        assertFalse(fields.has("assignee"));
    }

    @Test
    void currentUserComesFromMyself() throws Exception {
        route("GET", "/myself", ok("{\"accountId\": \"abc\", \"displayName\": \"Ada\"}"));

        var me = client.getCurrentUser();

        assertEquals("abc", me.accountId());
        assertEquals("Ada", me.displayName());
    }

    @Test
    void connectionProbeUsesSearch() {
        route("GET", "/search/jql", ok("{\"issues\": [], \"isLast\": true}"));

        assertTrue(ConnectionValidator.testConnection(client).isConnected());
    }

    @Test
    void unreachableServerIsANetworkError() {
        mockServer.stop(0);
        mockServer = null;

        var status = ConnectionValidator.testConnection(client);

        assertEquals(ConnectionStatus.NETWORK_ERROR, status);
    }
}
