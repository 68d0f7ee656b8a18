package io.github.jbellis.lazyjira.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import io.github.jbellis.lazyjira.model.Priority;
import io.github.jbellis.lazyjira.model.Status;
import io.github.jbellis.lazyjira.model.StatusCategory;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.model.User;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps Jira REST v3 JSON trees to model objects. Stateless; every method is a pure function of its input.
 *
 * <p>Single-entity methods fail with a PARSE {@link LazyJiraException} naming the first missing required field. Batch
 * methods (comments, search pages) drop and log malformed entries instead, so one bad record cannot void a page.
 */
public final class JiraResponseParser {
    private static final Logger logger = LogManager.getLogger(JiraResponseParser.class);

    private static final DateTimeFormatter JIRA_PRIMARY_DATE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
    private static final DateTimeFormatter JIRA_LOCAL_DATE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            text -> OffsetDateTime.parse(text, JIRA_PRIMARY_DATE_FORMATTER).toInstant(),
            text -> LocalDateTime.parse(text, JIRA_LOCAL_DATE_FORMATTER).toInstant(ZoneOffset.UTC),
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_DATE_TIME).toInstant(),
            Instant::parse);

    private JiraResponseParser() {}

    public static Issue parseIssue(JsonNode json) throws LazyJiraException {
        var id = requireText(json, "id");
        var key = requireText(json, "key");
        var fields = json.get("fields");
        if (fields == null || !fields.isObject()) {
            throw LazyJiraException.parse("fields", "Missing 'fields' object in issue " + key);
        }

        var summary = requireText(fields, "summary");
        var status = parseStatus(fields.get("status"));
        var issueType = requireText(requireObject(fields, "issuetype"), "name", "issuetype.name");
        var projectKey = requireText(requireObject(fields, "project"), "key", "project.key");
        var created = parseTimestamp(fields.get("created"), "created");
        var updated = parseTimestamp(fields.get("updated"), "updated");

        var assigneeNode = fields.get("assignee");
        User assignee = isAbsent(assigneeNode) ? null : parseUser(assigneeNode, "assignee.accountId");

        var description = AdfDocument.fromJson(fields.get("description"));

        return new Issue(
                id,
                key,
                summary,
                status,
                assignee,
                parsePriority(fields.get("priority")),
                issueType,
                projectKey,
                description.isEmpty() ? null : description.toPlainText(),
                created,
                updated);
    }

    static Status parseStatus(@Nullable JsonNode status) throws LazyJiraException {
        if (isAbsent(status)) {
            throw LazyJiraException.parse("status", "Missing required field 'status'");
        }
        var id = requireText(status, "id", "status.id");
        var name = requireText(status, "name", "status.name");
        var categoryNode = requireObject(status, "statusCategory", "status.statusCategory");
        var categoryKey = requireText(categoryNode, "key", "status.statusCategory.key");
        var category = StatusCategory.fromKey(categoryKey)
                .orElseThrow(() -> LazyJiraException.parse(
                        "status.statusCategory.key", "Unknown status category '%s'".formatted(categoryKey)));
        return new Status(id, name, category);
    }

    /** Name first, then Jira's stock numeric ids, then MEDIUM. Never fails. */
    static Priority parsePriority(@Nullable JsonNode priority) {
        if (isAbsent(priority)) {
            return Priority.MEDIUM;
        }
        return Priority.fromName(textOrNull(priority, "name"))
                .or(() -> Priority.fromId(textOrNull(priority, "id")))
                .orElse(Priority.MEDIUM);
    }

    public static User parseUser(JsonNode json) throws LazyJiraException {
        return parseUser(json, "accountId");
    }

    private static User parseUser(JsonNode json, String accountIdField) throws LazyJiraException {
        var accountId = textOrNull(json, "accountId");
        if (accountId == null) {
            throw LazyJiraException.parse(accountIdField, "Missing required field '%s'".formatted(accountIdField));
        }
        var displayName = textOrNull(json, "displayName");
        return new User(accountId, displayName == null ? "Unknown" : displayName, textOrNull(json, "emailAddress"));
    }

    /**
     * Accepts either a bare array of comments or an object carrying a {@code comments} array. Entries without id,
     * without an author account, or with an unreadable {@code created} are skipped.
     */
    public static List<Comment> parseComments(JsonNode json) throws LazyJiraException {
        JsonNode array;
        if (json.isArray()) {
            array = json;
        } else {
            array = json.get("comments");
            if (array == null || !array.isArray()) {
                throw LazyJiraException.parse(
                        "comments",
                        "Expected an array or an object with a 'comments' array, got fields " + fieldNames(json));
            }
        }

        var comments = new ArrayList<Comment>(array.size());
        int index = 0;
        for (var entry : array) {
            try {
                comments.add(parseComment(entry));
            } catch (LazyJiraException e) {
                logger.warn("Skipping comment at index {}: {}", index, e.getMessage());
            }
            index++;
        }
        logger.debug("Parsed {} of {} comments", comments.size(), array.size());
        return comments;
    }

    static Comment parseComment(JsonNode json) throws LazyJiraException {
        var id = requireText(json, "id");
        var authorNode = json.get("author");
        if (isAbsent(authorNode)) {
            throw LazyJiraException.parse("author", "Missing 'author' on comment " + id);
        }
        var author = parseUser(authorNode, "author.accountId");
        var body = AdfDocument.fromJson(json.get("body")).toPlainText();
        var created = parseTimestamp(json.get("created"), "created");

        Instant updated = null;
        var updatedNode = json.get("updated");
        if (updatedNode != null && updatedNode.isTextual()) {
            try {
                updated = parseTimestamp(updatedNode, "updated");
            } catch (LazyJiraException e) {
                logger.debug("Ignoring unreadable 'updated' on comment {}: {}", id, e.getMessage());
            }
        }
        return new Comment(id, author, body, created, updated);
    }

    /**
     * Parses a search page. Paging fields fall back to the request's own {@code startAt}/{@code maxResults} and a
     * total of 0; issues may be keyed {@code issues} or {@code values}.
     */
    public static SearchResult parseSearchResults(JsonNode json, int requestedStartAt, int requestedMaxResults)
            throws LazyJiraException {
        var issuesArray = issuesArray(json);
        var issues = new ArrayList<Issue>(issuesArray.size());
        int index = 0;
        for (var entry : issuesArray) {
            try {
                issues.add(parseIssue(entry));
            } catch (LazyJiraException e) {
                logger.warn("Dropping issue at index {} of search page: {}", index, e.getMessage());
            }
            index++;
        }
        return new SearchResult(
                intOr(json, "startAt", requestedStartAt),
                intOr(json, "maxResults", requestedMaxResults),
                intOr(json, "total", 0),
                issues,
                issuesArray.size());
    }

    /** Identifiers of a {@code search/jql} page, in page order. Entries with neither id nor key are dropped. */
    public static List<String> parseSearchIds(JsonNode json) throws LazyJiraException {
        var ids = new ArrayList<String>();
        for (var entry : issuesArray(json)) {
            var id = textOrNull(entry, "id");
            if (id == null) {
                id = textOrNull(entry, "key");
            }
            if (id == null) {
                logger.warn("Dropping search entry without id or key: {}", entry);
                continue;
            }
            ids.add(id);
        }
        return ids;
    }

    public static List<Transition> parseTransitions(JsonNode json) throws LazyJiraException {
        var array = json.get("transitions");
        if (array == null || !array.isArray()) {
            throw LazyJiraException.parse("transitions", "Missing 'transitions' array, got fields " + fieldNames(json));
        }
        var transitions = new ArrayList<Transition>(array.size());
        for (var entry : array) {
            var id = requireText(entry, "id", "transitions.id");
            var name = requireText(entry, "name", "transitions.name");
            var toStatus = textOrNull(entry.path("to"), "name");
            transitions.add(new Transition(id, name, toStatus == null ? name : toStatus));
        }
        return transitions;
    }

    /**
     * Jira's offset format ({@code 2024-01-15T10:30:00.000+0000}) first, then the same without zone (read as UTC),
     * then any ISO-8601 offset date-time or instant.
     */
    static Instant parseTimestamp(@Nullable JsonNode node, String field) throws LazyJiraException {
        if (node == null || !node.isTextual()) {
            throw LazyJiraException.parse(field, "Missing required field '%s'".formatted(field));
        }
        var text = node.asText();
        DateTimeParseException last = null;
        for (var parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw LazyJiraException.parse(
                field, "Failed to parse %s timestamp '%s': %s".formatted(field, text, last.getMessage()), last);
    }

    private static JsonNode issuesArray(JsonNode json) throws LazyJiraException {
        var array = json.get("issues");
        if (array == null || !array.isArray()) {
            array = json.get("values");
        }
        if (array == null || !array.isArray()) {
            throw LazyJiraException.parse(
                    "issues", "Missing 'issues' or 'values' array, got fields " + fieldNames(json));
        }
        return array;
    }

    private static String requireText(JsonNode parent, String field) throws LazyJiraException {
        return requireText(parent, field, field);
    }

    private static String requireText(JsonNode parent, String field, String path) throws LazyJiraException {
        var value = textOrNull(parent, field);
        if (value == null) {
            throw LazyJiraException.parse(path, "Missing required field '%s'".formatted(path));
        }
        return value;
    }

    private static JsonNode requireObject(JsonNode parent, String field) throws LazyJiraException {
        return requireObject(parent, field, field);
    }

    private static JsonNode requireObject(JsonNode parent, String field, String path) throws LazyJiraException {
        var value = parent.get(field);
        if (value == null || !value.isObject()) {
            throw LazyJiraException.parse(path, "Missing required field '%s'".formatted(path));
        }
        return value;
    }

    /** Textual or numeric scalar as a string; null when missing, null or structured. */
    private static @Nullable String textOrNull(JsonNode parent, String field) {
        var value = parent.get(field);
        if (value == null || !(value.isTextual() || value.isNumber())) {
            return null;
        }
        return value.asText();
    }

    private static int intOr(JsonNode json, String field, int fallback) {
        var value = json.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : fallback;
    }

    private static boolean isAbsent(@Nullable JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static List<String> fieldNames(JsonNode json) {
        var names = new ArrayList<String>();
        json.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
