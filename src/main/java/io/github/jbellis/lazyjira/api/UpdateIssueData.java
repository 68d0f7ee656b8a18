package io.github.jbellis.lazyjira.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Field values for an issue edit, sent verbatim as the {@code fields} object of the PUT body. */
public record UpdateIssueData(Map<String, JsonNode> fields) {

    public UpdateIssueData {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static UpdateIssueData assignee(String accountId) {
        var assignee = JsonNodeFactory.instance.objectNode().put("accountId", accountId);
        return new UpdateIssueData(Map.of("assignee", assignee));
    }

    public static UpdateIssueData summary(String summary) {
        return new UpdateIssueData(Map.of("summary", JsonNodeFactory.instance.textNode(summary)));
    }

    public static UpdateIssueData description(String description) {
        return new UpdateIssueData(Map.of("description", AdfDocument.fromPlainText(description)));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    ObjectNode toPayload() {
        var body = JsonNodeFactory.instance.objectNode();
        var fieldsNode = body.putObject("fields");
        fields.forEach(fieldsNode::set);
        return body;
    }
}
