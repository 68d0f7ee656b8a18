package io.github.jbellis.lazyjira.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Rich-text document as used by Jira for descriptions and comment bodies.
 *
 * <p>Flattening walks the tree depth-first and collects one fragment per text node (the literal text) and per hard
 * break (a newline); fragments are joined with newlines.
 */
public record AdfDocument(List<AdfNode> content) {

    public static AdfDocument fromJson(@Nullable JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return new AdfDocument(List.of());
        }
        // Some server-side renderers hand back plain strings instead of a document
        if (json.isTextual()) {
            return json.asText().isEmpty()
                    ? new AdfDocument(List.of())
                    : new AdfDocument(List.of(new AdfNode.Paragraph(List.of(new AdfNode.Text(json.asText())))));
        }
        return new AdfDocument(AdfNode.childrenOf(json));
    }

    public boolean isEmpty() {
        return fragments().isEmpty();
    }

    public String toPlainText() {
        return String.join("\n", fragments());
    }

    private List<String> fragments() {
        var parts = new ArrayList<String>();
        for (var node : content) {
            collect(node, parts);
        }
        return parts;
    }

    private static void collect(AdfNode node, List<String> parts) {
        if (node instanceof AdfNode.Text text) {
            parts.add(text.text());
        } else if (node instanceof AdfNode.HardBreak) {
            parts.add("\n");
        } else {
            for (var child : node.children()) {
                collect(child, parts);
            }
        }
    }

    /**
     * Builds the request-side document for {@code text}: one paragraph per line, blank lines become empty paragraphs.
     */
    public static ObjectNode fromPlainText(String text) {
        var factory = JsonNodeFactory.instance;
        var doc = factory.objectNode();
        doc.put("type", "doc");
        doc.put("version", 1);
        var content = doc.putArray("content");
        for (var line : text.split("\\R", -1)) {
            var paragraph = content.addObject();
            paragraph.put("type", "paragraph");
            var children = paragraph.putArray("content");
            if (!line.isEmpty()) {
                var textNode = children.addObject();
                textNode.put("type", "text");
                textNode.put("text", line);
            }
        }
        return doc;
    }
}
