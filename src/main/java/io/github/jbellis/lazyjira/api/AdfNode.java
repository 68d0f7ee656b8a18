package io.github.jbellis.lazyjira.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * One node of an Atlassian Document Format tree. Node kinds we do not model are kept as {@link Other} with their
 * children, so text nested inside them (tables, panels, mentions in future formats) is still reachable.
 */
public sealed interface AdfNode
        permits AdfNode.Paragraph, AdfNode.Heading, AdfNode.ListItem, AdfNode.Text, AdfNode.HardBreak, AdfNode.Other {

    record Paragraph(List<AdfNode> children) implements AdfNode {}

    record Heading(int level, List<AdfNode> children) implements AdfNode {}

    record ListItem(List<AdfNode> children) implements AdfNode {}

    record Text(String text) implements AdfNode {}

    record HardBreak() implements AdfNode {}

    record Other(String type, List<AdfNode> children) implements AdfNode {}

    /** Children of container nodes; empty for leaves. */
    default List<AdfNode> children() {
        return List.of();
    }

    static AdfNode fromJson(JsonNode json) {
        var type = json.path("type").asText("");
        return switch (type) {
            case "paragraph" -> new Paragraph(childrenOf(json));
            case "heading" -> new Heading(json.path("attrs").path("level").asInt(1), childrenOf(json));
            case "listItem" -> new ListItem(childrenOf(json));
            case "hardBreak" -> new HardBreak();
            case "text" -> {
                var text = json.get("text");
                // a text node without text carries nothing
                yield text != null && text.isTextual() ? new Text(text.asText()) : new Other(type, List.of());
            }
            default -> new Other(type, childrenOf(json));
        };
    }

    static List<AdfNode> childrenOf(JsonNode json) {
        var content = json.get("content");
        if (content == null || !content.isArray()) {
            return List.of();
        }
        var nodes = new ArrayList<AdfNode>(content.size());
        for (var child : content) {
            if (child.isObject()) {
                nodes.add(fromJson(child));
            }
        }
        return List.copyOf(nodes);
    }
}
