package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.model.Comment;
import io.github.jbellis.lazyjira.model.Issue;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Renders one issue with its fields, description and comments. Rows past {@code height} are dropped. */
public final class TicketDetailView {
    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    private TicketDetailView() {}

    public static List<AttributedString> render(AppState state, int width, int height) {
        var lines = new ArrayList<AttributedString>();
        var issue = state.detailIssue();
        if (issue == null) {
            var key = state.currentIssueKey();
            lines.add(new AttributedString(
                    state.isDetailLoading() ? "Loading %s...".formatted(key) : "No ticket loaded", Theme.DIM));
            return lines;
        }

        lines.add(new AttributedString(issue.key() + "  " + issue.summary(), Theme.BOLD));
        lines.add(AttributedString.EMPTY);
        lines.add(field("Status", issue.status().name(), Theme.status(issue.status().category())));
        lines.add(field("Priority", issue.priority().displayName(), Theme.priority(issue.priority())));
        lines.add(field("Type", issue.issueType(), Theme.NORMAL));
        lines.add(field("Project", issue.projectKey(), Theme.NORMAL));
        var assignee = issue.assignee() == null ? "Unassigned" : issue.assignee().displayName();
        lines.add(field("Assignee", assignee, Theme.NORMAL));
        lines.add(field("Created", format(issue.created()), Theme.NORMAL));
        lines.add(field("Updated", format(issue.updated()), Theme.NORMAL));
        lines.add(AttributedString.EMPTY);

        lines.add(new AttributedString("Description", Theme.BOLD));
        appendWrapped(lines, description(issue), width - 2);
        lines.add(AttributedString.EMPTY);

        var comments = state.detailComments();
        lines.add(new AttributedString("Comments (%d)".formatted(comments.size()), Theme.BOLD));
        if (state.isDetailLoading()) {
            lines.add(new AttributedString("  Loading...", Theme.DIM));
        } else if (comments.isEmpty()) {
            lines.add(new AttributedString("  No comments", Theme.DIM));
        }
        for (var comment : comments) {
            lines.add(commentHeader(comment));
            appendWrapped(lines, comment.body(), width - 2);
        }

        var fitted = new ArrayList<AttributedString>(Math.min(lines.size(), height));
        for (int i = 0; i < lines.size() && i < height; i++) {
            fitted.add(TextLayout.fit(lines.get(i), width));
        }
        return fitted;
    }

    private static String description(Issue issue) {
        var description = issue.description();
        return description == null || description.isBlank() ? "(no description)" : description;
    }

    private static AttributedString field(String label, String value, AttributedStyle style) {
        var sb = new AttributedStringBuilder();
        sb.append(TextLayout.pad(label + ":", 11), Theme.DIM);
        sb.append(value, style);
        return sb.toAttributedString();
    }

    private static AttributedString commentHeader(Comment comment) {
        var sb = new AttributedStringBuilder();
        sb.append("  ");
        sb.append(comment.author().displayName(), Theme.BOLD);
        sb.append(" · " + format(comment.created()), Theme.DIM);
        if (comment.updated() != null && !comment.updated().equals(comment.created())) {
            sb.append(" (edited)", Theme.DIM);
        }
        return sb.toAttributedString();
    }

    private static void appendWrapped(List<AttributedString> lines, String text, int width) {
        for (var line : TextLayout.wrap(text, Math.max(1, width))) {
            lines.add(new AttributedString("  " + line));
        }
    }

    static String format(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }
}
