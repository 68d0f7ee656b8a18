package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.model.Issue;
import java.util.ArrayList;
import java.util.List;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;

/** Renders the issue list: one row per issue, the focused row highlighted, scrolled to keep focus visible. */
public final class TicketListView {
    private static final int KEY_WIDTH = 12;
    private static final int STATUS_WIDTH = 14;
    private static final int PRIORITY_WIDTH = 8;

    private TicketListView() {}

    public static List<AttributedString> render(AppState state, int width, int height) {
        var lines = new ArrayList<AttributedString>();
        var list = state.issueList();
        var title = "Tickets (%d%s)".formatted(list.size(), list.hasMore() ? "+" : "");
        lines.add(TextLayout.fit(new AttributedString(title, Theme.BOLD), width));
        int rows = Math.max(0, height - 1);

        if (state.isListLoading() && list.size() == 0) {
            lines.add(new AttributedString("Loading tickets...", Theme.DIM));
            return lines;
        }
        if (list.size() == 0) {
            lines.add(new AttributedString("No tickets found. Press r to refresh.", Theme.DIM));
            return lines;
        }

        var issues = list.issues();
        int focused = Math.max(0, list.focusedIndex());
        int offset = rows == 0 ? 0 : Math.max(0, focused - rows + 1);
        for (int i = offset; i < issues.size() && lines.size() <= rows; i++) {
            var issue = issues.get(i);
            lines.add(TextLayout.fit(row(issue, i == list.focusedIndex(), list.isSelected(issue), width), width));
        }
        return lines;
    }

    static AttributedString row(Issue issue, boolean focused, boolean selected, int width) {
        var marker = selected ? "✓ " : "  ";
        var key = TextLayout.pad(issue.key(), KEY_WIDTH);
        var status = TextLayout.pad("[" + issue.status().name() + "]", STATUS_WIDTH);
        var priority = TextLayout.pad(issue.priority().displayName(), PRIORITY_WIDTH);
        var assignee = issue.assignee() == null ? "" : " • " + issue.assignee().displayName();

        if (focused) {
            var plain = marker + key + status + priority + issue.summary() + assignee;
            return new AttributedString(TextLayout.pad(plain, width), Theme.FOCUSED);
        }
        var sb = new AttributedStringBuilder();
        sb.append(marker, Theme.SUCCESS);
        sb.append(key, Theme.BOLD);
        sb.append(status, Theme.status(issue.status().category()));
        sb.append(priority, Theme.priority(issue.priority()));
        sb.append(issue.summary());
        sb.append(assignee, Theme.DIM);
        return sb.toAttributedString();
    }
}
