package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.app.AppState;
import java.util.ArrayList;
import java.util.List;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;

public final class TransitionListView {
    private TransitionListView() {}

    public static List<AttributedString> render(AppState state, int width, int height) {
        var lines = new ArrayList<AttributedString>();
        lines.add(new AttributedString("Transitions for " + state.currentIssueKey(), Theme.BOLD));
        var list = state.transitionList();
        if (state.isTransitionsLoading()) {
            lines.add(new AttributedString("Loading transitions...", Theme.DIM));
        } else if (list.isEmpty()) {
            lines.add(new AttributedString("No transitions available", Theme.DIM));
        } else {
            var transitions = list.transitions();
            for (int i = 0; i < transitions.size() && lines.size() < height; i++) {
                var t = transitions.get(i);
                if (i == list.focusedIndex()) {
                    var plain = "> %s → %s".formatted(t.name(), t.toStatus());
                    lines.add(new AttributedString(TextLayout.pad(plain, width), Theme.FOCUSED));
                } else {
                    var sb = new AttributedStringBuilder();
                    sb.append("  ").append(t.name()).append(" → ", Theme.DIM).append(t.toStatus(), Theme.DIM);
                    lines.add(sb.toAttributedString());
                }
            }
        }
        var fitted = new ArrayList<AttributedString>(lines.size());
        for (var line : lines) {
            fitted.add(TextLayout.fit(line, width));
        }
        return fitted;
    }
}
