package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.app.ViewMode;
import org.jetbrains.annotations.Nullable;
import org.jline.utils.AttributedString;

/** Top bar (instance and view) and bottom bar (prompt, error, message or key hints). */
public final class StatusLine {
    private StatusLine() {}

    public static AttributedString header(AppState state, int width) {
        var text = " LazyJira │ %s │ %s".formatted(state.instance(), title(state.viewMode()));
        return new AttributedString(TextLayout.pad(text, width), Theme.HEADER);
    }

    /** @param prompt text being typed into an inline prompt, or null when no prompt is open */
    public static AttributedString footer(AppState state, @Nullable String prompt, int width) {
        if (prompt != null) {
            var text = "Comment (Enter to send, Esc to cancel): " + prompt + "_";
            return TextLayout.fit(new AttributedString(text), width);
        }
        if (state.lastError() != null) {
            return TextLayout.fit(new AttributedString(" " + state.lastError(), Theme.ERROR), width);
        }
        if (isLoading(state)) {
            return TextLayout.fit(new AttributedString(" Loading...", Theme.WARNING), width);
        }
        if (state.statusMessage() != null) {
            return TextLayout.fit(new AttributedString(" " + state.statusMessage(), Theme.SUCCESS), width);
        }
        return new AttributedString(TextLayout.pad(" " + hints(state.viewMode()), width), Theme.HELP);
    }

    static String hints(ViewMode viewMode) {
        return switch (viewMode) {
            case LIST -> "j/k move  Enter open  Space select  r refresh  n more  o browser  c create  q quit";
            case DETAIL -> "t transitions  s start  d resolve  a assign me  m comment  r reload  o browser  Esc back";
            case TRANSITIONS -> "j/k move  Enter apply  Esc back";
            case CREATE_TICKET -> "Esc back";
        };
    }

    private static String title(ViewMode viewMode) {
        return switch (viewMode) {
            case LIST -> "Tickets";
            case DETAIL -> "Detail";
            case TRANSITIONS -> "Transitions";
            case CREATE_TICKET -> "Create ticket";
        };
    }

    private static boolean isLoading(AppState state) {
        return state.isListLoading() || state.isDetailLoading() || state.isTransitionsLoading();
    }
}
