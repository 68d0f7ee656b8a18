package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.model.Priority;
import io.github.jbellis.lazyjira.model.StatusCategory;
import org.jline.utils.AttributedStyle;

/** Terminal styles shared by the views. */
public final class Theme {
    public static final AttributedStyle NORMAL = AttributedStyle.DEFAULT;
    public static final AttributedStyle HEADER =
            AttributedStyle.DEFAULT.foreground(AttributedStyle.BLACK).background(AttributedStyle.CYAN);
    public static final AttributedStyle HELP =
            AttributedStyle.DEFAULT.foreground(AttributedStyle.BLACK).background(AttributedStyle.YELLOW);
    public static final AttributedStyle FOCUSED = AttributedStyle.DEFAULT.inverse();
    public static final AttributedStyle BOLD = AttributedStyle.BOLD;
    public static final AttributedStyle DIM = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT).faint();
    public static final AttributedStyle ERROR = AttributedStyle.BOLD.foreground(AttributedStyle.RED);
    public static final AttributedStyle SUCCESS = AttributedStyle.BOLD.foreground(AttributedStyle.GREEN);
    public static final AttributedStyle WARNING = AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW);

    private Theme() {}

    public static AttributedStyle status(StatusCategory category) {
        return switch (category) {
            case TO_DO -> AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE);
            case IN_PROGRESS -> AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
            case DONE -> AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);
        };
    }

    public static AttributedStyle priority(Priority priority) {
        return switch (priority) {
            case LOWEST -> DIM;
            case LOW -> AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE);
            case MEDIUM -> AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
            case HIGH -> AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA);
            case HIGHEST, CRITICAL -> AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
        };
    }
}
