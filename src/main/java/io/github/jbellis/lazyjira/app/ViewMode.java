package io.github.jbellis.lazyjira.app;

public enum ViewMode {
    LIST,
    DETAIL,
    TRANSITIONS,
    /** Reserved; shows a placeholder until issue creation gets a form. */
    CREATE_TICKET
}
