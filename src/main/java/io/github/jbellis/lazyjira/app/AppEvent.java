package io.github.jbellis.lazyjira.app;

/** Input events after key decoding. What each one does depends on the current {@link ViewMode}. */
public enum AppEvent {
    QUIT,
    MOVE_UP,
    MOVE_DOWN,
    /** Enter: open the focused issue, or confirm the focused transition. */
    SELECT,
    BACK,
    TOGGLE_SELECTION,
    REFRESH,
    LOAD_MORE,
    SHOW_TRANSITIONS,
    START_PROGRESS,
    RESOLVE,
    ASSIGN_TO_ME,
    /** Needs text; the view collects it and calls {@link AppController#submitComment}. */
    ADD_COMMENT,
    CREATE_TICKET,
    OPEN_IN_BROWSER,
    RESIZE,
    UNKNOWN
}
