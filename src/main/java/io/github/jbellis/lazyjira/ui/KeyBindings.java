package io.github.jbellis.lazyjira.ui;

import static org.jline.keymap.KeyMap.ctrl;
import static org.jline.keymap.KeyMap.del;
import static org.jline.keymap.KeyMap.esc;
import static org.jline.keymap.KeyMap.key;

import io.github.jbellis.lazyjira.app.AppEvent;
import org.jetbrains.annotations.Nullable;
import org.jline.keymap.KeyMap;
import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp.Capability;

/** Key sequences to {@link AppEvent}s. Unbound input decodes to {@link AppEvent#UNKNOWN}. */
public final class KeyBindings {
    /** How long a lone ESC waits for the rest of an escape sequence before counting as Esc. */
    static final long AMBIGUOUS_TIMEOUT_MS = 100;

    private KeyBindings() {}

    /**
     * @param terminal used to look up the terminal's own arrow-key sequences; the common ANSI sequences are bound
     *     either way, so null gives a usable map for tests
     */
    public static KeyMap<AppEvent> create(@Nullable Terminal terminal) {
        var keyMap = new KeyMap<AppEvent>();
        keyMap.setNomatch(AppEvent.UNKNOWN);
        keyMap.setAmbiguousTimeout(AMBIGUOUS_TIMEOUT_MS);

        keyMap.bind(AppEvent.QUIT, "q", "Q", ctrl('C'));
        keyMap.bind(AppEvent.MOVE_DOWN, "j", "\033[B", "\033OB");
        keyMap.bind(AppEvent.MOVE_UP, "k", "\033[A", "\033OA");
        keyMap.bind(AppEvent.SELECT, "\r", "\n");
        keyMap.bind(AppEvent.BACK, esc(), del(), ctrl('H'), "h", "\033[D", "\033OD");
        keyMap.bind(AppEvent.TOGGLE_SELECTION, " ");
        keyMap.bind(AppEvent.REFRESH, "r", "R");
        keyMap.bind(AppEvent.LOAD_MORE, "n");
        keyMap.bind(AppEvent.SHOW_TRANSITIONS, "t");
        keyMap.bind(AppEvent.START_PROGRESS, "s");
        keyMap.bind(AppEvent.RESOLVE, "d");
        keyMap.bind(AppEvent.ASSIGN_TO_ME, "a");
        keyMap.bind(AppEvent.ADD_COMMENT, "m");
        keyMap.bind(AppEvent.CREATE_TICKET, "c");
        keyMap.bind(AppEvent.OPEN_IN_BROWSER, "o");

        if (terminal != null) {
            bindCapability(keyMap, terminal, AppEvent.MOVE_UP, Capability.key_up);
            bindCapability(keyMap, terminal, AppEvent.MOVE_DOWN, Capability.key_down);
            bindCapability(keyMap, terminal, AppEvent.BACK, Capability.key_left);
            bindCapability(keyMap, terminal, AppEvent.BACK, Capability.key_backspace);
        }
        return keyMap;
    }

    private static void bindCapability(
            KeyMap<AppEvent> keyMap, Terminal terminal, AppEvent event, Capability capability) {
        var sequence = key(terminal, capability);
        if (sequence != null && !sequence.isEmpty()) {
            keyMap.bind(event, sequence);
        }
    }
}
