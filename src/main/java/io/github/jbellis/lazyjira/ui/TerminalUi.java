package io.github.jbellis.lazyjira.ui;

import io.github.jbellis.lazyjira.app.AppController;
import io.github.jbellis.lazyjira.app.AppEvent;
import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.app.ViewMode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jline.keymap.BindingReader;
import org.jline.keymap.KeyMap;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.Display;

/**
 * The interactive loop: draw, read one key binding, hand the event to the controller, repeat. The controller's
 * handler finishes before the next key is read.
 */
public class TerminalUi {
    private static final Logger logger = LogManager.getLogger(TerminalUi.class);
    private static final int ESC = 27;

    private final Terminal terminal;
    private final Display display;
    private final BindingReader bindingReader;
    private final KeyMap<AppEvent> keyMap;
    private final AtomicBoolean resized = new AtomicBoolean(true);
    private @Nullable AppController controller;

    public TerminalUi(Terminal terminal) {
        this.terminal = terminal;
        this.display = new Display(terminal, true);
        this.bindingReader = new BindingReader(terminal.reader());
        this.keyMap = KeyBindings.create(terminal);
        terminal.handle(Terminal.Signal.WINCH, signal -> resized.set(true));
    }

    /** Repaint hook for the controller while it is mid-handler. */
    public void onStateChanged() {
        if (controller != null) {
            draw(controller.state(), null);
        }
    }

    public void run(AppController controller) {
        this.controller = controller;
        var state = controller.state();
        controller.loadInitial();

        while (state.isRunning()) {
            draw(state, null);
            var event = bindingReader.readBinding(keyMap);
            if (event == null) {
                logger.info("Input closed, exiting");
                controller.handle(AppEvent.QUIT);
                break;
            }
            if (event == AppEvent.ADD_COMMENT && state.viewMode() == ViewMode.DETAIL) {
                var text = promptComment(state);
                if (text != null && !text.isBlank()) {
                    controller.submitComment(text);
                }
                continue;
            }
            controller.handle(event);
        }
    }

    /** Inline single-line prompt on the status row. Returns null when cancelled. */
    private @Nullable String promptComment(AppState state) {
        var text = new StringBuilder();
        while (true) {
            draw(state, text.toString());
            int c = bindingReader.readCharacter();
            if (c == -1 || c == ESC) {
                return null;
            }
            if (c == '\r' || c == '\n') {
                return text.toString();
            }
            if (c == 127 || c == '\b') {
                if (text.length() > 0) {
                    text.setLength(text.length() - 1);
                }
            } else if (!Character.isISOControl(c)) {
                text.appendCodePoint(c);
            }
        }
    }

    private void draw(AppState state, @Nullable String prompt) {
        var size = terminal.getSize();
        if (resized.getAndSet(false)) {
            display.clear();
            display.resize(size.getRows(), size.getColumns());
        }
        display.update(frame(state, prompt, size.getColumns(), size.getRows()), 0);
        terminal.flush();
    }

    /** Full screen: header, the current view padded to fill, footer. */
    static List<AttributedString> frame(AppState state, @Nullable String prompt, int width, int height) {
        int bodyHeight = Math.max(0, height - 2);
        var body = switch (state.viewMode()) {
            case LIST -> TicketListView.render(state, width, bodyHeight);
            case DETAIL -> TicketDetailView.render(state, width, bodyHeight);
            case TRANSITIONS -> TransitionListView.render(state, width, bodyHeight);
            case CREATE_TICKET -> List.of(new AttributedString("Ticket creation is not available yet.", Theme.DIM));
        };

        var lines = new ArrayList<AttributedString>(height);
        lines.add(StatusLine.header(state, width));
        for (int i = 0; i < bodyHeight; i++) {
            lines.add(i < body.size() ? body.get(i) : AttributedString.EMPTY);
        }
        lines.add(StatusLine.footer(state, prompt, width));
        return lines;
    }
}
