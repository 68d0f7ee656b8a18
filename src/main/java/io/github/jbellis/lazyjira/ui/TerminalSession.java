package io.github.jbellis.lazyjira.ui;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.InfoCmp.Capability;

/**
 * Owns the terminal for the lifetime of the interactive view: raw mode, alternate screen, hidden cursor. All three are
 * undone by {@link #close()}, which also runs from a shutdown hook if the JVM exits some other way.
 */
public final class TerminalSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TerminalSession.class);

    private final Terminal terminal;
    private final Attributes savedAttributes;
    private final Thread shutdownHook;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TerminalSession(Terminal terminal) {
        this.terminal = terminal;
        this.savedAttributes = terminal.enterRawMode();
        terminal.puts(Capability.enter_ca_mode);
        terminal.puts(Capability.keypad_xmit);
        terminal.puts(Capability.cursor_invisible);
        terminal.flush();
        this.shutdownHook = new Thread(this::restore, "lazyjira-terminal-restore");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public static TerminalSession open() {
        try {
            var terminal = TerminalBuilder.builder()
                    .system(true)
                    .nativeSignals(true)
                    .build();
            return new TerminalSession(terminal);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize terminal: " + e.getMessage(), e);
        }
    }

    public Terminal terminal() {
        return terminal;
    }

    @Override
    public void close() {
        restore();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, hook stays registered");
        }
    }

    private void restore() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            terminal.puts(Capability.cursor_visible);
            terminal.puts(Capability.keypad_local);
            terminal.puts(Capability.exit_ca_mode);
            terminal.flush();
            terminal.setAttributes(savedAttributes);
            terminal.close();
        } catch (IOException e) {
            logger.warn("Failed to restore terminal: {}", e.getMessage());
        }
    }
}
