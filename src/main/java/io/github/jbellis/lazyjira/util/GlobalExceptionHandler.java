package io.github.jbellis.lazyjira.util;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GlobalExceptionHandler implements UncaughtExceptionHandler {
    private static final Logger logger = LogManager.getLogger(GlobalExceptionHandler.class);

    private final Consumer<String> notifier;

    public GlobalExceptionHandler() {
        this(s -> {});
    }

    /** @param notifier receives a one-line description, e.g. to show on the status line */
    GlobalExceptionHandler(Consumer<String> notifier) {
        this.notifier = notifier;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        handle(thread, throwable, notifier);
    }

    /**
     * Logs the failure and passes a short description to {@code notifier}. Interrupts and cancellations are expected
     * during shutdown and are only logged at debug.
     */
    public static void handle(Thread thread, Throwable th, Consumer<String> notifier) {
        if (isCausedBy(th, InterruptedException.class) || isCausedBy(th, CancellationException.class)) {
            logger.debug("Suppressing cancellation/interrupt on thread %s".formatted(thread.getName()), th);
            return;
        }

        logger.error("Uncaught exception on thread %s".formatted(thread), th);

        notifier.accept("Internal error %s%s"
                .formatted(th.getClass().getName(), th.getMessage() == null ? "" : ": " + th.getMessage()));

        if (isCausedBy(th, OutOfMemoryError.class)) {
            // exit rather than halt so shutdown hooks restore the terminal
            System.exit(1);
        }
    }

    public static boolean isCausedBy(Throwable th, Class<? extends Throwable> type) {
        for (Throwable t = th; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
