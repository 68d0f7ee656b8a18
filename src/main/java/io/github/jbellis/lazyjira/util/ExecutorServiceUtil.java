package io.github.jbellis.lazyjira.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** Fixed pool of daemon threads named {@code threadPrefix1..n}; uncaught failures go to the global handler. */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        var factory = new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(threadPrefix + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler((thr, ex) -> GlobalExceptionHandler.handle(thr, ex, s -> {}));
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }

    /** Stops accepting work and waits briefly for running tasks; in-flight requests are not cancelled. */
    public static void shutdownQuietly(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.debug("{} still busy after shutdown grace period", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while shutting down {}", name);
        }
    }
}
