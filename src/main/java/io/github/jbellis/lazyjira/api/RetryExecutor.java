package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.exception.LazyJiraException;
import java.time.Duration;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Exponential-backoff driver. Each attempt invokes the operation afresh, so the operation must be re-invokable
 * (build the request inside it, not outside).
 */
public final class RetryExecutor {
    private static final Logger logger = LogManager.getLogger(RetryExecutor.class);

    /** Client errors that will fail the same way on every attempt. */
    private static final Set<Integer> NON_RETRYABLE_STATUSES = Set.of(400, 401, 403, 404, 422);

    @FunctionalInterface
    public interface Operation<T> {
        T call() throws LazyJiraException;
    }

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.SYSTEM);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code operation} up to {@code maxRetries + 1} times.
     *
     * <p>Authentication and validation failures, and API failures with status 400/401/403/404/422, are rethrown at
     * once regardless of the remaining budget. Every other failure is retried after the current delay; the delay then
     * grows by the multiplier up to the configured maximum. The last failure is rethrown once the budget is spent.
     */
    public <T> T retry(RetryConfig config, Operation<T> operation) throws LazyJiraException {
        Duration delay = config.initialDelay();
        for (int attempt = 0; ; attempt++) {
            try {
                return operation.call();
            } catch (LazyJiraException e) {
                if (abortsImmediately(e)) {
                    logger.debug("Not retrying {} failure: {}", e.getKind(), e.getMessage());
                    throw e;
                }
                if (attempt >= config.maxRetries()) {
                    logger.warn("Giving up after {} attempt(s): {}", attempt + 1, e.getMessage());
                    throw e;
                }
                logger.warn(
                        "Attempt {} of {} failed ({}), retrying in {} ms",
                        attempt + 1,
                        config.maxRetries() + 1,
                        e.getMessage(),
                        delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    var interrupted = new LazyJiraException(
                            LazyJiraException.Kind.INTERNAL, "Interrupted during retry backoff", ie);
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
                delay = config.nextDelay(delay);
            }
        }
    }

    /** Pre-filter for callers that do not run the full loop. */
    public static boolean isRetryable(LazyJiraException e) {
        return e.isRetryable();
    }

    static boolean abortsImmediately(LazyJiraException e) {
        return switch (e.getKind()) {
            case AUTHENTICATION, VALIDATION -> true;
            case API -> e.getStatusCode() != null && NON_RETRYABLE_STATUSES.contains(e.getStatusCode());
            default -> false;
        };
    }
}
