package io.github.jbellis.lazyjira.api;

import java.time.Duration;

/** Blocking pause used by the rate limiter and the retry loop; swapped out in tests. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
