package io.stagewise.core.execution;

import java.time.Duration;

/// Waits between retry attempts; replaceable in tests.
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
