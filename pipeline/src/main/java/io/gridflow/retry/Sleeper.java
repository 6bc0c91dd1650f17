package io.gridflow.retry;

/**
 * Waits between retry attempts. Swapped out in tests so waits can be recorded instead of slept.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
