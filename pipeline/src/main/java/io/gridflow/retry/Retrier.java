package io.gridflow.retry;

import java.util.Objects;

/**
 * Runs an operation under a {@link RetryPolicy}. The failure of the last attempt, or of the first attempt
 * the policy refuses to retry, is rethrown as is.
 */
public final class Retrier {
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Listener listener;

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        this(policy, sleeper, Listener.NONE);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper, Listener listener) {
        this.policy = Objects.requireNonNull(policy);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.listener = Objects.requireNonNull(listener);
    }

    public <T, X extends Exception> T call(Attempt<T, X> op) throws X, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.run();
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                if (!policy.shouldRetry(attempt, e)) {
                    if (e instanceof RuntimeException re) throw re;
                    throw Retrier.<X>checked(e);
                }
                long wait = policy.backoffMillis(attempt);
                listener.onRetry(attempt, e, wait);
                sleeper.sleep(wait);
            }
        }
    }

    // op declares only X besides unchecked exceptions
    @SuppressWarnings("unchecked")
    private static <X extends Exception> X checked(Exception e) {
        return (X) e;
    }

    @FunctionalInterface
    public interface Attempt<T, X extends Exception> {
        T run() throws X, InterruptedException;
    }

    /** Notified before each wait, with the attempt that just failed. */
    @FunctionalInterface
    public interface Listener {
        Listener NONE = (attempt, failure, waitMillis) -> {};

        void onRetry(int attempt, Exception failure, long waitMillis);
    }
}
