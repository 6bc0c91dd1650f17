package io.gridflow.retry;

/**
 * Decides whether a failed attempt is retried and how long to wait before the next one.
 * Attempts are numbered from 1; {@code backoffMillis(n)} is the wait between attempt n and n + 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);
}
