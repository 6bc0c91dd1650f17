package io.gridflow.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void backoff_doubles_from_base_and_caps() {
        var p = new ExponentialBackoffRetryPolicy(5, 1_000, 5_000);
        assertEquals(1_000, p.backoffMillis(1));
        assertEquals(2_000, p.backoffMillis(2));
        assertEquals(4_000, p.backoffMillis(3));
        assertEquals(5_000, p.backoffMillis(4));
        assertEquals(5_000, p.backoffMillis(40));
    }

    @Test
    void retries_until_max_attempts() {
        var p = new ExponentialBackoffRetryPolicy(5, 1, 10);
        Exception e = new IOException("x");
        assertTrue(p.shouldRetry(1, e));
        assertTrue(p.shouldRetry(4, e));
        assertFalse(p.shouldRetry(5, e));
        assertEquals(5, p.maxAttempts());
    }

    @Test
    void only_matching_failures_are_retried() {
        var p = new ExponentialBackoffRetryPolicy(5, 1, 10, e -> e instanceof IOException);
        assertTrue(p.shouldRetry(1, new IOException("retry me")));
        assertFalse(p.shouldRetry(1, new IllegalStateException("fatal")));
    }

    @Test
    void clamps_nonsense_arguments() {
        var p = new ExponentialBackoffRetryPolicy(0, 0, 0);
        assertEquals(1, p.maxAttempts());
        assertEquals(1, p.backoffMillis(1));
        assertFalse(p.shouldRetry(1, new IOException()));
    }
}
