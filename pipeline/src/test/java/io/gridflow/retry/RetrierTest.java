package io.gridflow.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetrierTest {
    private final List<Long> waits = new ArrayList<>();
    private final Sleeper recording = waits::add;
    private final RetryPolicy retryIo = new ExponentialBackoffRetryPolicy(5, 1_000, 5_000, e -> e instanceof IOException);

    @Test
    void returns_after_transient_failures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String out = new Retrier(retryIo, recording).call(() -> {
            if (calls.incrementAndGet() < 3) throw new IOException("busy");
            return "done";
        });
        assertEquals("done", out);
        assertEquals(3, calls.get());
        assertEquals(List.of(1_000L, 2_000L), waits);
    }

    @Test
    void gives_up_after_five_attempts_with_last_failure() {
        AtomicInteger calls = new AtomicInteger();
        IOException e = assertThrows(IOException.class, () -> new Retrier(retryIo, recording).call(() -> {
            throw new IOException("busy " + calls.incrementAndGet());
        }));
        assertEquals("busy 5", e.getMessage());
        assertEquals(5, calls.get());
        assertEquals(List.of(1_000L, 2_000L, 4_000L, 5_000L), waits);
    }

    @Test
    void fatal_failure_is_not_retried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> new Retrier(retryIo, recording).call(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("fatal");
        }));
        assertEquals(1, calls.get());
        assertTrue(waits.isEmpty());
    }

    @Test
    void listener_sees_each_retry() throws Exception {
        List<String> events = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        new Retrier(retryIo, recording, (attempt, failure, wait) -> events.add(attempt + ":" + failure.getMessage() + ":" + wait))
                .call(() -> {
                    if (calls.incrementAndGet() == 1) throw new IOException("busy");
                    return 1;
                });
        assertEquals(List.of("1:busy:1000"), events);
    }
}
