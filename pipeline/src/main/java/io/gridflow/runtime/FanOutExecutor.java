package io.gridflow.runtime;

import io.gridflow.budget.ConcurrencyLimiter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task per key concurrently, each inside a {@link ConcurrencyLimiter} slot, and fans the results
 * back in keyed by their originating key in submission order. All-or-nothing: the first failure cancels
 * the remaining tasks and is rethrown.
 */
public class FanOutExecutor implements AutoCloseable {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final ConcurrencyLimiter limiter;
    private final ExecutorService pool;

    public FanOutExecutor(ConcurrencyLimiter limiter) {
        this.limiter = Objects.requireNonNull(limiter);
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "fan-out-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ConcurrencyLimiter limiter() { return limiter; }

    public <K, V, X extends Exception> Map<K, V> invokeAll(List<K> keys, KeyedTask<K, V, X> task, Class<X> failureType)
            throws X, InterruptedException {
        CompletionService<Map.Entry<K, V>> completions = new ExecutorCompletionService<>(pool);
        List<Future<Map.Entry<K, V>>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            futures.add(completions.submit(() -> {
                limiter.acquire();
                try {
                    return Map.entry(key, task.call(key));
                } finally {
                    limiter.release();
                }
            }));
        }

        Map<K, V> byKey = new LinkedHashMap<>();
        try {
            for (int i = 0; i < keys.size(); i++) {
                Map.Entry<K, V> done = completions.take().get();
                byKey.put(done.getKey(), done.getValue());
            }
        } catch (ExecutionException ee) {
            cancelAll(futures);
            throw unwrap(ee.getCause(), failureType);
        } catch (InterruptedException ie) {
            cancelAll(futures);
            throw ie;
        }

        Map<K, V> ordered = new LinkedHashMap<>();
        for (K key : keys) ordered.put(key, byKey.get(key));
        return ordered;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) f.cancel(true);
    }

    private static <X extends Exception> X unwrap(Throwable cause, Class<X> failureType) throws InterruptedException {
        if (failureType.isInstance(cause)) return failureType.cast(cause);
        if (cause instanceof InterruptedException ie) throw ie;
        if (cause instanceof RuntimeException re) throw re;
        if (cause instanceof Error err) throw err;
        throw new IllegalStateException("Task failed with undeclared exception", cause);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    @FunctionalInterface
    public interface KeyedTask<K, V, X extends Exception> {
        V call(K key) throws X, InterruptedException;
    }
}
