package io.gridflow.renewables.extract;

import io.gridflow.core.Table;
import io.gridflow.metrics.Metrics;
import io.gridflow.renewables.SeriesTables;
import io.gridflow.retry.ExponentialBackoffRetryPolicy;
import io.gridflow.retry.Retrier;
import io.gridflow.retry.RetryPolicy;
import io.gridflow.retry.Sleeper;
import io.gridflow.runtime.FanOutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pulls the trailing week of wind and solar data: one request per (day, series), all dispatched through the
 * shared concurrency limiter, merged per series in day order once every request has succeeded.
 */
public class ExtractionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    public static final int MAX_CONCURRENT_FETCHES = 100;
    public static final int MAX_ATTEMPTS = 5;
    public static final long BACKOFF_BASE_MILLIS = 1_000;
    public static final long BACKOFF_MAX_MILLIS = 5_000;

    private final RenewablesClient client;
    private final FanOutExecutor fanOut;
    private final Retrier retrier;
    private final Metrics metrics;

    public ExtractionOrchestrator(RenewablesClient client, FanOutExecutor fanOut, RetryPolicy retryPolicy,
                                  Sleeper sleeper, Metrics metrics) {
        this.client = Objects.requireNonNull(client);
        this.fanOut = Objects.requireNonNull(fanOut);
        this.metrics = Objects.requireNonNull(metrics);
        this.retrier = new Retrier(retryPolicy, sleeper, (attempt, failure, waitMillis) -> {
            metrics.counter("extract.fetch.overloads").inc();
            log.warn("Fetch attempt {} failed ({}), retrying in {} ms", attempt, failure.getMessage(), waitMillis);
        });
        metrics.gauge("extract.limiter.peak", () -> fanOut.limiter().peakInFlight());
    }

    /** Retries only the overload signal: 5 attempts, waits of 1, 2, 4 then 5 seconds. */
    public static RetryPolicy overloadRetryPolicy() {
        return new ExponentialBackoffRetryPolicy(MAX_ATTEMPTS, BACKOFF_BASE_MILLIS, BACKOFF_MAX_MILLIS,
                e -> e instanceof OverloadException);
    }

    /** Extracts the seven days before {@code windowEndExclusive}. */
    public SeriesTables extract(LocalDate windowEndExclusive, String apiKey) throws FetchException, InterruptedException {
        List<FetchRequest> requests = plan(windowEndExclusive);
        log.info("Fetching {} resources for {} .. {}", requests.size(),
                requests.get(0).date(), requests.get(requests.size() - 1).date());

        Map<FetchRequest, Table> results = fanOut.invokeAll(requests, r -> fetch(r, apiKey), FetchException.class);

        Table wind = merge(results, Series.WIND);
        Table solar = merge(results, Series.SOLAR);
        metrics.counter("extract.rows.wind").inc(wind.size());
        metrics.counter("extract.rows.solar").inc(solar.size());
        return new SeriesTables(wind, solar);
    }

    /** Requests grouped by series, days ascending within each series. */
    public static List<FetchRequest> plan(LocalDate windowEndExclusive) {
        List<LocalDate> days = TrailingWindow.endingBefore(windowEndExclusive);
        List<FetchRequest> requests = new ArrayList<>(days.size() * Series.values().length);
        for (Series s : Series.values()) {
            for (LocalDate d : days) requests.add(FetchRequest.of(d, s));
        }
        return requests;
    }

    private Table fetch(FetchRequest request, String apiKey) throws FetchException, InterruptedException {
        metrics.counter("extract.fetch.requests").inc();
        try {
            Table t = retrier.call(() -> client.fetch(request.resourcePath(), apiKey, request.format()));
            log.debug("Fetched {} rows for {}", t.size(), request);
            return t;
        } catch (FetchException e) {
            metrics.counter("extract.fetch.failures").inc();
            throw e;
        }
    }

    private static Table merge(Map<FetchRequest, Table> results, Series series) {
        List<Table> parts = new ArrayList<>();
        for (Map.Entry<FetchRequest, Table> e : results.entrySet()) {
            if (e.getKey().series() == series) parts.add(e.getValue());
        }
        return Table.concat(parts);
    }
}
