package io.gridflow.renewables;

import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import io.gridflow.core.Sink;
import io.gridflow.metrics.Metrics;
import io.gridflow.renewables.extract.ExtractionOrchestrator;
import io.gridflow.renewables.extract.TrailingWindow;
import io.gridflow.renewables.quality.QualityGate;
import io.gridflow.renewables.transform.RenewablesTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One batch run: extract, transform, quality gate, load. Any failure aborts the run; nothing is written
 * unless every stage before the load succeeded.
 */
public class EtlRunner {
    private static final Logger log = LoggerFactory.getLogger(EtlRunner.class);

    private final EtlConfig config;
    private final ExtractionOrchestrator extractor;
    private final RenewablesTransformer transformer;
    private final QualityGate gate;
    private final Sink<WeeklyBatch> loader;
    private final Clock clock;
    private final Metrics metrics;

    public EtlRunner(EtlConfig config, ExtractionOrchestrator extractor, RenewablesTransformer transformer,
                     QualityGate gate, Sink<WeeklyBatch> loader, Clock clock, Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.extractor = Objects.requireNonNull(extractor);
        this.transformer = Objects.requireNonNull(transformer);
        this.gate = Objects.requireNonNull(gate);
        this.loader = Objects.requireNonNull(loader);
        this.clock = Objects.requireNonNull(clock);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /** @return the normalized tables that were loaded */
    public SeriesTables run() throws EtlRunException {
        long start = System.nanoTime();
        Timer.Context total = metrics.timer("etl.run.time").time();
        LocalDate referenceDay = TrailingWindow.today(clock);
        log.info("ETL pipeline started for reference day {}", referenceDay);
        Stage stage = Stage.EXTRACT;
        try {
            SeriesTables raw = extract(referenceDay);

            stage = Stage.TRANSFORM;
            SeriesTables normalized = transformer.transform(raw);

            stage = Stage.QUALITY;
            gate.evaluate(normalized.byName());
            log.info("Data quality checks passed. Loading data...");

            stage = Stage.LOAD;
            loader.accept(new WeeklyBatch(referenceDay, normalized));
            return normalized;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("ETL pipeline interrupted during {}", stage);
            throw new EtlRunException(stage, e);
        } catch (Exception e) {
            log.error("ETL pipeline failed during {}: {}", stage, e.getMessage(), e);
            throw new EtlRunException(stage, e);
        } finally {
            total.stop();
            log.info("ETL pipeline finished in {}s", seconds(System.nanoTime() - start));
            report();
        }
    }

    private SeriesTables extract(LocalDate referenceDay) throws Exception {
        long t0 = System.nanoTime();
        try (Timer.Context ignored = metrics.timer("etl.extract.time").time()) {
            SeriesTables raw = extractor.extract(referenceDay, config.apiKey());
            log.info("Data extraction completed in {}s ({} wind rows, {} solar rows)",
                    seconds(System.nanoTime() - t0), raw.wind().size(), raw.solar().size());
            return raw;
        } catch (Exception e) {
            log.info("Data extraction aborted after {}s", seconds(System.nanoTime() - t0));
            throw e;
        }
    }

    private void report() {
        Slf4jReporter.forRegistry(metrics.registry())
                .outputTo(LoggerFactory.getLogger("io.gridflow.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build()
                .report();
    }

    private static String seconds(long nanos) {
        return String.format("%.3f", nanos / 1_000_000_000.0);
    }
}
