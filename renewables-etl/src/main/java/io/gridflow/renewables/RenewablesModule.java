package io.gridflow.renewables;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.gridflow.budget.ConcurrencyLimiter;
import io.gridflow.metrics.Metrics;
import io.gridflow.renewables.extract.ExtractionOrchestrator;
import io.gridflow.renewables.extract.HttpRenewablesClient;
import io.gridflow.renewables.extract.RenewablesClient;
import io.gridflow.renewables.load.PartitionedCsvLoader;
import io.gridflow.renewables.quality.NoGapsPolicy;
import io.gridflow.renewables.quality.NoNullValuesPolicy;
import io.gridflow.renewables.quality.QualityGate;
import io.gridflow.renewables.transform.RenewablesTransformer;
import io.gridflow.retry.Sleeper;
import io.gridflow.runtime.FanOutExecutor;

import java.time.Clock;
import java.util.List;

public class RenewablesModule extends AbstractModule {
    private final EtlConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    public RenewablesModule(EtlConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RenewablesModule(EtlConfig config, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    protected void configure() {
        bind(EtlConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);
        bind(Sleeper.class).toInstance(sleeper);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ConcurrencyLimiter limiter() { return new ConcurrencyLimiter(ExtractionOrchestrator.MAX_CONCURRENT_FETCHES); }

    @Provides @Singleton FanOutExecutor fanOut(ConcurrencyLimiter limiter) { return new FanOutExecutor(limiter); }

    @Provides @Singleton RenewablesClient client() { return new HttpRenewablesClient(config.baseUri()); }

    @Provides @Singleton ExtractionOrchestrator extractor(RenewablesClient client, FanOutExecutor fanOut, Metrics metrics) {
        return new ExtractionOrchestrator(client, fanOut, ExtractionOrchestrator.overloadRetryPolicy(), sleeper, metrics);
    }

    @Provides RenewablesTransformer transformer() { return new RenewablesTransformer(); }

    @Provides QualityGate qualityGate() { return new QualityGate(List.of(new NoGapsPolicy(), new NoNullValuesPolicy())); }

    @Provides PartitionedCsvLoader loader(Metrics metrics) { return new PartitionedCsvLoader(config.outputDir(), metrics); }

    @Provides EtlRunner runner(ExtractionOrchestrator extractor, RenewablesTransformer transformer, QualityGate gate,
                               PartitionedCsvLoader loader, Metrics metrics) {
        return new EtlRunner(config, extractor, transformer, gate, loader, clock, metrics);
    }
}
