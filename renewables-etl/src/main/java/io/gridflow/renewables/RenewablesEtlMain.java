package io.gridflow.renewables;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.gridflow.runtime.FanOutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI: pulls the last seven days of wind and solar generation, validates them and writes weekly partitions.
 * Exit codes: 0 success, 1 run failed, 2 usage error.
 */
@CommandLine.Command(name = "renewables-etl", mixinStandardHelpOptions = true,
        description = "Extract, validate and store the last week of wind and solar generation data")
public final class RenewablesEtlMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RenewablesEtlMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Option(names = {"-k", "--api-key"}, description = "Data source API key (default: $API_KEY)")
    String apiKey;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output root directory (default: $OUTPUT_DIR or 'output')")
    Path outDir;

    @CommandLine.Option(names = {"-u", "--base-url"}, description = "Data source base URL (default: $RENEWABLES_BASE_URL or " + EtlConfig.DEFAULT_BASE_URL + ")")
    URI baseUrl;

    private final EtlConfig baseConfig;

    public RenewablesEtlMain() {
        this(EtlConfig.fromEnv());
    }

    RenewablesEtlMain(EtlConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RenewablesEtlMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        EtlConfig cfg = baseConfig.withOverrides(apiKey, outDir, baseUrl);
        if (!cfg.hasApiKey()) {
            log.error("No API key given: pass --api-key or set API_KEY");
            return EXIT_USAGE;
        }
        return run(Guice.createInjector(new RenewablesModule(cfg)));
    }

    static int run(Injector injector) {
        EtlRunner runner = injector.getInstance(EtlRunner.class);
        try (FanOutExecutor ignored = injector.getInstance(FanOutExecutor.class)) {
            runner.run();
            return EXIT_OK;
        } catch (EtlRunException e) {
            return EXIT_FAILED;
        }
    }
}
