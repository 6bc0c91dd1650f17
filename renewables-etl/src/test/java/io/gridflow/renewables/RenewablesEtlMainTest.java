package io.gridflow.renewables;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RenewablesEtlMainTest {
    @TempDir
    Path out;

    private static int execute(EtlConfig base, String... args) {
        return new CommandLine(new RenewablesEtlMain(base)).execute(args);
    }

    @Test
    void missing_api_key_is_a_usage_error() {
        EtlConfig noKey = new EtlConfig(null, Path.of("unused"), URI.create("http://127.0.0.1:1"));
        assertEquals(RenewablesEtlMain.EXIT_USAGE, execute(noKey));
        assertEquals(RenewablesEtlMain.EXIT_USAGE, execute(noKey, "--api-key", " "));
    }

    @Test
    void unknown_option_is_rejected() {
        EtlConfig cfg = new EtlConfig("k", out, URI.create("http://127.0.0.1:1"));
        assertEquals(2, execute(cfg, "--bogus"));
    }

    @Test
    void runs_against_the_configured_source() throws Exception {
        try (FakeRenewablesServer server = new FakeRenewablesServer()) {
            EtlConfig env = new EtlConfig(null, Path.of("unused"), URI.create("http://127.0.0.1:1"));
            int code = execute(env, "-k", FakeRenewablesServer.API_KEY, "-o", out.toString(),
                    "--base-url", server.baseUri().toString());

            assertEquals(RenewablesEtlMain.EXIT_OK, code);
            try (var files = Files.walk(out)) {
                assertEquals(2, files.filter(p -> p.toString().endsWith("_data.csv")).count());
            }
        }
    }

    @Test
    void failed_run_exits_with_one() throws Exception {
        try (FakeRenewablesServer server = new FakeRenewablesServer()) {
            server.stepMinutes = 24 * 60;
            EtlConfig cfg = new EtlConfig(FakeRenewablesServer.API_KEY, out, server.baseUri());
            assertEquals(RenewablesEtlMain.EXIT_FAILED, execute(cfg));
        }
    }

    @Test
    void config_overrides_only_replace_given_values() {
        EtlConfig base = new EtlConfig("k", Path.of("a"), URI.create("http://h"));
        EtlConfig merged = base.withOverrides(null, Path.of("b"), null);
        assertEquals("k", merged.apiKey());
        assertEquals(Path.of("b"), merged.outputDir());
        assertEquals(URI.create("http://h"), merged.baseUri());
        assertFalse(merged.toString().contains("k,"));
    }
}
