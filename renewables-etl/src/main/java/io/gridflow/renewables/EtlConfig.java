package io.gridflow.renewables;

import java.net.URI;
import java.nio.file.Path;

/**
 * Externally supplied settings. Everything else about a run is a fixed constant.
 */
public record EtlConfig(String apiKey, Path outputDir, URI baseUri) {
    public static final String DEFAULT_OUTPUT_DIR = "output";
    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8000";

    public static EtlConfig fromEnv() {
        String key = System.getProperty("renewables.apiKey", System.getenv("API_KEY"));
        Path out = Path.of(System.getProperty("renewables.out", System.getenv().getOrDefault("OUTPUT_DIR", DEFAULT_OUTPUT_DIR)));
        URI base = URI.create(System.getProperty("renewables.baseUrl", System.getenv().getOrDefault("RENEWABLES_BASE_URL", DEFAULT_BASE_URL)));
        return new EtlConfig(key, out, base);
    }

    /** Non-null arguments replace the corresponding values. */
    public EtlConfig withOverrides(String apiKey, Path outputDir, URI baseUri) {
        return new EtlConfig(
                apiKey != null ? apiKey : this.apiKey,
                outputDir != null ? outputDir : this.outputDir,
                baseUri != null ? baseUri : this.baseUri);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "EtlConfig{apiKey=" + (hasApiKey() ? "****" : "<unset>") + ", outputDir=" + outputDir + ", baseUri=" + baseUri + '}';
    }
}
