package io.gridflow.renewables.extract;

import io.gridflow.core.Table;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * GETs {@code {base}/{resourcePath}?api_key=...} and decodes the body in the requested format.
 */
public final class HttpRenewablesClient implements RenewablesClient {
    static final int TOO_MANY_REQUESTS = 429;

    private final HttpClient http;
    private final URI baseUri;
    private final ResponseDecoder decoder;

    public HttpRenewablesClient(URI baseUri) {
        this(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(Duration.ofSeconds(10)).build(), baseUri, new ResponseDecoder());
    }

    public HttpRenewablesClient(HttpClient http, URI baseUri, ResponseDecoder decoder) {
        this.http = Objects.requireNonNull(http);
        this.baseUri = Objects.requireNonNull(baseUri);
        this.decoder = Objects.requireNonNull(decoder);
    }

    @Override
    public Table fetch(String resourcePath, String apiKey, ResponseFormat format) throws FetchException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uriFor(resourcePath, apiKey))
                .header("Accept", format == ResponseFormat.RECORD_LIST ? "application/json" : "text/csv")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException(resourcePath, e);
        }
        int status = resp.statusCode();
        if (status == TOO_MANY_REQUESTS) throw new OverloadException(resourcePath);
        if (status < 200 || status >= 300) throw new HttpStatusException(resourcePath, status);
        return decoder.decode(resourcePath, resp.body(), format);
    }

    URI uriFor(String resourcePath, String apiKey) {
        String base = baseUri.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        String key = URLEncoder.encode(apiKey == null ? "" : apiKey, StandardCharsets.UTF_8);
        return URI.create(base + "/" + path + "?api_key=" + key);
    }
}
