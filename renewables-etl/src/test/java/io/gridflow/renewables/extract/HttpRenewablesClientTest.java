package io.gridflow.renewables.extract;

import com.sun.net.httpserver.HttpServer;
import io.gridflow.core.Table;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class HttpRenewablesClientTest {
    HttpServer server;
    final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok/windgen.csv", ex -> {
            lastQuery.set(ex.getRequestURI().getRawQuery());
            reply(ex, 200, "a,b\n1,2\n");
        });
        server.createContext("/ok/solargen.json", ex -> reply(ex, 200, "[{\"a\":1}]"));
        server.createContext("/busy", ex -> reply(ex, 429, "Too Many Requests"));
        server.createContext("/broken", ex -> reply(ex, 500, "oops"));
        server.createContext("/garbled", ex -> reply(ex, 200, "[{"));
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private HttpRenewablesClient client() {
        return new HttpRenewablesClient(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/"));
    }

    @Test
    void fetches_and_decodes_csv_with_api_key_query() throws Exception {
        Table t = client().fetch("ok/windgen.csv", "k&y=1", ResponseFormat.ROW_TABULAR);
        assertEquals(1, t.size());
        assertEquals("2", t.get(0, "b"));
        assertEquals("api_key=k%26y%3D1", lastQuery.get());
    }

    @Test
    void fetches_and_decodes_json() throws Exception {
        Table t = client().fetch("/ok/solargen.json", "key", ResponseFormat.RECORD_LIST);
        assertEquals(1L, t.get(0, "a"));
    }

    @Test
    void status_429_is_the_overload_signal() {
        OverloadException e = assertThrows(OverloadException.class, () -> client().fetch("busy", "key", ResponseFormat.ROW_TABULAR));
        assertEquals("busy", e.resourcePath());
    }

    @Test
    void other_error_status_carries_code() {
        HttpStatusException e = assertThrows(HttpStatusException.class, () -> client().fetch("broken", "key", ResponseFormat.ROW_TABULAR));
        assertEquals(500, e.statusCode());
        HttpStatusException missing = assertThrows(HttpStatusException.class, () -> client().fetch("nowhere", "key", ResponseFormat.ROW_TABULAR));
        assertEquals(404, missing.statusCode());
    }

    @Test
    void undecodable_body_is_a_decode_error() {
        assertThrows(DecodeException.class, () -> client().fetch("garbled", "key", ResponseFormat.RECORD_LIST));
    }

    @Test
    void connection_failure_is_a_transport_error() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        var c = new HttpRenewablesClient(URI.create("http://127.0.0.1:" + closedPort));
        assertThrows(TransportException.class, () -> c.fetch("ok/windgen.csv", "key", ResponseFormat.ROW_TABULAR));
    }

    @Test
    void builds_uri_without_double_slashes() {
        var c = new HttpRenewablesClient(URI.create("http://host:8000/"));
        assertEquals(URI.create("http://host:8000/2024-06-01/renewables/windgen.csv?api_key=abc"),
                c.uriFor("2024-06-01/renewables/windgen.csv", "abc"));
    }

    private static void reply(com.sun.net.httpserver.HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
