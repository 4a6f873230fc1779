package com.example.namecrawler;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpAutocompleteClientTest {
    private HttpServer server;
    private final AtomicReference<String> rawQuery = new AtomicReference<>();
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private final AtomicReference<String> path = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            rawQuery.set(exchange.getRequestURI().getRawQuery());
            path.set(exchange.getRequestURI().getPath());
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "{\"count\": 1, \"results\": [\"a+b\"]}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void sendsEncodedPrefixAndPageSize() throws Exception {
        AutocompleteResponse response = client().query("a+b", 5);

        assertEquals(200, response.statusCode());
        assertEquals("{\"count\": 1, \"results\": [\"a+b\"]}", response.body());
        assertEquals("/v3/autocomplete", path.get());
        assertEquals("query=a%2Bb&max_results=5", rawQuery.get());
        assertEquals(HttpAutocompleteClient.USER_AGENT, userAgent.get());
    }

    @Test
    void passesErrorStatusThrough() throws Exception {
        status.set(429);

        AutocompleteResponse response = client().query("x", 10);

        assertEquals(429, response.statusCode());
    }

    @Test
    void encodesSpecialCharacters() {
        HttpAutocompleteClient client = new HttpAutocompleteClient("http://localhost:8000/", 2,
                Duration.ofSeconds(1), Duration.ofSeconds(1));

        assertEquals("http://localhost:8000/v2/autocomplete?query=%26%3F%23&max_results=12",
                client.uriFor("&?#", 12).toString());
        assertEquals("http://localhost:8000/v2/autocomplete?query=a+b&max_results=12",
                client.uriFor("a b", 12).toString());
    }

    private HttpAutocompleteClient client() {
        return new HttpAutocompleteClient("http://127.0.0.1:" + server.getAddress().getPort(), 3,
                Duration.ofSeconds(2), Duration.ofSeconds(5));
    }
}
