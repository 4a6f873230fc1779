package com.example.namecrawler;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link AutocompleteClient} backed by the JDK HTTP client:
 * {@code GET {baseUrl}/v{N}/autocomplete?query=<prefix>&max_results=<K>}.
 */
public final class HttpAutocompleteClient implements AutocompleteClient {
    static final String USER_AGENT = "AutocompleteExtractor/1.0";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final int apiVersion;
    private final Duration requestTimeout;

    public HttpAutocompleteClient(String baseUrl, int apiVersion, Duration connectTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiVersion = apiVersion;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public AutocompleteResponse query(String prefix, int maxResults) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uriFor(prefix, maxResults))
                .timeout(requestTimeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new AutocompleteResponse(response.statusCode(), response.body());
    }

    URI uriFor(String prefix, int maxResults) {
        String query = URLEncoder.encode(prefix, StandardCharsets.UTF_8);
        return URI.create(baseUrl + "/v" + apiVersion + "/autocomplete?query=" + query + "&max_results=" + maxResults);
    }
}
