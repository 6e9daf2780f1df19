package com.calcsheet.compute;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the compute sidecar. Only the unit-consistency endpoint is used here.
 */
public class ComputeServiceClient implements UnitChecker {

    static final String CHECK_UNITS_PATH = "/compute/check_units";
    private static final int DEFAULT_TIMEOUT_MS = 10_000;

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final int timeoutMs;

    public ComputeServiceClient(ObjectMapper mapper, String baseUrl, int timeoutMs) {
        this(mapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), baseUrl, timeoutMs);
    }

    public ComputeServiceClient(ObjectMapper mapper, HttpClient httpClient, String baseUrl, int timeoutMs) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public UnitCheckResult checkUnits(String expression, String expectedUnit) throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("expression", expression);
        if (expectedUnit != null) {
            payload.put("expected_unit", expectedUnit);
        }
        JsonNode response = sendJsonPost(baseUrl + CHECK_UNITS_PATH, payload);
        return mapper.treeToValue(response, UnitCheckResult.class);
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMillis(timeoutMs))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)))
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Unit check failed (" + status + "): " + response.body());
        }
        return mapper.readTree(response.body());
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    static String normalizeBaseUrl(String baseUrl) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? "http://localhost:8000" : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
