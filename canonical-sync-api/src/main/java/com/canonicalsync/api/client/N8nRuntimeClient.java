package com.canonicalsync.api.client;

import com.canonicalsync.core.client.RuntimeClient;
import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.exception.WorkflowFetchException;
import com.canonicalsync.core.model.Environment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime client for the n8n public REST API.
 *
 * Lists workflows page by page following {@code nextCursor} and authenticates
 * every call with the environment's API key. A failed listing aborts the pass;
 * an error answer for one workflow is reported against that workflow only.
 */
public class N8nRuntimeClient implements RuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(N8nRuntimeClient.class);

    static final String API_KEY_HEADER = "X-N8N-API-KEY";
    private static final String UPSTREAM = "runtime";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final int pageSize;

    public N8nRuntimeClient(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout, int pageSize) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.pageSize = pageSize;
    }

    @Override
    public List<WorkflowSummary> listWorkflowSummaries(Environment environment) {
        List<WorkflowSummary> summaries = new ArrayList<>();
        String cursor = null;
        int pages = 0;

        do {
            String uri = baseUrl(environment) + "/api/v1/workflows?limit=" + pageSize;
            if (cursor != null) {
                uri += "&cursor=" + URLEncoder.encode(cursor, StandardCharsets.UTF_8);
            }
            JsonNode page = readJson(get(environment, uri));
            for (JsonNode item : page.path("data")) {
                summaries.add(new WorkflowSummary(item.path("id").asText(), parseInstant(item.path("updatedAt"))));
            }
            JsonNode next = page.path("nextCursor");
            cursor = next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
            pages++;
        } while (cursor != null);

        log.debug("Listed {} workflows from {} in {} pages", summaries.size(), environment.environmentId(), pages);
        return summaries;
    }

    @Override
    public JsonNode fetchWorkflow(Environment environment, String workflowId) {
        String uri = baseUrl(environment) + "/api/v1/workflows/" + URLEncoder.encode(workflowId, StandardCharsets.UTF_8);
        HttpResponse<String> response = send(environment, uri);
        int status = response.statusCode();
        if (status == 404) {
            throw new NotFoundException("RuntimeWorkflow", workflowId);
        }
        if (status < 200 || status >= 300) {
            throw new WorkflowFetchException(UPSTREAM, workflowId, "HTTP " + status, null);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new WorkflowFetchException(UPSTREAM, workflowId, "malformed workflow body", e);
        }
    }

    private String get(Environment environment, String uri) {
        return requireSuccess(send(environment, uri), uri);
    }

    private HttpResponse<String> send(Environment environment, String uri) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(uri))
            .timeout(requestTimeout)
            .header(API_KEY_HEADER, environment.runtimeApiKey() != null ? environment.runtimeApiKey() : "")
            .header("Accept", "application/json")
            .GET()
            .build();

        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "request to " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(UPSTREAM, "interrupted calling " + uri, e);
        }
    }

    private String requireSuccess(HttpResponse<String> response, String uri) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new UpstreamUnavailableException(UPSTREAM, "HTTP " + status + " from " + uri, null);
        }
        return response.body();
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "malformed response body", e);
        }
    }

    private static String baseUrl(Environment environment) {
        String url = environment.runtimeBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static Instant parseInstant(JsonNode value) {
        if (!value.isTextual()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.asText()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable updatedAt from runtime: {}", value.asText());
            return null;
        }
    }
}
