package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.json.AgentJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * HTTP client for the ruvector decision event ledger.
 *
 * <p>Events are appended with {@code POST /api/v1/events}, looked up by execution ref with
 * {@code GET /api/v1/events/{ref}} and listed with query parameters on {@code GET /api/v1/events}.
 * Every request carries the bearer API key (when configured) and the {@code X-Namespace} header.
 */
public class HttpDecisionEventStore implements DecisionEventStore {

    private static final Logger log = LoggerFactory.getLogger(HttpDecisionEventStore.class);

    private static final String EVENTS_PATH = "/api/v1/events";

    private final PersistenceProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpDecisionEventStore(PersistenceProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build());
    }

    HttpDecisionEventStore(PersistenceProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = AgentJson.mapper();
    }

    @Override
    public String name() {
        return "ruvector";
    }

    @Override
    public StoreReceipt store(DecisionEvent event) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("event_type", "agent." + event.decisionType());
        body.put("agent_id", event.agentId());
        body.put("agent_version", event.agentVersion());
        body.put("execution_ref", event.executionRef());
        body.set("payload", objectMapper.valueToTree(event));
        body.put("timestamp", event.timestamp().toString());

        var request = baseRequest(EVENTS_PATH)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response = send(request, "POST " + EVENTS_PATH);
        if (response.statusCode() / 100 != 2) {
            throw new PersistenceException("ruvector persistence failed: HTTP %d %s"
                    .formatted(response.statusCode(), response.body()));
        }
        JsonNode json = readJson(response.body());
        String id = json.hasNonNull("id") ? json.get("id").asText() : event.executionRef();
        log.debug("Persisted decision event {} to ruvector as {}", event.executionRef(), id);
        return new StoreReceipt(id, true);
    }

    @Override
    public Optional<DecisionEvent> retrieve(String executionRef) {
        String path = EVENTS_PATH + "/" + encode(executionRef);
        HttpResponse<String> response = send(baseRequest(path).GET().build(), "GET " + path);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            throw new PersistenceException("ruvector retrieval failed: HTTP %d %s"
                    .formatted(response.statusCode(), response.body()));
        }
        JsonNode json = readJson(response.body());
        return Optional.of(toEvent(json.has("payload") ? json.get("payload") : json));
    }

    @Override
    public List<DecisionEvent> search(EventQuery query) {
        StringJoiner params = new StringJoiner("&");
        if (query.agentId() != null) {
            params.add("agent_id=" + encode(query.agentId()));
        }
        if (query.decisionType() != null) {
            params.add("decision_type=" + encode(query.decisionType()));
        }
        if (query.fromTimestamp() != null) {
            params.add("from=" + encode(query.fromTimestamp().toString()));
        }
        if (query.toTimestamp() != null) {
            params.add("to=" + encode(query.toTimestamp().toString()));
        }
        params.add("limit=" + query.effectiveLimit());

        String path = EVENTS_PATH + "?" + params;
        HttpResponse<String> response = send(baseRequest(path).GET().build(), "GET " + path);
        if (response.statusCode() / 100 != 2) {
            throw new PersistenceException("ruvector search failed: HTTP %d %s"
                    .formatted(response.statusCode(), response.body()));
        }

        JsonNode json = readJson(response.body());
        JsonNode entries = json.isArray() ? json : json.path("events");
        List<DecisionEvent> events = new ArrayList<>();
        for (JsonNode entry : entries) {
            events.add(toEvent(entry.has("payload") ? entry.get("payload") : entry));
        }
        return events;
    }

    private HttpRequest.Builder baseRequest(String path) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getEndpoint() + path))
                .timeout(properties.getTimeout())
                .header("Accept", "application/json")
                .header("X-Namespace", properties.getNamespace());
        if (properties.hasApiKey()) {
            builder.header("Authorization", "Bearer " + properties.getApiKey());
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String description) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PersistenceException("ruvector request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("ruvector request interrupted: " + description, e);
        }
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new PersistenceException("ruvector returned malformed JSON", e);
        }
    }

    private DecisionEvent toEvent(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, DecisionEvent.class);
        } catch (IOException e) {
            throw new PersistenceException("ruvector returned an unreadable decision event", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
