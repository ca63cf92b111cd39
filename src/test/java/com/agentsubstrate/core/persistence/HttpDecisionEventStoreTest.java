package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.json.AgentJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpDecisionEventStoreTest {

    private static final String REF = "3f2b8c1e-9d4a-4e6b-8f7c-1a2b3c4d5e6f";

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private PersistenceProperties properties;
    private HttpDecisionEventStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

        properties = new PersistenceProperties();
        properties.setEndpoint("http://ledger.local:8081");
        properties.setApiKey("secret");
        properties.setNamespace("team-a");
        store = new HttpDecisionEventStore(properties, httpClient);
    }

    private static DecisionEvent event() {
        return new DecisionEvent("decomposer-agent", "1.0.0", "objective_decomposition", "b".repeat(64),
                AgentJson.toTree(Map.of("k", "v")), 0.75, List.of("read_only_analysis"), REF,
                Instant.parse("2024-03-01T12:00:00Z"));
    }

    @SuppressWarnings("unchecked")
    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        return captor.getValue();
    }

    // -- store -----------------------------------------------------------------

    @Nested
    @DisplayName("store")
    class Store {

        @Test
        @DisplayName("POSTs to the events endpoint with auth and namespace headers")
        void postsEvent() throws Exception {
            when(response.statusCode()).thenReturn(201);
            when(response.body()).thenReturn("{\"id\":\"evt-77\"}");

            StoreReceipt receipt = store.store(event());

            assertEquals("evt-77", receipt.id());
            HttpRequest request = sentRequest();
            assertEquals("POST", request.method());
            assertEquals("http://ledger.local:8081/api/v1/events", request.uri().toString());
            assertEquals("Bearer secret", request.headers().firstValue("Authorization").orElseThrow());
            assertEquals("team-a", request.headers().firstValue("X-Namespace").orElseThrow());
        }

        @Test
        @DisplayName("omits the Authorization header without an API key")
        void noApiKey() throws Exception {
            properties.setApiKey("");
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("");

            StoreReceipt receipt = store.store(event());

            assertEquals(REF, receipt.id());
            assertTrue(sentRequest().headers().firstValue("Authorization").isEmpty());
        }

        @Test
        @DisplayName("non-2xx responses raise PersistenceException with the status")
        void httpError() {
            when(response.statusCode()).thenReturn(503);
            when(response.body()).thenReturn("unavailable");

            var e = assertThrows(PersistenceException.class, () -> store.store(event()));
            assertTrue(e.getMessage().contains("ruvector persistence failed: HTTP 503"));
        }

        @Test
        @DisplayName("I/O failures raise PersistenceException")
        @SuppressWarnings("unchecked")
        void ioError() throws Exception {
            when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                    .thenThrow(new IOException("connection refused"));
            var e = assertThrows(PersistenceException.class, () -> store.store(event()));
            assertInstanceOf(IOException.class, e.getCause());
        }
    }

    // -- retrieve and search ---------------------------------------------------

    @Nested
    @DisplayName("retrieve and search")
    class Reads {

        @Test
        @DisplayName("retrieve unwraps the stored payload")
        void retrieve() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"id\":\"evt-1\",\"payload\":" + AgentJson.write(event()) + "}");

            DecisionEvent found = store.retrieve(REF).orElseThrow();

            assertEquals(event(), found);
            assertEquals("http://ledger.local:8081/api/v1/events/" + REF, sentRequest().uri().toString());
        }

        @Test
        @DisplayName("retrieve maps 404 to empty")
        void retrieveMissing() {
            when(response.statusCode()).thenReturn(404);
            assertTrue(store.retrieve(REF).isEmpty());
        }

        @Test
        @DisplayName("search passes filters as query parameters")
        void search() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"events\":[{\"payload\":" + AgentJson.write(event()) + "}]}");

            List<DecisionEvent> events = store.search(new EventQuery("decomposer-agent", null,
                    Instant.parse("2024-03-01T00:00:00Z"), null, 5));

            assertEquals(1, events.size());
            String uri = sentRequest().uri().toString();
            assertTrue(uri.contains("agent_id=decomposer-agent"));
            assertTrue(uri.contains("from=2024-03-01T00%3A00%3A00Z"));
            assertTrue(uri.contains("limit=5"));
            assertFalse(uri.contains("decision_type"));
        }
    }
}
