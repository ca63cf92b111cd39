package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.persistence.DecisionEventStore;
import com.agentsubstrate.core.persistence.InMemoryDecisionEventStore;
import com.agentsubstrate.core.persistence.PersistenceException;
import com.agentsubstrate.core.telemetry.NoopAgentTelemetry;
import com.agentsubstrate.engine.clarification.ObjectiveClarifierAgent;
import com.agentsubstrate.engine.decomposition.DecomposerAgent;
import com.agentsubstrate.engine.metareasoning.MetaReasonerAgent;
import com.agentsubstrate.engine.reflection.ReflectionAgent;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the substrate CLI command structure.
 * These tests exercise picocli directly without a Spring context, running the real agents
 * against an in-memory ledger.
 */
class CliTest {

    private static final String REF = "5b1f0c2a-7e3d-4a9b-8c6d-2e4f6a8b0c1d";

    /**
     * Exit code with stdout and stderr captured separately: stdout carries command results only.
     */
    private record CliResult(int exitCode, String output, String errors) {}

    private InMemoryDecisionEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDecisionEventStore();
    }

    /**
     * Custom picocli IFactory wiring every command to the given ledger.
     */
    private CommandLine.IFactory createFactory(DecisionEventStore ledger) {
        AgentInvoker invoker = new AgentInvoker(ledger, new NoopAgentTelemetry(), Runnable::run, Duration.ofSeconds(5));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DecomposeCommand.class) {
                    return (K) new DecomposeCommand(invoker, new DecomposerAgent());
                }
                if (cls == MetaReasonCommand.class) {
                    return (K) new MetaReasonCommand(invoker, new MetaReasonerAgent());
                }
                if (cls == ClarifyCommand.class) {
                    return (K) new ClarifyCommand(invoker, new ObjectiveClarifierAgent());
                }
                if (cls == ReflectCommand.class) {
                    return (K) new ReflectCommand(invoker, new ReflectionAgent());
                }
                if (cls == EventsCommand.class) {
                    return (K) new EventsCommand(ledger);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(store, null, args);
    }

    private CliResult execute(DecisionEventStore ledger, String stdin, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        ByteArrayOutputStream errCapture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, StandardCharsets.UTF_8);
        PrintStream errPrintStream = new PrintStream(errCapture, true, StandardCharsets.UTF_8);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        InputStream originalIn = System.in;
        System.setOut(capturePrintStream);
        System.setErr(errPrintStream);
        if (stdin != null) {
            System.setIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        }
        try {
            CommandLine commandLine = new CommandLine(new SubstrateCommand(), createFactory(ledger));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            errPrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8),
                    errCapture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            System.setIn(originalIn);
        }
    }

    private static JsonNode json(String text) throws Exception {
        return AgentJson.mapper().readTree(text);
    }

    // -- Help output -----------------------------------------------------------

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("decompose"), "Help should list 'decompose' subcommand");
            assertTrue(output.contains("meta-reason"), "Help should list 'meta-reason' subcommand");
            assertTrue(output.contains("clarify"), "Help should list 'clarify' subcommand");
            assertTrue(output.contains("reflect"), "Help should list 'reflect' subcommand");
            assertTrue(output.contains("events"), "Help should list 'events' subcommand");
            assertTrue(output.contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agent Substrate 0.1.0"));
        }

        @Test
        @DisplayName("decompose --help lists the input options")
        void decomposeHelp() {
            CliResult result = execute("decompose", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--objective"));
            assertTrue(result.output().contains("--stdin"));
            assertTrue(result.output().contains("--execution-ref"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AGENT SUBSTRATE"));
            assertTrue(result.output().contains("Usage: substrate"));
        }
    }

    // -- Agent commands --------------------------------------------------------

    @Nested
    @DisplayName("Agent commands")
    class AgentCommands {

        @Test
        @DisplayName("decompose --objective prints a success result and persists the event")
        void decomposeObjective() throws Exception {
            CliResult result = execute("decompose", "-o", "Deploy v2.0 to production with health checks", "-e", REF);
            assertEquals(0, result.exitCode());

            JsonNode printed = json(result.output());
            assertEquals(AgentResult.STATUS_SUCCESS, printed.get("status").asText());
            assertEquals(DecomposerAgent.DECISION_TYPE, printed.at("/event/decision_type").asText());
            assertEquals(REF, printed.at("/event/execution_ref").asText());
            assertEquals("persisted", printed.at("/persistence_status/status").asText());
            assertTrue(store.retrieve(REF).isPresent());
        }

        @Test
        @DisplayName("clarify accepts a JSON --input")
        void clarifyInput() throws Exception {
            CliResult result = execute("clarify", "--input", "{\"objective\":\"Do\"}");
            assertEquals(0, result.exitCode());
            assertEquals("insufficient", json(result.output()).at("/event/outputs/status").asText());
        }

        @Test
        @DisplayName("meta-reason reads its input from stdin")
        void metaReasonStdin() throws Exception {
            String input = """
                    {"traces": [{"agent_id": "agent-a", "decision_type": "plan_generation",
                      "execution_ref": "11111111-1111-4111-8111-111111111111",
                      "timestamp": "2024-06-01T09:00:00Z", "reported_confidence": 0.9}]}
                    """;
            CliResult result = execute(store, input, "meta-reason", "--stdin");
            assertEquals(0, result.exitCode());
            assertEquals(MetaReasonerAgent.DECISION_TYPE, json(result.output()).at("/event/decision_type").asText());
        }

        @Test
        @DisplayName("pretty format prints a readable summary")
        void prettyFormat() {
            CliResult result = execute("decompose", "-o", "Build an SDK", "-f", "pretty");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Decomposer Agent produced objective_decomposition"));
            assertTrue(result.output().contains("Ledger:"));
            assertTrue(result.output().contains("pipeline steps"));
        }

        @Test
        @DisplayName("a ledger outage still exits 0 with persistence skipped")
        void ledgerOutage() throws Exception {
            DecisionEventStore failing = mock(DecisionEventStore.class);
            when(failing.name()).thenReturn("ruvector");
            when(failing.store(any()))
                    .thenThrow(new PersistenceException("ruvector persistence failed: HTTP 503"));

            CliResult result = execute(failing, null, "decompose", "-o", "Build an SDK");
            assertEquals(0, result.exitCode());
            assertEquals("skipped", json(result.output()).at("/persistence_status/status").asText());
        }
    }

    // -- Error handling --------------------------------------------------------

    @Nested
    @DisplayName("Error handling")
    class ErrorTests {

        @Test
        @DisplayName("no input exits 1 with a hint")
        void noInput() {
            CliResult result = execute("reflect");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("No input given"));
        }

        @Test
        @DisplayName("malformed JSON exits 1 with AGENT_INVALID_INPUT")
        void invalidJson() throws Exception {
            CliResult result = execute("clarify", "--input", "{not json");
            assertEquals(1, result.exitCode());
            JsonNode printed = json(result.output());
            assertEquals(AgentResult.STATUS_ERROR, printed.get("status").asText());
            assertEquals("AGENT_INVALID_INPUT", printed.get("error_code").asText());
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("schema violations exit 1 with AGENT_VALIDATION_FAILED")
        void validationFailure() throws Exception {
            CliResult result = execute("meta-reason", "--input", "{\"traces\":[]}");
            assertEquals(1, result.exitCode());
            assertEquals("AGENT_VALIDATION_FAILED", json(result.output()).get("error_code").asText());
        }

        @Test
        @DisplayName("an unknown format exits 1")
        void invalidFormat() {
            CliResult result = execute("decompose", "-o", "Build an SDK", "-f", "xml");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Invalid format: xml"));
        }

        @Test
        @DisplayName("an unknown subcommand is a usage error")
        void unknownSubcommand() {
            CliResult result = execute("deploy");
            assertNotEquals(0, result.exitCode());
        }
    }

    // -- Events command --------------------------------------------------------

    @Nested
    @DisplayName("Events command")
    class EventsTests {

        @Test
        @DisplayName("get prints a stored event")
        void getStored() throws Exception {
            execute("decompose", "-o", "Build an SDK", "-e", REF);
            CliResult result = execute("events", "get", REF);
            assertEquals(0, result.exitCode());
            assertEquals(REF, json(result.output()).get("execution_ref").asText());
        }

        @Test
        @DisplayName("get exits 1 for an unknown execution ref")
        void getUnknown() {
            CliResult result = execute("events", "get", REF);
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Decision event not found"));
        }

        @Test
        @DisplayName("search filters by agent id")
        void search() throws Exception {
            execute("decompose", "-o", "Build an SDK");
            execute("clarify", "-o", "Build an SDK for the billing team");

            CliResult result = execute("events", "search", "--agent-id", DecomposerAgent.AGENT_ID);
            assertEquals(0, result.exitCode());
            JsonNode events = json(result.output());
            assertEquals(1, events.size());
            assertEquals(DecomposerAgent.AGENT_ID, events.get(0).get("agent_id").asText());
        }

        @Test
        @DisplayName("search rejects a malformed timestamp")
        void searchBadTimestamp() {
            CliResult result = execute("events", "search", "--from", "yesterday");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Invalid timestamp"));
        }

        @Test
        @DisplayName("a ledger failure during lookup exits 1")
        void lookupFailure() {
            DecisionEventStore failing = mock(DecisionEventStore.class);
            when(failing.retrieve(anyString())).thenThrow(new PersistenceException("ruvector request failed"));
            CliResult result = execute(failing, null, "events", "get", REF);
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Lookup failed"));
        }
    }
}
