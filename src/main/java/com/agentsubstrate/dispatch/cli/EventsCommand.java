package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.persistence.DecisionEventStore;
import com.agentsubstrate.core.persistence.EventQuery;
import com.agentsubstrate.core.persistence.PersistenceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: substrate events get|search
 * <p>
 * Reads decision events back from the configured ledger.
 */
@Command(name = "events", mixinStandardHelpOptions = true, description = "Query the decision event ledger")
@Component
public class EventsCommand implements Runnable {

    private final DecisionEventStore store;

    public EventsCommand(DecisionEventStore store) {
        this.store = store;
    }

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "get", mixinStandardHelpOptions = true, description = "Show one decision event by execution ref")
    int get(@Parameters(index = "0", paramLabel = "<execution-ref>", description = "Execution ref of the event")
            String executionRef) {
        Optional<DecisionEvent> event;
        try {
            event = store.retrieve(executionRef);
        } catch (PersistenceException e) {
            ConsoleOutput.error("Lookup failed: " + e.getMessage());
            return 1;
        }
        if (event.isEmpty()) {
            ConsoleOutput.error("Decision event not found: " + executionRef);
            return 1;
        }
        System.out.println(AgentJson.writePretty(event.get()));
        return 0;
    }

    @Command(name = "search", mixinStandardHelpOptions = true, description = "List decision events, newest first")
    int search(@Option(names = "--agent-id", description = "Only events from this agent") String agentId,
               @Option(names = "--decision-type", description = "Only events of this decision type") String decisionType,
               @Option(names = "--from", description = "Earliest timestamp (ISO-8601, inclusive)") String from,
               @Option(names = "--to", description = "Latest timestamp (ISO-8601, inclusive)") String to,
               @Option(names = {"--limit", "-n"}, description = "Maximum number of events",
                       defaultValue = "" + EventQuery.DEFAULT_LIMIT) int limit) {
        EventQuery query;
        try {
            query = new EventQuery(agentId, decisionType, parseInstant(from), parseInstant(to), limit);
        } catch (DateTimeParseException e) {
            ConsoleOutput.error("Invalid timestamp: " + e.getParsedString());
            return 1;
        }

        List<DecisionEvent> events;
        try {
            events = store.search(query);
        } catch (PersistenceException e) {
            ConsoleOutput.error("Search failed: " + e.getMessage());
            return 1;
        }
        System.out.println(AgentJson.writePretty(events));
        return 0;
    }

    private static Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
