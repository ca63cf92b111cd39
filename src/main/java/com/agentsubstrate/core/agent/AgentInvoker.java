package com.agentsubstrate.core.agent;

import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.contract.DecisionEvents;
import com.agentsubstrate.core.contract.ErrorCode;
import com.agentsubstrate.core.contract.PersistenceStatus;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.logging.MdcContext;
import com.agentsubstrate.core.persistence.DecisionEventStore;
import com.agentsubstrate.core.telemetry.AgentTelemetry;
import com.agentsubstrate.core.validation.SchemaValidator;
import com.agentsubstrate.core.validation.ValidationFailedException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Runs an {@link AnalyticalAgent} through the shared invocation pipeline:
 * validate input, analyze, validate output, score confidence, collect constraints,
 * build the decision event, persist it (best effort) and emit telemetry.
 * <p>
 * A ledger failure never fails the invocation; the result is still a success carrying
 * {@code persistence_status=skipped}. Validation and processing failures return an error
 * result and nothing is written to the ledger.
 * <p>
 * A store call still running when the persistence wait elapses is abandoned, not interrupted:
 * the event may yet reach the ledger although the result reports {@code skipped}.
 */
@Service
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final DecisionEventStore store;
    private final AgentTelemetry telemetry;
    private final Executor sideEffectExecutor;
    private final Duration persistenceWait;
    private final SchemaValidator validator;

    @Autowired
    public AgentInvoker(DecisionEventStore store,
                        AgentTelemetry telemetry,
                        @Qualifier("agentSideEffectExecutor") Executor sideEffectExecutor,
                        RuntimeProperties properties) {
        this(store, telemetry, sideEffectExecutor, properties.getPersistenceWait());
    }

    public AgentInvoker(DecisionEventStore store, AgentTelemetry telemetry,
                        Executor sideEffectExecutor, Duration persistenceWait) {
        this.store = store;
        this.telemetry = telemetry;
        this.sideEffectExecutor = sideEffectExecutor;
        this.persistenceWait = persistenceWait;
        this.validator = SchemaValidator.shared();
    }

    /**
     * Invokes {@code agent} once.
     *
     * @param agent        the agent to run
     * @param rawInput     the caller's input as JSON; hashed as-is into the decision event
     * @param executionRef UUID correlating this invocation, generated when null or blank
     * @return a success carrying exactly one decision event, or an error carrying none
     */
    public <I, O> AgentResult invoke(AnalyticalAgent<I, O> agent, JsonNode rawInput, String executionRef) {
        AgentMetadata meta = agent.metadata();
        String ref = executionRef == null || executionRef.isBlank() ? UUID.randomUUID().toString() : executionRef;
        MdcContext.setInvocation(meta.id(), ref);
        long started = System.nanoTime();
        try {
            fireAndForget(() -> telemetry.recordStart(meta.id(), ref, rawInput));

            if (!UUID_PATTERN.matcher(ref).matches()) {
                return fail(meta, ref, ErrorCode.AGENT_INVALID_INPUT, "execution_ref must be a UUID: " + ref);
            }
            if (rawInput == null || !rawInput.isObject()) {
                return fail(meta, ref, ErrorCode.AGENT_INVALID_INPUT, "Input must be a JSON object");
            }

            I input = validator.parse(rawInput, agent.inputType());
            O output = agent.analyze(input);
            validator.validate(output);

            JsonNode outputs = AgentJson.toTree(output);
            InvocationPostconditions.checkOutputs(outputs);
            double confidence = InvocationPostconditions.checkConfidence(agent.confidence(input, output));
            List<String> constraints = agent.constraintsApplied(input, output);

            DecisionEvent event = DecisionEvents.create(meta.id(), meta.version(), meta.decisionType(),
                    rawInput, outputs, confidence, constraints, ref);

            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            CompletableFuture<PersistenceStatus> persistence = persistAsync(event);
            fireAndForget(() -> telemetry.recordSuccess(meta.id(), ref, durationMs));
            PersistenceStatus persistenceStatus = awaitPersistence(persistence);

            log.info("{} produced {} (confidence {}, {}ms, ledger {})", meta.id(), meta.decisionType(),
                    String.format("%.2f", confidence), durationMs,
                    persistenceStatus.status().name().toLowerCase());
            return new AgentResult.Success(event, persistenceStatus);
        } catch (ValidationFailedException e) {
            log.warn("{} rejected invocation: {}", meta.id(), e.getMessage());
            return fail(meta, ref, ErrorClassifier.classify(e), e.getMessage());
        } catch (Exception e) {
            ErrorCode code = ErrorClassifier.classify(e);
            log.error("{} failed with {}: {}", meta.id(), code, e.getMessage(), e);
            return fail(meta, ref, code, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MdcContext.clear();
        }
    }

    private AgentResult fail(AgentMetadata meta, String ref, ErrorCode code, String message) {
        fireAndForget(() -> telemetry.recordFailure(meta.id(), ref, code, message));
        return new AgentResult.Failure(code, message, ref, Instant.now());
    }

    private CompletableFuture<PersistenceStatus> persistAsync(DecisionEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                store.store(event);
                return PersistenceStatus.persisted();
            }, sideEffectExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private PersistenceStatus awaitPersistence(CompletableFuture<PersistenceStatus> persistence) {
        try {
            return persistence.get(persistenceWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            persistence.cancel(true);
            String message = "%s persistence timed out after %dms; write outcome unknown"
                    .formatted(store.name(), persistenceWait.toMillis());
            log.warn("Decision event not persisted: {}", message);
            return PersistenceStatus.skipped(message);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("Decision event not persisted to {}: {}", store.name(), message);
            return PersistenceStatus.skipped(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PersistenceStatus.skipped(store.name() + " persistence interrupted");
        }
    }

    private void fireAndForget(Runnable task) {
        try {
            CompletableFuture.runAsync(task, sideEffectExecutor)
                    .exceptionally(ex -> {
                        log.warn("Telemetry call failed: {}", ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Telemetry call dropped: {}", e.getMessage());
        }
    }
}
