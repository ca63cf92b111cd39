package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.contract.ErrorCode;
import com.agentsubstrate.core.json.AgentJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Shared shape of the per-agent subcommands: read one JSON input, invoke the agent once and
 * print the {@link AgentResult}.
 * <p>
 * Exit code is 0 when the result is a success and 1 otherwise.
 */
abstract class AgentCommand implements Callable<Integer> {

    static final String FORMAT_JSON = "json";
    static final String FORMAT_PRETTY = "pretty";

    @Option(names = {"--input", "-i"}, description = "Agent input as a JSON object")
    String input;

    @Option(names = "--stdin", description = "Read the JSON input from standard input")
    boolean stdin;

    @Option(names = {"--execution-ref", "-e"}, description = "Execution ref (UUID); generated when omitted")
    String executionRef;

    @Option(names = {"--format", "-f"}, description = "Output format: json, pretty", defaultValue = FORMAT_JSON)
    String format;

    private final AgentInvoker invoker;

    protected AgentCommand(AgentInvoker invoker) {
        this.invoker = invoker;
    }

    protected abstract AnalyticalAgent<?, ?> agent();

    /**
     * Input built from command specific shortcuts such as {@code --objective}, or null when none was given.
     */
    protected JsonNode shortcutInput() {
        return null;
    }

    /**
     * One line describing the agent's outputs in pretty format, or null to print none.
     */
    protected String describe(JsonNode outputs) {
        return null;
    }

    @Override
    public Integer call() {
        if (!FORMAT_JSON.equals(format) && !FORMAT_PRETTY.equals(format)) {
            ConsoleOutput.error("Invalid format: " + format + ". Valid formats: json, pretty");
            return 1;
        }

        String rawInput;
        try {
            rawInput = readRawInput();
        } catch (IOException e) {
            ConsoleOutput.error("Could not read standard input: " + e.getMessage());
            return 1;
        }

        AgentResult result;
        if (rawInput == null) {
            JsonNode shortcut = shortcutInput();
            if (shortcut == null) {
                ConsoleOutput.error("No input given. Use --input, --stdin" + (supportsObjective() ? " or --objective" : ""));
                return 1;
            }
            result = invoker.invoke(agent(), shortcut, executionRef);
        } else {
            result = invokeWithJson(rawInput);
        }

        if (FORMAT_PRETTY.equals(format)) {
            ConsoleOutput.printResult(agent().metadata().name(), result,
                    result instanceof AgentResult.Success success ? describe(success.event().outputs()) : null);
        } else {
            System.out.println(AgentJson.writePretty(result));
        }
        return result.succeeded() ? 0 : 1;
    }

    protected boolean supportsObjective() {
        return false;
    }

    private AgentResult invokeWithJson(String rawInput) {
        JsonNode json;
        try {
            json = AgentJson.mapper().readTree(rawInput);
        } catch (JsonProcessingException e) {
            String ref = executionRef == null || executionRef.isBlank() ? UUID.randomUUID().toString() : executionRef;
            return new AgentResult.Failure(ErrorCode.AGENT_INVALID_INPUT,
                    "Input is not valid JSON: " + e.getOriginalMessage(), ref, Instant.now());
        }
        return invoker.invoke(agent(), json, executionRef);
    }

    private String readRawInput() throws IOException {
        if (input != null) {
            return input;
        }
        if (stdin) {
            InputStream in = System.in;
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return text.isBlank() ? null : text;
        }
        return null;
    }
}
