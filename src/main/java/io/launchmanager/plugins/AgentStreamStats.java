package io.launchmanager.plugins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.launchmanager.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running totals over an agent's {@code stream-json} output: session, model, tool usage, tokens
 * and the final result event. Fed by a single reader thread; {@link #snapshot()} may be called
 * from any thread.
 */
final class AgentStreamStats {
    private String sessionId;
    private String model;
    private final Map<String, Integer> toolCounts = new TreeMap<>();
    private long inputTokens;
    private long outputTokens;
    private String status;
    private String result;
    private double costUsd;
    private long numTurns;
    private boolean error;
    private JsonNode toolsAvailable;

    /**
     * Parses one line of the stream. Blank and non-JSON lines are ignored.
     *
     * @return true if the line was a JSON object
     */
    boolean accept(String line) {
        if (line == null || line.isBlank()) {
            return false;
        }
        JsonNode event;
        try {
            event = Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            return false;
        }
        if (event == null || !event.isObject()) {
            return false;
        }
        onEvent(event);
        return true;
    }

    synchronized void onEvent(JsonNode event) {
        if (sessionId == null && event.hasNonNull("session_id")) {
            sessionId = event.get("session_id").asText();
        }
        String type = event.path("type").asText("");
        switch (type) {
            case "system" -> {
                if ("init".equals(event.path("subtype").asText())) {
                    toolsAvailable = event.path("tools");
                }
            }
            case "assistant" -> onAssistant(event.path("message"));
            case "result" -> onResult(event);
            default -> {
            }
        }
    }

    private void onAssistant(JsonNode message) {
        if (model == null && message.hasNonNull("model")) {
            model = message.get("model").asText();
        }
        for (JsonNode item : message.path("content")) {
            if ("tool_use".equals(item.path("type").asText())) {
                toolCounts.merge(item.path("name").asText("unknown"), 1, Integer::sum);
            }
        }
        JsonNode usage = message.path("usage");
        inputTokens += usage.path("input_tokens").asLong(0L)
                + usage.path("cache_creation_input_tokens").asLong(0L)
                + usage.path("cache_read_input_tokens").asLong(0L);
        outputTokens += usage.path("output_tokens").asLong(0L);
    }

    private void onResult(JsonNode event) {
        status = event.path("subtype").asText("unknown");
        result = event.path("result").asText("");
        JsonNode cost = event.hasNonNull("cost_usd") ? event.get("cost_usd") : event.path("total_cost_usd");
        costUsd = cost.asDouble(0.0);
        numTurns = event.path("num_turns").asLong(0L);
        error = event.path("is_error").asBoolean(false);
    }

    synchronized void markFailed(String message) {
        status = "error";
        error = true;
        if (result == null) {
            result = message;
        }
    }

    /**
     * Metadata patch for the process table. Keys without a value yet are left out.
     */
    synchronized Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (sessionId != null) {
            out.put("session_id", sessionId);
        }
        if (model != null) {
            out.put("model", model);
        }
        out.put("tool_counts", new TreeMap<>(toolCounts));
        out.put("total_input_tokens", inputTokens);
        out.put("total_output_tokens", outputTokens);
        out.put("total_tokens", inputTokens + outputTokens);
        if (status != null) {
            out.put("agent_status", status);
            out.put("result", result);
            out.put("cost_usd", costUsd);
            out.put("num_turns", numTurns);
            out.put("is_error", error);
        }
        return out;
    }

    synchronized JsonNode toolsAvailable() {
        return toolsAvailable;
    }
}
