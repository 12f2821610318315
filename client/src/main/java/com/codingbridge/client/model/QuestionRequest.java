package com.codingbridge.client.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured question the agent asks through its {@code AskUserQuestion} tool.
 *
 * Input shape: {@code {questions:[{question, header?, multiSelect?, options:[{label, description?}]}]}}.
 */
public record QuestionRequest(String requestId, List<Question> questions) {

    public static final String TOOL_NAME = "AskUserQuestion";

    public record Question(String question, String header, boolean multiSelect, List<Option> options) {}

    public record Option(String label, String description) {}

    public QuestionRequest {
        questions = List.copyOf(questions);
    }

    /** @return the parsed request, or null when no question could be read from {@code input} */
    public static QuestionRequest from(String requestId, JsonNode input) {
        JsonNode arr = input == null ? null : input.get("questions");
        if (arr == null || !arr.isArray()) return null;

        List<Question> parsed = new ArrayList<>();
        for (JsonNode q : arr) {
            JsonNode text = q.get("question");
            if (text == null || !text.isTextual()) continue;
            List<Option> options = new ArrayList<>();
            for (JsonNode o : q.path("options")) {
                JsonNode label = o.get("label");
                if (label == null || !label.isTextual()) continue;
                JsonNode desc = o.get("description");
                options.add(new Option(label.asText(), desc != null && desc.isTextual() ? desc.asText() : null));
            }
            JsonNode header = q.get("header");
            parsed.add(new Question(
                    text.asText(),
                    header != null && header.isTextual() ? header.asText() : null,
                    q.path("multiSelect").asBoolean(false),
                    List.copyOf(options)));
        }
        return parsed.isEmpty() ? null : new QuestionRequest(requestId, parsed);
    }
}
