package com.openforge.mnemo.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * {@code responseFormat} is {@code {"type": "json_object"}} for structured-output calls
 * and absent otherwise.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens,
        Map<String, String> responseFormat
) {

    public static final Map<String, String> JSON_OBJECT = Map.of("type", "json_object");
}
