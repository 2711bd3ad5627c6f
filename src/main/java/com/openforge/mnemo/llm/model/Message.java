package com.openforge.mnemo.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A single entry in the chat history sent to the provider.
 *
 * role variants:
 *   "system"    persona and instructions
 *   "user"      human turn
 *   "assistant" model reply
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role("assistant").content(content).build();
    }
}
