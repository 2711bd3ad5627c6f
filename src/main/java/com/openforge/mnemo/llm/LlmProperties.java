package com.openforge.mnemo.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "mnemo.llm" prefix:
 *
 * mnemo:
 *   llm:
 *     temperature: 0.7
 *     max-tokens: 2048
 *     primary:
 *       name: gpt-4o-mini
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o-mini
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek-chat
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 *       timeout-seconds: 120
 *
 * {@code temperature} and {@code max-tokens} apply when a caller does not pass its own.
 */
@ConfigurationProperties(prefix = "mnemo.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback,
        @DefaultValue("0.7")  double temperature,
        @DefaultValue("2048") int    maxTokens
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
