package com.openforge.mnemo.llm;

import com.openforge.mnemo.config.AppConfig;
import com.openforge.mnemo.config.Resilience4jConfig;
import com.openforge.mnemo.llm.model.ChatRequest;
import com.openforge.mnemo.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmRouterTest {

    private static final ChatRequest HELLO = ChatRequest.builder()
            .messages(List.of(Message.user("hello")))
            .build();

    private final List<String> calledHosts = new ArrayList<>();

    private HttpClient     httpClient;
    private CircuitBreaker primaryCb;
    private LlmRouter      router;

    private HttpResponse<String> primaryReply;
    private HttpResponse<String> fallbackReply;

    @BeforeEach
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            String host = request.uri().getHost();
            calledHosts.add(host);
            return host.equals("primary.local") ? primaryReply : fallbackReply;
        }).when(httpClient).send(any(), any());

        Resilience4jConfig resilience = new Resilience4jConfig();
        CircuitBreakerRegistry breakers = resilience.circuitBreakerRegistry();
        RetryRegistry retries = resilience.retryRegistry();
        primaryCb = resilience.primaryLlmCircuitBreaker(breakers);

        LlmProperties properties = new LlmProperties(
                new LlmProperties.ProviderConfig("primary", "http://primary.local/v1", "sk-p", "gpt-4o-mini", 5),
                new LlmProperties.ProviderConfig("fallback", "http://fallback.local/v1", "sk-f", "deepseek-chat", 5),
                0.7, 2048);
        router = new LlmRouter(httpClient, new AppConfig().objectMapper(), properties,
                primaryCb, resilience.fallbackLlmCircuitBreaker(breakers),
                resilience.primaryLlmRetry(retries), resilience.fallbackLlmRetry(retries));
    }

    @Test
    void healthyPrimaryAnswersAlone() {
        primaryReply  = completion("from primary");
        fallbackReply = completion("from fallback");

        assertThat(router.chat(HELLO).text()).isEqualTo("from primary");
        assertThat(calledHosts).containsExactly("primary.local");
    }

    @Test
    void failingPrimaryFallsBack() {
        primaryReply  = response(500, "internal error");
        fallbackReply = completion("from fallback");

        assertThat(router.chat(HELLO).text()).isEqualTo("from fallback");
        assertThat(calledHosts).containsExactly("primary.local", "fallback.local");
    }

    @Test
    void rateLimitedPrimaryFallsBack() {
        primaryReply  = response(429, "slow down");
        fallbackReply = completion("from fallback");

        assertThat(router.chat(HELLO).text()).isEqualTo("from fallback");
    }

    @Test
    void openPrimaryBreakerGoesStraightToFallback() {
        primaryReply  = completion("from primary");
        fallbackReply = completion("from fallback");
        primaryCb.transitionToOpenState();

        assertThat(router.chat(HELLO).text()).isEqualTo("from fallback");
        assertThat(calledHosts).containsExactly("fallback.local");
    }

    @Test
    void bothProvidersFailingRaisesLlmException() {
        primaryReply  = response(500, "internal error");
        fallbackReply = response(503, "overloaded");

        assertThatThrownBy(() -> router.chat(HELLO))
                .isInstanceOf(LlmClient.LlmException.class)
                .hasMessageContaining("fallback provider ultimately failed")
                .hasMessageContaining("503");
        assertThat(calledHosts).containsExactly("primary.local", "fallback.local");
    }

    private static HttpResponse<String> completion(String text) {
        return response(200, """
                {"id": "chatcmpl-1", "object": "chat.completion", "created": 1, "model": "m",
                 "choices": [{"index": 0, "message": {"role": "assistant", "content": "%s"},
                              "finish_reason": "stop"}]}""".formatted(text));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
