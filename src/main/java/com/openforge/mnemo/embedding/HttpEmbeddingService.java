package com.openforge.mnemo.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.net.http.HttpClient;
import java.util.List;

/**
 * {@link EmbeddingService} over the HTTP embedding endpoint, each call wrapped in the
 * {@code embedding} retry.
 */
@Slf4j
@Service
@EnableConfigurationProperties(EmbeddingProperties.class)
public class HttpEmbeddingService implements EmbeddingService {

    private final EmbeddingClient client;
    private final Retry           retry;

    public HttpEmbeddingService(HttpClient httpClient,
                                ObjectMapper objectMapper,
                                EmbeddingProperties properties,
                                Retry embeddingRetry) {
        this.client = new EmbeddingClient(httpClient, objectMapper, properties);
        this.retry  = embeddingRetry;
    }

    @Override
    public List<Float> embed(String text) {
        return Retry.decorateSupplier(retry, () -> client.embed(text)).get();
    }

    @Override
    public List<List<Float>> embedBatch(List<String> texts) {
        return Retry.decorateSupplier(retry, () -> client.embedBatch(texts)).get();
    }

    @Override
    public double similarity(String a, String b) {
        if (a == null || a.isBlank() || b == null || b.isBlank()) return 0.0;
        List<List<Float>> vectors = embedBatch(List.of(a, b));
        return VectorMath.cosine(vectors.get(0), vectors.get(1));
    }
}
