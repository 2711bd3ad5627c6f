package com.openforge.mnemo.config;

import com.openforge.mnemo.embedding.EmbeddingProperties;
import com.openforge.mnemo.llm.LlmProperties;
import com.openforge.mnemo.storage.StorageMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready:
 * storage mode, LLM providers (API keys masked), embedding model and memory tuning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final StorageMode         storageMode;
    private final LlmProperties       llmProperties;
    private final EmbeddingProperties embeddingProperties;
    private final MemoryProperties    memoryProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        MemoryProperties.Extraction extraction = memoryProperties.extraction();
        MemoryProperties.Retrieval  retrieval  = memoryProperties.retrieval();
        MemoryProperties.Forgetting forgetting = memoryProperties.forgetting();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Mnemo  -  Startup Summary                   ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ║    Storage Mode   : {}
                ║    Milvus         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Extraction     : window={} overlap={} min-conf={}
                ║    Retrieval      : top-k={} threshold={} rrf-k={}
                ║    Forgetting     : threshold={} decay={} boost={} cap={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                System.getProperty("java.version"),
                storageMode,
                storageMode == StorageMode.MILVUS
                        ? env.getProperty("mnemo.milvus.host", "localhost") + ":" + env.getProperty("mnemo.milvus.port", "19530")
                        : "(not used)",

                providerName(llmProperties.primary()),
                providerModel(llmProperties.primary()),
                maskKey(llmProperties.primary() == null ? null : llmProperties.primary().apiKey()),

                providerName(llmProperties.fallback()),
                providerModel(llmProperties.fallback()),
                maskKey(llmProperties.fallback() == null ? null : llmProperties.fallback().apiKey()),

                embeddingProperties.model(),
                embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(),

                extraction.windowSize(), extraction.overlap(), extraction.minConfidence(),
                retrieval.topK(), retrieval.scoreThreshold(), retrieval.rrfK(),
                forgetting.importanceThreshold(), forgetting.timeDecayFactor(),
                forgetting.accessBoostFactor(), forgetting.maxMemoriesPerUser()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String providerName(LlmProperties.ProviderConfig config) {
        return config == null ? "(not set)" : config.name();
    }

    private static String providerModel(LlmProperties.ProviderConfig config) {
        return config == null ? "-" : config.model();
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
