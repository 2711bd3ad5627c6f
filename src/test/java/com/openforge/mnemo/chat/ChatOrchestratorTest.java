package com.openforge.mnemo.chat;

import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.llm.GenerationService;
import com.openforge.mnemo.memory.extract.MemoryExtractor;
import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.ExtractionResult;
import com.openforge.mnemo.memory.model.MemoryType;
import com.openforge.mnemo.memory.model.MessageRole;
import com.openforge.mnemo.memory.model.RetrievalQuery;
import com.openforge.mnemo.memory.model.RetrievalResult;
import com.openforge.mnemo.memory.model.RetrievalSource;
import com.openforge.mnemo.memory.model.ScoredMemory;
import com.openforge.mnemo.memory.model.SemanticCategory;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.memory.retrieve.MemoryRetriever;
import com.openforge.mnemo.storage.local.InMemoryWorkingMemoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-07-01T18:00:00Z");

    private InMemoryWorkingMemoryRepository sessions;
    private MemoryRetriever   retriever;
    private MemoryExtractor   extractor;
    private GenerationService generation;
    private ExecutorService   executor;
    private ProfileSnapshotProvider profiles;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        sessions   = new InMemoryWorkingMemoryRepository(clock, 100, 50);
        retriever  = mock(MemoryRetriever.class);
        extractor  = mock(MemoryExtractor.class);
        generation = mock(GenerationService.class);
        executor   = mock(ExecutorService.class);
        profiles   = userId -> Optional.empty();
        doAnswer(inv -> {
            inv.<Runnable>getArgument(0).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        when(retriever.retrieve(any())).thenReturn(RetrievalResult.empty());
        when(generation.generateWithHistory(anyList(), anyString())).thenReturn("Heading to the airport now.");
        when(extractor.extract(anyList(), anyString(), anyString(), anyString())).thenReturn(ExtractionResult.empty());
    }

    @Test
    void replyIsGeneratedWithMemoriesAndBothMessagesLandInTheSession() {
        when(retriever.retrieve(any())).thenReturn(new RetrievalResult(
                List.of(new ScoredMemory("mem_ep_1", MemoryType.EPISODIC, "Drove to the airport with Lisa", 0.03,
                        Set.of(RetrievalSource.SEMANTIC), Map.of())),
                List.of(SemanticMemory.builder().id("mem_sem_1").userId("u-1").subject("user").predicate("prefers")
                        .object("window seats").category(SemanticCategory.PREFERENCE).confidence(0.9).build()),
                "navigation", "plan", 1.0));

        TurnResponse response = orchestrator(MemoryProperties.defaults())
                .chat(TurnRequest.of("u-1", "s-1", "Take me to the airport"));

        assertThat(response.reply()).isEqualTo("Heading to the airport now.");
        assertThat(response.memoriesUsed()).isEqualTo(2);
        assertThat(response.extractionTriggered()).isFalse();

        String systemPrompt = capturedSystemPrompt();
        assertThat(systemPrompt).startsWith(PromptBuilder.PERSONA)
                .contains("1. Drove to the airport with Lisa (relevance 0.03)")
                .contains("- user prefers window seats");

        assertThat(sessions.get("s-1").orElseThrow().messages())
                .extracting(ConversationMessage::role, ConversationMessage::content)
                .containsExactly(
                        tuple(MessageRole.USER, "Take me to the airport"),
                        tuple(MessageRole.ASSISTANT, "Heading to the airport now."));
    }

    @Test
    void retrievalUsesTheRequestedBreadth() {
        orchestrator(MemoryProperties.defaults()).chat(new TurnRequest("u-1", "s-1", null, "hello",
                new TurnOptions(true, false, 3)));

        ArgumentCaptor<RetrievalQuery> query = ArgumentCaptor.forClass(RetrievalQuery.class);
        verify(retriever).retrieve(query.capture());
        assertThat(query.getValue().topK()).isEqualTo(3);
        assertThat(query.getValue().query()).isEqualTo("hello");
    }

    @Test
    void generationFailureYieldsTheApology() {
        when(generation.generateWithHistory(anyList(), anyString())).thenThrow(new RuntimeException("both providers down"));

        TurnResponse response = orchestrator(MemoryProperties.defaults()).chat(TurnRequest.of("u-1", "s-1", "hi"));

        assertThat(response.reply()).isEqualTo(ChatOrchestrator.APOLOGY);
        assertThat(sessions.get("s-1").orElseThrow().messages()).hasSize(2);
    }

    @Test
    void retrievalFailureDegradesToNoMemory() {
        when(retriever.retrieve(any())).thenThrow(new IllegalStateException("index offline"));

        TurnResponse response = orchestrator(MemoryProperties.defaults()).chat(TurnRequest.of("u-1", "s-1", "hi"));

        assertThat(response.reply()).isEqualTo("Heading to the airport now.");
        assertThat(response.memoriesUsed()).isZero();
        assertThat(response.memoryContext()).isNull();
        assertThat(capturedSystemPrompt()).doesNotContain("## Relevant memories");
    }

    @Test
    void memoryAndProfileCanBeSwitchedOff() {
        profiles = userId -> { throw new AssertionError("profile should not be read"); };

        orchestrator(MemoryProperties.defaults())
                .chat(new TurnRequest("u-1", "s-1", "car", "hi", TurnOptions.withoutMemory()));

        verify(retriever, never()).retrieve(any());
    }

    @Test
    void profileSnapshotIsRenderedIntoThePrompt() {
        profiles = userId -> Optional.of(new ProfileSnapshot(Map.of("name", "Sam", "home city", "Porto")));

        orchestrator(MemoryProperties.defaults()).chat(TurnRequest.of("u-1", "s-1", "hi"));

        assertThat(capturedSystemPrompt()).contains("## User profile").contains("- name: Sam").contains("- home city: Porto");
    }

    @Test
    void extractionStartsOnceTheSessionHoldsAFullWindow() {
        ChatOrchestrator chat = orchestrator(windowOf(4));

        TurnResponse first  = chat.chat(TurnRequest.of("u-1", "s-1", "one"));
        TurnResponse second = chat.chat(TurnRequest.of("u-1", "s-1", "two"));

        assertThat(first.extractionTriggered()).isFalse();
        assertThat(second.extractionTriggered()).isTrue();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ConversationMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(extractor).extract(messages.capture(), eq("u-1"), eq(TurnRequest.DEFAULT_AGENT), eq("s-1"));
        assertThat(messages.getValue()).hasSize(4);
    }

    @Test
    void extractionFailureNeverReachesTheCaller() {
        when(extractor.extract(anyList(), anyString(), anyString(), anyString()))
                .thenThrow(new RuntimeException("extraction exploded"));
        ChatOrchestrator chat = orchestrator(windowOf(2));

        TurnResponse response = chat.chat(TurnRequest.of("u-1", "s-1", "hi"));

        assertThat(response.reply()).isEqualTo("Heading to the airport now.");
        assertThat(response.extractionTriggered()).isTrue();
    }

    @Test
    void historySentToTheModelEndsWithTheUserMessage() {
        ChatOrchestrator chat = orchestrator(MemoryProperties.defaults());
        for (int i = 0; i < 7; i++) chat.chat(TurnRequest.of("u-1", "s-1", "turn " + i));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ConversationMessage>> history = ArgumentCaptor.forClass(List.class);
        verify(generation, times(7)).generateWithHistory(history.capture(), anyString());

        List<ConversationMessage> last = history.getValue();
        assertThat(last).hasSize(PromptBuilder.HISTORY_LIMIT);
        assertThat(last.get(last.size() - 1).content()).isEqualTo("turn 6");
        assertThat(last.get(last.size() - 1).role()).isEqualTo(MessageRole.USER);
    }

    private String capturedSystemPrompt() {
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generation).generateWithHistory(anyList(), prompt.capture());
        return prompt.getValue();
    }

    private ChatOrchestrator orchestrator(MemoryProperties properties) {
        return new ChatOrchestrator(sessions, retriever, extractor, generation, profiles, properties, executor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MemoryProperties windowOf(int size) {
        MemoryProperties d = MemoryProperties.defaults();
        return new MemoryProperties(d.working(), new MemoryProperties.Extraction(size, 0, 0.6), d.retrieval(), d.forgetting());
    }
}
