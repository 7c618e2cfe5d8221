package io.github.hide212131.langchain4j.incident.runtime.provider;

import io.github.hide212131.langchain4j.incident.runtime.config.LlmConfiguration;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LangChain4j wrapper exposing the single call the reasoning adapters need: a system instruction
 * plus a user prompt in, plain text out. Keeps cumulative call metrics.
 */
public final class LlmReasoningClient {

    private final ChatModel chatModel;
    private final Clock clock;
    private final String modelName;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();
    private final AtomicInteger cumulativeInputTokens = new AtomicInteger();
    private final AtomicInteger cumulativeOutputTokens = new AtomicInteger();

    private LlmReasoningClient(ChatModel chatModel, Clock clock, String modelName) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.modelName = modelName;
    }

    public static LlmReasoningClient forOpenAi(LlmConfiguration configuration) {
        return forOpenAi(configuration, new OpenAiChatModelFactory(), Clock.systemUTC());
    }

    static LlmReasoningClient forOpenAi(LlmConfiguration configuration, ChatModelFactory factory, Clock clock) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.openAiApiKey() == null || configuration.openAiApiKey().isBlank()) {
            throw new IllegalStateException("OPENAI_API_KEY must be set");
        }
        ChatModel chatModel = factory.create(configuration);
        return new LlmReasoningClient(chatModel, clock, configuration.modelOrDefault());
    }

    public static LlmReasoningClient usingChatModel(ChatModel chatModel) {
        return usingChatModel(chatModel, Clock.systemUTC());
    }

    static LlmReasoningClient usingChatModel(ChatModel chatModel, Clock clock) {
        return new LlmReasoningClient(chatModel, clock, null);
    }

    public CompletionResult complete(String instruction, String prompt) {
        Instant start = clock.instant();
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(instruction), UserMessage.from(prompt)))
                .build();
        ChatResponse response = chatModel.chat(request);
        long durationMs = Duration.between(start, clock.instant()).toMillis();
        AiMessage aiMessage = response.aiMessage();
        String content = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        TokenUsage usage = response.tokenUsage();
        recordMetrics(usage, durationMs);
        return new CompletionResult(content, usage, durationMs);
    }

    public String modelName() {
        return modelName;
    }

    public ProviderMetrics metrics() {
        return new ProviderMetrics(
                callCount.get(),
                cumulativeDurationMs.get(),
                cumulativeInputTokens.get(),
                cumulativeOutputTokens.get());
    }

    public record CompletionResult(String content, TokenUsage tokenUsage, long durationMs) {}

    public record ProviderMetrics(int callCount, long totalDurationMs, int totalInputTokens, int totalOutputTokens) {
        public int totalTokenCount() {
            return totalInputTokens + totalOutputTokens;
        }
    }

    interface ChatModelFactory {
        ChatModel create(LlmConfiguration configuration);
    }

    private static final class OpenAiChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(LlmConfiguration configuration) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(configuration.openAiApiKey())
                    .modelName(configuration.modelOrDefault())
                    .timeout(configuration.timeout());
            if (configuration.openAiBaseUrl() != null) {
                builder.baseUrl(configuration.openAiBaseUrl());
            }
            return builder.build();
        }
    }

    private void recordMetrics(TokenUsage usage, long durationMs) {
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        if (usage != null) {
            if (usage.inputTokenCount() != null) {
                cumulativeInputTokens.addAndGet(usage.inputTokenCount());
            }
            if (usage.outputTokenCount() != null) {
                cumulativeOutputTokens.addAndGet(usage.outputTokenCount());
            }
        }
    }
}
