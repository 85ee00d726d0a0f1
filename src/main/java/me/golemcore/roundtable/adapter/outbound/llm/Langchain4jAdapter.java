/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.roundtable.adapter.outbound.llm;

import me.golemcore.roundtable.domain.model.LlmRequest;
import me.golemcore.roundtable.domain.model.LlmResponse;
import me.golemcore.roundtable.domain.model.LlmUsage;
import me.golemcore.roundtable.domain.model.Message;
import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/model-name} (for example
 * {@code openai/gpt-4o-mini} or {@code anthropic/claude-3-5-haiku-latest}); a
 * name without prefix is treated as OpenAI. Rate-limit errors are retried with
 * exponential backoff up to {@code roundtable.llm.langchain4j.max-retries}
 * times; any other failure is reported immediately.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 4096;
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final RoundtableProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        CompletableFuture<LlmResponse> result = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            try {
                String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
                ChatModel chatModel = models.computeIfAbsent(model, this::createModel);

                ChatRequest chatRequest = ChatRequest.builder()
                        .messages(convertMessages(request))
                        .temperature(request.getTemperature())
                        .maxOutputTokens(request.getMaxTokens())
                        .build();
                result.complete(convertResponse(callWithBackoff(chatModel, chatRequest, model, result), model));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Cancelling the returned future does not interrupt the worker, so the
     * loop checks {@code caller} before every backoff and retry and stops once
     * nobody waits for the answer.
     */
    private ChatResponse callWithBackoff(ChatModel chatModel, ChatRequest chatRequest, String model,
            CompletableFuture<LlmResponse> caller) {
        RoundtableProperties.Langchain4jProperties settings = properties.getLlm().getLangchain4j();
        int maxRetries = settings.getMaxRetries();
        int attempt = 0;
        while (true) {
            try {
                return chatModel.chat(chatRequest);
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= maxRetries) {
                    log.error("[LLM] Chat failed for model {} after {} attempt(s)", model, attempt + 1, e);
                    throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                }
                long backoffMs = (long) (settings.getInitialBackoffMs() * Math.pow(BACKOFF_MULTIPLIER, attempt));
                long resetSeconds = extractResetSeconds(e);
                if (resetSeconds > 0) {
                    backoffMs = Math.max(resetSeconds * 1000 + 1000, backoffMs);
                }
                attempt++;
                abortIfAbandoned(caller, model);
                log.warn("[LLM] Rate limit hit for {} (retry {}/{}), waiting {}ms", model, attempt, maxRetries,
                        backoffMs);
                sleep(backoffMs);
                abortIfAbandoned(caller, model);
            }
        }
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of(properties.getLlm().getModel());
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    /**
     * Available when the provider of the configured model has an API key.
     */
    @Override
    public boolean isAvailable() {
        RoundtableProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(getProvider(properties.getLlm().getModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Creates a chat model for {@code provider/model-name}.
     */
    ChatModel createModel(String model) {
        String provider = getProvider(model);
        RoundtableProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs());
        log.info("[LLM] Creating {} model: {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(ANTHROPIC_DEFAULT_MAX_TOKENS)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private String getProvider(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private RoundtableProperties.ProviderProperties getProviderConfig(String providerName) {
        RoundtableProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add roundtable.llm.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }

        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(tokenUsage.inputTokenCount()))
                    .outputTokens(orZero(tokenUsage.outputTokenCount()))
                    .totalTokens(orZero(tokenUsage.totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(response.aiMessage().text())
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("token_quota_exceeded")
                    || msg.contains("Too Many Requests") || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extracts reset_seconds from a rate limit error body. Returns -1 if absent.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    private void abortIfAbandoned(CompletableFuture<LlmResponse> caller, String model) {
        if (caller.isDone()) {
            log.info("[LLM] Caller gave up on {}, dropping remaining retries", model);
            throw new IllegalStateException("LLM chat abandoned by caller");
        }
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
