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
import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import me.golemcore.roundtable.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Speaks the OpenAI {@code /chat/completions} dialect to any compatible
 * endpoint (local inference servers, gateways, proxies) through Feign over the
 * shared OkHttp client.
 *
 * <p>
 * Configured by {@code roundtable.llm.custom.api-url} and
 * {@code roundtable.llm.custom.api-key}; the model name is
 * {@code roundtable.llm.model} sent as is. The Feign client is built on first
 * use, so a missing URL only fails the calls, not startup.
 *
 * <p>
 * Provider ID: {@code "custom"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomLlmAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ID = "custom";

    private final RoundtableProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile ChatCompletionsApi api;

    @Override
    public synchronized void initialize() {
        if (api != null) {
            return;
        }
        String apiUrl = properties.getLlm().getCustom().getApiUrl();
        if (isBlank(apiUrl)) {
            log.debug("[LLM] Custom endpoint not configured");
            return;
        }
        api = feignClientFactory.create(ChatCompletionsApi.class, apiUrl);
        log.info("[LLM] Custom endpoint: {}", apiUrl);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            initialize();
            ChatCompletionsApi endpoint = api;
            if (endpoint == null) {
                throw new IllegalStateException(
                        "Custom LLM adapter not available: roundtable.llm.custom.api-url is not set");
            }
            CompletionRequest body = toCompletionRequest(request);
            CompletionResponse response;
            try {
                response = endpoint.complete(properties.getLlm().getCustom().getApiKey(), body);
            } catch (RuntimeException e) {
                log.error("[LLM] Custom endpoint call failed for model {}", body.getModel(), e);
                throw new IllegalStateException("Custom LLM chat failed: " + e.getMessage(), e);
            }
            return toLlmResponse(response);
        });
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of(getCurrentModel());
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        RoundtableProperties.CustomLlmProperties custom = properties.getLlm().getCustom();
        return !isBlank(custom.getApiUrl()) && !isBlank(custom.getApiKey());
    }

    private CompletionRequest toCompletionRequest(LlmRequest request) {
        List<CompletionMessage> messages = new ArrayList<>();
        if (!isBlank(request.getSystemPrompt())) {
            messages.add(new CompletionMessage("system", request.getSystemPrompt()));
        }
        request.getMessages().forEach(msg -> messages.add(new CompletionMessage(msg.getRole(), msg.getContent())));

        return CompletionRequest.builder()
                .model(request.getModel() != null ? request.getModel() : getCurrentModel())
                .messages(messages)
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .build();
    }

    private LlmResponse toLlmResponse(CompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            // Callers treat missing content as a failed generation
            return LlmResponse.builder().finishReason("error").build();
        }

        CompletionChoice first = response.getChoices().get(0);
        CompletionUsage usage = response.getUsage();
        return LlmResponse.builder()
                .content(first.getMessage() != null ? first.getMessage().getContent() : null)
                .model(response.getModel())
                .finishReason(first.getFinishReason())
                .usage(usage == null ? null
                        : new LlmUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens()))
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        CompletionResponse complete(@Param("apiKey") String apiKey, CompletionRequest request);
    }

    // ==================== Wire format ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CompletionRequest {
        private String model;
        private List<CompletionMessage> messages;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletionMessage {
        private String role;
        private String content;
    }

    @Data
    public static class CompletionResponse {
        private String id;
        private String model;
        private List<CompletionChoice> choices;
        private CompletionUsage usage;
    }

    @Data
    public static class CompletionChoice {
        private int index;
        private CompletionMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class CompletionUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
