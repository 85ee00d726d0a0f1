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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback adapter when no LLM is configured. Every speaker answers with the
 * same placeholder line, which is enough to watch turn-taking work end to end
 * without network access.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";
    private static final String NONE = "none";

    @Override
    public String getProviderId() {
        return NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.debug("[LLM] No provider configured, answering with placeholder");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model(NONE)
                .finishReason("stop")
                .usage(new LlmUsage(0, 0, 0))
                .build());
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of();
    }

    @Override
    public String getCurrentModel() {
        return NONE;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
