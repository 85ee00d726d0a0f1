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
import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import me.golemcore.roundtable.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Primary {@link LlmPort}: routes every call to the adapter chosen by
 * {@code roundtable.llm.provider}.
 *
 * <p>
 * Provider values:
 * <ul>
 * <li>{@code langchain4j}, {@code custom}, {@code none} - that adapter
 * <li>{@code auto} - the first configured adapter in the order langchain4j,
 * custom, falling back to {@code none}
 * </ul>
 * An unknown provider resolves to {@code none}, or to the first registered
 * adapter when even that is missing.
 *
 * @see Langchain4jAdapter
 * @see CustomLlmAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    static final String PROVIDER_AUTO = "auto";
    private static final String PROVIDER_NONE = "none";
    private static final List<String> AUTO_PREFERENCE = List.of("langchain4j", "custom");

    private final RoundtableProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> registry = new LinkedHashMap<>();

    @Getter
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        adapters.forEach(adapter -> registry.put(adapter.getProviderId(), adapter));
        log.debug("[LLM] Registered adapters: {}", registry.keySet());

        String requested = properties.getLlm().getProvider();
        activeAdapter = resolve(requested).orElse(null);
        if (activeAdapter == null) {
            log.warn("[LLM] No adapter registered, LLM calls will fail");
            return;
        }
        activeAdapter.initialize();
        if (activeAdapter.getProviderId().equals(requested)) {
            log.info("[LLM] Active provider: {} (model {})", requested, activeAdapter.getCurrentModel());
        } else {
            log.warn("[LLM] Provider '{}' resolved to '{}'", requested, activeAdapter.getProviderId());
        }
    }

    private Optional<LlmProviderAdapter> resolve(String requested) {
        if (PROVIDER_AUTO.equals(requested)) {
            Optional<LlmProviderAdapter> configured = AUTO_PREFERENCE.stream()
                    .map(registry::get)
                    .filter(adapter -> adapter != null && adapter.isAvailable())
                    .findFirst();
            if (configured.isPresent()) {
                return configured;
            }
        } else if (registry.containsKey(requested)) {
            return Optional.of(registry.get(requested));
        }
        if (registry.containsKey(PROVIDER_NONE)) {
            return Optional.of(registry.get(PROVIDER_NONE));
        }
        return registry.values().stream().findFirst();
    }

    // ==================== LlmPort ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public List<String> getSupportedModels() {
        return activeAdapter != null ? activeAdapter.getSupportedModels() : List.of();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
