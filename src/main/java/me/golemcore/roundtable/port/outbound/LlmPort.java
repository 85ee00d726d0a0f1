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

package me.golemcore.roundtable.port.outbound;

import me.golemcore.roundtable.domain.model.LlmRequest;
import me.golemcore.roundtable.domain.model.LlmResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chat-completion access to an LLM provider. {@link TextOracle} is built on
 * top of it; the conversation core never talks to this port directly.
 */
public interface LlmPort {

    /**
     * Short provider identifier, such as {@code langchain4j}, {@code custom} or
     * {@code none}.
     */
    String getProviderId();

    /**
     * Sends one chat request. Failures complete the future exceptionally.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    List<String> getSupportedModels();

    String getCurrentModel();

    /**
     * Whether the provider has the credentials it needs.
     */
    boolean isAvailable();
}
