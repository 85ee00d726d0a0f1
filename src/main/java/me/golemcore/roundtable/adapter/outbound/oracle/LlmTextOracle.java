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

package me.golemcore.roundtable.adapter.outbound.oracle;

import me.golemcore.roundtable.domain.model.LlmRequest;
import me.golemcore.roundtable.domain.model.LlmResponse;
import me.golemcore.roundtable.domain.model.Message;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import me.golemcore.roundtable.port.outbound.LlmPort;
import me.golemcore.roundtable.port.outbound.TextOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextOracle} backed by the active {@link LlmPort}.
 *
 * <p>
 * The directive becomes the system prompt and the content a single user
 * message. The call blocks for at most {@code roundtable.oracle.timeout-ms};
 * timeouts, provider errors, interruption and responses without content are
 * all reported as {@link OracleUnavailableException}. The returned text is the
 * provider's content, unmodified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmTextOracle implements TextOracle {

    private final LlmPort llmPort;
    private final RoundtableProperties properties;

    @Override
    public String generate(String directive, String content) {
        RoundtableProperties.LlmProperties llm = properties.getLlm();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(directive)
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .build();
        request.addMessage(Message.user(content));

        long timeoutMs = properties.getOracle().getTimeoutMs();
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        LlmResponse response;
        try {
            response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // does not interrupt the worker; Langchain4jAdapter drops pending retries on it
            future.cancel(true);
            log.warn("[LLM] {} did not answer within {}ms", llmPort.getProviderId(), timeoutMs);
            throw new OracleUnavailableException("LLM timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[LLM] {} failed: {}", llmPort.getProviderId(), cause.getMessage());
            throw new OracleUnavailableException("LLM call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OracleUnavailableException("Interrupted while waiting for LLM", e);
        }

        if (response == null || response.getContent() == null) {
            throw new OracleUnavailableException("LLM returned no content"
                    + (response != null ? " (finish reason: " + response.getFinishReason() + ")" : ""));
        }
        if (response.getUsage() != null) {
            log.debug("[LLM] {} tokens in, {} out", response.getUsage().getInputTokens(),
                    response.getUsage().getOutputTokens());
        }
        return response.getContent();
    }
}
