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

package me.golemcore.roundtable.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code roundtable.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link OracleProperties} - how long speakers wait for the LLM</li>
 * <li>{@link ConversationProperties} - scripted conversation run at
 * startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "roundtable")
@Data
public class RoundtableProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private OracleProperties oracle = new OracleProperties();
    private ConversationProperties conversation = new ConversationProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "auto";
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.7;
        private Integer maxTokens;
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
        private CustomLlmProperties custom = new CustomLlmProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private long timeoutMs = 120000;
        private int maxRetries = 3;
        private long initialBackoffMs = 5000;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class CustomLlmProperties {
        private String apiUrl;
        private String apiKey;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== ORACLE ====================

    @Data
    public static class OracleProperties {
        private long timeoutMs = 180000;
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private boolean enabled = false;
        private int maxTurns = 10;
        private String stopPhrase;
        private int retries = 0;
        private String selection = "round-robin";
        private long seed = 0;
        private String initiator = "Narrator";
        private String opening;
        private List<SpeakerProperties> speakers = new ArrayList<>();
    }

    @Data
    public static class SpeakerProperties {
        private String identity;
        private String directive;
    }
}
