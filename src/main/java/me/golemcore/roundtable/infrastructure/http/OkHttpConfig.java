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


package me.golemcore.roundtable.infrastructure.http;

import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the custom LLM endpoint, configured from
 * {@code roundtable.http.*}. The whole call is capped at
 * {@code roundtable.oracle.timeout-ms} so an abandoned turn does not keep a
 * connection busy.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final RoundtableProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        RoundtableProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectionPool(pool)
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(properties.getOracle().getTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
