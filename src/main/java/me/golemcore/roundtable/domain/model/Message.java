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

package me.golemcore.roundtable.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * One chat message in an {@link LlmRequest}. Speakers only ever send a single
 * user message carrying the rendered transcript.
 */
@Data
@Builder
public class Message {

    private String role; // user, assistant, system
    private String content;

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public boolean isUserMessage() {
        return "user".equals(role);
    }
}
