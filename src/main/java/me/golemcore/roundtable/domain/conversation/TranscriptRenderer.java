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

package me.golemcore.roundtable.domain.conversation;

import me.golemcore.roundtable.domain.model.TranscriptEntry;

import java.util.List;

/**
 * Flattens a transcript into the narrative block a speaker hands to the
 * oracle.
 *
 * <pre>
 * Here is the conversation so far.
 * Narrator: Begin the quest.
 * Hero: I go north.
 * </pre>
 */
public final class TranscriptRenderer {

    public static final String FRAMING = "Here is the conversation so far.";

    private TranscriptRenderer() {
    }

    /**
     * Renders entries in transcript order, each as {@code "\n<identity>: <text>"}
     * after the framing sentence.
     */
    public static String render(List<TranscriptEntry> transcript) {
        StringBuilder sb = new StringBuilder(FRAMING);
        for (TranscriptEntry entry : transcript) {
            sb.append('\n').append(entry.getIdentity()).append(": ").append(entry.getText());
        }
        return sb.toString();
    }

    /**
     * Cue appended after the narrative telling the oracle whose line comes next.
     */
    public static String cue(String identity) {
        return "\n" + identity + ":";
    }
}
