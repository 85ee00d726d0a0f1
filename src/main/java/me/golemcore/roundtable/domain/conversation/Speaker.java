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

import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.port.outbound.TextOracle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One persona taking part in a conversation.
 *
 * <p>
 * A speaker holds an immutable identity and directive plus a private,
 * append-only transcript. It never appends its own output while producing;
 * the {@link Orchestrator} broadcasts every utterance back to all speakers,
 * the author included, through {@link #absorb(String, String)}.
 *
 * <p>
 * Not thread-safe. A speaker belongs to exactly one orchestrator.
 */
@Slf4j
public class Speaker {

    @Getter
    private final String identity;

    @Getter
    private final String directive;

    private final TextOracle oracle;
    private final List<TranscriptEntry> transcript = new ArrayList<>();

    public Speaker(String identity, String directive, TextOracle oracle) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.directive = Objects.requireNonNull(directive, "directive");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    /**
     * Asks the oracle for this speaker's next utterance.
     *
     * <p>
     * The user content is the rendered transcript followed by the
     * {@code "\n<identity>:"} cue; the directive goes in as the system
     * instruction. The response is returned verbatim and the transcript is left
     * untouched.
     *
     * @return raw oracle output
     * @throws OracleUnavailableException
     *             if the oracle fails for any reason
     */
    public String produce() {
        String content = TranscriptRenderer.render(transcript) + TranscriptRenderer.cue(identity);
        log.debug("[Speaker] {} producing from {} transcript entries ({} chars)",
                identity, transcript.size(), content.length());
        try {
            return oracle.generate(directive, content);
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleUnavailableException("Oracle failed for speaker " + identity + ": " + e.getMessage(), e);
        }
    }

    /**
     * Appends an utterance to this speaker's transcript. No validation, no
     * deduplication.
     */
    public void absorb(String identity, String text) {
        transcript.add(TranscriptEntry.of(identity, text));
    }

    /**
     * Returns a snapshot of the transcript in insertion order.
     */
    public List<TranscriptEntry> getTranscript() {
        return List.copyOf(transcript);
    }

    public int getTranscriptSize() {
        return transcript.size();
    }
}
