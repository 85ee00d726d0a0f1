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

import me.golemcore.roundtable.domain.conversation.selection.RoundRobinSelectionPolicy;
import me.golemcore.roundtable.domain.conversation.selection.SpeakerSelectionPolicy;
import me.golemcore.roundtable.domain.model.ConversationState;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.domain.model.Turn;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Drives turn-taking for a fixed, ordered roster of {@link Speaker}s.
 *
 * <p>
 * Each {@link #advance()} selects one speaker, asks it for an utterance and
 * then broadcasts that utterance to every speaker in roster order, the author
 * included. After every completed turn all transcripts are therefore identical
 * and equal the global history, seed included.
 *
 * <p>
 * A failed oracle call aborts the turn before any state changes: no speaker
 * absorbs anything and the turn index stays put, so the caller may simply call
 * {@code advance()} again.
 *
 * <p>
 * The orchestrator has no built-in termination and is not thread-safe; hosts
 * running several conversations give each its own orchestrator and roster.
 */
@Slf4j
public class Orchestrator {

    @Getter
    private final List<Speaker> roster;

    @Getter
    private final SpeakerSelectionPolicy selectionPolicy;

    @Getter
    private int turnIndex;

    @Getter
    private ConversationState state = ConversationState.UNSEEDED;

    public Orchestrator(List<Speaker> roster) {
        this(roster, new RoundRobinSelectionPolicy());
    }

    public Orchestrator(List<Speaker> roster, SpeakerSelectionPolicy selectionPolicy) {
        Objects.requireNonNull(roster, "roster");
        if (roster.isEmpty()) {
            throw new IllegalArgumentException("Roster must contain at least one speaker");
        }
        Set<String> identities = new HashSet<>();
        for (Speaker speaker : roster) {
            if (!identities.add(speaker.getIdentity())) {
                throw new IllegalArgumentException("Duplicate speaker identity: " + speaker.getIdentity());
            }
        }
        this.roster = List.copyOf(roster);
        this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
    }

    /**
     * Seeds every transcript with an opening utterance. The initiator does not
     * have to be a roster member. Calling this twice seeds twice.
     */
    public void prime(String identity, String text) {
        for (Speaker speaker : roster) {
            speaker.absorb(identity, text);
        }
        state = ConversationState.SEEDED;
        log.debug("[Conversation] Primed {} speakers with opening from {}", roster.size(), identity);
    }

    /**
     * Resolves the roster index that speaks on the given turn.
     *
     * @throws IllegalStateException
     *             if the policy returns an index outside the roster
     */
    public int selectSpeaker(int turnIndex) {
        int index = selectionPolicy.select(turnIndex, roster.size());
        if (index < 0 || index >= roster.size()) {
            throw new IllegalStateException("Selection policy " + selectionPolicy.getName()
                    + " returned index " + index + " for roster of size " + roster.size());
        }
        return index;
    }

    /**
     * Runs one full turn: select, produce, broadcast, count.
     *
     * @return who spoke and what they said
     * @throws OracleUnavailableException
     *             if the selected speaker could not produce; nothing changed
     * @throws IllegalStateException
     *             if the turn counter is exhausted
     */
    public Turn advance() {
        int current = turnIndex;
        if (current == Integer.MAX_VALUE) {
            throw new IllegalStateException("Turn limit of " + Integer.MAX_VALUE + " reached");
        }
        Speaker speaker = roster.get(selectSpeaker(current));
        log.debug("[Conversation] Turn {}: {} selected by {}", current, speaker.getIdentity(),
                selectionPolicy.getName());

        String text = speaker.produce();

        for (Speaker listener : roster) {
            listener.absorb(speaker.getIdentity(), text);
        }
        turnIndex = current + 1;
        return new Turn(current, speaker.getIdentity(), text);
    }

    public Optional<Speaker> findSpeaker(String identity) {
        return roster.stream()
                .filter(speaker -> speaker.getIdentity().equals(identity))
                .findFirst();
    }

    /**
     * Shared history as seen by the first speaker. Equal to every other
     * speaker's view while {@link #transcriptsConverged()} holds.
     */
    public List<TranscriptEntry> getTranscript() {
        return roster.get(0).getTranscript();
    }

    /**
     * Checks that every speaker holds the same sequence of entries.
     */
    public boolean transcriptsConverged() {
        List<TranscriptEntry> reference = roster.get(0).getTranscript();
        for (int i = 1; i < roster.size(); i++) {
            if (!reference.equals(roster.get(i).getTranscript())) {
                return false;
            }
        }
        return true;
    }
}
