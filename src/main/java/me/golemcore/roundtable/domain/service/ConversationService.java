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

package me.golemcore.roundtable.domain.service;

import me.golemcore.roundtable.domain.conversation.Conversation;
import me.golemcore.roundtable.domain.conversation.Orchestrator;
import me.golemcore.roundtable.domain.conversation.Speaker;
import me.golemcore.roundtable.domain.conversation.TerminationPolicy;
import me.golemcore.roundtable.domain.conversation.selection.SpeakerSelectionPolicy;
import me.golemcore.roundtable.domain.model.ConversationOutcome;
import me.golemcore.roundtable.domain.model.ConversationState;
import me.golemcore.roundtable.domain.model.SpeakerDefinition;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.domain.model.Turn;
import me.golemcore.roundtable.port.outbound.TextOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory registry of independent conversations.
 *
 * <p>
 * Every conversation owns its own orchestrator and roster; nothing mutable is
 * shared between them. Operations on one conversation are serialized on the
 * {@link Conversation} instance, so concurrent requests against the same id
 * run one turn at a time while different conversations proceed in parallel.
 * Nothing is persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final TextOracle textOracle;
    private final ConversationRunner conversationRunner;
    private final Clock clock;

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    /**
     * Builds a roster in the given order and registers a new, unseeded
     * conversation.
     *
     * @throws IllegalArgumentException
     *             for an empty roster, blank identity or duplicate identity
     */
    public Conversation create(List<SpeakerDefinition> definitions, SpeakerSelectionPolicy selectionPolicy) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("At least one speaker is required");
        }
        List<Speaker> roster = new ArrayList<>(definitions.size());
        for (SpeakerDefinition definition : definitions) {
            if (definition.getIdentity() == null || definition.getIdentity().isBlank()) {
                throw new IllegalArgumentException("Speaker identity must not be blank");
            }
            String directive = definition.getDirective() != null ? definition.getDirective() : "";
            roster.add(new Speaker(definition.getIdentity(), directive, textOracle));
        }

        Orchestrator orchestrator = new Orchestrator(roster, selectionPolicy);
        Conversation conversation = new Conversation(UUID.randomUUID().toString(), clock.instant(), orchestrator);
        conversations.put(conversation.getId(), conversation);
        log.info("[Conversation] Created {} with {} speakers, policy: {}",
                conversation.getId(), roster.size(), selectionPolicy.getName());
        return conversation;
    }

    public List<Conversation> list() {
        return conversations.values().stream()
                .sorted(Comparator.comparing(Conversation::getCreatedAt))
                .toList();
    }

    public Optional<Conversation> find(String id) {
        return Optional.ofNullable(conversations.get(id));
    }

    /**
     * Seeds the conversation with its opening utterance.
     *
     * @throws IllegalStateException
     *             if the conversation was already primed
     */
    public void prime(String id, String identity, String text) {
        Conversation conversation = require(id);
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Initiator identity must not be blank");
        }
        synchronized (conversation) {
            Orchestrator orchestrator = conversation.getOrchestrator();
            if (orchestrator.getState() != ConversationState.UNSEEDED) {
                throw new IllegalStateException("Conversation " + id + " is already primed");
            }
            orchestrator.prime(identity, text);
        }
        log.info("[Conversation] {} primed by {}", id, identity);
    }

    /**
     * Runs one turn.
     *
     * @throws IllegalStateException
     *             if the conversation has not been primed
     * @throws me.golemcore.roundtable.domain.model.OracleUnavailableException
     *             if the speaker could not produce; the conversation is
     *             unchanged
     */
    public Turn advance(String id) {
        Conversation conversation = require(id);
        Turn turn;
        synchronized (conversation) {
            requireSeeded(conversation);
            turn = conversation.getOrchestrator().advance();
        }
        log.info("[Conversation] {} turn {}: {}", id, turn.getIndex(), turn.getIdentity());
        return turn;
    }

    /**
     * Drives the conversation until the termination policy stops it. Holds the
     * conversation for the whole run.
     */
    public ConversationOutcome run(String id, TerminationPolicy termination, int retries, Consumer<Turn> observer) {
        Conversation conversation = require(id);
        synchronized (conversation) {
            requireSeeded(conversation);
            return conversationRunner.run(conversation.getOrchestrator(), termination, retries, observer);
        }
    }

    /**
     * Reads conversation state under the conversation's lock, so the reader
     * never observes a half-finished broadcast. Blocks while a turn is running.
     */
    public <T> T inspect(String id, Function<Conversation, T> reader) {
        Conversation conversation = require(id);
        synchronized (conversation) {
            return reader.apply(conversation);
        }
    }

    /**
     * Returns one speaker's own view of the transcript, or empty when no such
     * speaker is in the roster.
     */
    public Optional<List<TranscriptEntry>> transcriptOf(String id, String identity) {
        Conversation conversation = require(id);
        synchronized (conversation) {
            return conversation.getOrchestrator().findSpeaker(identity)
                    .map(Speaker::getTranscript);
        }
    }

    public boolean delete(String id) {
        boolean removed = conversations.remove(id) != null;
        if (removed) {
            log.info("[Conversation] Deleted {}", id);
        }
        return removed;
    }

    private Conversation require(String id) {
        Conversation conversation = conversations.get(id);
        if (conversation == null) {
            throw new IllegalArgumentException("Unknown conversation: " + id);
        }
        return conversation;
    }

    private void requireSeeded(Conversation conversation) {
        if (conversation.getOrchestrator().getState() == ConversationState.UNSEEDED) {
            throw new IllegalStateException("Conversation " + conversation.getId() + " must be primed first");
        }
    }
}
