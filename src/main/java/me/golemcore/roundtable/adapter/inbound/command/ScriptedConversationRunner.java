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

package me.golemcore.roundtable.adapter.inbound.command;

import me.golemcore.roundtable.domain.conversation.Conversation;
import me.golemcore.roundtable.domain.conversation.TerminationPolicy;
import me.golemcore.roundtable.domain.conversation.selection.SelectionPolicies;
import me.golemcore.roundtable.domain.model.ConversationOutcome;
import me.golemcore.roundtable.domain.model.SpeakerDefinition;
import me.golemcore.roundtable.domain.model.StopReason;
import me.golemcore.roundtable.domain.service.ConversationService;
import me.golemcore.roundtable.infrastructure.config.RoundtableProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the conversation described under {@code roundtable.conversation.*} once
 * the application has started.
 *
 * <p>
 * The roster is built in configuration order, primed with
 * {@code initiator}/{@code opening}, and driven until {@code max-turns} turns
 * have completed or an utterance contains {@code stop-phrase}. Every line is
 * logged as {@code <identity>: <text>}. The conversation stays registered, so
 * it can still be inspected or continued over the REST API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScriptedConversationRunner implements ApplicationRunner {

    private final RoundtableProperties properties;
    private final ConversationService conversationService;

    @Override
    public void run(ApplicationArguments args) {
        RoundtableProperties.ConversationProperties config = properties.getConversation();
        if (!config.isEnabled()) {
            log.debug("[Conversation] Scripted conversation disabled");
            return;
        }
        if (config.getOpening() == null || config.getOpening().isBlank()) {
            throw new IllegalStateException("roundtable.conversation.opening is required when the scripted "
                    + "conversation is enabled");
        }

        List<SpeakerDefinition> definitions = config.getSpeakers().stream()
                .map(s -> new SpeakerDefinition(s.getIdentity(), s.getDirective()))
                .toList();
        Conversation conversation = conversationService.create(definitions,
                SelectionPolicies.byName(config.getSelection(), config.getSeed()));

        conversationService.prime(conversation.getId(), config.getInitiator(), config.getOpening());
        log.info("{}: {}", config.getInitiator(), config.getOpening());

        ConversationOutcome outcome = conversationService.run(conversation.getId(), buildTermination(config),
                config.getRetries(), turn -> log.info("{}: {}", turn.getIdentity(), turn.getText()));

        if (outcome.getStopReason() == StopReason.ORACLE_UNAVAILABLE) {
            log.warn("[Conversation] Scripted run {} aborted after {} turns: {}", conversation.getId(),
                    outcome.getTurnsCompleted(), outcome.getFailure().getMessage());
        } else {
            log.info("[Conversation] Scripted run {} finished after {} turns ({})", conversation.getId(),
                    outcome.getTurnsCompleted(), outcome.getStopReason());
        }
    }

    private TerminationPolicy buildTermination(RoundtableProperties.ConversationProperties config) {
        TerminationPolicy budget = TerminationPolicy.maxTurns(config.getMaxTurns());
        if (config.getStopPhrase() == null || config.getStopPhrase().isBlank()) {
            return budget;
        }
        return TerminationPolicy.anyOf(TerminationPolicy.stopPhrase(config.getStopPhrase()), budget);
    }
}
