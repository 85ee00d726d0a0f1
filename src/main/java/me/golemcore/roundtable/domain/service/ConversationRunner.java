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

import me.golemcore.roundtable.domain.conversation.Orchestrator;
import me.golemcore.roundtable.domain.conversation.TerminationPolicy;
import me.golemcore.roundtable.domain.model.ConversationOutcome;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.StopReason;
import me.golemcore.roundtable.domain.model.Turn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drives an {@link Orchestrator} until a {@link TerminationPolicy} says stop.
 *
 * <p>
 * Failed turns leave the orchestrator untouched, so a failed
 * {@code advance()} is simply re-invoked up to {@code retries} more times.
 * When retries run out the run ends with
 * {@link StopReason#ORACLE_UNAVAILABLE} and the last failure attached.
 */
@Service
@Slf4j
public class ConversationRunner {

    public ConversationOutcome run(Orchestrator orchestrator, TerminationPolicy termination, int retries,
            Consumer<Turn> observer) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got " + retries);
        }
        ConversationOutcome.ConversationOutcomeBuilder outcome = ConversationOutcome.builder();
        Turn lastTurn = null;
        int completed = 0;

        while (true) {
            Optional<StopReason> stop = termination.evaluate(lastTurn, completed);
            if (stop.isPresent()) {
                log.info("[Conversation] Stopped after {} turns: {}", completed, stop.get());
                return outcome.stopReason(stop.get()).build();
            }

            Turn turn;
            try {
                turn = advanceWithRetries(orchestrator, retries);
            } catch (OracleUnavailableException e) {
                log.warn("[Conversation] Oracle unavailable at turn {}, giving up after {} attempts: {}",
                        orchestrator.getTurnIndex(), retries + 1, e.getMessage());
                return outcome.stopReason(StopReason.ORACLE_UNAVAILABLE).failure(e).build();
            }

            outcome.turn(turn);
            observer.accept(turn);
            lastTurn = turn;
            completed++;
        }
    }

    private Turn advanceWithRetries(Orchestrator orchestrator, int retries) {
        for (int attempt = 0;; attempt++) {
            try {
                return orchestrator.advance();
            } catch (OracleUnavailableException e) {
                if (attempt >= retries) {
                    throw e;
                }
                log.warn("[Conversation] Turn {} failed (attempt {}/{}), retrying: {}",
                        orchestrator.getTurnIndex(), attempt + 1, retries + 1, e.getMessage());
            }
        }
    }
}
