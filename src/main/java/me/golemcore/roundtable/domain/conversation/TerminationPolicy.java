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

import me.golemcore.roundtable.domain.model.StopReason;
import me.golemcore.roundtable.domain.model.Turn;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Caller-side stop condition, checked before the first turn and after every
 * completed turn.
 */
@FunctionalInterface
public interface TerminationPolicy {

    /**
     * @param lastTurn
     *            the turn that just completed, or {@code null} before the first
     *            turn
     * @param turnsCompleted
     *            number of turns completed so far in this run
     * @return the reason to stop, or empty to keep going
     */
    Optional<StopReason> evaluate(Turn lastTurn, int turnsCompleted);

    /**
     * Stops once {@code maxTurns} turns have completed.
     */
    static TerminationPolicy maxTurns(int maxTurns) {
        if (maxTurns < 0) {
            throw new IllegalArgumentException("maxTurns must be >= 0, got " + maxTurns);
        }
        return (lastTurn, turnsCompleted) -> turnsCompleted >= maxTurns
                ? Optional.of(StopReason.TURN_BUDGET)
                : Optional.empty();
    }

    /**
     * Stops when the latest utterance contains {@code phrase}, ignoring case.
     */
    static TerminationPolicy stopPhrase(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("Stop phrase must not be blank");
        }
        String needle = phrase.toLowerCase(Locale.ROOT);
        return (lastTurn, turnsCompleted) -> lastTurn != null && lastTurn.getText() != null
                && lastTurn.getText().toLowerCase(Locale.ROOT).contains(needle)
                        ? Optional.of(StopReason.STOP_PHRASE)
                        : Optional.empty();
    }

    /**
     * First non-empty verdict wins, in argument order.
     */
    static TerminationPolicy anyOf(TerminationPolicy... policies) {
        List<TerminationPolicy> all = List.of(policies);
        return (lastTurn, turnsCompleted) -> {
            for (TerminationPolicy policy : all) {
                Optional<StopReason> reason = policy.evaluate(lastTurn, turnsCompleted);
                if (reason.isPresent()) {
                    return reason;
                }
            }
            return Optional.empty();
        };
    }
}
