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

package me.golemcore.roundtable.domain.conversation.selection;

/**
 * Decides which roster member speaks on a given turn.
 *
 * <p>
 * Implementations must be pure functions of their inputs so that a
 * conversation's speaking order can be replayed from its starting index and
 * roster order.
 */
@FunctionalInterface
public interface SpeakerSelectionPolicy {

    /**
     * @param turnIndex
     *            current turn index, starting at 0
     * @param rosterSize
     *            number of speakers, at least 1
     * @return roster index in {@code [0, rosterSize)}
     */
    int select(int turnIndex, int rosterSize);

    /**
     * Short name used in configuration and API payloads.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
