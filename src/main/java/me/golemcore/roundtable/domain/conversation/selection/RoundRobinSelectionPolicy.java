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
 * Default policy: {@code (turnIndex + 1) mod rosterSize}.
 *
 * <p>
 * The +1 offset assumes roster entry 0 opened the conversation through
 * priming, so the member after it answers first. For a two-member roster
 * ordered [initiator, responder] this alternates responder, initiator,
 * responder...
 */
public class RoundRobinSelectionPolicy implements SpeakerSelectionPolicy {

    public static final String NAME = "round-robin";

    @Override
    public int select(int turnIndex, int rosterSize) {
        return Math.floorMod(turnIndex + 1L, rosterSize);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
