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

import java.util.Locale;

/**
 * Resolves a selection policy from its configured name.
 */
public final class SelectionPolicies {

    private SelectionPolicies() {
    }

    /**
     * @param name
     *            {@code round-robin} (default when null or blank) or
     *            {@code seeded-random}
     * @param seed
     *            seed for {@code seeded-random}, ignored otherwise
     * @throws IllegalArgumentException
     *             for an unknown name
     */
    public static SpeakerSelectionPolicy byName(String name, long seed) {
        if (name == null || name.isBlank()) {
            return new RoundRobinSelectionPolicy();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case RoundRobinSelectionPolicy.NAME -> new RoundRobinSelectionPolicy();
        case SeededRandomSelectionPolicy.NAME -> new SeededRandomSelectionPolicy(seed);
        default -> throw new IllegalArgumentException("Unknown selection policy: " + name);
        };
    }
}
