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

import java.util.SplittableRandom;

/**
 * Uniform random speaker choice that is reproducible: the pick for a turn
 * depends only on the seed, the turn index and the roster size.
 */
public class SeededRandomSelectionPolicy implements SpeakerSelectionPolicy {

    public static final String NAME = "seeded-random";

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;

    public SeededRandomSelectionPolicy(long seed) {
        this.seed = seed;
    }

    @Override
    public int select(int turnIndex, int rosterSize) {
        SplittableRandom random = new SplittableRandom(seed + GOLDEN_GAMMA * (turnIndex + 1L));
        return random.nextInt(rosterSize);
    }

    @Override
    public String getName() {
        return NAME;
    }

    public long getSeed() {
        return seed;
    }
}
