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

package me.golemcore.roundtable.port.outbound;

import me.golemcore.roundtable.domain.model.OracleUnavailableException;

/**
 * Port for the external text generator that speakers consult to produce
 * their next utterance. Synchronous from the caller's point of view; any
 * network I/O, timeout or cancellation policy belongs to the implementation.
 */
@FunctionalInterface
public interface TextOracle {

    /**
     * Generates text for the given system directive and user content.
     *
     * @param directive
     *            system-level behavioral instruction
     * @param content
     *            user content (the rendered transcript and turn cue)
     * @return the raw generated text
     * @throws OracleUnavailableException
     *             if no text could be produced for any reason
     */
    String generate(String directive, String content);
}
