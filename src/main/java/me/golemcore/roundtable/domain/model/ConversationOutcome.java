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

package me.golemcore.roundtable.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Summary of a conversation driven to completion by
 * {@link me.golemcore.roundtable.domain.service.ConversationRunner}.
 */
@Value
@Builder
public class ConversationOutcome {

    @Singular
    List<Turn> turns;

    StopReason stopReason;

    /** Last oracle failure, set only when {@link #stopReason} is ORACLE_UNAVAILABLE. */
    OracleUnavailableException failure;

    public int getTurnsCompleted() {
        return turns.size();
    }
}
