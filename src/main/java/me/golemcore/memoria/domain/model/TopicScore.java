package me.golemcore.memoria.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Importance and frequency record of one topic, as persisted in the score
 * store file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopicScore {

    public static final int MIN_IMPORTANCE = 0;
    public static final int MAX_IMPORTANCE = 100;

    @JsonProperty("base_importance")
    private int baseImportance;

    @JsonProperty("last_mentioned_in")
    private String lastReferencedRecord;

    @JsonProperty("mention_frequency")
    private int mentionCount;

    public static int clampImportance(int value) {
        return Math.max(MIN_IMPORTANCE, Math.min(MAX_IMPORTANCE, value));
    }

    public TopicScore copy() {
        return new TopicScore(baseImportance, lastReferencedRecord, mentionCount);
    }
}
