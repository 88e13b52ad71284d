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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Continuously merged record of everything known about one topic (Tier 1).
 *
 * <p>
 * {@link #contexts} and {@link #opinions} are newest-first and hold at most one
 * entry per summary-record reference.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopicProfile {

    private String topic;

    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    @Builder.Default
    private List<String> keyThemes = new ArrayList<>();

    private String sentimentOverall;

    @Builder.Default
    private List<String> sentimentDetails = new ArrayList<>();

    private String significance;

    @Builder.Default
    private List<String> relatedTopics = new ArrayList<>();

    @Builder.Default
    private List<String> summaryRefs = new ArrayList<>();

    private String overview;

    @Builder.Default
    private List<HistoryEntry> contexts = new ArrayList<>();

    @Builder.Default
    private List<HistoryEntry> opinions = new ArrayList<>();

    private String otherNotes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    private String lastReferencedRecord;
    private int mentionCount;
}
