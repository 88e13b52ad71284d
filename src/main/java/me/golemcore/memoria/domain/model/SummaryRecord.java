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

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable digest of one concluded conversation (Tier 2).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SummaryRecord {

    public static final String TYPE = "conversation_summary";

    /**
     * Document name without extension, e.g. {@code SN-202405011230-Travel}.
     */
    private String name;

    private String title;
    private String date;

    @Builder.Default
    private List<String> participants = new ArrayList<>();

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private String fullTranscriptRef;
    private String mood;

    @Builder.Default
    private List<String> keyTakeaways = new ArrayList<>();

    @Builder.Default
    private List<String> actionItems = new ArrayList<>();

    /**
     * Markdown body following the metadata block.
     */
    private String body;

    /**
     * Full document text, metadata included, as handed to consolidation prompts.
     */
    private String rawText;

    /**
     * Link form used by profiles and the score store: {@code [[name.md]]}.
     */
    public String reference() {
        return "[[" + name + ".md]]";
    }
}
