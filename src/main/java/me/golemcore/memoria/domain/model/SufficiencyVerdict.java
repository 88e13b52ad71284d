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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded answer of the sufficiency judge.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SufficiencyVerdict {

    @JsonProperty("sufficient_for_response")
    private boolean sufficient;

    @JsonProperty("next_summary_notes_to_fetch")
    @Builder.Default
    private List<String> summaryRecordsToFetch = new ArrayList<>();

    @JsonProperty("requires_full_log_for_summary_note")
    private String transcriptForSummary;

    private String reasoning;

    public boolean hasSummaryRequests() {
        return summaryRecordsToFetch != null && !summaryRecordsToFetch.isEmpty();
    }

    public boolean hasTranscriptRequest() {
        return transcriptForSummary != null && !transcriptForSummary.isBlank()
                && !"null".equalsIgnoreCase(transcriptForSummary.trim());
    }
}
