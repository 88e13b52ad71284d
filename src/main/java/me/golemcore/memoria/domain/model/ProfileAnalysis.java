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
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured answer of the model to a consolidation prompt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileAnalysis {

    @JsonProperty("tag_name")
    private String topic;

    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    @JsonProperty("key_themes")
    @Builder.Default
    private List<String> keyThemes = new ArrayList<>();

    @JsonProperty("user_sentiment_overall")
    private String sentimentOverall;

    @JsonProperty("user_sentiment_details")
    @Builder.Default
    private List<String> sentimentDetails = new ArrayList<>();

    @JsonProperty("master_significance")
    private String significance;

    @JsonProperty("related_tags")
    @Builder.Default
    private List<String> relatedTopics = new ArrayList<>();

    @JsonProperty("body_overview")
    private String overview;

    @JsonProperty("body_contexts")
    @Builder.Default
    private List<ContextEntry> contexts = new ArrayList<>();

    @JsonProperty("body_user_opinions")
    @Builder.Default
    private List<OpinionEntry> opinions = new ArrayList<>();

    @JsonProperty("body_other_notes")
    private String otherNotes;

    @JsonProperty("new_base_importance")
    private JsonNode newBaseImportance;

    /**
     * Importance suggested by the model, clamped to 0-100, or {@code null} when
     * absent or not a number.
     */
    public Integer suggestedImportance() {
        if (newBaseImportance == null || newBaseImportance.isNull()) {
            return null;
        }
        if (newBaseImportance.isNumber()) {
            return clampImportance(newBaseImportance.asDouble());
        }
        if (newBaseImportance.isTextual()) {
            try {
                return clampImportance(Double.parseDouble(newBaseImportance.asText().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer clampImportance(double value) {
        if (Double.isNaN(value)) {
            return null;
        }
        return (int) Math.round(Math.max(0.0, Math.min(100.0, value)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContextEntry {
        @JsonProperty("summary_note_link")
        private String reference;

        @JsonProperty("context_summary")
        private String summary;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpinionEntry {
        @JsonProperty("summary_note_link")
        private String reference;

        @JsonProperty("user_opinion")
        private String opinion;
    }
}
