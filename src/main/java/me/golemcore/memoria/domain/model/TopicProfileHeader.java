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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML metadata block at the top of a topic profile document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "tag_name", "aliases", "type", "created_date", "updated_date", "key_themes",
        "user_sentiment", "master_significance", "related_tags", "summary_notes", "last_mentioned_in",
        "mention_frequency", "context_history", "opinion_history" })
public class TopicProfileHeader {

    public static final String TYPE = "tag_profile";

    @JsonProperty("tag_name")
    private String tagName;

    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    @Builder.Default
    private String type = TYPE;

    @JsonProperty("created_date")
    private String createdDate;

    @JsonProperty("updated_date")
    private String updatedDate;

    @JsonProperty("key_themes")
    @Builder.Default
    private List<String> keyThemes = new ArrayList<>();

    @JsonProperty("user_sentiment")
    private Sentiment userSentiment;

    @JsonProperty("master_significance")
    private String significance;

    @JsonProperty("related_tags")
    @Builder.Default
    private List<String> relatedTags = new ArrayList<>();

    @JsonProperty("summary_notes")
    @Builder.Default
    private List<String> summaryNotes = new ArrayList<>();

    @JsonProperty("last_mentioned_in")
    private String lastMentionedIn;

    @JsonProperty("mention_frequency")
    private Integer mentionFrequency;

    @JsonProperty("context_history")
    private List<HistoryEntry> contextHistory;

    @JsonProperty("opinion_history")
    private List<HistoryEntry> opinionHistory;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sentiment {
        private String overall;
        private List<String> details = new ArrayList<>();
    }
}
