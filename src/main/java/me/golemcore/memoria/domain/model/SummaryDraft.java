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
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Model answer to a summarization prompt, before it becomes a
 * {@link SummaryRecord}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SummaryDraft {

    private String conversationTitle;
    private List<String> tags = new ArrayList<>();
    private String mood;
    private List<String> keyTakeaways = new ArrayList<>();
    private List<String> actionItems = new ArrayList<>();
    private List<String> mainTopics = new ArrayList<>();
    private String summaryBody;
    private UserInsights userInsights;
    private AssistantInsights llmInsights;
    private List<String> relatedInformation = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserInsights {
        private List<String> mainStatements = new ArrayList<>();
        private List<String> observedEmotions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssistantInsights {
        private List<String> mainResponses = new ArrayList<>();
        private String rolePlayed;
    }
}
