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
 * YAML metadata block at the top of a summary record document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "title", "date", "type", "participants", "tags", "full_log", "mood", "key_takeaways",
        "action_items" })
public class SummaryRecordHeader {

    private String title;
    private String date;

    @Builder.Default
    private String type = SummaryRecord.TYPE;

    @Builder.Default
    private List<String> participants = new ArrayList<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @JsonProperty("full_log")
    private String fullLog;

    private String mood;

    @JsonProperty("key_takeaways")
    @Builder.Default
    private List<String> keyTakeaways = new ArrayList<>();

    @JsonProperty("action_items")
    @Builder.Default
    private List<String> actionItems = new ArrayList<>();
}
