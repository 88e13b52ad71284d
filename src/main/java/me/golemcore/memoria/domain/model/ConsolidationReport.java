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
 * Per-topic results of consolidating one summary record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsolidationReport {

    public enum Status {
        CREATED, UPDATED, FAILED
    }

    private String summaryName;

    @Builder.Default
    private List<TopicResult> topics = new ArrayList<>();

    public long countByStatus(Status status) {
        return topics.stream().filter(topic -> topic.status() == status).count();
    }

    public record TopicResult(String topic, Status status, String detail) {
    }
}
