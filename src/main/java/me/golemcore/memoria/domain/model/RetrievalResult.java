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
 * Outcome of one memory retrieval request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrievalResult {

    public static final String NO_MEMORY_FOUND = "No relevant information was found in memory.";

    private String query;

    @Builder.Default
    private List<ScoredKeyword> keywords = new ArrayList<>();

    @Builder.Default
    private List<RetrievedContextItem> items = new ArrayList<>();

    @Builder.Default
    private String formattedContext = NO_MEMORY_FOUND;

    private List<String> summaryRefsToFetch;
    private String transcriptRefToFetch;
    private String evaluatorResponse;
    private int evaluationRounds;
}
