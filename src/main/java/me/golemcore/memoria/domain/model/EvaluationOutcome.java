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
 * Final state of the sufficiency evaluation loop.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationOutcome {

    public enum Stage {
        INIT, PROFILE_EVAL, SUMMARY_EVAL, DONE
    }

    public enum StopReason {
        NOTHING_TO_JUDGE, SUFFICIENT, NO_NEW_ITEMS, ROUND_LIMIT, EVALUATION_FAILED
    }

    @Builder.Default
    private List<RetrievedContextItem> items = new ArrayList<>();

    private int rounds;
    private boolean sufficient;
    private StopReason stopReason;
    private List<String> summaryRefsRequested;
    private String transcriptRefRequested;
    private String rawResponse;
}
