package me.golemcore.memoria.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.RankedTopic;
import me.golemcore.memoria.domain.model.ScoredKeyword;
import me.golemcore.memoria.domain.model.TopicScore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Combines the in-utterance score of each keyword with the stored importance
 * of the matching topic.
 */
@Service
@Slf4j
public class TopicRanker {

    static final double PROMPT_WEIGHT = 0.7;
    static final double IMPORTANCE_WEIGHT = 0.3;

    /**
     * Ranks keywords that match a known topic, highest score first. Keywords
     * without a score record are left out. Equal scores keep input order.
     */
    public List<RankedTopic> rank(List<ScoredKeyword> keywords, Map<String, TopicScore> scores) {
        List<RankedTopic> ranked = new ArrayList<>();
        if (keywords == null || scores == null) {
            return ranked;
        }
        for (ScoredKeyword keyword : keywords) {
            TopicScore score = scores.get(keyword.keyword());
            if (score == null) {
                log.debug("[Ranker] '{}' is not a known topic", keyword.keyword());
                continue;
            }
            double finalScore = PROMPT_WEIGHT * keyword.inPromptScore() + IMPORTANCE_WEIGHT * score.getBaseImportance();
            ranked.add(new RankedTopic(keyword.keyword(), finalScore, keyword.keyword()));
        }
        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(RankedTopic::score).reversed());
        return ranked;
    }
}
