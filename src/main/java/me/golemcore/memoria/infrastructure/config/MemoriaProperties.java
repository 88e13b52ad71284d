package me.golemcore.memoria.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memoria.*} prefix:
 * <ul>
 * <li>{@link PersonaProperties} - agent persona used in prompts</li>
 * <li>{@link LlmProperties} - LLM provider and model settings</li>
 * <li>{@link StorageProperties} - document store layout</li>
 * <li>{@link RetrievalProperties} - tiered retrieval budgets and limits</li>
 * <li>{@link ConsolidationProperties} - topic profile consolidation</li>
 * <li>{@link PromptsProperties} - optional prompt template overrides</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memoria")
@Data
public class MemoriaProperties {

    private PersonaProperties persona = new PersonaProperties();
    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class PersonaProperties {
        private String name = "Memoria";
        private String character = "";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String model = "openai/gpt-4o-mini";
        private String keywordModel = "";
        private long timeoutMs = 60000;
        private double temperature = 0.3;
        private Map<String, ProviderProperties> providers = new HashMap<>();

        public String resolveKeywordModel() {
            return keywordModel != null && !keywordModel.isBlank() ? keywordModel : model;
        }
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memoria";
        private String scoreFile = "tag_scores.json";
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class DirectoriesProperties {
        private String profiles = "TagProfilingNote";
        private String summaries = "SummaryNote";
        private String transcripts = "FullLog";
        private String index = "index";
    }

    // ==================== RETRIEVAL ====================

    @Data
    public static class RetrievalProperties {
        private int maxTopics = 5;
        private int maxContextLength = 3500;
        private int maxEvaluationContextLength = 3500;
        private int profileSnippetOverhead = 200;
        private int summarySnippetMaxChars = 1000;
        private int transcriptExcerptChars = 800;
        private int historyTurns = 4;
        private int maxEvaluationRounds = 2;
        private long llmCallTimeoutMs = 5000;
    }

    // ==================== CONSOLIDATION ====================

    @Data
    public static class ConsolidationProperties {
        private boolean enabled = true;
        private int defaultImportance = 50;
        private long llmCallTimeoutMs = 45000;
    }

    @Data
    public static class PromptsProperties {
        private String keywordExtraction;
        private String contextEvaluation;
    }
}
