package me.golemcore.memoria;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Memoria.
 *
 * <p>
 * Memoria gives a conversational agent a long-term memory organised in three
 * tiers:
 * <ul>
 * <li><b>Topic profiles</b> - continuously merged records, one per topic</li>
 * <li><b>Conversation summaries</b> - immutable digests of concluded
 * conversations</li>
 * <li><b>Full transcripts</b> - raw conversation logs referenced by
 * summaries</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → MemoryController (REST)
 * Domain Layer       → ContextRetrievalService, TopicProfileConsolidator
 * Infrastructure     → LLM/Storage/Notification Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code memoria.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoriaApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoriaApplication.class, args);
    }

}
