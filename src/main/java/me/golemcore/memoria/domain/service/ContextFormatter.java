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

import lombok.RequiredArgsConstructor;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.RetrievalResult;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders retrieved items into prompt text, once for the sufficiency judge and
 * once for the final answer.
 */
@Component
@RequiredArgsConstructor
public class ContextFormatter {

    static final int EVALUATION_SNIPPET_CHARS = 500;
    static final int ANSWER_SNIPPET_CHARS = 700;
    static final String SNIPPET_ELISION = "... (details omitted)";
    static final String CONTEXT_ELISION = "... (remaining memory context omitted)...";
    static final String NOTHING_AVAILABLE = "No memory items or conversation history are available.";

    private static final Comparator<RetrievedContextItem> BY_RELEVANCE = Comparator
            .comparingDouble((RetrievedContextItem item) -> item.getRelevance() != null ? item.getRelevance() : 0.0)
            .reversed();

    private final MemoriaProperties properties;

    public String formatForEvaluation(List<RetrievedContextItem> items, String query, List<Message> history) {
        List<Message> turns = history != null ? history : List.of();
        if ((items == null || items.isEmpty()) && turns.isEmpty()) {
            return NOTHING_AVAILABLE;
        }

        StringBuilder sb = new StringBuilder("Recent conversation:\n");
        int historyTurns = Math.max(0, properties.getRetrieval().getHistoryTurns());
        List<Message> recent = turns.subList(Math.max(0, turns.size() - historyTurns), turns.size());
        if (recent.isEmpty()) {
            sb.append("none\n");
        }
        for (Message message : recent) {
            sb.append(message.isUserMessage() ? "User" : "Assistant").append(": ")
                    .append(message.getContent()).append('\n');
        }
        sb.append("\nCurrent user question: ").append(query).append("\n\n");

        if (items == null || items.isEmpty()) {
            sb.append("Collected memory: none\n");
        } else {
            sb.append("Collected memory:\n");
            for (RetrievedContextItem item : sortByRelevance(items)) {
                appendItem(sb, item, MemoryNoteSupport.truncate(item.getSnippet(), EVALUATION_SNIPPET_CHARS, "..."));
            }
        }

        int maxLength = properties.getRetrieval().getMaxEvaluationContextLength();
        return MemoryNoteSupport.truncate(sb.toString(), maxLength, "");
    }

    public String formatForAnswer(List<RetrievedContextItem> items) {
        if (items == null || items.isEmpty()) {
            return RetrievalResult.NO_MEMORY_FOUND;
        }

        StringBuilder sb = new StringBuilder();
        for (RetrievedContextItem item : sortByRelevance(items)) {
            appendItem(sb, item, MemoryNoteSupport.truncate(item.getSnippet(), ANSWER_SNIPPET_CHARS, SNIPPET_ELISION));
        }
        return MemoryNoteSupport.truncate(sb.toString(), properties.getRetrieval().getMaxContextLength(),
                CONTEXT_ELISION);
    }

    private static List<RetrievedContextItem> sortByRelevance(List<RetrievedContextItem> items) {
        List<RetrievedContextItem> sorted = new ArrayList<>(items);
        sorted.sort(BY_RELEVANCE);
        return sorted;
    }

    private static void appendItem(StringBuilder sb, RetrievedContextItem item, String snippet) {
        sb.append("\n[Source: ").append(item.getTier().getLabel()).append(" - ").append(item.getSourceName())
                .append(" (").append(item.getDate() != null ? item.getDate() : "unknown date").append(")]\n");
        if (item.getTitle() != null && !item.getTitle().isBlank()) {
            sb.append("Title: ").append(item.getTitle()).append('\n');
        }
        sb.append("Excerpt:\n").append(snippet).append("\n---\n");
    }
}
