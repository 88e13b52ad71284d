package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.RetrievalResult;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.SourceTier;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextFormatterTest {

    private MemoriaProperties properties;
    private ContextFormatter formatter;

    @BeforeEach
    void setUp() {
        properties = new MemoriaProperties();
        formatter = new ContextFormatter(properties);
    }

    private static RetrievedContextItem item(SourceTier tier, String name, String snippet, Double relevance) {
        return RetrievedContextItem.builder()
                .tier(tier)
                .sourceName(name)
                .title("Title of " + name)
                .date(relevance != null ? "2024-01-15 12:30" : null)
                .snippet(snippet)
                .relevance(relevance)
                .build();
    }

    @Test
    void formatForAnswer_returnsSentinelWhenEmpty() {
        assertEquals(RetrievalResult.NO_MEMORY_FOUND, formatter.formatForAnswer(List.of()));
        assertEquals(RetrievalResult.NO_MEMORY_FOUND, formatter.formatForAnswer(null));
    }

    @Test
    void formatForAnswer_ordersByRelevanceAndLabelsSources() {
        String formatted = formatter.formatForAnswer(List.of(
                item(SourceTier.SUMMARY, "SN-1", "summary text", null),
                item(SourceTier.PROFILE, "TPN-Coffee", "profile text", 86.0)));

        assertTrue(formatted.startsWith("\n[Source: Profile - TPN-Coffee (2024-01-15 12:30)]\n"
                + "Title: Title of TPN-Coffee\nExcerpt:\nprofile text\n---\n"));
        assertTrue(formatted.contains("[Source: Summary - SN-1 (unknown date)]"));
        assertTrue(formatted.indexOf("TPN-Coffee") < formatted.indexOf("SN-1"));
    }

    @Test
    void formatForAnswer_elidesLongSnippets() {
        String formatted = formatter.formatForAnswer(List.of(
                item(SourceTier.PROFILE, "TPN-Coffee", "z".repeat(900), 50.0)));

        assertTrue(formatted.contains("z".repeat(700) + ContextFormatter.SNIPPET_ELISION));
        assertFalse(formatted.contains("z".repeat(701)));
    }

    @Test
    void formatForAnswer_capsTotalLength() {
        properties.getRetrieval().setMaxContextLength(300);
        List<RetrievedContextItem> items = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            items.add(item(SourceTier.PROFILE, "TPN-" + i, "w".repeat(200), 10.0 * i));
        }

        String formatted = formatter.formatForAnswer(items);

        assertEquals(300 + ContextFormatter.CONTEXT_ELISION.length(), formatted.length());
        assertTrue(formatted.endsWith(ContextFormatter.CONTEXT_ELISION));
    }

    @Test
    void formatForEvaluation_reportsNothingAvailable() {
        assertEquals(ContextFormatter.NOTHING_AVAILABLE, formatter.formatForEvaluation(List.of(), "q", List.of()));
    }

    @Test
    void formatForEvaluation_includesRecentTurnsAndQuestion() {
        List<Message> history = List.of(
                Message.user("turn 1"), Message.assistant("turn 2"), Message.user("turn 3"),
                Message.assistant("turn 4"), Message.user("turn 5"));

        String formatted = formatter.formatForEvaluation(
                List.of(item(SourceTier.PROFILE, "TPN-Coffee", "profile text", 50.0)), "What beans?", history);

        assertTrue(formatted.startsWith("Recent conversation:\nAssistant: turn 2\nUser: turn 3\n"));
        assertFalse(formatted.contains("turn 1"));
        assertTrue(formatted.contains("User: turn 5\n\nCurrent user question: What beans?\n\nCollected memory:\n"));
        assertTrue(formatted.contains("[Source: Profile - TPN-Coffee"));
    }

    @Test
    void formatForEvaluation_withHistoryButNoItems() {
        String formatted = formatter.formatForEvaluation(List.of(), "q", List.of(Message.user("hi")));

        assertTrue(formatted.endsWith("Collected memory: none\n"));
    }

    @Test
    void formatForEvaluation_respectsLengthLimit() {
        properties.getRetrieval().setMaxEvaluationContextLength(100);

        String formatted = formatter.formatForEvaluation(
                List.of(item(SourceTier.PROFILE, "TPN-Coffee", "v".repeat(400), 50.0)), "q", List.of());

        assertEquals(100, formatted.length());
    }
}
