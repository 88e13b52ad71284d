package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.model.SummaryRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryRecordCodecTest {

    private final SummaryRecordCodec codec = new SummaryRecordCodec();

    @Test
    void renderThenParse_keepsMetadataAndBody() {
        SummaryRecord record = SummaryRecord.builder()
                .name("SN-202401151230-Coffee_chat")
                .title("Coffee chat")
                .date("2024-01-15 12:30:00")
                .participants(List.of("User", "Memoria"))
                .topics(List.of("Coffee", "Morning"))
                .fullTranscriptRef("[[20240115123000.md]]")
                .mood("Relaxed")
                .keyTakeaways(List.of("Likes dark roast"))
                .actionItems(List.of())
                .body("# Coffee chat\n\n## Summary\nTalked about beans.\n")
                .build();

        String content = codec.render(record);
        SummaryRecord parsed = codec.parse("SN-202401151230-Coffee_chat.md", content);

        assertNotNull(parsed);
        assertEquals("SN-202401151230-Coffee_chat", parsed.getName());
        assertEquals("Coffee chat", parsed.getTitle());
        assertEquals(List.of("Coffee", "Morning"), parsed.getTopics());
        assertEquals("[[20240115123000.md]]", parsed.getFullTranscriptRef());
        assertEquals(List.of("Likes dark roast"), parsed.getKeyTakeaways());
        assertEquals(content, parsed.getRawText());
        assertEquals("[[SN-202401151230-Coffee_chat.md]]", parsed.reference());
    }

    @Test
    void parse_returnsNullWithoutMetadata() {
        assertNull(codec.parse("SN-1", "# Just text"));
    }

    @Test
    void excerpt_prefersSummarySection() {
        SummaryRecord record = SummaryRecord.builder()
                .body("# Title\n\nIntro paragraph.\n\n## Summary\nThe gist of it.\n\n## Main Topics\n- x\n")
                .build();

        assertEquals("The gist of it.", codec.excerpt(record, 500));
        assertEquals("The g...", codec.excerpt(record, 5));
    }

    @Test
    void excerpt_fallsBackToFirstParagraph() {
        SummaryRecord record = SummaryRecord.builder()
                .body("# Title\n\nIntro paragraph.\n\nSecond paragraph.\n")
                .build();

        assertEquals("Intro paragraph.", codec.excerpt(record, 500));
    }

    @Test
    void linkTranscript_addsMetadataAndKeepsExistingKeys() {
        String transcript = "---\nsource: chat\n---\nUser: hi\n";

        String linked = codec.linkTranscript(transcript, "Coffee chat", "[[SN-1.md]]");

        assertTrue(linked.startsWith("---\n"));
        assertTrue(linked.contains("source:"));
        assertTrue(linked.contains("title: \"Coffee chat\""));
        assertTrue(linked.contains("summary_note: \"[[SN-1.md]]\""));
        assertTrue(linked.endsWith("---\nUser: hi\n"));
    }

    @Test
    void linkTranscript_createsMetadataBlockWhenMissing() {
        String linked = codec.linkTranscript("User: hi\n", "Coffee chat", "[[SN-1.md]]");

        assertTrue(linked.startsWith("---\ntitle: \"Coffee chat\"\nsummary_note: \"[[SN-1.md]]\"\n---\n"));
        assertTrue(linked.endsWith("User: hi\n"));
    }
}
