package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.model.HistoryEntry;
import me.golemcore.memoria.domain.model.TopicProfile;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicProfileCodecTest {

    private static final String REF_JAN = "[[SN-202401151230-Coffee.md]]";
    private static final String REF_FEB = "[[SN-202402011000-Beans.md]]";

    private final TopicProfileCodec codec = new TopicProfileCodec();

    private TopicProfile sampleProfile() {
        return TopicProfile.builder()
                .topic("Coffee")
                .aliases(List.of("Kaffee"))
                .keyThemes(List.of("roasting", "brewing"))
                .sentimentOverall("Positive")
                .sentimentDetails(List.of("likes dark roast"))
                .significance("Daily ritual")
                .relatedTopics(List.of("[[TPN-Tea]]"))
                .summaryRefs(List.of(REF_FEB, REF_JAN))
                .overview("The user drinks coffee every morning.")
                .contexts(List.of(new HistoryEntry(REF_FEB, "Bought new beans."),
                        new HistoryEntry(REF_JAN, "Discussed brewing.")))
                .opinions(List.of(new HistoryEntry(REF_FEB, "Prefers Ethiopian beans.")))
                .otherNotes("None.")
                .createdAt(LocalDateTime.of(2024, 1, 15, 12, 30))
                .updatedAt(LocalDateTime.of(2024, 2, 1, 10, 0))
                .lastReferencedRecord(REF_FEB)
                .mentionCount(2)
                .build();
    }

    @Test
    void renderBody_writesSectionsAndDatedHistory() {
        String body = codec.renderBody(sampleProfile());

        assertTrue(body.startsWith("# Coffee\n\n## Overview\n\nThe user drinks coffee every morning.\n"));
        assertTrue(body.contains("- **2024/02/01 " + REF_FEB + "**: Bought new beans.\n"));
        assertTrue(body.contains("- **2024/01/15 " + REF_JAN + "**: Discussed brewing.\n"));
        assertTrue(body.contains("## User Opinions\n\n- **" + REF_FEB + "**: Prefers Ethiopian beans.\n"));
        assertTrue(body.contains("## Other Notes\n\nNone.\n"));
    }

    @Test
    void renderContextLines_usesUnknownDateForUndatedReference() {
        String lines = codec.renderContextLines(List.of(new HistoryEntry("[[Loose-note.md]]", "multi\nline")));

        assertEquals("- **Unknown Date [[Loose-note.md]]**: multi line\n", lines);
    }

    @Test
    void renderThenParse_preservesProfile() {
        TopicProfile original = sampleProfile();

        TopicProfile parsed = codec.parse(codec.render(original));

        assertNotNull(parsed);
        assertEquals("Coffee", parsed.getTopic());
        assertEquals(original.getAliases(), parsed.getAliases());
        assertEquals(original.getKeyThemes(), parsed.getKeyThemes());
        assertEquals("Positive", parsed.getSentimentOverall());
        assertEquals(original.getSummaryRefs(), parsed.getSummaryRefs());
        assertEquals(original.getContexts(), parsed.getContexts());
        assertEquals(original.getOpinions(), parsed.getOpinions());
        assertEquals(original.getOverview(), parsed.getOverview());
        assertEquals(original.getCreatedAt(), parsed.getCreatedAt());
        assertEquals(REF_FEB, parsed.getLastReferencedRecord());
        assertEquals(2, parsed.getMentionCount());
    }

    @Test
    void parse_recoversHistoryFromBodyWhenHeaderLacksIt() {
        String content = """
                ---
                tag_name: Coffee
                type: tag_profile
                ---

                # Coffee

                ## Overview

                Morning drink.

                ## Prior Contexts

                - **2024/01/15 [[SN-202401151230-Coffee.md]]**: Discussed brewing.
                - [[SN-202402011000-Beans.md]]: Bought new beans.
                - a line without a link

                ## User Opinions

                - **[[SN-202402011000-Beans.md]]**: Prefers light roast.

                ## Other Notes

                """;

        TopicProfile parsed = codec.parse(content);

        assertNotNull(parsed);
        assertEquals(List.of(new HistoryEntry(REF_JAN, "Discussed brewing."),
                new HistoryEntry(REF_FEB, "Bought new beans.")), parsed.getContexts());
        assertEquals(List.of(new HistoryEntry(REF_FEB, "Prefers light roast.")), parsed.getOpinions());
        assertEquals("Morning drink.", parsed.getOverview());
        assertEquals(0, parsed.getMentionCount());
    }

    @Test
    void parse_returnsNullWithoutMetadataBlock() {
        assertNull(codec.parse("# Coffee\n\n## Overview\n"));
    }

    @Test
    void parse_returnsNullForBrokenMetadata() {
        assertNull(codec.parse("---\ntag_name: [unclosed\n---\n# Coffee\n"));
    }
}
