package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import me.golemcore.memoria.domain.model.SufficiencyVerdict;
import me.golemcore.memoria.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelJsonExtractorTest {

    private final ModelJsonExtractor extractor = new ModelJsonExtractor(AutoConfiguration.objectMapper());

    @Test
    void shouldReadFencedObject() {
        SufficiencyVerdict verdict = extractor.readObject("""
                Here is my answer:
                ```json
                {"sufficient_for_response": false, "next_summary_notes_to_fetch": ["SN-1"]}
                ```
                """, SufficiencyVerdict.class);

        assertFalse(verdict.isSufficient());
        assertEquals(List.of("SN-1"), verdict.getSummaryRecordsToFetch());
    }

    @Test
    void shouldReadObjectSurroundedByProse() {
        SufficiencyVerdict verdict = extractor.readObject(
                "Verdict: {\"sufficient_for_response\": true} hope that helps", SufficiencyVerdict.class);

        assertTrue(verdict.isSufficient());
    }

    @Test
    void shouldReadBareList() {
        List<KeywordExtractor.KeywordCandidate> candidates = extractor.readList(
                "[{\"keyword\": \"Coffee\", \"score\": 80}]", KeywordExtractor.KeywordCandidate.class);

        assertEquals(1, candidates.size());
        assertEquals("Coffee", candidates.get(0).getKeyword());
        assertEquals(80.0, candidates.get(0).getScore());
    }

    @Test
    void shouldRejectResponsesWithoutJson() {
        assertThrows(ModelResponseParseException.class,
                () -> extractor.readObject("no json here", SufficiencyVerdict.class));
        assertThrows(ModelResponseParseException.class,
                () -> extractor.readList(" ", KeywordExtractor.KeywordCandidate.class));
    }
}
