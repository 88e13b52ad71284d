package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.model.RankedTopic;
import me.golemcore.memoria.domain.model.ScoredKeyword;
import me.golemcore.memoria.domain.model.TopicScore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopicRankerTest {

    private final TopicRanker ranker = new TopicRanker();

    @Test
    void rank_combinesPromptScoreAndImportance() {
        Map<String, TopicScore> scores = Map.of(
                "Coffee", new TopicScore(100, "SN-1", 4),
                "Tea", new TopicScore(0, "SN-2", 1));

        List<RankedTopic> ranked = ranker.rank(List.of(
                new ScoredKeyword("Tea", 90),
                new ScoredKeyword("Coffee", 80)), scores);

        assertEquals(2, ranked.size());
        assertEquals("Coffee", ranked.get(0).topic());
        assertEquals(86.0, ranked.get(0).score(), 1e-9);
        assertEquals("Tea", ranked.get(1).topic());
        assertEquals(63.0, ranked.get(1).score(), 1e-9);
    }

    @Test
    void rank_dropsUnknownKeywords() {
        List<RankedTopic> ranked = ranker.rank(List.of(new ScoredKeyword("Mountains", 95)),
                Map.of("Coffee", new TopicScore(50, "SN-1", 1)));

        assertTrue(ranked.isEmpty());
    }

    @Test
    void rank_keepsInputOrderForEqualScores() {
        Map<String, TopicScore> scores = Map.of(
                "A", new TopicScore(50, "SN-1", 1),
                "B", new TopicScore(50, "SN-1", 1));

        List<RankedTopic> ranked = ranker.rank(List.of(
                new ScoredKeyword("B", 60), new ScoredKeyword("A", 60)), scores);

        assertEquals(List.of("B", "A"), ranked.stream().map(RankedTopic::topic).toList());
    }

    @Test
    void rank_handlesMissingInputs() {
        assertTrue(ranker.rank(null, Map.of()).isEmpty());
        assertTrue(ranker.rank(List.of(new ScoredKeyword("A", 1)), null).isEmpty());
    }
}
