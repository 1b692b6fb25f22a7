package lane.escape.analysis;

import lane.escape.level.GenerationParameters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DifficultyScorerTest {

    private static final GenerationParameters PARAMS = GenerationParameters.builder()
        .pieceCount(10, 20)
        .targetDifficulty(50f, 5f)
        .directionRatioCeilings(0.7f, 0.6f, 0.65f)
        .depthTargetRange(1f, 3f)
        .removableRatioTarget(0.1f, 0.3f)
        .build();

    private static DirectionStats directions(float global, float local, float lane) {
        DirectionStats stats = new DirectionStats();
        stats.maxRatio = global;
        stats.maxLocalRatio = local;
        stats.maxLaneRatio = lane;
        return stats;
    }

    @Test
    void testScoreBounds() {
        assertEquals(100f, DifficultyScorer.score(new GraphStats(10, 16, 8f, 0), directions(0.25f, 0.25f, 0.25f)), 0.05f);
        assertEquals(0f, DifficultyScorer.score(new GraphStats(10, 0, 0f, 10), directions(1f, 1f, 1f)), 0.05f);
    }

    @Test
    void testScoreWeightsDepthAndBlocking() {
        float score = DifficultyScorer.score(new GraphStats(20, 8, 4f, 5), directions(0.25f, 0.25f, 0.25f));

        // 36 * 0.5 + 27 * 0.5 + 20 * 0.75 + 17
        assertEquals(63.5f, score, 0.05f);
    }

    @Test
    void testDepthTermsSaturate() {
        float deep = DifficultyScorer.score(new GraphStats(20, 40, 20f, 5), directions(0.25f, 0.25f, 0.25f));
        float capped = DifficultyScorer.score(new GraphStats(20, 16, 8f, 5), directions(0.25f, 0.25f, 0.25f));

        assertEquals(capped, deep);
    }

    @Test
    void testDiversity() {
        assertEquals(1f, DifficultyScorer.diversity(0.25f), 1e-6f);
        assertEquals(0.5f, DifficultyScorer.diversity(0.625f), 1e-6f);
        assertEquals(0f, DifficultyScorer.diversity(1f), 1e-6f);
        assertEquals(1f, DifficultyScorer.diversity(0.1f), 1e-6f);
    }

    @Test
    void testVerdictAcceptsBoardInsideEveryBand() {
        DifficultyScorer.Verdict verdict = DifficultyScorer.verdict(PARAMS, new GraphStats(20, 4, 2f, 4),
            directions(0.3f, 0.4f, 0.5f), 52f, 20);

        assertTrue(verdict.accepted, verdict.toString());
        assertEquals(2f, verdict.distance, 1e-6f);
        assertTrue(verdict.failures.isEmpty());
    }

    @Test
    void testVerdictListsEveryFailure() {
        DifficultyScorer.Verdict verdict = DifficultyScorer.verdict(PARAMS, new GraphStats(20, 9, 6f, 18),
            directions(0.8f, 0.9f, 0.9f), 70f, 5);

        assertFalse(verdict.accepted);
        assertEquals(20f, verdict.distance, 1e-6f);
        assertTrue(verdict.failures.contains("direction"));
        assertTrue(verdict.failures.contains("localDirection"));
        assertTrue(verdict.failures.contains("laneDirection"));
        assertTrue(verdict.failures.contains("avgDepth"));
        assertTrue(verdict.failures.contains("removableRatio"));
        assertTrue(verdict.failures.contains("score"));
        assertTrue(verdict.failures.contains("pieceCount"));
    }

    @Test
    void testZeroCeilingsAndTargetAreIgnored() {
        GenerationParameters open = PARAMS.toBuilder()
            .directionRatioCeilings(0f, 0f, 0f)
            .targetDifficulty(0f, 5f)
            .build();

        DifficultyScorer.Verdict verdict = DifficultyScorer.verdict(open, new GraphStats(20, 4, 2f, 4),
            directions(1f, 1f, 1f), 95f, 20);

        assertTrue(verdict.accepted, verdict.toString());
    }

    @Test
    void testScoreBandIsClampedAtZero() {
        GenerationParameters easy = PARAMS.toBuilder().targetDifficulty(3f, 5f).build();

        DifficultyScorer.Verdict verdict = DifficultyScorer.verdict(easy, new GraphStats(20, 4, 2f, 4),
            directions(0.3f, 0.4f, 0.5f), 0f, 20);

        assertTrue(verdict.accepted, verdict.toString());
    }
}
