package lane.escape.level;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DifficultyParameterizerTest {

    @Test
    void testTutorial() {
        GenerationParameters params = DifficultyParameterizer.forLevel(1);

        assertEquals(DifficultyPhase.TUTORIAL, params.getPhase());
        assertEquals(6, params.getPieceCount());
        assertEquals(4, params.getMinPieceCount());
        assertEquals(28f, params.getShortSide());
        assertFalse(params.isForceFillRate());
    }

    @Test
    void testSecondLevelIsADenseSpike() {
        GenerationParameters params = DifficultyParameterizer.forLevel(2);

        assertEquals(DifficultyPhase.RAMP, params.getPhase());
        assertEquals(120, params.getPieceCount());
        assertEquals(60, params.getMinPieceCount());
        assertTrue(params.isForceFillRate());
        assertEquals(16f, params.getShortSide());
    }

    @ParameterizedTest
    @CsvSource({"1, TUTORIAL", "2, RAMP", "10, RAMP", "11, CHALLENGE", "30, CHALLENGE", "31, MASTER", "60, MASTER", "61, LEGENDARY"})
    void testPhases(int level, DifficultyPhase phase) {
        assertEquals(phase, DifficultyParameterizer.forLevel(level).getPhase());
        assertEquals(phase, DifficultyPhase.forLevel(level));
    }

    @Test
    void testEveryFifthLevelIsARelief() {
        GenerationParameters relief = DifficultyParameterizer.forLevel(10);
        GenerationParameters before = DifficultyParameterizer.forLevel(9);

        assertTrue(relief.isReliefLevel());
        assertFalse(before.isReliefLevel());
        assertTrue(relief.getPieceCount() < before.getPieceCount());
        assertTrue(relief.getDepthFactor() < before.getDepthFactor());
        assertTrue(DifficultyParameterizer.forLevel(5).isReliefLevel());
        assertFalse(DifficultyParameterizer.forLevel(3).isReliefLevel());
    }

    @Test
    void testCurveIsClamped() {
        for (int level = 2; level <= 300; level++) {
            GenerationParameters params = DifficultyParameterizer.forLevel(level);
            assertTrue(params.getPieceCount() >= 120 && params.getPieceCount() <= 200, "level " + level);
            assertTrue(params.getDepthFactor() >= 0.85f && params.getDepthFactor() <= 0.95f, "level " + level);
            assertEquals(Math.round(params.getPieceCount() * 0.5f), params.getMinPieceCount());
        }
        assertEquals(0.852f, DifficultyParameterizer.forLevel(5).getDepthFactor(), 1e-4f);
        assertEquals(0.95f, DifficultyParameterizer.forLevel(99).getDepthFactor(), 1e-6f);
        assertEquals(180, DifficultyParameterizer.forLevel(100).getPieceCount());
    }

    @Test
    void testTargetDifficultyClimbs() {
        float previous = DifficultyParameterizer.forLevel(2).getTargetDifficulty();
        for (int level = 3; level <= 40; level++) {
            float target = DifficultyParameterizer.forLevel(level).getTargetDifficulty();
            assertEquals(previous + 2f, target, 1e-4f);
            previous = target;
        }
    }

    @Test
    void testRejectsLevelBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> DifficultyParameterizer.forLevel(0));
    }
}
