package lane.escape.level;

import lane.escape.board.enums.LayoutProfileType;

/**
 * Maps a level index to its generation parameters.
 * <p>
 * Level 1 is a small tutorial board and level 2 jumps straight to a dense board. From level 3
 * the target difficulty climbs by two points per level while piece count and depth bias ramp up
 * over the next fifty levels. Every fifth level is a relief level with slightly fewer pieces and
 * less depth bias.
 */
public final class DifficultyParameterizer {
    /** Levels over which the level 3+ curve reaches its maximum */
    private static final int RAMP_LEVELS = 50;
    private static final int RELIEF_CYCLE = 5;
    private static final float MIN_PIECE_SHARE = 0.5f;

    private DifficultyParameterizer() {
    }

    public static GenerationParameters forLevel(int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be >= 1: " + level);
        }
        if (level == 1) {
            return tutorial();
        }
        if (level == 2) {
            return spike();
        }
        return progressive(level);
    }

    private static GenerationParameters tutorial() {
        return GenerationParameters.builder()
            .level(1)
            .phase(DifficultyPhase.TUTORIAL)
            .pieceCount(4, 6)
            .shortSide(28f)
            .depthFactor(0.05f)
            .pieceTypeCount(3)
            .targetDifficulty(10f, 4f)
            .depthTargetRange(0f, 1.8f)
            .removableRatioTarget(0.6f, 1.0f)
            .directionRatioCeilings(0.9f, 0.9f, 0.9f)
            .localDirection(2, 0.1f)
            .axisBalanceWeight(0.2f)
            .laneDirection(0.15f, 2)
            .directionMix(0.3f, 0.25f, 0.25f, 0.2f)
            .layoutProfiles(LayoutProfileType.UNIFORM, LayoutProfileType.HOLLOW_CENTER)
            .budget(3, 3000L)
            .build();
    }

    private static GenerationParameters spike() {
        return GenerationParameters.builder()
            .level(2)
            .phase(DifficultyPhase.forLevel(2))
            .pieceCount(minPieces(120), 120)
            .shortSide(16f)
            .depthFactor(0.9f)
            .pieceTypeCount(4)
            .targetDifficulty(80f, 8f)
            .depthTargetRange(4.5f, 7.5f)
            .removableRatioTarget(0.08f, 0.22f)
            .directionRatioCeilings(0.7f, 0.65f, 0.7f)
            .localDirection(3, 0.35f)
            .axisBalanceWeight(0.35f)
            .laneDirection(0.45f, 3)
            .layoutProfiles(LayoutProfileType.RING, LayoutProfileType.DIAGONAL_BAND,
                LayoutProfileType.TWIN_CLUSTER, LayoutProfileType.HOLLOW_CENTER)
            .budget(3, 2000L)
            .fillRate(0.85f, true)
            .build();
    }

    private static GenerationParameters progressive(int level) {
        float progress = Math.min(1f, (level - 3) / (float) RAMP_LEVELS);
        int pieceCount = Math.round(120 + progress * 70);
        float depthFactor = 0.9f + progress * 0.05f;

        int cyclePosition = (level - 1) % RELIEF_CYCLE;
        boolean relief = cyclePosition == RELIEF_CYCLE - 1;
        int pieceAdjust = relief ? -10 : cyclePosition * 3;
        float depthAdjust = relief ? -0.05f : cyclePosition * 0.01f;

        pieceCount = clamp(pieceCount + pieceAdjust, 120, 200);
        depthFactor = clamp(depthFactor + depthAdjust, 0.85f, 0.95f);

        float avgDepthTarget = 5.0f + progress * 2.6f;
        float removableBase = Math.max(0.1f, 0.2f - progress * 0.08f);

        return GenerationParameters.builder()
            .level(level)
            .phase(DifficultyPhase.forLevel(level))
            .reliefLevel(relief)
            .pieceCount(minPieces(pieceCount), pieceCount)
            .shortSide(16f)
            .depthFactor(depthFactor)
            .pieceTypeCount(level < 10 ? 4 : 5)
            .targetDifficulty(80f + (level - 2) * 2f, 6f)
            .depthTargetRange(avgDepthTarget - 1.2f, avgDepthTarget + 1.2f)
            .removableRatioTarget(Math.max(0.06f, removableBase - 0.05f), Math.min(0.28f, removableBase + 0.05f))
            .directionRatioCeilings(0.7f, 0.6f, 0.65f)
            .localDirection(4, 0.5f)
            .axisBalanceWeight(0.35f)
            .laneDirection(0.5f, 3)
            .layoutProfiles(LayoutProfileType.RING, LayoutProfileType.DIAGONAL_BAND,
                LayoutProfileType.TWIN_CLUSTER, LayoutProfileType.HOLLOW_CENTER, LayoutProfileType.UNIFORM)
            .budget(6, 2500L)
            .fillRate(Math.min(0.9f, 0.83f + progress * 0.05f), false)
            .build();
    }

    private static int minPieces(int pieceCount) {
        return Math.round(pieceCount * MIN_PIECE_SHARE);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }
}
