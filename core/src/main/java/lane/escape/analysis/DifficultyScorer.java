package lane.escape.analysis;

import lane.escape.Constants;
import lane.escape.level.GenerationParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Difficulty score of a finished board and the accept/reject decision against a level's targets.
 */
public final class DifficultyScorer {
    private static final float WEIGHT_AVG_DEPTH = 0.36f;
    private static final float WEIGHT_MAX_DEPTH = 0.27f;
    private static final float WEIGHT_BLOCKED = 0.20f;
    private static final float WEIGHT_GLOBAL_DIVERSITY = 0.07f;
    private static final float WEIGHT_LOCAL_DIVERSITY = 0.05f;
    private static final float WEIGHT_LANE_DIVERSITY = 0.05f;

    private DifficultyScorer() {
    }

    public static class Verdict {
        public final boolean accepted;
        /** Distance of the score from the level's target */
        public final float distance;
        public final List<String> failures;

        Verdict(boolean accepted, float distance, List<String> failures) {
            this.accepted = accepted;
            this.distance = distance;
            this.failures = Collections.unmodifiableList(failures);
        }

        @Override
        public String toString() {
            return accepted ? "accepted (distance " + distance + ")" : "rejected " + failures + " (distance " + distance + ")";
        }
    }

    /**
     * @return 0-100, rounded to one decimal
     */
    public static float score(GraphStats stats, DirectionStats directions) {
        float avgDepth = Math.min(1f, stats.avgDepth / Constants.SCORE_AVG_DEPTH_NORM);
        float maxDepth = Math.min(1f, stats.maxDepth / Constants.SCORE_MAX_DEPTH_NORM);
        float blocked = clamp01(1f - stats.removableRatio);
        float score = 100f * (WEIGHT_AVG_DEPTH * avgDepth
            + WEIGHT_MAX_DEPTH * maxDepth
            + WEIGHT_BLOCKED * blocked
            + WEIGHT_GLOBAL_DIVERSITY * diversity(directions.maxRatio)
            + WEIGHT_LOCAL_DIVERSITY * diversity(directions.maxLocalRatio)
            + WEIGHT_LANE_DIVERSITY * diversity(directions.maxLaneRatio));
        return Math.round(score * 10f) / 10f;
    }

    /** 1 for a perfectly even split over four directions, 0 when one direction takes everything. */
    static float diversity(float maxRatio) {
        return clamp01(1f - (maxRatio - 0.25f) / 0.75f);
    }

    /**
     * Accepts a board only when every ceiling and target band holds. Ceilings of 0 and a target
     * difficulty of 0 are treated as "no constraint".
     */
    public static Verdict verdict(GenerationParameters params, GraphStats stats, DirectionStats directions,
                                  float score, int pieceCount) {
        List<String> failures = new ArrayList<>();
        if (params.getMaxDirectionRatio() > 0 && directions.maxRatio > params.getMaxDirectionRatio()) {
            failures.add("direction");
        }
        if (params.getMaxLocalDirectionRatio() > 0 && directions.maxLocalRatio > params.getMaxLocalDirectionRatio()) {
            failures.add("localDirection");
        }
        if (params.getMaxLaneDirectionRatio() > 0 && directions.maxLaneRatio > params.getMaxLaneDirectionRatio()) {
            failures.add("laneDirection");
        }
        if (params.getDepthTargetRange() != null && !params.getDepthTargetRange().contains(stats.avgDepth)) {
            failures.add("avgDepth");
        }
        if (params.getRemovableRatioTarget() != null && !params.getRemovableRatioTarget().contains(stats.removableRatio)) {
            failures.add("removableRatio");
        }
        float target = params.getTargetDifficulty();
        if (target != 0f) {
            float min = Math.max(0f, target - params.getDifficultyTolerance());
            float max = target + params.getDifficultyTolerance();
            if (score < min || score > max) {
                failures.add("score");
            }
        }
        if (pieceCount < params.getMinPieceCount()) {
            failures.add("pieceCount");
        }
        return new Verdict(failures.isEmpty(), Math.abs(score - target), failures);
    }

    private static float clamp01(float value) {
        return Math.max(0f, Math.min(1f, value));
    }
}
