package lane.escape.level;

import lane.escape.Constants;
import lane.escape.board.enums.Direction;
import lane.escape.board.enums.LayoutProfileType;
import lane.escape.common.FloatRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable per-level generation settings. Build with {@link #builder()}; the defaults match a
 * mid-game level with a balanced direction mix.
 */
public final class GenerationParameters {
    private static final float MIX_SUM_TOLERANCE = 0.001f;

    private final int level;
    private final DifficultyPhase phase;
    private final boolean reliefLevel;

    private final int pieceCount;
    private final int minPieceCount;
    private final float shortSide;
    private final float depthFactor;
    private final int pieceTypeCount;
    private final float targetFillRate;
    private final boolean forceFillRate;

    private final float[] directionMix;
    private final FloatRange depthTargetRange;
    private final FloatRange removableRatioTarget;
    private final float targetDifficulty;
    private final float difficultyTolerance;

    private final float maxDirectionRatio;
    private final float maxLocalDirectionRatio;
    private final float maxLaneDirectionRatio;
    private final int localDirectionGrid;
    private final float localDirectionWeight;
    private final float axisBalanceWeight;
    private final float laneDirectionWeight;
    private final int laneDirectionMinCount;

    private final List<LayoutProfileType> layoutProfiles;
    private final int maxAttempts;
    private final long maxTimeMs;
    private final int monteCarloRuns;

    private GenerationParameters(Builder builder) {
        this.level = builder.level;
        this.phase = builder.phase;
        this.reliefLevel = builder.reliefLevel;
        this.pieceCount = builder.pieceCount;
        this.minPieceCount = builder.minPieceCount;
        this.shortSide = builder.shortSide;
        this.depthFactor = builder.depthFactor;
        this.pieceTypeCount = builder.pieceTypeCount;
        this.targetFillRate = builder.targetFillRate;
        this.forceFillRate = builder.forceFillRate;
        this.directionMix = builder.directionMix.clone();
        this.depthTargetRange = builder.depthTargetRange;
        this.removableRatioTarget = builder.removableRatioTarget;
        this.targetDifficulty = builder.targetDifficulty;
        this.difficultyTolerance = builder.difficultyTolerance;
        this.maxDirectionRatio = builder.maxDirectionRatio;
        this.maxLocalDirectionRatio = builder.maxLocalDirectionRatio;
        this.maxLaneDirectionRatio = builder.maxLaneDirectionRatio;
        this.localDirectionGrid = builder.localDirectionGrid;
        this.localDirectionWeight = builder.localDirectionWeight;
        this.axisBalanceWeight = builder.axisBalanceWeight;
        this.laneDirectionWeight = builder.laneDirectionWeight;
        this.laneDirectionMinCount = builder.laneDirectionMinCount;
        this.layoutProfiles = Collections.unmodifiableList(new ArrayList<>(builder.layoutProfiles));
        this.maxAttempts = builder.maxAttempts;
        this.maxTimeMs = builder.maxTimeMs;
        this.monteCarloRuns = builder.monteCarloRuns;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.level = level;
        builder.phase = phase;
        builder.reliefLevel = reliefLevel;
        builder.pieceCount = pieceCount;
        builder.minPieceCount = minPieceCount;
        builder.shortSide = shortSide;
        builder.depthFactor = depthFactor;
        builder.pieceTypeCount = pieceTypeCount;
        builder.targetFillRate = targetFillRate;
        builder.forceFillRate = forceFillRate;
        builder.directionMix = directionMix.clone();
        builder.depthTargetRange = depthTargetRange;
        builder.removableRatioTarget = removableRatioTarget;
        builder.targetDifficulty = targetDifficulty;
        builder.difficultyTolerance = difficultyTolerance;
        builder.maxDirectionRatio = maxDirectionRatio;
        builder.maxLocalDirectionRatio = maxLocalDirectionRatio;
        builder.maxLaneDirectionRatio = maxLaneDirectionRatio;
        builder.localDirectionGrid = localDirectionGrid;
        builder.localDirectionWeight = localDirectionWeight;
        builder.axisBalanceWeight = axisBalanceWeight;
        builder.laneDirectionWeight = laneDirectionWeight;
        builder.laneDirectionMinCount = laneDirectionMinCount;
        builder.layoutProfiles = new ArrayList<>(layoutProfiles);
        builder.maxAttempts = maxAttempts;
        builder.maxTimeMs = maxTimeMs;
        builder.monteCarloRuns = monteCarloRuns;
        return builder;
    }

    public int getLevel() {
        return level;
    }

    public DifficultyPhase getPhase() {
        return phase;
    }

    public boolean isReliefLevel() {
        return reliefLevel;
    }

    public int getPieceCount() {
        return pieceCount;
    }

    public int getMinPieceCount() {
        return minPieceCount;
    }

    public float getShortSide() {
        return shortSide;
    }

    public float getDepthFactor() {
        return depthFactor;
    }

    public int getPieceTypeCount() {
        return pieceTypeCount;
    }

    public float getTargetFillRate() {
        return targetFillRate;
    }

    public boolean isForceFillRate() {
        return forceFillRate;
    }

    public float getDirectionMix(Direction direction) {
        return directionMix[direction.ordinal()];
    }

    public FloatRange getDepthTargetRange() {
        return depthTargetRange;
    }

    public FloatRange getRemovableRatioTarget() {
        return removableRatioTarget;
    }

    public float getTargetDifficulty() {
        return targetDifficulty;
    }

    public float getDifficultyTolerance() {
        return difficultyTolerance;
    }

    public float getMaxDirectionRatio() {
        return maxDirectionRatio;
    }

    public float getMaxLocalDirectionRatio() {
        return maxLocalDirectionRatio;
    }

    public float getMaxLaneDirectionRatio() {
        return maxLaneDirectionRatio;
    }

    public int getLocalDirectionGrid() {
        return localDirectionGrid;
    }

    public float getLocalDirectionWeight() {
        return localDirectionWeight;
    }

    public float getAxisBalanceWeight() {
        return axisBalanceWeight;
    }

    public float getLaneDirectionWeight() {
        return laneDirectionWeight;
    }

    public int getLaneDirectionMinCount() {
        return laneDirectionMinCount;
    }

    public List<LayoutProfileType> getLayoutProfiles() {
        return layoutProfiles;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxTimeMs() {
        return maxTimeMs;
    }

    public int getMonteCarloRuns() {
        return monteCarloRuns;
    }

    @Override
    public String toString() {
        return "GenerationParameters{level=" + level
            + ", phase=" + phase
            + ", relief=" + reliefLevel
            + ", pieces=" + minPieceCount + ".." + pieceCount
            + ", shortSide=" + shortSide
            + ", depthFactor=" + depthFactor
            + ", fill=" + targetFillRate + (forceFillRate ? " (forced)" : "")
            + ", mix=" + Arrays.toString(directionMix)
            + ", difficulty=" + targetDifficulty + "+-" + difficultyTolerance
            + ", depth=" + depthTargetRange
            + ", removable=" + removableRatioTarget
            + ", profiles=" + layoutProfiles
            + ", attempts=" + maxAttempts
            + ", timeMs=" + maxTimeMs + "}";
    }

    public static final class Builder {
        private int level = 1;
        private DifficultyPhase phase = DifficultyPhase.RAMP;
        private boolean reliefLevel;
        private int pieceCount = 120;
        private int minPieceCount = 2;
        private float shortSide = Constants.PIECE_DEFAULT_SHORT_SIDE;
        private float depthFactor = 0.6f;
        private int pieceTypeCount = 5;
        private float targetFillRate = 0.7f;
        private boolean forceFillRate;
        private float[] directionMix = {0.25f, 0.25f, 0.25f, 0.25f};
        private FloatRange depthTargetRange;
        private FloatRange removableRatioTarget;
        private float targetDifficulty;
        private float difficultyTolerance = 6f;
        private float maxDirectionRatio = 0.7f;
        private float maxLocalDirectionRatio;
        private float maxLaneDirectionRatio;
        private int localDirectionGrid = 3;
        private float localDirectionWeight = 0.2f;
        private float axisBalanceWeight = 0.25f;
        private float laneDirectionWeight = 0.2f;
        private int laneDirectionMinCount = 3;
        private List<LayoutProfileType> layoutProfiles = new ArrayList<>(Arrays.asList(LayoutProfileType.values()));
        private int maxAttempts = Constants.GENERATION_DEFAULT_MAX_ATTEMPTS;
        private long maxTimeMs = Constants.GENERATION_DEFAULT_MAX_TIME_MS;
        private int monteCarloRuns;

        private Builder() {
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder phase(DifficultyPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder reliefLevel(boolean reliefLevel) {
            this.reliefLevel = reliefLevel;
            return this;
        }

        public Builder pieceCount(int minPieceCount, int pieceCount) {
            this.minPieceCount = minPieceCount;
            this.pieceCount = pieceCount;
            return this;
        }

        public Builder shortSide(float shortSide) {
            this.shortSide = shortSide;
            return this;
        }

        public Builder depthFactor(float depthFactor) {
            this.depthFactor = depthFactor;
            return this;
        }

        public Builder pieceTypeCount(int pieceTypeCount) {
            this.pieceTypeCount = pieceTypeCount;
            return this;
        }

        public Builder fillRate(float targetFillRate, boolean force) {
            this.targetFillRate = targetFillRate;
            this.forceFillRate = force;
            return this;
        }

        /**
         * Target share of each direction, in {@link Direction} order: up, right, down, left.
         */
        public Builder directionMix(float up, float right, float down, float left) {
            this.directionMix = new float[]{up, right, down, left};
            return this;
        }

        public Builder depthTargetRange(float min, float max) {
            this.depthTargetRange = new FloatRange(min, max);
            return this;
        }

        public Builder removableRatioTarget(float min, float max) {
            this.removableRatioTarget = new FloatRange(min, max);
            return this;
        }

        /** A target of 0 disables the score band check. */
        public Builder targetDifficulty(float target, float tolerance) {
            this.targetDifficulty = target;
            this.difficultyTolerance = tolerance;
            return this;
        }

        /** A ratio of 0 disables that check. */
        public Builder directionRatioCeilings(float global, float local, float lane) {
            this.maxDirectionRatio = global;
            this.maxLocalDirectionRatio = local;
            this.maxLaneDirectionRatio = lane;
            return this;
        }

        public Builder localDirection(int grid, float weight) {
            this.localDirectionGrid = grid;
            this.localDirectionWeight = weight;
            return this;
        }

        public Builder axisBalanceWeight(float axisBalanceWeight) {
            this.axisBalanceWeight = axisBalanceWeight;
            return this;
        }

        public Builder laneDirection(float weight, int minCount) {
            this.laneDirectionWeight = weight;
            this.laneDirectionMinCount = minCount;
            return this;
        }

        public Builder layoutProfiles(LayoutProfileType... profiles) {
            this.layoutProfiles = new ArrayList<>(Arrays.asList(profiles));
            return this;
        }

        public Builder budget(int maxAttempts, long maxTimeMs) {
            this.maxAttempts = maxAttempts;
            this.maxTimeMs = maxTimeMs;
            return this;
        }

        /** Number of randomized greedy playouts run as a pre-filter; 0 turns it off. */
        public Builder monteCarloRuns(int monteCarloRuns) {
            this.monteCarloRuns = monteCarloRuns;
            return this;
        }

        public GenerationParameters build() {
            if (level < 1) {
                throw new IllegalArgumentException("Level must be >= 1: " + level);
            }
            if (shortSide <= 0) {
                throw new IllegalArgumentException("Short side must be positive: " + shortSide);
            }
            if (pieceCount < 0 || minPieceCount < 0 || minPieceCount > pieceCount) {
                throw new IllegalArgumentException("Invalid piece count range: " + minPieceCount + ".." + pieceCount);
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("At least one attempt is required: " + maxAttempts);
            }
            if (pieceTypeCount < 1) {
                throw new IllegalArgumentException("At least one piece type is required: " + pieceTypeCount);
            }
            float sum = 0f;
            for (float weight : directionMix) {
                if (weight < 0) {
                    throw new IllegalArgumentException("Direction mix weights must not be negative: " + Arrays.toString(directionMix));
                }
                sum += weight;
            }
            if (Math.abs(sum - 1f) > MIX_SUM_TOLERANCE) {
                throw new IllegalArgumentException("Direction mix must sum to 1: " + Arrays.toString(directionMix));
            }
            return new GenerationParameters(this);
        }
    }
}
