package lane.escape.analysis;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.board.Piece;
import lane.escape.board.enums.Axis;
import lane.escape.board.enums.Direction;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How evenly directions are spread over a board: globally, per sector of an N x N split of the
 * safe rect, and across the lanes of each axis.
 * <p>
 * Every lane faces a single way, so the lane figure compares lanes with each other: for each
 * axis, the share of qualifying lanes (at least {@code laneMinCount} pieces) that face its most
 * common direction. With no qualifying lane, and for the sector figure when sectors are disabled,
 * the neutral value {@link #NEUTRAL_RATIO} is reported.
 */
public class DirectionStats {
    public static final float NEUTRAL_RATIO = 0.25f;

    public int[] counts = new int[Direction.values().length];
    public float maxRatio;
    public float maxLocalRatio;
    public float maxLaneRatio;

    // Default constructor for Kryo
    public DirectionStats() {
    }

    public static DirectionStats compute(List<Piece> pieces, Rectangle safeRect, int localGrid, int laneMinCount) {
        DirectionStats stats = new DirectionStats();
        for (Piece piece : pieces) {
            stats.counts[piece.getDirection().ordinal()]++;
        }
        int total = Math.max(1, pieces.size());
        int max = 0;
        for (int count : stats.counts) {
            max = Math.max(max, count);
        }
        stats.maxRatio = max / (float) total;
        stats.maxLocalRatio = localRatio(pieces, safeRect, localGrid);
        stats.maxLaneRatio = laneRatio(pieces, laneMinCount);
        return stats;
    }

    private static float localRatio(List<Piece> pieces, Rectangle rect, int grid) {
        if (rect == null || grid <= 1 || rect.width <= 0 || rect.height <= 0) {
            return NEUTRAL_RATIO;
        }
        int directions = Direction.values().length;
        Map<Integer, int[]> sectors = new HashMap<>();
        for (Piece piece : pieces) {
            int col = sectorIndex(piece.getCenterX(), rect.x, rect.width, grid);
            int row = sectorIndex(piece.getCenterY(), rect.y, rect.height, grid);
            int[] sector = sectors.computeIfAbsent(row * grid + col, k -> new int[directions + 1]);
            sector[piece.getDirection().ordinal()]++;
            sector[directions]++;
        }
        float worst = 0f;
        for (int[] sector : sectors.values()) {
            int max = 0;
            for (int d = 0; d < directions; d++) {
                max = Math.max(max, sector[d]);
            }
            worst = Math.max(worst, max / (float) sector[directions]);
        }
        return worst;
    }

    private static float laneRatio(List<Piece> pieces, int minCount) {
        Map<Long, int[]> lanes = new HashMap<>();
        Map<Long, Direction> laneDirection = new HashMap<>();
        for (Piece piece : pieces) {
            if (!piece.hasLatticeCoordinates()) {
                continue;
            }
            long key = piece.getLaneKey();
            lanes.computeIfAbsent(key, k -> new int[1])[0]++;
            laneDirection.put(key, piece.getDirection());
        }

        int[] lanesFacing = new int[Direction.values().length];
        for (Map.Entry<Long, int[]> lane : lanes.entrySet()) {
            if (lane.getValue()[0] >= minCount) {
                lanesFacing[laneDirection.get(lane.getKey()).ordinal()]++;
            }
        }

        float worst = 0f;
        for (Axis axis : Axis.values()) {
            int lower = lanesFacing[axis.towardLower().ordinal()];
            int higher = lanesFacing[axis.towardHigher().ordinal()];
            if (lower + higher > 0) {
                worst = Math.max(worst, Math.max(lower, higher) / (float) (lower + higher));
            }
        }
        return worst > 0 ? worst : NEUTRAL_RATIO;
    }

    static int sectorIndex(float value, float origin, float extent, int grid) {
        int index = (int) Math.floor((value - origin) / extent * grid);
        return Math.min(grid - 1, Math.max(0, index));
    }

    public float getRatio(Direction direction) {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        return total > 0 ? counts[direction.ordinal()] / (float) total : 0f;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "up=%d right=%d down=%d left=%d max=%.2f local=%.2f lane=%.2f",
            counts[0], counts[1], counts[2], counts[3], maxRatio, maxLocalRatio, maxLaneRatio);
    }
}
