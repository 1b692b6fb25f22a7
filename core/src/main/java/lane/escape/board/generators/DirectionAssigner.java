package lane.escape.board.generators;

import com.badlogic.gdx.math.Rectangle;
import com.esotericsoftware.minlog.Log;
import lane.escape.Constants;
import lane.escape.board.Lattice;
import lane.escape.board.Piece;
import lane.escape.board.enums.Direction;
import lane.escape.common.SeededRandom;
import lane.escape.level.GenerationParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Peel assignment: gives every placed piece a direction so that the board is solvable by
 * construction.
 * <p>
 * Each step looks at every unassigned piece and each of its directions whose path to the lattice
 * edge is clear of unassigned pieces, scores the candidates and commits the best one. A committed
 * piece's cells are released, so it no longer blocks anyone. The commit order is therefore a valid
 * removal order: each piece's path was clear of everything committed after it.
 * <p>
 * Once a lane has a direction, every later piece in that lane may only use that direction, which
 * keeps each lane facing one way. If no candidate is left the attempt is a dead end; the pieces
 * committed so far still form a solvable board ({@link #getCommitted()}).
 */
public class DirectionAssigner {
    private static final int DIRECTION_COUNT = Direction.values().length;

    private final Lattice lattice;
    private final GenerationParameters params;
    private final SeededRandom random;
    private final Rectangle safeRect;
    private final int total;

    private final List<Piece> remaining;
    private final List<Piece> committed = new ArrayList<>();
    private final float[] targetCounts = new float[DIRECTION_COUNT];
    private final int[] counts = new int[DIRECTION_COUNT];
    /** Per sector: count per direction, total in the last slot */
    private final Map<Integer, int[]> sectorCounts = new HashMap<>();
    private final Map<Long, Direction> laneDirections = new HashMap<>();
    /** Number of lanes locked to each direction */
    private final int[] laneCounts = new int[DIRECTION_COUNT];

    private StepResult state = StepResult.CONTINUE;

    public DirectionAssigner(Lattice lattice, List<Piece> pieces, GenerationParameters params, SeededRandom random) {
        this.lattice = lattice;
        this.params = params;
        this.random = random;
        this.safeRect = lattice.getSafeRect();
        this.remaining = new ArrayList<>(pieces);
        this.total = pieces.size();
        for (Direction direction : Direction.values()) {
            targetCounts[direction.ordinal()] = params.getDirectionMix(direction) * total;
        }
    }

    public StepResult assignAll() {
        while (step() == StepResult.CONTINUE) {
            // keep going
        }
        return state;
    }

    /**
     * Commits one piece.
     */
    public StepResult step() {
        if (state != StepResult.CONTINUE) {
            return state;
        }
        if (remaining.isEmpty()) {
            state = StepResult.COMPLETE;
            return state;
        }

        Piece bestPiece = null;
        Direction bestDirection = null;
        float bestScore = 0f;
        for (Piece piece : remaining) {
            int[] sector = sectorStats(sectorKey(piece));
            Direction locked = laneDirections.get(piece.getLaneKey());
            Direction[] options = locked != null
                ? new Direction[]{locked}
                : new Direction[]{piece.getAxis().towardLower(), piece.getAxis().towardHigher()};
            for (Direction direction : options) {
                if (!lattice.isPathClearToEdge(piece, direction)) {
                    continue;
                }
                float score = score(piece, direction, sector);
                if (bestPiece == null || score > bestScore) {
                    bestPiece = piece;
                    bestDirection = direction;
                    bestScore = score;
                }
            }
        }

        if (bestPiece == null) {
            Log.debug("DirectionAssigner", "Dead end after " + committed.size() + "/" + total + " pieces");
            state = StepResult.DEADEND;
            return state;
        }

        commit(bestPiece, bestDirection);
        if (remaining.isEmpty()) {
            state = StepResult.COMPLETE;
        }
        return state;
    }

    private float score(Piece piece, Direction direction, int[] sector) {
        int d = direction.ordinal();
        float mix = params.getDirectionMix(direction);
        float deficit = targetCounts[d] - counts[d];

        int sectorTotal = sector[DIRECTION_COUNT];
        float localRatio = sectorTotal > 0 ? sector[d] / (float) sectorTotal : 0f;
        float localDeficit = (mix - localRatio) * params.getLocalDirectionWeight();

        // Lanes are uniform, so balance is measured across the lanes of one axis
        Direction opposite = Direction.opposite(direction);
        float pairMix = mix + params.getDirectionMix(opposite);
        float laneShare = pairMix > 0 ? mix / pairMix : 0.5f;
        int pairLanes = laneCounts[d] + laneCounts[opposite.ordinal()];
        float laneRatio = pairLanes > 0 ? laneCounts[d] / (float) pairLanes : 0f;
        float laneDeficit = (laneShare - laneRatio) * params.getLaneDirectionWeight();

        float depthBias = piece.getDistNorm() * params.getDepthFactor();
        return deficit + localDeficit + laneDeficit + depthBias + random.jitter(Constants.PEEL_SCORE_JITTER);
    }

    private void commit(Piece piece, Direction direction) {
        lattice.release(piece);
        piece.applyDirection(direction);

        int d = direction.ordinal();
        counts[d]++;
        int[] sector = sectorStats(sectorKey(piece));
        sector[d]++;
        sector[DIRECTION_COUNT]++;
        if (laneDirections.put(piece.getLaneKey(), direction) == null) {
            laneCounts[d]++;
        }

        remaining.remove(piece);
        committed.add(piece);
        Log.trace("DirectionAssigner", "Committed " + piece + " (" + committed.size() + "/" + total + ")");
    }

    private int sectorKey(Piece piece) {
        int grid = params.getLocalDirectionGrid();
        if (grid <= 1 || safeRect.width <= 0 || safeRect.height <= 0) {
            return 0;
        }
        int col = sectorIndex(piece.getCenterX(), safeRect.x, safeRect.width, grid);
        int row = sectorIndex(piece.getCenterY(), safeRect.y, safeRect.height, grid);
        return row * grid + col;
    }

    static int sectorIndex(float value, float origin, float extent, int grid) {
        int index = (int) Math.floor((value - origin) / extent * grid);
        return Math.min(grid - 1, Math.max(0, index));
    }

    private int[] sectorStats(int key) {
        int[] stats = sectorCounts.get(key);
        if (stats == null) {
            stats = new int[DIRECTION_COUNT + 1];
            sectorCounts.put(key, stats);
        }
        return stats;
    }

    public StepResult getState() {
        return state;
    }

    /**
     * Pieces with a final direction, in commit order. This is a valid removal order for the
     * committed pieces, also after a dead end.
     */
    public List<Piece> getCommitted() {
        return Collections.unmodifiableList(committed);
    }

    public int getTotal() {
        return total;
    }
}
