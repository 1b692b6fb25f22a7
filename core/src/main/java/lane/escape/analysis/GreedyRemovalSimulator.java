package lane.escape.analysis;

import com.esotericsoftware.minlog.Log;
import lane.escape.board.Piece;
import lane.escape.common.SeededRandom;

import java.util.ArrayList;
import java.util.List;

/**
 * Plays a board out by repeatedly removing a removable piece until it clears or gets stuck.
 * Works on copies, so the caller's pieces are untouched.
 * <p>
 * The dependency graph is the authoritative solvability check. Randomized playouts are only a
 * cheap pre-filter and a cross-check.
 */
public class GreedyRemovalSimulator {
    private final DeadlockDetector deadlockDetector;

    public GreedyRemovalSimulator(BlockingDetector detector) {
        this.deadlockDetector = new DeadlockDetector(detector);
    }

    /**
     * Always removes the first removable piece in list order.
     *
     * @return true when the board was cleared
     */
    public boolean clearsGreedily(List<Piece> pieces) {
        return playout(pieces, null);
    }

    /**
     * @param random picks which removable piece goes next; null picks the first
     * @return true when the board was cleared
     */
    public boolean playout(List<Piece> pieces, SeededRandom random) {
        List<Piece> board = copyActive(pieces);
        int left = board.size();
        while (left > 0) {
            List<Piece> removable = deadlockDetector.removablePieces(board);
            if (removable.isEmpty()) {
                return false;
            }
            Piece next = random == null ? removable.get(0) : removable.get(random.nextInt(removable.size()));
            next.setRemoved(true);
            left--;
        }
        return true;
    }

    public boolean hasSolvablePath(List<Piece> pieces, int runs, SeededRandom random) {
        for (int i = 0; i < runs; i++) {
            if (playout(pieces, random)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the share of random playouts that got stuck
     */
    public float estimateDeadlockProbability(List<Piece> pieces, int runs, SeededRandom random) {
        if (runs <= 0) {
            return 0f;
        }
        int stuck = 0;
        for (int i = 0; i < runs; i++) {
            if (!playout(pieces, random)) {
                stuck++;
            }
        }
        float probability = stuck / (float) runs;
        Log.debug("GreedyRemovalSimulator", stuck + "/" + runs + " playouts stuck");
        return probability;
    }

    private static List<Piece> copyActive(List<Piece> pieces) {
        List<Piece> board = new ArrayList<>(pieces.size());
        for (Piece piece : pieces) {
            if (piece.isActive()) {
                board.add(piece.copy());
            }
        }
        return board;
    }
}
