package lane.escape.analysis;

import lane.escape.board.Piece;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-board check run after every removal: a board is deadlocked when pieces remain and
 * none of them can leave.
 */
public class DeadlockDetector {
    private final BlockingDetector detector;

    public DeadlockDetector(BlockingDetector detector) {
        this.detector = detector;
    }

    public boolean isDeadlocked(List<Piece> pieces) {
        OccupancyIndex index = OccupancyIndex.build(pieces);
        boolean anyActive = false;
        for (Piece piece : pieces) {
            if (!piece.isActive()) {
                continue;
            }
            anyActive = true;
            if (!detector.isBlocked(piece, pieces, index)) {
                return false;
            }
        }
        return anyActive;
    }

    public int removableCount(List<Piece> pieces) {
        return removablePieces(pieces).size();
    }

    public List<Piece> removablePieces(List<Piece> pieces) {
        OccupancyIndex index = OccupancyIndex.build(pieces);
        List<Piece> removable = new ArrayList<>();
        for (Piece piece : pieces) {
            if (piece.isActive() && !detector.isBlocked(piece, pieces, index)) {
                removable.add(piece);
            }
        }
        return removable;
    }

    public BlockingDetector getBlockingDetector() {
        return detector;
    }
}
