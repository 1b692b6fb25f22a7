package lane.escape.analysis;

import lane.escape.board.Lattice;
import lane.escape.board.Piece;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cell-to-piece lookup over the active pieces of a board, with the bounding box of every
 * occupied cell. Walking past the bounding box means nothing further can block.
 */
public class OccupancyIndex {
    private final Map<Long, Piece> cells = new HashMap<>();
    private int minRow = Integer.MAX_VALUE, maxRow = Integer.MIN_VALUE;
    private int minCol = Integer.MAX_VALUE, maxCol = Integer.MIN_VALUE;

    private OccupancyIndex() {
    }

    /**
     * @return the index, or null when an active piece has no lattice coordinates and the grid
     * cannot describe the board
     */
    public static OccupancyIndex build(List<Piece> pieces) {
        OccupancyIndex index = new OccupancyIndex();
        for (Piece piece : pieces) {
            if (!piece.isActive()) {
                continue;
            }
            if (!piece.hasLatticeCoordinates()) {
                return null;
            }
            for (int i = 0; i < Piece.CELL_COUNT; i++) {
                index.put(piece.getCellRow(i), piece.getCellCol(i), piece);
            }
        }
        return index;
    }

    private void put(int row, int col, Piece piece) {
        cells.put(Lattice.constructKey(row, col), piece);
        minRow = Math.min(minRow, row);
        maxRow = Math.max(maxRow, row);
        minCol = Math.min(minCol, col);
        maxCol = Math.max(maxCol, col);
    }

    public Piece get(int row, int col) {
        return cells.get(Lattice.constructKey(row, col));
    }

    public boolean isInBounds(int row, int col) {
        return row >= minRow && row <= maxRow && col >= minCol && col <= maxCol;
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public int size() {
        return cells.size();
    }
}
