package lane.escape.board;

/**
 * One lattice position with its pixel centre. Occupancy is only changed through {@link Lattice}.
 */
public class LatticeCell {
    public static final int NO_PIECE = -1;

    public final int row, col;
    public final float x, y;
    public final long key;
    /** True when the cell touches the outside of the lattice */
    public final boolean edge;

    boolean occupied;
    int pieceId = NO_PIECE;

    LatticeCell(int row, int col, float x, float y, boolean edge) {
        this.row = row;
        this.col = col;
        this.x = x;
        this.y = y;
        this.key = Lattice.constructKey(row, col);
        this.edge = edge;
    }

    public boolean isOccupied() {
        return occupied;
    }

    public int getPieceId() {
        return pieceId;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")" + (occupied ? "#" + pieceId : "");
    }
}
