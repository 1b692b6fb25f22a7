package lane.escape.board;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.board.enums.Axis;
import lane.escape.board.enums.Direction;

/**
 * Hand-built boards on the default 375x667 screen.
 */
public final class BoardFixtures {
    public static final float SCREEN_WIDTH = 375f;
    public static final float SCREEN_HEIGHT = 667f;
    public static final float SHORT_SIDE = 16f;

    private BoardFixtures() {
    }

    public static Rectangle boardRect() {
        return PieceGeometry.boardRect(SCREEN_WIDTH, SCREEN_HEIGHT);
    }

    public static Lattice lattice() {
        return Lattice.create(SHORT_SIDE, boardRect());
    }

    /**
     * A ROW piece covering (row, col) and (row + 1, col).
     */
    public static Piece rowPiece(Lattice lattice, int id, int row, int col, Direction direction) {
        float cx = (lattice.cellX(row, col) + lattice.cellX(row + 1, col)) / 2f;
        float cy = (lattice.cellY(row, col) + lattice.cellY(row + 1, col)) / 2f;
        return new Piece(id, Axis.ROW, row, col, cx, cy, direction, lattice.getShortSide());
    }

    /**
     * A COL piece covering (row, col) and (row, col + 1).
     */
    public static Piece colPiece(Lattice lattice, int id, int row, int col, Direction direction) {
        float cx = (lattice.cellX(row, col) + lattice.cellX(row, col + 1)) / 2f;
        float cy = (lattice.cellY(row, col) + lattice.cellY(row, col + 1)) / 2f;
        return new Piece(id, Axis.COL, row, col, cx, cy, direction, lattice.getShortSide());
    }
}
