package lane.escape.board.enums;

/**
 * Orientation of a piece on the lattice. A ROW piece spans two rows of one column and moves
 * along that column; a COL piece spans two columns of one row and moves along that row.
 */
public enum Axis {
    ROW,
    COL;

    public Direction towardLower() {
        return this == ROW ? Direction.UP : Direction.LEFT;
    }

    public Direction towardHigher() {
        return this == ROW ? Direction.DOWN : Direction.RIGHT;
    }
}
