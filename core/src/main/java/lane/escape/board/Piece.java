package lane.escape.board;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.board.enums.Axis;
import lane.escape.board.enums.Direction;
import lane.escape.board.enums.PieceType;

/**
 * A two-cell capsule on the board. The pixel rect is the axis-aligned bounding box of the
 * rotated capsule. {@code removed} and {@code visible} are a runtime overlay owned by the play
 * session and are never serialized.
 */
public class Piece {
    public static final int CELL_COUNT = 2;
    public static final int NO_DEPTH = -1;

    private int id;
    private float x, y, width, height;
    private Direction direction;
    private Axis axis;
    private boolean latticeCoordinates;
    private int gridRow, gridCol;
    private PieceType type;
    private float shortSide;
    private int depth = NO_DEPTH;

    private transient float distNorm;
    private transient boolean removed;
    private transient boolean visible = true;

    // Default constructor for Kryo
    public Piece() {
    }

    /**
     * Creates a piece anchored on the lattice. For a ROW piece the anchor is the upper of its two
     * rows, for a COL piece the left of its two columns.
     */
    public Piece(int id, Axis axis, int gridRow, int gridCol, float centerX, float centerY, Direction direction, float shortSide) {
        this(id, centerX, centerY, direction, shortSide);
        if (!direction.isValidFor(axis)) {
            throw new IllegalArgumentException("Direction " + direction + " is not valid for axis " + axis);
        }
        this.axis = axis;
        this.gridRow = gridRow;
        this.gridCol = gridCol;
        this.latticeCoordinates = true;
    }

    /**
     * Creates a free-floating piece without lattice coordinates. Blocking checks for it always go
     * through the ray march.
     */
    public Piece(int id, float centerX, float centerY, Direction direction, float shortSide) {
        this.id = id;
        this.axis = direction.axis;
        this.shortSide = shortSide;
        this.direction = direction;
        resize(centerX, centerY);
    }

    /**
     * Turns the piece to face {@code newDirection}, keeping its centre.
     * <p>
     * Pre: {@code newDirection} is valid for the piece's axis.
     * Post: the direction is updated and the rect is resized around the same centre.
     */
    public void applyDirection(Direction newDirection) {
        if (!newDirection.isValidFor(axis)) {
            throw new IllegalArgumentException("Direction " + newDirection + " is not valid for axis " + axis + " of piece " + id);
        }
        float cx = getCenterX();
        float cy = getCenterY();
        this.direction = newDirection;
        resize(cx, cy);
    }

    /** Reverses the facing, the way the flip power-up does. */
    public void flip() {
        applyDirection(Direction.opposite(direction));
    }

    /**
     * Moves the piece to a new centre. The piece no longer matches any lattice cell afterwards.
     */
    public void relocate(float centerX, float centerY) {
        latticeCoordinates = false;
        resize(centerX, centerY);
    }

    private void resize(float centerX, float centerY) {
        this.width = PieceGeometry.boundsWidth(direction, shortSide);
        this.height = PieceGeometry.boundsHeight(direction, shortSide);
        this.x = centerX - width / 2f;
        this.y = centerY - height / 2f;
    }

    public int getCellRow(int index) {
        return axis == Axis.ROW ? gridRow + index : gridRow;
    }

    public int getCellCol(int index) {
        return axis == Axis.COL ? gridCol + index : gridCol;
    }

    /** Row of the first cell strictly ahead of the piece when moving in {@code towards}. */
    public int getFrontRow(Direction towards) {
        if (towards.rowDelta < 0) {
            return gridRow - 1;
        }
        if (towards.rowDelta > 0) {
            return axis == Axis.ROW ? gridRow + CELL_COUNT : gridRow + 1;
        }
        return gridRow;
    }

    public int getFrontCol(Direction towards) {
        if (towards.colDelta < 0) {
            return gridCol - 1;
        }
        if (towards.colDelta > 0) {
            return axis == Axis.COL ? gridCol + CELL_COUNT : gridCol + 1;
        }
        return gridCol;
    }

    /**
     * Key of the lattice lane the piece moves along: its column for ROW pieces, its row for COL pieces.
     */
    public long getLaneKey() {
        return axis == Axis.ROW ? Lattice.constructKey(Integer.MIN_VALUE, gridCol) : Lattice.constructKey(gridRow, Integer.MIN_VALUE);
    }

    public boolean isActive() {
        return !removed && visible;
    }

    public Rectangle getRect(Rectangle out) {
        return out.set(x, y, width, height);
    }

    public Rectangle getHitRect(Rectangle out) {
        return PieceGeometry.hitRect(this, out);
    }

    public Piece copy() {
        Piece copy = new Piece();
        copy.id = id;
        copy.x = x;
        copy.y = y;
        copy.width = width;
        copy.height = height;
        copy.direction = direction;
        copy.axis = axis;
        copy.latticeCoordinates = latticeCoordinates;
        copy.gridRow = gridRow;
        copy.gridCol = gridCol;
        copy.type = type;
        copy.shortSide = shortSide;
        copy.depth = depth;
        copy.distNorm = distNorm;
        copy.removed = removed;
        copy.visible = visible;
        return copy;
    }

    public int getId() {
        return id;
    }

    public float getX() {
        return x;
    }

    public float getY() {
        return y;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public float getCenterX() {
        return x + width / 2f;
    }

    public float getCenterY() {
        return y + height / 2f;
    }

    public Direction getDirection() {
        return direction;
    }

    public Axis getAxis() {
        return axis;
    }

    public boolean hasLatticeCoordinates() {
        return latticeCoordinates;
    }

    public int getGridRow() {
        return gridRow;
    }

    public int getGridCol() {
        return gridCol;
    }

    public PieceType getType() {
        return type;
    }

    public void setType(PieceType type) {
        this.type = type;
    }

    public float getShortSide() {
        return shortSide;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public float getDistNorm() {
        return distNorm;
    }

    public void setDistNorm(float distNorm) {
        this.distNorm = distNorm;
    }

    public boolean isRemoved() {
        return removed;
    }

    public void setRemoved(boolean removed) {
        this.removed = removed;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        return "Piece#" + id + "[" + direction + (latticeCoordinates ? " @" + gridRow + "," + gridCol : " free") + "]";
    }
}
