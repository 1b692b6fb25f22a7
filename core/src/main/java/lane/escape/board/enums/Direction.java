package lane.escape.board.enums;

import com.badlogic.gdx.math.Vector2;

/**
 * Facing of a piece. The lattice is rotated 45 degrees, so every direction points diagonally
 * on screen: UP is north-east, RIGHT south-east, DOWN south-west and LEFT north-west
 * (screen y grows downwards).
 */
public enum Direction {
    UP(-1, 0, Axis.ROW, -45f),
    RIGHT(0, 1, Axis.COL, 45f),
    DOWN(1, 0, Axis.ROW, 135f),
    LEFT(0, -1, Axis.COL, -135f);

    private static final float INV_SQRT2 = (float) (1.0 / Math.sqrt(2.0));

    public final int rowDelta;
    public final int colDelta;
    public final Axis axis;
    /** Rotation of the capsule sprite in degrees */
    public final float angleDegrees;

    Direction(int rowDelta, int colDelta, Axis axis, float angleDegrees) {
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
        this.axis = axis;
        this.angleDegrees = angleDegrees;
    }

    public static Direction opposite(Direction direction) {
        switch (direction) {
            case UP: return DOWN;
            case DOWN: return UP;
            case LEFT: return RIGHT;
            default: return LEFT;
        }
    }

    /**
     * Unit vector of this direction in screen space.
     */
    public Vector2 toVector(Vector2 out) {
        // (col - row) maps to x, (col + row) maps to y
        float x = (colDelta - rowDelta) * INV_SQRT2;
        float y = (colDelta + rowDelta) * INV_SQRT2;
        return out.set(x, y);
    }

    public boolean isValidFor(Axis pieceAxis) {
        return axis == pieceAxis;
    }
}
