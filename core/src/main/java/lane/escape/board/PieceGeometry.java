package lane.escape.board;

import com.badlogic.gdx.math.MathUtils;
import com.badlogic.gdx.math.Rectangle;
import lane.escape.Constants;
import lane.escape.board.enums.Direction;

/**
 * Pixel geometry shared by the lattice, the placer and the blocking detector.
 */
public final class PieceGeometry {

    private PieceGeometry() {
    }

    /**
     * Play area between the HUD bars for a given screen size.
     */
    public static Rectangle boardRect(float screenWidth, float screenHeight) {
        if (screenWidth < 0 || screenHeight < 0) {
            throw new IllegalArgumentException("Screen size must not be negative: " + screenWidth + "x" + screenHeight);
        }
        float x = Constants.LAYOUT_BOARD_SIDE_PADDING;
        float y = Constants.LAYOUT_TOP_BAR_HEIGHT + Constants.LAYOUT_BOARD_TOP_OFFSET;
        float width = Math.max(0f, screenWidth - Constants.LAYOUT_BOARD_SIDE_PADDING * 2);
        float bottomY = screenHeight - Constants.LAYOUT_BOTTOM_BAR_HEIGHT - Constants.LAYOUT_BOARD_BOTTOM_MARGIN;
        float height = Math.max(0f, bottomY - y);
        return new Rectangle(x, y, width, height);
    }

    public static float longSide(float shortSide) {
        return shortSide * Constants.PIECE_ASPECT_RATIO;
    }

    /**
     * Width of the axis-aligned bounding box of a capsule rotated to face {@code direction}.
     */
    public static float boundsWidth(Direction direction, float shortSide) {
        float c = Math.abs(MathUtils.cosDeg(direction.angleDegrees));
        float s = Math.abs(MathUtils.sinDeg(direction.angleDegrees));
        return c * longSide(shortSide) + s * shortSide;
    }

    public static float boundsHeight(Direction direction, float shortSide) {
        float c = Math.abs(MathUtils.cosDeg(direction.angleDegrees));
        float s = Math.abs(MathUtils.sinDeg(direction.angleDegrees));
        return s * longSide(shortSide) + c * shortSide;
    }

    /**
     * Gap between neighbouring lattice cells. Wide enough that a capsule spanning two cells
     * fits its long side.
     */
    public static float cellGap(float shortSide) {
        float baseGap = Math.max(Constants.LATTICE_MIN_GAP, Math.round(shortSide * Constants.LATTICE_GAP_RATIO));
        return Math.max(baseGap, Math.round(longSide(shortSide) - 2 * shortSide));
    }

    /** Distance between neighbouring cell centres, measured along a lane. */
    public static float cellStep(float shortSide) {
        return shortSide + cellGap(shortSide);
    }

    /**
     * Insets {@code boardRect} so that a piece centred anywhere inside the result is not clipped.
     */
    public static Rectangle safeRect(Rectangle boardRect, float shortSide) {
        float halfW = boundsWidth(Direction.UP, shortSide) / 2f;
        float halfH = boundsHeight(Direction.UP, shortSide) / 2f;
        float marginX = Constants.LAYOUT_SAFETY_MARGIN + halfW + Constants.LAYOUT_RENDER_MARGIN;
        float marginY = Constants.LAYOUT_SAFETY_MARGIN + halfH + Constants.LAYOUT_RENDER_MARGIN;
        return new Rectangle(
            boardRect.x + marginX,
            boardRect.y + marginY,
            Math.max(0f, boardRect.width - marginX * 2),
            Math.max(0f, boardRect.height - marginY * 2));
    }

    /**
     * Eroded hit-rect of a piece: its bounding box shrunk on every side so that diagonal
     * neighbours in adjacent lanes never overlap.
     */
    public static Rectangle hitRect(Piece piece, Rectangle out) {
        float inset = hitInset(piece.getWidth(), piece.getHeight());
        float width = Math.max(0f, piece.getWidth() - inset * 2);
        float height = Math.max(0f, piece.getHeight() - inset * 2);
        return out.set(piece.getX() + inset, piece.getY() + inset, width, height);
    }

    static float hitInset(float width, float height) {
        float ratioInset = Math.min(width, height) * Constants.PIECE_COLLISION_SHRINK;
        return Math.max(Constants.PIECE_HITBOX_INSET, ratioInset);
    }
}
