package lane.escape.analysis;

import com.badlogic.gdx.math.Rectangle;
import com.badlogic.gdx.math.Vector2;
import lane.escape.Constants;
import lane.escape.board.Piece;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a piece's exit path is clear and which pieces stand in it.
 * <p>
 * The grid path walks lattice cells ahead of the piece and is used whenever every active piece
 * has lattice coordinates. Otherwise a ray is marched from the piece's centre in steps of
 * {@link Constants#RAY_STEP_SIZE}. Each sample tests the other pieces' hit-rects grown by half
 * the mover's hit-rect, which is the same as sweeping the mover's hit-rect along the ray.
 * A ray that has not left the screen after {@link Constants#RAY_MAX_STEPS} samples counts as
 * blocked. Both paths agree on lattice boards.
 */
public class BlockingDetector {
    private final float screenWidth;
    private final float screenHeight;

    public BlockingDetector(float screenWidth, float screenHeight) {
        this.screenWidth = screenWidth;
        this.screenHeight = screenHeight;
    }

    public boolean isBlocked(Piece piece, List<Piece> pieces) {
        return isBlocked(piece, pieces, OccupancyIndex.build(pieces));
    }

    /**
     * @param index occupancy of {@code pieces}, or null to force the ray march
     */
    public boolean isBlocked(Piece piece, List<Piece> pieces, OccupancyIndex index) {
        if (canUseGrid(piece, index)) {
            return walkGrid(piece, index, null);
        }
        return marchRay(piece, pieces, null);
    }

    public boolean canRemove(Piece piece, List<Piece> pieces) {
        return piece.isActive() && !isBlocked(piece, pieces);
    }

    public List<Piece> findBlockers(Piece piece, List<Piece> pieces) {
        return findBlockers(piece, pieces, OccupancyIndex.build(pieces));
    }

    /**
     * Every active piece that stands anywhere on the exit path, nearest first.
     */
    public List<Piece> findBlockers(Piece piece, List<Piece> pieces, OccupancyIndex index) {
        Set<Piece> blockers = new LinkedHashSet<>();
        if (canUseGrid(piece, index)) {
            walkGrid(piece, index, blockers);
        } else {
            marchRay(piece, pieces, blockers);
        }
        return new ArrayList<>(blockers);
    }

    /** Ray-march only, regardless of lattice coordinates. */
    public boolean isBlockedByRay(Piece piece, List<Piece> pieces) {
        return marchRay(piece, pieces, null);
    }

    public List<Piece> findBlockersByRay(Piece piece, List<Piece> pieces) {
        Set<Piece> blockers = new LinkedHashSet<>();
        marchRay(piece, pieces, blockers);
        return new ArrayList<>(blockers);
    }

    private static boolean canUseGrid(Piece piece, OccupancyIndex index) {
        return index != null
            && piece.hasLatticeCoordinates()
            && piece.getDirection().isValidFor(piece.getAxis());
    }

    /**
     * @param blockers collects every blocker when non-null, otherwise the walk stops at the first
     * @return true when blocked
     */
    private static boolean walkGrid(Piece piece, OccupancyIndex index, Set<Piece> blockers) {
        int rowDelta = piece.getDirection().rowDelta;
        int colDelta = piece.getDirection().colDelta;
        int row = piece.getFrontRow(piece.getDirection());
        int col = piece.getFrontCol(piece.getDirection());
        boolean blocked = false;
        while (index.isInBounds(row, col)) {
            Piece other = index.get(row, col);
            if (other != null && other != piece && other.isActive()) {
                blocked = true;
                if (blockers == null) {
                    return true;
                }
                blockers.add(other);
            }
            row += rowDelta;
            col += colDelta;
        }
        return blocked;
    }

    private boolean marchRay(Piece piece, List<Piece> pieces, Set<Piece> blockers) {
        Rectangle own = piece.getHitRect(new Rectangle());
        float halfW = own.width / 2f;
        float halfH = own.height / 2f;

        List<Rectangle> obstacles = new ArrayList<>();
        List<Piece> owners = new ArrayList<>();
        for (Piece other : pieces) {
            if (other == piece || !other.isActive()) {
                continue;
            }
            Rectangle hit = other.getHitRect(new Rectangle());
            obstacles.add(hit.set(hit.x - halfW, hit.y - halfH, hit.width + halfW * 2, hit.height + halfH * 2));
            owners.add(other);
        }

        Vector2 dir = piece.getDirection().toVector(new Vector2());
        float startX = piece.getCenterX();
        float startY = piece.getCenterY();
        boolean blocked = false;
        for (int step = 1; step <= Constants.RAY_MAX_STEPS; step++) {
            float px = startX + dir.x * Constants.RAY_STEP_SIZE * step;
            float py = startY + dir.y * Constants.RAY_STEP_SIZE * step;
            if (px < 0 || px > screenWidth || py < 0 || py > screenHeight) {
                return blocked;
            }
            for (int i = 0; i < obstacles.size(); i++) {
                if (obstacles.get(i).contains(px, py)) {
                    blocked = true;
                    if (blockers == null) {
                        return true;
                    }
                    blockers.add(owners.get(i));
                }
            }
        }
        // Never left the screen
        return true;
    }

    public float getScreenWidth() {
        return screenWidth;
    }

    public float getScreenHeight() {
        return screenHeight;
    }
}
