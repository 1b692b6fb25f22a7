package lane.escape.analysis;

import lane.escape.board.Piece;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One piece in the blocking graph. An edge A -> B means A stands in B's exit path;
 * A lists B in {@code blocking} and B lists A in {@code blockedBy}.
 */
public class DependencyGraphNode {
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    private final int id;
    private final Piece piece;
    final Set<Integer> blockedBy = new LinkedHashSet<>();
    final Set<Integer> blocking = new LinkedHashSet<>();
    int depth = UNREACHABLE;

    DependencyGraphNode(Piece piece) {
        this.id = piece.getId();
        this.piece = piece;
    }

    public int getId() {
        return id;
    }

    public Piece getPiece() {
        return piece;
    }

    public Set<Integer> getBlockedBy() {
        return Collections.unmodifiableSet(blockedBy);
    }

    public Set<Integer> getBlocking() {
        return Collections.unmodifiableSet(blocking);
    }

    public int getInDegree() {
        return blockedBy.size();
    }

    public int getOutDegree() {
        return blocking.size();
    }

    /**
     * @return the layer this piece clears in, or {@link #UNREACHABLE} when it sits in or behind a cycle
     */
    public int getDepth() {
        return depth;
    }

    public boolean isReachable() {
        return depth != UNREACHABLE;
    }

    public boolean isRemovable() {
        return blockedBy.isEmpty() && piece.isActive();
    }

    @Override
    public String toString() {
        return "Node#" + id + "{in=" + getInDegree() + ", out=" + getOutDegree()
            + ", depth=" + (isReachable() ? String.valueOf(depth) : "inf") + "}";
    }
}
