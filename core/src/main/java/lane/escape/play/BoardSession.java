package lane.escape.play;

import com.esotericsoftware.minlog.Log;
import lane.escape.analysis.BlockingDetector;
import lane.escape.analysis.DeadlockDetector;
import lane.escape.analysis.DependencyGraph;
import lane.escape.analysis.DependencyGraphNode;
import lane.escape.board.Piece;
import lane.escape.level.GenerationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime state of one board being played. Owns copies of the generated pieces and layers the
 * removed flag on them; the blocking graph is kept in step with every removal.
 * Not thread-safe; drive it from the game loop.
 */
public class BoardSession {
    private final int level;
    private final List<Piece> pieces;
    private final Map<Integer, Piece> byId = new HashMap<>();
    private final BlockingDetector detector;
    private final DeadlockDetector deadlockDetector;
    private DependencyGraph graph;
    private int moves;

    public BoardSession(GenerationResult result, float screenWidth, float screenHeight) {
        this(result.level, result.copyPieces(), new BlockingDetector(screenWidth, screenHeight));
    }

    public BoardSession(int level, List<Piece> pieces, BlockingDetector detector) {
        this.level = level;
        this.pieces = new ArrayList<>(pieces);
        this.detector = detector;
        this.deadlockDetector = new DeadlockDetector(detector);
        for (Piece piece : this.pieces) {
            byId.put(piece.getId(), piece);
        }
        this.graph = DependencyGraph.build(this.pieces, detector);
    }

    /**
     * Tries to send a piece off the board.
     */
    public RemovalOutcome tryRemove(int pieceId) {
        Piece piece = byId.get(pieceId);
        if (piece == null || !piece.isActive()) {
            return RemovalOutcome.ALREADY_REMOVED;
        }
        if (detector.isBlocked(piece, pieces)) {
            return RemovalOutcome.BLOCKED;
        }

        piece.setRemoved(true);
        graph.updateAfterRemoval(pieceId);
        moves++;

        if (graph.isEmpty()) {
            Log.info("BoardSession", "Level " + level + " cleared in " + moves + " moves");
            return RemovalOutcome.CLEARED;
        }
        if (deadlockDetector.isDeadlocked(pieces)) {
            Log.info("BoardSession", "Level " + level + " deadlocked with " + graph.size() + " pieces left");
            return RemovalOutcome.DEADLOCK;
        }
        return RemovalOutcome.REMOVED;
    }

    /**
     * Rebuilds the graph from the pieces' current state. Call after anything moves or turns a
     * piece outside {@link #tryRemove(int)}, such as a flip or shuffle power-up.
     */
    public void rebuild() {
        graph = DependencyGraph.build(pieces, detector);
        Log.debug("BoardSession", "Rebuilt graph: " + graph.size() + " pieces, solvable=" + (graph.topologicalSort() != null));
    }

    /**
     * @return the piece to suggest next, or null when nothing can move
     */
    public Piece hint() {
        DependencyGraphNode node = graph.hint();
        return node == null ? null : node.getPiece();
    }

    public boolean canRemove(int pieceId) {
        Piece piece = byId.get(pieceId);
        return piece != null && detector.canRemove(piece, pieces);
    }

    public int removableCount() {
        return deadlockDetector.removableCount(pieces);
    }

    public boolean isDeadlocked() {
        return deadlockDetector.isDeadlocked(pieces);
    }

    public boolean isSolvable() {
        return graph.topologicalSort() != null;
    }

    public boolean isCleared() {
        return graph.isEmpty();
    }

    public int remainingCount() {
        return graph.size();
    }

    public int getMoves() {
        return moves;
    }

    public int getLevel() {
        return level;
    }

    public Piece getPiece(int pieceId) {
        return byId.get(pieceId);
    }

    public List<Piece> getPieces() {
        return Collections.unmodifiableList(pieces);
    }

    public DependencyGraph getGraph() {
        return graph;
    }
}
