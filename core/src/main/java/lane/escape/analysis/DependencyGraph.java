package lane.escape.analysis;

import com.esotericsoftware.minlog.Log;
import lane.escape.Constants;
import lane.escape.board.Piece;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Directed "blocks" graph over the active pieces of a board.
 * <p>
 * Built from any piece list, so it can re-validate boards changed after generation. Removal
 * never adds a blocker, so an acyclic graph can always be cleared by removing any removable piece
 * at each step, and {@link #updateAfterRemoval(int)} only needs to drop edges.
 */
public class DependencyGraph {

    public enum SolvabilityReason {
        EMPTY,
        CYCLE,
        NO_TOPOLOGICAL_ORDER,
        NO_INITIAL_REMOVABLE,
        VALID
    }

    /**
     * Result of {@link #validateSolvability()}.
     */
    public static class Solvability {
        public final boolean solvable;
        public final SolvabilityReason reason;
        public final List<Integer> cycleNodes;
        public final List<Integer> solutionOrder;

        Solvability(boolean solvable, SolvabilityReason reason, List<Integer> cycleNodes, List<Integer> solutionOrder) {
            this.solvable = solvable;
            this.reason = reason;
            this.cycleNodes = cycleNodes;
            this.solutionOrder = solutionOrder;
        }
    }

    /**
     * Full report from {@link #analyze()}. Safe-move figures are null on boards too large to simulate.
     */
    public static class Analysis {
        public GraphStats stats;
        public boolean hasCycle;
        public List<Integer> cycleNodes;
        public List<Integer> solutionOrder;
        /** Depth to node count; key {@link DependencyGraphNode#UNREACHABLE} counts deadlocked nodes */
        public Map<Integer, Integer> depthDistribution;
        public float avgBranchFactor;
        public Integer safeMoveCount;
        public Float toleranceRate;
        public float graphScore;

        public boolean isSolvable() {
            return solutionOrder != null;
        }
    }

    // DFS colours
    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    private final Map<Integer, DependencyGraphNode> nodes = new LinkedHashMap<>();
    private final BlockingDetector detector;

    private DependencyGraph(BlockingDetector detector) {
        this.detector = detector;
    }

    public static DependencyGraph build(List<Piece> pieces, float screenWidth, float screenHeight) {
        return build(pieces, new BlockingDetector(screenWidth, screenHeight));
    }

    /**
     * Builds the graph over the active pieces of {@code pieces}.
     */
    public static DependencyGraph build(List<Piece> pieces, BlockingDetector detector) {
        DependencyGraph graph = new DependencyGraph(detector);
        List<Piece> active = new ArrayList<>();
        for (Piece piece : pieces) {
            if (piece.isActive()) {
                active.add(piece);
                graph.nodes.put(piece.getId(), new DependencyGraphNode(piece));
            }
        }

        OccupancyIndex index = OccupancyIndex.build(active);
        for (Piece piece : active) {
            DependencyGraphNode blocked = graph.nodes.get(piece.getId());
            for (Piece blocker : detector.findBlockers(piece, active, index)) {
                DependencyGraphNode node = graph.nodes.get(blocker.getId());
                node.blocking.add(blocked.getId());
                blocked.blockedBy.add(node.getId());
            }
        }
        graph.computeDepths();
        return graph;
    }

    private DependencyGraph copy() {
        DependencyGraph copy = new DependencyGraph(detector);
        for (DependencyGraphNode node : nodes.values()) {
            DependencyGraphNode clone = new DependencyGraphNode(node.getPiece());
            clone.blockedBy.addAll(node.blockedBy);
            clone.blocking.addAll(node.blocking);
            clone.depth = node.depth;
            copy.nodes.put(clone.getId(), clone);
        }
        return copy;
    }

    /**
     * Layers the graph: depth 0 for unblocked nodes, otherwise one more than the deepest blocker.
     * Nodes that never become free keep {@link DependencyGraphNode#UNREACHABLE}.
     */
    private void computeDepths() {
        Map<Integer, Integer> remainingBlockers = new HashMap<>();
        Deque<DependencyGraphNode> queue = new ArrayDeque<>();
        for (DependencyGraphNode node : nodes.values()) {
            node.depth = DependencyGraphNode.UNREACHABLE;
            remainingBlockers.put(node.getId(), node.blockedBy.size());
            if (node.blockedBy.isEmpty()) {
                node.depth = 0;
                queue.add(node);
            }
        }
        while (!queue.isEmpty()) {
            DependencyGraphNode current = queue.poll();
            for (int blockedId : current.blocking) {
                DependencyGraphNode blocked = nodes.get(blockedId);
                int left = remainingBlockers.get(blockedId) - 1;
                remainingBlockers.put(blockedId, left);
                if (left == 0) {
                    int deepest = 0;
                    for (int blockerId : blocked.blockedBy) {
                        deepest = Math.max(deepest, nodes.get(blockerId).depth);
                    }
                    blocked.depth = deepest + 1;
                    queue.add(blocked);
                }
            }
        }
    }

    public boolean hasCycle() {
        return !findCycle().isEmpty();
    }

    /**
     * Three-colour depth-first search.
     *
     * @return the node ids of the first cycle found, empty when the graph is acyclic
     */
    public List<Integer> findCycle() {
        Map<Integer, Integer> colour = new HashMap<>();
        for (int id : nodes.keySet()) {
            colour.put(id, WHITE);
        }
        List<Integer> path = new ArrayList<>();
        for (int id : nodes.keySet()) {
            if (colour.get(id) == WHITE) {
                List<Integer> cycle = visit(id, colour, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return Collections.emptyList();
    }

    private List<Integer> visit(int id, Map<Integer, Integer> colour, List<Integer> path) {
        colour.put(id, GREY);
        path.add(id);
        for (int next : nodes.get(id).blocking) {
            int state = colour.get(next);
            if (state == GREY) {
                return new ArrayList<>(path.subList(path.indexOf(next), path.size()));
            }
            if (state == WHITE) {
                List<Integer> cycle = visit(next, colour, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        colour.put(id, BLACK);
        return null;
    }

    /**
     * Kahn's algorithm over a copy of the in-degrees.
     *
     * @return a full removal order of piece ids, or null when the graph has a cycle
     */
    public List<Integer> topologicalSort() {
        Map<Integer, Integer> inDegree = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (DependencyGraphNode node : nodes.values()) {
            inDegree.put(node.getId(), node.getInDegree());
            if (node.getInDegree() == 0) {
                queue.add(node.getId());
            }
        }
        List<Integer> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            int id = queue.poll();
            order.add(id);
            for (int blockedId : nodes.get(id).blocking) {
                int degree = inDegree.get(blockedId) - 1;
                inDegree.put(blockedId, degree);
                if (degree == 0) {
                    queue.add(blockedId);
                }
            }
        }
        return order.size() == nodes.size() ? order : null;
    }

    public List<DependencyGraphNode> getRemovableNodes() {
        List<DependencyGraphNode> removable = new ArrayList<>();
        for (DependencyGraphNode node : nodes.values()) {
            if (node.isRemovable()) {
                removable.add(node);
            }
        }
        return removable;
    }

    /**
     * Removable pieces whose removal leaves a board that can still be fully cleared, found by
     * simulating each removal.
     *
     * @return the safe piece ids, or null when the board has more than
     * {@link Constants#ANALYSIS_SAFE_MOVE_LIMIT} pieces
     */
    public List<Integer> getSafeMoves() {
        if (nodes.size() > Constants.ANALYSIS_SAFE_MOVE_LIMIT) {
            return null;
        }
        List<Integer> safe = new ArrayList<>();
        for (DependencyGraphNode node : getRemovableNodes()) {
            DependencyGraph simulated = copy();
            simulated.updateAfterRemoval(node.getId());
            if (!simulated.hasCycle() && simulated.topologicalSort() != null) {
                safe.add(node.getId());
            }
        }
        return safe;
    }

    /**
     * Suggests the next piece to remove: the shallowest safe move, or any removable piece when
     * nothing is known to be safe.
     *
     * @return the node, or null when nothing can be removed
     */
    public DependencyGraphNode hint() {
        List<Integer> safe = getSafeMoves();
        if (safe == null) {
            // Too large to simulate; on an acyclic board every removable piece is safe
            safe = new ArrayList<>();
            if (topologicalSort() != null) {
                for (DependencyGraphNode node : getRemovableNodes()) {
                    safe.add(node.getId());
                }
            }
        }
        DependencyGraphNode best = null;
        for (int id : safe) {
            DependencyGraphNode node = nodes.get(id);
            if (best == null || node.depth < best.depth) {
                best = node;
            }
        }
        if (best != null) {
            return best;
        }
        List<DependencyGraphNode> removable = getRemovableNodes();
        return removable.isEmpty() ? null : removable.get(0);
    }

    /**
     * @return piece ids in a valid removal order, or null when the board cannot be cleared
     */
    public List<Integer> solutionPath() {
        return topologicalSort();
    }

    public Solvability validateSolvability() {
        if (nodes.isEmpty()) {
            return new Solvability(true, SolvabilityReason.EMPTY, Collections.emptyList(), Collections.emptyList());
        }
        List<Integer> cycle = findCycle();
        if (!cycle.isEmpty()) {
            return new Solvability(false, SolvabilityReason.CYCLE, cycle, null);
        }
        List<Integer> order = topologicalSort();
        if (order == null) {
            return new Solvability(false, SolvabilityReason.NO_TOPOLOGICAL_ORDER, Collections.emptyList(), null);
        }
        if (getRemovableNodes().isEmpty()) {
            return new Solvability(false, SolvabilityReason.NO_INITIAL_REMOVABLE, Collections.emptyList(), null);
        }
        return new Solvability(true, SolvabilityReason.VALID, Collections.emptyList(), order);
    }

    /**
     * Drops a removed piece from the graph and frees the pieces it was blocking.
     */
    public void updateAfterRemoval(int pieceId) {
        DependencyGraphNode removed = nodes.remove(pieceId);
        if (removed == null) {
            return;
        }
        for (int blockedId : removed.blocking) {
            DependencyGraphNode blocked = nodes.get(blockedId);
            if (blocked != null) {
                blocked.blockedBy.remove(pieceId);
            }
        }
        for (int blockerId : removed.blockedBy) {
            DependencyGraphNode blocker = nodes.get(blockerId);
            if (blocker != null) {
                blocker.blocking.remove(pieceId);
            }
        }
        computeDepths();
        Log.trace("DependencyGraph", "Removed " + pieceId + ", " + nodes.size() + " nodes left");
    }

    public GraphStats getStats() {
        int maxDepth = 0;
        long totalDepth = 0;
        int reachable = 0;
        int removable = 0;
        for (DependencyGraphNode node : nodes.values()) {
            if (node.isReachable()) {
                maxDepth = Math.max(maxDepth, node.depth);
                totalDepth += node.depth;
                reachable++;
            }
            if (node.isRemovable()) {
                removable++;
            }
        }
        float avgDepth = reachable > 0 ? totalDepth / (float) reachable : 0f;
        return new GraphStats(nodes.size(), maxDepth, avgDepth, removable);
    }

    public Analysis analyze() {
        Analysis analysis = new Analysis();
        analysis.stats = getStats();
        analysis.cycleNodes = findCycle();
        analysis.hasCycle = !analysis.cycleNodes.isEmpty();
        analysis.solutionOrder = topologicalSort();

        Map<Integer, Integer> distribution = new TreeMap<>();
        int totalOut = 0;
        int branching = 0;
        for (DependencyGraphNode node : nodes.values()) {
            distribution.merge(node.depth, 1, Integer::sum);
            if (node.getOutDegree() > 0) {
                totalOut += node.getOutDegree();
                branching++;
            }
        }
        analysis.depthDistribution = distribution;
        analysis.avgBranchFactor = branching > 0 ? totalOut / (float) branching : 0f;

        List<Integer> safe = getSafeMoves();
        if (safe != null) {
            int removable = analysis.stats.removableCount;
            analysis.safeMoveCount = safe.size();
            analysis.toleranceRate = removable > 0 ? safe.size() / (float) removable : 0f;
        }
        analysis.graphScore = graphScore(analysis.stats, analysis.hasCycle, analysis.avgBranchFactor);
        return analysis;
    }

    /**
     * Graph-only difficulty on a 0-100 scale: max depth up to 40 points, average depth up to 25,
     * blocked share up to 20 and branching up to 15. A cyclic board scores 100.
     */
    static float graphScore(GraphStats stats, boolean hasCycle, float avgBranchFactor) {
        if (hasCycle) {
            return 100f;
        }
        float score = Math.min(40f, stats.maxDepth * 4f)
            + Math.min(25f, stats.avgDepth * 5f)
            + Math.min(20f, (1f - stats.removableRatio) * 20f)
            + Math.min(15f, avgBranchFactor * 5f);
        return Math.round(Math.min(100f, score));
    }

    public DependencyGraphNode getNode(int pieceId) {
        return nodes.get(pieceId);
    }

    public List<DependencyGraphNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public Set<Integer> getNodeIds() {
        return new LinkedHashSet<>(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
