package lane.escape.analysis;

import java.util.Locale;

/**
 * Depth and removability summary of a dependency graph. Nodes in or behind a cycle are left out
 * of the depth figures.
 */
public class GraphStats {
    public int nodeCount;
    public int maxDepth;
    public float avgDepth;
    public int removableCount;
    public float removableRatio;

    // Default constructor for Kryo
    public GraphStats() {
    }

    public GraphStats(int nodeCount, int maxDepth, float avgDepth, int removableCount) {
        this.nodeCount = nodeCount;
        this.maxDepth = maxDepth;
        this.avgDepth = avgDepth;
        this.removableCount = removableCount;
        this.removableRatio = nodeCount > 0 ? removableCount / (float) nodeCount : 0f;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "nodes=%d maxDepth=%d avgDepth=%.2f removable=%d (%.2f)",
            nodeCount, maxDepth, avgDepth, removableCount, removableRatio);
    }
}
