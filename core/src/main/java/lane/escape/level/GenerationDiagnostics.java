package lane.escape.level;

import lane.escape.analysis.DirectionStats;
import lane.escape.board.enums.LayoutProfileType;

import java.util.Locale;

/**
 * Figures describing how a board came out. Elapsed time is kept out of serialization so that
 * equal seeds produce equal bytes.
 */
public class GenerationDiagnostics {
    public float avgDepth;
    public int maxDepth;
    public int removableCount;
    public float removableRatio;
    public float fillRate;
    public int targetCount;
    public int attempts;
    public int seed;
    public LayoutProfileType layoutProfile;
    public DirectionStats directionStats;
    public boolean accepted;
    public boolean salvaged;
    /** Share of random playouts that got stuck, or -1 when playouts were off */
    public float deadlockProbability = -1f;
    public transient long elapsedMs;

    // Default constructor for Kryo
    public GenerationDiagnostics() {
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "avgDepth=%.2f maxDepth=%d removable=%d (%.2f) fill=%.2f target=%d attempts=%d profile=%s accepted=%s%s",
            avgDepth, maxDepth, removableCount, removableRatio, fillRate, targetCount, attempts,
            layoutProfile, accepted, salvaged ? " salvaged" : "");
    }
}
