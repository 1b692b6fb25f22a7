package lane.escape.board.generators;

import com.badlogic.gdx.math.Rectangle;
import com.esotericsoftware.minlog.Log;
import lane.escape.Constants;
import lane.escape.board.Lattice;
import lane.escape.board.LatticeCell;
import lane.escape.board.Piece;
import lane.escape.board.enums.Axis;
import lane.escape.common.SeededRandom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fills the lattice with two-cell pieces following a {@link LayoutProfile}.
 * <p>
 * Cells are visited by descending profile weight. Each free cell is paired with its best free
 * neighbour, where the neighbour score nudges towards an even split of ROW and COL pieces.
 * A second pass over the cells in shuffled order mops up what the first pass skipped.
 * Every piece starts facing {@link Axis#towardLower()}; the direction assigner sets the real one.
 * <p>
 * The placer is resumable: {@link #step()} handles one cell and {@link #place()} runs to the end.
 */
public class LayoutPlacer {

    private enum Pass {
        WEIGHTED,
        MOP_UP,
        DONE
    }

    private static class WeightedCell {
        final LatticeCell cell;
        final float weight;

        WeightedCell(LatticeCell cell, float weight) {
            this.cell = cell;
            this.weight = weight;
        }
    }

    private final Lattice lattice;
    private final LayoutProfile profile;
    private final SeededRandom random;
    private final int targetCount;
    private final float axisBalanceWeight;
    private final float maxDist;

    private final List<Piece> pieces = new ArrayList<>();
    private int rowPieces;
    private int colPieces;

    private Pass pass = Pass.WEIGHTED;
    private List<LatticeCell> queue;
    private int cursor;

    public LayoutPlacer(Lattice lattice, LayoutProfile profile, SeededRandom random, int targetCount, float axisBalanceWeight) {
        this.lattice = lattice;
        this.profile = profile;
        this.random = random;
        this.targetCount = targetCount;
        this.axisBalanceWeight = axisBalanceWeight;
        Rectangle safe = lattice.getSafeRect();
        this.maxDist = (float) Math.sqrt(safe.width * safe.width / 4f + safe.height * safe.height / 4f);
    }

    /**
     * How many pieces to aim for: the requested count capped by the fill rate and by the lattice,
     * or just the fill rate when filling is forced.
     */
    public static int computeTargetCount(int maxPossible, int requested, float fillRate, boolean forceFill) {
        int fillTarget = (int) Math.floor(maxPossible * fillRate);
        if (forceFill) {
            return Math.min(maxPossible, fillTarget);
        }
        return Math.min(requested, Math.min(maxPossible, fillTarget));
    }

    /**
     * Runs every remaining step.
     *
     * @return the placed pieces, possibly fewer than the target
     */
    public List<Piece> place() {
        while (step() == StepResult.CONTINUE) {
            // keep going
        }
        return getPieces();
    }

    /**
     * Visits one cell of the current pass.
     */
    public StepResult step() {
        if (pass == Pass.DONE) {
            return StepResult.COMPLETE;
        }
        if (queue == null) {
            queue = weightedOrder();
            cursor = 0;
        }
        if (pieces.size() >= targetCount) {
            finish();
            return StepResult.COMPLETE;
        }
        if (cursor >= queue.size()) {
            if (pass == Pass.WEIGHTED) {
                List<LatticeCell> shuffled = new ArrayList<>(lattice.getCells());
                random.shuffle(shuffled);
                queue = shuffled;
                cursor = 0;
                pass = Pass.MOP_UP;
                Log.trace("LayoutPlacer", "Weighted pass placed " + pieces.size() + "/" + targetCount + ", starting mop-up");
                return StepResult.CONTINUE;
            }
            finish();
            return StepResult.COMPLETE;
        }
        tryPlaceAt(queue.get(cursor++));
        return StepResult.CONTINUE;
    }

    private List<LatticeCell> weightedOrder() {
        List<WeightedCell> weighted = new ArrayList<>(lattice.size());
        for (LatticeCell cell : lattice.getCells()) {
            weighted.add(new WeightedCell(cell, profile.weight(cell) + random.jitter(Constants.PLACER_WEIGHT_JITTER)));
        }
        weighted.sort((a, b) -> Float.compare(b.weight, a.weight));
        List<LatticeCell> ordered = new ArrayList<>(weighted.size());
        for (WeightedCell entry : weighted) {
            ordered.add(entry.cell);
        }
        return ordered;
    }

    private void tryPlaceAt(LatticeCell cell) {
        if (cell.isOccupied()) {
            return;
        }
        List<LatticeCell> neighbors = lattice.getFreeNeighbors(cell);
        if (neighbors.isEmpty()) {
            return;
        }

        LatticeCell best = null;
        float bestScore = 0f;
        for (LatticeCell neighbor : neighbors) {
            Axis axis = axisBetween(cell, neighbor);
            float score = profile.weight(neighbor) + axisBias(axis) * axisBalanceWeight
                + random.jitter(Constants.PLACER_NEIGHBOR_JITTER);
            if (best == null || score > bestScore) {
                best = neighbor;
                bestScore = score;
            }
        }

        Piece piece = createPiece(cell, best);
        pieces.add(piece);
        lattice.occupy(piece);
        if (piece.getAxis() == Axis.ROW) {
            rowPieces++;
        } else {
            colPieces++;
        }
    }

    private Piece createPiece(LatticeCell a, LatticeCell b) {
        Axis axis = axisBetween(a, b);
        int gridRow = axis == Axis.ROW ? Math.min(a.row, b.row) : a.row;
        int gridCol = axis == Axis.COL ? Math.min(a.col, b.col) : a.col;
        float centerX = (a.x + b.x) / 2f;
        float centerY = (a.y + b.y) / 2f;

        Piece piece = new Piece(pieces.size(), axis, gridRow, gridCol, centerX, centerY, axis.towardLower(), lattice.getShortSide());
        float dx = centerX - lattice.getCenterX();
        float dy = centerY - lattice.getCenterY();
        float dist = (float) Math.sqrt(dx * dx + dy * dy);
        piece.setDistNorm(maxDist > 0 ? Math.min(1f, dist / maxDist) : 0f);
        return piece;
    }

    /** Positive when the axis is under-represented so far. */
    private float axisBias(Axis axis) {
        int total = rowPieces + colPieces;
        if (total == 0) {
            return 0f;
        }
        int count = axis == Axis.ROW ? rowPieces : colPieces;
        return 0.5f - count / (float) total;
    }

    private static Axis axisBetween(LatticeCell a, LatticeCell b) {
        return a.row != b.row ? Axis.ROW : Axis.COL;
    }

    private void finish() {
        if (pass == Pass.DONE) {
            return;
        }
        pass = Pass.DONE;
        if (pieces.size() < targetCount) {
            Log.debug("LayoutPlacer", "Placement shortfall: " + pieces.size() + "/" + targetCount
                + " pieces (" + profile.getType() + ")");
        }
    }

    public boolean isDone() {
        return pass == Pass.DONE;
    }

    public List<Piece> getPieces() {
        return Collections.unmodifiableList(pieces);
    }

    public int getTargetCount() {
        return targetCount;
    }
}
