package lane.escape.board;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.board.enums.Direction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Board lattice rotated 45 degrees. Cell (row, col) sits at
 * {@code (centerX + (col - row) * step, centerY + (col + row) * step)}, so rows run towards the
 * south-west and columns towards the south-east. Only cells inside the safe rect are members.
 * <p>
 * Cells are kept in a flat array indexed by their offset from the lattice's minimum corner;
 * positions outside that box, or inside the box but outside the safe rect, are not members.
 * A lattice belongs to a single generation attempt and is not thread-safe.
 * <p>
 * Occupy and release keep a frontier of free cells that sit on the lattice edge or touch an
 * occupied cell ({@link #getBoundaryCells()}). The placer and assigner in this project do not
 * read it. It is kept for callers outside the generator that need entry points, such as
 * edge-inward placement, or that inspect the holes a finished layout leaves behind.
 */
public class Lattice {
    private static final int[][] NEIGHBOR_OFFSETS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    // down, up, right, left keeps the pairing order stable
    private static final int[][] PAIRING_OFFSETS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private final float shortSide;
    private final float cellStep;
    private final float step;
    private final float centerX, centerY;
    private final Rectangle safeRect;

    private final int radius;
    private final int span;
    private final LatticeCell[] arena;
    private final List<LatticeCell> cells;
    private final List<LatticeCell> edgeCells;
    private final Set<LatticeCell> boundary = new LinkedHashSet<>();

    private Lattice(float shortSide, Rectangle safeRect) {
        this.shortSide = shortSide;
        this.cellStep = PieceGeometry.cellStep(shortSide);
        this.step = (float) (cellStep / Math.sqrt(2.0));
        this.safeRect = safeRect;
        this.centerX = safeRect.x + safeRect.width / 2f;
        this.centerY = safeRect.y + safeRect.height / 2f;

        if (safeRect.width > 0 && safeRect.height > 0) {
            // |col| <= (W/2 + H/2) / (2 * step) for every cell inside the rect
            radius = (int) Math.ceil((safeRect.width + safeRect.height) / (4f * step));
        } else {
            radius = -1;
        }
        span = radius * 2 + 1;
        arena = new LatticeCell[Math.max(0, span * span)];

        List<LatticeCell> members = new ArrayList<>();
        for (int row = -radius; row <= radius; row++) {
            for (int col = -radius; col <= radius; col++) {
                float x = cellX(row, col);
                float y = cellY(row, col);
                if (x >= safeRect.x && x <= safeRect.x + safeRect.width
                    && y >= safeRect.y && y <= safeRect.y + safeRect.height) {
                    arena[index(row, col)] = new LatticeCell(row, col, x, y, false);
                }
            }
        }
        // Second pass once membership is known, so edge flags can look at neighbours
        for (int i = 0; i < arena.length; i++) {
            LatticeCell cell = arena[i];
            if (cell == null) {
                continue;
            }
            boolean edge = false;
            for (int[] offset : NEIGHBOR_OFFSETS) {
                if (getCell(cell.row + offset[0], cell.col + offset[1]) == null) {
                    edge = true;
                    break;
                }
            }
            if (edge) {
                cell = new LatticeCell(cell.row, cell.col, cell.x, cell.y, true);
                arena[i] = cell;
            }
            members.add(cell);
        }
        this.cells = Collections.unmodifiableList(members);

        List<LatticeCell> edges = new ArrayList<>();
        for (LatticeCell cell : cells) {
            if (cell.edge) {
                edges.add(cell);
            }
        }
        this.edgeCells = Collections.unmodifiableList(edges);
        boundary.addAll(edgeCells);
    }

    /**
     * Builds the lattice for pieces of the given short side inside {@code boardRect}.
     */
    public static Lattice create(float shortSide, Rectangle boardRect) {
        if (shortSide <= 0) {
            throw new IllegalArgumentException("Short side must be positive: " + shortSide);
        }
        return new Lattice(shortSide, PieceGeometry.safeRect(boardRect, shortSide));
    }

    public static long constructKey(int row, int col) {
        return (((long) row) << 32) | (col & 0xFFFFFFFFL);
    }

    public float cellX(int row, int col) {
        return centerX + (col - row) * step;
    }

    public float cellY(int row, int col) {
        return centerY + (col + row) * step;
    }

    public LatticeCell getCell(int row, int col) {
        if (row < -radius || row > radius || col < -radius || col > radius) {
            return null;
        }
        return arena[index(row, col)];
    }

    public boolean contains(int row, int col) {
        return getCell(row, col) != null;
    }

    /**
     * Positions outside the lattice count as occupied, so nothing can be placed there.
     */
    public boolean isOccupied(int row, int col) {
        LatticeCell cell = getCell(row, col);
        return cell == null || cell.occupied;
    }

    public void occupy(Piece piece) {
        for (int i = 0; i < Piece.CELL_COUNT; i++) {
            LatticeCell cell = getCell(piece.getCellRow(i), piece.getCellCol(i));
            if (cell == null) {
                continue;
            }
            cell.occupied = true;
            cell.pieceId = piece.getId();
            boundary.remove(cell);
        }
        for (int i = 0; i < Piece.CELL_COUNT; i++) {
            refreshNeighborsOf(piece.getCellRow(i), piece.getCellCol(i));
        }
    }

    /**
     * Frees a piece's cells. The peel assigner uses this to treat a committed piece as gone.
     */
    public void release(Piece piece) {
        for (int i = 0; i < Piece.CELL_COUNT; i++) {
            LatticeCell cell = getCell(piece.getCellRow(i), piece.getCellCol(i));
            if (cell != null && cell.pieceId == piece.getId()) {
                cell.occupied = false;
                cell.pieceId = LatticeCell.NO_PIECE;
            }
        }
        for (int i = 0; i < Piece.CELL_COUNT; i++) {
            int row = piece.getCellRow(i);
            int col = piece.getCellCol(i);
            refreshBoundary(getCell(row, col));
            refreshNeighborsOf(row, col);
        }
    }

    public void reset() {
        for (LatticeCell cell : cells) {
            cell.occupied = false;
            cell.pieceId = LatticeCell.NO_PIECE;
        }
        boundary.clear();
        boundary.addAll(edgeCells);
    }

    /**
     * Walks from the cell just ahead of the piece towards the lattice edge.
     *
     * @return true when every cell up to the edge is free
     */
    public boolean isPathClearToEdge(Piece piece, Direction direction) {
        if (!piece.hasLatticeCoordinates() || !direction.isValidFor(piece.getAxis())) {
            return false;
        }
        int row = piece.getFrontRow(direction);
        int col = piece.getFrontCol(direction);
        while (true) {
            LatticeCell cell = getCell(row, col);
            if (cell == null) {
                return true;
            }
            if (cell.occupied) {
                return false;
            }
            row += direction.rowDelta;
            col += direction.colDelta;
        }
    }

    public List<LatticeCell> getFreeNeighbors(LatticeCell cell) {
        List<LatticeCell> neighbors = new ArrayList<>(PAIRING_OFFSETS.length);
        for (int[] offset : PAIRING_OFFSETS) {
            LatticeCell neighbor = getCell(cell.row + offset[0], cell.col + offset[1]);
            if (neighbor != null && !neighbor.occupied) {
                neighbors.add(neighbor);
            }
        }
        return neighbors;
    }

    /**
     * Free cells on the lattice edge or next to an occupied cell, in the order they joined the
     * frontier. Once a layout is complete every free cell is on the frontier and none of them
     * has a free neighbour.
     */
    public List<LatticeCell> getBoundaryCells() {
        return new ArrayList<>(boundary);
    }

    public List<LatticeCell> getEdgeCells() {
        return edgeCells;
    }

    public List<LatticeCell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public int maxPossiblePieces() {
        return cells.size() / 2;
    }

    public int occupiedCount() {
        int count = 0;
        for (LatticeCell cell : cells) {
            if (cell.occupied) {
                count++;
            }
        }
        return count;
    }

    public float getShortSide() {
        return shortSide;
    }

    public float getStep() {
        return step;
    }

    public float getCellStep() {
        return cellStep;
    }

    public float getCenterX() {
        return centerX;
    }

    public float getCenterY() {
        return centerY;
    }

    public Rectangle getSafeRect() {
        return new Rectangle(safeRect);
    }

    private void refreshNeighborsOf(int row, int col) {
        for (int[] offset : NEIGHBOR_OFFSETS) {
            refreshBoundary(getCell(row + offset[0], col + offset[1]));
        }
    }

    private void refreshBoundary(LatticeCell cell) {
        if (cell == null) {
            return;
        }
        if (cell.occupied) {
            boundary.remove(cell);
            return;
        }
        boolean frontier = cell.edge;
        for (int i = 0; i < NEIGHBOR_OFFSETS.length && !frontier; i++) {
            LatticeCell neighbor = getCell(cell.row + NEIGHBOR_OFFSETS[i][0], cell.col + NEIGHBOR_OFFSETS[i][1]);
            frontier = neighbor != null && neighbor.occupied;
        }
        if (frontier) {
            boundary.add(cell);
        } else {
            boundary.remove(cell);
        }
    }

    private int index(int row, int col) {
        return (row + radius) * span + (col + radius);
    }
}
