package lane.escape.board.generators;

import lane.escape.board.BoardFixtures;
import lane.escape.board.Lattice;
import lane.escape.board.LatticeCell;
import lane.escape.board.Piece;
import lane.escape.board.enums.LayoutProfileType;
import lane.escape.common.SeededRandom;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayoutPlacerTest {

    @Test
    void testComputeTargetCount() {
        assertEquals(77, LayoutPlacer.computeTargetCount(91, 120, 0.85f, true));
        assertEquals(60, LayoutPlacer.computeTargetCount(91, 60, 0.85f, false));
        assertEquals(45, LayoutPlacer.computeTargetCount(91, 120, 0.5f, false));
        assertEquals(91, LayoutPlacer.computeTargetCount(91, 10, 1.5f, true));
    }

    @Test
    void testPlacesDisjointPiecesOnTheLattice() {
        Lattice lattice = BoardFixtures.lattice();
        List<Piece> pieces = place(lattice, LayoutProfileType.RING, 7, 60);

        Set<Long> cells = new HashSet<>();
        for (Piece piece : pieces) {
            assertTrue(piece.hasLatticeCoordinates());
            assertEquals(piece.getAxis().towardLower(), piece.getDirection());
            for (int i = 0; i < Piece.CELL_COUNT; i++) {
                int row = piece.getCellRow(i);
                int col = piece.getCellCol(i);
                assertTrue(lattice.contains(row, col), piece + " off the lattice");
                assertTrue(cells.add(Lattice.constructKey(row, col)), piece + " overlaps another piece");
                assertEquals(piece.getId(), lattice.getCell(row, col).getPieceId());
            }
        }
        assertEquals(cells.size(), lattice.occupiedCount());
    }

    @Test
    void testReachesASmallTarget() {
        Lattice lattice = BoardFixtures.lattice();
        List<Piece> pieces = place(lattice, LayoutProfileType.UNIFORM, 3, 20);

        assertEquals(20, pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            assertEquals(i, pieces.get(i).getId());
        }
    }

    @Test
    void testPieceCentreSitsBetweenItsCells() {
        Lattice lattice = BoardFixtures.lattice();
        for (Piece piece : place(lattice, LayoutProfileType.DIAGONAL_BAND, 11, 30)) {
            float cx = (lattice.cellX(piece.getCellRow(0), piece.getCellCol(0))
                + lattice.cellX(piece.getCellRow(1), piece.getCellCol(1))) / 2f;
            assertEquals(cx, piece.getCenterX(), 1e-3f);
            assertTrue(piece.getDistNorm() >= 0f && piece.getDistNorm() <= 1f);
        }
    }

    @Test
    void testSameSeedSameLayout() {
        List<Piece> first = place(BoardFixtures.lattice(), LayoutProfileType.TWIN_CLUSTER, 1234, 70);
        List<Piece> second = place(BoardFixtures.lattice(), LayoutProfileType.TWIN_CLUSTER, 1234, 70);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getGridRow(), second.get(i).getGridRow());
            assertEquals(first.get(i).getGridCol(), second.get(i).getGridCol());
            assertEquals(first.get(i).getAxis(), second.get(i).getAxis());
        }
    }

    @Test
    void testStepIsResumable() {
        Lattice lattice = BoardFixtures.lattice();
        SeededRandom random = new SeededRandom(5);
        LayoutPlacer placer = new LayoutPlacer(lattice, LayoutProfile.create(LayoutProfileType.HOLLOW_CENTER, lattice, random),
            random, 10, 0.3f);

        int steps = 0;
        while (placer.step() == StepResult.CONTINUE) {
            steps++;
        }

        assertTrue(placer.isDone());
        assertTrue(steps >= 10);
        assertEquals(10, placer.getPieces().size());
        assertEquals(StepResult.COMPLETE, placer.step());
    }

    @Test
    void testFrontierHoldsOnlyUnpairableHolesAfterAFullLayout() {
        Lattice lattice = BoardFixtures.lattice();
        place(lattice, LayoutProfileType.HOLLOW_CENTER, 19, lattice.maxPossiblePieces());

        List<LatticeCell> frontier = lattice.getBoundaryCells();
        int free = 0;
        for (LatticeCell cell : lattice.getCells()) {
            if (!cell.isOccupied()) {
                free++;
                assertTrue(frontier.contains(cell), cell + " is free but off the frontier");
            }
        }
        assertEquals(free, frontier.size());
        for (LatticeCell cell : frontier) {
            assertFalse(cell.isOccupied());
            assertTrue(lattice.getFreeNeighbors(cell).isEmpty(), cell + " could still host a piece");
        }
    }

    static List<Piece> place(Lattice lattice, LayoutProfileType type, int seed, int target) {
        SeededRandom random = new SeededRandom(seed);
        LayoutProfile profile = LayoutProfile.create(type, lattice, random);
        return new LayoutPlacer(lattice, profile, random, target, 0.3f).place();
    }
}
