package lane.escape.board;

import com.badlogic.gdx.math.Rectangle;
import com.badlogic.gdx.math.Vector2;
import lane.escape.board.enums.Axis;
import lane.escape.board.enums.Direction;
import lane.escape.board.enums.PieceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PieceTest {

    private Lattice lattice;

    @BeforeEach
    void setUp() {
        lattice = BoardFixtures.lattice();
    }

    @Test
    void testCellsFollowTheAxis() {
        Piece row = BoardFixtures.rowPiece(lattice, 0, 2, 5, Direction.DOWN);
        Piece col = BoardFixtures.colPiece(lattice, 1, 2, 5, Direction.RIGHT);

        assertEquals(2, row.getCellRow(0));
        assertEquals(3, row.getCellRow(1));
        assertEquals(5, row.getCellCol(1));
        assertEquals(2, col.getCellRow(1));
        assertEquals(6, col.getCellCol(1));
    }

    @Test
    void testFrontCellIsJustAheadOfThePiece() {
        Piece row = BoardFixtures.rowPiece(lattice, 0, 2, 5, Direction.DOWN);
        Piece col = BoardFixtures.colPiece(lattice, 1, 2, 5, Direction.RIGHT);

        assertEquals(1, row.getFrontRow(Direction.UP));
        assertEquals(4, row.getFrontRow(Direction.DOWN));
        assertEquals(5, row.getFrontCol(Direction.DOWN));
        assertEquals(4, col.getFrontCol(Direction.LEFT));
        assertEquals(7, col.getFrontCol(Direction.RIGHT));
        assertEquals(2, col.getFrontRow(Direction.RIGHT));
    }

    @Test
    void testLaneKeyIsSharedAlongTheLane() {
        Piece a = BoardFixtures.rowPiece(lattice, 0, 0, 3, Direction.UP);
        Piece b = BoardFixtures.rowPiece(lattice, 1, 4, 3, Direction.UP);
        Piece c = BoardFixtures.colPiece(lattice, 2, 3, 0, Direction.LEFT);

        assertEquals(a.getLaneKey(), b.getLaneKey());
        assertNotEquals(a.getLaneKey(), c.getLaneKey());
    }

    @Test
    void testRejectsDirectionOffAxis() {
        assertThrows(IllegalArgumentException.class,
            () -> new Piece(0, Axis.ROW, 0, 0, 100f, 100f, Direction.LEFT, 16f));

        Piece piece = BoardFixtures.rowPiece(lattice, 0, 0, 0, Direction.UP);
        assertThrows(IllegalArgumentException.class, () -> piece.applyDirection(Direction.RIGHT));
    }

    @Test
    void testApplyDirectionKeepsCentre() {
        Piece piece = BoardFixtures.rowPiece(lattice, 0, 0, 0, Direction.UP);
        float cx = piece.getCenterX();
        float cy = piece.getCenterY();

        piece.flip();

        assertEquals(Direction.DOWN, piece.getDirection());
        assertEquals(cx, piece.getCenterX(), 1e-4f);
        assertEquals(cy, piece.getCenterY(), 1e-4f);
    }

    @Test
    void testRelocateDropsLatticeCoordinates() {
        Piece piece = BoardFixtures.rowPiece(lattice, 0, 0, 0, Direction.UP);

        piece.relocate(50f, 60f);

        assertFalse(piece.hasLatticeCoordinates());
        assertEquals(50f, piece.getCenterX(), 1e-4f);
        assertEquals(60f, piece.getCenterY(), 1e-4f);
    }

    @Test
    void testDiagonalBoundsAreSquare() {
        Piece piece = BoardFixtures.colPiece(lattice, 0, 0, 0, Direction.LEFT);

        // (40 + 16) / sqrt(2)
        assertEquals(39.598f, piece.getWidth(), 0.05f);
        assertEquals(piece.getWidth(), piece.getHeight(), 0.05f);
    }

    @Test
    void testHitRectIsInsetFromBounds() {
        Piece piece = BoardFixtures.rowPiece(lattice, 0, 0, 0, Direction.UP);
        Rectangle bounds = piece.getRect(new Rectangle());
        Rectangle hit = piece.getHitRect(new Rectangle());

        float inset = Math.min(bounds.width, bounds.height) * 0.30f;
        assertEquals(bounds.x + inset, hit.x, 1e-3f);
        assertEquals(bounds.width - inset * 2, hit.width, 1e-3f);
        assertEquals(bounds.getCenter(new Vector2()).x, piece.getCenterX(), 1e-4f);
    }

    @Test
    void testCopyIsIndependent() {
        Piece piece = BoardFixtures.rowPiece(lattice, 3, 0, 0, Direction.UP);
        piece.setType(PieceType.values()[0]);
        piece.setDepth(2);

        Piece copy = piece.copy();
        copy.setRemoved(true);
        copy.flip();

        assertFalse(piece.isRemoved());
        assertEquals(Direction.UP, piece.getDirection());
        assertEquals(3, copy.getId());
        assertEquals(2, copy.getDepth());
        assertEquals(piece.getType(), copy.getType());
        assertTrue(copy.hasLatticeCoordinates());
    }

    @Test
    void testActiveMeansNotRemovedAndVisible() {
        Piece piece = BoardFixtures.rowPiece(lattice, 0, 0, 0, Direction.UP);
        assertTrue(piece.isActive());

        piece.setVisible(false);
        assertFalse(piece.isActive());

        piece.setVisible(true);
        piece.setRemoved(true);
        assertFalse(piece.isActive());
    }
}
