package lane.escape.analysis;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.board.BoardFixtures;
import lane.escape.board.Lattice;
import lane.escape.board.Piece;
import lane.escape.board.enums.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectionStatsTest {

    private Lattice lattice;

    @BeforeEach
    void setUp() {
        lattice = BoardFixtures.lattice();
    }

    private List<Piece> lanes(Direction... laneDirections) {
        List<Piece> pieces = new ArrayList<>();
        int id = 0;
        for (int col = 0; col < laneDirections.length; col++) {
            for (int row = -4; row <= 2; row += 3) {
                pieces.add(BoardFixtures.rowPiece(lattice, id++, row, col, laneDirections[col]));
            }
        }
        return pieces;
    }

    @Test
    void testGlobalCountsAndRatio() {
        DirectionStats stats = DirectionStats.compute(lanes(Direction.UP, Direction.DOWN, Direction.UP),
            lattice.getSafeRect(), 1, 3);

        assertEquals(6, stats.counts[Direction.UP.ordinal()]);
        assertEquals(3, stats.counts[Direction.DOWN.ordinal()]);
        assertEquals(6f / 9f, stats.maxRatio, 1e-6f);
        assertEquals(6f / 9f, stats.getRatio(Direction.UP), 1e-6f);
        assertEquals(0f, stats.getRatio(Direction.LEFT));
    }

    @Test
    void testLaneRatioMeasuresBalanceAcrossLanes() {
        DirectionStats stats = DirectionStats.compute(lanes(Direction.UP, Direction.DOWN, Direction.UP),
            lattice.getSafeRect(), 1, 3);

        assertEquals(2f / 3f, stats.maxLaneRatio, 1e-6f);
    }

    @Test
    void testShortLanesAreIgnored() {
        DirectionStats stats = DirectionStats.compute(lanes(Direction.UP, Direction.UP),
            lattice.getSafeRect(), 1, 4);

        assertEquals(DirectionStats.NEUTRAL_RATIO, stats.maxLaneRatio);
    }

    @Test
    void testLocalRatioIsNeutralWithoutAGrid() {
        DirectionStats stats = DirectionStats.compute(lanes(Direction.UP), lattice.getSafeRect(), 1, 3);

        assertEquals(DirectionStats.NEUTRAL_RATIO, stats.maxLocalRatio);
    }

    @Test
    void testLocalRatioFindsTheWorstSector() {
        List<Piece> pieces = new ArrayList<>();
        Rectangle safe = new Rectangle(0, 0, 100, 100);
        // top-left sector: all up; bottom-right sector: half and half
        pieces.add(new Piece(0, 10, 10, Direction.UP, 16f));
        pieces.add(new Piece(1, 20, 20, Direction.UP, 16f));
        pieces.add(new Piece(2, 80, 80, Direction.UP, 16f));
        pieces.add(new Piece(3, 90, 90, Direction.LEFT, 16f));

        DirectionStats stats = DirectionStats.compute(pieces, safe, 2, 3);

        assertEquals(1f, stats.maxLocalRatio, 1e-6f);
        assertEquals(0.75f, stats.maxRatio, 1e-6f);
    }

    @Test
    void testSectorIndexClampsToTheGrid() {
        assertEquals(0, DirectionStats.sectorIndex(-5f, 0f, 100f, 4));
        assertEquals(3, DirectionStats.sectorIndex(100f, 0f, 100f, 4));
        assertEquals(1, DirectionStats.sectorIndex(30f, 0f, 100f, 4));
    }
}
