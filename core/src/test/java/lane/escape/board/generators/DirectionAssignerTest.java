package lane.escape.board.generators;

import lane.escape.analysis.BlockingDetector;
import lane.escape.board.BoardFixtures;
import lane.escape.board.Lattice;
import lane.escape.board.Piece;
import lane.escape.board.enums.Direction;
import lane.escape.board.enums.LayoutProfileType;
import lane.escape.common.SeededRandom;
import lane.escape.level.GenerationParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DirectionAssignerTest {

    private static final GenerationParameters PARAMS = GenerationParameters.builder()
        .depthFactor(0.8f)
        .laneDirection(0.4f, 3)
        .build();

    @ParameterizedTest
    @ValueSource(ints = {1, 17, 404, 9001})
    void testCommitOrderIsAValidRemovalOrder(int seed) {
        Lattice lattice = BoardFixtures.lattice();
        SeededRandom random = new SeededRandom(seed);
        List<Piece> pieces = LayoutPlacerTest.place(lattice, LayoutProfileType.UNIFORM, seed, 80);

        DirectionAssigner assigner = new DirectionAssigner(lattice, pieces, PARAMS, random);
        StepResult state = assigner.assignAll();

        List<Piece> committed = assigner.getCommitted();
        if (state == StepResult.COMPLETE) {
            assertEquals(pieces.size(), committed.size());
        } else {
            assertEquals(StepResult.DEADEND, state);
            assertTrue(committed.size() < pieces.size());
        }
        assertRemovableInOrder(committed);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 33, 777})
    void testEveryLaneFacesOneWay(int seed) {
        Lattice lattice = BoardFixtures.lattice();
        List<Piece> pieces = LayoutPlacerTest.place(lattice, LayoutProfileType.RING, seed, 80);

        DirectionAssigner assigner = new DirectionAssigner(lattice, pieces, PARAMS, new SeededRandom(seed));
        assigner.assignAll();

        Map<Long, Direction> lanes = new HashMap<>();
        for (Piece piece : assigner.getCommitted()) {
            Direction previous = lanes.putIfAbsent(piece.getLaneKey(), piece.getDirection());
            if (previous != null) {
                assertEquals(previous, piece.getDirection(), "lane of " + piece + " is mixed");
            }
        }
    }

    @Test
    void testCommittedPiecesLeaveTheLattice() {
        Lattice lattice = BoardFixtures.lattice();
        List<Piece> pieces = LayoutPlacerTest.place(lattice, LayoutProfileType.UNIFORM, 8, 30);

        DirectionAssigner assigner = new DirectionAssigner(lattice, pieces, PARAMS, new SeededRandom(8));
        assertEquals(StepResult.CONTINUE, assigner.step());

        Piece first = assigner.getCommitted().get(0);
        assertFalse(lattice.isOccupied(first.getCellRow(0), first.getCellCol(0)));
        assertTrue(first.getDirection().isValidFor(first.getAxis()));
    }

    @Test
    void testDirectionMixSteersTheAssignment() {
        GenerationParameters upHeavy = PARAMS.toBuilder()
            .directionMix(0.55f, 0.15f, 0.15f, 0.15f)
            .build();
        Lattice lattice = BoardFixtures.lattice();
        List<Piece> pieces = LayoutPlacerTest.place(lattice, LayoutProfileType.UNIFORM, 21, 70);

        DirectionAssigner assigner = new DirectionAssigner(lattice, pieces, upHeavy, new SeededRandom(21));
        assigner.assignAll();

        int up = 0;
        int down = 0;
        for (Piece piece : assigner.getCommitted()) {
            if (piece.getDirection() == Direction.UP) {
                up++;
            } else if (piece.getDirection() == Direction.DOWN) {
                down++;
            }
        }
        assertTrue(up > down, "up=" + up + " down=" + down);
    }

    @Test
    void testEmptyBoardCompletesImmediately() {
        DirectionAssigner assigner = new DirectionAssigner(BoardFixtures.lattice(), Collections.emptyList(), PARAMS,
            new SeededRandom(1));

        assertEquals(StepResult.COMPLETE, assigner.step());
        assertEquals(0, assigner.getTotal());
    }

    private static void assertRemovableInOrder(List<Piece> order) {
        BlockingDetector detector = new BlockingDetector(BoardFixtures.SCREEN_WIDTH, BoardFixtures.SCREEN_HEIGHT);
        List<Piece> board = new ArrayList<>();
        for (Piece piece : order) {
            board.add(piece.copy());
        }
        for (Piece piece : board) {
            assertFalse(detector.isBlocked(piece, board), piece + " is blocked when its turn comes");
            piece.setRemoved(true);
        }
    }
}
