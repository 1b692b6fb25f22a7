package lane.escape.level;

import com.badlogic.gdx.math.Rectangle;
import com.badlogic.gdx.utils.TimeUtils;
import com.esotericsoftware.minlog.Log;
import lane.escape.Constants;
import lane.escape.analysis.BlockingDetector;
import lane.escape.analysis.DependencyGraph;
import lane.escape.analysis.DependencyGraphNode;
import lane.escape.analysis.DifficultyScorer;
import lane.escape.analysis.DirectionStats;
import lane.escape.analysis.GraphStats;
import lane.escape.analysis.GreedyRemovalSimulator;
import lane.escape.board.Lattice;
import lane.escape.board.Piece;
import lane.escape.board.enums.PieceType;
import lane.escape.board.generators.DirectionAssigner;
import lane.escape.board.generators.LayoutPlacer;
import lane.escape.board.generators.LayoutProfile;
import lane.escape.board.generators.StepResult;
import lane.escape.common.SeededRandom;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One level's generation, split into small steps so it can run a little per frame.
 * <p>
 * Each attempt places pieces, peels directions, then scores the board. The first attempt whose
 * verdict is accepted wins. Otherwise the candidate closest to the target difficulty is kept, and
 * when every attempt dead-ends the largest solvable subset of a dead-ended attempt is used.
 * The time budget is only checked between attempts, so the first attempt always runs and equal
 * seeds give equal boards when the attempt budget, not the clock, is what runs out.
 */
public class GenerationTask {

    private enum Stage {
        START_ATTEMPT,
        PLACING,
        ASSIGNING,
        EVALUATING,
        DONE
    }

    private static class Candidate {
        final GenerationResult result;
        final DifficultyScorer.Verdict verdict;

        Candidate(GenerationResult result, DifficultyScorer.Verdict verdict) {
            this.result = result;
            this.verdict = verdict;
        }
    }

    private final GenerationParameters params;
    private final Rectangle boardRect;
    private final BlockingDetector detector;
    private final int baseSeed;
    private long startMs = -1;

    private Stage stage = Stage.START_ATTEMPT;
    private int attempt;

    private int attemptSeed;
    private SeededRandom random;
    private Lattice lattice;
    private LayoutProfile profile;
    private LayoutPlacer placer;
    private DirectionAssigner assigner;

    private Candidate best;
    private List<Piece> salvage;
    private int salvageSeed;
    private LayoutProfile salvageProfile;
    private Lattice salvageLattice;
    private int salvageTarget;
    private GenerationResult result;

    public GenerationTask(GenerationParameters params, Rectangle boardRect, float screenWidth, float screenHeight, int seed) {
        this.params = params;
        this.boardRect = new Rectangle(boardRect);
        this.detector = new BlockingDetector(screenWidth, screenHeight);
        this.baseSeed = seed;
    }

    /**
     * Runs a single unit of work.
     *
     * @return {@link StepResult#COMPLETE} once the result is ready, {@link StepResult#CONTINUE} otherwise
     * @throws IllegalStateException if the task already finished
     */
    public StepResult step() {
        if (stage == Stage.DONE) {
            throw new IllegalStateException("Generation of level " + params.getLevel() + " already finished");
        }
        if (startMs < 0) {
            startMs = TimeUtils.millis();
        }
        switch (stage) {
            case START_ATTEMPT:
                startAttempt();
                break;
            case PLACING:
                if (placer.step() != StepResult.CONTINUE) {
                    List<Piece> pieces = placer.getPieces();
                    assigner = new DirectionAssigner(lattice, pieces, params, random);
                    stage = Stage.ASSIGNING;
                }
                break;
            case ASSIGNING:
                StepResult assigned = assigner.step();
                if (assigned == StepResult.COMPLETE) {
                    stage = Stage.EVALUATING;
                } else if (assigned == StepResult.DEADEND) {
                    keepSalvage();
                    nextAttempt();
                }
                break;
            case EVALUATING:
                evaluateAttempt();
                break;
            default:
                break;
        }
        return stage == Stage.DONE ? StepResult.COMPLETE : StepResult.CONTINUE;
    }

    public GenerationResult runToCompletion() {
        while (stage != Stage.DONE) {
            step();
        }
        return result;
    }

    private void startAttempt() {
        boolean outOfAttempts = attempt >= params.getMaxAttempts();
        boolean outOfTime = attempt > 0 && TimeUtils.timeSinceMillis(startMs) > params.getMaxTimeMs();
        if (outOfAttempts || outOfTime) {
            finish();
            return;
        }

        attemptSeed = baseSeed + attempt * Constants.GENERATION_ATTEMPT_SEED_STRIDE;
        random = new SeededRandom(attemptSeed);
        lattice = Lattice.create(params.getShortSide(), boardRect);
        profile = LayoutProfile.create(params.getLayoutProfiles(), lattice, random);

        if (lattice.maxPossiblePieces() < 2) {
            Log.warn("GenerationTask", "Board too small for level " + params.getLevel() + ": "
                + lattice.size() + " usable cells");
            finish();
            return;
        }

        int target = LayoutPlacer.computeTargetCount(lattice.maxPossiblePieces(), params.getPieceCount(),
            params.getTargetFillRate(), params.isForceFillRate());
        placer = new LayoutPlacer(lattice, profile, random, target, params.getAxisBalanceWeight());
        stage = Stage.PLACING;
        Log.debug("GenerationTask", "Level " + params.getLevel() + " attempt " + (attempt + 1)
            + ": seed=" + attemptSeed + " profile=" + profile.getType() + " target=" + target);
    }

    private void nextAttempt() {
        attempt++;
        stage = Stage.START_ATTEMPT;
    }

    private void keepSalvage() {
        List<Piece> committed = assigner.getCommitted();
        if (salvage == null || committed.size() > salvage.size()) {
            salvage = new ArrayList<>(committed);
            salvage.sort(Comparator.comparingInt(Piece::getId));
            salvageSeed = attemptSeed;
            salvageProfile = profile;
            salvageLattice = lattice;
            salvageTarget = placer.getTargetCount();
        }
        Log.debug("GenerationTask", "Level " + params.getLevel() + " attempt " + (attempt + 1)
            + " dead-ended with " + committed.size() + "/" + assigner.getTotal() + " pieces assigned");
    }

    private void evaluateAttempt() {
        Candidate candidate = evaluate(new ArrayList<>(placer.getPieces()), lattice, profile, random,
            attemptSeed, placer.getTargetCount(), false);
        if (candidate == null) {
            nextAttempt();
            return;
        }
        Log.debug("GenerationTask", "Level " + params.getLevel() + " attempt " + (attempt + 1)
            + ": score=" + candidate.result.difficultyScore + " " + candidate.verdict);
        if (candidate.verdict.accepted) {
            best = candidate;
            attempt++;
            finish();
            return;
        }
        if (best == null || candidate.verdict.distance < best.verdict.distance) {
            best = candidate;
        }
        nextAttempt();
    }

    /**
     * Scores a finished board and fills in depths and cosmetic types.
     *
     * @return null when the board cannot be cleared
     */
    private Candidate evaluate(List<Piece> pieces, Lattice board, LayoutProfile layout, SeededRandom rng,
                               int seed, int targetCount, boolean salvaged) {
        float deadlockProbability = -1f;
        if (params.getMonteCarloRuns() > 0) {
            GreedyRemovalSimulator simulator = new GreedyRemovalSimulator(detector);
            deadlockProbability = simulator.estimateDeadlockProbability(pieces, params.getMonteCarloRuns(), rng);
            if (deadlockProbability >= 1f) {
                Log.debug("GenerationTask", "Level " + params.getLevel() + " board got stuck in every playout, skipping graph check");
                return null;
            }
        }

        DependencyGraph graph = DependencyGraph.build(pieces, detector);
        if (graph.topologicalSort() == null) {
            Log.warn("GenerationTask", "Level " + params.getLevel() + " produced an unsolvable board, discarding it");
            return null;
        }
        GraphStats stats = graph.getStats();
        DirectionStats directions = DirectionStats.compute(pieces, board.getSafeRect(),
            params.getLocalDirectionGrid(), params.getLaneDirectionMinCount());
        float score = DifficultyScorer.score(stats, directions);
        DifficultyScorer.Verdict verdict = DifficultyScorer.verdict(params, stats, directions, score, pieces.size());

        for (Piece piece : pieces) {
            DependencyGraphNode node = graph.getNode(piece.getId());
            piece.setDepth(node.getDepth());
        }
        assignTypes(pieces, rng);

        GenerationDiagnostics diagnostics = new GenerationDiagnostics();
        diagnostics.avgDepth = stats.avgDepth;
        diagnostics.maxDepth = stats.maxDepth;
        diagnostics.removableCount = stats.removableCount;
        diagnostics.removableRatio = stats.removableRatio;
        diagnostics.fillRate = board.size() > 0 ? pieces.size() * Piece.CELL_COUNT / (float) board.size() : 0f;
        diagnostics.targetCount = targetCount;
        diagnostics.seed = seed;
        diagnostics.layoutProfile = layout.getType();
        diagnostics.directionStats = directions;
        diagnostics.accepted = verdict.accepted;
        diagnostics.salvaged = salvaged;

        diagnostics.deadlockProbability = deadlockProbability;

        GenerationResult candidate = new GenerationResult(params.getLevel(), pieces, true, score, diagnostics);
        return new Candidate(candidate, verdict);
    }

    /**
     * Deals the level's piece types round-robin, layer by layer, shuffling within each layer.
     */
    private void assignTypes(List<Piece> pieces, SeededRandom rng) {
        PieceType[] all = PieceType.values();
        int typeCount = Math.min(all.length, params.getPieceTypeCount());
        Map<Integer, List<Piece>> layers = new TreeMap<>();
        for (Piece piece : pieces) {
            layers.computeIfAbsent(piece.getDepth(), k -> new ArrayList<>()).add(piece);
        }
        int typeIndex = 0;
        for (List<Piece> layer : layers.values()) {
            rng.shuffle(layer);
            for (Piece piece : layer) {
                piece.setType(all[typeIndex % typeCount]);
                typeIndex++;
            }
        }
    }

    private void finish() {
        if (best == null && salvage != null) {
            Log.warn("GenerationTask", "Every attempt for level " + params.getLevel() + " dead-ended, using "
                + salvage.size() + " salvaged pieces");
            best = evaluate(salvage, salvageLattice, salvageProfile, new SeededRandom(salvageSeed),
                salvageSeed, salvageTarget, true);
        }

        if (best != null && !best.verdict.accepted) {
            Log.info("GenerationTask", "Level " + params.getLevel() + ": no board accepted in " + attempt
                + " attempts, using the closest one, " + best.verdict);
        }

        GenerationDiagnostics diagnostics;
        if (best != null) {
            result = best.result;
            diagnostics = result.diagnostics;
        } else {
            diagnostics = new GenerationDiagnostics();
            diagnostics.seed = baseSeed;
            result = GenerationResult.empty(params.getLevel(), diagnostics);
        }
        diagnostics.attempts = attempt;
        diagnostics.elapsedMs = TimeUtils.timeSinceMillis(startMs);
        stage = Stage.DONE;
    }

    public boolean isDone() {
        return stage == Stage.DONE;
    }

    /**
     * @return the finished board, or null while the task is still running
     */
    public GenerationResult getResult() {
        return result;
    }

    public GenerationParameters getParameters() {
        return params;
    }
}
