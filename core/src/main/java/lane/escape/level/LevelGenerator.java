package lane.escape.level;

import com.badlogic.gdx.math.Rectangle;
import com.esotericsoftware.minlog.Log;
import lane.escape.Constants;
import lane.escape.GeneratorConfig;
import lane.escape.board.PieceGeometry;

/**
 * Entry point for level generation. Holds the screen size the boards are laid out for; every
 * call is independent and safe to run from several threads at once.
 */
public class LevelGenerator {
    private final float screenWidth;
    private final float screenHeight;
    private final long seedSalt;
    private final Rectangle boardRect;

    public LevelGenerator(GeneratorConfig config) {
        this(config.getScreenWidth(), config.getScreenHeight(), config.getSeedSalt());
    }

    public LevelGenerator(float screenWidth, float screenHeight) {
        this(screenWidth, screenHeight, 0L);
    }

    public LevelGenerator(float screenWidth, float screenHeight, long seedSalt) {
        this.boardRect = PieceGeometry.boardRect(screenWidth, screenHeight);
        this.screenWidth = screenWidth;
        this.screenHeight = screenHeight;
        this.seedSalt = seedSalt;
    }

    /**
     * Seed for the given replay of a level. Variant 0 is the first time the level is played.
     */
    public static int levelSeed(int level, int variant, long salt) {
        long seed = (long) (level + 1) * Constants.GENERATION_LEVEL_SEED_FACTOR
            + (long) variant * Constants.GENERATION_VARIANT_SEED_STRIDE
            + salt;
        return (int) seed;
    }

    public GenerationResult generate(int level) {
        return generate(level, 0);
    }

    public GenerationResult generate(int level, int variant) {
        GenerationParameters params = DifficultyParameterizer.forLevel(level);
        int seed = levelSeed(level, variant, seedSalt);
        Log.info("LevelGenerator", "Generating level " + level + " (" + params.getPhase().getDisplayName()
            + (params.isReliefLevel() ? ", relief" : "") + ") target pieces: " + params.getPieceCount()
            + ", seed: " + seed);
        GenerationResult result = generate(params, seed);
        Log.info("LevelGenerator", "Level " + level + " ready: " + result.getTotalCount() + " pieces, score "
            + result.difficultyScore + ", " + result.diagnostics.attempts + " attempts, "
            + result.diagnostics.elapsedMs + "ms, profile " + result.diagnostics.layoutProfile);
        return result;
    }

    public GenerationResult generate(GenerationParameters params, int seed) {
        return createTask(params, seed).runToCompletion();
    }

    /**
     * A task the caller drives with {@link GenerationTask#step()}, e.g. a few steps per frame.
     */
    public GenerationTask createTask(GenerationParameters params, int seed) {
        return new GenerationTask(params, boardRect, screenWidth, screenHeight, seed);
    }

    public Rectangle getBoardRect() {
        return new Rectangle(boardRect);
    }

    public float getScreenWidth() {
        return screenWidth;
    }

    public float getScreenHeight() {
        return screenHeight;
    }
}
