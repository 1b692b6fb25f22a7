package lane.escape;

public class Constants {

    // =========================
    // PIECE GEOMETRY
    // =========================

    /** Reference capsule long side in pixels, only the ratio to the short side matters */
    public static final float PIECE_LENGTH = 45f;

    /** Reference capsule short side in pixels */
    public static final float PIECE_WIDTH = 18f;

    /** Long side divided by short side */
    public static final float PIECE_ASPECT_RATIO = PIECE_LENGTH / PIECE_WIDTH;

    /** Minimum inset applied to a piece's bounding box when building its hit-rect */
    public static final float PIECE_HITBOX_INSET = 4f;

    /** Hit-rect inset as a fraction of the bounding box's shorter side */
    public static final float PIECE_COLLISION_SHRINK = 0.30f;

    /** Default short side when the parameters do not provide one */
    public static final float PIECE_DEFAULT_SHORT_SIDE = 16f;

    /** Minimum gap between lattice cells */
    public static final float LATTICE_MIN_GAP = 4f;

    /** Gap between lattice cells as a fraction of the short side */
    public static final float LATTICE_GAP_RATIO = 0.35f;


    // =========================
    // BOARD LAYOUT
    // =========================

    /** Height of the HUD bar above the board */
    public static final float LAYOUT_TOP_BAR_HEIGHT = 60f;

    /** Height of the tool bar below the board */
    public static final float LAYOUT_BOTTOM_BAR_HEIGHT = 110f;

    /** Horizontal padding between the screen edge and the board */
    public static final float LAYOUT_BOARD_SIDE_PADDING = 4f;

    /** Space reserved under the top bar for the progress readout */
    public static final float LAYOUT_BOARD_TOP_OFFSET = 60f;

    /** Space between the board and the bottom tool bar */
    public static final float LAYOUT_BOARD_BOTTOM_MARGIN = 10f;

    /** Extra margin so no piece is clipped by the board edge */
    public static final float LAYOUT_SAFETY_MARGIN = 6f;

    /** Margin for the renderer's outline and shadow */
    public static final float LAYOUT_RENDER_MARGIN = 10f;


    // =========================
    // LEVEL GENERATION
    // =========================

    /** Fallback attempt budget for a single level */
    public static final int GENERATION_DEFAULT_MAX_ATTEMPTS = 6;

    /** Fallback wall-clock budget for a single level in milliseconds */
    public static final long GENERATION_DEFAULT_MAX_TIME_MS = 3000L;

    /** Seed spacing between successive attempts of the same level */
    public static final int GENERATION_ATTEMPT_SEED_STRIDE = 131;

    /** Seed multiplier applied to the level index */
    public static final int GENERATION_LEVEL_SEED_FACTOR = 10007;

    /** Seed spacing between replays of the same level */
    public static final int GENERATION_VARIANT_SEED_STRIDE = 7919;

    /** Jitter added to cell weights before ordering */
    public static final float PLACER_WEIGHT_JITTER = 0.1f;

    /** Jitter added to neighbour scores when pairing cells */
    public static final float PLACER_NEIGHBOR_JITTER = 0.05f;

    /** Jitter added to peel candidate scores */
    public static final float PEEL_SCORE_JITTER = 0.1f;

    /** Layout profile weight floor so no region is left completely empty */
    public static final float LAYOUT_WEIGHT_FLOOR = 0.2f;


    // =========================
    // ANALYSIS
    // =========================

    /** Largest board (active pieces) for which safe moves are simulated */
    public static final int ANALYSIS_SAFE_MOVE_LIMIT = 50;

    /** Ray-march step in pixels */
    public static final float RAY_STEP_SIZE = 4f;

    /** Ray-march iteration cap; a ray that has not left the screen by then is treated as blocked */
    public static final int RAY_MAX_STEPS = 2000;

    /** Normaliser for average depth in the difficulty score */
    public static final float SCORE_AVG_DEPTH_NORM = 8f;

    /** Normaliser for max depth in the difficulty score */
    public static final float SCORE_MAX_DEPTH_NORM = 16f;


    // =========================
    // LEVEL SERVICE
    // =========================

    /** Default number of background generation threads */
    public static final int SERVICE_DEFAULT_WORKER_THREADS = 1;

    /** Default screen width used when no configuration is present */
    public static final float DEFAULT_SCREEN_WIDTH = 375f;

    /** Default screen height used when no configuration is present */
    public static final float DEFAULT_SCREEN_HEIGHT = 667f;
}
