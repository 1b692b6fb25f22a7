package lane.escape.board.enums;

/**
 * Spatial density shapes the layout placer can fill the board with.
 */
public enum LayoutProfileType {
    UNIFORM,
    RING,
    DIAGONAL_BAND,
    TWIN_CLUSTER,
    HOLLOW_CENTER
}
