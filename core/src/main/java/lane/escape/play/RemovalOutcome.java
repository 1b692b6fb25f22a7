package lane.escape.play;

/**
 * What happened when the player tapped a piece.
 */
public enum RemovalOutcome {
    /** The piece left the board and others remain removable */
    REMOVED,
    /** Something stands in the piece's exit path; nothing changed */
    BLOCKED,
    /** The piece was already gone, or is unknown */
    ALREADY_REMOVED,
    /** The piece left and the board is now empty */
    CLEARED,
    /** The piece left but none of the remaining pieces can move */
    DEADLOCK
}
