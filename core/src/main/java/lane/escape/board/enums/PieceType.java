package lane.escape.board.enums;

/**
 * Cosmetic skin of a piece. Has no effect on blocking.
 */
public enum PieceType {
    PIG,
    SHEEP,
    DOG,
    FOX,
    PANDA
}
