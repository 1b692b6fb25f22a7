package lane.escape.board.generators;

/**
 * Outcome of one step of a resumable generation stage.
 */
public enum StepResult {
    /** More work remains; call step again. */
    CONTINUE,
    /** The stage finished successfully. */
    COMPLETE,
    /** The stage cannot finish with the current board. */
    DEADEND
}
