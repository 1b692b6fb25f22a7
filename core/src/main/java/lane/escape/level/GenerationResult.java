package lane.escape.level;

import lane.escape.board.Piece;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A generated board: pieces in placement order plus what the generator learned about them.
 */
public class GenerationResult {
    public int level;
    public ArrayList<Piece> pieces = new ArrayList<>();
    public boolean solvable;
    public float difficultyScore;
    public GenerationDiagnostics diagnostics;

    // Default constructor for Kryo
    public GenerationResult() {
    }

    public GenerationResult(int level, List<Piece> pieces, boolean solvable, float difficultyScore, GenerationDiagnostics diagnostics) {
        this.level = level;
        this.pieces = new ArrayList<>(pieces);
        this.solvable = solvable;
        this.difficultyScore = difficultyScore;
        this.diagnostics = diagnostics;
    }

    public static GenerationResult empty(int level, GenerationDiagnostics diagnostics) {
        return new GenerationResult(level, Collections.emptyList(), true, 0f, diagnostics);
    }

    public List<Piece> getPieces() {
        return pieces;
    }

    public int getTotalCount() {
        return pieces.size();
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public Piece getPiece(int id) {
        for (Piece piece : pieces) {
            if (piece.getId() == id) {
                return piece;
            }
        }
        return null;
    }

    /**
     * Fresh copies of the pieces with a clean runtime overlay, for a new play session.
     */
    public List<Piece> copyPieces() {
        List<Piece> copies = new ArrayList<>(pieces.size());
        for (Piece piece : pieces) {
            Piece copy = piece.copy();
            copy.setRemoved(false);
            copy.setVisible(true);
            copies.add(copy);
        }
        return copies;
    }

    @Override
    public String toString() {
        return "GenerationResult{level=" + level + ", pieces=" + pieces.size() + ", solvable=" + solvable
            + ", score=" + difficultyScore + ", " + diagnostics + "}";
    }
}
