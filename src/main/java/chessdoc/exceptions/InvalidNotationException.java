package chessdoc.exceptions;

/**
 * Thrown when a move notation is not legal, or not understood, in a given position.
 */
public class InvalidNotationException extends RuntimeException {

    private final String fen;
    private final String notation;

    public InvalidNotationException(String fen, String notation, String message) {
        super(message);
        this.fen = fen;
        this.notation = notation;
    }

    /** FEN of the position the notation was checked against. */
    public String fen() {
        return fen;
    }

    public String notation() {
        return notation;
    }
}
