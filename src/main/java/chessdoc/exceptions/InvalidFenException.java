package chessdoc.exceptions;

/**
 * Thrown when a FEN string cannot be decoded into a valid position.
 */
public class InvalidFenException extends RuntimeException {

    private final String fen;

    public InvalidFenException(String fen, String message) {
        super(message);
        this.fen = fen;
    }

    public String fen() {
        return fen;
    }
}
