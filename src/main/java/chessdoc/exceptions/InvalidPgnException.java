package chessdoc.exceptions;

/**
 * Thrown when a PGN text cannot be decoded.
 *
 * Carries the text being read and the location of the failure. The character index is
 * negative when no location applies (e.g. a game index past the end of the text).
 */
public class InvalidPgnException extends RuntimeException {

    public enum Reason {
        INVALID_TOKEN("Invalid token."),
        UNEXPECTED_HEADER("Unexpected header."),
        MISSING_HEADER_ID("Missing header ID."),
        MISSING_HEADER_VALUE("Missing header value."),
        MISSING_END_OF_HEADER("Missing end of header marker."),
        INVALID_MOVE("Invalid move (%s): %s"),
        INVALID_FEN("Invalid FEN in PGN: %s"),
        UNKNOWN_VARIANT("Unknown chess game variant: %s"),
        VARIANT_WITHOUT_FEN("A FEN header is required with chess game variant %s."),
        UNSUPPORTED_VARIANT("Chess game variant %s is not supported by the position engine."),
        UNEXPECTED_BEGIN_OF_VARIATION("Unexpected begin of variation."),
        UNEXPECTED_END_OF_VARIATION("Unexpected end of variation."),
        UNEXPECTED_END_OF_GAME("Unexpected end of game: there are pending variations."),
        UNEXPECTED_END_OF_TEXT("Unexpected end of text: the current game is not complete."),
        INVALID_GAME_INDEX("Game index %d is invalid (only %d game(s) found in the PGN data).");

        private final String template;

        Reason(String template) {
            this.template = template;
        }

        String format(Object... args) {
            return args.length == 0 ? template : String.format(template, args);
        }
    }

    private final String pgn;
    private final int index;
    private final int lineNumber;
    private final Reason reason;

    public InvalidPgnException(String pgn, int index, int lineNumber, Reason reason, Object... args) {
        this(pgn, index, lineNumber, reason, null, args);
    }

    public InvalidPgnException(String pgn, int index, int lineNumber, Reason reason, Throwable cause, Object... args) {
        super(buildMessage(index, lineNumber, reason.format(args)), cause);
        this.pgn = pgn;
        this.index = index;
        this.lineNumber = lineNumber;
        this.reason = reason;
    }

    public String pgn() { return pgn; }

    /** 0-based character index of the failure, negative if not applicable. */
    public int index() { return index; }

    /** 1-based line number of the failure, negative if not applicable. */
    public int lineNumber() { return lineNumber; }

    public Reason reason() { return reason; }

    private static String buildMessage(int index, int lineNumber, String detail) {
        if (index < 0) return detail;
        return "Line " + lineNumber + " (character " + index + "): " + detail;
    }
}
