package chessdoc.records;

/**
 * Result of a game, as written in the {@code Result} header and as end-of-game marker.
 */
public enum GameResult {
    WHITE_WINS("1-0"),
    BLACK_WINS("0-1"),
    DRAW("1/2-1/2"),
    LINE("*");

    private final String pgn;

    GameResult(String pgn) {
        this.pgn = pgn;
    }

    public String pgn() {
        return pgn;
    }

    public static GameResult fromPgn(String value) {
        for (GameResult r : values()) {
            if (r.pgn.equals(value)) return r;
        }
        throw new IllegalArgumentException("Invalid game result: " + value);
    }
}
