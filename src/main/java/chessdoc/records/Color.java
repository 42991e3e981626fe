package chessdoc.records;

/**
 * Side to move. The single-character code is the one used in FEN strings and node IDs.
 */
public enum Color {
    WHITE('w'),
    BLACK('b');

    private final char code;

    Color(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public Color opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
