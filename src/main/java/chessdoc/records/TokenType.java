package chessdoc.records;

/**
 * Kinds of lexical tokens found in a PGN text.
 */
public enum TokenType {
    BEGIN_HEADER,    // [
    END_HEADER,      // ]
    HEADER_ID,       // White in [White "Kasparov, G."]
    HEADER_VALUE,    // Kasparov, G. in [White "Kasparov, G."]
    MOVE_NUMBER,     // 42. or 23...
    MOVE,            // SAN or --
    NAG,             // $12 or one of the symbolic glyphs
    COMMENT,         // {some text}
    BEGIN_VARIATION, // (
    END_VARIATION,   // )
    END_OF_GAME;     // 1-0, 0-1, 1/2-1/2 or *

    /** Whether tokens of this type belong to the move-text section of a game. */
    public boolean isMoveText() {
        return ordinal() >= MOVE_NUMBER.ordinal();
    }
}
