package chessdoc.constants;

import java.util.Map;

/**
 * Compile-time constants of the PGN reader and writer.
 */
public final class PgnConstants {

    private PgnConstants() {}

    /* ────────────── Layout ────────────── */
    public static final int LINE_WIDTH = 80;
    public static final String GAME_SEPARATOR = "\n";

    /* ────────────── Header defaults ────────────── */
    public static final String UNKNOWN_VALUE = "?";
    public static final String UNKNOWN_DATE = "????.??.??";
    public static final String SETUP_VALUE = "1";

    /* ────────────── Positions ────────────── */
    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    /* ────────────── NAGs ────────────── */
    // symbolic glyph -> numeric value
    public static final Map<String, Integer> SYMBOLIC_NAGS = Map.ofEntries(
            Map.entry("!!",  3),
            Map.entry("!",   1),
            Map.entry("!?",  5),
            Map.entry("?!",  6),
            Map.entry("?",   2),
            Map.entry("??",  4),
            Map.entry("+-",  18),
            Map.entry("+/-", 16),
            Map.entry("+/=", 14),
            Map.entry("+=",  14),
            Map.entry("=",   10),
            Map.entry("~",   13),
            Map.entry("inf", 13),
            Map.entry("=/+", 15),
            Map.entry("=+",  15),
            Map.entry("-/+", 17),
            Map.entry("-+",  19),
            Map.entry("RR",  145),
            Map.entry("N",   146));

    /* ────────────── Identifiers ────────────── */
    public static final String ID_SEPARATOR = "-";
    public static final String VARIATION_MARKER = "v";
    public static final String VARIATION_START = "start";
    public static final String VARIATION_END = "end";
}
