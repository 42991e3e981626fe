package chessdoc.records;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Chess game variants that a PGN {@code Variant} header may declare.
 */
public enum GameVariant {
    REGULAR(null, true),
    CHESS960("Chess960", true),
    NO_KING("No King", false),
    WHITE_KING_ONLY("White King Only", false),
    BLACK_KING_ONLY("Black King Only", false),
    ANTICHESS("Antichess", true),
    HORDE("Horde", true);

    private static final Pattern CHESS960_NAME = Pattern.compile("chess[ -]?960");
    private static final Pattern NO_KING_NAME = Pattern.compile("no[ -]king");
    private static final Pattern WHITE_KING_ONLY_NAME = Pattern.compile("white[ -]king[ -]only");
    private static final Pattern BLACK_KING_ONLY_NAME = Pattern.compile("black[ -]king[ -]only");
    private static final Pattern ANTICHESS_NAME = Pattern.compile("anti[ -]?chess.*");

    private final String pgnName;
    private final boolean canonicalStartPosition;

    GameVariant(String pgnName, boolean canonicalStartPosition) {
        this.pgnName = pgnName;
        this.canonicalStartPosition = canonicalStartPosition;
    }

    /** Value of the {@code Variant} header, or {@code null} for regular chess (no header). */
    public String pgnName() {
        return pgnName;
    }

    /** Whether a game of this variant may omit the {@code FEN} header. */
    public boolean hasCanonicalStartPosition() {
        return canonicalStartPosition;
    }

    /**
     * Parses the value of a {@code Variant} header.
     *
     * @return {@code null} if the name is not recognized
     */
    public static GameVariant fromPgnName(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("regular") || v.equals("standard")) return REGULAR;
        if (v.equals("fischerandom") || CHESS960_NAME.matcher(v).matches()) return CHESS960;
        if (NO_KING_NAME.matcher(v).matches()) return NO_KING;
        if (WHITE_KING_ONLY_NAME.matcher(v).matches()) return WHITE_KING_ONLY;
        if (BLACK_KING_ONLY_NAME.matcher(v).matches()) return BLACK_KING_ONLY;
        if (ANTICHESS_NAME.matcher(v).matches()) return ANTICHESS;
        if (v.equals("horde")) return HORDE;
        return null;
    }
}
