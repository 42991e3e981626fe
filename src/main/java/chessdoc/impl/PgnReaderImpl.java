package chessdoc.impl;

import chessdoc.contracts.AnnotatedEntity;
import chessdoc.contracts.Database;
import chessdoc.contracts.Node;
import chessdoc.contracts.PgnReader;
import chessdoc.contracts.PositionEngine;
import chessdoc.contracts.Variation;
import chessdoc.exceptions.InvalidFenException;
import chessdoc.exceptions.InvalidNotationException;
import chessdoc.exceptions.InvalidPgnException;
import chessdoc.exceptions.InvalidPgnException.Reason;
import chessdoc.game.Game;
import chessdoc.records.Color;
import chessdoc.records.DateValue;
import chessdoc.records.FenParseResult;
import chessdoc.records.GameResult;
import chessdoc.records.GameVariant;
import chessdoc.records.PgnToken;
import chessdoc.records.StreamLocation;
import chessdoc.records.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static chessdoc.constants.PgnConstants.UNKNOWN_VALUE;

/**
 * PGN reader. Nested variations are tracked on an explicit stack, so the nesting depth
 * is bounded by memory only.
 */
public final class PgnReaderImpl implements PgnReader {

    private static final Pattern ELO = Pattern.compile("[0-9]{1,9}");
    private static final Pattern ROUND = Pattern.compile("(\\?|[0-9]{1,9})(?:\\.(\\?|[0-9]{1,9}))?(?:\\.(\\?|[0-9]{1,9}))?");

    private final PositionEngine engine;

    public PgnReaderImpl() {
        this(new ChesslibPositionEngine());
    }

    public PgnReaderImpl(PositionEngine engine) {
        this.engine = engine;
    }

    @Override
    public Database readDatabase(String pgn) {
        return new PgnDatabaseImpl(pgn, this);
    }

    @Override
    public Game readGame(String pgn) {
        return readGame(pgn, 0);
    }

    @Override
    public Game readGame(String pgn, int gameIndex) {
        if (gameIndex < 0) {
            throw new IllegalArgumentException("Negative game index: " + gameIndex);
        }
        PgnTokenStream stream = new PgnTokenStream(pgn);
        for (int skipped = 0; skipped < gameIndex; skipped++) {
            if (!stream.skipGame()) {
                throw new InvalidPgnException(stream.text(), -1, -1, Reason.INVALID_GAME_INDEX, gameIndex, skipped);
            }
        }
        // a blank text holds no first game: parsing it fails with a premature end of text
        StreamLocation start = stream.currentLocation();
        if (gameIndex > 0 && !stream.skipGame()) {
            throw new InvalidPgnException(stream.text(), -1, -1, Reason.INVALID_GAME_INDEX, gameIndex, gameIndex);
        }
        return parseGame(new PgnTokenStream(stream.text(), start));
    }

    /* ═════════════════════════ Game ═════════════════════════ */

    /**
     * Reads one game from the current location of the stream, up to and including its
     * end-of-game marker.
     */
    Game parseGame(PgnTokenStream stream) {
        Game game = null;
        AnnotatedEntity current = null; // node or variation the next move is appended to
        Deque<Node> stack = new ArrayDeque<>(); // nodes the open variations branch from
        InitialPositionSetup setup = new InitialPositionSetup();

        PgnToken token;
        while ((token = stream.next()) != null) {
            if (game == null) {
                game = new Game(engine);
            }
            if (token.type().isMoveText() && current == null) {
                initializeInitialPosition(stream, game, setup);
                current = game.mainVariation();
            }

            switch (token.type()) {
                case BEGIN_HEADER -> {
                    if (current != null) {
                        throw error(stream, token, Reason.UNEXPECTED_HEADER);
                    }
                    readHeader(stream, game, setup);
                }
                case MOVE_NUMBER -> { }
                case MOVE -> current = play(stream, token, current);
                case NAG -> current.addNag(token.nag());
                case COMMENT -> {
                    for (Map.Entry<String, String> tag : token.comment().tags().entrySet()) {
                        current.setTag(tag.getKey(), tag.getValue());
                    }
                    if (token.comment().comment() != null) {
                        boolean isLong = current instanceof Variation ? token.emptyLineAfter() : token.emptyLineBefore();
                        current.setComment(token.comment().comment(), isLong);
                    }
                }
                case BEGIN_VARIATION -> {
                    if (current instanceof Variation) {
                        throw error(stream, token, Reason.UNEXPECTED_BEGIN_OF_VARIATION);
                    }
                    Node node = (Node) current;
                    stack.push(node);
                    current = node.addVariation(token.emptyLineBefore());
                }
                case END_VARIATION -> {
                    if (stack.isEmpty()) {
                        throw error(stream, token, Reason.UNEXPECTED_END_OF_VARIATION);
                    }
                    current = stack.pop();
                }
                case END_OF_GAME -> {
                    if (!stack.isEmpty()) {
                        throw error(stream, token, Reason.UNEXPECTED_END_OF_GAME);
                    }
                    game.setResult(GameResult.fromPgn(token.text()));
                    return game;
                }
                default -> throw error(stream, token, Reason.INVALID_TOKEN);
            }
        }

        StreamLocation end = stream.currentLocation();
        throw new InvalidPgnException(stream.text(), end.pos(), end.lineIndex(), Reason.UNEXPECTED_END_OF_TEXT);
    }

    private static AnnotatedEntity play(PgnTokenStream stream, PgnToken token, AnnotatedEntity current) {
        try {
            return current instanceof Node node ? node.play(token.text()) : ((Variation) current).play(token.text());
        } catch (InvalidNotationException e) {
            throw new InvalidPgnException(stream.text(), token.characterIndex(), token.lineIndex(), Reason.INVALID_MOVE, e,
                    e.notation(), e.getMessage());
        }
    }

    /* ═════════════════════════ Headers ═════════════════════════ */

    private static final class InitialPositionSetup {
        String fen;
        PgnToken fenToken;
        GameVariant variant;
        PgnToken variantToken;
    }

    private void readHeader(PgnTokenStream stream, Game game, InitialPositionSetup setup) {
        PgnToken id = stream.next();
        if (id == null || id.type() != TokenType.HEADER_ID) {
            throw error(stream, id, Reason.MISSING_HEADER_ID);
        }
        PgnToken value = stream.next();
        if (value == null || value.type() != TokenType.HEADER_VALUE) {
            throw error(stream, value, Reason.MISSING_HEADER_VALUE);
        }
        PgnToken end = stream.next();
        if (end == null || end.type() != TokenType.END_HEADER) {
            throw error(stream, end, Reason.MISSING_END_OF_HEADER);
        }
        processHeader(stream, game, setup, id.text(), value);
    }

    private static void processHeader(PgnTokenStream stream, Game game, InitialPositionSetup setup, String key, PgnToken valueToken) {
        String value = valueToken.text();
        switch (key) {
            case "White" -> game.setPlayerName(Color.WHITE, nullable(value));
            case "Black" -> game.setPlayerName(Color.BLACK, nullable(value));
            case "WhiteElo" -> game.setPlayerElo(Color.WHITE, parseElo(value));
            case "BlackElo" -> game.setPlayerElo(Color.BLACK, parseElo(value));
            case "WhiteTitle" -> game.setPlayerTitle(Color.WHITE, nullable(value));
            case "BlackTitle" -> game.setPlayerTitle(Color.BLACK, nullable(value));
            case "Event" -> game.setEvent(nullable(value));
            case "Round" -> parseRound(game, value);
            case "Date" -> game.setDate(DateValue.fromPgnString(value));
            case "Site" -> game.setSite(nullable(value));
            case "Annotator" -> game.setAnnotator(nullable(value));
            case "ECO" -> game.setEco(Game.isValidEco(value) ? value : null);
            case "Opening" -> game.setOpening(nullable(value));
            case "Variation" -> game.setOpeningVariation(nullable(value));
            case "SubVariation" -> game.setOpeningSubVariation(nullable(value));
            case "Termination" -> game.setTermination(nullable(value));
            case "FEN" -> {
                setup.fen = value;
                setup.fenToken = valueToken;
            }
            case "Variant" -> {
                setup.variant = GameVariant.fromPgnName(value);
                if (setup.variant == null) {
                    throw error(stream, valueToken, Reason.UNKNOWN_VARIANT, value);
                }
                setup.variantToken = valueToken;
            }
            default -> { } // other headers are not kept
        }
    }

    private void initializeInitialPosition(PgnTokenStream stream, Game game, InitialPositionSetup setup) {
        if (setup.fen == null && setup.variant == null) {
            return;
        }
        GameVariant variant = setup.variant == null ? GameVariant.REGULAR : setup.variant;
        if (setup.fen == null && !variant.hasCanonicalStartPosition()) {
            throw error(stream, setup.variantToken, Reason.VARIANT_WITHOUT_FEN, setup.variantToken.text());
        }
        if (!engine.supportsVariant(variant)) {
            throw error(stream, setup.variantToken, Reason.UNSUPPORTED_VARIANT, setup.variantToken.text());
        }

        if (setup.fen == null) {
            game.setInitialPosition(engine.startPosition(variant), 1);
            return;
        }
        try {
            FenParseResult result = engine.parseFen(variant, setup.fen, false);
            game.setInitialPosition(result.position(), result.fullMoveNumber());
        } catch (InvalidFenException e) {
            PgnToken at = setup.fenToken;
            throw new InvalidPgnException(stream.text(), at.characterIndex(), at.lineIndex(), Reason.INVALID_FEN, e, e.getMessage());
        }
    }

    private static String nullable(String value) {
        return value.isEmpty() || value.equals(UNKNOWN_VALUE) ? null : value;
    }

    private static Integer parseElo(String value) {
        return ELO.matcher(value).matches() ? Integer.valueOf(value) : null;
    }

    // malformed values are dropped
    private static void parseRound(Game game, String value) {
        Matcher m = ROUND.matcher(value);
        if (!m.matches()) {
            return;
        }
        game.setRound(roundPart(m.group(1)));
        game.setSubRound(roundPart(m.group(2)));
        game.setSubSubRound(roundPart(m.group(3)));
    }

    private static Integer roundPart(String part) {
        return part == null || part.equals(UNKNOWN_VALUE) ? null : Integer.valueOf(part);
    }

    /* ═════════════════════════ Errors ═════════════════════════ */

    /** Error located at the given token, or at the end of the text if there is none. */
    private static InvalidPgnException error(PgnTokenStream stream, PgnToken token, Reason reason, Object... args) {
        if (token == null) {
            StreamLocation end = stream.currentLocation();
            return new InvalidPgnException(stream.text(), end.pos(), end.lineIndex(), reason, args);
        }
        return new InvalidPgnException(stream.text(), token.characterIndex(), token.lineIndex(), reason, args);
    }
}
