package chessdoc.impl;

import chessdoc.constants.PgnConstants;
import chessdoc.contracts.MoveDescriptor;
import chessdoc.contracts.Position;
import chessdoc.contracts.PositionEngine;
import chessdoc.exceptions.InvalidFenException;
import chessdoc.exceptions.InvalidNotationException;
import chessdoc.records.Color;
import chessdoc.records.FenParseResult;
import chessdoc.records.GameVariant;
import com.github.bhlangonijr.chesslib.Board;
import com.github.bhlangonijr.chesslib.Piece;
import com.github.bhlangonijr.chesslib.PieceType;
import com.github.bhlangonijr.chesslib.Side;
import com.github.bhlangonijr.chesslib.Square;

import java.util.logging.Logger;

/**
 * {@link PositionEngine} backed by chesslib. Supports regular chess only.
 *
 * chesslib boards are mutable, so one is rebuilt from the FEN of each position passed in
 * and never escapes this class.
 */
public final class ChesslibPositionEngine implements PositionEngine {

    private static final Logger LOGGER = Logger.getLogger("ChesslibPositionEngine");

    private final Position start;

    public ChesslibPositionEngine() {
        this.start = FenCodec.parse(GameVariant.REGULAR, PgnConstants.START_FEN, true).position();
    }

    @Override
    public boolean supportsVariant(GameVariant variant) {
        boolean supported = variant == GameVariant.REGULAR;
        if (!supported) {
            LOGGER.fine(() -> "Variant not supported by chesslib: " + variant);
        }
        return supported;
    }

    @Override
    public Position startPosition(GameVariant variant) {
        if (!supportsVariant(variant)) {
            throw new IllegalArgumentException("Unsupported variant: " + variant);
        }
        return start;
    }

    @Override
    public FenParseResult parseFen(GameVariant variant, String fen, boolean strict) throws InvalidFenException {
        if (!supportsVariant(variant)) {
            throw new IllegalArgumentException("Unsupported variant: " + variant);
        }
        return FenCodec.parse(variant, fen, strict);
    }

    @Override
    public String toFen(Position position, int fiftyMoveClock, int fullMoveNumber) {
        return position.fen() + ' ' + fiftyMoveClock + ' ' + fullMoveNumber;
    }

    @Override
    public MoveDescriptor parseNotation(Position position, String notation) throws InvalidNotationException {
        return SanCodec.parse(toBoard(position), position.fen(), notation);
    }

    @Override
    public String notation(Position position, MoveDescriptor move) {
        return SanCodec.render(toBoard(position), cast(move));
    }

    @Override
    public Position play(Position position, MoveDescriptor move) {
        ChesslibPosition before = cast(position);
        ChesslibMove descriptor = cast(move);
        Board board = toBoard(before);
        if (!board.doMove(descriptor.move())) {
            throw new IllegalArgumentException("Move " + descriptor.move() + " cannot be played in " + before.fen());
        }
        return new ChesslibPosition(
                before.variant(),
                placement(board),
                before.turn().opposite(),
                castlingAfter(before.castling(), descriptor),
                enPassantAfter(board, descriptor));
    }

    @Override
    public boolean isNullMoveLegal(Position position) {
        return !toBoard(position).isKingAttacked();
    }

    @Override
    public Position playNullMove(Position position) {
        ChesslibPosition before = cast(position);
        return new ChesslibPosition(before.variant(), before.placement(), before.turn().opposite(), before.castling(), "-");
    }

    /* ────────────── chesslib glue ────────────── */

    static Board toBoard(Position position) {
        Board board = new Board();
        board.setEnableEvents(false);
        board.loadFromFen(position.fen() + " 0 1");
        return board;
    }

    private static String placement(Board board) {
        StringBuilder sb = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece piece = board.getPiece(Square.squareAt(rank * 8 + file));
                if (piece == Piece.NONE) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                char c = SanCodec.letter(piece.getPieceType());
                sb.append(piece.getPieceSide() == Side.WHITE ? c : Character.toLowerCase(c));
            }
            if (empty > 0) sb.append(empty);
            if (rank > 0) sb.append('/');
        }
        return sb.toString();
    }

    private static String castlingAfter(String castling, ChesslibMove move) {
        if (castling.equals("-")) return castling;
        String result = castling;
        if (move.movingPiece() == 'K') {
            result = move.color() == Color.WHITE ? result.replaceAll("[KQ]", "") : result.replaceAll("[kq]", "");
        }
        result = dropRookRight(result, move.from());
        result = dropRookRight(result, move.to());
        return result.isEmpty() ? "-" : result;
    }

    private static String dropRookRight(String castling, String square) {
        return switch (square) {
            case "h1" -> castling.replace("K", "");
            case "a1" -> castling.replace("Q", "");
            case "h8" -> castling.replace("k", "");
            case "a8" -> castling.replace("q", "");
            default -> castling;
        };
    }

    // set only when a pawn of the side to move stands next to the pawn that just moved
    private static String enPassantAfter(Board after, ChesslibMove move) {
        if (move.movingPiece() != 'P') return "-";
        Square from = move.move().getFrom();
        Square to = move.move().getTo();
        if (Math.abs(SanCodec.rank(to) - SanCodec.rank(from)) != 2) return "-";

        Side opponent = move.color() == Color.WHITE ? Side.BLACK : Side.WHITE;
        Piece capturer = Piece.make(opponent, PieceType.PAWN);
        int file = SanCodec.file(to);
        int rank = SanCodec.rank(to);
        boolean adjacent = (file > 0 && after.getPiece(Square.squareAt(rank * 8 + file - 1)) == capturer)
                || (file < 7 && after.getPiece(Square.squareAt(rank * 8 + file + 1)) == capturer);
        if (!adjacent) return "-";
        int crossedRank = (SanCodec.rank(to) + SanCodec.rank(from)) / 2;
        return "" + (char) ('a' + file) + (char) ('1' + crossedRank);
    }

    private static ChesslibPosition cast(Position position) {
        if (position instanceof ChesslibPosition p) return p;
        throw new IllegalArgumentException("Position not created by this engine: " + position);
    }

    private static ChesslibMove cast(MoveDescriptor move) {
        if (move instanceof ChesslibMove m) return m;
        throw new IllegalArgumentException("Move not created by this engine: " + move);
    }
}
