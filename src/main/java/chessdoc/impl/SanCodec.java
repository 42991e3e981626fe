package chessdoc.impl;

import chessdoc.exceptions.InvalidNotationException;
import chessdoc.records.Color;
import com.github.bhlangonijr.chesslib.Board;
import com.github.bhlangonijr.chesslib.Piece;
import com.github.bhlangonijr.chesslib.PieceType;
import com.github.bhlangonijr.chesslib.Side;
import com.github.bhlangonijr.chesslib.Square;
import com.github.bhlangonijr.chesslib.move.Move;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Standard algebraic notation on top of chesslib's legal move generator.
 */
final class SanCodec {

    private SanCodec() {}

    // 1: O-O-O, 2: O-O, 3-7: piece move (piece, file, rank, x, to), 8-11: pawn move (file, x, to, promotion), 12: check
    private static final Pattern SAN = Pattern.compile(
            "(?:(O-O-O|0-0-0)|(O-O|0-0)|([KQRBN])([a-h])?([1-8])?(x)?([a-h][1-8])"
          + "|(?:([a-h])(x)?)?([a-h][1-8])(?:=?([KQRBNP]))?)([+#])?");

    /* ────────────── Descriptor ────────────── */

    static ChesslibMove describe(Board board, Move move) {
        Piece moving = board.getPiece(move.getFrom());
        PieceType type = moving.getPieceType();
        Piece target = board.getPiece(move.getTo());

        boolean castling = type == PieceType.KING && Math.abs(file(move.getFrom()) - file(move.getTo())) == 2;
        boolean enPassant = type == PieceType.PAWN && file(move.getFrom()) != file(move.getTo()) && target == Piece.NONE;

        Character captured = null;
        if (enPassant) captured = 'P';
        else if (target != Piece.NONE) captured = letter(target.getPieceType());

        Character promotion = move.getPromotion() == Piece.NONE ? null : letter(move.getPromotion().getPieceType());
        Color color = moving.getPieceSide() == Side.WHITE ? Color.WHITE : Color.BLACK;
        return new ChesslibMove(move, color, letter(type), captured, promotion, castling, enPassant);
    }

    /* ────────────── Rendering ────────────── */

    static String render(Board board, ChesslibMove descriptor) {
        Move move = descriptor.move();
        StringBuilder sb = new StringBuilder();

        if (descriptor.isCastling()) {
            sb.append(file(move.getTo()) == 6 ? "O-O" : "O-O-O");
        } else if (descriptor.movingPiece() == 'P') {
            if (descriptor.isCapture()) {
                sb.append(descriptor.from().charAt(0)).append('x');
            }
            sb.append(descriptor.to());
            if (descriptor.isPromotion()) {
                sb.append('=').append(descriptor.promotion());
            }
        } else {
            sb.append(descriptor.movingPiece());
            sb.append(disambiguation(board, move));
            if (descriptor.isCapture()) sb.append('x');
            sb.append(descriptor.to());
        }

        sb.append(checkSymbol(board, move));
        return sb.toString();
    }

    private static String disambiguation(Board board, Move move) {
        PieceType type = board.getPiece(move.getFrom()).getPieceType();
        boolean found = false, sameFile = false, sameRank = false;
        for (Move other : board.legalMoves()) {
            if (other.getTo() != move.getTo() || other.getFrom() == move.getFrom()) continue;
            if (board.getPiece(other.getFrom()).getPieceType() != type) continue;
            found = true;
            if (file(other.getFrom()) == file(move.getFrom())) sameFile = true;
            if (rank(other.getFrom()) == rank(move.getFrom())) sameRank = true;
        }
        String from = move.getFrom().name().toLowerCase();
        if (sameFile) return sameRank ? from : from.substring(1);
        return found ? from.substring(0, 1) : "";
    }

    private static String checkSymbol(Board board, Move move) {
        board.doMove(move);
        try {
            if (!board.isKingAttacked()) return "";
            return board.legalMoves().isEmpty() ? "#" : "+";
        } finally {
            board.undoMove();
        }
    }

    /* ────────────── Parsing ────────────── */

    static ChesslibMove parse(Board board, String fen, String notation) {
        Matcher m = SAN.matcher(notation);
        if (!m.matches()) {
            throw new InvalidNotationException(fen, notation, "Invalid move notation syntax.");
        }
        List<Move> legal = board.legalMoves();

        Move move;
        if (m.group(1) != null || m.group(2) != null) {
            move = parseCastling(board, legal, fen, notation, m.group(2) != null);
        } else if (m.group(3) != null) {
            move = parsePieceMove(board, legal, fen, notation, m);
        } else {
            move = parsePawnMove(board, legal, fen, notation, m);
        }

        ChesslibMove descriptor = describe(board, move);
        boolean captureSymbol = m.group(6) != null || m.group(9) != null;
        if (captureSymbol && !descriptor.isCapture()) {
            throw new InvalidNotationException(fen, notation, "Capture symbol used for a move that is not a capture.");
        }
        return descriptor;
    }

    private static Move parseCastling(Board board, List<Move> legal, String fen, String notation, boolean kingSide) {
        for (Move move : legal) {
            if (board.getPiece(move.getFrom()).getPieceType() != PieceType.KING) continue;
            int delta = file(move.getTo()) - file(move.getFrom());
            if (kingSide ? delta == 2 : delta == -2) return move;
        }
        throw new InvalidNotationException(fen, notation,
                kingSide ? "King-side castling is not legal in this position." : "Queen-side castling is not legal in this position.");
    }

    private static Move parsePieceMove(Board board, List<Move> legal, String fen, String notation, Matcher m) {
        PieceType type = pieceType(m.group(3).charAt(0));
        Square to = square(m.group(7));
        int fileFilter = m.group(4) == null ? -1 : m.group(4).charAt(0) - 'a';
        int rankFilter = m.group(5) == null ? -1 : m.group(5).charAt(0) - '1';

        Piece target = board.getPiece(to);
        if (target != Piece.NONE && target.getPieceSide() == board.getSideToMove()) {
            throw new InvalidNotationException(fen, notation, "Trying to capture your own pieces.");
        }

        List<Move> candidates = new ArrayList<>();
        for (Move move : legal) {
            if (move.getTo() != to || board.getPiece(move.getFrom()).getPieceType() != type) continue;
            if (fileFilter >= 0 && file(move.getFrom()) != fileFilter) continue;
            if (rankFilter >= 0 && rank(move.getFrom()) != rankFilter) continue;
            candidates.add(move);
        }
        if (candidates.isEmpty()) {
            throw new InvalidNotationException(fen, notation,
                    "No " + m.group(3) + " can legally move to " + m.group(7) + ".");
        }
        if (candidates.size() > 1) {
            throw new InvalidNotationException(fen, notation,
                    "Cannot determine which " + m.group(3) + " is moving to " + m.group(7) + " (disambiguation required).");
        }
        return candidates.get(0);
    }

    private static Move parsePawnMove(Board board, List<Move> legal, String fen, String notation, Matcher m) {
        Square to = square(m.group(10));
        int fromFile = m.group(8) == null ? to.name().toLowerCase().charAt(0) - 'a' : m.group(8).charAt(0) - 'a';
        String promotion = m.group(11);

        List<Move> candidates = new ArrayList<>();
        for (Move move : legal) {
            if (move.getTo() != to || board.getPiece(move.getFrom()).getPieceType() != PieceType.PAWN) continue;
            if (file(move.getFrom()) != fromFile) continue;
            candidates.add(move);
        }
        if (candidates.isEmpty()) {
            throw new InvalidNotationException(fen, notation, "No pawn can legally move to " + m.group(10) + ".");
        }

        boolean isPromotion = candidates.get(0).getPromotion() != Piece.NONE;
        if (!isPromotion) {
            if (promotion != null) {
                throw new InvalidNotationException(fen, notation, "A pawn can only be promoted on the last rank.");
            }
            return candidates.get(0);
        }
        if (promotion == null) {
            throw new InvalidNotationException(fen, notation, "A promoted piece must be specified.");
        }
        if (promotion.equals("P") || promotion.equals("K")) {
            throw new InvalidNotationException(fen, notation, "A pawn cannot be promoted to " + promotion + ".");
        }
        PieceType promotedType = pieceType(promotion.charAt(0));
        for (Move move : candidates) {
            if (move.getPromotion().getPieceType() == promotedType) return move;
        }
        throw new InvalidNotationException(fen, notation, "Invalid promotion.");
    }

    /* ────────────── Helpers ────────────── */

    static int file(Square square) {
        return square.ordinal() % 8;
    }

    static int rank(Square square) {
        return square.ordinal() / 8;
    }

    static Square square(String name) {
        return Square.valueOf(name.toUpperCase());
    }

    static char letter(PieceType type) {
        return switch (type) {
            case PAWN -> 'P';
            case KNIGHT -> 'N';
            case BISHOP -> 'B';
            case ROOK -> 'R';
            case QUEEN -> 'Q';
            case KING -> 'K';
            default -> throw new IllegalArgumentException("No piece: " + type);
        };
    }

    static PieceType pieceType(char letter) {
        return switch (letter) {
            case 'P' -> PieceType.PAWN;
            case 'N' -> PieceType.KNIGHT;
            case 'B' -> PieceType.BISHOP;
            case 'R' -> PieceType.ROOK;
            case 'Q' -> PieceType.QUEEN;
            case 'K' -> PieceType.KING;
            default -> throw new IllegalArgumentException("Invalid piece letter: " + letter);
        };
    }
}
