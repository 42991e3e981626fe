package chessdoc.impl;

import chessdoc.exceptions.InvalidFenException;
import chessdoc.records.Color;
import chessdoc.records.FenParseResult;
import chessdoc.records.GameVariant;
import com.github.bhlangonijr.chesslib.Board;

import java.util.Arrays;

/**
 * FEN decoding and validation for {@link ChesslibPositionEngine}.
 */
final class FenCodec {

    private FenCodec() {}

    private static final String PIECES = "KQRBNPkqrbnp";

    static FenParseResult parse(GameVariant variant, String fen, boolean strict) {
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 6 && !(fields.length == 4 && !strict)) {
            throw new InvalidFenException(fen, "A FEN string must contain exactly 6 space-separated fields.");
        }

        char[] board = parsePlacement(fen, fields[0]);
        Color turn = parseTurn(fen, fields[1]);
        String castling = parseCastling(fen, fields[2], board, strict);
        String enPassant = parseEnPassant(fen, fields[3], board, turn, strict);

        int fiftyMoveClock = 0;
        int fullMoveNumber = 1;
        if (fields.length == 6) {
            fiftyMoveClock = parseCounter(fen, fields[4], 0, "fifty-move clock");
            fullMoveNumber = parseCounter(fen, fields[5], 1, "full-move number");
        }

        checkKings(fen, board);
        checkPawns(fen, board);

        ChesslibPosition position = new ChesslibPosition(variant, fields[0], turn, castling, enPassant);
        if (isOpponentInCheck(position)) {
            throw new InvalidFenException(fen, "The king of the side that is not to move is in check.");
        }
        return new FenParseResult(position, fiftyMoveClock, fullMoveNumber);
    }

    /* ────────────── Fields ────────────── */

    // index = rank * 8 + file, rank 0 = rank 1
    private static char[] parsePlacement(String fen, String field) {
        String[] ranks = field.split("/", -1);
        if (ranks.length != 8) {
            throw new InvalidFenException(fen, "The piece placement field must describe exactly 8 ranks.");
        }
        char[] board = new char[64];
        Arrays.fill(board, ' ');
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    file += c - '0';
                } else if (PIECES.indexOf(c) >= 0) {
                    if (file < 8) board[rank * 8 + file] = c;
                    file++;
                } else {
                    throw new InvalidFenException(fen, "Unexpected character '" + c + "' in the piece placement field.");
                }
                if (file > 8) break;
            }
            if (file != 8) {
                throw new InvalidFenException(fen, "Rank " + (rank + 1) + " does not contain exactly 8 squares.");
            }
        }
        return board;
    }

    private static Color parseTurn(String fen, String field) {
        return switch (field) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new InvalidFenException(fen, "Invalid turn field: " + field);
        };
    }

    private static String parseCastling(String fen, String field, char[] board, boolean strict) {
        if (field.equals("-")) return "-";
        if (!field.matches("K?Q?k?q?")) {
            throw new InvalidFenException(fen, "Invalid castling field: " + field);
        }
        StringBuilder sb = new StringBuilder();
        for (char right : field.toCharArray()) {
            if (isCastlingConsistent(board, right)) {
                sb.append(right);
            } else if (strict) {
                throw new InvalidFenException(fen, "Castling right '" + right + "' is not consistent with the piece placement.");
            }
        }
        return sb.length() == 0 ? "-" : sb.toString();
    }

    private static boolean isCastlingConsistent(char[] board, char right) {
        return switch (right) {
            case 'K' -> board[4] == 'K' && board[7] == 'R';
            case 'Q' -> board[4] == 'K' && board[0] == 'R';
            case 'k' -> board[60] == 'k' && board[63] == 'r';
            case 'q' -> board[60] == 'k' && board[56] == 'r';
            default -> false;
        };
    }

    private static String parseEnPassant(String fen, String field, char[] board, Color turn, boolean strict) {
        if (field.equals("-")) return "-";
        char expectedRank = turn == Color.WHITE ? '6' : '3';
        if (field.length() != 2 || field.charAt(0) < 'a' || field.charAt(0) > 'h' || field.charAt(1) != expectedRank) {
            throw new InvalidFenException(fen, "Invalid en-passant field: " + field);
        }
        int file = field.charAt(0) - 'a';
        // square of the pawn that has just moved two squares, and the two squares it crossed
        int pawnSquare = turn == Color.WHITE ? 32 + file : 24 + file;
        int crossed = turn == Color.WHITE ? 40 + file : 16 + file;
        int origin = turn == Color.WHITE ? 48 + file : 8 + file;
        char pawn = turn == Color.WHITE ? 'p' : 'P';
        boolean consistent = board[pawnSquare] == pawn && board[crossed] == ' ' && board[origin] == ' ';
        if (consistent) return field;
        if (strict) {
            throw new InvalidFenException(fen, "En-passant square " + field + " is not consistent with the piece placement.");
        }
        return "-";
    }

    private static int parseCounter(String fen, String field, int min, String name) {
        if (!field.matches("[0-9]{1,6}")) {
            throw new InvalidFenException(fen, "Invalid " + name + ": " + field);
        }
        int value = Integer.parseInt(field);
        if (value < min) {
            throw new InvalidFenException(fen, "Invalid " + name + ": " + field);
        }
        return value;
    }

    /* ────────────── Legality ────────────── */

    private static void checkKings(String fen, char[] board) {
        int white = 0, black = 0;
        for (char c : board) {
            if (c == 'K') white++;
            else if (c == 'k') black++;
        }
        if (white != 1 || black != 1) {
            throw new InvalidFenException(fen, "Each side must have exactly one king.");
        }
    }

    private static void checkPawns(String fen, char[] board) {
        for (int file = 0; file < 8; file++) {
            if (Character.toUpperCase(board[file]) == 'P' || Character.toUpperCase(board[56 + file]) == 'P') {
                throw new InvalidFenException(fen, "Pawns cannot stand on the first or the last rank.");
            }
        }
    }

    private static boolean isOpponentInCheck(ChesslibPosition position) {
        ChesslibPosition flipped = new ChesslibPosition(position.variant(), position.placement(),
                position.turn().opposite(), "-", "-");
        Board board = ChesslibPositionEngine.toBoard(flipped);
        return board.isKingAttacked();
    }
}
