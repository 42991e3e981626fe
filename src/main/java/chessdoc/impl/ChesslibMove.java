package chessdoc.impl;

import chessdoc.contracts.MoveDescriptor;
import chessdoc.records.Color;
import com.github.bhlangonijr.chesslib.move.Move;

/**
 * {@link MoveDescriptor} wrapping a legal chesslib {@link Move}.
 */
public record ChesslibMove(
        Move      move,
        Color     color,
        char      movingPiece,
        Character capturedPiece,
        Character promotion,
        boolean   isCastling,
        boolean   isEnPassant
) implements MoveDescriptor {

    @Override public boolean isCapture()   { return capturedPiece != null; }
    @Override public boolean isPromotion() { return promotion != null; }

    @Override public String from() { return move.getFrom().name().toLowerCase(); }
    @Override public String to()   { return move.getTo().name().toLowerCase(); }

    @Override
    public String rookFrom() {
        if (!isCastling) return null;
        return (kingSide() ? "h" : "a") + rank();
    }

    @Override
    public String rookTo() {
        if (!isCastling) return null;
        return (kingSide() ? "f" : "d") + rank();
    }

    private boolean kingSide() {
        return to().charAt(0) == 'g';
    }

    private char rank() {
        return color == Color.WHITE ? '1' : '8';
    }
}
