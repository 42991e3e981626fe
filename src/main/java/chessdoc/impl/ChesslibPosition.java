package chessdoc.impl;

import chessdoc.contracts.Position;
import chessdoc.records.Color;
import chessdoc.records.GameVariant;

/**
 * Position value used by {@link ChesslibPositionEngine}. Stored as the four leading
 * FEN fields, so two positions are equal iff their FEN are.
 *
 * @param placement piece placement field, rank 8 first
 * @param castling  castling field, {@code -} if none
 * @param enPassant en-passant field, {@code -} if none
 */
public record ChesslibPosition(
        GameVariant variant,
        String      placement,
        Color       turn,
        String      castling,
        String      enPassant
) implements Position {

    @Override
    public String fen() {
        return placement + ' ' + turn.code() + ' ' + castling + ' ' + enPassant;
    }

    @Override
    public String toString() {
        return fen();
    }
}
