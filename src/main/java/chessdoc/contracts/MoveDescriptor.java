package chessdoc.contracts;

import chessdoc.records.Color;

/**
 * A move validated against a given position by a {@link PositionEngine}.
 *
 * Squares are written in lower-case algebraic form ({@code "e4"}); pieces as the
 * upper-case letters {@code K Q R B N P}.
 */
public interface MoveDescriptor {

  boolean isCapture();

  boolean isCastling();

  boolean isEnPassant();

  boolean isPromotion();

  String from();

  String to();

  Color color();

  char movingPiece();

  /** @return the captured piece, or {@code null} if the move is not a capture */
  Character capturedPiece();

  /** @return the promoted piece, or {@code null} if the move is not a promotion */
  Character promotion();

  /** @return origin square of the rook for castling moves, {@code null} otherwise */
  String rookFrom();

  /** @return destination square of the rook for castling moves, {@code null} otherwise */
  String rookTo();
}
