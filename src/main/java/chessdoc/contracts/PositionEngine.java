package chessdoc.contracts;

import chessdoc.exceptions.InvalidFenException;
import chessdoc.exceptions.InvalidNotationException;
import chessdoc.records.FenParseResult;
import chessdoc.records.GameVariant;

/**
 * Narrow contract to the chess rules: everything the game tree and the PGN reader
 * need to know about legality and resulting positions.
 *
 * Implementations never mutate the positions they receive.
 */
public interface PositionEngine {

  boolean supportsVariant(GameVariant variant);

  /**
   * @throws IllegalArgumentException if the variant is not supported or has no canonical start position
   */
  Position startPosition(GameVariant variant);

  /**
   * Decodes a FEN string.
   *
   * @param strict whether castling rights inconsistent with the piece placement are rejected
   *               (when {@code false}, they are silently dropped)
   */
  FenParseResult parseFen(GameVariant variant, String fen, boolean strict) throws InvalidFenException;

  String toFen(Position position, int fiftyMoveClock, int fullMoveNumber);

  /** Validates a SAN notation against the given position. */
  MoveDescriptor parseNotation(Position position, String notation) throws InvalidNotationException;

  /** Renders a move as SAN. */
  String notation(Position position, MoveDescriptor move);

  /** @return the position after the move; {@code position} is left untouched */
  Position play(Position position, MoveDescriptor move);

  /** Whether the side to move may pass, i.e. is not in check. */
  boolean isNullMoveLegal(Position position);

  Position playNullMove(Position position);
}
