package chessdoc.contracts;

import chessdoc.records.Color;
import chessdoc.records.GameVariant;

/**
 * Immutable chess position: piece placement, side to move, castling rights and
 * en-passant square. Move counters are not part of the position.
 */
public interface Position {

  Color turn();

  GameVariant variant();

  /** FEN of the position without its two move-counter fields. */
  String fen();
}
