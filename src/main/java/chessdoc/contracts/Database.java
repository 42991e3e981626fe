package chessdoc.contracts;

import chessdoc.game.Game;

/**
 * Games read from one PGN text, decoded lazily on access.
 *
 * Iteration skips the games that fail to decode, so it may yield fewer than
 * {@link #gameCount()} games.
 */
public interface Database extends Iterable<Game> {

  int gameCount();

  /**
   * Decodes the game at the given index.
   *
   * @throws IllegalArgumentException if the index is negative
   * @throws IndexOutOfBoundsException if the index is not less than {@link #gameCount()}
   * @throws chessdoc.exceptions.InvalidPgnException if the game cannot be decoded
   */
  Game game(int gameIndex);

  /** Decodes all games, skipping invalid ones. */
  Iterable<Game> games();
}
