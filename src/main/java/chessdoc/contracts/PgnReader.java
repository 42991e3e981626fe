package chessdoc.contracts;

import chessdoc.game.Game;

public interface PgnReader {

  Database readDatabase(String pgn);

  /** Reads the first game of the text. */
  Game readGame(String pgn);

  /** Reads one game, skipping the ones before it without decoding them. */
  Game readGame(String pgn, int gameIndex);
}
