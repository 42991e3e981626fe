package chessdoc;

import chessdoc.contracts.Database;
import chessdoc.contracts.PositionEngine;
import chessdoc.game.Game;
import chessdoc.impl.PgnReaderImpl;
import chessdoc.impl.PgnWriterImpl;
import chessdoc.records.PgnWriteOptions;

import java.util.List;

/**
 * Entry point for reading and writing PGN with the default position engine.
 */
public final class Pgn {

  private static final PgnReaderImpl READER = new PgnReaderImpl();
  private static final PgnWriterImpl WRITER = new PgnWriterImpl();

  private Pgn() {}

  /** Indexes the games of the text; each one is decoded on access. */
  public static Database read(String pgn) {
    return READER.readDatabase(pgn);
  }

  /**
   * Decodes the game at the given index.
   *
   * @throws chessdoc.exceptions.InvalidPgnException if the game cannot be decoded or does not exist
   */
  public static Game read(String pgn, int gameIndex) {
    return READER.readGame(pgn, gameIndex);
  }

  public static Database read(String pgn, PositionEngine engine) {
    return new PgnReaderImpl(engine).readDatabase(pgn);
  }

  public static Game read(String pgn, int gameIndex, PositionEngine engine) {
    return new PgnReaderImpl(engine).readGame(pgn, gameIndex);
  }

  public static String write(Game game) {
    return WRITER.write(game);
  }

  public static String write(Game game, PgnWriteOptions options) {
    return WRITER.write(game, options);
  }

  public static String write(List<Game> games) {
    return WRITER.write(games);
  }

  public static String write(List<Game> games, PgnWriteOptions options) {
    return WRITER.write(games, options);
  }
}
