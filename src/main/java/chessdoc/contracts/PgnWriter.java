package chessdoc.contracts;

import chessdoc.game.Game;
import chessdoc.records.PgnWriteOptions;

import java.util.List;

public interface PgnWriter {

  String write(Game game, PgnWriteOptions options);

  /** Writes the games separated by an empty line. */
  String write(List<Game> games, PgnWriteOptions options);

  default String write(Game game) {
    return write(game, PgnWriteOptions.defaults());
  }

  default String write(List<Game> games) {
    return write(games, PgnWriteOptions.defaults());
  }
}
