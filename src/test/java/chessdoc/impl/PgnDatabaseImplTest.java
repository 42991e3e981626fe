package chessdoc.impl;

import chessdoc.contracts.Database;
import chessdoc.exceptions.InvalidPgnException;
import chessdoc.game.Game;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class PgnDatabaseImplTest {

  private CountingPositionEngine engine;
  private Database database;

  @BeforeEach
  void setUp() {
    engine = new CountingPositionEngine();
    database = new PgnReaderImpl(engine).readDatabase(PgnFixtures.load("database.pgn"));
  }

  @Test
  void indexingDecodesNothing() {
    Assertions.assertEquals(3, database.gameCount());
    Assertions.assertEquals(0, engine.parsedMoves());
  }

  @Test
  void gameDecodesOnlyThatGame() {
    Game third = database.game(2);
    Assertions.assertEquals("Third", third.event());
    Assertions.assertEquals("A comment with a brace } inside", third.mainVariation().first().comment());
    Assertions.assertEquals(2, engine.parsedMoves());
  }

  @Test
  void invalidGameReportsAbsoluteLocation() {
    InvalidPgnException e = Assertions.assertThrows(InvalidPgnException.class, () -> database.game(1));
    Assertions.assertEquals(InvalidPgnException.Reason.INVALID_MOVE, e.reason());
    Assertions.assertEquals(11, e.lineNumber());
  }

  @Test
  void iterationSkipsInvalidGames() {
    List<String> events = new ArrayList<>();
    for (Game game : database) {
      events.add(game.event());
    }
    Assertions.assertEquals(List.of("First", "Third"), events);

    Game first = database.games().iterator().next();
    Assertions.assertEquals(7, first.plyCount());
    Assertions.assertEquals("Qxf7#", first.nodes(false).get(6).notation());
  }

  @Test
  void indexOutOfRange() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> database.game(-1));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> database.game(3));
  }

  @Test
  void emptyText() {
    Database empty = new PgnReaderImpl().readDatabase("  \n\n");
    Assertions.assertEquals(0, empty.gameCount());
    Assertions.assertFalse(empty.iterator().hasNext());
  }
}
