package chessdoc.impl;

import chessdoc.contracts.AnnotatedEntity;
import chessdoc.contracts.Node;
import chessdoc.contracts.Variation;
import chessdoc.game.Game;
import chessdoc.records.Color;
import chessdoc.records.DateValue;
import chessdoc.records.GameResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

/**
 * Reading then writing a game in the writer's own layout gives back the same text.
 */
public class PgnRoundTripTest {

  private static final PgnReaderImpl READER = new PgnReaderImpl();
  private static final PgnWriterImpl WRITER = new PgnWriterImpl();

  @ParameterizedTest(name = "{0}")
  @ValueSource(strings = {"italian.pgn", "annotated.pgn", "study.pgn"})
  void canonicalFixture(String name) {
    String pgn = PgnFixtures.load(name);
    Assertions.assertEquals(pgn, WRITER.write(READER.readGame(pgn)));
  }

  @Test
  void studyKeepsLongLayout() {
    Game game = READER.readGame(PgnFixtures.load("study.pgn"));
    Assertions.assertTrue(game.mainVariation().first().isLongComment());
    Assertions.assertTrue(game.mainVariation().first().next().variations().get(0).isLongVariation());
  }

  @Test
  void looseLayoutIsNormalized() {
    String loose = "[White \"A\"]\r\n[Black \"B\"]\r\n\r\n1.e4   e5 2.Nf3\r\n  Nc6 {a   comment} ( 2...d6 ) 3.Bb5 ! *\r\n";
    String written = WRITER.write(READER.readGame(loose));
    Assertions.assertTrue(written.endsWith("\n1. e4 e5 2. Nf3 Nc6 {a comment} (2... d6) 3. Bb5 $1 *\n"), written);
    Assertions.assertEquals(written, WRITER.write(READER.readGame(written)));
  }

  @Test
  void databaseOfWrittenGames() {
    String pgn = PgnFixtures.load("italian.pgn") + "\n" + PgnFixtures.load("study.pgn");
    Game first = READER.readGame(pgn, 0);
    Game second = READER.readGame(pgn, 1);
    Assertions.assertEquals(pgn, WRITER.write(List.of(first, second)));
  }

  @Test
  void gameBuiltInCode() {
    Game game = new Game();
    game.setEvent("Club \"open\"");
    game.setSite("Paris");
    game.setDate(DateValue.of(2024, 5));
    game.setRound(3);
    game.setSubRound(2);
    game.setPlayerName(Color.WHITE, "Alice");
    game.setPlayerName(Color.BLACK, "Bob");
    game.setPlayerElo(Color.WHITE, 2200);
    game.setEco("C20");
    game.setResult(GameResult.DRAW);

    game.mainVariation().setComment("Intro");
    Node e4 = game.mainVariation().play("e4");
    e4.addNag(1);
    e4.setTag("clk", "1:00:00");
    e4.setComment("Best by test");
    Node e5 = e4.play("e5");
    e5.setComment("Long thought", true);

    Variation queenPawn = e4.addVariation(true);
    queenPawn.setComment("Queen's pawn");
    Node d4 = queenPawn.play("d4");
    d4.play("d5").addNag(2);
    d4.addVariation(false).play("c4").setTag("eval", "0.1");

    Node c5 = e5.addVariation().play("c5");
    c5.setComment("Sicilian } brace");
    c5.setTag("eval", "0.3");
    Node nc6 = e5.play("Nf3").play("Nc6");
    nc6.addNag(14);
    nc6.addNag(3);

    Game reread = READER.readGame(WRITER.write(game));
    Assertions.assertEquals(describe(game.mainVariation()), describe(reread.mainVariation()));
    Assertions.assertEquals("Club \"open\"", reread.event());
    Assertions.assertEquals("Paris", reread.site());
    Assertions.assertEquals(DateValue.of(2024, 5), reread.date());
    Assertions.assertEquals("3.2", reread.fullRound());
    Assertions.assertEquals("Alice", reread.playerName(Color.WHITE));
    Assertions.assertEquals("Bob", reread.playerName(Color.BLACK));
    Assertions.assertEquals(2200, reread.playerElo(Color.WHITE));
    Assertions.assertNull(reread.playerElo(Color.BLACK));
    Assertions.assertEquals("C20", reread.eco());
    Assertions.assertEquals(GameResult.DRAW, reread.result());
    Assertions.assertTrue(reread.mainVariation().first().next().isLongComment());
    Assertions.assertTrue(reread.mainVariation().first().variations().get(0).isLongVariation());
  }

  /** Shape, moves and annotations of a variation and everything below it. */
  private static String describe(Variation variation) {
    StringBuilder sb = new StringBuilder();
    describe(sb, variation);
    return sb.toString();
  }

  private static void describe(StringBuilder sb, Variation variation) {
    sb.append(variation.id()).append(variation.isLongVariation() ? " long" : "").append(" (");
    annotations(sb, variation);
    for (Node node : variation.nodes()) {
      sb.append(' ').append(node.id()).append(':').append(node.notation());
      annotations(sb, node);
      for (Variation sub : node.variations()) {
        describe(sb, sub);
      }
    }
    sb.append(')');
  }

  private static void annotations(StringBuilder sb, AnnotatedEntity entity) {
    sb.append(entity.nags());
    for (String key : entity.tags()) {
      sb.append('[').append(key).append('=').append(entity.tag(key)).append(']');
    }
    if (entity.comment() != null) {
      sb.append('{').append(entity.comment()).append(entity.isLongComment() ? " long" : "").append('}');
    }
  }
}
