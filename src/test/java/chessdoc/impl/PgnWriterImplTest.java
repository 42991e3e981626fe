package chessdoc.impl;

import chessdoc.contracts.Node;
import chessdoc.contracts.Variation;
import chessdoc.game.Game;
import chessdoc.records.Color;
import chessdoc.records.DateValue;
import chessdoc.records.GameResult;
import chessdoc.records.GameVariant;
import chessdoc.records.PgnWriteOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class PgnWriterImplTest {

  private static final PgnWriterImpl WRITER = new PgnWriterImpl();

  private static final String DEFAULT_HEADERS = String.join("\n",
      "[Event \"?\"]",
      "[Site \"?\"]",
      "[Date \"????.??.??\"]",
      "[Round \"?\"]",
      "[White \"?\"]",
      "[Black \"?\"]",
      "[Result \"*\"]",
      "",
      "");

  /** Move text of the written game, without the header section. */
  private static String moveText(Game game) {
    return moveText(game, PgnWriteOptions.defaults());
  }

  private static String moveText(Game game, PgnWriteOptions options) {
    String pgn = WRITER.write(game, options);
    return pgn.substring(pgn.indexOf("\n\n") + 2);
  }

  private static Node playAll(Variation variation, String... notations) {
    Node node = variation.play(notations[0]);
    for (int i = 1; i < notations.length; i++) {
      node = node.play(notations[i]);
    }
    return node;
  }

  /* ── headers ───────────────────────────────────────────────────── */

  @Test
  void emptyGame() {
    Assertions.assertEquals(DEFAULT_HEADERS + "*\n", WRITER.write(new Game()));
  }

  @Test
  void allHeaders() {
    Game game = new Game();
    game.setEvent("World  Championship ");
    game.setSite("London");
    game.setDate(DateValue.of(2000, 10));
    game.setRound(3);
    game.setSubRound(2);
    game.setPlayerName(Color.WHITE, "Kramnik, V.");
    game.setPlayerName(Color.BLACK, "Kasparov, G.");
    game.setPlayerElo(Color.WHITE, 2770);
    game.setPlayerElo(Color.BLACK, 2849);
    game.setPlayerTitle(Color.WHITE, "GM");
    game.setPlayerTitle(Color.BLACK, "GM");
    game.setAnnotator("  ");
    game.setEco("C67");
    game.setOpening("Ruy Lopez");
    game.setOpeningVariation("Berlin defence");
    game.setOpeningSubVariation("Rio de Janeiro");
    game.setTermination("normal");
    game.setResult(GameResult.DRAW);

    String expected = String.join("\n",
        "[Event \"World Championship\"]",
        "[Site \"London\"]",
        "[Date \"2000.10.??\"]",
        "[Round \"3.2\"]",
        "[White \"Kramnik, V.\"]",
        "[Black \"Kasparov, G.\"]",
        "[Result \"1/2-1/2\"]",
        "[BlackElo \"2849\"]",
        "[BlackTitle \"GM\"]",
        "[ECO \"C67\"]",
        "[Opening \"Ruy Lopez\"]",
        "[SubVariation \"Rio de Janeiro\"]",
        "[Termination \"normal\"]",
        "[Variation \"Berlin defence\"]",
        "[WhiteElo \"2770\"]",
        "[WhiteTitle \"GM\"]",
        "",
        "1/2-1/2",
        "");
    Assertions.assertEquals(expected, WRITER.write(game));
  }

  @Test
  void headerEscaping() {
    Game game = new Game();
    game.setPlayerName(Color.WHITE, "Bob \"The Rook\" \\ Smith");
    Assertions.assertTrue(WRITER.write(game).contains("[White \"Bob \\\"The Rook\\\" \\\\ Smith\"]\n"));
  }

  @Test
  void fenAndPlyCount() {
    Game game = new Game();
    game.setInitialPosition(game.engine().parseFen(GameVariant.REGULAR, "4k3/8/8/8/8/8/4P3/4K3 b - - 0 7", true).position(), 7);
    playAll(game.mainVariation(), "Kd7", "e4");

    String pgn = WRITER.write(game, new PgnWriteOptions.Builder().withPlyCount(true).build());
    Assertions.assertTrue(pgn.contains("[Result \"*\"]\n[FEN \"4k3/8/8/8/8/8/4P3/4K3 b - - 0 7\"]\n[PlyCount \"2\"]\n[SetUp \"1\"]\n\n"), pgn);
    Assertions.assertTrue(pgn.endsWith("\n7... Kd7 8. e4 *\n"), pgn);
  }

  @Test
  void noFenForStartPosition() {
    Game game = new Game();
    playAll(game.mainVariation(), "e4");
    Assertions.assertFalse(WRITER.write(game).contains("FEN"));
    Assertions.assertFalse(WRITER.write(game).contains("PlyCount"));
  }

  /* ── move text ─────────────────────────────────────────────────── */

  @Test
  void mainLine() {
    Game game = new Game();
    playAll(game.mainVariation(), "e4", "e5", "Nf3");
    game.setResult(GameResult.WHITE_WINS);
    Assertions.assertEquals("1. e4 e5 2. Nf3 1-0\n", moveText(game));
  }

  @Test
  void variationsForceMoveNumbers() {
    Game game = new Game();
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.play("e5");
    playAll(e4.addVariation(), "d4", "d5");
    Assertions.assertEquals("1. e4 (1. d4 d5) 1... e5 *\n", moveText(game));
  }

  @Test
  void emptyVariationsAreSkipped() {
    Game game = new Game();
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.play("e5");
    e4.addVariation();
    Assertions.assertEquals("1. e4 e5 *\n", moveText(game));
  }

  @Test
  void nestedVariations() {
    Game game = new Game();
    Node e5 = playAll(game.mainVariation(), "e4", "e5");
    e5.play("Nf3");
    Node nf3 = playAll(e5.addVariation(), "c5", "Nf3");
    nf3.play("d6");
    playAll(nf3.addVariation(), "c3", "d5");
    Assertions.assertEquals("1. e4 e5 (1... c5 2. Nf3 (2. c3 d5) 2... d6) 2. Nf3 *\n", moveText(game));
  }

  @Test
  void annotations() {
    Game game = new Game();
    game.mainVariation().setComment("Intro");
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.addNag(1);
    e4.play("e5").addNag(2);
    Assertions.assertEquals("{Intro} 1. e4 $1 e5 $2 *\n", moveText(game));

    e4.setComment("Best  by\ttest");
    e4.setTag("clk", "0:10:00");
    Assertions.assertEquals("{Intro} 1. e4 $1 {[%clk 0:10:00] Best by test} 1... e5 $2 *\n", moveText(game));
  }

  @Test
  void commentEscaping() {
    Game game = new Game();
    playAll(game.mainVariation(), "e4").setComment("a}b\\c");
    game.mainVariation().first().setTag("note", "x [y] z");
    Assertions.assertEquals("1. e4 {[%note x y z] a\\}b\\\\c} *\n", moveText(game));
  }

  @Test
  void wrapsAtLineWidth() {
    Game game = new Game();
    playAll(game.mainVariation(), "e4", "e5", "Nf3", "Nc6");
    PgnWriteOptions narrow = new PgnWriteOptions.Builder().lineWidth(10).build();
    Assertions.assertEquals("1. e4 e5\n2. Nf3 Nc6\n*\n", moveText(game, narrow));
  }

  @Test
  void defaultWidthIsEightyColumns() {
    Game game = new Game();
    Node node = playAll(game.mainVariation(), "Nf3", "Nf6", "Ng1", "Ng8");
    for (int i = 0; i < 20; i++) {
      node = node.play("Nf3").play("Nf6").play("Ng1").play("Ng8");
    }
    for (String line : moveText(game).split("\n")) {
      Assertions.assertTrue(line.length() <= 80, line);
    }
  }

  @Test
  void longComment() {
    Game game = new Game();
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.play("e5");
    e4.setComment("Long one", true);
    Assertions.assertEquals("1. e4\n\n{Long one}\n\n1... e5 *\n", moveText(game));
  }

  @Test
  void longVariation() {
    Game game = new Game();
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.play("e5");
    playAll(e4.addVariation(true), "d4");
    Assertions.assertEquals("1. e4\n\n(1. d4)\n\n1... e5 *\n", moveText(game));
  }

  @Test
  void longFlagsIgnoredInShortVariation() {
    Game game = new Game();
    Node e4 = playAll(game.mainVariation(), "e4");
    e4.play("e5");
    Node d4 = playAll(e4.addVariation(false), "d4");
    d4.setComment("Inside", true);
    playAll(d4.addVariation(true), "c4");
    Assertions.assertFalse(d4.isLongComment());
    Assertions.assertFalse(e4.variations().get(0).isLongVariation());
    Assertions.assertFalse(d4.variations().get(0).isLongVariation());
    Assertions.assertTrue(game.mainVariation().isLongVariation());
    Assertions.assertEquals("1. e4 (1. d4 {Inside} (1. c4)) 1... e5 *\n", moveText(game));
  }

  @Test
  void severalGames() {
    Game first = new Game();
    playAll(first.mainVariation(), "e4");
    Game second = new Game();
    playAll(second.mainVariation(), "d4");

    String pgn = WRITER.write(List.of(first, second));
    Assertions.assertEquals(WRITER.write(first) + "\n" + WRITER.write(second), pgn);
    Assertions.assertTrue(pgn.contains("1. e4 *\n\n[Event"));
  }
}
