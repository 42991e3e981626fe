package chessdoc.impl;

import chessdoc.contracts.MoveDescriptor;
import chessdoc.contracts.Position;
import chessdoc.exceptions.InvalidFenException;
import chessdoc.exceptions.InvalidNotationException;
import chessdoc.records.Color;
import chessdoc.records.FenParseResult;
import chessdoc.records.GameVariant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static chessdoc.constants.PgnConstants.START_FEN;

public class ChesslibPositionEngineTest {

  private static final ChesslibPositionEngine ENGINE = new ChesslibPositionEngine();

  private static Position position(String fen) {
    return ENGINE.parseFen(GameVariant.REGULAR, fen, true).position();
  }

  private static Position play(Position position, String... notations) {
    for (String notation : notations) {
      position = ENGINE.play(position, ENGINE.parseNotation(position, notation));
    }
    return position;
  }

  /* ── FEN ───────────────────────────────────────────────────────── */

  @Test
  void startPosition() {
    Position start = ENGINE.startPosition(GameVariant.REGULAR);
    Assertions.assertEquals(START_FEN, ENGINE.toFen(start, 0, 1));
    Assertions.assertEquals(Color.WHITE, start.turn());
    Assertions.assertEquals(start, position(START_FEN));
  }

  @Test
  void onlyRegularChessIsSupported() {
    Assertions.assertTrue(ENGINE.supportsVariant(GameVariant.REGULAR));
    Assertions.assertFalse(ENGINE.supportsVariant(GameVariant.CHESS960));
    Assertions.assertThrows(IllegalArgumentException.class, () -> ENGINE.startPosition(GameVariant.HORDE));
  }

  @Test
  void counters() {
    FenParseResult result = ENGINE.parseFen(GameVariant.REGULAR, "4k3/8/8/8/8/8/8/4K3 b - - 17 42", true);
    Assertions.assertEquals(17, result.fiftyMoveClock());
    Assertions.assertEquals(42, result.fullMoveNumber());
    Assertions.assertEquals(Color.BLACK, result.position().turn());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq -",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP w KQkq - 0 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNX w KQkq - 0 1",
      "rnbqkbnr/pppppppp/9/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR x KQkq - 0 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkqX - 0 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq e9 0 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - x 1",
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 0",
      "4k3/8/8/8/8/8/8/8 w - - 0 1",
      "4k3/8/8/8/8/8/8/3KK3 w - - 0 1",
      "4k2P/8/8/8/8/8/8/4K3 w - - 0 1",
      "7k/8/8/8/8/8/8/4K2R w - - 0 1"
  })
  void invalidFen(String fen) {
    Assertions.assertThrows(InvalidFenException.class, () -> ENGINE.parseFen(GameVariant.REGULAR, fen, true));
  }

  @Test
  void sideNotToMoveInCheck() {
    InvalidFenException e = Assertions.assertThrows(InvalidFenException.class,
        () -> ENGINE.parseFen(GameVariant.REGULAR, "7k/8/8/8/8/8/8/4K2R w - - 0 1", true));
    Assertions.assertFalse(e.getMessage().isEmpty());
    Assertions.assertEquals("7k/8/8/8/8/8/8/4K2R w - - 0 1", e.fen());
    // the side to move may be in check
    Assertions.assertDoesNotThrow(() -> ENGINE.parseFen(GameVariant.REGULAR, "7k/8/8/8/8/8/8/4K2R b - - 0 1", true));
  }

  @Test
  void inconsistentCastlingRights() {
    String fen = "4k3/8/8/8/8/8/8/4K3 w KQkq - 0 1";
    Assertions.assertThrows(InvalidFenException.class, () -> ENGINE.parseFen(GameVariant.REGULAR, fen, true));
    Position lenient = ENGINE.parseFen(GameVariant.REGULAR, fen, false).position();
    Assertions.assertEquals("4k3/8/8/8/8/8/8/4K3 w - - 0 1", ENGINE.toFen(lenient, 0, 1));
  }

  @Test
  void lenientFenWithoutCounters() {
    FenParseResult result = ENGINE.parseFen(GameVariant.REGULAR, "4k3/8/8/8/8/8/8/4K3 w - -", false);
    Assertions.assertEquals(0, result.fiftyMoveClock());
    Assertions.assertEquals(1, result.fullMoveNumber());
  }

  /* ── SAN ───────────────────────────────────────────────────────── */

  @Test
  void moveDescriptor() {
    Position start = ENGINE.startPosition(GameVariant.REGULAR);
    MoveDescriptor move = ENGINE.parseNotation(start, "Nf3");
    Assertions.assertEquals("g1", move.from());
    Assertions.assertEquals("f3", move.to());
    Assertions.assertEquals('N', move.movingPiece());
    Assertions.assertEquals(Color.WHITE, move.color());
    Assertions.assertFalse(move.isCapture());
    Assertions.assertNull(move.rookFrom());
    Assertions.assertEquals("Nf3", ENGINE.notation(start, move));
  }

  @Test
  void castling() {
    Position position = position("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
    MoveDescriptor kingSide = ENGINE.parseNotation(position, "0-0");
    Assertions.assertTrue(kingSide.isCastling());
    Assertions.assertEquals("h1", kingSide.rookFrom());
    Assertions.assertEquals("f1", kingSide.rookTo());
    Assertions.assertEquals("O-O", ENGINE.notation(position, kingSide));

    Position after = ENGINE.play(position, kingSide);
    Assertions.assertEquals("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1", ENGINE.toFen(after, 1, 1));

    MoveDescriptor queenSide = ENGINE.parseNotation(after, "O-O-O");
    Assertions.assertEquals("a8", queenSide.rookFrom());
    Assertions.assertEquals("d8", queenSide.rookTo());
  }

  @Test
  void rookMoveDropsCastlingRight() {
    Position after = play(position("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1"), "Rb1", "Rxh1");
    Assertions.assertEquals("r3k3/8/8/8/8/8/8/1R2K2r w q - 0 1", ENGINE.toFen(after, 0, 1));
  }

  @Test
  void enPassant() {
    Position position = play(ENGINE.startPosition(GameVariant.REGULAR), "e4", "a6", "e5", "d5");
    Assertions.assertEquals("rnbqkbnr/1pp1pppp/p7/3pP3/8/8/PPPP1PPP/RNBQKBNR w KQkq d6", position.fen());

    MoveDescriptor capture = ENGINE.parseNotation(position, "exd6");
    Assertions.assertTrue(capture.isEnPassant());
    Assertions.assertEquals(Character.valueOf('P'), capture.capturedPiece());
    Assertions.assertEquals("rnbqkbnr/1pp1pppp/p2P4/8/8/8/PPPP1PPP/RNBQKBNR b KQkq -", ENGINE.play(position, capture).fen());
  }

  @Test
  void doubleStepWithoutCapturerLeavesNoEnPassantSquare() {
    Position position = play(ENGINE.startPosition(GameVariant.REGULAR), "e4");
    Assertions.assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq -", position.fen());
  }

  @Test
  void promotion() {
    Position position = position("8/4P1k1/8/8/8/8/8/4K3 w - - 0 1");
    Assertions.assertThrows(InvalidNotationException.class, () -> ENGINE.parseNotation(position, "e8"));
    Assertions.assertThrows(InvalidNotationException.class, () -> ENGINE.parseNotation(position, "e8=K"));

    MoveDescriptor queen = ENGINE.parseNotation(position, "e8Q");
    Assertions.assertEquals(Character.valueOf('Q'), queen.promotion());
    Assertions.assertEquals("e8=Q", ENGINE.notation(position, queen));
    Assertions.assertEquals("e8=N+", ENGINE.notation(position, ENGINE.parseNotation(position, "e8=N")));
  }

  @Test
  void disambiguation() {
    Position position = position("4k3/8/8/8/8/8/4K3/R6R w - - 0 1");
    Assertions.assertThrows(InvalidNotationException.class, () -> ENGINE.parseNotation(position, "Rf1"));
    Assertions.assertEquals("Rhf1", ENGINE.notation(position, ENGINE.parseNotation(position, "Rhf1")));

    Position sameFile = position("4k3/8/8/8/R7/8/8/R3K3 w - - 0 1");
    Assertions.assertEquals("R1a2", ENGINE.notation(sameFile, ENGINE.parseNotation(sameFile, "R1a2")));
  }

  @Test
  void checkmate() {
    Position position = play(ENGINE.startPosition(GameVariant.REGULAR), "f3", "e5", "g4");
    Assertions.assertEquals("Qh4#", ENGINE.notation(position, ENGINE.parseNotation(position, "Qh4")));
  }

  @ParameterizedTest
  @ValueSource(strings = {"e5", "Nxf3", "exd3", "Ke2", "O-O", "Qd8", "xyz", "Bb5"})
  void illegalMoves(String notation) {
    Position start = ENGINE.startPosition(GameVariant.REGULAR);
    InvalidNotationException e = Assertions.assertThrows(InvalidNotationException.class, () -> ENGINE.parseNotation(start, notation));
    Assertions.assertEquals(notation, e.notation());
    Assertions.assertEquals(start.fen(), e.fen());
  }

  @Test
  void captureSymbolOnQuietMoveIsRejected() {
    Position position = play(ENGINE.startPosition(GameVariant.REGULAR), "e4", "d5");
    Assertions.assertThrows(InvalidNotationException.class, () -> ENGINE.parseNotation(position, "Nxf3"));
    // a missing capture symbol is tolerated
    Assertions.assertEquals("exd5", ENGINE.notation(position, ENGINE.parseNotation(position, "ed5")));
  }

  @Test
  void nullMove() {
    Position start = ENGINE.startPosition(GameVariant.REGULAR);
    Assertions.assertTrue(ENGINE.isNullMoveLegal(start));
    Assertions.assertEquals(Color.BLACK, ENGINE.playNullMove(start).turn());

    Position inCheck = play(start, "e4", "f5", "Qh5+");
    Assertions.assertFalse(ENGINE.isNullMoveLegal(inCheck));
  }

  @Test
  void positionsAreNotMutated() {
    Position start = ENGINE.startPosition(GameVariant.REGULAR);
    play(start, "e4", "e5");
    Assertions.assertEquals(START_FEN, ENGINE.toFen(start, 0, 1));
  }
}
