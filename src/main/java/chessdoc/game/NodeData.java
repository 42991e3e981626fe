package chessdoc.game;

import chessdoc.contracts.MoveDescriptor;
import chessdoc.records.Color;

import java.util.ArrayList;
import java.util.List;

/**
 * Storage of one node of the move tree. Handles ({@link NodeImpl}) point here.
 */
final class NodeData {

  // links
  VariationData parentVariation;
  NodeData child;
  List<VariationData> variations = new ArrayList<>();

  // move
  final Color moveColor;
  int fiftyMoveClock; // before the move
  final int fullMoveNumber;
  final MoveDescriptor move; // null for a null-move
  final String notation;

  final AnnotationData annotations = new AnnotationData();

  NodeData(VariationData parentVariation, Color moveColor, int fiftyMoveClock, int fullMoveNumber,
           MoveDescriptor move, String notation) {
    this.parentVariation = parentVariation;
    this.moveColor = moveColor;
    this.fiftyMoveClock = fiftyMoveClock;
    this.fullMoveNumber = fullMoveNumber;
    this.move = move;
    this.notation = notation;
  }

  int nextFiftyMoveClock() {
    if (move == null) return fiftyMoveClock;
    if (move.isCapture() || move.movingPiece() == 'P') return 0;
    return fiftyMoveClock + 1;
  }

  int nextFullMoveNumber() {
    return moveColor == Color.WHITE ? fullMoveNumber : fullMoveNumber + 1;
  }
}
