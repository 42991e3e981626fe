package chessdoc.game;

import chessdoc.contracts.PositionEngine;
import chessdoc.contracts.Position;

/**
 * Root of a move tree: initial position, initial move number and main variation.
 */
final class MoveTreeRoot {

  final PositionEngine engine;
  Position position;
  int fullMoveNumber;
  VariationData mainVariation;

  MoveTreeRoot(PositionEngine engine, Position position, int fullMoveNumber) {
    this.engine = engine;
    this.position = position;
    this.fullMoveNumber = fullMoveNumber;
    this.mainVariation = new VariationData(this, null, true);
  }

  void reset(Position position, int fullMoveNumber) {
    this.position = position;
    this.fullMoveNumber = fullMoveNumber;
    this.mainVariation = new VariationData(this, null, true);
  }
}
