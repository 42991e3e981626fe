package chessdoc.game;

import chessdoc.contracts.Position;
import chessdoc.contracts.PositionEngine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Recomputes positions from the initial position of a game by replaying moves. Nothing
 * computed here is stored in the tree.
 */
final class PositionReplay {

  private PositionReplay() {}

  static Position apply(PositionEngine engine, Position position, NodeData node) {
    return node.move == null ? engine.playNullMove(position) : engine.play(position, node.move);
  }

  /** Applies the nodes starting at {@code from}, up to but excluding {@code until} ({@code null}: to the end). */
  static Position replay(PositionEngine engine, Position position, NodeData from, NodeData until) {
    for (NodeData node = from; node != null && node != until; node = node.child) {
      position = apply(engine, position, node);
    }
    return position;
  }

  /** Position at the start of the given variation. */
  static Position variationStart(VariationData variation) {
    Deque<NodeData> branches = new ArrayDeque<>();
    for (VariationData v = variation; !v.isMain(); v = v.parentNode.parentVariation) {
      branches.push(v.parentNode);
    }
    MoveTreeRoot root = variation.root;
    Position position = root.position;
    while (!branches.isEmpty()) {
      NodeData branch = branches.pop();
      position = replay(root.engine, position, branch.parentVariation.child, branch);
    }
    return position;
  }

  static Position before(NodeData node) {
    VariationData parent = node.parentVariation;
    return replay(parent.root.engine, variationStart(parent), parent.child, node);
  }
}
