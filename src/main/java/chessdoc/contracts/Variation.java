package chessdoc.contracts;

import java.util.List;

/**
 * A straight sequence of nodes sharing one initial position: the main line of a game, or
 * an alternative line branching from a node.
 */
public interface Variation extends AnnotatedEntity {

  /** Identifier of the variation, e.g. {@code start} or {@code 5w-v0-start}. */
  String id();

  /**
   * Identifier the node {@code distance} half-moves after the start of the variation would
   * have ({@code distance == 0} designates the variation itself).
   */
  String followingId(int distance);

  /** @return the node the variation branches from, or {@code null} for the main variation */
  Node parentNode();

  /** @return the first node, or {@code null} if the variation is empty */
  Node first();

  List<Node> nodes();

  int plyCount();

  /** Own long flag AND the flags of all enclosing variations. */
  boolean isLongVariation();

  Position initialPosition();

  String initialFen();

  int initialFiftyMoveClock();

  int initialFullMoveNumber();

  Position finalPosition();

  String finalFen();

  /**
   * Plays a move at the start of the variation, discarding its current content.
   *
   * @throws chessdoc.exceptions.InvalidNotationException if the move is not legal (the tree is left untouched)
   */
  Node play(String notation);

  void clearMoves();
}
