package chessdoc.contracts;

import chessdoc.records.Color;

import java.util.List;

/**
 * A half-move in a game tree, together with the variations branching from the position
 * before it.
 *
 * Handles are lightweight views: two handles over the same node are {@link #equals equal}.
 */
public interface Node extends AnnotatedEntity {

  /**
   * Identifier of the node within its game, e.g. {@code 12b} or {@code 5w-v0-5b}. Derived
   * from the current tree shape: any structural edit may change it.
   */
  String id();

  /** Identifier the node {@code distance} half-moves further in the same variation would have. */
  String followingId(int distance);

  /** SAN of the move, {@code --} for a null-move. */
  String notation();

  /** @return the move, or {@code null} for a null-move */
  MoveDescriptor moveDescriptor();

  boolean isNullMove();

  /** Side playing the move. */
  Color moveColor();

  int fullMoveNumber();

  /** Fifty-move clock after the move. */
  int fiftyMoveClock();

  Position positionBefore();

  /** Position after the move. */
  Position position();

  /** FEN of the position after the move, with its counters. */
  String fen();

  Variation parentVariation();

  /** @return the previous node in the same variation, or {@code null} if this is the first one */
  Node previous();

  /** @return the next node in the same variation, or {@code null} if this is the last one */
  Node next();

  List<Variation> variations();

  /**
   * Plays a move after this one, discarding the current continuation.
   *
   * @throws chessdoc.exceptions.InvalidNotationException if the move is not legal (the tree is left untouched)
   */
  Node play(String notation);

  void removeFollowingMoves();

  /**
   * Makes the position before this node the initial position of the game. Earlier moves of
   * the main line and the annotations of the main variation are dropped.
   */
  void removePrecedingMoves();

  /** Same as {@code addVariation(false)}. */
  Variation addVariation();

  /** Appends an empty variation branching from the position before this node. */
  Variation addVariation(boolean isLong);

  void removeVariation(int variationIndex);

  void swapVariations(int variationIndex1, int variationIndex2);

  /**
   * Exchanges the non-empty variation at the given index with the line continuing from this
   * node. After the call this handle designates the first node of the promoted line.
   */
  void promoteVariation(int variationIndex);
}
