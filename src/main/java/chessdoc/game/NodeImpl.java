package chessdoc.game;

import chessdoc.contracts.MoveDescriptor;
import chessdoc.contracts.Node;
import chessdoc.contracts.Position;
import chessdoc.contracts.PositionEngine;
import chessdoc.contracts.Variation;
import chessdoc.exceptions.InvalidNotationException;
import chessdoc.records.Color;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Handle over a {@link NodeData}. The position before the move is resolved on first use
 * and kept for the lifetime of the handle only.
 */
final class NodeImpl extends AnnotatedHandle implements Node {

  static final String NULL_MOVE = "--";

  private NodeData data;
  private Position positionBefore;

  NodeImpl(NodeData data, Position positionBefore) {
    this.data = data;
    this.positionBefore = positionBefore;
  }

  @Override
  AnnotationData annotations() {
    return data.annotations;
  }

  @Override
  boolean inLongVariation() {
    return data.parentVariation.isEffectivelyLong();
  }

  private PositionEngine engine() {
    return data.parentVariation.root.engine;
  }

  /* ───────── Identity ───────── */

  @Override
  public String id() {
    return NodeIds.nodeId(data);
  }

  @Override
  public String followingId(int distance) {
    if (distance < 0) {
      throw new IllegalArgumentException("Negative distance: " + distance);
    }
    return NodeIds.variationPrefix(data.parentVariation) + NodeIds.followingSuffix(data.fullMoveNumber, data.moveColor, distance);
  }

  /* ───────── Move ───────── */

  @Override public String notation()               { return data.notation; }
  @Override public MoveDescriptor moveDescriptor() { return data.move; }
  @Override public boolean isNullMove()            { return data.move == null; }
  @Override public Color moveColor()               { return data.moveColor; }
  @Override public int fullMoveNumber()            { return data.fullMoveNumber; }
  @Override public int fiftyMoveClock()            { return data.nextFiftyMoveClock(); }

  @Override
  public Position positionBefore() {
    if (positionBefore == null) {
      positionBefore = PositionReplay.before(data);
    }
    return positionBefore;
  }

  @Override
  public Position position() {
    return PositionReplay.apply(engine(), positionBefore(), data);
  }

  @Override
  public String fen() {
    return engine().toFen(position(), data.nextFiftyMoveClock(), data.nextFullMoveNumber());
  }

  /* ───────── Navigation ───────── */

  @Override
  public Variation parentVariation() {
    return new VariationImpl(data.parentVariation, null);
  }

  @Override
  public Node previous() {
    NodeData current = data.parentVariation.child;
    if (current == data) return null;
    while (current.child != data) {
      current = current.child;
    }
    return new NodeImpl(current, null);
  }

  @Override
  public Node next() {
    if (data.child == null) return null;
    return new NodeImpl(data.child, positionBefore == null ? null : position());
  }

  @Override
  public List<Variation> variations() {
    List<Variation> result = new ArrayList<>(data.variations.size());
    for (VariationData variation : data.variations) {
      result.add(new VariationImpl(variation, positionBefore));
    }
    return result;
  }

  /* ───────── Edition ───────── */

  @Override
  public Node play(String notation) {
    Position next = position();
    NodeData created = createNode(data.parentVariation, next, data.nextFiftyMoveClock(), data.nextFullMoveNumber(), notation);
    data.child = created;
    return new NodeImpl(created, next);
  }

  @Override
  public void removeFollowingMoves() {
    data.child = null;
  }

  @Override
  public void removePrecedingMoves() {
    Position start = positionBefore();
    MoveTreeRoot root = data.parentVariation.root;
    root.reset(start, data.fullMoveNumber);
    root.mainVariation.child = data;
    reparent(data, root.mainVariation);
    resetFiftyMoveClocks(data);
  }

  @Override
  public Variation addVariation() {
    return addVariation(false);
  }

  @Override
  public Variation addVariation(boolean isLong) {
    VariationData variation = new VariationData(data.parentVariation.root, data, isLong);
    data.variations.add(variation);
    return new VariationImpl(variation, positionBefore);
  }

  @Override
  public void removeVariation(int variationIndex) {
    checkVariationIndex(variationIndex);
    data.variations.remove(variationIndex);
  }

  @Override
  public void swapVariations(int variationIndex1, int variationIndex2) {
    checkVariationIndex(variationIndex1);
    checkVariationIndex(variationIndex2);
    Collections.swap(data.variations, variationIndex1, variationIndex2);
  }

  @Override
  public void promoteVariation(int variationIndex) {
    checkVariationIndex(variationIndex);
    VariationData promoted = data.variations.get(variationIndex);
    if (promoted.child == null) {
      throw new IllegalArgumentException("Cannot promote empty variation " + variationIndex);
    }
    NodeData oldMainLine = data;
    NodeData newMainLine = promoted.child;
    VariationData line = oldMainLine.parentVariation;

    // the old continuation moves to a fresh variation in the promoted slot
    List<VariationData> variations = oldMainLine.variations;
    oldMainLine.variations = new ArrayList<>();
    VariationData demoted = new VariationData(line.root, newMainLine, false);
    demoted.child = oldMainLine;
    variations.set(variationIndex, demoted);
    variations.addAll(newMainLine.variations);
    newMainLine.variations = variations;

    if (line.child == oldMainLine) {
      line.child = newMainLine;
    } else {
      NodeData previous = line.child;
      while (previous.child != oldMainLine) previous = previous.child;
      previous.child = newMainLine;
    }
    reparent(newMainLine, line);
    reparent(oldMainLine, demoted);
    for (VariationData variation : newMainLine.variations) {
      variation.parentNode = newMainLine;
    }
    data = newMainLine;
  }

  private void checkVariationIndex(int variationIndex) {
    if (variationIndex < 0 || variationIndex >= data.variations.size()) {
      throw new IllegalArgumentException("Invalid variation index: " + variationIndex);
    }
  }

  /* ───────── Helpers ───────── */

  /**
   * Validates a move against the given position and builds the corresponding node.
   *
   * @throws InvalidNotationException if the move is not legal
   */
  static NodeData createNode(VariationData parent, Position before, int fiftyMoveClock, int fullMoveNumber, String notation) {
    PositionEngine engine = parent.root.engine;
    if (NULL_MOVE.equals(notation)) {
      if (!engine.isNullMoveLegal(before)) {
        throw new InvalidNotationException(engine.toFen(before, fiftyMoveClock, fullMoveNumber), notation,
            "Cannot play a null-move in this position.");
      }
      return new NodeData(parent, before.turn(), fiftyMoveClock, fullMoveNumber, null, NULL_MOVE);
    }
    MoveDescriptor move = engine.parseNotation(before, notation);
    return new NodeData(parent, before.turn(), fiftyMoveClock, fullMoveNumber, move, engine.notation(before, move));
  }

  private static void reparent(NodeData first, VariationData parent) {
    for (NodeData node = first; node != null; node = node.child) {
      node.parentVariation = parent;
    }
  }

  private record PendingLine(NodeData first, int fiftyMoveClock) {}

  private static void resetFiftyMoveClocks(NodeData first) {
    Deque<PendingLine> pending = new ArrayDeque<>();
    pending.push(new PendingLine(first, 0));
    while (!pending.isEmpty()) {
      PendingLine line = pending.pop();
      int clock = line.fiftyMoveClock();
      for (NodeData node = line.first(); node != null; node = node.child) {
        node.fiftyMoveClock = clock;
        for (VariationData variation : node.variations) {
          if (variation.child != null) pending.push(new PendingLine(variation.child, clock));
        }
        clock = node.nextFiftyMoveClock();
      }
    }
  }

  /* ───────── Object ───────── */

  @Override
  public boolean equals(Object o) {
    return o instanceof NodeImpl other && other.data == data;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(data);
  }

  @Override
  public String toString() {
    return id() + " " + data.notation;
  }
}
