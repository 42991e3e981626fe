package chessdoc.game;

import chessdoc.contracts.Node;
import chessdoc.contracts.Position;
import chessdoc.contracts.PositionEngine;
import chessdoc.contracts.Variation;

import java.util.ArrayList;
import java.util.List;

import static chessdoc.constants.PgnConstants.VARIATION_START;

/**
 * Handle over a {@link VariationData}. The initial position is resolved on first use.
 */
final class VariationImpl extends AnnotatedHandle implements Variation {

  private final VariationData data;
  private Position initialPosition;

  VariationImpl(VariationData data, Position initialPosition) {
    this.data = data;
    this.initialPosition = initialPosition;
  }

  @Override
  AnnotationData annotations() {
    return data.annotations;
  }

  @Override
  boolean inLongVariation() {
    return data.isEffectivelyLong();
  }

  private PositionEngine engine() {
    return data.root.engine;
  }

  @Override
  public String id() {
    return NodeIds.variationId(data);
  }

  @Override
  public String followingId(int distance) {
    if (distance < 0) {
      throw new IllegalArgumentException("Negative distance: " + distance);
    }
    String suffix = distance == 0
        ? VARIATION_START
        : NodeIds.followingSuffix(initialFullMoveNumber(), initialPosition().turn(), distance - 1);
    return NodeIds.variationPrefix(data) + suffix;
  }

  @Override
  public Node parentNode() {
    return data.isMain() ? null : new NodeImpl(data.parentNode, initialPosition);
  }

  @Override
  public Node first() {
    return data.child == null ? null : new NodeImpl(data.child, initialPosition);
  }

  @Override
  public List<Node> nodes() {
    List<Node> result = new ArrayList<>();
    Position position = data.child == null ? null : initialPosition();
    for (NodeData node = data.child; node != null; node = node.child) {
      result.add(new NodeImpl(node, position));
      if (node.child != null) position = PositionReplay.apply(engine(), position, node);
    }
    return result;
  }

  @Override
  public int plyCount() {
    int result = 0;
    for (NodeData node = data.child; node != null; node = node.child) {
      result++;
    }
    return result;
  }

  @Override
  public boolean isLongVariation() {
    return data.isEffectivelyLong();
  }

  /* ───────── Positions ───────── */

  @Override
  public Position initialPosition() {
    if (initialPosition == null) {
      initialPosition = PositionReplay.variationStart(data);
    }
    return initialPosition;
  }

  @Override
  public String initialFen() {
    return engine().toFen(initialPosition(), initialFiftyMoveClock(), initialFullMoveNumber());
  }

  @Override
  public int initialFiftyMoveClock() {
    return data.isMain() ? 0 : data.parentNode.fiftyMoveClock;
  }

  @Override
  public int initialFullMoveNumber() {
    return data.isMain() ? data.root.fullMoveNumber : data.parentNode.fullMoveNumber;
  }

  @Override
  public Position finalPosition() {
    return PositionReplay.replay(engine(), initialPosition(), data.child, null);
  }

  @Override
  public String finalFen() {
    if (data.child == null) {
      return initialFen();
    }
    NodeData last = data.child;
    while (last.child != null) last = last.child;
    return engine().toFen(finalPosition(), last.nextFiftyMoveClock(), last.nextFullMoveNumber());
  }

  /* ───────── Edition ───────── */

  @Override
  public Node play(String notation) {
    Position start = initialPosition();
    NodeData created = NodeImpl.createNode(data, start, initialFiftyMoveClock(), initialFullMoveNumber(), notation);
    data.child = created;
    return new NodeImpl(created, start);
  }

  @Override
  public void clearMoves() {
    data.child = null;
  }

  /* ───────── Object ───────── */

  @Override
  public boolean equals(Object o) {
    return o instanceof VariationImpl other && other.data == data;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(data);
  }

  @Override
  public String toString() {
    return id();
  }
}
