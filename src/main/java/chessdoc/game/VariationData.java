package chessdoc.game;

/**
 * Storage of one variation of the move tree. Handles ({@link VariationImpl}) point here.
 */
final class VariationData {

  final MoveTreeRoot root;
  NodeData parentNode; // null for the main variation
  NodeData child;
  final boolean isLong;

  final AnnotationData annotations = new AnnotationData();

  VariationData(MoveTreeRoot root, NodeData parentNode, boolean isLong) {
    this.root = root;
    this.parentNode = parentNode;
    this.isLong = isLong;
  }

  boolean isMain() {
    return parentNode == null;
  }

  /** Own flag AND the flags of all enclosing variations. */
  boolean isEffectivelyLong() {
    VariationData current = this;
    while (true) {
      if (!current.isLong) return false;
      if (current.isMain()) return true;
      current = current.parentNode.parentVariation;
    }
  }
}
