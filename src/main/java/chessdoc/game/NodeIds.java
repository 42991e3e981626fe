package chessdoc.game;

import chessdoc.contracts.AnnotatedEntity;
import chessdoc.contracts.Position;
import chessdoc.records.Color;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static chessdoc.constants.PgnConstants.ID_SEPARATOR;
import static chessdoc.constants.PgnConstants.VARIATION_END;
import static chessdoc.constants.PgnConstants.VARIATION_MARKER;
import static chessdoc.constants.PgnConstants.VARIATION_START;

/**
 * Derivation and resolution of node and variation identifiers.
 *
 * Grammar: a node is {@code <prefix><fullMoveNumber><w|b>}, a variation is
 * {@code <prefix>start}, where the prefix of a sub-variation is
 * {@code <parentNodeId>-v<index>-} and the prefix of the main variation is empty.
 */
final class NodeIds {

  private NodeIds() {}

  private static final Pattern VARIATION_TOKEN = Pattern.compile(VARIATION_MARKER + "([0-9]{1,9})");

  static String nodeId(NodeData node) {
    return variationPrefix(node.parentVariation) + nodeSuffix(node.fullMoveNumber, node.moveColor);
  }

  static String variationId(VariationData variation) {
    return variationPrefix(variation) + VARIATION_START;
  }

  static String variationPrefix(VariationData variation) {
    StringBuilder sb = new StringBuilder();
    for (VariationData v = variation; !v.isMain(); v = v.parentNode.parentVariation) {
      NodeData parent = v.parentNode;
      int index = parent.variations.indexOf(v);
      sb.insert(0, nodeSuffix(parent.fullMoveNumber, parent.moveColor) + ID_SEPARATOR + VARIATION_MARKER + index + ID_SEPARATOR);
    }
    return sb.toString();
  }

  static String nodeSuffix(int fullMoveNumber, Color color) {
    return fullMoveNumber + String.valueOf(color.code());
  }

  static String followingSuffix(int fullMoveNumber, Color color, int distance) {
    int targetMove = fullMoveNumber + distance / 2;
    Color targetColor = color;
    if (distance % 2 == 1) {
      if (color == Color.BLACK) targetMove++;
      targetColor = color.opposite();
    }
    return nodeSuffix(targetMove, targetColor);
  }

  /**
   * Resolves an identifier against the current tree.
   *
   * @return a {@link NodeImpl}, a {@link VariationImpl}, or {@code null} if nothing matches
   */
  static AnnotatedEntity find(MoveTreeRoot root, String id, boolean allowAliases) {
    String[] tokens = id.split(ID_SEPARATOR, -1);
    if (tokens.length % 2 != 1) return null;

    Position position = root.position;
    VariationData variation = root.mainVariation;
    for (int i = 0; i + 1 < tokens.length; i += 2) {
      NodeData node = variation.child;
      while (node != null && !tokens[i].equals(nodeSuffix(node.fullMoveNumber, node.moveColor))) {
        position = PositionReplay.apply(root.engine, position, node);
        node = node.child;
      }
      if (node == null) return null;

      Matcher m = VARIATION_TOKEN.matcher(tokens[i + 1]);
      if (!m.matches()) return null;
      int index = Integer.parseInt(m.group(1));
      if (index >= node.variations.size()) return null;
      variation = node.variations.get(index);
    }

    String last = tokens[tokens.length - 1];
    if (last.equals(VARIATION_START)) {
      return new VariationImpl(variation, position);
    }
    if (allowAliases && last.equals(VARIATION_END)) {
      if (variation.child == null) return new VariationImpl(variation, position);
      NodeData node = variation.child;
      while (node.child != null) {
        position = PositionReplay.apply(root.engine, position, node);
        node = node.child;
      }
      return new NodeImpl(node, position);
    }
    for (NodeData node = variation.child; node != null; node = node.child) {
      if (last.equals(nodeSuffix(node.fullMoveNumber, node.moveColor))) {
        return new NodeImpl(node, position);
      }
      position = PositionReplay.apply(root.engine, position, node);
    }
    return null;
  }
}
