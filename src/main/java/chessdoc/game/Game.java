package chessdoc.game;

import chessdoc.contracts.AnnotatedEntity;
import chessdoc.contracts.Node;
import chessdoc.contracts.Position;
import chessdoc.contracts.PositionEngine;
import chessdoc.contracts.Variation;
import chessdoc.impl.ChesslibPositionEngine;
import chessdoc.records.Color;
import chessdoc.records.DateValue;
import chessdoc.records.GameResult;
import chessdoc.records.GameVariant;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A chess game: headers, initial position and move tree.
 *
 * Setting the initial position discards the move tree.
 */
public class Game {

  private static final Pattern ECO = Pattern.compile("[A-E][0-9][0-9]");

  /* ───────── Headers ───────── */
  private final String[] playerName = new String[2];
  private final Integer[] playerElo = new Integer[2];
  private final String[] playerTitle = new String[2];
  private String event;
  private Integer round;
  private Integer subRound;
  private Integer subSubRound;
  private DateValue date;
  private String site;
  private String annotator;
  private String eco;
  private String opening;
  private String openingVariation;
  private String openingSubVariation;
  private String termination;
  private GameResult result = GameResult.LINE;

  /* ───────── Moves ───────── */
  private final MoveTreeRoot root;

  public Game() {
    this(new ChesslibPositionEngine());
  }

  public Game(PositionEngine engine) {
    this.root = new MoveTreeRoot(engine, engine.startPosition(GameVariant.REGULAR), 1);
  }

  public PositionEngine engine() {
    return root.engine;
  }

  /* ═════════════════════════ Headers ═════════════════════════ */

  public String playerName(Color color)                 { return playerName[color.ordinal()]; }
  public void setPlayerName(Color color, String value)  { playerName[color.ordinal()] = value; }

  public Integer playerElo(Color color) { return playerElo[color.ordinal()]; }

  public void setPlayerElo(Color color, Integer value) {
    if (value != null && value < 0) {
      throw new IllegalArgumentException("Invalid elo: " + value);
    }
    playerElo[color.ordinal()] = value;
  }

  public String playerTitle(Color color)                { return playerTitle[color.ordinal()]; }
  public void setPlayerTitle(Color color, String value) { playerTitle[color.ordinal()] = value; }

  public String event()                { return event; }
  public void setEvent(String value)   { event = value; }

  public Integer round()                  { return round; }
  public void setRound(Integer value)     { round = checkRound(value); }
  public Integer subRound()               { return subRound; }
  public void setSubRound(Integer value)  { subRound = checkRound(value); }
  public Integer subSubRound()               { return subSubRound; }
  public void setSubSubRound(Integer value)  { subSubRound = checkRound(value); }

  /**
   * Round, sub-round and sub-sub-round separated by dots, unknown leading parts written
   * {@code ?}, e.g. {@code 3}, {@code 3.1}, {@code ?.2.4}.
   *
   * @return {@code null} if none of the three parts is set
   */
  public String fullRound() {
    if (round == null && subRound == null && subSubRound == null) return null;
    StringBuilder sb = new StringBuilder(round == null ? "?" : round.toString());
    if (subRound != null || subSubRound != null) {
      sb.append('.').append(subRound == null ? "?" : subRound.toString());
    }
    if (subSubRound != null) {
      sb.append('.').append(subSubRound);
    }
    return sb.toString();
  }

  public DateValue date()               { return date; }
  public void setDate(DateValue value)  { date = value; }

  public String site()                  { return site; }
  public void setSite(String value)     { site = value; }

  public String annotator()                { return annotator; }
  public void setAnnotator(String value)   { annotator = value; }

  public String eco() { return eco; }

  public void setEco(String value) {
    if (value != null && !isValidEco(value)) {
      throw new IllegalArgumentException("Invalid ECO code: " + value);
    }
    eco = value;
  }

  public static boolean isValidEco(String value) {
    return ECO.matcher(value).matches();
  }

  public String opening()                          { return opening; }
  public void setOpening(String value)             { opening = value; }
  public String openingVariation()                 { return openingVariation; }
  public void setOpeningVariation(String value)    { openingVariation = value; }
  public String openingSubVariation()              { return openingSubVariation; }
  public void setOpeningSubVariation(String value) { openingSubVariation = value; }

  public String termination()              { return termination; }
  public void setTermination(String value) { termination = value; }

  public GameResult result() { return result; }

  public void setResult(GameResult value) {
    if (value == null) {
      throw new IllegalArgumentException("Result cannot be null");
    }
    result = value;
  }

  /** Resets every header to its default (absent, result {@code *}). */
  public void clearHeaders() {
    for (int i = 0; i < 2; i++) {
      playerName[i] = null;
      playerElo[i] = null;
      playerTitle[i] = null;
    }
    event = null;
    round = null;
    subRound = null;
    subSubRound = null;
    date = null;
    site = null;
    annotator = null;
    eco = null;
    opening = null;
    openingVariation = null;
    openingSubVariation = null;
    termination = null;
    result = GameResult.LINE;
  }

  private static Integer checkRound(Integer value) {
    if (value != null && value < 0) {
      throw new IllegalArgumentException("Invalid round: " + value);
    }
    return value;
  }

  /* ═════════════════════════ Moves ═════════════════════════ */

  public GameVariant variant() {
    return root.position.variant();
  }

  public Position initialPosition() {
    return root.position;
  }

  public int initialFullMoveNumber() {
    return root.fullMoveNumber;
  }

  public void setInitialPosition(Position position) {
    setInitialPosition(position, 1);
  }

  /** Changes the initial position. The whole move tree is discarded. */
  public void setInitialPosition(Position position, int fullMoveNumber) {
    if (fullMoveNumber < 1) {
      throw new IllegalArgumentException("Invalid full-move number: " + fullMoveNumber);
    }
    if (!root.engine.supportsVariant(position.variant())) {
      throw new IllegalArgumentException("Unsupported variant: " + position.variant());
    }
    root.reset(position, fullMoveNumber);
  }

  public String initialFen() {
    return root.engine.toFen(root.position, 0, root.fullMoveNumber);
  }

  public Position finalPosition() {
    return mainVariation().finalPosition();
  }

  public String finalFen() {
    return mainVariation().finalFen();
  }

  public Variation mainVariation() {
    return new VariationImpl(root.mainVariation, root.position);
  }

  /** Number of half-moves of the main line. */
  public int plyCount() {
    return mainVariation().plyCount();
  }

  /**
   * Nodes of the main line, or of the whole tree in depth-first pre-order (each node, then
   * the nodes of its variations, then the rest of the line).
   */
  public List<Node> nodes(boolean withSubVariations) {
    if (!withSubVariations) {
      return mainVariation().nodes();
    }
    List<Node> result = new ArrayList<>();
    Deque<PendingNode> stack = new ArrayDeque<>();
    if (root.mainVariation.child != null) stack.push(new PendingNode(root.mainVariation.child, root.position));
    while (!stack.isEmpty()) {
      PendingNode pending = stack.pop();
      NodeData node = pending.node();
      result.add(new NodeImpl(node, pending.positionBefore()));
      if (node.child != null) {
        stack.push(new PendingNode(node.child, PositionReplay.apply(root.engine, pending.positionBefore(), node)));
      }
      // variations branch from the position before the node
      for (int i = node.variations.size() - 1; i >= 0; i--) {
        NodeData first = node.variations.get(i).child;
        if (first != null) stack.push(new PendingNode(first, pending.positionBefore()));
      }
    }
    return result;
  }

  private record PendingNode(NodeData node, Position positionBefore) {}

  /** Same as {@code findById(id, false)}. */
  public AnnotatedEntity findById(String id) {
    return findById(id, false);
  }

  /**
   * Resolves a {@link Node} or {@link Variation} identifier.
   *
   * @param allowAliases whether {@code <prefix>end} designates the last node of a variation
   * @return the node or variation, or {@code null} if the identifier matches nothing
   */
  public AnnotatedEntity findById(String id, boolean allowAliases) {
    return NodeIds.find(root, id, allowAliases);
  }
}
