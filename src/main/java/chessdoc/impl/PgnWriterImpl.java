package chessdoc.impl;

import chessdoc.contracts.AnnotatedEntity;
import chessdoc.contracts.Node;
import chessdoc.contracts.PgnWriter;
import chessdoc.contracts.Position;
import chessdoc.contracts.Variation;
import chessdoc.game.Game;
import chessdoc.records.Color;
import chessdoc.records.GameVariant;
import chessdoc.records.PgnWriteOptions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static chessdoc.constants.PgnConstants.GAME_SEPARATOR;
import static chessdoc.constants.PgnConstants.SETUP_VALUE;
import static chessdoc.constants.PgnConstants.UNKNOWN_DATE;
import static chessdoc.constants.PgnConstants.UNKNOWN_VALUE;
import static chessdoc.impl.PgnTokenStream.trimAndCollapse;

/**
 * PGN writer. Move text is soft-wrapped at the configured line width; long comments and
 * long variations are set apart by empty lines.
 */
public final class PgnWriterImpl implements PgnWriter {

    @Override
    public String write(List<Game> games, PgnWriteOptions options) {
        return games.stream().map(game -> write(game, options)).collect(Collectors.joining(GAME_SEPARATOR));
    }

    @Override
    public String write(Game game, PgnWriteOptions options) {
        StringBuilder out = new StringBuilder();
        writeHeaders(out, game, options);
        out.append('\n');

        MoveTextBuilder moveText = new MoveTextBuilder(out, options.lineWidth());
        writeMoveText(moveText, game.mainVariation());
        moveText.pushToken(game.result().pgn(), false, false);
        moveText.flush();
        return out.toString();
    }

    /* ═════════════════════════ Headers ═════════════════════════ */

    private static void writeHeaders(StringBuilder out, Game game, PgnWriteOptions options) {
        // seven tag roster
        header(out, "Event", nullable(game.event()));
        header(out, "Site", nullable(game.site()));
        header(out, "Date", game.date() == null ? UNKNOWN_DATE : game.date().toPgnString());
        header(out, "Round", nullable(game.fullRound()));
        header(out, "White", nullable(game.playerName(Color.WHITE)));
        header(out, "Black", nullable(game.playerName(Color.BLACK)));
        header(out, "Result", game.result().pgn());

        GameVariant variant = game.variant();
        Position initial = game.initialPosition();
        boolean hasFen = !variant.hasCanonicalStartPosition()
                || !initial.equals(game.engine().startPosition(variant))
                || game.initialFullMoveNumber() != 1;

        // other tags, by name
        Map<String, String> optional = new LinkedHashMap<>();
        optional.put("Annotator", game.annotator());
        optional.put("BlackElo", integer(game.playerElo(Color.BLACK)));
        optional.put("BlackTitle", game.playerTitle(Color.BLACK));
        optional.put("ECO", game.eco());
        optional.put("FEN", hasFen ? game.engine().toFen(initial, 0, game.initialFullMoveNumber()) : null);
        optional.put("Opening", game.opening());
        optional.put("PlyCount", options.withPlyCount() ? String.valueOf(game.plyCount()) : null);
        optional.put("SetUp", hasFen ? SETUP_VALUE : null);
        optional.put("SubVariation", game.openingSubVariation());
        optional.put("Termination", game.termination());
        optional.put("Variant", variant.pgnName());
        optional.put("Variation", game.openingVariation());
        optional.put("WhiteElo", integer(game.playerElo(Color.WHITE)));
        optional.put("WhiteTitle", game.playerTitle(Color.WHITE));
        for (Map.Entry<String, String> e : optional.entrySet()) {
            String value = e.getValue() == null ? "" : trimAndCollapse(e.getValue());
            if (!value.isEmpty()) {
                header(out, e.getKey(), value);
            }
        }
    }

    private static void header(StringBuilder out, String key, String value) {
        out.append('[').append(key).append(" \"").append(escapeHeaderValue(value)).append("\"]\n");
    }

    private static String nullable(String value) {
        String v = value == null ? "" : trimAndCollapse(value);
        return v.isEmpty() ? UNKNOWN_VALUE : v;
    }

    private static String integer(Integer value) {
        return value == null ? null : value.toString();
    }

    private static String escapeHeaderValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String escapeCommentValue(String value) {
        return value.replace("\\", "\\\\").replace("}", "\\}");
    }

    /* ═════════════════════════ Move text ═════════════════════════ */

    /** Progress through one variation: the node being written and its pending sub-variations. */
    private static final class Frame {
        final boolean isMain;
        Node node;
        boolean forceMoveNumber = true;
        List<Variation> variations; // null until the node itself is written
        int nextVariation;
        int lastNonEmpty;

        Frame(Node first, boolean isMain) {
            this.node = first;
            this.isMain = isMain;
        }
    }

    private static void writeMoveText(MoveTextBuilder out, Variation mainVariation) {
        Deque<Frame> stack = new ArrayDeque<>();
        writeAnnotations(out, mainVariation, false, true);
        stack.push(new Frame(mainVariation.first(), true));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();

            // end of a variation
            if (frame.node == null) {
                stack.pop();
                if (!stack.isEmpty()) {
                    Frame parent = stack.peek();
                    int index = parent.nextVariation - 1;
                    out.pushToken(")", true, false);
                    if (index == parent.lastNonEmpty && parent.variations.get(index).isLongVariation()) {
                        out.skipLine();
                    }
                    parent.forceMoveNumber = true;
                }
                continue;
            }

            if (frame.variations == null) {
                writeNodeHead(out, frame);
            }

            // next non-empty sub-variation, if any
            while (frame.nextVariation < frame.variations.size() && frame.variations.get(frame.nextVariation).first() == null) {
                frame.nextVariation++;
            }
            if (frame.nextVariation < frame.variations.size()) {
                Variation variation = frame.variations.get(frame.nextVariation++);
                if (variation.isLongVariation()) {
                    out.skipLine();
                }
                out.pushToken("(", false, true);
                writeAnnotations(out, variation, false, true);
                stack.push(new Frame(variation.first(), false));
                continue;
            }

            frame.node = frame.node.next();
            frame.variations = null;
        }
    }

    private static void writeNodeHead(MoveTextBuilder out, Frame frame) {
        Node node = frame.node;
        if (node.moveColor() == Color.WHITE) {
            out.pushToken(node.fullMoveNumber() + ".", false, false);
        } else if (frame.forceMoveNumber) {
            out.pushToken(node.fullMoveNumber() + "...", false, false);
        }
        out.pushToken(node.notation(), false, false);

        frame.variations = node.variations();
        frame.nextVariation = 0;
        frame.lastNonEmpty = -1;
        for (int k = frame.variations.size() - 1; k >= 0; k--) {
            if (frame.variations.get(k).first() != null) {
                frame.lastNonEmpty = k;
                break;
            }
        }

        boolean skipLineAfterLongComment = (frame.isMain || node.next() != null) && frame.lastNonEmpty < 0;
        frame.forceMoveNumber = writeAnnotations(out, node, true, skipLineAfterLongComment);
    }

    /**
     * Writes the NAGs, then the tags and the comment merged into one brace block.
     *
     * @return {@code true} if anything was written (the next move number must then be written)
     */
    private static boolean writeAnnotations(MoveTextBuilder out, AnnotatedEntity entity, boolean isNode, boolean skipLineAfterLongComment) {
        for (int nag : entity.nags()) {
            out.pushToken("$" + nag, false, false);
        }

        String comment = entity.comment() == null ? "" : trimAndCollapse(entity.comment());
        Map<String, String> tags = new LinkedHashMap<>();
        for (String key : entity.tags()) {
            // square brackets cannot appear in tag values
            String value = trimAndCollapse(entity.tag(key).replaceAll("[\\[\\]]", ""));
            if (!value.isEmpty()) {
                tags.put(key, value);
            }
        }
        if (tags.isEmpty() && comment.isEmpty()) {
            return false;
        }

        boolean longComment = !comment.isEmpty() && entity.isLongComment();
        if (longComment && isNode) {
            out.skipLine();
        }
        out.pushToken("{", false, true);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            out.pushToken("[%" + tag.getKey(), false, false);
            for (String token : escapeCommentValue(tag.getValue() + "]").split(" ")) {
                out.pushToken(token, false, false);
            }
        }
        if (!comment.isEmpty()) {
            for (String token : escapeCommentValue(comment).split(" ")) {
                out.pushToken(token, false, false);
            }
        }
        out.pushToken("}", true, false);
        if (longComment && skipLineAfterLongComment) {
            out.skipLine();
        }
        return true;
    }

    /** Assembles tokens into lines of at most {@code lineWidth} characters, breaking between tokens only. */
    private static final class MoveTextBuilder {
        private final StringBuilder out;
        private final int lineWidth;
        private final StringBuilder currentLine = new StringBuilder();
        private boolean avoidNextSpace;

        MoveTextBuilder(StringBuilder out, int lineWidth) {
            this.out = out;
            this.lineWidth = lineWidth;
        }

        void pushToken(String token, boolean avoidSpaceBefore, boolean avoidSpaceAfter) {
            boolean space = !(avoidNextSpace || avoidSpaceBefore);
            if (currentLine.length() == 0) {
                currentLine.append(token);
            } else if (currentLine.length() + token.length() + (space ? 1 : 0) <= lineWidth) {
                if (space) currentLine.append(' ');
                currentLine.append(token);
            } else {
                out.append(currentLine).append('\n');
                currentLine.setLength(0);
                currentLine.append(token);
            }
            avoidNextSpace = avoidSpaceAfter;
        }

        /** Ends the current line and adds an empty one. */
        void skipLine() {
            if (currentLine.length() == 0) {
                return;
            }
            out.append(currentLine).append("\n\n");
            currentLine.setLength(0);
            avoidNextSpace = false;
        }

        void flush() {
            out.append(currentLine).append('\n');
            currentLine.setLength(0);
        }
    }
}
