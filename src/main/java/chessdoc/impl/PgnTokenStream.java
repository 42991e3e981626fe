package chessdoc.impl;

import chessdoc.constants.PgnConstants;
import chessdoc.exceptions.InvalidPgnException;
import chessdoc.records.CommentData;
import chessdoc.records.PgnToken;
import chessdoc.records.StreamLocation;
import chessdoc.records.TokenType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static chessdoc.exceptions.InvalidPgnException.Reason.INVALID_TOKEN;

/**
 * Lexer over a PGN text. Tokens are produced one at a time by {@link #next()}.
 *
 * Besides the tokens themselves, the stream reports whether an empty line (two or more
 * line breaks) separates a token from its neighbours: the reader uses this to tell long
 * comments and variations apart.
 */
public final class PgnTokenStream {

    /* ────────────── Blanks ────────────── */
    private static final Pattern SPACES = Pattern.compile("[ \\f\\t\\x0B]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");
    private static final Pattern FAST_ADVANCE = Pattern.compile("[^ \\f\\t\\x0B\\r\\n\"{][^ \\f\\t\\x0B\\r\\n\"{10*]*");

    /* ────────────── Tokens ────────────── */
    private static final Pattern MOVE_NUMBER = Pattern.compile("[0-9]+\\.(?:\\.\\.)?");
    private static final Pattern MOVE = Pattern.compile(
            "(?:O-O(?:-O)?|0-0(?:-0)?|[KQRBN][a-h]?[1-8]?x?[a-h][1-8]|(?:[a-h]x?)?[a-h][1-8](?:=?[KQRBNP])?)[+#]?|--");
    private static final Pattern NAG = Pattern.compile(
            "([!?][!?]?|\\+/?[-=]|[-=]/?\\+|=|inf|~|RR|N)|\\$([1-9][0-9]{0,8})");
    private static final Pattern END_OF_GAME = Pattern.compile("1-0|0-1|1/2-1/2|\\*");
    private static final Pattern HEADER_ID = Pattern.compile("\\w+");

    /* ────────────── Token content ────────────── */
    private static final Pattern COMMENT_ESCAPE = Pattern.compile("\\\\([\\\\}])");
    private static final Pattern HEADER_ESCAPE = Pattern.compile("\\\\([\\\\\"])");
    private static final Pattern COMMENT_TAG = Pattern.compile("\\[%(\\w+)\\s([^\\[\\]]*)\\]");
    private static final Pattern WHITESPACES = Pattern.compile("\\s+");

    private final String text;
    private int pos;
    private int lineIndex = 1;

    private TokenType lastType; // null before the first token and after skipGame()
    private boolean emptyLineAfterLast;

    private final Matcher spaces;
    private final Matcher lineBreak;
    private final Matcher fastAdvance;
    private final Matcher moveNumber;
    private final Matcher move;
    private final Matcher nag;
    private final Matcher endOfGame;
    private final Matcher headerId;

    public PgnTokenStream(String text) {
        this(text, null);
    }

    /**
     * @param start location previously obtained from {@link #currentLocation()} on the same text,
     *              or {@code null} to start at the beginning
     */
    public PgnTokenStream(String text, StreamLocation start) {
        this.text = !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        if (start != null) {
            this.pos = start.pos();
            this.lineIndex = start.lineIndex();
        }
        this.spaces = SPACES.matcher(this.text);
        this.lineBreak = LINE_BREAK.matcher(this.text);
        this.fastAdvance = FAST_ADVANCE.matcher(this.text);
        this.moveNumber = MOVE_NUMBER.matcher(this.text);
        this.move = MOVE.matcher(this.text);
        this.nag = NAG.matcher(this.text);
        this.endOfGame = END_OF_GAME.matcher(this.text);
        this.headerId = HEADER_ID.matcher(this.text);
    }

    /** Text being read, without its byte-order mark if it had one. */
    public String text() {
        return text;
    }

    public StreamLocation currentLocation() {
        return new StreamLocation(pos, lineIndex);
    }

    /**
     * Reads the next token.
     *
     * @return the token, or {@code null} at the end of the text
     * @throws InvalidPgnException if no token can be recognized at the current location
     */
    public PgnToken next() {
        boolean emptyLineBefore = lastType == null || lastType == TokenType.END_OF_GAME ? skipBlanks() : emptyLineAfterLast;
        if (pos >= text.length()) {
            return null;
        }

        int characterIndex = pos;
        int tokenLine = lineIndex;
        TokenType type;
        String value = null;
        int nagValue = -1;
        CommentData comment = null;

        if (lastType == TokenType.BEGIN_HEADER && lookingAt(headerId)) {
            type = TokenType.HEADER_ID;
            value = headerId.group();
        } else if (lookingAt(moveNumber)) {
            type = TokenType.MOVE_NUMBER;
        } else if (lookingAt(move)) {
            type = TokenType.MOVE;
            value = move.group();
        } else if (lookingAt(nag)) {
            type = TokenType.NAG;
            nagValue = nag.group(2) == null
                    ? PgnConstants.SYMBOLIC_NAGS.get(nag.group(1))
                    : Integer.parseInt(nag.group(2));
        } else if (lookingAtChar('{')) {
            String raw = scanComment();
            if (raw == null) {
                throw new InvalidPgnException(text, characterIndex, tokenLine, INVALID_TOKEN);
            }
            type = TokenType.COMMENT;
            comment = parseComment(raw);
        } else if (lookingAtChar('(')) {
            type = TokenType.BEGIN_VARIATION;
        } else if (lookingAtChar(')')) {
            type = TokenType.END_VARIATION;
        } else if (lookingAt(endOfGame)) {
            type = TokenType.END_OF_GAME;
            value = endOfGame.group();
        } else if (lookingAtChar('[')) {
            type = TokenType.BEGIN_HEADER;
        } else if (lookingAtChar(']')) {
            type = TokenType.END_HEADER;
        } else if (lookingAt(headerId)) {
            type = TokenType.HEADER_ID;
            value = headerId.group();
        } else if (lookingAtChar('"')) {
            String raw = scanHeaderValue();
            if (raw == null) {
                throw new InvalidPgnException(text, characterIndex, tokenLine, INVALID_TOKEN);
            }
            type = TokenType.HEADER_VALUE;
            value = trimAndCollapse(HEADER_ESCAPE.matcher(raw).replaceAll("$1"));
        } else {
            throw new InvalidPgnException(text, pos, lineIndex, INVALID_TOKEN);
        }

        lastType = type;
        emptyLineAfterLast = type != TokenType.END_OF_GAME && skipBlanks();
        return new PgnToken(type, value, nagValue, comment, characterIndex, tokenLine, emptyLineBefore, emptyLineAfterLast);
    }

    /**
     * Skips everything up to and including the next end-of-game marker, without decoding
     * moves, NAGs or headers.
     *
     * @return {@code true} if anything but blanks was found
     */
    public boolean skipGame() {
        boolean found = false;
        lastType = null;
        while (true) {
            skipBlanks();
            if (pos >= text.length()) {
                return found;
            }
            found = true;

            if (lookingAtChar('{')) {
                if (scanComment() == null) {
                    pos = text.length();
                    return true;
                }
            } else if (lookingAtChar('"')) {
                if (scanHeaderValue() == null) {
                    skipToEndOfLine();
                }
            } else if (lookingAt(endOfGame)) {
                return true;
            } else {
                lookingAt(fastAdvance);
            }
        }
    }

    /* ────────────── Scanning ────────────── */

    /** @return {@code true} if at least one empty line was skipped */
    private boolean skipBlanks() {
        int lineBreaks = 0;
        while (pos < text.length()) {
            if (lookingAt(spaces)) {
                continue;
            }
            if (lookingAt(lineBreak)) {
                lineBreaks++;
                lineIndex++;
                continue;
            }
            break;
        }
        return lineBreaks >= 2;
    }

    private boolean lookingAt(Matcher m) {
        m.region(pos, text.length());
        if (m.lookingAt()) {
            pos = m.end();
            return true;
        }
        return false;
    }

    private boolean lookingAtChar(char c) {
        if (pos < text.length() && text.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Reads a comment body up to its closing brace. Line breaks inside the comment are
     * counted.
     *
     * @return the raw body, or {@code null} (cursor untouched) if the comment is not closed
     */
    private String scanComment() {
        int lines = 0;
        for (int i = pos; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 >= text.length()) return null;
                lines += lineBreakAt(i + 1);
                i++;
            } else if (c == '}') {
                String raw = text.substring(pos, i);
                pos = i + 1;
                lineIndex += lines;
                return raw;
            } else {
                lines += lineBreakAt(i);
            }
        }
        return null;
    }

    // 1 if a line break starts at i (\r\n counts at its \n)
    private int lineBreakAt(int i) {
        char c = text.charAt(i);
        if (c == '\n') return 1;
        if (c == '\r') return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? 0 : 1;
        return 0;
    }

    /**
     * Reads a header value up to its closing quote. Header values cannot span lines.
     *
     * @return the raw value, or {@code null} (cursor untouched) if the value is not closed
     */
    private String scanHeaderValue() {
        for (int i = pos; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 >= text.length() || isHeaderBreak(text.charAt(i + 1))) return null;
                i++;
            } else if (c == '"') {
                String raw = text.substring(pos, i);
                pos = i + 1;
                return raw;
            } else if (isHeaderBreak(c)) {
                return null;
            }
        }
        return null;
    }

    private static boolean isHeaderBreak(char c) {
        return c == '\f' || c == '\t' || c == '\u000B' || c == '\r' || c == '\n';
    }

    private void skipToEndOfLine() {
        while (pos < text.length() && text.charAt(pos) != '\r' && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    /* ────────────── Token content ────────────── */

    private static CommentData parseComment(String raw) {
        String unescaped = COMMENT_ESCAPE.matcher(raw).replaceAll("$1");
        Map<String, String> tags = new LinkedHashMap<>();
        Matcher m = COMMENT_TAG.matcher(unescaped);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String tagValue = trimAndCollapse(m.group(2));
            if (!tagValue.isEmpty()) {
                tags.put(m.group(1), tagValue);
            }
            m.appendReplacement(sb, " ");
        }
        m.appendTail(sb);
        String comment = trimAndCollapse(sb.toString());
        return new CommentData(comment.isEmpty() ? null : comment, tags);
    }

    static String trimAndCollapse(String value) {
        return WHITESPACES.matcher(value.strip()).replaceAll(" ");
    }
}
