package chessdoc.records;

/**
 * One lexical token of a PGN text.
 *
 * @param type            kind of token
 * @param text            header id/value, move notation or end-of-game marker; {@code null} otherwise
 * @param nag             numeric value of a NAG token, -1 otherwise
 * @param comment         decoded content of a comment token, {@code null} otherwise
 * @param characterIndex  0-based index of the first character of the token
 * @param lineIndex       1-based line of the first character of the token
 * @param emptyLineBefore whether an empty line separates this token from the previous one
 * @param emptyLineAfter  whether an empty line separates this token from the next one
 */
public record PgnToken(
        TokenType   type,
        String      text,
        int         nag,
        CommentData comment,
        int         characterIndex,
        int         lineIndex,
        boolean     emptyLineBefore,
        boolean     emptyLineAfter
) {}
