package chessdoc.records;

import java.util.Map;

/**
 * Decoded content of a PGN comment.
 *
 * @param comment visible text, trimmed with space runs collapsed, or {@code null} if nothing remains
 * @param tags    {@code [%key value]} sub-tags found in the comment, in order of appearance
 */
public record CommentData(String comment, Map<String, String> tags) {
    public CommentData {
        tags = Map.copyOf(tags);
    }
}
