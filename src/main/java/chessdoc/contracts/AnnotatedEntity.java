package chessdoc.contracts;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.IntPredicate;

/**
 * Annotations shared by {@link Node} and {@link Variation}: NAGs, {@code [%key value]} tags
 * and a free-text comment.
 *
 * NAGs are non-negative integers; tag keys match {@code \w+}. Invalid values are rejected
 * with {@link IllegalArgumentException}.
 */
public interface AnnotatedEntity {

  /* ───────── NAGs ───────── */

  /** @return the NAGs, in ascending order */
  List<Integer> nags();

  boolean hasNag(int nag);

  /** @return {@code true} if the NAG was not already present */
  boolean addNag(int nag);

  /** @return {@code true} if the NAG was present */
  boolean removeNag(int nag);

  void clearNags();

  /** Keeps only the NAGs accepted by the filter. */
  void filterNags(IntPredicate filter);

  /* ───────── Tags ───────── */

  /** @return the tag keys, in lexicographic order */
  List<String> tags();

  /** @return the tag value, or {@code null} if not set */
  String tag(String key);

  /** Sets a tag; a {@code null} value removes it. */
  void setTag(String key, String value);

  void removeTag(String key);

  void clearTags();

  /** Keeps only the tags accepted by the filter. */
  void filterTags(BiPredicate<String, String> filter);

  /* ───────── Comment ───────── */

  /** @return the comment, or {@code null} if none */
  String comment();

  /** Same as {@code setComment(text, false)}. */
  void setComment(String text);

  /**
   * Sets the comment; {@code null} removes it (and resets the long flag).
   *
   * @param isLong whether the comment should be rendered on its own paragraph
   */
  void setComment(String text, boolean isLong);

  /**
   * Whether the comment is rendered on its own paragraph. Always {@code false} when the
   * enclosing variation is not effectively long.
   */
  boolean isLongComment();
}
