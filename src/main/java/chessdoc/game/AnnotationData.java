package chessdoc.game;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiPredicate;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * NAGs, tags and comment attached to a node or a variation.
 */
final class AnnotationData {

  private static final Pattern TAG_KEY = Pattern.compile("\\w+");

  private final TreeSet<Integer> nags = new TreeSet<>();
  private final TreeMap<String, String> tags = new TreeMap<>();
  private String comment;
  private boolean longComment;

  /* ───────── NAGs ───────── */

  List<Integer> nags() {
    return new ArrayList<>(nags);
  }

  boolean hasNag(int nag) {
    return nags.contains(checkNag(nag));
  }

  boolean addNag(int nag) {
    return nags.add(checkNag(nag));
  }

  boolean removeNag(int nag) {
    return nags.remove(checkNag(nag));
  }

  void clearNags() {
    nags.clear();
  }

  void filterNags(IntPredicate filter) {
    nags.removeIf(nag -> !filter.test(nag));
  }

  /* ───────── Tags ───────── */

  List<String> tags() {
    return new ArrayList<>(tags.keySet());
  }

  String tag(String key) {
    return tags.get(checkTagKey(key));
  }

  void setTag(String key, String value) {
    checkTagKey(key);
    if (value == null) tags.remove(key);
    else tags.put(key, value);
  }

  void clearTags() {
    tags.clear();
  }

  void filterTags(BiPredicate<String, String> filter) {
    tags.entrySet().removeIf(e -> !filter.test(e.getKey(), e.getValue()));
  }

  /* ───────── Comment ───────── */

  String comment() {
    return comment;
  }

  boolean longComment() {
    return longComment;
  }

  void setComment(String text, boolean isLong) {
    comment = text;
    longComment = text != null && isLong;
  }

  /* ───────── Validation ───────── */

  private static int checkNag(int nag) {
    if (nag < 0) {
      throw new IllegalArgumentException("Invalid NAG: " + nag);
    }
    return nag;
  }

  private static String checkTagKey(String key) {
    if (key == null || !TAG_KEY.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid tag key: " + key);
    }
    return key;
  }

}
