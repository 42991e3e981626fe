package chessdoc.game;

import chessdoc.contracts.AnnotatedEntity;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.IntPredicate;

/**
 * Annotation operations shared by node and variation handles.
 */
abstract class AnnotatedHandle implements AnnotatedEntity {

  abstract AnnotationData annotations();

  /** Effective long status of the variation the comment is rendered in. */
  abstract boolean inLongVariation();

  @Override public List<Integer> nags()         { return annotations().nags(); }
  @Override public boolean hasNag(int nag)      { return annotations().hasNag(nag); }
  @Override public boolean addNag(int nag)      { return annotations().addNag(nag); }
  @Override public boolean removeNag(int nag)   { return annotations().removeNag(nag); }
  @Override public void clearNags()             { annotations().clearNags(); }
  @Override public void filterNags(IntPredicate filter) { annotations().filterNags(filter); }

  @Override public List<String> tags()                 { return annotations().tags(); }
  @Override public String tag(String key)              { return annotations().tag(key); }
  @Override public void setTag(String key, String value) { annotations().setTag(key, value); }
  @Override public void removeTag(String key)          { annotations().setTag(key, null); }
  @Override public void clearTags()                    { annotations().clearTags(); }
  @Override public void filterTags(BiPredicate<String, String> filter) { annotations().filterTags(filter); }

  @Override public String comment()                { return annotations().comment(); }
  @Override public void setComment(String text)    { annotations().setComment(text, false); }
  @Override public void setComment(String text, boolean isLong) { annotations().setComment(text, isLong); }

  @Override
  public boolean isLongComment() {
    return annotations().longComment() && inLongVariation();
  }
}
