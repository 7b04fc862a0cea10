package org.waabox.refwatch;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a ref of the remote repository is watched.
 *
 * <p>A ref can be selected by its exact name, by a regular expression that
 * must match the whole name, or by an arbitrary predicate. Whatever the
 * form, it is resolved once into this uniform type before polling starts.
 *
 * <p>Instances are immutable and thread-safe as long as a custom predicate
 * is.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefPredicate {

  /** The resolved predicate, never null. */
  private final Predicate<String> predicate;

  /** Human readable form, used in log and step output. */
  private final String description;

  /** Private constructor; use the static factories.
   *
   * @param thePredicate   the resolved predicate
   * @param theDescription the human readable form
   */
  private RefPredicate(final Predicate<String> thePredicate,
      final String theDescription) {
    predicate = thePredicate;
    description = theDescription;
  }

  /**
   * Matches a single ref by name, e.g. {@code refs/heads/master}.
   *
   * @param ref the full ref name, never null
   * @return the predicate, never null
   */
  public static RefPredicate exact(final String ref) {
    Objects.requireNonNull(ref, "ref cannot be null");
    return new RefPredicate(ref::equals, ref);
  }

  /**
   * Matches every ref whose whole name matches the pattern, e.g.
   * {@code refs/tags/v.*}.
   *
   * @param pattern the pattern, never null
   * @return the predicate, never null
   */
  public static RefPredicate matching(final Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    return new RefPredicate(ref -> pattern.matcher(ref).matches(),
        pattern.pattern());
  }

  /**
   * Matches every ref accepted by the given predicate.
   *
   * @param predicate the predicate over full ref names, never null
   * @return the predicate, never null
   */
  public static RefPredicate custom(final Predicate<String> predicate) {
    Objects.requireNonNull(predicate, "predicate cannot be null");
    return new RefPredicate(predicate, "custom ref predicate");
  }

  /**
   * Tells whether the ref is watched.
   *
   * @param refName the full ref name, never null
   * @return true if the ref is watched
   */
  public boolean matches(final String refName) {
    return predicate.test(refName);
  }

  @Override
  public String toString() {
    return description;
  }
}
