package org.waabox.refwatch;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.waabox.refwatch.git.GitConfig;

/**
 * Options of the {@link WaitForGit} step.
 *
 * <p>Defaults:
 * <ul>
 *   <li>Ref: {@code refs/heads/master}</li>
 *   <li>Poll interval: 10 seconds</li>
 *   <li>Git settings: none beyond the pipeline's</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WaitForGitOptions {

  /** The default watched ref. */
  private static final String DEFAULT_REF = "refs/heads/master";

  /** The default poll interval. */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofSeconds(10);

  /** The watched refs, never null. */
  private final RefPredicate ref;

  /** The poll interval, never null. */
  private final Duration pollInterval;

  /** The step's own git settings, never null. */
  private final GitConfig gitConfig;

  /** Private constructor; use {@link #defaults()} or {@link #builder()}.
   *
   * @param builder the populated builder
   */
  private WaitForGitOptions(final Builder builder) {
    ref = builder.ref;
    pollInterval = builder.pollInterval;
    gitConfig = builder.gitConfig;
  }

  /**
   * Returns the default options.
   *
   * @return the options, never null
   */
  public static WaitForGitOptions defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the watched refs.
   *
   * @return the ref predicate, never null
   */
  public RefPredicate ref() {
    return ref;
  }

  /**
   * Returns the time between two polls.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns the step's own git settings, merged over the pipeline's.
   *
   * @return the settings, never null
   */
  public GitConfig gitConfig() {
    return gitConfig;
  }

  /** Fluent builder for {@link WaitForGitOptions}. */
  public static final class Builder {

    /** The watched refs. */
    private RefPredicate ref = RefPredicate.exact(DEFAULT_REF);

    /** The poll interval. */
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /** The step's own git settings. */
    private GitConfig gitConfig = GitConfig.defaults();

    /** Creates a builder; use {@link WaitForGitOptions#builder()}. */
    private Builder() {
    }

    /**
     * Watches a single ref, e.g. {@code refs/heads/develop}.
     *
     * @param theRef the full ref name, never null
     * @return this builder, never null
     */
    public Builder ref(final String theRef) {
      ref = RefPredicate.exact(theRef);
      return this;
    }

    /**
     * Watches every ref whose whole name matches the pattern.
     *
     * @param pattern the pattern, never null
     * @return this builder, never null
     */
    public Builder ref(final Pattern pattern) {
      ref = RefPredicate.matching(pattern);
      return this;
    }

    /**
     * Watches every ref accepted by the predicate.
     *
     * @param predicate the predicate over full ref names, never null
     * @return this builder, never null
     */
    public Builder ref(final Predicate<String> predicate) {
      ref = RefPredicate.custom(predicate);
      return this;
    }

    /**
     * Watches the refs selected by an already resolved predicate.
     *
     * @param theRef the predicate, never null
     * @return this builder, never null
     */
    public Builder ref(final RefPredicate theRef) {
      ref = Objects.requireNonNull(theRef, "ref cannot be null");
      return this;
    }

    /**
     * Sets the time between two polls.
     *
     * @param thePollInterval the interval, must be positive
     * @return this builder, never null
     */
    public Builder pollInterval(final Duration thePollInterval) {
      Objects.requireNonNull(thePollInterval, "pollInterval cannot be null");
      if (thePollInterval.isNegative() || thePollInterval.isZero()) {
        throw new IllegalArgumentException(
            "pollInterval must be positive, got: " + thePollInterval);
      }
      pollInterval = thePollInterval;
      return this;
    }

    /**
     * Sets the step's own git settings.
     *
     * @param theGitConfig the settings, never null
     * @return this builder, never null
     */
    public Builder gitConfig(final GitConfig theGitConfig) {
      gitConfig = Objects.requireNonNull(theGitConfig,
          "gitConfig cannot be null");
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     */
    public WaitForGitOptions build() {
      return new WaitForGitOptions(this);
    }
  }
}
