package org.waabox.refwatch.pipeline;

import java.util.Objects;

import org.waabox.refwatch.cancel.CancellationSignal;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.notify.NotificationBus;

/**
 * A plain {@link StepContext} for running steps embedded in an application.
 *
 * <p>Instances are created through the fluent {@link Builder}:
 * <pre>{@code
 * StepContext ctx = DefaultStepContext.builder()
 *     .history(history)
 *     .notificationBus(bus)
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DefaultStepContext implements StepContext {

  /** The kill switch, never null. */
  private final CancellationSignal cancellation;

  /** The result channel, never null. */
  private final ResultChannel resultChannel;

  /** The step history, never null. */
  private final StepHistory history;

  /** The pipeline wide git settings, never null. */
  private final GitConfig gitConfig;

  /** The shared notification bus, never null. */
  private final NotificationBus notificationBus;

  /** Creates a context; use {@link #builder()}.
   *
   * @param builder the populated builder
   */
  private DefaultStepContext(final Builder builder) {
    cancellation = builder.cancellation;
    resultChannel = builder.resultChannel;
    history = builder.history;
    gitConfig = builder.gitConfig;
    notificationBus = builder.notificationBus;
  }

  /**
   * Creates a new builder. Unset collaborators default to fresh instances:
   * a live signal, a {@link CollectingResultChannel}, an
   * {@link InMemoryStepHistory}, {@link GitConfig#defaults()} and a new
   * {@link NotificationBus}.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** {@inheritDoc} */
  @Override
  public CancellationSignal cancellation() {
    return cancellation;
  }

  /** {@inheritDoc} */
  @Override
  public ResultChannel resultChannel() {
    return resultChannel;
  }

  /** {@inheritDoc} */
  @Override
  public StepHistory history() {
    return history;
  }

  /** {@inheritDoc} */
  @Override
  public GitConfig gitConfig() {
    return gitConfig;
  }

  /** {@inheritDoc} */
  @Override
  public NotificationBus notificationBus() {
    return notificationBus;
  }

  /** Fluent builder for {@link DefaultStepContext}. */
  public static final class Builder {

    /** The kill switch. */
    private CancellationSignal cancellation = new CancellationSignal();

    /** The result channel. */
    private ResultChannel resultChannel = new CollectingResultChannel();

    /** The step history. */
    private StepHistory history = new InMemoryStepHistory();

    /** The pipeline wide git settings. */
    private GitConfig gitConfig = GitConfig.defaults();

    /** The shared notification bus. */
    private NotificationBus notificationBus = new NotificationBus();

    /** Creates a builder; use {@link DefaultStepContext#builder()}. */
    private Builder() {
    }

    /**
     * Sets the kill switch.
     *
     * @param theCancellation the signal, never null
     * @return this builder, never null
     */
    public Builder cancellation(final CancellationSignal theCancellation) {
      cancellation = Objects.requireNonNull(theCancellation,
          "cancellation cannot be null");
      return this;
    }

    /**
     * Sets the result channel.
     *
     * @param theResultChannel the channel, never null
     * @return this builder, never null
     */
    public Builder resultChannel(final ResultChannel theResultChannel) {
      resultChannel = Objects.requireNonNull(theResultChannel,
          "resultChannel cannot be null");
      return this;
    }

    /**
     * Sets the step history.
     *
     * @param theHistory the history, never null
     * @return this builder, never null
     */
    public Builder history(final StepHistory theHistory) {
      history = Objects.requireNonNull(theHistory, "history cannot be null");
      return this;
    }

    /**
     * Sets the pipeline wide git settings.
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
     * Sets the shared notification bus.
     *
     * @param theNotificationBus the bus, never null
     * @return this builder, never null
     */
    public Builder notificationBus(final NotificationBus theNotificationBus) {
      notificationBus = Objects.requireNonNull(theNotificationBus,
          "notificationBus cannot be null");
      return this;
    }

    /**
     * Builds the context.
     *
     * @return the context, never null
     */
    public DefaultStepContext build() {
      return new DefaultStepContext(this);
    }
  }
}
