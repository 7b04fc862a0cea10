package org.waabox.refwatch;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.git.GitOperationException;
import org.waabox.refwatch.notify.NotificationEvent;
import org.waabox.refwatch.notify.NotificationSubscription;
import org.waabox.refwatch.pipeline.CollectingResultChannel;
import org.waabox.refwatch.pipeline.DefaultStepContext;
import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * Tests for {@link RevisionPoller}.
 *
 * <p>The poll loop runs on a separate thread; the tests drive it through
 * the kill switch and the notification bus.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RevisionPollerTest {

  private static final String REMOTE = "git@example.com:team/app.git";

  private static final String MASTER = "refs/heads/master";

  private static final RevisionSnapshot ABC =
      RevisionSnapshot.of(MASTER, "abc123");

  private static final RevisionSnapshot DEF =
      RevisionSnapshot.of(MASTER, "def456");

  private final CollectingResultChannel out = new CollectingResultChannel();

  private final StepContext ctx = DefaultStepContext.builder()
      .resultChannel(out)
      .build();

  private RevisionPoller poller(final GitClient git, final Duration interval) {
    return new RevisionPoller(git, REMOTE, RefPredicate.exact(MASTER),
        GitConfig.defaults(), interval);
  }

  @Test
  void whenPolling_givenRevisionMoved_shouldReportChange() throws Exception {
    // Arrange
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andReturn(ABC);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andReturn(DEF);
    replay(git);

    // Act
    final PollOutcome outcome;
    try (NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE)) {
      outcome = poller(git, Duration.ofMillis(20))
          .pollUntilChanged(ctx, ABC, notifications);
    }

    // Assert
    final ChangeEvent change = outcome.changeEvent().orElseThrow();
    assertEquals(MASTER, change.changedRef());
    assertEquals("def456", change.revision());
    assertEquals("abc123", change.oldRevision());
    assertEquals(REMOTE, change.remote());
    assertEquals(DEF, outcome.lastSeen());
    assertEquals(1, out.statuses().size());
    assertEquals(StepStatus.WAITING, out.statuses().get(0));
    assertTrue(out.output().contains("Found new commit: def456 on "
        + MASTER));
    verify(git);
  }

  @Test
  void whenPolling_givenEmptyLastSeen_shouldReportNewRefWithoutOldRevision() {
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andReturn(ABC);
    replay(git);

    final PollOutcome outcome;
    try (NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE)) {
      outcome = poller(git, Duration.ofMillis(20))
          .pollUntilChanged(ctx, RevisionSnapshot.empty(), notifications);
    }

    final ChangeEvent change = outcome.changeEvent().orElseThrow();
    assertEquals("abc123", change.revision());
    assertNull(change.oldRevision());
    verify(git);
  }

  @Test
  void whenPolling_givenSameRevisions_shouldKeepWaitingUntilKilled()
      throws Exception {
    // Arrange
    final CountDownLatch polledThrice = new CountDownLatch(3);
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andAnswer(() -> {
          polledThrice.countDown();
          return ABC;
        }).atLeastOnce();
    replay(git);

    final NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE);

    // Act
    final CompletableFuture<PollOutcome> run = CompletableFuture.supplyAsync(
        () -> poller(git, Duration.ofMillis(20))
            .pollUntilChanged(ctx, ABC, notifications));
    assertTrue(polledThrice.await(5, TimeUnit.SECONDS));
    ctx.cancellation().kill();

    // Assert
    final PollOutcome outcome = run.get(5, TimeUnit.SECONDS);
    assertTrue(outcome.isCancelled());
    assertEquals(ABC, outcome.lastSeen());
    assertTrue(out.statuses().size() >= 2);
    assertTrue(out.statuses().stream().allMatch(StepStatus.WAITING::equals));
    assertEquals(0, ctx.cancellation().observerCount());
    notifications.close();
    verify(git);
  }

  @Test
  void whenPolling_givenOnlyRemovedRefs_shouldAdoptSmallerSnapshotAndWait()
      throws Exception {
    // Arrange
    final RevisionSnapshot both = RevisionSnapshot.of(Map.of(
        "refs/heads/a", "111", "refs/heads/b", "222"));
    final RevisionSnapshot onlyA = RevisionSnapshot.of("refs/heads/a", "111");

    final CountDownLatch polledTwice = new CountDownLatch(2);
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andAnswer(() -> {
          polledTwice.countDown();
          return onlyA;
        }).atLeastOnce();
    replay(git);

    final NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE);

    // Act
    final CompletableFuture<PollOutcome> run = CompletableFuture.supplyAsync(
        () -> poller(git, Duration.ofMillis(20))
            .pollUntilChanged(ctx, both, notifications));
    assertTrue(polledTwice.await(5, TimeUnit.SECONDS));
    ctx.cancellation().kill();

    // Assert
    final PollOutcome outcome = run.get(5, TimeUnit.SECONDS);
    assertTrue(outcome.isCancelled());
    assertFalse(outcome.changeEvent().isPresent());
    assertEquals(onlyA, outcome.lastSeen());
    assertTrue(out.statuses().contains(StepStatus.WAITING));
    assertFalse(out.output().stream()
        .anyMatch(line -> line.startsWith("Found new commit")));
    notifications.close();
    verify(git);
  }

  @Test
  void whenWaiting_givenManyTimerWakeups_shouldNotKeepKillObservers()
      throws Exception {
    // Arrange
    final CountDownLatch manyPolls = new CountDownLatch(200);
    final AtomicInteger observersDuringFetch = new AtomicInteger();
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andAnswer(() -> {
          observersDuringFetch.accumulateAndGet(
              ctx.cancellation().observerCount(), Math::max);
          manyPolls.countDown();
          return ABC;
        }).atLeastOnce();
    replay(git);

    final NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE);

    // Act
    final CompletableFuture<PollOutcome> run = CompletableFuture.supplyAsync(
        () -> poller(git, Duration.ofMillis(1))
            .pollUntilChanged(ctx, ABC, notifications));
    assertTrue(manyPolls.await(10, TimeUnit.SECONDS));
    ctx.cancellation().kill();

    // Assert
    assertTrue(run.get(5, TimeUnit.SECONDS).isCancelled());
    assertEquals(0, observersDuringFetch.get());
    assertEquals(0, ctx.cancellation().observerCount());
    notifications.close();
    verify(git);
  }

  @Test
  void whenPolling_givenFetchFailure_shouldReportAndKeepPolling() {
    // Arrange
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class)))
        .andThrow(new GitOperationException("connection refused"));
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andReturn(DEF);
    replay(git);

    // Act
    final PollOutcome outcome;
    try (NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE)) {
      outcome = poller(git, Duration.ofMillis(20))
          .pollUntilChanged(ctx, ABC, notifications);
    }

    // Assert
    assertEquals("abc123", outcome.changeEvent().orElseThrow().oldRevision());
    assertTrue(out.output().contains("could not get current revision for ref "
        + MASTER + " on " + REMOTE + ": connection refused"));
    verify(git);
  }

  @Test
  void whenWaiting_givenNotification_shouldPollBeforeTheInterval()
      throws Exception {
    // Arrange
    final CountDownLatch firstPoll = new CountDownLatch(1);
    final AtomicInteger polls = new AtomicInteger();
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andAnswer(() -> {
          firstPoll.countDown();
          return polls.incrementAndGet() == 1 ? ABC : DEF;
        }).times(2);
    replay(git);

    final NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE);

    // Act
    final CompletableFuture<PollOutcome> run = CompletableFuture.supplyAsync(
        () -> poller(git, Duration.ofSeconds(30))
            .pollUntilChanged(ctx, ABC, notifications));
    assertTrue(firstPoll.await(5, TimeUnit.SECONDS));
    ctx.notificationBus().publish(new NotificationEvent("some/other/repo"));
    ctx.notificationBus().publish(new NotificationEvent(REMOTE));

    // Assert
    final PollOutcome outcome = run.get(5, TimeUnit.SECONDS);
    assertEquals("def456", outcome.changeEvent().orElseThrow().revision());
    assertTrue(out.output().contains(
        "Received notification. Polling out of schedule"));
    notifications.close();
    verify(git);
  }

  @Test
  void whenWaiting_givenKill_shouldStopWithoutWaitingForTheInterval()
      throws Exception {
    // Arrange
    final CountDownLatch firstPoll = new CountDownLatch(1);
    final GitClient git = createMock(GitClient.class);
    expect(git.currentRevisions(eq(REMOTE), anyObject(RefPredicate.class),
        anyObject(GitConfig.class))).andAnswer(() -> {
          firstPoll.countDown();
          return ABC;
        });
    replay(git);

    final NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE);

    // Act
    final CompletableFuture<PollOutcome> run = CompletableFuture.supplyAsync(
        () -> poller(git, Duration.ofSeconds(30))
            .pollUntilChanged(ctx, ABC, notifications));
    assertTrue(firstPoll.await(5, TimeUnit.SECONDS));
    ctx.cancellation().kill();

    // Assert
    final PollOutcome outcome = run.get(5, TimeUnit.SECONDS);
    assertTrue(outcome.isCancelled());
    assertFalse(outcome.changeEvent().isPresent());
    notifications.close();
    verify(git);
  }

  @Test
  void whenPolling_givenAlreadyKilled_shouldNotFetch() {
    final GitClient git = createMock(GitClient.class);
    replay(git);
    ctx.cancellation().kill();

    final PollOutcome outcome;
    try (NotificationSubscription notifications =
        ctx.notificationBus().subscribe(REMOTE)) {
      outcome = poller(git, Duration.ofSeconds(30))
          .pollUntilChanged(ctx, ABC, notifications);
    }

    assertTrue(outcome.isCancelled());
    assertEquals(ABC, outcome.lastSeen());
    verify(git);
  }

  @Test
  void whenCreating_givenZeroInterval_shouldFail() {
    final GitClient git = createMock(GitClient.class);

    assertThrows(IllegalArgumentException.class,
        () -> poller(git, Duration.ZERO));
  }
}
