package org.waabox.refwatch;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.waabox.refwatch.git.Commit;
import org.waabox.refwatch.git.CommitReport;
import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.git.GitOperationException;
import org.waabox.refwatch.pipeline.CollectingResultChannel;
import org.waabox.refwatch.pipeline.DefaultStepContext;
import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepResult;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * Tests for {@link GitSteps}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GitStepsTest {

  private static final String REPO = "git@example.com:team/app.git";

  private static final CommitReport UTC_REPORT =
      new CommitReport(ZoneOffset.UTC);

  private static final Commit FIRST = new Commit("aaa111", "First",
      "Jane Doe <jane@example.com>", Instant.parse("2026-01-15T10:30:00Z"));

  private static final Commit SECOND = new Commit("bbb222", "Second",
      "John Roe <john@example.com>", Instant.parse("2026-01-16T08:00:00Z"));

  @TempDir
  Path tempDir;

  private final CollectingResultChannel out = new CollectingResultChannel();

  private final StepContext ctx = DefaultStepContext.builder()
      .resultChannel(out)
      .build();

  private Path clonedRepository() throws IOException {
    Files.createDirectories(tempDir.resolve(".git"));
    return tempDir;
  }

  @Test
  void whenListingChanges_givenNoWorkingDirectory_shouldFailWithoutGitCall() {
    // Arrange
    final GitClient git = createMock(GitClient.class);
    replay(git);

    // Act
    final StepResult result = new GitSteps(git, UTC_REPORT).listChanges(ctx,
        new ListChangesArgs(null, "aaa111", "bbb222"));

    // Assert
    assertEquals(StepStatus.FAILURE, result.status());
    assertEquals(GitSteps.NO_WORKING_DIRECTORY, result.get(StepResult.OUT));
    assertEquals(List.of(GitSteps.NO_WORKING_DIRECTORY), out.output());
    verify(git);
  }

  @Test
  void whenListingChanges_givenDirectoryWithoutGit_shouldFail() {
    final GitClient git = createMock(GitClient.class);
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).listChanges(ctx,
        new ListChangesArgs(tempDir, "aaa111", "bbb222"));

    assertEquals(StepStatus.FAILURE, result.status());
    assertEquals(GitSteps.NO_GIT_DIRECTORY, result.get(StepResult.OUT));
    verify(git);
  }

  @Test
  void whenListingChanges_givenBothRevisions_shouldPrintCommitsOldestFirst()
      throws Exception {
    // Arrange
    final Path cwd = clonedRepository();
    final GitClient git = createMock(GitClient.class);
    expect(git.commitsBetween(cwd, "aaa000", "bbb222"))
        .andReturn(List.of(FIRST, SECOND));
    replay(git);

    // Act
    final StepResult result = new GitSteps(git, UTC_REPORT).listChanges(ctx,
        new ListChangesArgs(cwd, "aaa000", "bbb222"));

    // Assert
    assertEquals(StepStatus.SUCCESS, result.status());
    assertEquals(List.of(FIRST, SECOND), result.get(GitSteps.COMMITS));
    assertEquals(List.of(
        "aaa111 | 2026-01-15 10:30:00 +0000 | Jane Doe <jane@example.com>"
            + " | First",
        "bbb222 | 2026-01-16 08:00:00 +0000 | John Roe <john@example.com>"
            + " | Second"), out.output());
    verify(git);
  }

  @Test
  void whenListingChanges_givenMissingOldRevision_shouldPrintHead()
      throws Exception {
    final Path cwd = clonedRepository();
    final GitClient git = createMock(GitClient.class);
    expect(git.singleCommit(cwd, "HEAD")).andReturn(SECOND);
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).listChanges(ctx,
        new ListChangesArgs(cwd, null, "bbb222"));

    assertEquals(StepStatus.SUCCESS, result.status());
    assertEquals("No old or current revision found.", out.output().get(0));
    assertEquals("Current HEAD:", out.output().get(1));
    assertTrue(out.output().get(2).startsWith("bbb222 | "));
    verify(git);
  }

  @Test
  void whenListingChanges_givenGitError_shouldFail() throws Exception {
    // Arrange
    final Path cwd = clonedRepository();
    final GitClient git = createMock(GitClient.class);
    expect(git.commitsBetween(cwd, "HEAD^{nonsense}", "bbb222"))
        .andThrow(new GitOperationException(
            "Invalid revision: HEAD^{nonsense}"));
    replay(git);

    // Act
    final StepResult result = new GitSteps(git, UTC_REPORT).listChanges(ctx,
        new ListChangesArgs(cwd, "HEAD^{nonsense}", "bbb222"));

    // Assert
    assertEquals(StepStatus.FAILURE, result.status());
    assertEquals("Failure: Could not list changes: Invalid revision:"
        + " HEAD^{nonsense}", result.get(StepResult.OUT));
    verify(git);
  }

  @Test
  void whenTagging_givenGitError_shouldFail() throws Exception {
    final Path cwd = clonedRepository();
    final GitClient git = createMock(GitClient.class);
    git.tag(cwd, "HEAD^{nonsense}", "v1.0");
    expectLastCall().andThrow(
        new GitOperationException("Invalid revision: HEAD^{nonsense}"));
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).tagVersion(ctx,
        cwd, REPO, "HEAD^{nonsense}", "v1.0", GitConfig.defaults());

    assertEquals(StepStatus.FAILURE, result.status());
    assertFalse(out.output().contains("Pushing changes..."));
    verify(git);
  }

  @Test
  void whenBuildingArgs_givenTriggerResult_shouldTakeBothRevisions() {
    final StepResult trigger = StepResult.success()
        .with(WaitForGit.REVISION, "bbb222")
        .with(WaitForGit.OLD_REVISION, "aaa111");

    final ListChangesArgs args = ListChangesArgs.fromTrigger(trigger, tempDir);

    assertEquals(tempDir, args.cwd());
    assertEquals("aaa111", args.oldRevision());
    assertEquals("bbb222", args.revision());
  }

  @Test
  void whenTagging_givenChecksFail_shouldReportTheFirstProblem()
      throws Exception {
    // Arrange
    final GitClient git = createMock(GitClient.class);
    replay(git);
    final GitSteps steps = new GitSteps(git, UTC_REPORT);
    final Path cwd = clonedRepository();

    // Act
    final StepResult noCwd = steps.tagVersion(ctx, null, "", null, "",
        GitConfig.defaults());
    final StepResult noTag = steps.tagVersion(ctx, cwd, "", null, "",
        GitConfig.defaults());
    final StepResult noRepo = steps.tagVersion(ctx, cwd, "", null, "v1.0",
        GitConfig.defaults());

    // Assert
    assertEquals(GitSteps.NO_WORKING_DIRECTORY, noCwd.get(StepResult.OUT));
    assertEquals("No tag name was given.", noTag.get(StepResult.OUT));
    assertEquals("No remote repository was given.",
        noRepo.get(StepResult.OUT));
    verify(git);
  }

  @Test
  void whenTagging_givenValidArguments_shouldTagHeadAndPush()
      throws Exception {
    // Arrange
    final Path cwd = clonedRepository();
    final GitClient git = createMock(GitClient.class);
    git.tag(cwd, "HEAD", "v1.0");
    expectLastCall();
    git.push(eq(cwd), eq(REPO), anyObject(GitConfig.class));
    expectLastCall();
    replay(git);

    // Act
    final StepResult result = new GitSteps(git, UTC_REPORT).tagVersion(ctx,
        cwd, REPO, null, "v1.0", GitConfig.defaults());

    // Assert
    assertEquals(StepStatus.SUCCESS, result.status());
    assertEquals(List.of("Tagging HEAD with v1.0...", "Pushing changes..."),
        out.output());
    verify(git);
  }

  @Test
  void whenCloning_givenMissingRef_shouldFail() {
    final Path cwd = tempDir.resolve("checkout");
    final GitClient git = createMock(GitClient.class);
    expect(git.cloneAndCheckout(eq(REPO), eq("release"), eq(cwd),
        anyObject(GitConfig.class))).andReturn(Optional.empty());
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).cloneRepository(
        ctx, REPO, "release", cwd, GitConfig.defaults());

    assertEquals(StepStatus.FAILURE, result.status());
    assertEquals("Failure: Could not find ref release",
        result.get(StepResult.OUT));
    verify(git);
  }

  @Test
  void whenCloning_givenNoRef_shouldCheckoutMaster() {
    final Path cwd = tempDir.resolve("checkout");
    final GitClient git = createMock(GitClient.class);
    expect(git.cloneAndCheckout(eq(REPO), eq("master"), eq(cwd),
        anyObject(GitConfig.class))).andReturn(Optional.of("origin/master"));
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).cloneRepository(
        ctx, REPO, null, cwd, GitConfig.defaults());

    assertEquals(StepStatus.SUCCESS, result.status());
    assertTrue(out.output().contains("Checked out origin/master"));
    verify(git);
  }

  @Test
  void whenCloning_givenUnreachableRemote_shouldFail() {
    final Path cwd = tempDir.resolve("checkout");
    final GitClient git = createMock(GitClient.class);
    expect(git.cloneAndCheckout(eq(REPO), eq("master"), eq(cwd),
        anyObject(GitConfig.class)))
        .andThrow(new GitOperationException("Could not clone " + REPO));
    replay(git);

    final StepResult result = new GitSteps(git, UTC_REPORT).cloneRepository(
        ctx, REPO, "master", cwd, GitConfig.defaults());

    assertEquals(StepStatus.FAILURE, result.status());
    verify(git);
  }
}
