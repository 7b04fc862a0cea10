package org.waabox.refwatch.git;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.waabox.refwatch.RefPredicate;
import org.waabox.refwatch.RevisionSnapshot;

/**
 * The version control operations the pipeline steps rely on.
 *
 * <p>Every operation reports failures by throwing
 * {@link GitOperationException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface GitClient {

  /**
   * Lists the heads and tags of a remote repository.
   *
   * @param remote the remote repository uri, never null
   * @param refs   selects the refs to keep, never null
   * @param config the transport settings, never null
   * @return the snapshot of the matching refs, never null
   */
  RevisionSnapshot currentRevisions(String remote, RefPredicate refs,
      GitConfig config);

  /**
   * Clones a remote repository and checks out a ref, preferring the
   * remote tracking branch {@code origin/<ref>} over {@code <ref>}.
   *
   * @param remote the remote repository uri, never null
   * @param ref    the branch, tag or revision to check out, never null
   * @param cwd    the directory to clone into, never null
   * @param config the transport settings, never null
   * @return the name of the checked out ref, or empty if neither form of
   *         the ref exists in the clone
   */
  Optional<String> cloneAndCheckout(String remote, String ref, Path cwd,
      GitConfig config);

  /**
   * Lists the commits reachable from {@code to} but not from {@code from}.
   *
   * @param cwd  the working directory of a clone, never null
   * @param from the exclusive start revision, never null
   * @param to   the inclusive end revision, never null
   * @return the commits, oldest first, never null
   */
  List<Commit> commitsBetween(Path cwd, String from, String to);

  /**
   * Reads a single commit.
   *
   * @param cwd      the working directory of a clone, never null
   * @param revision the revision, e.g. {@code HEAD}, never null
   * @return the commit, never null
   */
  Commit singleCommit(Path cwd, String revision);

  /**
   * Creates a lightweight tag on a revision.
   *
   * @param cwd      the working directory of a clone, never null
   * @param revision the revision to tag, never null
   * @param tag      the tag name, never null
   */
  void tag(Path cwd, String revision, String tag);

  /**
   * Pushes all branches and tags to a remote.
   *
   * @param cwd    the working directory of a clone, never null
   * @param remote the remote repository uri, never null
   * @param config the transport settings, never null
   */
  void push(Path cwd, String remote, GitConfig config);
}
