package org.waabox.refwatch;

import java.nio.file.Path;
import java.util.Objects;

import org.waabox.refwatch.pipeline.StepResult;

/**
 * Arguments of {@link GitSteps#listChanges(
 * org.waabox.refwatch.pipeline.StepContext, ListChangesArgs)}.
 *
 * @param cwd         the working directory of a clone, may be null when
 *                    no clone step ran
 * @param oldRevision the revision before the change, may be null
 * @param revision    the revision after the change, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ListChangesArgs(Path cwd, String oldRevision,
    String revision) {

  /**
   * Takes the revisions from the result of a {@link WaitForGit} run.
   *
   * @param trigger the result of the trigger step, never null
   * @param cwd     the working directory of a clone, may be null
   * @return the arguments, never null
   */
  public static ListChangesArgs fromTrigger(final StepResult trigger,
      final Path cwd) {
    Objects.requireNonNull(trigger, "trigger cannot be null");
    return new ListChangesArgs(cwd,
        (String) trigger.get(WaitForGit.OLD_REVISION),
        (String) trigger.get(WaitForGit.REVISION));
  }
}
