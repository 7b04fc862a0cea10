package org.waabox.refwatch.pipeline;

/**
 * The status of a pipeline step, as reported to the host pipeline.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum StepStatus {

  /** The step completed successfully. */
  SUCCESS,

  /** The step completed with a user visible failure. */
  FAILURE,

  /** The step is running and waiting for something to happen. */
  WAITING,

  /** The step was cancelled through its kill switch. */
  KILLED
}
