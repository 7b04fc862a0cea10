package org.waabox.refwatch.git.jgit;

import org.waabox.refwatch.RefWatchException;

/**
 * Thrown when an SSH transport is engaged while SSH settings were supplied
 * both globally, through
 * {@link JGitClient#installGlobalSshSessionFactory(java.util.Map)}, and in
 * the step's {@link org.waabox.refwatch.git.GitConfig}.
 *
 * <p>Picking one of them silently could authenticate with the wrong
 * credentials, so this is fatal.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SshConfigurationClashException extends RefWatchException {

  private static final long serialVersionUID = 1L;

  /** The message explaining how to resolve the clash. */
  static final String MESSAGE = String.join("\n",
      "",
      "***** SSH CONFIGURATION CLASHES! *****",
      "You likely called installGlobalSshSessionFactory() and supplied ssh"
          + " settings in the GitConfig at the same time.",
      "Move all settings from installGlobalSshSessionFactory() to the"
          + " GitConfig to resolve this error.",
      "");

  /** Creates the exception with the explanatory message. */
  public SshConfigurationClashException() {
    super(MESSAGE);
  }
}
