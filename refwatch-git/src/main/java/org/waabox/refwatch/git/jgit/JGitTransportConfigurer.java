package org.waabox.refwatch.git.jgit;

import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import org.eclipse.jgit.api.TransportConfigCallback;
import org.eclipse.jgit.transport.SshTransport;
import org.eclipse.jgit.transport.Transport;

/**
 * Applies the SSH settings of a step to the transports JGit opens.
 *
 * <p>Non SSH transports are left untouched. For SSH transports:
 * <ul>
 *   <li>if a global session factory was installed and the step has SSH
 *       settings too, a {@link SshConfigurationClashException} is
 *       thrown;</li>
 *   <li>if no global session factory was installed and the step has SSH
 *       settings, a session factory is built from them;</li>
 *   <li>otherwise the JGit default session factory is used.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JGitTransportConfigurer implements TransportConfigCallback {

  /** The step's SSH settings, never null. */
  private final Map<String, String> ssh;

  /** Tells whether a global session factory was installed. */
  private final BooleanSupplier globalSessionFactoryInstalled;

  /**
   * Creates the configurer.
   *
   * @param theSsh                  the step's SSH settings, never null
   * @param theGlobalFactoryInstalled tells whether a global session factory
   *                                was installed, never null
   */
  JGitTransportConfigurer(final Map<String, String> theSsh,
      final BooleanSupplier theGlobalFactoryInstalled) {
    ssh = Objects.requireNonNull(theSsh, "ssh cannot be null");
    globalSessionFactoryInstalled = Objects.requireNonNull(
        theGlobalFactoryInstalled, "globalFactoryInstalled cannot be null");
  }

  /**
   * {@inheritDoc}
   *
   * @throws SshConfigurationClashException if SSH settings were supplied
   *     both globally and for the step
   */
  @Override
  public void configure(final Transport transport) {
    if (!(transport instanceof SshTransport sshTransport)) {
      return;
    }
    final boolean global = globalSessionFactoryInstalled.getAsBoolean();
    if (global && !ssh.isEmpty()) {
      throw new SshConfigurationClashException();
    }
    if (!global && !ssh.isEmpty()) {
      sshTransport.setSshSessionFactory(SshSessionFactories.forConfig(ssh));
    }
  }
}
