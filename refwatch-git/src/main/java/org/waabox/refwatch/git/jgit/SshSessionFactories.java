package org.waabox.refwatch.git.jgit;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.eclipse.jgit.transport.SshSessionFactory;
import org.eclipse.jgit.transport.sshd.SshdSessionFactoryBuilder;
import org.eclipse.jgit.util.FS;

import org.waabox.refwatch.git.GitConfig;

/**
 * Builds Apache MINA sshd based session factories from SSH settings.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SshSessionFactories {

  /** Private constructor to prevent instantiation. */
  private SshSessionFactories() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Builds a session factory for the given SSH settings.
   *
   * @param ssh the settings, see {@link GitConfig} for the keys, never null
   * @return the session factory, never null
   */
  static SshSessionFactory forConfig(final Map<String, String> ssh) {
    final SshdSessionFactoryBuilder builder = new SshdSessionFactoryBuilder()
        .setHomeDirectory(FS.DETECTED.userHome());

    final String sshDirectory = ssh.get(GitConfig.SSH_DIRECTORY);
    if (sshDirectory != null) {
      builder.setSshDirectory(new File(sshDirectory));
    }

    final String identityFile = ssh.get(GitConfig.SSH_IDENTITY_FILE);
    if (identityFile != null) {
      builder.setDefaultIdentities(dir -> List.of(Path.of(identityFile)));
    }

    final String knownHosts = ssh.get(GitConfig.SSH_KNOWN_HOSTS);
    if (knownHosts != null) {
      builder.setDefaultKnownHostsFiles(dir -> List.of(Path.of(knownHosts)));
    }

    return builder.build(null);
  }
}
