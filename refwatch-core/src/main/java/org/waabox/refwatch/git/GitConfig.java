package org.waabox.refwatch.git;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport settings for commands talking to a remote repository.
 *
 * <p>A pipeline defines base settings that each step can override with its
 * own through {@link #merge(GitConfig)}. Unset values fall back to the
 * defaults:
 * <ul>
 *   <li>Timeout: 20 seconds</li>
 *   <li>Credentials: none, the JGit default credentials provider is
 *       used</li>
 *   <li>SSH settings: none</li>
 * </ul>
 *
 * <p>Recognized SSH settings are {@value #SSH_DIRECTORY},
 * {@value #SSH_IDENTITY_FILE} and {@value #SSH_KNOWN_HOSTS}.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GitConfig {

  /** The SSH setting naming the directory holding keys and config. */
  public static final String SSH_DIRECTORY = "ssh-directory";

  /** The SSH setting naming a private key file. */
  public static final String SSH_IDENTITY_FILE = "identity-file";

  /** The SSH setting naming a known hosts file. */
  public static final String SSH_KNOWN_HOSTS = "known-hosts";

  /** The default transport timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

  /** The settings with nothing set. */
  private static final GitConfig DEFAULTS =
      new GitConfig(null, null, null, Map.of());

  /** The transport timeout, null if unset. */
  private final Duration timeout;

  /** The user name, null if unset. */
  private final String username;

  /** The password, null if unset. */
  private final String password;

  /** The SSH settings, never null. */
  private final Map<String, String> ssh;

  /** Private constructor; use {@link #builder()} or {@link #defaults()}.
   *
   * @param theTimeout  the timeout, may be null
   * @param theUsername the user name, may be null
   * @param thePassword the password, may be null
   * @param theSsh      the SSH settings, never null
   */
  private GitConfig(final Duration theTimeout, final String theUsername,
      final String thePassword, final Map<String, String> theSsh) {
    timeout = theTimeout;
    username = theUsername;
    password = thePassword;
    ssh = Collections.unmodifiableMap(new LinkedHashMap<>(theSsh));
  }

  /**
   * Returns the settings with nothing set.
   *
   * @return the default settings, never null
   */
  public static GitConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns these settings overridden by the values set in
   * {@code overrides}. SSH settings are merged key by key.
   *
   * @param overrides the overriding settings, never null
   * @return the merged settings, never null
   */
  public GitConfig merge(final GitConfig overrides) {
    Objects.requireNonNull(overrides, "overrides cannot be null");

    final Map<String, String> mergedSsh = new LinkedHashMap<>(ssh);
    mergedSsh.putAll(overrides.ssh);

    final boolean overrideCredentials = overrides.username != null;

    return new GitConfig(
        overrides.timeout != null ? overrides.timeout : timeout,
        overrideCredentials ? overrides.username : username,
        overrideCredentials ? overrides.password : password,
        mergedSsh);
  }

  /**
   * Returns the transport timeout.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout != null ? timeout : DEFAULT_TIMEOUT;
  }

  /**
   * Returns the user name for authenticated transports.
   *
   * @return the user name, empty if no credentials were set
   */
  public Optional<String> username() {
    return Optional.ofNullable(username);
  }

  /**
   * Returns the password that goes with {@link #username()}.
   *
   * @return the password, empty if no credentials were set
   */
  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  /**
   * Returns the SSH settings.
   *
   * @return an unmodifiable map of SSH settings, never null
   */
  public Map<String, String> ssh() {
    return ssh;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GitConfig that)) {
      return false;
    }
    return Objects.equals(timeout, that.timeout)
        && Objects.equals(username, that.username)
        && Objects.equals(password, that.password)
        && ssh.equals(that.ssh);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timeout, username, password, ssh);
  }

  @Override
  public String toString() {
    return "GitConfig{timeout=" + timeout()
        + ", username=" + username
        + ", ssh=" + ssh + "}";
  }

  /** Fluent builder for {@link GitConfig}. */
  public static final class Builder {

    /** The transport timeout. */
    private Duration timeout;

    /** The user name. */
    private String username;

    /** The password. */
    private String password;

    /** The SSH settings. */
    private final Map<String, String> ssh = new LinkedHashMap<>();

    /** Creates a builder; use {@link GitConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the transport timeout.
     *
     * @param theTimeout the timeout, must be positive
     * @return this builder, never null
     */
    public Builder timeout(final Duration theTimeout) {
      Objects.requireNonNull(theTimeout, "timeout cannot be null");
      if (theTimeout.isNegative() || theTimeout.isZero()) {
        throw new IllegalArgumentException(
            "timeout must be positive, got: " + theTimeout);
      }
      timeout = theTimeout;
      return this;
    }

    /**
     * Sets user name and password credentials.
     *
     * @param theUsername the user name, never null
     * @param thePassword the password, never null
     * @return this builder, never null
     */
    public Builder credentials(final String theUsername,
        final String thePassword) {
      username = Objects.requireNonNull(theUsername,
          "username cannot be null");
      password = Objects.requireNonNull(thePassword,
          "password cannot be null");
      return this;
    }

    /**
     * Sets an SSH setting.
     *
     * @param key   the setting, e.g. {@value GitConfig#SSH_IDENTITY_FILE}
     * @param value the value, never null
     * @return this builder, never null
     */
    public Builder ssh(final String key, final String value) {
      Objects.requireNonNull(key, "key cannot be null");
      Objects.requireNonNull(value, "value cannot be null");
      ssh.put(key, value);
      return this;
    }

    /**
     * Builds the settings.
     *
     * @return the settings, never null
     */
    public GitConfig build() {
      return new GitConfig(timeout, username, password, ssh);
    }
  }
}
