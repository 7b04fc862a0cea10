package org.waabox.refwatch.notify.http;

/**
 * Configuration for the {@link NotifyEndpoint}.
 *
 * <p>Instances are created through the static factory methods:
 * <pre>{@code
 * NotifyEndpointConfig config = NotifyEndpointConfig.create(8080);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotifyEndpointConfig {

  /** The default path of the notification endpoint. */
  private static final String DEFAULT_PATH = "/notify-git";

  /** The port to listen on, 0 picks a free one. */
  private final int port;

  /** The path the endpoint is mounted on. */
  private final String path;

  /**
   * Creates a new configuration.
   *
   * @param port the port to listen on
   * @param path the path of the endpoint
   */
  private NotifyEndpointConfig(final int port, final String path) {
    this.port = port;
    this.path = path;
  }

  /**
   * Creates a configuration with the default path {@code /notify-git}.
   *
   * @param port the port to listen on, 0 picks a free one
   * @return a new configuration, never null
   * @throws IllegalArgumentException if the port is out of range
   */
  public static NotifyEndpointConfig create(final int port) {
    return create(port, DEFAULT_PATH);
  }

  /**
   * Creates a configuration with a custom path.
   *
   * @param port the port to listen on, 0 picks a free one
   * @param path the endpoint path, must start with '/'
   * @return a new configuration, never null
   * @throws IllegalArgumentException if the port is out of range or the
   *     path does not start with '/'
   */
  public static NotifyEndpointConfig create(final int port,
      final String path) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/': " + path);
    }
    return new NotifyEndpointConfig(port, path);
  }

  /**
   * Returns the configured port.
   *
   * @return the port, 0 means any free port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the endpoint path.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }
}
