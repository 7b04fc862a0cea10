package org.waabox.refwatch.notify.http;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.refwatch.notify.NotificationBus;
import org.waabox.refwatch.notify.NotificationEvent;

/**
 * HTTP endpoint that lets a git host tell waiting triggers that a remote
 * changed, so they poll right away instead of at the next interval.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer}. A
 * {@code POST <path>?remote=<uri>} publishes a {@link NotificationEvent}
 * on the shared {@link NotificationBus} and answers 204; an empty
 * {@code remote} value is published as is. A missing {@code remote}
 * parameter answers 400, any other method 405.
 *
 * <p>Typical usage:
 * <pre>{@code
 * NotifyEndpoint endpoint = new NotifyEndpoint(
 *     NotifyEndpointConfig.create(8080), bus);
 * endpoint.start();
 * // ... on shutdown
 * endpoint.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NotifyEndpoint {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NotifyEndpoint.class);

  /** HTTP 204 No Content status code. */
  private static final int HTTP_NO_CONTENT = 204;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The query parameter naming the remote. */
  private static final String REMOTE_PARAMETER = "remote";

  /** The body of the response to a request without remote. */
  static final String MISSING_REMOTE_MESSAGE = "Mandatory parameter 'remote'"
      + " not found. Example: <host>/notify-git?remote=git@github.com:"
      + "flosell/testrepo";

  /** The endpoint configuration, never null. */
  private final NotifyEndpointConfig config;

  /** The bus notifications are published on, never null. */
  private final NotificationBus bus;

  /** The HTTP server, null until started. */
  private HttpServer server;

  /**
   * Creates a new endpoint.
   *
   * @param theConfig the endpoint configuration, never null
   * @param theBus    the bus to publish on, never null
   */
  public NotifyEndpoint(final NotifyEndpointConfig theConfig,
      final NotificationBus theBus) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    bus = Objects.requireNonNull(theBus, "bus cannot be null");
  }

  /**
   * Starts listening.
   *
   * @throws IllegalStateException if the server cannot be bound
   */
  public void start() {
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
      server.createContext(config.path(), this::handleNotify);
      server.start();
      log.info("Notify endpoint started on port {} at path {}", port(),
          config.path());
    } catch (final IOException e) {
      throw new IllegalStateException(
          "Failed to start HTTP server on port " + config.port(), e);
    }
  }

  /** Stops listening, if started. */
  public void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      server = null;
      log.info("Notify endpoint stopped");
    }
  }

  /**
   * Returns the port the endpoint is bound to.
   *
   * @return the bound port
   * @throws IllegalStateException if the endpoint is not started
   */
  public int port() {
    if (server == null) {
      throw new IllegalStateException("Notify endpoint is not started");
    }
    return server.getAddress().getPort();
  }

  /**
   * Handles a request on the notification path.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if sending the response fails
   */
  private void handleNotify(final HttpExchange exchange) throws IOException {
    try {
      if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
        sendResponse(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
        return;
      }

      final Optional<String> remote =
          queryParameter(exchange.getRequestURI().getRawQuery(),
              REMOTE_PARAMETER);
      if (remote.isEmpty()) {
        log.debug("Rejected notification without remote");
        sendResponse(exchange, HTTP_BAD_REQUEST, MISSING_REMOTE_MESSAGE);
        return;
      }

      log.debug("Received notification for {}", remote.get());
      bus.publish(new NotificationEvent(remote.get()));
      exchange.sendResponseHeaders(HTTP_NO_CONTENT, -1);
    } finally {
      exchange.close();
    }
  }

  /**
   * Finds a parameter in a raw query string.
   *
   * <p>A parameter given without a value, or with an empty one, is present
   * with the empty string as its value.
   *
   * @param rawQuery the undecoded query, may be null
   * @param name     the parameter name, never null
   * @return the decoded value of the first occurrence, empty if absent
   */
  static Optional<String> queryParameter(final String rawQuery,
      final String name) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return Optional.empty();
    }
    for (final String pair : rawQuery.split("&")) {
      final int eq = pair.indexOf('=');
      final String key = eq < 0 ? pair : pair.substring(0, eq);
      if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
        return Optional.of(eq < 0 ? "" : URLDecoder.decode(
            pair.substring(eq + 1), StandardCharsets.UTF_8));
      }
    }
    return Optional.empty();
  }

  /**
   * Sends a plain text response.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param body       the response body text
   * @throws IOException if writing the response fails
   */
  private void sendResponse(final HttpExchange exchange,
      final int statusCode, final String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type",
        "text/plain; charset=utf-8");
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
