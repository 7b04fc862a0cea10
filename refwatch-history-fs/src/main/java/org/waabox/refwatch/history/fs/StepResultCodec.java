package org.waabox.refwatch.history.fs;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.refwatch.GitSteps;
import org.waabox.refwatch.LastSeenRevisions;
import org.waabox.refwatch.RevisionSnapshot;
import org.waabox.refwatch.WaitForGit;
import org.waabox.refwatch.git.Commit;
import org.waabox.refwatch.pipeline.StepResult;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * JSON codec for {@link StepResult}, using the Jackson tree model.
 *
 * <p>The format is:
 * <pre>{@code
 * {
 *   "status": "SUCCESS",
 *   "details": {
 *     "changed-ref": "refs/heads/master",
 *     "_git-last-seen-revisions": {"refs/heads/master": "abc123"}
 *   }
 * }
 * }</pre>
 *
 * <p>A {@link RevisionSnapshot} is written as an object of ref to revision,
 * a {@link Commit} as an object with an ISO-8601 timestamp. On the way back
 * the snapshot keys and the commit list are restored to their types; any
 * other detail comes back as plain strings, numbers, booleans, lists and
 * maps.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StepResultCodec {

  /** Shared ObjectMapper instance, thread-safe after configuration. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private StepResultCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a step result to JSON.
   *
   * @param result the result, never null
   * @return the JSON text, never null
   * @throws IllegalArgumentException if a detail value cannot be encoded
   */
  public static String serialize(final StepResult result) {
    Objects.requireNonNull(result, "result cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("status", result.status().name());
    final ObjectNode details = node.putObject("details");
    result.details().forEach((key, value) ->
        details.set(key, encode(value)));

    return node.toString();
  }

  /**
   * Deserializes a step result from JSON.
   *
   * @param json the JSON text, never null
   * @return the result, never null
   * @throws IllegalArgumentException if the JSON is malformed
   */
  public static StepResult deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      final StepStatus status =
          StepStatus.valueOf(requireField(node, "status").asText());

      final Map<String, Object> details = new LinkedHashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields =
          requireField(node, "details").fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        details.put(field.getKey(), decode(field.getKey(), field.getValue()));
      }
      return new StepResult(status, details);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize StepResult from JSON: " + json, e);
    }
  }

  /**
   * Encodes one detail value.
   *
   * @param value the value, may be null
   * @return the JSON node, never null
   */
  private static JsonNode encode(final Object value) {
    if (value == null) {
      return MAPPER.nullNode();
    }
    if (value instanceof RevisionSnapshot snapshot) {
      final ObjectNode node = MAPPER.createObjectNode();
      snapshot.revisions().forEach(node::put);
      return node;
    }
    if (value instanceof Commit commit) {
      final ObjectNode node = MAPPER.createObjectNode();
      node.put("hash", commit.hash());
      node.put("message", commit.message());
      node.put("author", commit.author());
      node.put("timestamp", commit.timestamp().toString());
      return node;
    }
    if (value instanceof Iterable<?> items) {
      final ArrayNode node = MAPPER.createArrayNode();
      items.forEach(item -> node.add(encode(item)));
      return node;
    }
    if (value instanceof Map<?, ?> map) {
      final ObjectNode node = MAPPER.createObjectNode();
      map.forEach((k, v) -> node.set(String.valueOf(k), encode(v)));
      return node;
    }
    if (value instanceof String || value instanceof Number
        || value instanceof Boolean) {
      return MAPPER.valueToTree(value);
    }
    throw new IllegalArgumentException("Cannot encode detail of type "
        + value.getClass().getName());
  }

  /**
   * Decodes one detail value.
   *
   * @param key  the detail key, never null
   * @param node the JSON node, never null
   * @return the value, may be null
   */
  private static Object decode(final String key, final JsonNode node) {
    if (node.isNull()) {
      return null;
    }
    if (LastSeenRevisions.KEY.equals(key)
        || WaitForGit.ALL_REVISIONS.equals(key)) {
      return toSnapshot(node);
    }
    if (GitSteps.COMMITS.equals(key) && node.isArray()) {
      final List<Commit> commits = new ArrayList<>();
      node.forEach(commit -> commits.add(toCommit(commit)));
      return commits;
    }
    return plain(node);
  }

  /**
   * Decodes a JSON node into plain Java values.
   *
   * @param node the JSON node, never null
   * @return the value, may be null
   */
  private static Object plain(final JsonNode node) {
    if (node.isNull()) {
      return null;
    }
    if (node.isObject()) {
      final Map<String, Object> map = new LinkedHashMap<>();
      node.fields().forEachRemaining(field ->
          map.put(field.getKey(), plain(field.getValue())));
      return map;
    }
    if (node.isArray()) {
      final List<Object> list = new ArrayList<>();
      node.forEach(item -> list.add(plain(item)));
      return list;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToInt() ? (Object) node.intValue()
          : (Object) node.longValue();
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    return node.asText();
  }

  /**
   * Decodes a snapshot object.
   *
   * @param node the JSON object, never null
   * @return the snapshot, never null
   */
  private static RevisionSnapshot toSnapshot(final JsonNode node) {
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected an object of revisions: "
          + node);
    }
    final Map<String, String> revisions = new LinkedHashMap<>();
    node.fields().forEachRemaining(field ->
        revisions.put(field.getKey(), field.getValue().asText()));
    return RevisionSnapshot.of(revisions);
  }

  /**
   * Decodes a commit object.
   *
   * @param node the JSON object, never null
   * @return the commit, never null
   */
  private static Commit toCommit(final JsonNode node) {
    return new Commit(
        requireField(node, "hash").asText(),
        requireField(node, "message").asText(),
        requireField(node, "author").asText(),
        Instant.parse(requireField(node, "timestamp").asText()));
  }

  /**
   * Gets a required field from a JSON node.
   *
   * @param node  the JSON node, never null
   * @param field the field name, never null
   * @return the field value, never null
   * @throws IllegalArgumentException if the field is missing or null
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
