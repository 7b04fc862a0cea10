package org.waabox.refwatch.history.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.refwatch.pipeline.StepHistory;
import org.waabox.refwatch.pipeline.StepResult;

/**
 * File system based implementation of {@link StepHistory}.
 *
 * <p>Each recorded run of a step is stored as JSON in its own file:
 * <pre>
 * {baseDir}/
 *   {stepId}/
 *     run-1.json
 *     run-2.json
 * </pre>
 *
 * <p>Writes are atomic: the JSON is written to a temporary file first and
 * then moved into place. Run numbers grow monotonically, the newest run is
 * the one with the highest number.
 *
 * <p>Thread safety: writes and reads are synchronized on the instance.
 * Two instances must not share the same step directory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemStepHistory implements StepHistory {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemStepHistory.class);

  /** The name pattern of a run file. */
  private static final Pattern RUN_FILE = Pattern.compile("run-(\\d+)\\.json");

  /** The directory of this step's runs, never null. */
  private final Path stepDir;

  /**
   * Creates a new history, creating the step directory if needed.
   *
   * @param baseDir the base directory of all step histories, never null
   * @param stepId  the step identifier, never null or empty
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemStepHistory(final Path baseDir, final String stepId) {
    Objects.requireNonNull(baseDir, "baseDir cannot be null");
    Objects.requireNonNull(stepId, "stepId cannot be null");
    if (stepId.isBlank()) {
      throw new IllegalArgumentException("stepId cannot be empty");
    }
    stepDir = baseDir.resolve(stepId);

    try {
      Files.createDirectories(stepDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create step directory: " + stepDir, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<StepResult> mostRecentResultWith(
      final String key) {
    Objects.requireNonNull(key, "key cannot be null");

    final List<Integer> runs = runNumbers();
    for (int i = runs.size() - 1; i >= 0; i--) {
      final StepResult result = read(runs.get(i));
      if (result.has(key)) {
        return Optional.of(result);
      }
    }
    return Optional.empty();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void record(final StepResult result) {
    Objects.requireNonNull(result, "result cannot be null");

    final List<Integer> runs = runNumbers();
    final int run = runs.isEmpty() ? 1 : runs.get(runs.size() - 1) + 1;
    final Path runFile = stepDir.resolve(fileName(run));

    try {
      final Path tempFile = stepDir.resolve(fileName(run) + ".tmp");
      Files.writeString(tempFile, StepResultCodec.serialize(result),
          StandardCharsets.UTF_8);
      Files.move(tempFile, runFile,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to record run " + run
          + " in " + stepDir, e);
    }
    log.debug("Recorded run {} of {} with status {}", run, stepDir,
        result.status());
  }

  /**
   * Lists the recorded run numbers in ascending order.
   *
   * @return the run numbers, never null
   */
  private List<Integer> runNumbers() {
    try (Stream<Path> files = Files.list(stepDir)) {
      return files
          .map(file -> RUN_FILE.matcher(file.getFileName().toString()))
          .filter(Matcher::matches)
          .map(matcher -> Integer.parseInt(matcher.group(1)))
          .sorted()
          .collect(Collectors.toList());
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to list runs in " + stepDir, e);
    }
  }

  /**
   * Reads one run.
   *
   * @param run the run number
   * @return the recorded result, never null
   */
  private StepResult read(final int run) {
    final Path runFile = stepDir.resolve(fileName(run));
    try {
      return StepResultCodec.deserialize(
          Files.readString(runFile, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read " + runFile, e);
    }
  }

  /**
   * Returns the file name of a run.
   *
   * @param run the run number
   * @return the file name, never null
   */
  private static String fileName(final int run) {
    return "run-" + run + ".json";
  }
}
