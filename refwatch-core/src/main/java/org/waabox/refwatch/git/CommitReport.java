package org.waabox.refwatch.git;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Formats commits as report lines:
 * {@code <hash> | yyyy-MM-dd HH:mm:ss +HHMM | Name <email> | <message>}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CommitReport {

  /** The timestamp pattern. */
  private static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss xx";

  /** Separator between the columns. */
  private static final String SEPARATOR = " | ";

  /** The formatter, bound to the report's zone. */
  private final DateTimeFormatter formatter;

  /**
   * Creates a report printing timestamps in the given zone.
   *
   * @param zone the zone, never null
   */
  public CommitReport(final ZoneId zone) {
    Objects.requireNonNull(zone, "zone cannot be null");
    formatter = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN).withZone(zone);
  }

  /**
   * Creates a report printing timestamps in the system zone.
   *
   * @return the report, never null
   */
  public static CommitReport systemDefault() {
    return new CommitReport(ZoneId.systemDefault());
  }

  /**
   * Formats one commit.
   *
   * @param commit the commit, never null
   * @return the report line, never null
   */
  public String line(final Commit commit) {
    Objects.requireNonNull(commit, "commit cannot be null");
    return commit.hash()
        + SEPARATOR + formatter.format(commit.timestamp())
        + SEPARATOR + commit.author()
        + SEPARATOR + commit.message();
  }
}
