package org.waabox.refwatch.git;

import java.time.Instant;

/**
 * A commit as shown in step output.
 *
 * @param hash      the commit id, never null
 * @param message   the first line of the commit message, never null
 * @param author    the author as {@code Name <email>}, never null
 * @param timestamp the commit time, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Commit(String hash, String message, String author,
    Instant timestamp) {
}
