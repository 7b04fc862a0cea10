package org.waabox.refwatch;

/**
 * The single ref selected as changed between two snapshots.
 *
 * @param changedRef  the name of the ref that moved, never null
 * @param revision    the revision id it points to now, never null
 * @param oldRevision the revision id it pointed to before, null when the
 *                    ref was not part of the previous snapshot
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RefChange(String changedRef, String revision,
    String oldRevision) {
}
