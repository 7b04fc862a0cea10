package org.waabox.refwatch;

/**
 * Reports that a watched ref of a remote moved.
 *
 * @param changedRef   the name of the ref that moved, never null
 * @param revision     the revision id it points to now, never null
 * @param oldRevision  the revision id it pointed to before, null on the
 *                     first observation of the ref
 * @param remote       the remote repository uri, never null
 * @param allRevisions the full snapshot the change was found in, which
 *                     becomes the next last seen snapshot, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(
    String changedRef,
    String revision,
    String oldRevision,
    String remote,
    RevisionSnapshot allRevisions
) {
}
