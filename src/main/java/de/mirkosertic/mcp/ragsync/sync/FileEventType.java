package de.mirkosertic.mcp.ragsync.sync;

/**
 * Kind of a normalized file system change.
 */
public enum FileEventType {
    CREATED,
    MODIFIED,
    DELETED;

    /**
     * Combine a pending event with a newer one for the same path.
     * A create followed by modifications stays a create, a delete always wins,
     * and a delete followed by a create means the file was replaced.
     */
    public FileEventType mergeWith(final FileEventType newer) {
        if (newer == DELETED) {
            return DELETED;
        }
        if (this == DELETED) {
            return newer == CREATED ? MODIFIED : newer;
        }
        if (this == CREATED) {
            return CREATED;
        }
        return newer;
    }
}
