package org.sessionstate.model;

import java.nio.file.attribute.FileTime;

/**
 * Modification state of a file. Compared with {@code equals}; the values are
 * opaque to callers.
 *
 * @param modified last modification time
 * @param size     size in bytes
 * @param fileKey  file system identity (inode), may be {@code null}
 */
public record Fingerprint(FileTime modified, long size, Object fileKey) {}
