package org.sessionstate.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File primitives used by the save path. Callers decide how failures are
 * reported; everything except {@link #deleteQuietly(Path)} throws.
 */
public final class AtomicFiles {

    private AtomicFiles() {}

    /** Copies {@code src} over {@code dst}, keeping the modification time. */
    public static void copy(Path src, Path dst) throws IOException {
        Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    /**
     * Renames {@code tmp} over {@code target}. Falls back to a plain replacing
     * move on file systems without atomic rename.
     */
    public static void replace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** @return whether the file was removed */
    public static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            return false;
        }
    }

    /** @return path of {@code file} suffixed with {@code _<pid>} of this process */
    public static Path processUniqueSibling(Path file) {
        return file.resolveSibling(file.getFileName() + "_" + ProcessHandle.current().pid());
    }
}
