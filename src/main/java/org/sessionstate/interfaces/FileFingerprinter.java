package org.sessionstate.interfaces;

import org.sessionstate.model.Fingerprint;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Derives a comparable token from a file's modification state. Two tokens
 * taken from the same unchanged file are equal.
 */
public interface FileFingerprinter {

    /** @return token for the file, or empty if it can't be examined */
    Optional<Fingerprint> fingerprint(Path file);
}
