package org.sessionstate.impl;

import org.sessionstate.interfaces.FileFingerprinter;
import org.sessionstate.model.Fingerprint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Fingerprints files by modification time, size and file key. The file key
 * changes on every atomic replace, which catches writes that land within
 * the modification time resolution.
 */
public final class ModificationFingerprinter implements FileFingerprinter {

    @Override
    public Optional<Fingerprint> fingerprint(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return Optional.of(new Fingerprint(attrs.lastModifiedTime(), attrs.size(), attrs.fileKey()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
