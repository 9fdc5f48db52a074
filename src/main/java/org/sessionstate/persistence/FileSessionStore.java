package org.sessionstate.persistence;

import com.google.gson.JsonObject;
import org.sessionstate.SessionState;
import org.sessionstate.config.StateConfig;
import org.sessionstate.document.DocumentCodec;
import org.sessionstate.impl.ModificationFingerprinter;
import org.sessionstate.interfaces.FileFingerprinter;
import org.sessionstate.interfaces.SessionStore;
import org.sessionstate.legacy.LegacyInfoReader;
import org.sessionstate.load.LoadContext;
import org.sessionstate.load.StateLoader;
import org.sessionstate.merge.MergeEngine;
import org.sessionstate.model.Fingerprint;
import org.sessionstate.serialize.StateSerializer;
import org.sessionstate.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * FileSessionStore keeps session state in the structured state file and
 * shares it with other instances without locking.
 * <p>
 * Load prefers the structured file and falls back to the legacy one. The
 * fingerprint of the structured file is remembered; if it differs at save
 * time, some other instance wrote the file in between and its state is
 * merged into ours before writing.
 * <p>
 * Saving goes through {@code <structured file>_<pid>}:
 * <ol>
 *     <li>the on-disk file is copied to the temporary file (skipping the save if that fails);</li>
 *     <li>the merged state is written over the copy;</li>
 *     <li>the copy is renamed over the original.</li>
 * </ol>
 * Persistence failures are logged and never propagate; a failed save
 * leaves both the live state and the original file untouched.
 */
public final class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    private final SessionState session;
    private final StateConfig config;
    private final FileFingerprinter fingerprinter;
    private final LegacyInfoReader legacyReader;
    private final StateLoader loader = new StateLoader();
    private final StateSerializer serializer = new StateSerializer();
    private final MergeEngine mergeEngine = new MergeEngine();

    // Fingerprint of the state file as of the last load or save, empty if unknown.
    private Optional<Fingerprint> baseline = Optional.empty();

    /**
     * @param session       live state to load into and save from
     * @param fingerprinter detects changes made by other instances
     * @param clock         timestamps legacy marks that have none
     */
    public FileSessionStore(SessionState session, FileFingerprinter fingerprinter, Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.config = session.config();
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
        this.legacyReader = new LegacyInfoReader(config.trashDir(), clock);
    }

    public FileSessionStore(SessionState session) {
        this(session, new ModificationFingerprinter(), Clock.systemUTC());
    }

    @Override
    public boolean load(boolean reread) {
        Path structured = config.structuredFile();

        Optional<JsonObject> state = DocumentCodec.parse(structured);
        if (state.isEmpty()) {
            log.debug("No usable {}, trying legacy {}", structured, config.legacyFile());
            state = legacyReader.read(config.legacyFile());
        }
        if (state.isEmpty()) {
            log.info("No saved state found in {}", config.stateDir());
            return false;
        }

        loader.load(state.get(), new LoadContext(session, reread));

        baseline = fingerprinter.fingerprint(structured);
        session.dirStack().freeze();
        return true;
    }

    @Override
    public boolean save() {
        Path target = config.structuredFile();
        Path tmp = AtomicFiles.processUniqueSibling(target);

        try {
            Files.createDirectories(config.stateDir());
        } catch (IOException e) {
            log.error("Cannot create state directory {}: {}", config.stateDir(), e.getMessage());
            return false;
        }

        if (Files.isReadable(target)) {
            try {
                AtomicFiles.copy(target, tmp);
            } catch (IOException e) {
                log.error("Cannot copy {} to {}, state not saved: {}", target, tmp, e.getMessage());
                AtomicFiles.deleteQuietly(tmp);
                return false;
            }
        } else {
            // a leftover of a crashed save must not be taken for the other instance's state
            AtomicFiles.deleteQuietly(tmp);
        }

        Optional<Fingerprint> now = fingerprinter.fingerprint(target);
        boolean changed = now.isEmpty() || baseline.isEmpty() || !now.equals(baseline);

        JsonObject current = serializer.serialize(session);
        if (changed) {
            // tmp holds the other instance's state or doesn't exist at all
            DocumentCodec.parse(tmp).ifPresent(admixture -> {
                log.debug("{} changed since last load, merging", target);
                mergeEngine.merge(current, admixture, session);
            });
        }

        try {
            DocumentCodec.write(current, tmp);
        } catch (IOException e) {
            log.error("Error storing state to {}: {}", tmp, e.getMessage());
            AtomicFiles.deleteQuietly(tmp);
            return false;
        }
        baseline = fingerprinter.fingerprint(tmp);

        try {
            AtomicFiles.replace(tmp, target);
        } catch (IOException e) {
            log.error("Can't replace {} with its temporary copy: {}", target, e.getMessage());
            AtomicFiles.deleteQuietly(tmp);
            return false;
        }
        return true;
    }
}
