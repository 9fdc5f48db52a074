package org.sessionstate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable configuration of the state store.
 * <p>
 * Values come from the classpath resource {@code sessionstate.properties},
 * optionally overridden by a properties file and then by
 * {@code -Dsessionstate.<key>} system properties.
 *
 * @param stateDir           directory holding both state files
 * @param trashDir           trash directory used to resolve relative legacy trash paths
 * @param historyLength      initial capacity of every history list
 * @param categories         persistence categories enabled for this instance
 * @param structuredFileName name of the JSON state file inside {@code stateDir}
 * @param legacyFileName     name of the legacy line-oriented file inside {@code stateDir}
 */
public record StateConfig(Path stateDir,
                          Path trashDir,
                          int historyLength,
                          Set<InfoCategory> categories,
                          String structuredFileName,
                          String legacyFileName) {

    private static final Logger log = LoggerFactory.getLogger(StateConfig.class);

    private static final String DEFAULTS_RESOURCE = "/sessionstate.properties";
    private static final String SYSTEM_PREFIX = "sessionstate.";

    public StateConfig {
        Objects.requireNonNull(stateDir, "stateDir");
        Objects.requireNonNull(trashDir, "trashDir");
        Objects.requireNonNull(structuredFileName, "structuredFileName");
        Objects.requireNonNull(legacyFileName, "legacyFileName");
        historyLength = Math.max(0, historyLength);
        categories = categories == null || categories.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(InfoCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(categories));
    }

    /**
     * Configuration rooted at {@code stateDir} with every category enabled.
     * Mostly useful for tests and embedding.
     */
    public static StateConfig forDirectory(Path stateDir) {
        return new StateConfig(stateDir, stateDir.resolve("Trash"), 15,
                InfoCategory.all(), "vifminfo.json", "vifminfo");
    }

    /** @return path of the structured (JSON) state file. */
    public Path structuredFile() {
        return stateDir.resolve(structuredFileName);
    }

    /** @return path of the legacy state file. */
    public Path legacyFile() {
        return stateDir.resolve(legacyFileName);
    }

    /** @return whether the category is enabled. */
    public boolean has(InfoCategory category) {
        return categories.contains(category);
    }

    public StateConfig withCategories(Set<InfoCategory> newCategories) {
        return new StateConfig(stateDir, trashDir, historyLength, newCategories,
                structuredFileName, legacyFileName);
    }

    public StateConfig withHistoryLength(int newLength) {
        return new StateConfig(stateDir, trashDir, newLength, categories,
                structuredFileName, legacyFileName);
    }

    public StateConfig withTrashDir(Path newTrashDir) {
        return new StateConfig(stateDir, newTrashDir, historyLength, categories,
                structuredFileName, legacyFileName);
    }

    /**
     * Loads configuration from defaults, the optional override file and system
     * properties.
     *
     * @param overrides properties file to apply on top of defaults, may be {@code null}
     * @return resolved configuration
     */
    public static StateConfig load(Path overrides) {
        Properties props = new Properties();
        try (InputStream in = StateConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Cannot read default configuration: {}", e.getMessage());
        }

        if (overrides != null && Files.isReadable(overrides)) {
            try (Reader r = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                props.load(r);
            } catch (IOException e) {
                log.warn("Cannot read configuration from {}: {}", overrides, e.getMessage());
            }
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }

        return fromProperties(props);
    }

    /** Builds configuration from already-collected properties. */
    public static StateConfig fromProperties(Properties props) {
        Path stateDir = Paths.get(expand(props.getProperty("state.dir", "${user.home}/.vifm")));
        String trash = props.getProperty("trash.dir");
        Path trashDir = trash == null ? stateDir.resolve("Trash") : Paths.get(expand(trash));
        int historyLength = parseInt(props.getProperty("history.length"), 15);
        Set<InfoCategory> categories = InfoCategory.parse(props.getProperty("categories", "bookmarks"));
        return new StateConfig(stateDir, trashDir, historyLength, categories,
                props.getProperty("structured.file", "vifminfo.json"),
                props.getProperty("legacy.file", "vifminfo"));
    }

    private static String expand(String value) {
        return value.replace("${user.home}", System.getProperty("user.home", "."));
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid history.length '{}', using {}", value, fallback);
            return fallback;
        }
    }
}
