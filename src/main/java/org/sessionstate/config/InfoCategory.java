package org.sessionstate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Persistence categories. Each one enables a group of sections in the state
 * document; a section whose category is unset is neither written nor merged.
 */
public enum InfoCategory {
    OPTIONS("options"),
    FILETYPES("filetypes"),
    COMMANDS("commands"),
    MARKS("marks"),
    BOOKMARKS("bookmarks"),
    TUI("tui"),
    DHISTORY("dhistory"),
    STATE("state"),
    CS("cs"),
    SAVEDIRS("savedirs"),
    CHISTORY("chistory"),
    SHISTORY("shistory"),
    PHISTORY("phistory"),
    FHISTORY("fhistory"),
    DIRSTACK("dirstack"),
    REGISTERS("registers");

    private static final Logger log = LoggerFactory.getLogger(InfoCategory.class);

    private final String optionName;

    InfoCategory(String optionName) {
        this.optionName = optionName;
    }

    /** @return name of the category as it appears in the option value. */
    public String optionName() {
        return optionName;
    }

    /**
     * Parses comma-separated list of category names. Unknown names are
     * skipped.
     *
     * @param value option value, e.g. {@code "bookmarks,marks,dhistory"}
     * @return set of recognized categories (possibly empty)
     */
    public static Set<InfoCategory> parse(String value) {
        Set<InfoCategory> out = EnumSet.noneOf(InfoCategory.class);
        if (value == null || value.isBlank()) {
            return out;
        }
        for (String raw : value.split(",")) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            InfoCategory found = byName(name);
            if (found == null) {
                log.warn("Unknown persistence category '{}' ignored", name);
            } else {
                out.add(found);
            }
        }
        return out;
    }

    /** @return every category. */
    public static Set<InfoCategory> all() {
        return Collections.unmodifiableSet(EnumSet.allOf(InfoCategory.class));
    }

    /** Inverse of {@link #parse(String)}, in declaration order. */
    public static String format(Set<InfoCategory> categories) {
        StringBuilder sb = new StringBuilder();
        for (InfoCategory c : values()) {
            if (categories.contains(c)) {
                if (sb.length() > 0) sb.append(',');
                sb.append(c.optionName);
            }
        }
        return sb.toString();
    }

    private static InfoCategory byName(String name) {
        for (InfoCategory c : values()) {
            if (c.optionName.equals(name)) {
                return c;
            }
        }
        return null;
    }
}
