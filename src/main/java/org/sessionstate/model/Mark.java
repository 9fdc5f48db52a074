package org.sessionstate.model;

/**
 * A named position in the file system.
 *
 * @param name      single character name, see {@link #isValidName(char)}
 * @param dir       directory of the mark
 * @param file      file inside {@code dir}
 * @param timestamp seconds since epoch of the last update
 */
public record Mark(char name, String dir, String file, long timestamp) {

    /** Every name a mark can have. */
    public static final String VALID_NAMES =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789<>'";

    /** Marks managed by the application itself; they are never persisted. */
    public static final String SPECIAL_NAMES = "<>'";

    public static boolean isValidName(char name) {
        return VALID_NAMES.indexOf(name) >= 0;
    }

    public static boolean isSpecial(char name) {
        return SPECIAL_NAMES.indexOf(name) >= 0;
    }
}
