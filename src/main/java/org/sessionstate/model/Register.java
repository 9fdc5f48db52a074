package org.sessionstate.model;

import java.util.List;

/**
 * Register contents; order of files is significant.
 *
 * @param name  register name, see {@link #VALID_NAMES}
 * @param files paths in insertion order
 */
public record Register(char name, List<String> files) {

    /** Every name a register can have. */
    public static final String VALID_NAMES = "\"_abcdefghijklmnopqrstuvwxyz";

    public Register {
        files = List.copyOf(files);
    }

    public static boolean isValidName(char name) {
        return VALID_NAMES.indexOf(name) >= 0;
    }
}
