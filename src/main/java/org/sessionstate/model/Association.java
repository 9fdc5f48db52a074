package org.sessionstate.model;

/**
 * A program or viewer associated with files matched by an expression.
 *
 * @param matchers    matcher expression, e.g. {@code {*.jpg,*.png}}
 * @param command     command line, without description
 * @param description human-readable description, empty if none
 * @param builtin     whether the entry is synthesized by the application
 */
public record Association(String matchers, String command, String description, boolean builtin) {

    public Association {
        description = description == null ? "" : description;
    }

    public static Association of(String matchers, String command) {
        return new Association(matchers, command, "", false);
    }
}
