package org.sessionstate.model;

public enum SplitOrientation {
    VERTICAL("v"),
    HORIZONTAL("h");

    private final String code;

    SplitOrientation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Anything that doesn't start with {@code v} is horizontal. */
    public static SplitOrientation ofCode(String code) {
        return code != null && code.startsWith("v") ? VERTICAL : HORIZONTAL;
    }
}
