package org.sessionstate.model;

/** The two fixed panes; index matches position in the document. */
public enum PaneSide {
    LEFT,
    RIGHT;

    public int index() {
        return ordinal();
    }

    public PaneSide other() {
        return this == LEFT ? RIGHT : LEFT;
    }

    public static PaneSide ofIndex(int index) {
        return index == 1 ? RIGHT : LEFT;
    }
}
