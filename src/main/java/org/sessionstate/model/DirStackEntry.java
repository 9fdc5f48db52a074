package org.sessionstate.model;

/** Locations of both panes saved by a directory stack push. */
public record DirStackEntry(String leftDir, String leftFile, String rightDir, String rightFile) {}
