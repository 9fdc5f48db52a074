package org.sessionstate.model;

/**
 * One visited location of a pane.
 *
 * @param dir    visited directory
 * @param file   file under cursor
 * @param relPos cursor position relative to the top of the list
 */
public record HistoryEntry(String dir, String file, int relPos) {}
