package org.sessionstate.model;

/**
 * @param trashed  path of the file inside trash
 * @param original path the file was deleted from
 */
public record TrashEntry(String trashed, String original) {}
