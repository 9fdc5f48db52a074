package org.sessionstate.model;

/**
 * Tagged path.
 *
 * @param path      bookmarked path, unique key
 * @param tags      comma-separated tags
 * @param timestamp seconds since epoch of the last update
 */
public record Bookmark(String path, String tags, long timestamp) {}
