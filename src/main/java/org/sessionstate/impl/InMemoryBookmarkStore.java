package org.sessionstate.impl;

import org.sessionstate.interfaces.BookmarkStore;
import org.sessionstate.model.Bookmark;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryBookmarkStore implements BookmarkStore {

    private final Map<String, Bookmark> bookmarks = new LinkedHashMap<>();

    @Override
    public List<Bookmark> list() {
        return new ArrayList<>(bookmarks.values());
    }

    @Override
    public Optional<Bookmark> find(String path) {
        return Optional.ofNullable(bookmarks.get(path));
    }

    /** Bookmarks need a path and at least one tag. */
    @Override
    public boolean setup(Bookmark bookmark) {
        if (bookmark == null || bookmark.path().isEmpty() || bookmark.tags().isBlank()) {
            return false;
        }
        bookmarks.put(bookmark.path(), bookmark);
        return true;
    }
}
