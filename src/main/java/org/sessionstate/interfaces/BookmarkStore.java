package org.sessionstate.interfaces;

import org.sessionstate.model.Bookmark;

import java.util.List;
import java.util.Optional;

public interface BookmarkStore {

    List<Bookmark> list();

    Optional<Bookmark> find(String path);

    /**
     * Adds or replaces a bookmark.
     *
     * @return {@code false} if the bookmark was rejected
     */
    boolean setup(Bookmark bookmark);

    /** @return whether the live bookmark is absent or older than {@code timestamp} */
    default boolean isOlder(String path, long timestamp) {
        return find(path).map(b -> b.timestamp() < timestamp).orElse(true);
    }
}
