package org.sessionstate.interfaces;

import org.sessionstate.model.Mark;

import java.util.List;
import java.util.Optional;

public interface MarkStore {

    /** @return every set mark, special ones included, ordered by name. */
    List<Mark> list();

    Optional<Mark> find(char name);

    /** Sets a user mark; invalid names are ignored. */
    void setup(Mark mark);

    /**
     * @return whether the live mark is absent or older than {@code timestamp}
     */
    default boolean isOlder(char name, long timestamp) {
        return find(name).map(m -> m.timestamp() < timestamp).orElse(true);
    }
}
