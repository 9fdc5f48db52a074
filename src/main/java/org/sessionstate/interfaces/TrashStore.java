package org.sessionstate.interfaces;

import org.sessionstate.model.TrashEntry;

import java.util.List;

public interface TrashStore {

    List<TrashEntry> entries();

    /** @return {@code false} if the pair is already recorded */
    boolean add(String original, String trashed);

    boolean contains(String original, String trashed);
}
