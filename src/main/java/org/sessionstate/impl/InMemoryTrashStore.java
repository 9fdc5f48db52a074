package org.sessionstate.impl;

import org.sessionstate.interfaces.TrashStore;
import org.sessionstate.model.TrashEntry;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryTrashStore implements TrashStore {

    private final List<TrashEntry> entries = new ArrayList<>();

    @Override
    public List<TrashEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public boolean add(String original, String trashed) {
        if (contains(original, trashed)) {
            return false;
        }
        entries.add(new TrashEntry(trashed, original));
        return true;
    }

    @Override
    public boolean contains(String original, String trashed) {
        return entries.contains(new TrashEntry(trashed, original));
    }
}
