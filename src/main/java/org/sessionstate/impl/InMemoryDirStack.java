package org.sessionstate.impl;

import org.sessionstate.interfaces.DirStack;
import org.sessionstate.model.DirStackEntry;

import java.util.ArrayList;
import java.util.List;

/** Counts mutations so that {@link #changed()} is exact even if contents end up equal. */
public final class InMemoryDirStack implements DirStack {

    private final List<DirStackEntry> entries = new ArrayList<>();
    private int mutations;

    @Override
    public List<DirStackEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public void push(DirStackEntry entry) {
        entries.add(entry);
        mutations++;
    }

    @Override
    public DirStackEntry pop() {
        if (entries.isEmpty()) {
            return null;
        }
        mutations++;
        return entries.remove(entries.size() - 1);
    }

    @Override
    public void freeze() {
        mutations = 0;
    }

    @Override
    public boolean changed() {
        return mutations != 0;
    }
}
