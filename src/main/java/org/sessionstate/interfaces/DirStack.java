package org.sessionstate.interfaces;

import org.sessionstate.model.DirStackEntry;

import java.util.List;

public interface DirStack {

    /** @return entries from bottom to top. */
    List<DirStackEntry> entries();

    void push(DirStackEntry entry);

    /** Removes and returns the top entry, or {@code null} for an empty stack. */
    DirStackEntry pop();

    /** Marks current contents as the baseline for {@link #changed()}. */
    void freeze();

    /** @return whether the stack was mutated since the last {@link #freeze()} (or creation). */
    boolean changed();
}
