package org.sessionstate.interfaces;

import org.sessionstate.model.HistoryEntry;
import org.sessionstate.model.PaneFilters;

import java.util.List;

/**
 * The part of a navigation pane that is persisted: location, directory
 * history, filters and sorting.
 */
public interface PaneView {

    String currentDir();

    void setCurrentDir(String dir);

    /** Name of the file under cursor. */
    String currentFile();

    /** @return directory history, oldest first. */
    List<HistoryEntry> history();

    /** @return index of the current history entry, {@code -1} if history is empty. */
    int historyPos();

    /** Records a visit; the current entry is updated if it is for the same directory. */
    void saveHistory(String dir, String file, int relPos);

    /** Records the current location of the pane in its history. */
    void saveCurrentPosition();

    boolean historyContains(String dir);

    /** Changes maximum number of history entries. */
    void resizeHistory(int capacity);

    PaneFilters filters();

    void setHideDot(boolean hide);

    void setInvert(boolean invert);

    void setManualFilter(String expr);

    /** @return {@code false} if the value was rejected */
    boolean setAutoFilter(String value);

    int[] sortKeys();

    void setSortKeys(int[] keys);
}
