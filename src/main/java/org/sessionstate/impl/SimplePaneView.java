package org.sessionstate.impl;

import org.sessionstate.interfaces.PaneView;
import org.sessionstate.model.HistoryEntry;
import org.sessionstate.model.PaneFilters;
import org.sessionstate.model.SortKeys;
import org.sessionstate.util.InvalidMatcherException;
import org.sessionstate.util.Matchers;

import java.util.ArrayList;
import java.util.List;

/** Pane without a file list: tracks location, history, filters and sorting. */
public final class SimplePaneView implements PaneView {

    private final List<HistoryEntry> history = new ArrayList<>();
    private int historyPos = -1;
    private int capacity;

    private String currentDir;
    private String currentFile = "";
    private int currentRelPos;

    private boolean hideDot;
    private String manualFilter = "";
    private String autoFilter = "";
    private boolean invert = true;
    private int[] sortKeys = SortKeys.defaults();

    public SimplePaneView(String initialDir, int historyCapacity) {
        this.currentDir = initialDir == null ? "" : initialDir;
        this.capacity = Math.max(0, historyCapacity);
    }

    /** Moves the pane to a location and records it in history. */
    public void navigate(String dir, String file, int relPos) {
        saveCurrentPosition();
        currentDir = dir;
        currentFile = file == null ? "" : file;
        currentRelPos = relPos;
        saveCurrentPosition();
    }

    @Override
    public String currentDir() {
        return currentDir;
    }

    /** Entering a directory puts the cursor where history last saw it. */
    @Override
    public void setCurrentDir(String dir) {
        this.currentDir = dir;
        this.currentFile = "";
        this.currentRelPos = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            HistoryEntry e = history.get(i);
            if (e.dir().equals(dir)) {
                currentFile = e.file();
                currentRelPos = e.relPos();
                break;
            }
        }
    }

    @Override
    public String currentFile() {
        return currentFile;
    }

    @Override
    public List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    @Override
    public int historyPos() {
        return historyPos;
    }

    @Override
    public void saveHistory(String dir, String file, int relPos) {
        if (capacity == 0 || dir == null || dir.isEmpty()) {
            return;
        }
        HistoryEntry entry = new HistoryEntry(dir, file == null ? "" : file, relPos);
        if (historyPos >= 0 && history.get(historyPos).dir().equals(dir)) {
            history.set(historyPos, entry);
            return;
        }
        // visiting a new place discards entries past the cursor
        while (history.size() > historyPos + 1) {
            history.remove(history.size() - 1);
        }
        history.add(entry);
        while (history.size() > capacity) {
            history.remove(0);
        }
        historyPos = history.size() - 1;
    }

    @Override
    public void saveCurrentPosition() {
        saveHistory(currentDir, currentFile, currentRelPos);
    }

    @Override
    public boolean historyContains(String dir) {
        return history.stream().anyMatch(e -> e.dir().equals(dir));
    }

    @Override
    public void resizeHistory(int newCapacity) {
        capacity = Math.max(0, newCapacity);
        while (history.size() > capacity) {
            history.remove(0);
            historyPos--;
        }
        historyPos = Math.max(historyPos, history.isEmpty() ? -1 : 0);
    }

    /** @return maximum number of history entries. */
    public int historyCapacity() {
        return capacity;
    }

    @Override
    public PaneFilters filters() {
        return new PaneFilters(hideDot, manualFilter, autoFilter, invert);
    }

    @Override
    public void setHideDot(boolean hide) {
        this.hideDot = hide;
    }

    @Override
    public void setInvert(boolean invert) {
        this.invert = invert;
    }

    @Override
    public void setManualFilter(String expr) {
        this.manualFilter = expr == null ? "" : expr;
    }

    @Override
    public boolean setAutoFilter(String value) {
        try {
            Matchers.compileFilter(value);
        } catch (InvalidMatcherException e) {
            return false;
        }
        this.autoFilter = value;
        return true;
    }

    @Override
    public int[] sortKeys() {
        return sortKeys.clone();
    }

    @Override
    public void setSortKeys(int[] keys) {
        this.sortKeys = SortKeys.normalize(keys);
    }
}
