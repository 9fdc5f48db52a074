package org.sessionstate.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded list of strings, oldest first. Adding an item that is already
 * present moves it to the newest position; overflowing the capacity drops
 * the oldest item.
 */
public final class History {

    private final List<String> items = new ArrayList<>();
    private int capacity;

    public History(int capacity) {
        this.capacity = Math.max(0, capacity);
    }

    public void add(String item) {
        if (item == null || item.isEmpty() || capacity == 0) {
            return;
        }
        items.remove(item);
        items.add(item);
        trim();
    }

    /** @return items from oldest to newest. */
    public List<String> items() {
        return List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public void resize(int newCapacity) {
        capacity = Math.max(0, newCapacity);
        trim();
    }

    private void trim() {
        while (items.size() > capacity) {
            items.remove(0);
        }
    }
}
