package org.sessionstate.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Character trie answering exact membership queries. Lookup cost depends on
 * the length of the key only.
 */
public final class PrefixIndex {

    private final Node root = new Node();
    private int size;

    /** @return {@code false} if the key was already present */
    public boolean put(String key) {
        Node node = root;
        for (int i = 0; i < key.length(); i++) {
            node = node.children.computeIfAbsent(key.charAt(i), c -> new Node());
        }
        if (node.terminal) {
            return false;
        }
        node.terminal = true;
        size++;
        return true;
    }

    public boolean contains(String key) {
        Node node = root;
        for (int i = 0; i < key.length() && node != null; i++) {
            node = node.children.get(key.charAt(i));
        }
        return node != null && node.terminal;
    }

    public int size() {
        return size;
    }

    private static final class Node {
        final Map<Character, Node> children = new HashMap<>();
        boolean terminal;
    }
}
