package org.sessionstate.model;

import java.util.Arrays;

/**
 * Sort descriptor of a pane: up to {@link #KEY_COUNT} signed keys, sign
 * selects the direction. Unused slots hold {@code 0}.
 */
public final class SortKeys {

    /** Number of key slots in a descriptor. */
    public static final int KEY_COUNT = 24;

    /** Largest absolute key value. */
    public static final int MAX_KEY = 24;

    /** Key used when a descriptor has no keys (sort by name). */
    public static final int DEFAULT_KEY = 2;

    private SortKeys() {}

    /**
     * Parses a descriptor such as {@code "1,-2,3"}.
     * <p>
     * Integers are read left to right and clamped into
     * {@code [-MAX_KEY, MAX_KEY]}; a character that doesn't start an integer
     * is skipped, commas after a key are skipped. Reading ends with the string
     * or when every slot is filled.
     *
     * @param line descriptor text
     * @return array of {@link #KEY_COUNT} keys
     */
    public static int[] parse(String line) {
        int[] keys = new int[KEY_COUNT];
        int count = 0;
        int i = 0;
        int n = line == null ? 0 : line.length();
        while (i < n && count < KEY_COUNT) {
            int end = scanInteger(line, i);
            if (end > i) {
                keys[count++] = clamp(parseClamped(line.substring(i, end)));
                i = end;
            } else {
                i++;
            }
            while (i < n && line.charAt(i) == ',') {
                i++;
            }
        }
        if (count == 0) {
            keys[0] = DEFAULT_KEY;
        }
        return keys;
    }

    /**
     * Formats keys until the first empty slot, e.g. {@code [1,-2,3,0,...]}
     * becomes {@code "1,-2,3"}.
     */
    public static String format(int[] keys) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < keys.length && i < KEY_COUNT; i++) {
            int k = keys[i];
            if (k == 0 || Math.abs(k) > MAX_KEY) {
                break;
            }
            if (sb.length() > 0) sb.append(',');
            sb.append(k);
        }
        return sb.toString();
    }

    /** @return a descriptor sorting by the default key only. */
    public static int[] defaults() {
        int[] keys = new int[KEY_COUNT];
        keys[0] = DEFAULT_KEY;
        return keys;
    }

    /** @return copy padded or cut to {@link #KEY_COUNT} slots. */
    public static int[] normalize(int[] keys) {
        return Arrays.copyOf(keys, KEY_COUNT);
    }

    private static int clamp(long key) {
        return (int) Math.min(MAX_KEY, Math.max(-MAX_KEY, key));
    }

    // Index just past an optionally signed run of digits starting at from, or from if none.
    private static int scanInteger(String s, int from) {
        int i = from;
        if (i < s.length() && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            i++;
        }
        int digitsStart = i;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        return i == digitsStart ? from : i;
    }

    private static long parseClamped(String token) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            // too long for a long, only the sign matters after clamping
            return token.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
