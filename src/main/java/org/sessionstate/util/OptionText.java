package org.sessionstate.util;

/** Escaping used by flat {@code key=value} option strings. */
public final class OptionText {

    private OptionText() {}

    /** Prefixes every backslash and space with a backslash. */
    public static String escapeSpaces(String s) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == ' ') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Inverse of {@link #escapeSpaces(String)}. */
    public static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                c = s.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Doubles every occurrence of {@code c}. */
    public static String doubleChar(String s, char c) {
        String one = String.valueOf(c);
        return s.replace(one, one + one);
    }
}
