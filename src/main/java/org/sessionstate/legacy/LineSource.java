package org.sessionstate.legacy;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.OptionalLong;

/**
 * Line reader with one line of look-ahead. Lines are returned with leading
 * whitespace removed; {@code null} marks the end of input.
 */
final class LineSource {

    private final BufferedReader reader;
    private String pending;

    LineSource(BufferedReader reader) {
        this.reader = reader;
    }

    String next() throws IOException {
        String line;
        if (pending != null) {
            line = pending;
            pending = null;
        } else {
            line = reader.readLine();
        }
        return line == null ? null : line.stripLeading();
    }

    /**
     * Consumes the next line if it consists of a single integer.
     *
     * @return the number, or empty with the line left in place
     */
    OptionalLong optionalNumber() throws IOException {
        if (pending == null) {
            pending = reader.readLine();
        }
        if (pending == null || pending.isEmpty()) {
            return OptionalLong.empty();
        }
        char c = pending.charAt(0);
        if (!Character.isDigit(c) && c != '-' && c != '+') {
            return OptionalLong.empty();
        }
        try {
            long value = Long.parseLong(pending.strip());
            pending = null;
            return OptionalLong.of(value);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
