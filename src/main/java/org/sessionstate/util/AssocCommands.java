package org.sessionstate.util;

import org.sessionstate.model.Association;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion between association records and the persisted command form
 * {@code {description}command}, where literal commas are doubled and single
 * commas separate several commands.
 */
public final class AssocCommands {

    private AssocCommands() {}

    /** @return stored form of a single record */
    public static String encode(Association assoc) {
        String cmd = OptionText.doubleChar(assoc.command(), ',');
        return assoc.description().isEmpty() ? cmd : "{" + assoc.description() + "}" + cmd;
    }

    /**
     * Splits stored form into records. Empty pieces are dropped.
     *
     * @param matchers matcher expression the records belong to
     * @param stored   stored command form
     */
    public static List<Association> decode(String matchers, String stored) {
        List<Association> out = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        for (int i = 0; i < stored.length(); i++) {
            char c = stored.charAt(i);
            if (c == ',') {
                if (i + 1 < stored.length() && stored.charAt(i + 1) == ',') {
                    piece.append(',');
                    i++;
                    continue;
                }
                addPiece(out, matchers, piece.toString());
                piece.setLength(0);
            } else {
                piece.append(c);
            }
        }
        addPiece(out, matchers, piece.toString());
        return out;
    }

    private static void addPiece(List<Association> out, String matchers, String piece) {
        String p = piece.strip();
        String description = "";
        if (p.startsWith("{")) {
            int close = p.indexOf('}');
            if (close > 0) {
                description = p.substring(1, close);
                p = p.substring(close + 1).strip();
            }
        }
        if (!p.isEmpty()) {
            out.add(new Association(matchers, p, description, false));
        }
    }
}
