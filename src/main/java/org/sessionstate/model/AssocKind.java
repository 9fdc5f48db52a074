package org.sessionstate.model;

import org.sessionstate.document.DocKeys;

/** The three association tables and the document key each one is stored under. */
public enum AssocKind {
    FILETYPE(DocKeys.ASSOCS),
    XFILETYPE(DocKeys.XASSOCS),
    VIEWER(DocKeys.VIEWERS);

    private final String key;

    AssocKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
