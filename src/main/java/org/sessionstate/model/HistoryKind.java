package org.sessionstate.model;

import org.sessionstate.config.InfoCategory;
import org.sessionstate.document.DocKeys;

/** Kinds of string histories together with their document key and category. */
public enum HistoryKind {
    COMMAND(DocKeys.CMD_HIST, InfoCategory.CHISTORY),
    SEARCH(DocKeys.SEARCH_HIST, InfoCategory.SHISTORY),
    PROMPT(DocKeys.PROMPT_HIST, InfoCategory.PHISTORY),
    FILTER(DocKeys.LFILT_HIST, InfoCategory.FHISTORY);

    private final String key;
    private final InfoCategory category;

    HistoryKind(String key, InfoCategory category) {
        this.key = key;
        this.category = category;
    }

    public String key() {
        return key;
    }

    public InfoCategory category() {
        return category;
    }
}
