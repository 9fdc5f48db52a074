package org.sessionstate.document;

/** Key names used in the structured state document. */
public final class DocKeys {

    // root sections
    public static final String GTABS = "gtabs";
    public static final String REGS = "regs";
    public static final String TRASH = "trash";
    public static final String BMARKS = "bmarks";
    public static final String MARKS = "marks";
    public static final String CMDS = "cmds";
    public static final String VIEWERS = "viewers";
    public static final String ASSOCS = "assocs";
    public static final String XASSOCS = "xassocs";
    public static final String DIR_STACK = "dir-stack";
    public static final String OPTIONS = "options";
    public static final String CMD_HIST = "cmd-hist";
    public static final String SEARCH_HIST = "search-hist";
    public static final String PROMPT_HIST = "prompt-hist";
    public static final String LFILT_HIST = "lfilt-hist";
    public static final String USE_TERM_MULTIPLEXER = "use-term-multiplexer";
    public static final String COLOR_SCHEME = "color-scheme";

    // global tab
    public static final String PANES = "panes";
    public static final String SPLITTER = "splitter";
    public static final String ACTIVE_PANE = "active-pane";
    public static final String PREVIEW = "preview";
    public static final String POS = "pos";
    public static final String ORIENTATION = "orientation";
    public static final String EXPANDED = "expanded";

    // pane and pane tab
    public static final String PTABS = "ptabs";
    public static final String HISTORY = "history";
    public static final String FILTERS = "filters";
    public static final String SORTING = "sorting";
    public static final String RESTORE_LAST_LOCATION = "restore-last-location";
    public static final String DIR = "dir";
    public static final String FILE = "file";
    public static final String RELPOS = "relpos";
    public static final String DOT = "dot";
    public static final String MANUAL = "manual";
    public static final String AUTO = "auto";
    public static final String INVERT = "invert";

    // entries
    public static final String MATCHERS = "matchers";
    public static final String CMD = "cmd";
    public static final String TS = "ts";
    public static final String TAGS = "tags";
    public static final String LEFT_DIR = "left-dir";
    public static final String LEFT_FILE = "left-file";
    public static final String RIGHT_DIR = "right-dir";
    public static final String RIGHT_FILE = "right-file";
    public static final String TRASHED = "trashed";
    public static final String ORIGINAL = "original";

    private DocKeys() {}
}
