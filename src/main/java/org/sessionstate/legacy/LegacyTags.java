package org.sessionstate.legacy;

/** Tag characters of the legacy line-oriented state file. */
final class LegacyTags {

    static final char COMMENT = '#';
    static final char OPTION = '=';
    static final char FILETYPE = '.';
    static final char XFILETYPE = 'x';
    static final char FILEVIEWER = ',';
    static final char COMMAND = '!';
    static final char MARK = '\'';
    static final char BOOKMARK = 'b';
    static final char ACTIVE_VIEW = 'a';
    static final char QUICK_VIEW_STATE = 'q';
    static final char WIN_COUNT = 'v';
    static final char SPLIT_ORIENTATION = 'o';
    static final char SPLIT_POSITION = 'm';
    static final char LWIN_SORT = 'l';
    static final char RWIN_SORT = 'r';
    static final char LWIN_HIST = 'd';
    static final char RWIN_HIST = 'D';
    static final char CMDLINE_HIST = ':';
    static final char SEARCH_HIST = '/';
    static final char PROMPT_HIST = 'p';
    static final char FILTER_HIST = '|';
    static final char DIR_STACK = 'S';
    static final char TRASH = 't';
    static final char REG = '"';
    static final char LWIN_FILT = 'f';
    static final char RWIN_FILT = 'F';
    static final char LWIN_FILT_INV = 'i';
    static final char RWIN_FILT_INV = 'I';
    static final char USE_SCREEN = 's';
    static final char COLORSCHEME = 'c';
    static final char LWIN_SPECIFIC = '[';
    static final char RWIN_SPECIFIC = ']';

    // markers inside option and view-specific values
    static final char LEFT_OPTION = '[';
    static final char RIGHT_OPTION = ']';
    static final char PROP_DOTFILES = '.';
    static final char PROP_AUTO_FILTER = 'F';

    /** Command of builtin associations that older versions wrote out by mistake. */
    static final String PSEUDO_CMD = "vifm";

    private LegacyTags() {}
}
