package org.sessionstate.serialize;

import org.sessionstate.util.OptionText;

import java.util.List;
import java.util.Optional;

/**
 * Every option whose value is persisted, in the order it is written.
 */
public final class OptionCatalog {

    public enum Kind { BOOL, INT, STRING }

    /**
     * A persisted option.
     *
     * @param name option name as understood by the options engine
     * @param kind how the value is written
     */
    public record OptionSpec(String name, Kind kind) {

        /** @return {@code name} or {@code noname} */
        public String formatFlag(boolean on) {
            return on ? name : "no" + name;
        }

        /**
         * @return {@code name=value}, or empty for an integer option whose
         *         value isn't a number
         */
        public Optional<String> formatValue(String value) {
            String v = value == null ? "" : value;
            if (kind == Kind.INT) {
                try {
                    return Optional.of(name + "=" + Integer.parseInt(v.trim()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            return Optional.of(name + "=" + OptionText.escapeSpaces(v));
        }
    }

    /** Options of the whole application. */
    public static final List<OptionSpec> GLOBAL = List.of(
            str("aproposprg"),
            flag("autochpos"),
            str("cdpath"),
            flag("chaselinks"),
            num("columns"),
            str("cpoptions"),
            str("deleteprg"),
            flag("fastrun"),
            str("findprg"),
            flag("followlinks"),
            str("fusehome"),
            flag("gdefault"),
            str("grepprg"),
            str("histcursor"),
            num("history"),
            flag("hlsearch"),
            flag("iec"),
            flag("ignorecase"),
            flag("incsearch"),
            flag("laststatus"),
            flag("title"),
            num("lines"),
            str("locateprg"),
            str("mediaprg"),
            num("mintimeoutlen"),
            flag("quickview"),
            str("rulerformat"),
            flag("runexec"),
            flag("scrollbind"),
            num("scrolloff"),
            str("shell"),
            str("shellcmdflag"),
            str("shortmess"),
            str("showtabline"),
            str("sizefmt"),
            str("slowfs"),
            flag("smartcase"),
            flag("sortnumbers"),
            str("statusline"),
            str("syncregs"),
            str("tabscope"),
            num("tabstop"),
            str("timefmt"),
            num("timeoutlen"),
            flag("trash"),
            str("tuioptions"),
            num("undolevels"),
            str("vicmd"),
            str("vixcmd"),
            flag("wrapscan"),
            str("confirm"),
            str("dotdirs"),
            str("caseoptions"),
            str("suggestoptions"),
            str("iooptions"),
            str("dirsize"),
            str("classify"),
            str("vifminfo"),
            flag("vimhelp"),
            flag("wildmenu"),
            str("wildstyle"),
            str("wordchars"),
            flag("wrap"));

    /** Options local to a pane. */
    public static final List<OptionSpec> VIEW = List.of(
            str("viewcolumns"),
            str("sortgroups"),
            str("lsoptions"),
            flag("lsview"),
            str("milleroptions"),
            flag("millerview"),
            flag("number"),
            num("numberwidth"),
            flag("relativenumber"),
            flag("dotfiles"),
            str("previewprg"));

    private OptionCatalog() {}

    private static OptionSpec flag(String name) {
        return new OptionSpec(name, Kind.BOOL);
    }

    private static OptionSpec num(String name) {
        return new OptionSpec(name, Kind.INT);
    }

    private static OptionSpec str(String name) {
        return new OptionSpec(name, Kind.STRING);
    }
}
