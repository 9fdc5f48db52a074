package org.sessionstate.serialize;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.sessionstate.SessionState;
import org.sessionstate.config.InfoCategory;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.Json;
import org.sessionstate.interfaces.OptionsEngine;
import org.sessionstate.interfaces.PaneView;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Association;
import org.sessionstate.model.Bookmark;
import org.sessionstate.model.DirStackEntry;
import org.sessionstate.model.History;
import org.sessionstate.model.HistoryEntry;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.LayoutState;
import org.sessionstate.model.Mark;
import org.sessionstate.model.PaneFilters;
import org.sessionstate.model.PaneSide;
import org.sessionstate.model.Register;
import org.sessionstate.model.SortKeys;
import org.sessionstate.model.TrashEntry;
import org.sessionstate.util.AssocCommands;

import java.util.List;
import java.util.Map;

/**
 * Captures live state into a fresh document.
 * <p>
 * Sections whose category is disabled are left out entirely, which also
 * keeps them out of a later merge. Global tabs and trash don't have a
 * category and are always written.
 */
public final class StateSerializer {

    /**
     * @param session live state
     * @return new document
     */
    public JsonObject serialize(SessionState session) {
        JsonObject root = new JsonObject();

        storeGtab(Json.appendObject(Json.addArray(root, DocKeys.GTABS)), session);
        storeTrash(root, session);

        if (session.has(InfoCategory.OPTIONS)) {
            storeGlobalOptions(root, session.options());
        }
        if (session.has(InfoCategory.FILETYPES)) {
            for (AssocKind kind : AssocKind.values()) {
                storeAssocs(root, kind, session.associations().list(kind));
            }
        }
        if (session.has(InfoCategory.COMMANDS)) {
            storeCommands(root, session.commands().userCommands());
        }
        if (session.has(InfoCategory.MARKS)) {
            storeMarks(root, session.marks().list());
        }
        if (session.has(InfoCategory.BOOKMARKS)) {
            storeBookmarks(root, session.bookmarks().list());
        }
        for (HistoryKind kind : HistoryKind.values()) {
            if (session.has(kind.category())) {
                storeHistory(root, kind.key(), session.history(kind));
            }
        }
        if (session.has(InfoCategory.REGISTERS)) {
            storeRegisters(root, session.registers().list());
        }
        if (session.has(InfoCategory.DIRSTACK)) {
            storeDirStack(root, session.dirStack().entries());
        }
        if (session.has(InfoCategory.STATE)) {
            root.addProperty(DocKeys.USE_TERM_MULTIPLEXER, session.layout().useTermMultiplexer());
        }
        if (session.has(InfoCategory.CS)) {
            root.addProperty(DocKeys.COLOR_SCHEME, session.layout().colorScheme());
        }

        return root;
    }

    private void storeGtab(JsonObject gtab, SessionState session) {
        JsonArray panes = Json.addArray(gtab, DocKeys.PANES);
        for (PaneSide side : PaneSide.values()) {
            storePane(Json.appendObject(panes), session, side);
        }

        if (session.has(InfoCategory.TUI)) {
            LayoutState layout = session.layout();
            gtab.addProperty(DocKeys.ACTIVE_PANE, layout.activePane().index());
            gtab.addProperty(DocKeys.PREVIEW, layout.preview());

            JsonObject splitter = Json.addObject(gtab, DocKeys.SPLITTER);
            splitter.addProperty(DocKeys.POS, layout.splitterPos());
            splitter.addProperty(DocKeys.ORIENTATION, layout.orientation().code());
            splitter.addProperty(DocKeys.EXPANDED, layout.windowCount() == 1);
        }
    }

    private void storePane(JsonObject paneData, SessionState session, PaneSide side) {
        JsonObject ptab = Json.appendObject(Json.addArray(paneData, DocKeys.PTABS));
        PaneView pane = session.pane(side);

        if (session.has(InfoCategory.DHISTORY) && session.historyLength() > 0) {
            storeDirHistory(ptab, pane, session.has(InfoCategory.SAVEDIRS));
        }
        if (session.has(InfoCategory.STATE)) {
            storeFilters(ptab, pane.filters());
        }
        if (session.has(InfoCategory.OPTIONS)) {
            storeViewOptions(ptab, session.options(), side);
        }
        if (session.has(InfoCategory.TUI)) {
            ptab.addProperty(DocKeys.SORTING, SortKeys.format(pane.sortKeys()));
        }
    }

    // Entries past the cursor belong to a "forward" history that isn't kept.
    private static void storeDirHistory(JsonObject ptab, PaneView pane, boolean restoreLastLocation) {
        pane.saveCurrentPosition();

        JsonArray history = Json.addArray(ptab, DocKeys.HISTORY);
        List<HistoryEntry> entries = pane.history();
        for (int i = 0; i <= pane.historyPos() && i < entries.size(); i++) {
            HistoryEntry e = entries.get(i);
            JsonObject entry = Json.appendObject(history);
            entry.addProperty(DocKeys.DIR, e.dir());
            entry.addProperty(DocKeys.FILE, e.file());
            entry.addProperty(DocKeys.RELPOS, e.relPos());
        }

        ptab.addProperty(DocKeys.RESTORE_LAST_LOCATION, restoreLastLocation);
    }

    private static void storeFilters(JsonObject ptab, PaneFilters f) {
        JsonObject filters = Json.addObject(ptab, DocKeys.FILTERS);
        filters.addProperty(DocKeys.INVERT, f.invert());
        filters.addProperty(DocKeys.DOT, f.hideDot());
        filters.addProperty(DocKeys.MANUAL, f.manual());
        filters.addProperty(DocKeys.AUTO, f.auto());
    }

    private static void storeGlobalOptions(JsonObject root, OptionsEngine options) {
        JsonArray out = Json.addArray(root, DocKeys.OPTIONS);
        for (OptionCatalog.OptionSpec spec : OptionCatalog.GLOBAL) {
            if (spec.kind() == OptionCatalog.Kind.BOOL) {
                out.add(spec.formatFlag(options.flag(spec.name())));
            } else {
                spec.formatValue(options.text(spec.name())).ifPresent(out::add);
            }
        }
    }

    private static void storeViewOptions(JsonObject ptab, OptionsEngine options, PaneSide side) {
        JsonArray out = Json.addArray(ptab, DocKeys.OPTIONS);
        for (OptionCatalog.OptionSpec spec : OptionCatalog.VIEW) {
            if (spec.kind() == OptionCatalog.Kind.BOOL) {
                out.add(spec.formatFlag(options.localFlag(side, spec.name())));
            } else {
                spec.formatValue(options.localText(side, spec.name())).ifPresent(out::add);
            }
        }
    }

    private static void storeAssocs(JsonObject root, AssocKind kind, List<Association> assocs) {
        JsonArray entries = Json.addArray(root, kind.key());
        for (Association assoc : assocs) {
            // builtin records are synthesized on startup
            if (assoc.command().isEmpty() || assoc.builtin()) {
                continue;
            }
            JsonObject entry = Json.appendObject(entries);
            entry.addProperty(DocKeys.MATCHERS, assoc.matchers());
            entry.addProperty(DocKeys.CMD, AssocCommands.encode(assoc));
        }
    }

    private static void storeCommands(JsonObject root, Map<String, String> commands) {
        JsonObject cmds = Json.addObject(root, DocKeys.CMDS);
        commands.forEach(cmds::addProperty);
    }

    private static void storeMarks(JsonObject root, List<Mark> marks) {
        JsonObject out = Json.addObject(root, DocKeys.MARKS);
        for (Mark mark : marks) {
            if (Mark.isSpecial(mark.name())) {
                continue;
            }
            JsonObject entry = Json.addObject(out, String.valueOf(mark.name()));
            entry.addProperty(DocKeys.DIR, mark.dir());
            entry.addProperty(DocKeys.FILE, mark.file());
            Json.setLong(entry, DocKeys.TS, mark.timestamp());
        }
    }

    private static void storeBookmarks(JsonObject root, List<Bookmark> bookmarks) {
        JsonObject out = Json.addObject(root, DocKeys.BMARKS);
        for (Bookmark bookmark : bookmarks) {
            JsonObject entry = Json.addObject(out, bookmark.path());
            entry.addProperty(DocKeys.TAGS, bookmark.tags());
            Json.setLong(entry, DocKeys.TS, bookmark.timestamp());
        }
    }

    private static void storeHistory(JsonObject root, String key, History history) {
        if (history.isEmpty()) {
            return;
        }
        JsonArray entries = Json.addArray(root, key);
        history.items().forEach(entries::add);
    }

    private static void storeRegisters(JsonObject root, List<Register> registers) {
        JsonObject regs = Json.addObject(root, DocKeys.REGS);
        for (Register reg : registers) {
            if (reg.files().isEmpty()) {
                continue;
            }
            JsonArray files = Json.addArray(regs, String.valueOf(reg.name()));
            reg.files().forEach(files::add);
        }
    }

    private static void storeDirStack(JsonObject root, List<DirStackEntry> stack) {
        JsonArray entries = Json.addArray(root, DocKeys.DIR_STACK);
        for (DirStackEntry e : stack) {
            JsonObject info = Json.appendObject(entries);
            info.addProperty(DocKeys.LEFT_DIR, e.leftDir());
            info.addProperty(DocKeys.LEFT_FILE, e.leftFile());
            info.addProperty(DocKeys.RIGHT_DIR, e.rightDir());
            info.addProperty(DocKeys.RIGHT_FILE, e.rightFile());
        }
    }

    private static void storeTrash(JsonObject root, SessionState session) {
        List<TrashEntry> entries = session.trash().entries();
        if (entries.isEmpty()) {
            return;
        }
        JsonArray trash = Json.addArray(root, DocKeys.TRASH);
        for (TrashEntry e : entries) {
            JsonObject entry = Json.appendObject(trash);
            entry.addProperty(DocKeys.TRASHED, e.trashed());
            entry.addProperty(DocKeys.ORIGINAL, e.original());
        }
    }
}
