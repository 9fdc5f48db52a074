package org.sessionstate.load;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.sessionstate.SessionState;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.Json;
import org.sessionstate.interfaces.PaneView;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Bookmark;
import org.sessionstate.model.DirStackEntry;
import org.sessionstate.model.History;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.LayoutState;
import org.sessionstate.model.Mark;
import org.sessionstate.model.PaneSide;
import org.sessionstate.model.SortKeys;
import org.sessionstate.model.SplitOrientation;
import org.sessionstate.util.InvalidMatcherException;
import org.sessionstate.util.Matchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Applies a state document onto live state.
 * <p>
 * Every value is read only if present and of the expected type; anything
 * else leaves the live counterpart untouched. Broken matchers and filters
 * are logged and skipped, nothing here throws on bad input.
 */
public final class StateLoader {

    private static final Logger log = LoggerFactory.getLogger(StateLoader.class);

    /** Shorthand for {@link #load(JsonObject, LoadContext)}. */
    public void load(JsonObject root, SessionState session, boolean reread) {
        load(root, new LoadContext(session, reread));
    }

    /**
     * @param root document to apply
     * @param ctx  target session and load mode
     */
    public void load(JsonObject root, LoadContext ctx) {
        SessionState session = ctx.session();
        LayoutState layout = session.layout();

        Json.bool(root, DocKeys.USE_TERM_MULTIPLEXER).ifPresent(layout::setUseTermMultiplexer);
        Json.string(root, DocKeys.COLOR_SCHEME).ifPresent(layout::setColorScheme);

        Optional<JsonArray> gtabs = Json.array(root, DocKeys.GTABS);
        int gtabCount = Json.size(gtabs.orElse(null));
        for (int i = 0; i < gtabCount; i++) {
            Json.objectAt(gtabs.get(), i).ifPresent(gtab -> loadGtab(gtab, ctx));
        }

        Json.array(root, DocKeys.OPTIONS).ifPresent(opts ->
                Json.strings(opts).forEach(session.options()::apply));

        loadAssocs(root, AssocKind.FILETYPE, session);
        loadAssocs(root, AssocKind.XFILETYPE, session);
        loadAssocs(root, AssocKind.VIEWER, session);
        loadCommands(root, session);
        loadMarks(root, session);
        loadBookmarks(root, session);
        loadRegisters(root, session);
        loadDirStack(root, session);
        loadTrash(root, session);
        for (HistoryKind kind : HistoryKind.values()) {
            loadHistory(root, kind, session);
        }
    }

    private void loadGtab(JsonObject gtab, LoadContext ctx) {
        LayoutState layout = ctx.session().layout();

        Optional<JsonArray> panes = Json.array(gtab, DocKeys.PANES);
        for (PaneSide side : PaneSide.values()) {
            panes.flatMap(p -> Json.objectAt(p, side.index()))
                    .ifPresent(pane -> loadPane(pane, side, ctx));
        }

        // a running session keeps its focus and layout
        if (ctx.reread()) {
            return;
        }

        Json.integer(gtab, DocKeys.ACTIVE_PANE)
                .map(PaneSide::ofIndex)
                .ifPresent(layout::setActivePane);
        Json.bool(gtab, DocKeys.PREVIEW).ifPresent(layout::setPreview);

        JsonObject splitter = Json.object(gtab, DocKeys.SPLITTER).orElse(null);
        Json.string(splitter, DocKeys.ORIENTATION)
                .map(SplitOrientation::ofCode)
                .ifPresent(layout::setOrientation);
        Json.integer(splitter, DocKeys.POS).ifPresent(layout::setSplitterPos);
        Json.bool(splitter, DocKeys.EXPANDED)
                .ifPresent(expanded -> layout.setWindowCount(expanded ? 1 : 2));
    }

    private void loadPane(JsonObject pane, PaneSide side, LoadContext ctx) {
        JsonArray ptabs = Json.array(pane, DocKeys.PTABS).orElse(null);
        for (int i = 0; i < Json.size(ptabs); i++) {
            Optional<JsonObject> ptab = Json.objectAt(ptabs, i);
            if (ptab.isEmpty()) {
                continue;
            }
            JsonObject tab = ptab.get();
            PaneView view = ctx.session().pane(side);

            loadDirHistory(tab, view, ctx);
            loadFilters(tab, view);
            Json.array(tab, DocKeys.OPTIONS).ifPresent(opts ->
                    Json.strings(opts).forEach(o -> ctx.session().options().applyLocal(side, o)));
            Json.string(tab, DocKeys.SORTING)
                    .ifPresent(sorting -> view.setSortKeys(SortKeys.parse(sorting)));
        }
    }

    private void loadDirHistory(JsonObject ptab, PaneView view, LoadContext ctx) {
        SessionState session = ctx.session();
        JsonArray history = Json.array(ptab, DocKeys.HISTORY).orElse(null);

        String lastDir = null;
        for (int i = 0; i < Json.size(history); i++) {
            JsonObject entry = Json.objectAt(history, i).orElse(null);
            Optional<String> dir = Json.string(entry, DocKeys.DIR);
            Optional<String> file = Json.string(entry, DocKeys.FILE);
            Optional<Integer> relPos = Json.integer(entry, DocKeys.RELPOS);
            if (dir.isEmpty() || file.isEmpty() || relPos.isEmpty()) {
                continue;
            }

            if (view.history().size() >= session.historyLength()) {
                session.growHistoryLength();
            }
            view.saveHistory(dir.get(), file.get(), Math.max(0, relPos.get()));
            lastDir = dir.get();
        }

        boolean restore = Json.bool(ptab, DocKeys.RESTORE_LAST_LOCATION).orElse(false);
        if (restore && !ctx.reread() && lastDir != null) {
            view.setCurrentDir(lastDir);
        }
    }

    private void loadFilters(JsonObject ptab, PaneView view) {
        Optional<JsonObject> found = Json.object(ptab, DocKeys.FILTERS);
        if (found.isEmpty()) {
            return;
        }
        JsonObject filters = found.get();

        Json.bool(filters, DocKeys.INVERT).ifPresent(view::setInvert);
        Json.bool(filters, DocKeys.DOT).ifPresent(view::setHideDot);
        Json.string(filters, DocKeys.MANUAL).ifPresent(expr -> setManualFilter(view, expr));
        Json.string(filters, DocKeys.AUTO).ifPresent(value -> {
            if (!view.setAutoFilter(value)) {
                log.warn("Error setting auto filename filter to: {}", value);
            }
        });
    }

    // An invalid expression is replaced with an empty filter.
    private void setManualFilter(PaneView view, String expr) {
        try {
            Matchers.compileFilter(expr);
            view.setManualFilter(expr);
        } catch (InvalidMatcherException e) {
            log.warn("Invalid manual filter '{}' replaced with an empty one: {}", expr, e.getMessage());
            view.setManualFilter("");
        }
    }

    private void loadAssocs(JsonObject root, AssocKind kind, SessionState session) {
        JsonArray entries = Json.array(root, kind.key()).orElse(null);
        for (int i = 0; i < Json.size(entries); i++) {
            JsonObject entry = Json.objectAt(entries, i).orElse(null);
            Optional<String> matchers = Json.string(entry, DocKeys.MATCHERS);
            Optional<String> cmd = Json.string(entry, DocKeys.CMD);
            if (matchers.isEmpty() || cmd.isEmpty()) {
                continue;
            }

            try {
                Matchers.compile(matchers.get());
            } catch (InvalidMatcherException e) {
                log.warn("Error with matchers of {} entry `{}`: {}", kind.key(), matchers.get(), e.getMessage());
                continue;
            }

            switch (kind) {
                case FILETYPE -> session.associations().setPrograms(matchers.get(), cmd.get(), false);
                case XFILETYPE -> session.associations().setPrograms(matchers.get(), cmd.get(), true);
                case VIEWER -> session.associations().setViewers(matchers.get(), cmd.get());
            }
        }
    }

    private void loadCommands(JsonObject root, SessionState session) {
        Json.object(root, DocKeys.CMDS).ifPresent(cmds -> {
            for (Map.Entry<String, JsonElement> e : cmds.entrySet()) {
                Json.string(cmds, e.getKey()).ifPresent(body -> session.commands().define(e.getKey(), body));
            }
        });
    }

    private void loadMarks(JsonObject root, SessionState session) {
        Optional<JsonObject> marks = Json.object(root, DocKeys.MARKS);
        if (marks.isEmpty()) {
            return;
        }
        for (String name : marks.get().keySet()) {
            JsonObject mark = Json.object(marks.get(), name).orElse(null);
            Optional<String> dir = Json.string(mark, DocKeys.DIR);
            Optional<String> file = Json.string(mark, DocKeys.FILE);
            Optional<Long> ts = Json.longValue(mark, DocKeys.TS);
            if (name.isEmpty() || dir.isEmpty() || file.isEmpty() || ts.isEmpty()) {
                continue;
            }
            session.marks().setup(new Mark(name.charAt(0), dir.get(), file.get(), ts.get()));
        }
    }

    private void loadBookmarks(JsonObject root, SessionState session) {
        Optional<JsonObject> bmarks = Json.object(root, DocKeys.BMARKS);
        if (bmarks.isEmpty()) {
            return;
        }
        for (String path : bmarks.get().keySet()) {
            JsonObject bmark = Json.object(bmarks.get(), path).orElse(null);
            Optional<String> tags = Json.string(bmark, DocKeys.TAGS);
            Optional<Long> ts = Json.longValue(bmark, DocKeys.TS);
            if (tags.isEmpty() || ts.isEmpty()) {
                continue;
            }
            if (!session.bookmarks().setup(new Bookmark(path, tags.get(), ts.get()))) {
                log.warn("Can't add a bookmark: {} ({})", path, tags.get());
            }
        }
    }

    private void loadRegisters(JsonObject root, SessionState session) {
        Optional<JsonObject> regs = Json.object(root, DocKeys.REGS);
        if (regs.isEmpty()) {
            return;
        }
        for (String name : regs.get().keySet()) {
            if (name.isEmpty()) {
                continue;
            }
            Json.array(regs.get(), name).ifPresent(files ->
                    Json.strings(files).forEach(f -> session.registers().append(name.charAt(0), f)));
        }
    }

    private void loadDirStack(JsonObject root, SessionState session) {
        JsonArray entries = Json.array(root, DocKeys.DIR_STACK).orElse(null);
        for (int i = 0; i < Json.size(entries); i++) {
            JsonObject entry = Json.objectAt(entries, i).orElse(null);
            Optional<String> leftDir = Json.string(entry, DocKeys.LEFT_DIR);
            Optional<String> leftFile = Json.string(entry, DocKeys.LEFT_FILE);
            Optional<String> rightDir = Json.string(entry, DocKeys.RIGHT_DIR);
            Optional<String> rightFile = Json.string(entry, DocKeys.RIGHT_FILE);
            if (leftDir.isPresent() && leftFile.isPresent() && rightDir.isPresent() && rightFile.isPresent()) {
                session.dirStack().push(new DirStackEntry(leftDir.get(), leftFile.get(),
                        rightDir.get(), rightFile.get()));
            }
        }
    }

    private void loadTrash(JsonObject root, SessionState session) {
        JsonArray entries = Json.array(root, DocKeys.TRASH).orElse(null);
        for (int i = 0; i < Json.size(entries); i++) {
            JsonObject entry = Json.objectAt(entries, i).orElse(null);
            Optional<String> trashed = Json.string(entry, DocKeys.TRASHED);
            Optional<String> original = Json.string(entry, DocKeys.ORIGINAL);
            if (trashed.isPresent() && original.isPresent()) {
                session.trash().add(original.get(), trashed.get());
            }
        }
    }

    private void loadHistory(JsonObject root, HistoryKind kind, SessionState session) {
        JsonArray entries = Json.array(root, kind.key()).orElse(null);
        for (String item : Json.strings(entries)) {
            History history = session.history(kind);
            // make room instead of dropping the oldest entry
            if (history.size() >= history.capacity()) {
                session.growHistoryLength();
            }
            history.add(item);
        }
    }
}
