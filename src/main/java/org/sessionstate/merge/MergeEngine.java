package org.sessionstate.merge;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.sessionstate.SessionState;
import org.sessionstate.config.InfoCategory;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.Json;
import org.sessionstate.interfaces.PaneView;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.PaneSide;
import org.sessionstate.util.PrefixIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds state written by another instance (the admixture) into the document
 * this instance is about to save (the current one).
 * <p>
 * Merging only adds: entries of the current document are never removed or
 * reordered, except for the directory stack which is taken over wholesale
 * when this instance didn't touch its own. Conflicts are decided against the
 * live stores, so the current document must have been serialized from the
 * same session.
 */
public final class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    /**
     * @param current   freshly serialized document, updated in place
     * @param admixture document found on disk, not modified
     * @param session   live state the current document was built from
     */
    public void merge(JsonObject current, JsonObject admixture, SessionState session) {
        if (admixture == null) {
            return;
        }

        mergeTabs(current, admixture, session);

        if (session.has(InfoCategory.FILETYPES)) {
            for (AssocKind kind : AssocKind.values()) {
                mergeAssocs(current, admixture, kind, session);
            }
        }
        if (session.has(InfoCategory.COMMANDS)) {
            mergeCommands(current, admixture);
        }
        if (session.has(InfoCategory.MARKS)) {
            mergeMarks(current, admixture, session);
        }
        if (session.has(InfoCategory.BOOKMARKS)) {
            mergeBookmarks(current, admixture, session);
        }
        for (HistoryKind kind : HistoryKind.values()) {
            if (session.has(kind.category())) {
                mergeHistory(current, admixture, kind.key());
            }
        }
        if (session.has(InfoCategory.REGISTERS)) {
            mergeRegisters(current, admixture);
        }
        if (session.has(InfoCategory.DIRSTACK)) {
            mergeDirStack(current, admixture, session);
        }
        mergeTrash(current, admixture, session);
    }

    // Only directory history lives in tabs and it's merged only for single tabs.
    private void mergeTabs(JsonObject current, JsonObject admixture, SessionState session) {
        if (!session.has(InfoCategory.DHISTORY)) {
            return;
        }

        JsonArray currentGtabs = Json.array(current, DocKeys.GTABS).orElse(null);
        JsonArray updatedGtabs = Json.array(admixture, DocKeys.GTABS).orElse(null);
        if (Json.size(currentGtabs) != 1 || Json.size(updatedGtabs) != 1) {
            return;
        }

        JsonArray currentPanes = Json.objectAt(currentGtabs, 0)
                .flatMap(g -> Json.array(g, DocKeys.PANES)).orElse(null);
        JsonArray updatedPanes = Json.objectAt(updatedGtabs, 0)
                .flatMap(g -> Json.array(g, DocKeys.PANES)).orElse(null);

        for (PaneSide side : PaneSide.values()) {
            JsonArray currentPtabs = Json.objectAt(currentPanes, side.index())
                    .flatMap(p -> Json.array(p, DocKeys.PTABS)).orElse(null);
            JsonArray updatedPtabs = Json.objectAt(updatedPanes, side.index())
                    .flatMap(p -> Json.array(p, DocKeys.PTABS)).orElse(null);
            if (Json.size(currentPtabs) != 1 || Json.size(updatedPtabs) != 1) {
                continue;
            }

            Optional<JsonObject> currentTab = Json.objectAt(currentPtabs, 0);
            Optional<JsonObject> updatedTab = Json.objectAt(updatedPtabs, 0);
            if (currentTab.isPresent() && updatedTab.isPresent()) {
                mergeDirHistory(currentTab.get(), updatedTab.get(), session.pane(side), session.historyLength());
            }
        }
    }

    private void mergeDirHistory(JsonObject current, JsonObject admixture, PaneView pane, int historyLength) {
        JsonArray history = Json.array(current, DocKeys.HISTORY).orElse(null);
        JsonArray updated = Json.array(admixture, DocKeys.HISTORY).orElse(null);

        int extraSpace = historyLength - 1 - pane.historyPos();
        if (extraSpace <= 0 || Json.size(updated) == 0) {
            return;
        }

        JsonArray merged = new JsonArray();
        for (int i = 0; i < updated.size(); i++) {
            Optional<JsonObject> entry = Json.objectAt(updated, i);
            Optional<String> dir = entry.flatMap(e -> Json.string(e, DocKeys.DIR));
            if (dir.isPresent() && !pane.historyContains(dir.get()) && isDirectory(dir.get())) {
                merged.add(entry.get().deepCopy());
            }
        }
        for (int i = 0; i < Json.size(history); i++) {
            merged.add(history.get(i).deepCopy());
        }

        current.add(DocKeys.HISTORY, merged);
    }

    private void mergeAssocs(JsonObject current, JsonObject admixture, AssocKind kind, SessionState session) {
        JsonArray updated = Json.array(admixture, kind.key()).orElse(null);
        if (Json.size(updated) == 0) {
            return;
        }
        JsonArray entries = arrayOrCreate(current, kind.key());

        for (int i = 0; i < updated.size(); i++) {
            Optional<JsonObject> entry = Json.objectAt(updated, i);
            Optional<String> matchers = entry.flatMap(e -> Json.string(e, DocKeys.MATCHERS));
            Optional<String> cmd = entry.flatMap(e -> Json.string(e, DocKeys.CMD));
            if (matchers.isPresent() && cmd.isPresent()
                    && !session.associations().exists(kind, matchers.get(), cmd.get())) {
                entries.add(entry.get().deepCopy());
            }
        }
    }

    // Current definitions win on name collisions.
    private void mergeCommands(JsonObject current, JsonObject admixture) {
        Optional<JsonObject> updated = Json.object(admixture, DocKeys.CMDS);
        if (updated.isEmpty()) {
            return;
        }
        JsonObject cmds = objectOrCreate(current, DocKeys.CMDS);
        for (String name : updated.get().keySet()) {
            if (!cmds.has(name)) {
                Json.string(updated.get(), name).ifPresent(body -> cmds.addProperty(name, body));
            }
        }
    }

    private void mergeMarks(JsonObject current, JsonObject admixture, SessionState session) {
        Optional<JsonObject> updated = Json.object(admixture, DocKeys.MARKS);
        if (updated.isEmpty()) {
            return;
        }
        JsonObject marks = objectOrCreate(current, DocKeys.MARKS);
        for (Map.Entry<String, JsonElement> e : updated.get().entrySet()) {
            String name = e.getKey();
            Optional<Long> ts = Json.object(updated.get(), name).flatMap(m -> Json.longValue(m, DocKeys.TS));
            if (!name.isEmpty() && ts.isPresent() && session.marks().isOlder(name.charAt(0), ts.get())) {
                marks.add(name, e.getValue().deepCopy());
            }
        }
    }

    private void mergeBookmarks(JsonObject current, JsonObject admixture, SessionState session) {
        Optional<JsonObject> updated = Json.object(admixture, DocKeys.BMARKS);
        if (updated.isEmpty()) {
            return;
        }
        JsonObject bmarks = objectOrCreate(current, DocKeys.BMARKS);
        for (Map.Entry<String, JsonElement> e : updated.get().entrySet()) {
            String path = e.getKey();
            Optional<Long> ts = Json.object(updated.get(), path).flatMap(b -> Json.longValue(b, DocKeys.TS));
            if (ts.isPresent() && session.bookmarks().isOlder(path, ts.get())) {
                bmarks.add(path, e.getValue().deepCopy());
            }
        }
    }

    /**
     * Entries only the admixture has go first, so that entries of this
     * instance stay the most recent ones.
     */
    private void mergeHistory(JsonObject current, JsonObject admixture, String key) {
        List<String> updated = Json.strings(Json.array(admixture, key).orElse(null));
        if (updated.isEmpty()) {
            return;
        }
        List<String> entries = Json.strings(Json.array(current, key).orElse(null));

        PrefixIndex index = new PrefixIndex();
        entries.forEach(index::put);

        JsonArray merged = new JsonArray();
        for (String entry : updated) {
            if (!index.contains(entry)) {
                merged.add(entry);
            }
        }
        entries.forEach(merged::add);

        current.add(key, merged);
    }

    // Registers are taken as a whole, contents of a known one aren't mixed.
    private void mergeRegisters(JsonObject current, JsonObject admixture) {
        Optional<JsonObject> updated = Json.object(admixture, DocKeys.REGS);
        if (updated.isEmpty()) {
            return;
        }
        JsonObject regs = objectOrCreate(current, DocKeys.REGS);
        for (Map.Entry<String, JsonElement> e : updated.get().entrySet()) {
            if (!regs.has(e.getKey())) {
                regs.add(e.getKey(), e.getValue().deepCopy());
            }
        }
    }

    private void mergeDirStack(JsonObject current, JsonObject admixture, SessionState session) {
        if (session.dirStack().changed()) {
            log.debug("Directory stack changed since load, keeping it");
            return;
        }
        Json.array(admixture, DocKeys.DIR_STACK)
                .ifPresent(stack -> current.add(DocKeys.DIR_STACK, stack.deepCopy()));
    }

    private void mergeTrash(JsonObject current, JsonObject admixture, SessionState session) {
        JsonArray updated = Json.array(admixture, DocKeys.TRASH).orElse(null);
        if (Json.size(updated) == 0) {
            return;
        }
        JsonArray trash = arrayOrCreate(current, DocKeys.TRASH);

        for (int i = 0; i < updated.size(); i++) {
            Optional<JsonObject> entry = Json.objectAt(updated, i);
            Optional<String> trashed = entry.flatMap(e -> Json.string(e, DocKeys.TRASHED));
            Optional<String> original = entry.flatMap(e -> Json.string(e, DocKeys.ORIGINAL));
            if (trashed.isPresent() && original.isPresent()
                    && !session.trash().contains(original.get(), trashed.get())) {
                trash.add(entry.get().deepCopy());
            }
        }
    }

    private static JsonArray arrayOrCreate(JsonObject obj, String key) {
        return Json.array(obj, key).orElseGet(() -> Json.addArray(obj, key));
    }

    private static JsonObject objectOrCreate(JsonObject obj, String key) {
        return Json.object(obj, key).orElseGet(() -> Json.addObject(obj, key));
    }

    private static boolean isDirectory(String dir) {
        try {
            return Files.isDirectory(Paths.get(dir));
        } catch (InvalidPathException e) {
            log.debug("Skipping history entry with invalid path {}", dir);
            return false;
        }
    }
}
