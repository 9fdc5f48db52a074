package org.sessionstate;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.sessionstate.config.InfoCategory;
import org.sessionstate.config.StateConfig;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.Json;
import org.sessionstate.impl.InMemoryAssociationRegistry;
import org.sessionstate.impl.SimplePaneView;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Association;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.Mark;
import org.sessionstate.model.PaneSide;
import org.sessionstate.serialize.StateSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateSerializerTest {

    @TempDir Path tmp;

    private final StateSerializer serializer = new StateSerializer();

    private SessionState session(Set<InfoCategory> categories) {
        return SessionState.builder(StateConfig.forDirectory(tmp).withCategories(categories)).build();
    }

    private static JsonObject tab(JsonObject root, int pane) {
        JsonObject gtab = Json.objectAt(Json.array(root, DocKeys.GTABS).orElseThrow(), 0).orElseThrow();
        JsonObject p = Json.objectAt(Json.array(gtab, DocKeys.PANES).orElseThrow(), pane).orElseThrow();
        return Json.objectAt(Json.array(p, DocKeys.PTABS).orElseThrow(), 0).orElseThrow();
    }

    @Test
    void withoutCategoriesOnlyTabsAreWritten() {
        JsonObject root = serializer.serialize(session(EnumSet.noneOf(InfoCategory.class)));

        assertEquals(Set.of(DocKeys.GTABS), root.keySet());
        JsonObject gtab = Json.objectAt(Json.array(root, DocKeys.GTABS).orElseThrow(), 0).orElseThrow();
        assertEquals(2, Json.array(gtab, DocKeys.PANES).orElseThrow().size());
        assertFalse(gtab.has(DocKeys.SPLITTER));
        assertEquals(0, tab(root, 0).size());
        assertEquals(0, tab(root, 1).size());
    }

    @Test
    void trashIsWrittenRegardlessOfCategories() {
        SessionState s = session(EnumSet.noneOf(InfoCategory.class));
        s.trash().add("/home/u/file", "/trash/000_file");

        JsonArray trash = Json.array(serializer.serialize(s), DocKeys.TRASH).orElseThrow();
        JsonObject entry = Json.objectAt(trash, 0).orElseThrow();
        assertEquals("/trash/000_file", Json.string(entry, DocKeys.TRASHED).orElseThrow());
        assertEquals("/home/u/file", Json.string(entry, DocKeys.ORIGINAL).orElseThrow());
    }

    @Test
    void specialMarksAreNotWritten() {
        SessionState s = session(EnumSet.of(InfoCategory.MARKS));
        s.marks().setup(new Mark('a', "/d", "f", 10));
        s.marks().setup(new Mark('<', "/d", "f", 10));
        s.marks().setup(new Mark('\'', "/d", "f", 10));

        JsonObject marks = Json.object(serializer.serialize(s), DocKeys.MARKS).orElseThrow();
        assertEquals(Set.of("a"), marks.keySet());
        assertEquals(10L, Json.longValue(Json.object(marks, "a").orElseThrow(), DocKeys.TS).orElseThrow());
    }

    @Test
    void associationsSkipBuiltinAndEmptyCommands() {
        InMemoryAssociationRegistry registry = new InMemoryAssociationRegistry();
        registry.add(AssocKind.FILETYPE, new Association("{*.c}", "gcc a,b", "compile", false));
        registry.add(AssocKind.FILETYPE, new Association("{*.c}", "vim", "", true));
        registry.add(AssocKind.FILETYPE, Association.of("{*.h}", ""));
        registry.add(AssocKind.VIEWER, Association.of("{*.md}", "cat"));
        SessionState s = SessionState.builder(StateConfig.forDirectory(tmp)
                        .withCategories(EnumSet.of(InfoCategory.FILETYPES)))
                .associations(registry)
                .build();

        JsonObject root = serializer.serialize(s);
        JsonArray assocs = Json.array(root, DocKeys.ASSOCS).orElseThrow();
        assertEquals(1, assocs.size());
        assertEquals("{compile}gcc a,,b",
                Json.string(Json.objectAt(assocs, 0).orElseThrow(), DocKeys.CMD).orElseThrow());
        assertEquals(0, Json.array(root, DocKeys.XASSOCS).orElseThrow().size());
        assertEquals(1, Json.array(root, DocKeys.VIEWERS).orElseThrow().size());
    }

    @Test
    void emptyStringHistoriesAreOmitted() {
        SessionState s = session(EnumSet.of(InfoCategory.CHISTORY, InfoCategory.SHISTORY));
        s.history(HistoryKind.SEARCH).add("pattern");
        s.history(HistoryKind.PROMPT).add("ignored");

        JsonObject root = serializer.serialize(s);
        assertFalse(root.has(DocKeys.CMD_HIST));
        assertEquals(List.of("pattern"), Json.strings(Json.array(root, DocKeys.SEARCH_HIST).orElseThrow()));
        assertFalse(root.has(DocKeys.PROMPT_HIST));
    }

    @Test
    void directoryHistoryIncludesCurrentLocation() {
        SimplePaneView left = new SimplePaneView("/start", 15);
        left.navigate("/next", "file.c", 4);
        SessionState s = SessionState.builder(StateConfig.forDirectory(tmp)
                        .withCategories(EnumSet.of(InfoCategory.DHISTORY)))
                .panes(left, new SimplePaneView("", 15))
                .build();

        JsonObject root = serializer.serialize(s);
        JsonArray history = Json.array(tab(root, 0), DocKeys.HISTORY).orElseThrow();
        assertEquals(2, history.size());
        JsonObject last = Json.objectAt(history, 1).orElseThrow();
        assertEquals("/next", Json.string(last, DocKeys.DIR).orElseThrow());
        assertEquals("file.c", Json.string(last, DocKeys.FILE).orElseThrow());
        assertEquals(4, Json.integer(last, DocKeys.RELPOS).orElseThrow());
        assertFalse(Json.bool(tab(root, 0), DocKeys.RESTORE_LAST_LOCATION).orElseThrow());
        assertEquals(0, Json.array(tab(root, 1), DocKeys.HISTORY).orElseThrow().size());
    }

    @Test
    void restoreLastLocationFollowsSavedirs() {
        JsonObject root = serializer.serialize(session(EnumSet.of(InfoCategory.DHISTORY, InfoCategory.SAVEDIRS)));
        assertTrue(Json.bool(tab(root, 1), DocKeys.RESTORE_LAST_LOCATION).orElseThrow());
    }

    @Test
    void zeroHistoryLengthDisablesDirectoryHistory() {
        SessionState s = SessionState.builder(StateConfig.forDirectory(tmp).withHistoryLength(0)).build();
        assertFalse(tab(serializer.serialize(s), 0).has(DocKeys.HISTORY));
    }

    @Test
    void optionsAreFlattened() {
        SessionState s = session(EnumSet.of(InfoCategory.OPTIONS));
        s.options().apply("shell=/bin/my sh");
        s.options().apply("hlsearch");
        s.options().apply("columns=80");
        s.options().applyLocal(PaneSide.RIGHT, "number");
        s.options().applyLocal(PaneSide.RIGHT, "numberwidth=6");

        JsonObject root = serializer.serialize(s);
        List<String> global = Json.strings(Json.array(root, DocKeys.OPTIONS).orElseThrow());
        assertTrue(global.contains("shell=/bin/my\\ sh"), global.toString());
        assertTrue(global.contains("hlsearch"));
        assertTrue(global.contains("noignorecase"));
        assertTrue(global.contains("columns=80"));
        assertFalse(global.stream().anyMatch(o -> o.startsWith("lines=")));

        List<String> right = Json.strings(Json.array(tab(root, 1), DocKeys.OPTIONS).orElseThrow());
        assertTrue(right.contains("number"));
        assertTrue(right.contains("numberwidth=6"));
        List<String> left = Json.strings(Json.array(tab(root, 0), DocKeys.OPTIONS).orElseThrow());
        assertTrue(left.contains("nonumber"));
    }

    @Test
    void layoutIsGatedByTui() {
        SessionState s = session(EnumSet.of(InfoCategory.TUI, InfoCategory.STATE, InfoCategory.CS));
        s.layout().setActivePane(PaneSide.RIGHT);
        s.layout().setWindowCount(1);
        s.layout().setSplitterPos(33);
        s.layout().setColorScheme("dark");
        s.pane(PaneSide.LEFT).setSortKeys(new int[] {-3, 1});

        JsonObject root = serializer.serialize(s);
        JsonObject gtab = Json.objectAt(Json.array(root, DocKeys.GTABS).orElseThrow(), 0).orElseThrow();
        JsonObject splitter = Json.object(gtab, DocKeys.SPLITTER).orElseThrow();
        assertEquals(1, Json.integer(gtab, DocKeys.ACTIVE_PANE).orElseThrow());
        assertTrue(Json.bool(splitter, DocKeys.EXPANDED).orElseThrow());
        assertEquals(33, Json.integer(splitter, DocKeys.POS).orElseThrow());
        assertEquals("v", Json.string(splitter, DocKeys.ORIENTATION).orElseThrow());
        assertEquals("-3,1", Json.string(tab(root, 0), DocKeys.SORTING).orElseThrow());
        assertEquals("2", Json.string(tab(root, 1), DocKeys.SORTING).orElseThrow());
        assertEquals("dark", Json.string(root, DocKeys.COLOR_SCHEME).orElseThrow());
        assertFalse(Json.bool(root, DocKeys.USE_TERM_MULTIPLEXER).orElseThrow());
        assertTrue(Json.object(tab(root, 0), DocKeys.FILTERS).isPresent());
    }
}
