package org.sessionstate;

import com.google.gson.JsonObject;
import org.sessionstate.config.StateConfig;
import org.sessionstate.document.DocumentCodec;
import org.sessionstate.impl.SimplePaneView;
import org.sessionstate.load.StateLoader;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Bookmark;
import org.sessionstate.model.DirStackEntry;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.Mark;
import org.sessionstate.model.PaneSide;
import org.sessionstate.model.SplitOrientation;
import org.sessionstate.serialize.StateSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RoundTripTest {

    @TempDir Path tmp;

    private final StateSerializer serializer = new StateSerializer();
    private final StateLoader loader = new StateLoader();

    private SessionState populated() {
        SimplePaneView left = new SimplePaneView("/l1", 15);
        left.navigate("/l2", "f2", 3);
        SessionState s = SessionState.builder(StateConfig.forDirectory(tmp))
                .panes(left, new SimplePaneView("", 15)).build();

        s.layout().setActivePane(PaneSide.RIGHT);
        s.layout().setPreview(true);
        s.layout().setOrientation(SplitOrientation.HORIZONTAL);
        s.layout().setSplitterPos(30);
        s.layout().setWindowCount(1);
        s.layout().setUseTermMultiplexer(true);
        s.layout().setColorScheme("dark");

        left.setHideDot(true);
        left.setManualFilter("^x");
        left.setAutoFilter("a.c");
        left.setInvert(false);
        left.setSortKeys(new int[]{-3, 1});

        s.options().apply("hlsearch");
        s.options().apply("shell=/bin/my sh");
        s.options().apply("columns=80");
        s.options().applyLocal(PaneSide.LEFT, "number");
        s.options().applyLocal(PaneSide.RIGHT, "viewcolumns=-{name}");

        s.associations().setPrograms("{*.txt}", "{view}less,,x,cat", false);
        s.associations().setPrograms("{*.pdf}", "zathura", true);
        s.associations().setViewers("<image/*>", "img %f");
        s.commands().define("up", "cd ..");
        s.marks().setup(new Mark('a', "/d", "f", 100));
        s.marks().setup(new Mark('\'', "/skip", "", 100));
        s.bookmarks().setup(new Bookmark("/p", "work,docs", 200));
        s.history(HistoryKind.COMMAND).add("ls");
        s.history(HistoryKind.SEARCH).add("foo");
        s.history(HistoryKind.PROMPT).add("answer");
        s.history(HistoryKind.FILTER).add("*.c");
        s.registers().append('a', "/r1");
        s.registers().append('a', "/r2");
        s.dirStack().push(new DirStackEntry("/sl", "slf", "/sr", "srf"));
        s.trash().add("/orig", "/trash/000_orig");
        return s;
    }

    @Test
    void savedStateLoadsIntoEquivalentSession() throws IOException {
        SessionState original = populated();
        Path file = tmp.resolve("state.json");
        DocumentCodec.write(serializer.serialize(original), file);

        SessionState restored = SessionState.builder(StateConfig.forDirectory(tmp)).build();
        loader.load(DocumentCodec.parse(file).orElseThrow(), restored, false);

        assertEquals(PaneSide.RIGHT, restored.layout().activePane());
        assertEquals(1, restored.layout().windowCount());
        assertEquals("dark", restored.layout().colorScheme());
        assertEquals("/l2", restored.pane(PaneSide.LEFT).currentDir());
        assertEquals("f2", restored.pane(PaneSide.LEFT).currentFile());
        assertEquals(original.pane(PaneSide.LEFT).history(), restored.pane(PaneSide.LEFT).history());
        assertEquals(original.pane(PaneSide.LEFT).filters(), restored.pane(PaneSide.LEFT).filters());
        assertArrayEquals(original.pane(PaneSide.LEFT).sortKeys(), restored.pane(PaneSide.LEFT).sortKeys());
        assertEquals("/bin/my sh", restored.options().text("shell"));
        assertTrue(restored.options().localFlag(PaneSide.LEFT, "number"));
        assertEquals(original.associations().list(AssocKind.FILETYPE), restored.associations().list(AssocKind.FILETYPE));
        assertEquals(original.associations().list(AssocKind.XFILETYPE), restored.associations().list(AssocKind.XFILETYPE));
        assertEquals(original.associations().list(AssocKind.VIEWER), restored.associations().list(AssocKind.VIEWER));
        assertEquals(original.commands().userCommands(), restored.commands().userCommands());
        assertEquals(1, restored.marks().list().size());
        assertEquals(original.bookmarks().list(), restored.bookmarks().list());
        for (HistoryKind kind : HistoryKind.values()) {
            assertEquals(original.history(kind).items(), restored.history(kind).items());
        }
        assertEquals(original.registers().list(), restored.registers().list());
        assertEquals(original.dirStack().entries(), restored.dirStack().entries());
        assertEquals(original.trash().entries(), restored.trash().entries());

        JsonObject first = serializer.serialize(original);
        JsonObject second = serializer.serialize(restored);
        assertEquals(first, second);
    }
}
