package org.sessionstate;

import com.google.gson.JsonObject;
import org.sessionstate.config.StateConfig;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.DocumentCodec;
import org.sessionstate.document.Json;
import org.sessionstate.model.Bookmark;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.Mark;
import org.sessionstate.persistence.FileSessionStore;
import org.sessionstate.util.AtomicFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSessionStoreTest {

    @TempDir Path tmp;

    private SessionState session(StateConfig config) {
        return SessionState.builder(config).build();
    }

    private SessionState session() {
        return session(StateConfig.forDirectory(tmp));
    }

    @Test
    void nothingToLoad() {
        assertFalse(new FileSessionStore(session()).load(false));
    }

    @Test
    void savedStateIsLoadedByAnotherInstance() {
        SessionState first = session();
        first.bookmarks().setup(new Bookmark("/p", "work", 10));
        first.commands().define("up", "cd ..");

        assertTrue(new FileSessionStore(first).save());
        Path file = first.config().structuredFile();
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(AtomicFiles.processUniqueSibling(file)));

        SessionState second = session();
        assertTrue(new FileSessionStore(second).load(false));
        assertEquals(first.bookmarks().list(), second.bookmarks().list());
        assertEquals("cd ..", second.commands().userCommands().get("up"));
    }

    @Test
    void saveCanBeRepeated() {
        SessionState s = session();
        FileSessionStore store = new FileSessionStore(s);
        s.history(HistoryKind.COMMAND).add("ls");

        assertTrue(store.save());
        assertTrue(store.save());

        JsonObject saved = DocumentCodec.parse(s.config().structuredFile()).orElseThrow();
        assertEquals(List.of("ls"), Json.strings(Json.array(saved, DocKeys.CMD_HIST).orElseThrow()));
    }

    @Test
    void concurrentInstancesKeepEachOthersBookmarks() {
        SessionState first = session();
        SessionState second = session();
        FileSessionStore firstStore = new FileSessionStore(first);
        FileSessionStore secondStore = new FileSessionStore(second);
        firstStore.load(false);
        secondStore.load(false);

        first.bookmarks().setup(new Bookmark("/a", "one", 10));
        assertTrue(firstStore.save());
        second.bookmarks().setup(new Bookmark("/b", "two", 20));
        assertTrue(secondStore.save());

        SessionState third = session();
        assertTrue(new FileSessionStore(third).load(false));
        assertTrue(third.bookmarks().find("/a").isPresent());
        assertTrue(third.bookmarks().find("/b").isPresent());
    }

    @Test
    void newerMarkFromOtherInstanceWins() {
        SessionState first = session();
        SessionState second = session();
        FileSessionStore firstStore = new FileSessionStore(first);
        FileSessionStore secondStore = new FileSessionStore(second);

        first.marks().setup(new Mark('a', "/newer", "", 200));
        assertTrue(firstStore.save());
        second.marks().setup(new Mark('a', "/older", "", 100));
        assertTrue(secondStore.save());

        SessionState third = session();
        new FileSessionStore(third).load(false);
        assertEquals("/newer", third.marks().find('a').orElseThrow().dir());
    }

    @Test
    void unchangedFileIsNotMergedBack() {
        StateConfig config = StateConfig.forDirectory(tmp).withHistoryLength(2);
        SessionState first = session(config);
        first.history(HistoryKind.COMMAND).add("a");
        first.history(HistoryKind.COMMAND).add("b");
        assertTrue(new FileSessionStore(first).save());

        SessionState second = session(config);
        FileSessionStore store = new FileSessionStore(second);
        assertTrue(store.load(false));
        second.history(HistoryKind.COMMAND).add("c");
        assertTrue(store.save());

        JsonObject saved = DocumentCodec.parse(config.structuredFile()).orElseThrow();
        assertEquals(List.of("b", "c"), Json.strings(Json.array(saved, DocKeys.CMD_HIST).orElseThrow()));
    }

    @Test
    void legacyFileIsUsedWhenStructuredOneIsBroken() throws IOException {
        SessionState s = session();
        Files.writeString(s.config().structuredFile(), "{", StandardCharsets.UTF_8);
        Files.writeString(s.config().legacyFile(),
                String.join("\n", "b/good", "tag1,tag2", "77", ":ls", "'a", "/d", "f", "9") + "\n",
                StandardCharsets.UTF_8);

        FileSessionStore store = new FileSessionStore(s);
        assertTrue(store.load(false));
        assertEquals("tag1,tag2", s.bookmarks().find("/good").orElseThrow().tags());
        assertEquals(List.of("ls"), s.history(HistoryKind.COMMAND).items());
        assertEquals(9L, s.marks().find('a').orElseThrow().timestamp());

        assertTrue(store.save());
        JsonObject saved = DocumentCodec.parse(s.config().structuredFile()).orElseThrow();
        assertTrue(Json.object(saved, DocKeys.BMARKS).orElseThrow().has("/good"));
    }

    @Test
    void loadFreezesDirStack() {
        SessionState s = session();
        FileSessionStore store = new FileSessionStore(s);
        assertTrue(store.save());

        assertTrue(store.load(false));
        assertFalse(s.dirStack().changed());
    }

    @Test
    void failedSaveLeavesNoTemporaryFile() throws IOException {
        SessionState s = session();
        Path target = s.config().structuredFile();
        Files.createDirectories(target.resolve("occupied"));

        assertFalse(new FileSessionStore(s).save());
        assertFalse(Files.exists(AtomicFiles.processUniqueSibling(target)));
        assertTrue(Files.isDirectory(target));
    }

    @Test
    void failedCopySkipsTheSave() throws IOException {
        SessionState s = session();
        FileSessionStore store = new FileSessionStore(s);
        s.commands().define("up", "cd ..");
        assertTrue(store.save());

        Path target = s.config().structuredFile();
        Files.createDirectories(AtomicFiles.processUniqueSibling(target).resolve("occupied"));
        s.commands().define("ll", "ls -l");

        assertFalse(store.save());
        JsonObject saved = DocumentCodec.parse(target).orElseThrow();
        JsonObject cmds = Json.object(saved, DocKeys.CMDS).orElseThrow();
        assertTrue(cmds.has("up"));
        assertFalse(cmds.has("ll"));
    }

    @Test
    void missingStateDirectoryIsCreated() {
        SessionState s = session(StateConfig.forDirectory(tmp.resolve("nested/state")));

        assertTrue(new FileSessionStore(s).save());
        assertTrue(Files.exists(s.config().structuredFile()));
    }
}
