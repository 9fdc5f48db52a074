package org.sessionstate;

import org.sessionstate.config.InfoCategory;
import org.sessionstate.config.StateConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class StateConfigTest {

    @TempDir Path tmp;

    @Test
    void parsesCategoryListSkippingUnknownNames() {
        assertEquals(EnumSet.of(InfoCategory.BOOKMARKS, InfoCategory.DHISTORY, InfoCategory.MARKS),
                InfoCategory.parse("bookmarks, dhistory,,bogus,MARKS"));
        assertTrue(InfoCategory.parse("").isEmpty());
        assertTrue(InfoCategory.parse(null).isEmpty());
    }

    @Test
    void formatsCategoriesInDeclarationOrder() {
        assertEquals("marks,bookmarks",
                InfoCategory.format(EnumSet.of(InfoCategory.BOOKMARKS, InfoCategory.MARKS)));
        assertEquals(InfoCategory.all(), InfoCategory.parse(InfoCategory.format(InfoCategory.all())));
    }

    @Test
    void forDirectoryEnablesEverything() {
        StateConfig config = StateConfig.forDirectory(tmp);
        assertEquals(tmp.resolve("vifminfo.json"), config.structuredFile());
        assertEquals(tmp.resolve("vifminfo"), config.legacyFile());
        assertEquals(tmp.resolve("Trash"), config.trashDir());
        assertTrue(config.has(InfoCategory.REGISTERS));
        assertEquals(15, config.historyLength());
    }

    @Test
    void fromPropertiesAppliesValuesAndDefaults() {
        Properties props = new Properties();
        props.setProperty("state.dir", tmp.toString());
        props.setProperty("history.length", "not a number");
        props.setProperty("categories", "tui,state");

        StateConfig config = StateConfig.fromProperties(props);
        assertEquals(tmp, config.stateDir());
        assertEquals(tmp.resolve("Trash"), config.trashDir());
        assertEquals(15, config.historyLength());
        assertEquals(EnumSet.of(InfoCategory.TUI, InfoCategory.STATE), config.categories());
        assertFalse(config.has(InfoCategory.BOOKMARKS));
    }

    @Test
    void loadReadsOverrideFile() throws IOException {
        Path overrides = tmp.resolve("custom.properties");
        Files.writeString(overrides, "state.dir=" + tmp.toString().replace("\\", "/") + "\n"
                + "history.length=42\n"
                + "structured.file=state.json\n", StandardCharsets.UTF_8);

        StateConfig config = StateConfig.load(overrides);
        assertEquals(42, config.historyLength());
        assertEquals(tmp.resolve("state.json"), config.structuredFile());
        assertEquals(EnumSet.of(InfoCategory.BOOKMARKS), config.categories());
    }

    @Test
    void copiesAreIndependent() {
        StateConfig config = StateConfig.forDirectory(tmp);
        StateConfig fewer = config.withCategories(EnumSet.of(InfoCategory.MARKS)).withHistoryLength(-3);
        assertEquals(0, fewer.historyLength());
        assertEquals(EnumSet.of(InfoCategory.MARKS), fewer.categories());
        assertEquals(InfoCategory.all(), config.categories());
        assertThrows(UnsupportedOperationException.class, () -> fewer.categories().clear());
    }
}
