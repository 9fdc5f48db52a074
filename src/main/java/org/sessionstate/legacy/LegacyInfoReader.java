package org.sessionstate.legacy;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.sessionstate.document.DocKeys;
import org.sessionstate.document.DocumentCodec;
import org.sessionstate.document.Json;
import org.sessionstate.model.Register;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads the legacy line-oriented state file into a document of the same
 * shape as the structured file.
 * <p>
 * Every record starts with a tag character followed by its value; some
 * records continue on the following lines. A record whose continuation is
 * cut short by the end of file is dropped.
 */
public final class LegacyInfoReader {

    private static final Logger log = LoggerFactory.getLogger(LegacyInfoReader.class);

    private final Path trashDir;
    private final Clock clock;

    /**
     * @param trashDir directory relative trash entries are resolved against
     * @param clock    source of timestamps for marks stored without one
     */
    public LegacyInfoReader(Path trashDir, Clock clock) {
        this.trashDir = trashDir;
        this.clock = clock;
    }

    public LegacyInfoReader(Path trashDir) {
        this(trashDir, Clock.systemUTC());
    }

    /**
     * @param file legacy state file
     * @return equivalent document, or empty if the file can't be read
     */
    public Optional<JsonObject> read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (BufferedReader r = DocumentCodec.openLenient(file)) {
            return Optional.of(read(new LineSource(r)));
        } catch (IOException e) {
            log.warn("Cannot read legacy state file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private JsonObject read(LineSource in) throws IOException {
        Target t = new Target();

        String line;
        while ((line = in.next()) != null) {
            if (line.isEmpty() || line.charAt(0) == LegacyTags.COMMENT) {
                continue;
            }
            char type = line.charAt(0);
            String value = line.substring(1);

            switch (type) {
                case LegacyTags.OPTION -> readOption(t, value);
                case LegacyTags.FILETYPE -> readAssoc(in, t.assocs, value, true);
                case LegacyTags.XFILETYPE -> readAssoc(in, t.xassocs, value, true);
                case LegacyTags.FILEVIEWER -> readAssoc(in, t.viewers, value, false);
                case LegacyTags.COMMAND -> {
                    String body = in.next();
                    if (body != null) {
                        t.cmds.addProperty(value, body);
                    }
                }
                case LegacyTags.MARK -> readMark(in, t, value);
                case LegacyTags.BOOKMARK -> readBookmark(in, t, value);
                case LegacyTags.ACTIVE_VIEW ->
                        t.gtab.addProperty(DocKeys.ACTIVE_PANE, value.startsWith("l") ? 0 : 1);
                case LegacyTags.QUICK_VIEW_STATE -> t.gtab.addProperty(DocKeys.PREVIEW, atoi(value) != 0);
                case LegacyTags.WIN_COUNT -> t.splitter.addProperty(DocKeys.EXPANDED, atoi(value) == 1);
                case LegacyTags.SPLIT_ORIENTATION ->
                        t.splitter.addProperty(DocKeys.ORIENTATION, value.startsWith("v") ? "v" : "h");
                case LegacyTags.SPLIT_POSITION -> t.splitter.addProperty(DocKeys.POS, atoi(value));
                case LegacyTags.LWIN_SORT -> t.leftTab.addProperty(DocKeys.SORTING, value);
                case LegacyTags.RWIN_SORT -> t.rightTab.addProperty(DocKeys.SORTING, value);
                case LegacyTags.LWIN_HIST -> readDirHistory(in, t.leftTab, t.leftHistory, value);
                case LegacyTags.RWIN_HIST -> readDirHistory(in, t.rightTab, t.rightHistory, value);
                case LegacyTags.CMDLINE_HIST -> t.cmdHist.add(value);
                case LegacyTags.SEARCH_HIST -> t.searchHist.add(value);
                case LegacyTags.PROMPT_HIST -> t.promptHist.add(value);
                case LegacyTags.FILTER_HIST -> t.lfiltHist.add(value);
                case LegacyTags.DIR_STACK -> readDirStack(in, t, value);
                case LegacyTags.TRASH -> {
                    String original = in.next();
                    if (original != null) {
                        JsonObject entry = Json.appendObject(t.trash);
                        entry.addProperty(DocKeys.TRASHED, convertTrashPath(value));
                        entry.addProperty(DocKeys.ORIGINAL, original);
                    }
                }
                case LegacyTags.REG -> readRegister(t, value);
                case LegacyTags.LWIN_FILT -> t.leftFilters.addProperty(DocKeys.MANUAL, value);
                case LegacyTags.RWIN_FILT -> t.rightFilters.addProperty(DocKeys.MANUAL, value);
                case LegacyTags.LWIN_FILT_INV -> t.leftFilters.addProperty(DocKeys.INVERT, atoi(value) != 0);
                case LegacyTags.RWIN_FILT_INV -> t.rightFilters.addProperty(DocKeys.INVERT, atoi(value) != 0);
                case LegacyTags.USE_SCREEN -> t.root.addProperty(DocKeys.USE_TERM_MULTIPLEXER, atoi(value) != 0);
                case LegacyTags.COLORSCHEME -> t.root.addProperty(DocKeys.COLOR_SCHEME, value);
                case LegacyTags.LWIN_SPECIFIC -> readViewSpecific(t.leftFilters, value);
                case LegacyTags.RWIN_SPECIFIC -> readViewSpecific(t.rightFilters, value);
                default -> log.debug("Skipping legacy record with unknown tag '{}'", type);
            }
        }

        return t.root;
    }

    private static void readOption(Target t, String value) {
        if (value.isEmpty()) {
            t.options.add(value);
        } else if (value.charAt(0) == LegacyTags.LEFT_OPTION) {
            t.leftOptions.add(value.substring(1));
        } else if (value.charAt(0) == LegacyTags.RIGHT_OPTION) {
            t.rightOptions.add(value.substring(1));
        } else {
            t.options.add(value);
        }
    }

    private static void readAssoc(LineSource in, JsonArray target, String matchers, boolean dropPseudo)
            throws IOException {
        String cmd = in.next();
        if (cmd == null) {
            return;
        }
        if (dropPseudo && isPseudoCommand(cmd)) {
            log.debug("Dropping builtin association for {}", matchers);
            return;
        }
        JsonObject entry = Json.appendObject(target);
        entry.addProperty(DocKeys.MATCHERS, matchers);
        entry.addProperty(DocKeys.CMD, cmd);
    }

    private static boolean isPseudoCommand(String cmd) {
        return cmd.endsWith("}" + LegacyTags.PSEUDO_CMD);
    }

    private void readMark(LineSource in, Target t, String value) throws IOException {
        String dir = in.next();
        if (dir == null) {
            return;
        }
        String file = in.next();
        if (file == null) {
            return;
        }
        OptionalLong ts = in.optionalNumber();
        if (value.isEmpty()) {
            return;
        }
        long timestamp = ts.isPresent() ? ts.getAsLong() : clock.instant().getEpochSecond();

        JsonObject mark = Json.addObject(t.marks, value.substring(0, 1));
        mark.addProperty(DocKeys.DIR, dir);
        mark.addProperty(DocKeys.FILE, file);
        Json.setLong(mark, DocKeys.TS, timestamp);
    }

    private static void readBookmark(LineSource in, Target t, String path) throws IOException {
        String tags = in.next();
        if (tags == null) {
            return;
        }
        String tsLine = in.next();
        if (tsLine == null) {
            return;
        }
        long ts;
        try {
            ts = Long.parseLong(tsLine);
        } catch (NumberFormatException e) {
            log.debug("Dropping bookmark {} with bad timestamp '{}'", path, tsLine);
            return;
        }
        JsonObject bmark = Json.addObject(t.bmarks, path);
        bmark.addProperty(DocKeys.TAGS, tags);
        Json.setLong(bmark, DocKeys.TS, ts);
    }

    private static void readDirHistory(LineSource in, JsonObject tab, JsonArray history, String dir)
            throws IOException {
        if (dir.isEmpty()) {
            tab.addProperty(DocKeys.RESTORE_LAST_LOCATION, true);
            return;
        }
        String file = in.next();
        if (file == null) {
            return;
        }
        OptionalLong relPos = in.optionalNumber();

        JsonObject entry = Json.appendObject(history);
        entry.addProperty(DocKeys.DIR, dir);
        entry.addProperty(DocKeys.FILE, file);
        entry.addProperty(DocKeys.RELPOS, relPos.isPresent() ? (int) relPos.getAsLong() : -1);
    }

    private static void readDirStack(LineSource in, Target t, String leftDir) throws IOException {
        String leftFile = in.next();
        if (leftFile == null) {
            return;
        }
        String rightDir = in.next();
        if (rightDir == null) {
            return;
        }
        String rightFile = in.next();
        if (rightFile == null) {
            return;
        }
        JsonObject entry = Json.appendObject(t.dirStack);
        entry.addProperty(DocKeys.LEFT_DIR, leftDir);
        entry.addProperty(DocKeys.LEFT_FILE, leftFile);
        // the right directory line carries a marker character
        entry.addProperty(DocKeys.RIGHT_DIR, rightDir.isEmpty() ? "" : rightDir.substring(1));
        entry.addProperty(DocKeys.RIGHT_FILE, rightFile);
    }

    private static void readRegister(Target t, String value) {
        if (value.isEmpty() || !Register.isValidName(value.charAt(0))) {
            return;
        }
        String name = value.substring(0, 1);
        JsonArray files = Json.array(t.regs, name).orElseGet(() -> Json.addArray(t.regs, name));
        files.add(value.substring(1));
    }

    private static void readViewSpecific(JsonObject filters, String value) {
        if (value.isEmpty()) {
            return;
        }
        if (value.charAt(0) == LegacyTags.PROP_DOTFILES) {
            filters.addProperty(DocKeys.DOT, atoi(value.substring(1)) != 0);
        } else if (value.charAt(0) == LegacyTags.PROP_AUTO_FILTER) {
            filters.addProperty(DocKeys.AUTO, value.substring(1));
        }
    }

    /**
     * Relative trash paths written by old versions are made absolute when the
     * trash directory is usable and the file is really there.
     */
    private String convertTrashPath(String trashPath) {
        if (trashDir == null || Paths.get(trashPath).isAbsolute() || !Files.isWritable(trashDir)) {
            return trashPath;
        }
        Path full = trashDir.resolve(trashPath);
        if (Files.exists(full, LinkOption.NOFOLLOW_LINKS)) {
            return trashDir + "/" + trashPath;
        }
        return trashPath;
    }

    /** Leading integer of the string, {@code 0} if there is none. */
    static int atoi(String s) {
        String t = s.stripLeading();
        int i = 0;
        if (i < t.length() && (t.charAt(i) == '-' || t.charAt(i) == '+')) {
            i++;
        }
        int start = i;
        while (i < t.length() && Character.isDigit(t.charAt(i))) {
            i++;
        }
        if (i == start) {
            return 0;
        }
        try {
            return Integer.parseInt(t.substring(0, i));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** Nodes of the document being built. */
    private static final class Target {
        final JsonObject root = new JsonObject();

        final JsonArray options = Json.addArray(root, DocKeys.OPTIONS);
        final JsonArray assocs = Json.addArray(root, DocKeys.ASSOCS);
        final JsonArray xassocs = Json.addArray(root, DocKeys.XASSOCS);
        final JsonArray viewers = Json.addArray(root, DocKeys.VIEWERS);
        final JsonObject cmds = Json.addObject(root, DocKeys.CMDS);
        final JsonObject marks = Json.addObject(root, DocKeys.MARKS);
        final JsonObject bmarks = Json.addObject(root, DocKeys.BMARKS);
        final JsonArray cmdHist = Json.addArray(root, DocKeys.CMD_HIST);
        final JsonArray searchHist = Json.addArray(root, DocKeys.SEARCH_HIST);
        final JsonArray promptHist = Json.addArray(root, DocKeys.PROMPT_HIST);
        final JsonArray lfiltHist = Json.addArray(root, DocKeys.LFILT_HIST);
        final JsonArray dirStack = Json.addArray(root, DocKeys.DIR_STACK);
        final JsonArray trash = Json.addArray(root, DocKeys.TRASH);
        final JsonObject regs = Json.addObject(root, DocKeys.REGS);

        final JsonObject gtab = Json.appendObject(Json.addArray(root, DocKeys.GTABS));
        final JsonObject splitter = Json.addObject(gtab, DocKeys.SPLITTER);

        final JsonArray panes = Json.addArray(gtab, DocKeys.PANES);
        final JsonObject leftTab = Json.appendObject(Json.addArray(Json.appendObject(panes), DocKeys.PTABS));
        final JsonObject rightTab = Json.appendObject(Json.addArray(Json.appendObject(panes), DocKeys.PTABS));

        final JsonArray leftHistory = Json.addArray(leftTab, DocKeys.HISTORY);
        final JsonArray rightHistory = Json.addArray(rightTab, DocKeys.HISTORY);
        final JsonObject leftFilters = Json.addObject(leftTab, DocKeys.FILTERS);
        final JsonObject rightFilters = Json.addObject(rightTab, DocKeys.FILTERS);
        final JsonArray leftOptions = Json.addArray(leftTab, DocKeys.OPTIONS);
        final JsonArray rightOptions = Json.addArray(rightTab, DocKeys.OPTIONS);
    }
}
