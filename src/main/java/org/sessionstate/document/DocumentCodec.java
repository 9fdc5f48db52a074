package org.sessionstate.document;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes the structured state document.
 * <p>
 * Parsing never throws: a missing, unreadable or malformed file, as well as a
 * file whose root is not an object, all yield {@link Optional#empty()}.
 */
public final class DocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(DocumentCodec.class);

    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private DocumentCodec() {}

    /**
     * Parses the file as a state document.
     *
     * @param file path to read
     * @return root object, or empty if the file can't be used
     */
    public static Optional<JsonObject> parse(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (Reader r = openLenient(file)) {
            JsonElement root = JsonParser.parseReader(r);
            if (!root.isJsonObject()) {
                log.warn("State file {} does not contain an object", file);
                return Optional.empty();
            }
            return Optional.of(root.getAsJsonObject());
        } catch (IOException | JsonParseException e) {
            log.warn("Cannot parse state file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Opens a UTF-8 reader that substitutes U+FFFD for malformed bytes, so
     * that a file name in another encoding doesn't make the whole file unreadable.
     */
    public static BufferedReader openLenient(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }

    /** Parses a document from text, same rules as {@link #parse(Path)}. */
    public static Optional<JsonObject> parse(String text) {
        try {
            JsonElement root = JsonParser.parseString(text);
            return root.isJsonObject() ? Optional.of(root.getAsJsonObject()) : Optional.empty();
        } catch (JsonParseException e) {
            log.debug("Cannot parse state document: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the document to the file, replacing its contents.
     *
     * @throws IOException if the file can't be written
     */
    public static void write(JsonObject root, Path file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (JsonIOException e) {
            throw new IOException("Cannot write " + file, e);
        }
    }

    /** @return compact textual form of the document. */
    public static String toText(JsonObject root) {
        return GSON.toJson(root);
    }
}
