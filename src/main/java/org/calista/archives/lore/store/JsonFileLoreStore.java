package org.calista.archives.lore.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.io.FileIO;
import org.calista.archives.lore.entry.Category;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * JsonFileLoreStore: one JSON document per category.
 *
 * <pre>
 * &lt;databaseDir&gt;/characters.json
 * { "entries": { "&lt;id&gt;": { ... } }, "metadata": { "last_updated": "..." } }
 * </pre>
 *
 * Writes go through {@link FileIO} (atomic commit). Documents are handled as JSON trees so
 * that keys this version does not know about survive a load/save cycle.
 */
public final class JsonFileLoreStore implements LoreStore {
    private static final Logger log = LogManager.getLogger(JsonFileLoreStore.class);

    public static final String ENTRIES = "entries";
    public static final String METADATA = "metadata";
    public static final String LAST_UPDATED = "last_updated";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path databaseDir;
    private final Clock clock;

    public JsonFileLoreStore(FileIO io, ObjectMapper mapper, Path databaseDir) {
        this(io, mapper, databaseDir, Clock.systemUTC());
    }

    public JsonFileLoreStore(FileIO io, ObjectMapper mapper, Path databaseDir, Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.databaseDir = Objects.requireNonNull(databaseDir, "databaseDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path databaseDir() {
        return databaseDir;
    }

    public Path categoryFile(Category category) {
        Objects.requireNonNull(category, "category");
        return databaseDir.resolve(category.fileName());
    }

    // ---------------------------------------------------------------------
    // Read
    // ---------------------------------------------------------------------

    @Override
    public Map<String, JsonNode> readCategory(Category category) throws IOException {
        ObjectNode doc = loadDocument(category);
        JsonNode entries = doc.get(ENTRIES);

        LinkedHashMap<String, JsonNode> out = new LinkedHashMap<>();
        if (entries == null || entries.isNull()) return out;
        if (!entries.isObject()) throw new IOException("'" + ENTRIES + "' is not an object in " + categoryFile(category));

        Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    /**
     * Loads the whole category document. A missing or blank file yields a fresh empty document.
     */
    public ObjectNode loadDocument(Category category) throws IOException {
        Path file = categoryFile(category);
        Optional<String> json = io.readStringIfExists(file);
        if (json.isEmpty() || json.get().isBlank()) return emptyDocument();

        JsonNode root = mapper.readTree(json.get());
        if (root == null || !root.isObject()) throw new IOException("Category document root must be a JSON object: " + file);

        ObjectNode doc = (ObjectNode) root;
        if (!doc.has(ENTRIES)) doc.putObject(ENTRIES);
        if (!doc.has(METADATA) || !doc.get(METADATA).isObject()) doc.putObject(METADATA);
        return doc;
    }

    // ---------------------------------------------------------------------
    // Write
    // ---------------------------------------------------------------------

    /**
     * Stamps {@code metadata.last_updated} and writes the document atomically.
     */
    public void saveDocument(Category category, ObjectNode doc) throws IOException {
        Objects.requireNonNull(doc, "doc");
        if (!doc.has(METADATA) || !doc.get(METADATA).isObject()) doc.putObject(METADATA);
        ((ObjectNode) doc.get(METADATA)).put(LAST_UPDATED, Instant.now(clock).toString());

        Path file = categoryFile(category);
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
        io.writeString(file, out + System.lineSeparator());
        log.debug("Saved category {} ({} entries) to {}", category.id(), doc.get(ENTRIES).size(), file);
    }

    /**
     * Copies every existing category file into {@code targetDir}.
     *
     * @return the copied files
     */
    public List<Path> copyCategoryFilesTo(Path targetDir) throws IOException {
        Objects.requireNonNull(targetDir, "targetDir");
        io.createDirectories(targetDir);

        ArrayList<Path> copied = new ArrayList<>();
        for (Category c : Category.values()) {
            Path file = categoryFile(c);
            if (!io.exists(file)) continue;
            copied.add(io.copyInto(file, targetDir));
        }
        return copied;
    }

    private ObjectNode emptyDocument() {
        ObjectNode doc = mapper.createObjectNode();
        doc.putObject(ENTRIES);
        doc.putObject(METADATA).put(LAST_UPDATED, Instant.now(clock).toString());
        return doc;
    }
}
