package org.calista.archives.lore.manage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.lore.engine.LoreEngine;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.EntryMetadata;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.entry.Relationship;
import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.index.IndexBuilder;
import org.calista.archives.lore.store.JsonFileLoreStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Consumer;

/**
 * LoreManager: write side of the archive.
 *
 * <p>
 * Every successful write is persisted atomically through the store and followed by an
 * engine refresh, so queries issued afterwards see the change. Lookups here read the
 * store directly, not the index, and bind records with the same rules the index uses.
 * A stored record that does not bind can still be deleted by its key; reading or updating
 * it fails with {@link IllegalArgumentException}.
 * </p>
 */
public final class LoreManager {
    private static final Logger log = LogManager.getLogger(LoreManager.class);

    public static final String DEFAULT_AUTHOR = "system";

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final JsonFileLoreStore store;
    private final ObjectMapper mapper;
    private final LoreEngine engine;
    private final Path backupRoot;
    private final Clock clock;

    public LoreManager(JsonFileLoreStore store, ObjectMapper mapper, LoreEngine engine, Path backupRoot) {
        this(store, mapper, engine, backupRoot, Clock.systemDefaultZone());
    }

    public LoreManager(JsonFileLoreStore store, ObjectMapper mapper, LoreEngine engine, Path backupRoot, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.backupRoot = Objects.requireNonNull(backupRoot, "backupRoot");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Create / update / delete
    // ---------------------------------------------------------------------

    /**
     * Creates a new entry from {@code draft} (id, category and metadata are assigned here).
     *
     * @return the new entry id
     * @throws IllegalArgumentException when the draft is structurally invalid
     */
    public String createEntry(Category category, LoreEntry draft) throws IOException {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(draft, "draft");

        LoreEntry entry = draft.copy();
        entry.id = UUID.randomUUID().toString();
        entry.category = category;

        String now = now();
        EntryMetadata meta = new EntryMetadata();
        meta.createdDate = now;
        meta.modifiedDate = now;
        meta.author = (draft.metadata != null && draft.metadata.author != null) ? draft.metadata.author : DEFAULT_AUTHOR;
        meta.version = 1;
        meta.status = EntryMetadata.STATUS_DRAFT;
        entry.metadata = meta;

        entry.validate();

        ObjectNode doc = store.loadDocument(category);
        entries(doc).set(entry.id, mapper.valueToTree(entry));
        store.saveDocument(category, doc);
        engine.refresh();

        log.info("Created {} entry: {} ({})", category.id(), entry.name, entry.id);
        return entry.id;
    }

    /**
     * Applies {@code mutation} to a copy of the stored entry. The id and category cannot change;
     * the version is bumped and the modification date stamped.
     *
     * @return false when no entry has this id
     * @throws IllegalArgumentException when the stored record or the mutated entry is structurally invalid
     */
    public boolean updateEntry(String entryId, Consumer<LoreEntry> mutation) throws IOException {
        Objects.requireNonNull(mutation, "mutation");
        Optional<Located> found = locate(entryId);
        if (found.isEmpty()) {
            log.warn("Entry not found: {}", entryId);
            return false;
        }

        Located at = found.get();
        LoreEntry stored = bind(at);
        LoreEntry updated = stored.copy();
        mutation.accept(updated);

        updated.id = at.key;
        updated.category = at.category;
        if (updated.metadata == null) updated.metadata = stored.metadata.copy();
        updated.metadata.version = stored.metadata.version + 1;
        updated.metadata.modifiedDate = now();

        updated.validate();

        entries(at.doc).set(at.key, mapper.valueToTree(updated));
        store.saveDocument(at.category, at.doc);
        engine.refresh();

        log.info("Updated entry: {} ({}, v{})", updated.name, updated.id, updated.metadata.version);
        return true;
    }

    /**
     * Removes the record stored under {@code entryId}, whether or not it binds.
     */
    public boolean deleteEntry(String entryId) throws IOException {
        Optional<Located> found = locate(entryId);
        if (found.isEmpty()) {
            log.warn("Entry not found: {}", entryId);
            return false;
        }

        Located at = found.get();
        entries(at.doc).remove(at.key);
        store.saveDocument(at.category, at.doc);
        engine.refresh();

        log.info("Deleted entry: {} ({})", at.raw.path("name").asText(""), at.key);
        return true;
    }

    /**
     * Appends a relationship declaration to {@code sourceId}. Both entries must exist.
     *
     * @return false when either entry is missing
     * @throws IllegalArgumentException when the strength is outside [0, 10]
     */
    public boolean addRelationship(String sourceId, String targetId, RelationshipType type,
                                   String description, double strength) throws IOException {
        Objects.requireNonNull(type, "type");
        if (getEntry(sourceId).isEmpty() || getEntry(targetId).isEmpty()) {
            log.warn("Cannot link {} -> {}: one or both entries not found", sourceId, targetId);
            return false;
        }

        Relationship rel = Relationship.of(targetId, type, description == null ? "" : description, strength);
        rel.validate();

        return updateEntry(sourceId, e -> {
            List<Relationship> rels = e.relationships == null ? new ArrayList<>() : new ArrayList<>(e.relationships);
            rels.add(rel);
            e.relationships = rels;
        });
    }

    // ---------------------------------------------------------------------
    // Reads (straight from the store)
    // ---------------------------------------------------------------------

    /**
     * @throws IllegalArgumentException when the stored record does not bind
     */
    public Optional<LoreEntry> getEntry(String entryId) throws IOException {
        Optional<Located> found = locate(entryId);
        if (found.isEmpty()) return Optional.empty();
        return Optional.of(bind(found.get()));
    }

    /**
     * Entries in category order, then stored order. Records that fail to bind are skipped.
     *
     * @param category optional filter
     */
    public List<LoreEntry> listEntries(Category category, int limit) throws IOException {
        if (limit < 1) return List.of();
        List<Category> categories = category == null ? List.of(Category.values()) : List.of(category);

        ArrayList<LoreEntry> out = new ArrayList<>();
        for (Category c : categories) {
            for (Map.Entry<String, JsonNode> row : store.readCategory(c).entrySet()) {
                try {
                    out.add(IndexBuilder.bind(mapper, row.getKey(), row.getValue(), c));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Skipping unreadable entry {}/{}: {}", c.id(), row.getKey(), e.getMessage());
                    continue;
                }
                if (out.size() >= limit) return out;
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Backup
    // ---------------------------------------------------------------------

    /**
     * Copies every category file into {@code <backupRoot>/backup_<yyyyMMdd_HHmmss>}.
     */
    public Path backupDatabase() throws IOException {
        String stamp = BACKUP_STAMP.withZone(clock.getZone()).format(Instant.now(clock));
        Path dir = backupRoot.resolve("backup_" + stamp);
        List<Path> copied = store.copyCategoryFilesTo(dir);
        log.info("Database backed up to {} ({} file(s))", dir, copied.size());
        return dir;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private record Located(Category category, ObjectNode doc, String key, JsonNode raw) {}

    private Optional<Located> locate(String entryId) throws IOException {
        if (entryId == null || entryId.isBlank()) return Optional.empty();
        for (Category c : Category.values()) {
            ObjectNode doc = store.loadDocument(c);
            JsonNode raw = entries(doc).get(entryId);
            if (raw == null) continue;
            return Optional.of(new Located(c, doc, entryId, raw));
        }
        return Optional.empty();
    }

    private LoreEntry bind(Located at) throws IOException {
        try {
            return IndexBuilder.bind(mapper, at.key, at.raw, at.category);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Stored entry " + at.category.id() + "/" + at.key
                    + " is malformed: " + e.getMessage(), e);
        }
    }

    private static ObjectNode entries(ObjectNode doc) {
        JsonNode n = doc.get(JsonFileLoreStore.ENTRIES);
        if (n instanceof ObjectNode o) return o;
        return doc.putObject(JsonFileLoreStore.ENTRIES);
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
