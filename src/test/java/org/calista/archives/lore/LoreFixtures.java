package org.calista.archives.lore;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.archives.io.FileIO;
import org.calista.archives.lore.engine.InMemoryLoreEngine;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.store.JsonFileLoreStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builders for category files written into a temp database directory.
 */
public final class LoreFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private LoreFixtures() {}

    public static ObjectNode entry(String id, String name, String description, String... tags) {
        ObjectNode e = MAPPER.createObjectNode();
        e.put("id", id);
        e.put("name", name);
        e.put("description", description);
        ArrayNode t = e.putArray("tags");
        for (String tag : tags) t.add(tag);
        e.putArray("relationships");
        return e;
    }

    public static ObjectNode link(ObjectNode entry, String targetId, String type) {
        ObjectNode r = ((ArrayNode) entry.get("relationships")).addObject();
        r.put("target_id", targetId);
        r.put("relationship_type", type);
        return entry;
    }

    public static void writeCategory(Path databaseDir, Category category, ObjectNode... entries) throws IOException {
        ObjectNode doc = MAPPER.createObjectNode();
        ObjectNode map = doc.putObject("entries");
        for (ObjectNode e : entries) map.set(e.get("id").asText(), e);
        doc.putObject("metadata").put("last_updated", "2024-01-01T00:00:00Z");
        writeRaw(databaseDir, category, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(doc));
    }

    public static void writeRaw(Path databaseDir, Category category, String content) throws IOException {
        Files.createDirectories(databaseDir);
        Files.writeString(databaseDir.resolve(category.fileName()), content, StandardCharsets.UTF_8);
    }

    public static JsonFileLoreStore store(Path databaseDir) {
        return new JsonFileLoreStore(new FileIO(databaseDir), MAPPER, databaseDir);
    }

    public static InMemoryLoreEngine engine(Path databaseDir) {
        return new InMemoryLoreEngine(store(databaseDir), MAPPER);
    }

    public static InMemoryLoreEngine engine(Path databaseDir, double fuzzyThreshold) {
        InMemoryLoreEngine.Config cfg = new InMemoryLoreEngine.Config();
        cfg.fuzzyThreshold = fuzzyThreshold;
        return new InMemoryLoreEngine(store(databaseDir), MAPPER, cfg);
    }

    /**
     * Two mages and a city:
     * hero and villain in characters, city in locations.
     */
    public static void writeRealm(Path databaseDir) throws IOException {
        writeCategory(databaseDir, Category.CHARACTERS,
                entry("hero", "Aldric", "A wandering mage from the northern reaches.", "mage", "zeloria"),
                entry("villain", "Morvain", "A mage who turned to shadow.", "mage"));
        writeCategory(databaseDir, Category.LOCATIONS,
                entry("city", "Zeloria", "The capital city of the realm.", "capital"));
    }

    /**
     * Same realm with the hero declared {@code located_in} the city.
     */
    public static void writeLinkedRealm(Path databaseDir) throws IOException {
        writeCategory(databaseDir, Category.CHARACTERS,
                link(entry("hero", "Aldric", "A wandering mage from the northern reaches.", "mage", "zeloria"),
                        "city", "located_in"),
                entry("villain", "Morvain", "A mage who turned to shadow.", "mage"));
        writeCategory(databaseDir, Category.LOCATIONS,
                entry("city", "Zeloria", "The capital city of the realm.", "capital"));
    }
}
