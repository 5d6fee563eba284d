package org.calista.archives.lore.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.entry.Relationship;
import org.calista.archives.lore.graph.RelationshipEdge;
import org.calista.archives.lore.graph.RelationshipGraph;
import org.calista.archives.lore.store.LoreStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the index and the relationship graph in one pass over the store.
 *
 * <p>
 * Failure containment:
 * - a category that cannot be read contributes zero entries ({@code STORE_UNAVAILABLE})
 * - an entry that cannot be bound or validated is skipped ({@code MALFORMED_ENTRY})
 * - an id seen in an earlier category keeps the first copy ({@code DUPLICATE_ID})
 * Nothing here throws for bad data; the report says what was dropped.
 * </p>
 */
public final class IndexBuilder {
    private static final Logger log = LogManager.getLogger(IndexBuilder.class);

    private final ObjectMapper mapper;
    private final double defaultStrength;

    public IndexBuilder(ObjectMapper mapper, double defaultStrength) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.defaultStrength = defaultStrength;
    }

    public IndexSnapshot build(LoreStore store) {
        Objects.requireNonNull(store, "store");

        LinkedHashMap<String, IndexedEntry> byId = new LinkedHashMap<>();
        RelationshipGraph.Builder graph = RelationshipGraph.builder();
        ArrayList<BuildReport.Issue> issues = new ArrayList<>();
        int edges = 0;

        for (Category category : Category.values()) {
            Map<String, JsonNode> raw;
            try {
                raw = store.readCategory(category);
            } catch (Exception e) {
                log.warn("Category {} unavailable, indexing it as empty: {}", category.id(), e.toString());
                issues.add(new BuildReport.Issue(BuildReport.IssueKind.STORE_UNAVAILABLE, category, null, e.toString()));
                continue;
            }

            int ok = 0, bad = 0;
            for (Map.Entry<String, JsonNode> row : raw.entrySet()) {
                String id = row.getKey();

                LoreEntry entry;
                try {
                    entry = bind(id, row.getValue(), category);
                } catch (Exception e) {
                    bad++;
                    log.warn("Skipping malformed entry {}/{}: {}", category.id(), id, e.getMessage());
                    issues.add(new BuildReport.Issue(BuildReport.IssueKind.MALFORMED_ENTRY, category, id, e.getMessage()));
                    continue;
                }

                if (byId.containsKey(entry.id)) {
                    bad++;
                    log.warn("Skipping duplicate id {} in {} (first seen in {})",
                            entry.id, category.id(), byId.get(entry.id).category().id());
                    issues.add(new BuildReport.Issue(BuildReport.IssueKind.DUPLICATE_ID, category, entry.id,
                            "already indexed from " + byId.get(entry.id).category().id()));
                    continue;
                }

                byId.put(entry.id, new IndexedEntry(entry));
                graph.addNode(entry.id);
                for (Relationship r : entry.relationships) {
                    graph.addEdge(new RelationshipEdge(entry.id, r.targetId, r.type,
                            r.effectiveStrength(defaultStrength), r.description));
                    edges++;
                }
                ok++;
            }
            if (ok > 0 || bad > 0) log.debug("Indexed category {} (ok={}, bad={})", category.id(), ok, bad);
        }

        BuildReport report = new BuildReport(byId.size(), edges, issues);
        log.info("Lore index built: entries={}, relationships={}, issues={}", byId.size(), edges, issues.size());
        return new IndexSnapshot(new LoreIndex(byId), graph.build(), report, System.currentTimeMillis());
    }

    LoreEntry bind(String key, JsonNode node, Category fileCategory) throws JsonProcessingException {
        return bind(mapper, key, node, fileCategory);
    }

    /**
     * Binds one raw record. The map key is the authoritative id; a missing category is inherited
     * from the file the record came from.
     *
     * @throws IllegalArgumentException when the record is not an object, its body id disagrees
     *                                  with its key, or it fails validation
     */
    public static LoreEntry bind(ObjectMapper mapper, String key, JsonNode node, Category fileCategory)
            throws JsonProcessingException {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("entry key is blank");
        if (node == null || !node.isObject()) throw new IllegalArgumentException("entry is not a JSON object");

        LoreEntry entry = mapper.treeToValue(node, LoreEntry.class);
        if (entry == null) throw new IllegalArgumentException("entry is null");

        if (entry.id == null || entry.id.isBlank()) entry.id = key;
        else if (!entry.id.trim().equals(key)) {
            throw new IllegalArgumentException("entry id '" + entry.id + "' does not match its key '" + key + "'");
        }
        if (entry.category == null) entry.category = fileCategory;

        entry.validate();
        return entry;
    }
}
