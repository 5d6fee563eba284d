package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * LoreEntry: one persisted lore record (character, location, event, ...).
 *
 * <p>
 * Public fields for Jackson, snake_case on disk. {@link #validate()} both checks the
 * structural requirements and normalizes optional parts, so that every consumer downstream
 * can rely on non-null collections.
 * </p>
 *
 * <ul>
 *   <li>{@code id} is unique across the whole corpus and never changes once assigned</li>
 *   <li>tags keep their declared order (display) but duplicates are dropped</li>
 *   <li>relationships are directional as declared; no inverse is implied</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LoreEntry {

    // --------- Identity ---------

    public String id;

    public String name;

    public Category category;

    public String subcategory;

    // --------- Content ---------

    public String description = "";

    public List<String> tags = new ArrayList<>();

    public List<Relationship> relationships = new ArrayList<>();

    @JsonProperty("custom_fields")
    public Map<String, CustomValue> customFields = new LinkedHashMap<>();

    public EntryMetadata metadata = new EntryMetadata();

    // ---------------------------------------------------------------------
    // Validation / normalization
    // ---------------------------------------------------------------------

    public void validate() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("LoreEntry.id is required");
        id = id.trim();
        if (name == null || name.isBlank()) throw new IllegalArgumentException("LoreEntry.name is required (id=" + id + ")");
        if (category == null) throw new IllegalArgumentException("LoreEntry.category is required (id=" + id + ")");

        if (subcategory != null && subcategory.isBlank()) subcategory = null;
        if (description == null) description = "";

        if (tags == null) {
            tags = new ArrayList<>();
        } else {
            LinkedHashSet<String> norm = new LinkedHashSet<>();
            for (String t : tags) {
                if (t == null) continue;
                String x = t.trim();
                if (!x.isEmpty()) norm.add(x);
            }
            tags = new ArrayList<>(norm);
        }

        if (relationships == null) {
            relationships = new ArrayList<>();
        } else {
            ArrayList<Relationship> out = new ArrayList<>(relationships.size());
            for (Relationship r : relationships) {
                if (r == null) throw new IllegalArgumentException("null relationship in entry " + id);
                r.validate();
                out.add(r);
            }
            relationships = out;
        }

        if (customFields == null) {
            customFields = new LinkedHashMap<>();
        } else {
            LinkedHashMap<String, CustomValue> out = new LinkedHashMap<>();
            for (Map.Entry<String, CustomValue> e : customFields.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                out.put(e.getKey(), e.getValue());
            }
            customFields = out;
        }

        if (metadata == null) metadata = new EntryMetadata();
        metadata.normalize();
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    /**
     * Structural copy: collections and metadata are copied, relationship and custom values shared
     * (relationships are only replaced wholesale by the manager, custom values are immutable).
     */
    public LoreEntry copy() {
        LoreEntry e = new LoreEntry();
        e.id = id;
        e.name = name;
        e.category = category;
        e.subcategory = subcategory;
        e.description = description;
        e.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        e.relationships = relationships == null ? new ArrayList<>() : new ArrayList<>(relationships);
        e.customFields = customFields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(customFields);
        e.metadata = metadata == null ? new EntryMetadata() : metadata.copy();
        return e;
    }

    public Set<String> tagSet() {
        return tags == null ? Set.of() : new LinkedHashSet<>(tags);
    }

    @Override
    public String toString() {
        return "LoreEntry{"
                + "id='" + id + '\''
                + ", name='" + name + '\''
                + ", category=" + category
                + ", tags=" + tags
                + ", rels=" + (relationships == null ? 0 : relationships.size())
                + '}';
    }
}
