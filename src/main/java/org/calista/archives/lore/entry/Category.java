package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The ten top-level entry types. Each one is persisted in its own category file.
 */
public enum Category {
    CHARACTERS("characters"),
    LOCATIONS("locations"),
    EVENTS("events"),
    ORGANIZATIONS("organizations"),
    ITEMS("items"),
    CREATURES("creatures"),
    CULTURES("cultures"),
    RELIGIONS("religions"),
    MAGIC_SYSTEMS("magic_systems"),
    CONCEPTS("concepts");

    private final String id;

    Category(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** File name of the category document, e.g. {@code characters.json}. */
    public String fileName() {
        return id + ".json";
    }

    @JsonCreator
    public static Category fromId(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("category is required");
        String x = raw.trim().toLowerCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.id.equals(x)) return c;
        }
        throw new IllegalArgumentException("Unknown category: " + raw);
    }
}
