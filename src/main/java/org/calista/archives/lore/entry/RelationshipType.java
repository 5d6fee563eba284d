package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of directed relationship kinds. There is no implied inverse:
 * {@code parent_of} does not create a {@code child_of} edge.
 */
public enum RelationshipType {
    RELATED_TO("related_to"),
    PART_OF("part_of"),
    LOCATED_IN("located_in"),
    MEMBER_OF("member_of"),
    ALLY_OF("ally_of"),
    ENEMY_OF("enemy_of"),
    PARENT_OF("parent_of"),
    CHILD_OF("child_of"),
    CREATED_BY("created_by"),
    OWNED_BY("owned_by"),
    SUCCESSOR_OF("successor_of"),
    PREDECESSOR_OF("predecessor_of");

    private final String id;

    RelationshipType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static RelationshipType fromId(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("relationship_type is required");
        String x = raw.trim().toLowerCase(Locale.ROOT);
        for (RelationshipType t : values()) {
            if (t.id.equals(x)) return t;
        }
        throw new IllegalArgumentException("Unknown relationship type: " + raw);
    }
}
