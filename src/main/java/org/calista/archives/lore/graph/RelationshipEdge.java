package org.calista.archives.lore.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.archives.lore.entry.RelationshipType;

import java.util.Objects;

/**
 * One directed edge of the relationship graph, projected from a single relationship declaration.
 */
public final class RelationshipEdge {

    @JsonProperty("source_id")
    public final String sourceId;

    @JsonProperty("target_id")
    public final String targetId;

    @JsonProperty("relationship_type")
    public final RelationshipType type;

    public final double strength;

    public final String description;

    public RelationshipEdge(String sourceId, String targetId, RelationshipType type, double strength, String description) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.type = Objects.requireNonNull(type, "type");
        this.strength = strength;
        this.description = description == null ? "" : description;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RelationshipEdge e)) return false;
        return Double.compare(strength, e.strength) == 0
                && sourceId.equals(e.sourceId)
                && targetId.equals(e.targetId)
                && type == e.type
                && description.equals(e.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, type, strength, description);
    }

    @Override
    public String toString() {
        return sourceId + " -[" + type.id() + "]-> " + targetId;
    }
}
