package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relationship declaration held inside an entry: a directed, typed link to another entry.
 *
 * <p>The target does not have to exist. Dangling targets are reported by statistics, not rejected.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Relationship {

    public static final double MIN_STRENGTH = 0.0;
    public static final double MAX_STRENGTH = 10.0;

    @JsonProperty("target_id")
    public String targetId;

    @JsonProperty("relationship_type")
    public RelationshipType type;

    public String description = "";

    /** Null means "not declared"; the configured default applies at index time. */
    public Double strength;

    public static Relationship of(String targetId, RelationshipType type, String description, Double strength) {
        Relationship r = new Relationship();
        r.targetId = targetId;
        r.type = type;
        r.description = description;
        r.strength = strength;
        return r;
    }

    public void validate() {
        if (targetId == null || targetId.isBlank()) throw new IllegalArgumentException("relationship.target_id is required");
        targetId = targetId.trim();
        if (type == null) throw new IllegalArgumentException("relationship.relationship_type is required");
        if (description == null) description = "";
        if (strength != null) {
            if (!Double.isFinite(strength) || strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
                throw new IllegalArgumentException("relationship.strength must be within [0, 10]: " + strength);
            }
        }
    }

    public double effectiveStrength(double defaultStrength) {
        return strength == null ? defaultStrength : strength;
    }

    @Override
    public String toString() {
        return "Relationship{" + type + " -> " + targetId + (strength == null ? "" : ", s=" + strength) + '}';
    }
}
