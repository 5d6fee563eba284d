package org.calista.archives.lore.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.archives.lore.entry.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one index build: what was indexed and what was skipped, and why.
 */
public final class BuildReport {

    public enum IssueKind {
        /** Category file missing or unreadable; contributes zero entries. */
        STORE_UNAVAILABLE,
        /** Entry failed binding or structural validation; skipped. */
        MALFORMED_ENTRY,
        /** Identifier already indexed from an earlier category; later copy skipped. */
        DUPLICATE_ID
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Issue {
        public final IssueKind kind;
        public final Category category;
        @JsonProperty("entry_id")
        public final String entryId;
        public final String message;

        public Issue(IssueKind kind, Category category, String entryId, String message) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.category = category;
            this.entryId = entryId;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() {
            return kind + "[" + (category == null ? "-" : category.id())
                    + (entryId == null ? "" : "/" + entryId) + "]: " + message;
        }
    }

    @JsonProperty("indexed_entries")
    public final int indexedEntries;

    @JsonProperty("relationship_edges")
    public final int relationshipEdges;

    public final List<Issue> issues;

    public BuildReport(int indexedEntries, int relationshipEdges, List<Issue> issues) {
        this.indexedEntries = indexedEntries;
        this.relationshipEdges = relationshipEdges;
        this.issues = issues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public static BuildReport empty() {
        return new BuildReport(0, 0, List.of());
    }

    public List<Issue> issues(IssueKind kind) {
        ArrayList<Issue> out = new ArrayList<>();
        for (Issue i : issues) {
            if (i.kind == kind) out.add(i);
        }
        return out;
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    @Override
    public String toString() {
        return "BuildReport{indexed=" + indexedEntries + ", edges=" + relationshipEdges + ", issues=" + issues.size() + '}';
    }
}
