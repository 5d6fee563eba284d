package org.calista.archives.lore.index;

import org.calista.archives.lore.entry.Category;

import java.util.*;

/**
 * Immutable id -> {@link IndexedEntry} map in build order (category order, then file order).
 */
public final class LoreIndex {

    private static final LoreIndex EMPTY = new LoreIndex(new LinkedHashMap<>());

    private final Map<String, IndexedEntry> byId;

    LoreIndex(LinkedHashMap<String, IndexedEntry> byId) {
        this.byId = Collections.unmodifiableMap(byId);
    }

    public static LoreIndex empty() {
        return EMPTY;
    }

    public Optional<IndexedEntry> get(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /** Entries in iteration order; the order is stable across identical rebuilds. */
    public Collection<IndexedEntry> entries() {
        return byId.values();
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    public int size() {
        return byId.size();
    }

    public int count(Category category) {
        int n = 0;
        for (IndexedEntry e : byId.values()) {
            if (e.category() == category) n++;
        }
        return n;
    }
}
