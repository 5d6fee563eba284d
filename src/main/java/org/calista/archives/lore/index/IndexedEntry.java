package org.calista.archives.lore.index;

import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.text.SearchableText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry as held by the index: the validated entry plus its derived searchable text.
 * Created fresh on every build and never modified afterwards.
 */
public final class IndexedEntry {

    public final LoreEntry entry;
    public final String searchableText;

    // lower-cased views used by the scorers
    final String nameLower;
    final String descriptionLower;
    final List<String> tagsLower;

    public IndexedEntry(LoreEntry entry) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.searchableText = SearchableText.of(entry);
        this.nameLower = entry.name == null ? "" : entry.name.toLowerCase(Locale.ROOT);
        this.descriptionLower = entry.description == null ? "" : entry.description.toLowerCase(Locale.ROOT);

        ArrayList<String> tl = new ArrayList<>(entry.tags == null ? 0 : entry.tags.size());
        if (entry.tags != null) {
            for (String t : entry.tags) tl.add(t.toLowerCase(Locale.ROOT));
        }
        this.tagsLower = Collections.unmodifiableList(tl);
    }

    public String id() {
        return entry.id;
    }

    public String name() {
        return entry.name;
    }

    public Category category() {
        return entry.category;
    }

    public String nameLower() {
        return nameLower;
    }

    public String descriptionLower() {
        return descriptionLower;
    }

    public List<String> tagsLower() {
        return tagsLower;
    }

    @Override
    public String toString() {
        return "IndexedEntry{" + entry.id + ", " + entry.category + ", '" + entry.name + "'}";
    }
}
