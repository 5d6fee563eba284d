package org.calista.archives.lore.text;

import org.calista.archives.lore.entry.CustomValue;
import org.calista.archives.lore.entry.LoreEntry;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the single lower-cased blob used for full-text matching.
 *
 * <p>Order: name, description, tags, then every custom field value (lists flattened element-wise).
 * Empty parts are skipped. Pure function of the entry.</p>
 */
public final class SearchableText {

    private SearchableText() {}

    public static String of(LoreEntry entry) {
        Objects.requireNonNull(entry, "entry");

        ArrayList<String> parts = new ArrayList<>(8);
        add(parts, entry.name);
        add(parts, entry.description);
        if (entry.tags != null && !entry.tags.isEmpty()) add(parts, String.join(" ", entry.tags));

        if (entry.customFields != null) {
            for (CustomValue v : entry.customFields.values()) {
                if (v == null) continue;
                for (String t : v.texts()) add(parts, t);
            }
        }

        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static void add(ArrayList<String> parts, String s) {
        if (s != null && !s.isEmpty()) parts.add(s);
    }
}
