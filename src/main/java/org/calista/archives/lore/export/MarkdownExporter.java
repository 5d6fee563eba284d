package org.calista.archives.lore.export;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.io.FileIO;
import org.calista.archives.lore.entry.CustomValue;
import org.calista.archives.lore.entry.EntryMetadata;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.entry.Relationship;
import org.calista.archives.lore.manage.LoreManager;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes every stored entry as a markdown page: {@code <out>/<category>/<Name_With_Underscores>.md}.
 */
public final class MarkdownExporter {
    private static final Logger log = LogManager.getLogger(MarkdownExporter.class);

    public static final String DEFAULT_DIR_NAME = "markdown_export";

    private static final String UNKNOWN = "Unknown";

    private final FileIO io;
    private final LoreManager manager;
    private final Path defaultOutputDir;

    public MarkdownExporter(FileIO io, LoreManager manager, Path exportRoot) {
        this.io = Objects.requireNonNull(io, "io");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.defaultOutputDir = Objects.requireNonNull(exportRoot, "exportRoot").resolve(DEFAULT_DIR_NAME);
    }

    public Path defaultOutputDir() {
        return defaultOutputDir;
    }

    /**
     * @param outputDir optional target directory (null = {@code <exportRoot>/markdown_export})
     * @return the directory written to
     */
    public Path export(Path outputDir) throws IOException {
        Path out = outputDir == null ? defaultOutputDir : outputDir;
        io.createDirectories(out);

        List<LoreEntry> entries = manager.listEntries(null, Integer.MAX_VALUE);
        Map<String, String> names = new HashMap<>();
        for (LoreEntry e : entries) names.put(e.id, e.name);

        for (LoreEntry e : entries) {
            Path file = out.resolve(e.category.id()).resolve(fileName(e));
            io.writeString(file, render(e, names));
        }

        log.info("Exported {} entr{} to markdown: {}", entries.size(), entries.size() == 1 ? "y" : "ies", out);
        return out;
    }

    static String fileName(LoreEntry e) {
        String base = (e.name == null || e.name.isBlank()) ? e.id : e.name.trim();
        return base.replace(' ', '_').replace('/', '_').replace('\\', '_') + ".md";
    }

    /**
     * Renders one page. Relationship targets are shown by name when known, else by id.
     */
    static String render(LoreEntry e, Map<String, String> namesById) {
        StringBuilder md = new StringBuilder(512);
        md.append("# ").append(e.name).append("\n\n");
        md.append("**Category:** ").append(e.category.id()).append("\n\n");

        if (e.subcategory != null && !e.subcategory.isBlank()) {
            md.append("**Subcategory:** ").append(e.subcategory).append("\n\n");
        }

        String description = (e.description == null || e.description.isBlank()) ? "No description available." : e.description;
        md.append("## Description\n\n").append(description).append("\n\n");

        if (e.tags != null && !e.tags.isEmpty()) {
            md.append("**Tags:** ").append(String.join(", ", e.tags)).append("\n\n");
        }

        if (e.relationships != null && !e.relationships.isEmpty()) {
            md.append("## Relationships\n\n");
            for (Relationship r : e.relationships) {
                String target = namesById.getOrDefault(r.targetId, r.targetId);
                md.append("- **").append(r.type.id()).append("**: ").append(target);
                if (r.description != null && !r.description.isBlank()) md.append(" - ").append(r.description);
                md.append('\n');
            }
            md.append('\n');
        }

        if (e.customFields != null && !e.customFields.isEmpty()) {
            md.append("## Additional Information\n\n");
            for (Map.Entry<String, CustomValue> f : e.customFields.entrySet()) {
                md.append("**").append(titleCase(f.getKey())).append(":** ").append(f.getValue().display()).append("\n\n");
            }
        }

        EntryMetadata m = e.metadata;
        md.append("---\n\n");
        md.append("*Created: ").append(orUnknown(m == null ? null : m.createdDate)).append("*\n\n");
        md.append("*Last Modified: ").append(orUnknown(m == null ? null : m.modifiedDate)).append("*\n\n");
        md.append("*Status: ").append(orUnknown(m == null ? null : m.status)).append("*\n\n");
        return md.toString();
    }

    // "power_level" -> "Power Level"
    static String titleCase(String key) {
        String[] words = key.replace('_', ' ').trim().split("\\s+");
        StringBuilder sb = new StringBuilder(key.length());
        for (String w : words) {
            if (w.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String orUnknown(String v) {
        return (v == null || v.isBlank()) ? UNKNOWN : v;
    }
}
