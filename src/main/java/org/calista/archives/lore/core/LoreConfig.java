package org.calista.archives.lore.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.archives.io.FileIO;
import org.calista.archives.lore.engine.InMemoryLoreEngine;
import org.calista.archives.lore.entry.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * LoreConfig: plain POJO config:
 * - defaults live in the field initializers
 * - loadOrCreate() writes the defaults when the file is missing or empty
 * - validate() clamps everything into range
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LoreConfig {

    private static final Logger log = LoggerFactory.getLogger(LoreConfig.class);

    public static final String DEFAULT_FILE = "config/lore.json";
    public static final String CONFIG_PROPERTY = "lore.config";

    @JsonProperty("database_path")
    public String databasePath = "lore_database";

    @JsonProperty("export_path")
    public String exportPath = "exports";

    @JsonProperty("backup_path")
    public String backupPath = "backups";

    public Search search = new Search();
    public Suggestions suggestions = new Suggestions();
    public Relationships relationships = new Relationships();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        @JsonProperty("fuzzy_threshold")
        public double fuzzyThreshold = 0.6;

        @JsonProperty("max_results")
        public int maxResults = 20;

        @JsonProperty("include_relationships")
        public boolean includeRelationships = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Suggestions {
        @JsonProperty("min_similarity")
        public double minSimilarity = 0.3;

        @JsonProperty("default_limit")
        public int defaultLimit = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Relationships {
        @JsonProperty("default_strength")
        public double defaultStrength = 5.0;

        @JsonProperty("default_max_depth")
        public int defaultMaxDepth = 1;
    }

    // -------------------- Load / Create --------------------

    /**
     * Config file location: the {@code lore.config} system property, else {@link #DEFAULT_FILE}.
     */
    public static Path defaultLocation() {
        String p = System.getProperty(CONFIG_PROPERTY);
        return Path.of((p == null || p.isBlank()) ? DEFAULT_FILE : p.trim());
    }

    /**
     * Loads the config. A missing or blank file is replaced by the defaults, which are written back.
     */
    public static LoreConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            LoreConfig created = new LoreConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            LoreConfig created = new LoreConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        LoreConfig cfg = mapper.readValue(json, LoreConfig.class);
        if (cfg == null) cfg = new LoreConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, LoreConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, LoreConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Engine mapping --------------------

    public InMemoryLoreEngine.Config engineConfig() {
        InMemoryLoreEngine.Config c = new InMemoryLoreEngine.Config();
        c.fuzzyThreshold = search.fuzzyThreshold;
        c.maxResults = search.maxResults;
        c.includeRelationships = search.includeRelationships;
        c.minSimilarity = suggestions.minSimilarity;
        c.defaultStrength = relationships.defaultStrength;
        return c;
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (databasePath == null || databasePath.isBlank()) databasePath = "lore_database";
        if (exportPath == null || exportPath.isBlank()) exportPath = "exports";
        if (backupPath == null || backupPath.isBlank()) backupPath = "backups";

        if (search == null) search = new Search();
        if (!Double.isFinite(search.fuzzyThreshold)) search.fuzzyThreshold = 0.6;
        search.fuzzyThreshold = clamp(search.fuzzyThreshold, 0.0, 1.0);
        if (search.maxResults < 1) search.maxResults = 1;

        if (suggestions == null) suggestions = new Suggestions();
        if (!Double.isFinite(suggestions.minSimilarity)) suggestions.minSimilarity = 0.3;
        suggestions.minSimilarity = clamp(suggestions.minSimilarity, 0.0, 1.0);
        if (suggestions.defaultLimit < 1) suggestions.defaultLimit = 1;

        if (relationships == null) relationships = new Relationships();
        if (!Double.isFinite(relationships.defaultStrength)) relationships.defaultStrength = 5.0;
        relationships.defaultStrength = clamp(relationships.defaultStrength,
                Relationship.MIN_STRENGTH, Relationship.MAX_STRENGTH);
        if (relationships.defaultMaxDepth < 1) relationships.defaultMaxDepth = 1;
    }

    private static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }
}
