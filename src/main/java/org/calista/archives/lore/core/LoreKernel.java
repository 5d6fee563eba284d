package org.calista.archives.lore.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.archives.io.FileIO;
import org.calista.archives.lore.engine.InMemoryLoreEngine;
import org.calista.archives.lore.engine.LoreEngine;
import org.calista.archives.lore.export.MarkdownExporter;
import org.calista.archives.lore.manage.LoreManager;
import org.calista.archives.lore.store.JsonFileLoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * LoreKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, wire store / engine / manager / exporter
 *   2) use               -> the engine is already built from the store
 *
 * No static singletons: every piece is owned by the kernel instance.
 */
public final class LoreKernel {

    private static final Logger log = LoggerFactory.getLogger(LoreKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final LoreConfig cfg;

    private final JsonFileLoreStore store;
    private final LoreEngine engine;
    private final LoreManager manager;
    private final MarkdownExporter exporter;

    private LoreKernel(FileIO io,
                       ObjectMapper mapper,
                       LoreConfig cfg,
                       JsonFileLoreStore store,
                       LoreEngine engine,
                       LoreManager manager,
                       MarkdownExporter exporter) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.store = Objects.requireNonNull(store, "store");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory for the config file and for every relative path inside it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private JsonFileLoreStore store;
        private Clock clock = Clock.systemDefaultZone();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Replaces the store derived from {@code database_path}. */
        public Builder store(JsonFileLoreStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Loads (or creates) the config and wires every component. The engine index is built
         * from the store before this returns.
         */
        public LoreKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO io = new FileIO(configRoot, charset, true);

            Path cfgPath = configFile.isAbsolute() ? configFile : io.root().resolve(configFile);
            LoreConfig cfg = LoreConfig.loadOrCreate(io, cfgPath, om);

            Path databaseDir = io.resolveConfigured(cfg.databasePath);
            Path exportRoot = io.resolveConfigured(cfg.exportPath);
            Path backupRoot = io.resolveConfigured(cfg.backupPath);

            JsonFileLoreStore st = (this.store != null) ? this.store : new JsonFileLoreStore(io, om, databaseDir, clock);
            io.createDirectories(st.databaseDir());

            LoreEngine engine = new InMemoryLoreEngine(st, om, cfg.engineConfig());
            LoreManager manager = new LoreManager(st, om, engine, backupRoot, clock);
            MarkdownExporter exporter = new MarkdownExporter(io, manager, exportRoot);

            LoreKernel k = new LoreKernel(io, om, cfg, st, engine, manager, exporter);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public LoreConfig config() { return cfg; }
    public JsonFileLoreStore store() { return store; }
    public LoreEngine engine() { return engine; }
    public LoreManager manager() { return manager; }
    public MarkdownExporter exporter() { return exporter; }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("LoreKernel created: config={}, database={}, entries={}",
                cfgPath, store.databaseDir(), engine.snapshot().index.size());
    }
}
