package org.calista.archives.lore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.lore.core.LoreConfig;
import org.calista.archives.lore.core.LoreKernel;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.graph.RelatedEntry;
import org.calista.archives.lore.graph.RelationshipEdge;
import org.calista.archives.lore.graph.RelationshipGraph;
import org.calista.archives.lore.index.BuildReport;
import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.Scored;
import org.calista.archives.lore.search.SearchHit;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

/**
 * LoreApp: command-line front end.
 *
 * One command per invocation, or an interactive console loop when started without
 * arguments ({@code exit} quits). Bad input prints usage and yields a non-zero exit code;
 * nothing is thrown out of {@link #run(String...)}.
 */
public final class LoreApp {

    private static final Logger log = LogManager.getLogger(LoreApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final int DEFAULT_LIST_LIMIT = 20;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  search <query> [--category c] [--tags a,b] [--limit n]",
            "  related <id> [--type t] [--depth n]",
            "  suggest <id> [--limit n]",
            "  stats",
            "  list [--category c] [--limit n]",
            "  show <id>",
            "  create --category c --name n --description d [--tags a,b]",
            "  add-relationship <source> <target> <type> [--description d] [--strength s]",
            "  delete <id>",
            "  graph [id...]",
            "  refresh",
            "  backup",
            "  export-markdown [--output-dir d]",
            "  help");

    private final LoreKernel kernel;
    private final PrintStream out;

    public LoreApp(LoreKernel kernel, PrintStream out) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) throws IOException {
        LoreKernel kernel = LoreKernel.builder()
                .configRoot(Path.of("."))
                .build(LoreConfig.defaultLocation());

        LoreApp app = new LoreApp(kernel, System.out);
        if (args.length == 0) {
            app.runConsoleLoop(System.in);
            return;
        }
        int code = app.run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    // ---------------------------------------------------------------------
    // Console loop
    // ---------------------------------------------------------------------

    public void runConsoleLoop(InputStream in) {
        log.info("Lore archive ready. entries={}", kernel.engine().snapshot().index.size());
        out.println("Type 'help' for commands, 'exit' to quit.");

        try (Scanner sc = new Scanner(in, StandardCharsets.UTF_8)) {
            while (true) {
                out.print("> ");
                out.flush();
                if (!sc.hasNextLine()) break;

                String line = sc.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) break;
                if (line.isEmpty()) continue;

                List<String> argv;
                try {
                    argv = splitLine(line);
                } catch (UsageException e) {
                    out.println("Error: " + e.getMessage());
                    continue;
                }
                run(argv.toArray(new String[0]));
            }
        }
        out.println("Bye.");
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    /**
     * Runs one command.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILED} or {@link #EXIT_USAGE}
     */
    public int run(String... args) {
        if (args == null || args.length == 0) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        String command = args[0].trim().toLowerCase(Locale.ROOT);
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        try {
            switch (command) {
                case "search": return search(Args.parse(rest, "category", "tags", "limit"));
                case "related": return related(Args.parse(rest, "type", "depth"));
                case "suggest": return suggest(Args.parse(rest, "limit"));
                case "stats": return stats(Args.parse(rest));
                case "list": return list(Args.parse(rest, "category", "limit"));
                case "show": return show(Args.parse(rest));
                case "create": return create(Args.parse(rest, "category", "name", "description", "tags"));
                case "add-relationship": return addRelationship(Args.parse(rest, "description", "strength"));
                case "delete": return delete(Args.parse(rest));
                case "graph": return graph(Args.parse(rest));
                case "refresh": return refresh(Args.parse(rest));
                case "backup": return backup(Args.parse(rest));
                case "export-markdown": return exportMarkdown(Args.parse(rest, "output-dir"));
                case "help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    throw new UsageException("unknown command '" + args[0] + "'");
            }
        } catch (UsageException e) {
            out.println("Error: " + e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Command '{}' failed: {}", command, e.toString());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    private int search(Args a) throws UsageException {
        if (a.positional.isEmpty()) throw new UsageException("search needs a query");
        String query = String.join(" ", a.positional);

        List<SearchHit> hits = kernel.engine().search(query,
                a.category("category"), a.list("tags"), a.integer("limit"));
        if (hits.isEmpty()) {
            out.println("No results found");
            return EXIT_OK;
        }

        for (SearchHit h : hits) {
            out.printf(Locale.ROOT, "%6.2f  %s [%s] (%s)%n", h.score, h.entry.name(), h.entry.category().id(), h.entry.id());
            for (RelationshipEdge e : h.relationships) {
                out.println("        -> " + e.type.id() + " " + e.targetId);
            }
        }
        return EXIT_OK;
    }

    private int related(Args a) throws UsageException {
        String id = a.single("related needs an entry id");
        RelationshipType type = a.relationshipType("type");
        Integer depth = a.integer("depth");
        int maxDepth = depth == null ? kernel.config().relationships.defaultMaxDepth : depth;

        List<RelatedEntry> found = kernel.engine().related(id, type, maxDepth);
        if (found.isEmpty()) {
            out.println("No related entries");
            return EXIT_OK;
        }
        for (RelatedEntry r : found) {
            out.printf(Locale.ROOT, "%d  %-16s %s (%s)%n", r.depth, r.relationshipType().id(), r.entry.name(), r.entry.id());
        }
        return EXIT_OK;
    }

    private int suggest(Args a) throws UsageException {
        String id = a.single("suggest needs an entry id");
        Integer limit = a.integer("limit");

        List<Scored<IndexedEntry>> found = kernel.engine().suggest(id,
                limit == null ? kernel.config().suggestions.defaultLimit : limit);
        if (found.isEmpty()) {
            out.println("No suggestions");
            return EXIT_OK;
        }
        for (Scored<IndexedEntry> s : found) {
            out.printf(Locale.ROOT, "%.3f  %s [%s] (%s)%n", s.score, s.item.name(), s.item.category().id(), s.item.id());
        }
        return EXIT_OK;
    }

    private int stats(Args a) throws UsageException, IOException {
        a.noPositional("stats");
        out.println(kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(kernel.engine().statistics()));
        return EXIT_OK;
    }

    private int graph(Args a) {
        RelationshipGraph g = kernel.engine().graphView(a.positional);
        out.println("nodes=" + g.nodeCount() + ", edges=" + g.edgeCount());
        for (RelationshipEdge e : g.edges()) {
            out.printf(Locale.ROOT, "%s (%.1f)%n", e, e.strength);
        }
        return EXIT_OK;
    }

    private int refresh(Args a) throws UsageException {
        a.noPositional("refresh");
        BuildReport report = kernel.engine().refresh();
        out.println(report);
        for (BuildReport.Issue issue : report.issues) out.println("  " + issue);
        return EXIT_OK;
    }

    // ---------------------------------------------------------------------
    // Store-backed commands
    // ---------------------------------------------------------------------

    private int list(Args a) throws UsageException, IOException {
        a.noPositional("list");
        Integer limit = a.integer("limit");
        List<LoreEntry> entries = kernel.manager().listEntries(a.category("category"),
                limit == null ? DEFAULT_LIST_LIMIT : limit);
        if (entries.isEmpty()) {
            out.println("No entries");
            return EXIT_OK;
        }
        for (LoreEntry e : entries) {
            String modified = e.metadata == null || e.metadata.modifiedDate == null ? "unknown" : e.metadata.modifiedDate;
            out.println(e.name + " [" + e.category.id() + "] (" + e.id + ") modified " + modified);
        }
        return EXIT_OK;
    }

    private int show(Args a) throws UsageException, IOException {
        String id = a.single("show needs an entry id");
        Optional<LoreEntry> e = kernel.manager().getEntry(id);
        if (e.isEmpty()) {
            out.println("Entry not found: " + id);
            return EXIT_FAILED;
        }
        out.println(kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(e.get()));
        return EXIT_OK;
    }

    private int create(Args a) throws UsageException, IOException {
        a.noPositional("create");
        Category category = a.category("category");
        String name = a.option("name");
        String description = a.option("description");
        if (category == null || name == null || description == null) {
            throw new UsageException("create needs --category, --name and --description");
        }

        LoreEntry draft = new LoreEntry();
        draft.name = name;
        draft.description = description;
        List<String> tags = a.list("tags");
        if (tags != null) draft.tags = new ArrayList<>(tags);

        String id = kernel.manager().createEntry(category, draft);
        out.println("Created entry with ID: " + id);
        return EXIT_OK;
    }

    private int addRelationship(Args a) throws UsageException, IOException {
        if (a.positional.size() != 3) throw new UsageException("add-relationship needs <source> <target> <type>");
        RelationshipType type = parseType(a.positional.get(2));
        Double strength = a.decimal("strength");
        String description = a.option("description");

        boolean ok = kernel.manager().addRelationship(a.positional.get(0), a.positional.get(1), type,
                description == null ? "" : description,
                strength == null ? kernel.config().relationships.defaultStrength : strength);
        out.println(ok ? "Relationship added" : "Failed to add relationship: unknown source or target");
        return ok ? EXIT_OK : EXIT_FAILED;
    }

    private int delete(Args a) throws UsageException, IOException {
        String id = a.single("delete needs an entry id");
        boolean ok = kernel.manager().deleteEntry(id);
        out.println(ok ? "Deleted " + id : "Entry not found: " + id);
        return ok ? EXIT_OK : EXIT_FAILED;
    }

    private int backup(Args a) throws UsageException, IOException {
        a.noPositional("backup");
        out.println("Backup created at: " + kernel.manager().backupDatabase());
        return EXIT_OK;
    }

    private int exportMarkdown(Args a) throws UsageException, IOException {
        a.noPositional("export-markdown");
        String dir = a.option("output-dir");
        Path target = dir == null ? null : kernel.io().resolveConfigured(dir);
        out.println("Exported to: " + kernel.exporter().export(target));
        return EXIT_OK;
    }

    // ---------------------------------------------------------------------
    // Argument parsing
    // ---------------------------------------------------------------------

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    /**
     * Positional arguments plus {@code --name value} options, restricted to the names a command accepts.
     */
    static final class Args {
        final List<String> positional = new ArrayList<>();
        final Map<String, String> options = new HashMap<>();

        static Args parse(List<String> argv, String... allowed) throws UsageException {
            Set<String> ok = Set.of(allowed);
            Args a = new Args();
            for (int i = 0; i < argv.size(); i++) {
                String s = argv.get(i);
                if (!s.startsWith("--")) {
                    a.positional.add(s);
                    continue;
                }
                String name = s.substring(2);
                if (!ok.contains(name)) throw new UsageException("unknown option '" + s + "'");
                if (i + 1 >= argv.size()) throw new UsageException("option '" + s + "' needs a value");
                a.options.put(name, argv.get(++i));
            }
            return a;
        }

        String option(String name) {
            return options.get(name);
        }

        String single(String missing) throws UsageException {
            if (positional.size() != 1) throw new UsageException(missing);
            return positional.get(0);
        }

        void noPositional(String command) throws UsageException {
            if (!positional.isEmpty()) throw new UsageException(command + " takes no arguments");
        }

        Integer integer(String name) throws UsageException {
            String v = options.get(name);
            if (v == null) return null;
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 1) throw new UsageException("--" + name + " must be >= 1");
                return n;
            } catch (NumberFormatException e) {
                throw new UsageException("--" + name + " expects a number, got '" + v + "'");
            }
        }

        Double decimal(String name) throws UsageException {
            String v = options.get(name);
            if (v == null) return null;
            try {
                return Double.parseDouble(v.trim());
            } catch (NumberFormatException e) {
                throw new UsageException("--" + name + " expects a number, got '" + v + "'");
            }
        }

        List<String> list(String name) {
            String v = options.get(name);
            if (v == null) return null;
            ArrayList<String> out = new ArrayList<>();
            for (String p : v.split(",")) {
                String t = p.trim();
                if (!t.isEmpty()) out.add(t);
            }
            return out;
        }

        Category category(String name) throws UsageException {
            String v = options.get(name);
            if (v == null) return null;
            try {
                return Category.fromId(v);
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        RelationshipType relationshipType(String name) throws UsageException {
            String v = options.get(name);
            return v == null ? null : parseType(v);
        }
    }

    private static RelationshipType parseType(String raw) throws UsageException {
        try {
            return RelationshipType.fromId(raw);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    /**
     * Splits a console line on whitespace; double quotes group words.
     */
    static List<String> splitLine(String line) throws UsageException {
        ArrayList<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean any = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                any = true;
            } else if (Character.isWhitespace(c) && !quoted) {
                if (any) {
                    out.add(cur.toString());
                    cur.setLength(0);
                    any = false;
                }
            } else {
                cur.append(c);
                any = true;
            }
        }
        if (quoted) throw new UsageException("unterminated quote");
        if (any) out.add(cur.toString());
        return out;
    }
}
