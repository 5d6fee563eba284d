package org.calista.archives.lore;

import org.calista.archives.lore.core.LoreKernel;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.LoreEntry;
import org.calista.archives.lore.entry.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LoreAppTest {

    @TempDir
    Path root;

    private LoreKernel kernel;
    private ByteArrayOutputStream buffer;
    private LoreApp app;

    @BeforeEach
    void setUp() throws Exception {
        kernel = LoreKernel.builder()
                .configRoot(root)
                .mapper(LoreFixtures.MAPPER)
                .build(Path.of("config/lore.json"));
        buffer = new ByteArrayOutputStream();
        app = new LoreApp(kernel, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        String s = buffer.toString(StandardCharsets.UTF_8);
        buffer.reset();
        return s;
    }

    private String create(String category, String name, String description, String tags) throws Exception {
        LoreEntry draft = new LoreEntry();
        draft.name = name;
        draft.description = description;
        draft.tags.addAll(List.of(tags.split(",")));
        return kernel.manager().createEntry(Category.fromId(category), draft);
    }

    @Test
    void kernelCreatesConfigAndDatabaseDirectory() {
        assertTrue(Files.exists(root.resolve("config/lore.json")));
        assertTrue(Files.isDirectory(root.resolve("lore_database")));
        assertEquals(0, kernel.engine().snapshot().index.size());
    }

    @Test
    void helpAndUsageErrors() {
        assertEquals(LoreApp.EXIT_OK, app.run("help"));
        assertTrue(output().contains("add-relationship"));

        assertEquals(LoreApp.EXIT_USAGE, app.run());
        assertEquals(LoreApp.EXIT_USAGE, app.run("conjure"));
        assertTrue(output().contains("unknown command 'conjure'"));

        assertEquals(LoreApp.EXIT_USAGE, app.run("search"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("search", "mage", "--limit", "many"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("search", "mage", "--limit"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("search", "mage", "--color", "red"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("list", "--category", "vehicles"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("related", "x", "--type", "cousin_of"));
        assertEquals(LoreApp.EXIT_USAGE, app.run("create", "--name", "Aldric"));
    }

    @Test
    void createListShowAndDelete() throws Exception {
        assertEquals(LoreApp.EXIT_OK, app.run("create", "--category", "characters",
                "--name", "Aldric", "--description", "A wandering mage", "--tags", "mage, zeloria"));
        String created = output();
        assertTrue(created.startsWith("Created entry with ID: "));
        String id = created.substring("Created entry with ID: ".length()).trim();

        assertEquals(LoreApp.EXIT_OK, app.run("list"));
        assertTrue(output().contains("Aldric [characters] (" + id + ")"));

        assertEquals(LoreApp.EXIT_OK, app.run("show", id));
        String shown = output();
        assertTrue(shown.contains("\"name\" : \"Aldric\""));
        assertTrue(shown.contains("\"zeloria\""));

        assertEquals(LoreApp.EXIT_OK, app.run("delete", id));
        assertEquals(LoreApp.EXIT_FAILED, app.run("delete", id));
        assertEquals(LoreApp.EXIT_FAILED, app.run("show", id));
    }

    @Test
    void searchRelatedAndSuggest() throws Exception {
        String hero = create("characters", "Aldric", "A wandering mage from the northern reaches.", "mage,zeloria");
        String villain = create("characters", "Morvain", "A mage who turned to shadow.", "mage");
        output();

        assertEquals(LoreApp.EXIT_OK, app.run("add-relationship", hero, villain, "enemy_of", "--strength", "9"));
        assertTrue(output().contains("Relationship added"));
        assertEquals(LoreApp.EXIT_FAILED, app.run("add-relationship", hero, "nobody", "enemy_of"));
        assertEquals(LoreApp.EXIT_FAILED, app.run("add-relationship", hero, villain, "enemy_of", "--strength", "12"));
        output();

        assertEquals(LoreApp.EXIT_OK, app.run("search", "mage"));
        String found = output();
        assertTrue(found.indexOf("Morvain") < found.indexOf("Aldric"), found);
        assertTrue(found.contains("-> enemy_of " + villain));

        assertEquals(LoreApp.EXIT_OK, app.run("search", "mage", "--category", "locations"));
        assertTrue(output().contains("No results found"));

        assertEquals(LoreApp.EXIT_OK, app.run("related", hero, "--depth", "2"));
        assertTrue(output().contains("Morvain (" + villain + ")"));

        assertEquals(LoreApp.EXIT_OK, app.run("suggest", hero));
        assertTrue(output().contains("Morvain"));
    }

    @Test
    void statsGraphRefreshBackupAndExport() throws Exception {
        String hero = create("characters", "Aldric", "A mage", "mage");
        String city = create("locations", "Zeloria", "The capital", "capital");
        kernel.manager().addRelationship(hero, city, RelationshipType.LOCATED_IN, "", 5.0);
        output();

        assertEquals(LoreApp.EXIT_OK, app.run("stats"));
        String stats = output();
        assertTrue(stats.contains("\"total_entries\" : 2"));
        assertTrue(stats.contains("\"total_relationships\" : 1"));

        assertEquals(LoreApp.EXIT_OK, app.run("graph"));
        assertTrue(output().startsWith("nodes=2, edges=1"));
        assertEquals(LoreApp.EXIT_OK, app.run("graph", hero));
        assertTrue(output().startsWith("nodes=1, edges=0"));

        assertEquals(LoreApp.EXIT_OK, app.run("refresh"));
        assertTrue(output().contains("indexed=2"));

        assertEquals(LoreApp.EXIT_OK, app.run("backup"));
        assertTrue(output().contains("backup_"));
        try (Stream<Path> backups = Files.list(root.resolve("backups"))) {
            assertEquals(1, backups.count());
        }

        assertEquals(LoreApp.EXIT_OK, app.run("export-markdown", "--output-dir", "md"));
        assertTrue(Files.exists(root.resolve("md/characters/Aldric.md")));
        assertTrue(Files.exists(root.resolve("md/locations/Zeloria.md")));
    }

    @Test
    void consoleLoopRunsCommandsUntilExit() {
        String script = "help\n\nsearch \"northern mage\"\nexit\nstats\n";
        app.runConsoleLoop(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)));

        String out = output();
        assertTrue(out.contains("Usage:"));
        assertTrue(out.contains("No results found"));
        assertTrue(out.endsWith("Bye." + System.lineSeparator()));
        assertFalse(out.contains("total_entries"));
    }

    @Test
    void splitLineHonoursQuotes() throws Exception {
        assertEquals(List.of("create", "--name", "Aldric the Wise", "--tags", "a,b"),
                LoreApp.splitLine("create --name \"Aldric the Wise\"  --tags a,b"));
        assertThrows(LoreApp.UsageException.class, () -> LoreApp.splitLine("show \"broken"));
    }
}
