package org.calista.archives.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileIOTest {

    @Test
    void resolveStaysInsideRoot(@TempDir Path root) {
        FileIO io = new FileIO(root);

        assertEquals(root.toAbsolutePath().normalize().resolve("a/b.json"), io.resolve("a/b.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(root.resolve("x").toString()));
    }

    @Test
    void configuredAbsolutePathsAreKept(@TempDir Path root, @TempDir Path elsewhere) {
        FileIO io = new FileIO(root);

        assertEquals(elsewhere.normalize(), io.resolveConfigured(elsewhere.toString()));
        assertEquals(io.root().resolve("lore_database"), io.resolveConfigured("lore_database"));
    }

    @Test
    void writeCreatesParentsAndLeavesNoTempFile(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path file = root.resolve("nested/dir/out.json");

        io.writeString(file, "{}");

        assertEquals("{}", Files.readString(file, StandardCharsets.UTF_8));
        assertFalse(Files.exists(root.resolve("nested/dir/out.json.tmp")));
        assertEquals(List.of(file), io.list(root.resolve("nested/dir")));
    }

    @Test
    void directWritesUseTheConfiguredCharset(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root, StandardCharsets.ISO_8859_1, false);
        Path file = root.resolve("out/city.txt");

        io.writeString(file, "Zéloria");

        assertArrayEquals("Zéloria".getBytes(StandardCharsets.ISO_8859_1), Files.readAllBytes(file));
        assertEquals("Zéloria", io.readString(file));
        assertFalse(Files.exists(root.resolve("out/city.txt.tmp")));
    }

    @Test
    void unchangedContentIsNotRewritten(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path file = root.resolve("same.txt");
        io.writeString(file, "zeloria");

        FileTime old = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(file, old);
        io.writeString(file, "zeloria");

        assertEquals(old, Files.getLastModifiedTime(file));
    }

    @Test
    void readIfExistsAndCopyInto(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path src = root.resolve("characters.json");

        assertTrue(io.readStringIfExists(src).isEmpty());
        io.writeString(src, "{\"entries\":{}}");

        Path copy = io.copyInto(src, root.resolve("backup"));
        assertEquals(root.resolve("backup/characters.json"), copy);
        assertEquals("{\"entries\":{}}", io.readString(copy));
    }
}
