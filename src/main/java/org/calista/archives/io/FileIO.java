package org.calista.archives.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: the single I/O entry point of the archive.
 *
 * <p>
 * Everything that touches disk (config, category files, backups, markdown export) goes
 * through here so that the write discipline stays in one place:
 * - atomic commits (temp sibling + ATOMIC_MOVE, with a plain move fallback)
 * - unchanged content is not rewritten
 * - relative paths are resolved inside the root and cannot escape it via ".."
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path root;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path root) {
        this(root, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path root, Charset charset, boolean atomicWrites) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        log.debug("FileIO init: root={}, charset={}, atomicWrites={}", this.root, charset, atomicWrites);
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create root directory " + this.root, e);
        }
    }

    // ----------------------------
    // Root / Resolve
    // ----------------------------

    public Path root() {
        return root;
    }

    /**
     * Resolves a relative path inside the root. Absolute paths and ".." escapes are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = root.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(root)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /**
     * Configured locations may be absolute (kept as is) or relative to the root.
     */
    public Path resolveConfigured(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        Path p = Paths.get(anyPath);
        if (p.isAbsolute()) return p.normalize();
        return resolve(anyPath);
    }

    public void createDirectories(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Files.createDirectories(dir);
        log.trace("Directories ensured: {}", dir);
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Existence / listing
    // ----------------------------

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    public List<Path> list(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.sorted().collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }

        if (!atomicWrites) {
            Files.writeString(file, content, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    /**
     * Copies a file into a directory, keeping its file name. Existing targets are replaced.
     */
    public Path copyInto(Path source, Path targetDir) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(targetDir, "targetDir");
        Files.createDirectories(targetDir);
        Path target = targetDir.resolve(source.getFileName().toString());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        log.debug("copyInto: {} -> {}", source, target);
        return target;
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private boolean isSameContent(Path file, String content) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != content.getBytes(charset).length) return false;
            return Files.readString(file, charset).equals(content);
        } catch (IOException e) {
            // unreadable -> rewrite
            return false;
        }
    }
}
