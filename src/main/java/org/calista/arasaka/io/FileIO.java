package org.calista.arasaka.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * FileIO: single I/O entry point for config files and phrase corpora.
 *
 * <ul>
 *   <li>streaming line/JSONL reads, so large corpora never sit in memory twice</li>
 *   <li>transparent gzip for {@code .gz}/{@code .gzip} files</li>
 *   <li>atomic writes (temp sibling + move)</li>
 *   <li>{@link #resolve(String)} stays inside the base dir</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    /** Substituted for undecodable input in {@link #lines(Path)}. */
    public static final char REPLACEMENT = '\uFFFD';

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and ".." escapes are rejected;
     * backslashes are treated as separators.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /**
     * Relative paths are taken against baseDir, absolute ones as-is. No sandbox check:
     * corpora may live anywhere.
     */
    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        Path p = anyPath.isAbsolute() ? anyPath : baseDir.resolve(anyPath);
        return p.toAbsolutePath().normalize();
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    /** Whole file as a string; gzip is unpacked on the fly. */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = openInputStream(file)) {
                return new String(in.readAllBytes(), charset);
            }
        }
        return Files.readString(file, charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!atomicWrites) {
            Files.writeString(file, content, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    /**
     * Line stream. Must be closed (try-with-resources).
     * Undecodable bytes become {@link #REPLACEMENT}; the stream itself never fails on them.
     */
    public Stream<String> lines(Path file) throws IOException {
        Objects.requireNonNull(file, "file");

        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        BufferedReader br = new BufferedReader(new InputStreamReader(openInputStream(file), decoder));
        return br.lines().onClose(() -> {
            try {
                br.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close reader for " + file, e);
            }
        });
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    /** JSONL records: trimmed, blank lines skipped. Must be closed. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        return lines(file)
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static Path tempSibling(Path file) {
        Path abs = file.toAbsolutePath();
        return abs.resolveSibling("." + abs.getFileName() + "." + System.nanoTime() + ".tmp");
    }

    private static void atomicCommit(Path tmp, Path target) throws IOException {
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

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }

    private static InputStream openInputStream(Path file) throws IOException {
        InputStream raw = Files.newInputStream(file);
        if (!isGzip(file)) return raw;
        try {
            return new GZIPInputStream(raw);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }
}
