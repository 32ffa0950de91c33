package org.calista.arasaka.io;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestFileIO {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private FileIO io;

    @Before
    public void setUp() {
        io = new FileIO(tmp.getRoot().toPath());
    }

    @Test
    public void testWriteThenReadString() throws IOException {
        Path f = io.resolve("nested/dir/file.txt");
        io.writeString(f, "tape grid\n");
        assertTrue(io.exists(f));
        assertEquals("tape grid\n", io.readString(f));

        io.writeString(f, "overwritten");
        assertEquals("overwritten", io.readString(f));

        // no temp siblings left behind
        try (Stream<Path> s = Files.list(f.getParent())) {
            assertEquals(1L, s.count());
        }
    }

    @Test
    public void testNonAtomicWrite() throws IOException {
        FileIO direct = new FileIO(tmp.getRoot().toPath(), StandardCharsets.UTF_8, false);
        Path f = direct.resolve("direct.txt");
        direct.writeString(f, "x");
        assertEquals("x", direct.readString(f));
    }

    @Test(expected = NoSuchFileException.class)
    public void testReadMissingFile() throws IOException {
        io.readString(io.resolve("missing.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResolveRejectsTraversal() {
        io.resolve("../outside.txt");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResolveRejectsAbsolute() {
        io.resolve(tmp.getRoot().getAbsolutePath());
    }

    @Test
    public void testResolveNormalizesBackslashes() {
        assertEquals(io.baseDir().resolve("a").resolve("b.txt"), io.resolve("a\\b.txt"));
    }

    @Test
    public void testResolveExternal() {
        Path abs = tmp.getRoot().toPath().toAbsolutePath().getParent();
        assertEquals(abs.normalize(), io.resolveExternal(abs));
        assertEquals(io.baseDir().resolve("corpora"), io.resolveExternal(Path.of("corpora")));
    }

    @Test
    public void testJsonlSkipsBlankLinesAndTrims() throws IOException {
        Path f = io.resolve("rows.jsonl");
        io.writeString(f, "  {\"a\":1}  \n\n   \n{\"a\":2}\n");
        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), jsonl(f));
    }

    @Test
    public void testGzipReadTransparently() throws IOException {
        Path f = io.resolve("rows.jsonl.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(f))) {
            out.write("{\"a\":1}\n\n{\"a\":2}\n".getBytes(StandardCharsets.UTF_8));
        }
        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), jsonl(f));
        assertEquals("{\"a\":1}\n\n{\"a\":2}\n", io.readString(f));
    }

    @Test
    public void testExists() {
        assertFalse(io.exists(io.resolve("nope")));
    }

    @Test
    public void testUndecodableBytesAreReplaced() throws IOException {
        Path f = io.resolve("mixed.txt");
        Files.write(f, new byte[]{'o', 'k', '\n', 'b', (byte) 0xFF, 'd', '\n', 'o', 'k', '2', '\n'});
        try (Stream<String> lines = io.lines(f)) {
            assertEquals(List.of("ok", "b" + FileIO.REPLACEMENT + "d", "ok2"), lines.collect(Collectors.toList()));
        }
    }

    private List<String> jsonl(Path f) throws IOException {
        try (Stream<String> s = io.jsonlStream(f)) {
            return s.collect(Collectors.toList());
        }
    }
}
