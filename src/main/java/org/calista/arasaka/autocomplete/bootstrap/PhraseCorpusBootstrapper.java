package org.calista.arasaka.autocomplete.bootstrap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.autocomplete.index.AutocompleteIndex;
import org.calista.arasaka.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Streams a JSONL phrase corpus into an index. Gzipped corpora are read transparently.
 */
public final class PhraseCorpusBootstrapper {
    private static final Logger log = LogManager.getLogger(PhraseCorpusBootstrapper.class);

    private final FileIO io;
    private final ObjectReader reader;

    public PhraseCorpusBootstrapper(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        // scores are integers; 1.9 is a bad row, not 1
        this.reader = Objects.requireNonNull(mapper, "mapper")
                .readerFor(PhraseRecord.class)
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    /**
     * Loads one corpus file. Rows are parsed first and inserted only once the whole file has been
     * read, so a failed load leaves the index untouched.
     *
     * @param failFast true: the first bad row aborts the load with an IOException;
     *                 false: bad rows are logged and counted
     */
    public Report loadInto(AutocompleteIndex index, Path jsonlFile, boolean failFast) throws IOException {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(jsonlFile, "jsonlFile");
        int bad = 0;

        if (!io.exists(jsonlFile)) {
            log.warn("Corpus not found: {}", jsonlFile);
            return new Report(jsonlFile, 0, 0);
        }

        ArrayList<PhraseRecord> rows = new ArrayList<>();
        try (Stream<String> lines = io.jsonlStream(jsonlFile)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                try {
                    rows.add(parse(line));
                } catch (IOException | IllegalArgumentException e) {
                    bad++;
                    log.warn("Bad corpus line in {}: {}", jsonlFile, e.toString());
                    if (failFast) throw new IOException("Bad corpus line in " + jsonlFile + ": " + e, e);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        for (PhraseRecord row : rows) index.insert(row.phrase, row.score);

        log.info("Corpus loaded: {} (ok={}, bad={})", jsonlFile, rows.size(), bad);
        return new Report(jsonlFile, rows.size(), bad);
    }

    private PhraseRecord parse(String line) throws IOException {
        if (line.indexOf(FileIO.REPLACEMENT) >= 0) throw new IllegalArgumentException("undecodable bytes");
        PhraseRecord row = reader.readValue(line);
        if (row == null) throw new IllegalArgumentException("null row");
        row.validate();
        return row;
    }

    public static final class Report {
        public final Path file;
        public final int ok;
        public final int bad;

        public Report(Path file, int ok, int bad) {
            this.file = file;
            this.ok = ok;
            this.bad = bad;
        }

        @Override
        public String toString() {
            return "Report{file=" + file + ", ok=" + ok + ", bad=" + bad + '}';
        }
    }
}
