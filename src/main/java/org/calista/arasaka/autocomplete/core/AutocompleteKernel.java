package org.calista.arasaka.autocomplete.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.autocomplete.bootstrap.PhraseCorpusBootstrapper;
import org.calista.arasaka.autocomplete.index.AutocompleteIndex;
import org.calista.arasaka.autocomplete.index.impl.TrieIndex;
import org.calista.arasaka.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * AutocompleteKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + empty index (NO corpora yet)
 *   2) bootstrap()       -> stream configured corpora into the index
 *   3) use               -> insert/query via index()
 *   4) close()
 */
public final class AutocompleteKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutocompleteKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final AutocompleteConfig cfg;
    private final AutocompleteIndex index;

    private volatile boolean bootstrapped = false;

    /** Corpora already in the index; a retried bootstrap skips them. */
    private final Set<String> loadedCorpora = new HashSet<>();

    private AutocompleteKernel(FileIO io, ObjectMapper mapper, AutocompleteConfig cfg, AutocompleteIndex index) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.index = Objects.requireNonNull(index, "index");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Config file and corpora dir are resolved against this root. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private AutocompleteIndex index;

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

        /** Overrides the default {@link TrieIndex}; its limit wins over {@code index.topK}. */
        public Builder index(AutocompleteIndex index) {
            this.index = Objects.requireNonNull(index, "index");
            return this;
        }

        /**
         * Loads/creates the config and builds an empty index. Does NOT bootstrap corpora.
         */
        public AutocompleteKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO io = new FileIO(configRoot, charset, true);

            Path cfgPath = io.resolveExternal(configFile);
            AutocompleteConfig cfg = AutocompleteConfig.loadOrCreate(io, cfgPath, om);

            AutocompleteIndex idx = (this.index != null) ? this.index : new TrieIndex(cfg.index.topK);
            if (idx.limit() != cfg.index.topK) {
                log.warn("Injected index limit {} differs from config index.topK {}; using the index", idx.limit(), cfg.index.topK);
            }

            AutocompleteKernel k = new AutocompleteKernel(io, om, cfg, idx);
            log.info("AutocompleteKernel created (no bootstrap yet): config={}, topK={}", cfgPath, idx.limit());
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            om.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Bootstrap (explicit)
    // ---------------------------------------------------------------------

    /**
     * Loads configured corpora into the index. Repeated calls are no-ops.
     * If a corpus fails, the ones loaded before it stay loaded and a later call resumes
     * from the failed one; each corpus lands in the index at most once.
     */
    public synchronized void bootstrap() throws IOException {
        if (bootstrapped) return;

        Path corporaDir = io.resolveExternal(Path.of(cfg.corpora.dir));
        PhraseCorpusBootstrapper bs = new PhraseCorpusBootstrapper(io, mapper);

        int files = 0;
        long rows = 0;
        for (String name : cfg.corpora.bootstrap) {
            if (loadedCorpora.contains(name)) continue;
            PhraseCorpusBootstrapper.Report r = bs.loadInto(index, corporaDir.resolve(name), cfg.corpora.failFast);
            loadedCorpora.add(name);
            files++;
            rows += r.ok;
        }

        bootstrapped = true;
        log.info("AutocompleteKernel bootstrap done: corporaDir={}, files={}, phrases={}, failFast={}",
                corporaDir, files, rows, cfg.corpora.failFast);
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public AutocompleteConfig config() { return cfg; }
    public AutocompleteIndex index() { return index; }

    @Override
    public void close() {
        log.debug("AutocompleteKernel closed: indexSize={}", index.size());
    }
}
