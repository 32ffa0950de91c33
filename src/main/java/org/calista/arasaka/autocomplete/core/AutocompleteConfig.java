package org.calista.arasaka.autocomplete.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AutocompleteConfig, a plain POJO config.
 * - defaults live in field initializers
 * - loadOrCreate() writes the defaults when the file is missing
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AutocompleteConfig {

    private static final Logger log = LoggerFactory.getLogger(AutocompleteConfig.class);

    public static final int DEFAULT_TOP_K = 10;

    public Index index = new Index();
    public Corpora corpora = new Corpora();
    public Console console = new Console();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Index {
        /** K: entries kept per trie node and returned per query. */
        public int topK = DEFAULT_TOP_K;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Corpora {
        /** Relative to the config root. */
        public String dir = "corpora";
        public List<String> bootstrap = List.of("phrases.jsonl");
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Console {
        public String prompt = "> ";
        public boolean showScores = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced with the defaults, written to disk.
     */
    public static AutocompleteConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            AutocompleteConfig created = new AutocompleteConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            AutocompleteConfig created = new AutocompleteConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        AutocompleteConfig cfg = mapper.readValue(json, AutocompleteConfig.class);
        if (cfg == null) cfg = new AutocompleteConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, AutocompleteConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, AutocompleteConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (index == null) index = new Index();
        if (index.topK < 1) {
            log.warn("index.topK={} is not positive -> fallback to default: {}", index.topK, DEFAULT_TOP_K);
            index.topK = DEFAULT_TOP_K;
        }

        if (corpora == null) corpora = new Corpora();
        if (corpora.dir == null || corpora.dir.isBlank()) corpora.dir = "corpora";
        if (corpora.bootstrap == null) {
            corpora.bootstrap = List.of();
        } else {
            ArrayList<String> names = new ArrayList<>(corpora.bootstrap.size());
            for (String n : corpora.bootstrap) {
                if (n != null && !n.isBlank()) names.add(n.trim());
            }
            corpora.bootstrap = List.copyOf(names);
        }

        if (console == null) console = new Console();
        if (console.prompt == null) console.prompt = "> ";
    }
}
