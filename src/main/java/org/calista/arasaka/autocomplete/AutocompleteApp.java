package org.calista.arasaka.autocomplete;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.autocomplete.core.AutocompleteConfig;
import org.calista.arasaka.autocomplete.core.AutocompleteKernel;
import org.calista.arasaka.autocomplete.index.AutocompleteIndex;
import org.calista.arasaka.autocomplete.index.impl.TrieIndex;
import org.calista.arasaka.autocomplete.rank.Entry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * AutocompleteApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + empty index)
 *  2) kernel.bootstrap() (corpora)
 *  3) read-eval loop: prefix queries, ":add score phrase", ":stats", "exit"
 */
public final class AutocompleteApp {

    private static final Logger log = LogManager.getLogger(AutocompleteApp.class);

    private final Path cfgPath;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 ? args[0] : "config/autocomplete.json");
        new AutocompleteApp(cfg).run();
    }

    public AutocompleteApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run() throws IOException {
        try (AutocompleteKernel kernel = AutocompleteKernel.builder().build(cfgPath)) {
            kernel.bootstrap();
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            runConsoleLoop(kernel, in, System.out);
        }
    }

    /** Reads commands until "exit" or end of input. */
    static void runConsoleLoop(AutocompleteKernel kernel, BufferedReader in, PrintStream out) throws IOException {
        AutocompleteConfig.Console console = kernel.config().console;
        AutocompleteIndex index = kernel.index();

        log.info("Autocomplete started. phrases={}, topK={}", index.size(), index.limit());
        log.info("Type 'exit' to quit.");

        while (true) {
            out.print(console.prompt);
            out.flush();

            String line = in.readLine();
            if (line == null) break;
            if (line.trim().equalsIgnoreCase("exit")) break;

            if (line.startsWith(":add ")) {
                add(index, line.substring(5), out);
                continue;
            }
            if (line.trim().equals(":stats")) {
                printStats(index, out);
                continue;
            }

            List<Entry> ranked = index.queryEntries(line);
            if (ranked.isEmpty()) {
                out.println("(no suggestions)");
                continue;
            }
            for (Entry e : ranked) {
                out.println(console.showScores ? e.score + "\t" + e.phrase : e.phrase);
            }
        }
    }

    private static void add(AutocompleteIndex index, String args, PrintStream out) {
        String trimmed = args.trim();
        int sp = trimmed.indexOf(' ');
        if (sp <= 0) {
            out.println("usage: :add <score> <phrase>");
            return;
        }
        long score;
        try {
            score = Long.parseLong(trimmed.substring(0, sp));
        } catch (NumberFormatException e) {
            out.println("bad score: " + trimmed.substring(0, sp));
            return;
        }
        String phrase = trimmed.substring(sp + 1).stripLeading();
        index.insert(phrase, score);
        log.debug("Console insert: phrase={}, score={}", phrase, score);
        out.println("added");
    }

    private static void printStats(AutocompleteIndex index, PrintStream out) {
        out.println("topK=" + index.limit());
        out.println("phrases=" + index.size());
        if (index instanceof TrieIndex trie) out.println("nodes=" + trie.nodeCount());
    }
}
