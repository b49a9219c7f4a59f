package com.example.tatoeba.index;

import com.example.tatoeba.index.dictionary.SqliteDictionary;
import com.example.tatoeba.index.links.GroupingStrategy;
import com.example.tatoeba.index.reader.CorpusOptions;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Console entry point. Loads a corpus, then reads one sentence id per line from STDIN and prints
 * a JSON description of each sentence on STDOUT.
 *
 * <pre>
 * --sentences FILE    sentences.csv or sentences_detailed.csv (required)
 * --links FILE        links.csv (required)
 * --indices FILE      jpn_indices.csv
 * --dictionary FILE   SQLite reading dictionary
 * --languages LIST    comma separated language codes, or "none" for all
 * --link-filter MODE  sentence_id, translation_id or both
 * --grouping NAME     greedy or merging
 * </pre>
 *
 * The dictionary may also be given through the {@code tatoeba.dictionary.path} system property or
 * the {@code TATOEBA_DICTIONARY} environment variable.
 */
public final class Main {

    static final String DICTIONARY_PROPERTY = "tatoeba.dictionary.path";
    static final String DICTIONARY_ENV = "TATOEBA_DICTIONARY";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    Main(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new Main(System.in, System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        Map<String, String> flags;
        try {
            flags = parseFlags(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return 2;
        }
        String sentences = flags.get("--sentences");
        String links = flags.get("--links");
        if (sentences == null || links == null) {
            err.println("Usage: --sentences FILE --links FILE [--indices FILE] [--dictionary FILE]"
                    + " [--languages LIST] [--link-filter MODE] [--grouping NAME]");
            return 2;
        }

        Path dictionaryPath = resolveDictionaryPath(flags.get("--dictionary"));
        SqliteDictionary dictionary = null;
        try {
            CorpusOptions.Builder options = CorpusOptions.builder();
            applyLanguages(options, flags.get("--languages"));
            if (flags.containsKey("--link-filter")) {
                options.linkFilterMode(flags.get("--link-filter"));
            }
            if (flags.containsKey("--grouping")) {
                options.groupingStrategy(GroupingStrategy.valueOf(flags.get("--grouping").toUpperCase(Locale.ROOT)));
            }
            if (dictionaryPath != null) {
                dictionary = SqliteDictionary.open(dictionaryPath);
                options.dictionary(dictionary);
            }
            String indices = flags.get("--indices");
            CorpusIndex index = CorpusIndex.load(
                    Paths.get(sentences),
                    Paths.get(links),
                    indices == null ? null : Paths.get(indices),
                    options.build());
            answerQueries(new CorpusQueryService(index));
            return 0;
        } catch (CorpusException | IllegalArgumentException ex) {
            err.println("Failed to load corpus: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            err.println("Failed to read input: " + ex.getMessage());
            return 1;
        } finally {
            closeDictionary(dictionary);
        }
    }

    private void answerQueries(CorpusQueryService service) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int sentenceId;
            try {
                sentenceId = Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                err.println("Not a sentence id: " + trimmed);
                continue;
            }
            try {
                out.println(gson.toJson(service.describe(sentenceId)));
            } catch (InvalidIdException ex) {
                err.println(ex.getMessage());
            }
        }
        out.flush();
    }

    private static void applyLanguages(CorpusOptions.Builder options, String value) {
        if (value == null) {
            return;
        }
        if ("none".equalsIgnoreCase(value.trim())) {
            options.allLanguages();
            return;
        }
        Set<String> languages = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(language -> !language.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        options.languages(languages);
    }

    static Path resolveDictionaryPath(String flag) {
        if (flag != null && !flag.isBlank()) {
            return Paths.get(flag);
        }
        String systemProperty = System.getProperty(DICTIONARY_PROPERTY);
        if (systemProperty != null && !systemProperty.isBlank()) {
            return Paths.get(systemProperty);
        }
        String envPath = System.getenv(DICTIONARY_ENV);
        if (envPath != null && !envPath.isBlank()) {
            return Paths.get(envPath);
        }
        return null;
    }

    static Map<String, String> parseFlags(String[] args) {
        Map<String, String> flags = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String name = args[i];
            if (!name.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + name);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + name);
            }
            flags.put(name, args[++i]);
        }
        return flags;
    }

    private void closeDictionary(SqliteDictionary dictionary) {
        if (dictionary == null) {
            return;
        }
        try {
            dictionary.close();
        } catch (IOException ex) {
            err.println("Failed to close dictionary: " + ex.getMessage());
        }
    }
}
