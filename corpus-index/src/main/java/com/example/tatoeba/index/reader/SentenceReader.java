package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.InvalidFileException;
import com.example.tatoeba.index.InvalidIdException;
import com.example.tatoeba.index.MissingDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a Tatoeba {@code sentences.csv} or {@code sentences_detailed.csv} export.
 *
 * <p>The layout is inferred from the first row: three columns
 * {@code id, language, text}, or six columns that add
 * {@code username, date added, date modified}. Every row must use the same layout.</p>
 */
public final class SentenceReader implements TatoebaReader<String> {

    private static final Logger LOG = LoggerFactory.getLogger(SentenceReader.class);

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    static final String NULL_MARKER = "\\N";

    private static final int BASIC_COLUMNS = 3;
    private static final int DETAILED_COLUMNS = 6;

    private final String source;
    private final Map<Integer, String> sentences;
    private final Map<String, Set<Integer>> languageIndex;
    private final Map<Integer, SentenceDetails> details;

    private SentenceReader(String source,
                           Map<Integer, String> sentences,
                           Map<String, Set<Integer>> languageIndex,
                           Map<Integer, SentenceDetails> details) {
        this.source = source;
        this.sentences = Collections.unmodifiableMap(sentences);
        this.languageIndex = Collections.unmodifiableMap(languageIndex);
        this.details = details == null ? null : Collections.unmodifiableMap(details);
    }

    public static SentenceReader load(Path path) {
        return load(path, CorpusOptions.defaults());
    }

    public static SentenceReader load(Path path, CorpusOptions options) {
        Loader loader = new Loader(path.toString(), options);
        DelimitedRows.read(path, loader::accept);
        return loader.finish();
    }

    public static SentenceReader read(Reader source, String sourceName, CorpusOptions options) {
        Loader loader = new Loader(sourceName, options);
        DelimitedRows.read(source, sourceName, loader::accept);
        return loader.finish();
    }

    /**
     * @throws InvalidIdException when the sentence was not loaded
     */
    public String sentence(int sentenceId) {
        String text = sentences.get(sentenceId);
        if (text == null) {
            throw new InvalidIdException(sentenceId, "Could not find sentence with ID " + sentenceId);
        }
        return text;
    }

    /**
     * Language of a sentence. Scans the per-language id sets, of which there are only as many as
     * loaded languages.
     *
     * @throws InvalidIdException when no language holds the sentence
     */
    public String language(int sentenceId) {
        for (Map.Entry<String, Set<Integer>> entry : languageIndex.entrySet()) {
            if (entry.getValue().contains(sentenceId)) {
                return entry.getKey();
            }
        }
        throw new InvalidIdException(sentenceId, "No language found for sentence id " + sentenceId);
    }

    /**
     * @throws MissingDataException when the source had no detail columns
     * @throws InvalidIdException   when the sentence was not loaded
     */
    public SentenceDetails details(int sentenceId) {
        if (details == null) {
            throw new MissingDataException("Detailed information not loaded from " + source);
        }
        SentenceDetails found = details.get(sentenceId);
        if (found == null) {
            throw new InvalidIdException(sentenceId, "Detailed information not found for sentence ID " + sentenceId);
        }
        return found;
    }

    public boolean hasDetails() {
        return details != null;
    }

    public Set<String> languages() {
        return languageIndex.keySet();
    }

    @Override
    public String get(int sentenceId) {
        return sentence(sentenceId);
    }

    @Override
    public boolean containsId(int sentenceId) {
        return sentences.containsKey(sentenceId);
    }

    @Override
    public Set<Integer> ids() {
        return sentences.keySet();
    }

    @Override
    public int size() {
        return sentences.size();
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "SentenceReader(sentences='" + source + "')";
    }

    private static final class Loader {
        private final String source;
        private final CorpusOptions options;
        private final Map<Integer, String> sentences = new LinkedHashMap<>();
        private final Map<String, Set<Integer>> languageIndex = new LinkedHashMap<>();
        private Map<Integer, SentenceDetails> details;
        private int columns = -1;
        private int rowsRead;

        Loader(String source, CorpusOptions options) {
            this.source = source;
            this.options = Objects.requireNonNull(options, "options");
        }

        void accept(int lineNumber, List<String> row) {
            rowsRead++;
            if (columns < 0) {
                if (row.size() != BASIC_COLUMNS && row.size() != DETAILED_COLUMNS) {
                    throw new InvalidFileException(source, lineNumber,
                            "sentences files must have either 3 or 6 columns, found " + row.size());
                }
                columns = row.size();
                if (columns == DETAILED_COLUMNS) {
                    details = new LinkedHashMap<>();
                }
            } else if (row.size() != columns) {
                throw new InvalidFileException(source, lineNumber,
                        "expected " + columns + " columns, found " + row.size());
            }

            if (!options.rowFilter().test(row)) {
                LOG.debug("Row filter skipped line {} of {}", lineNumber, source);
                return;
            }
            String language = row.get(1);
            Set<String> languages = options.languages();
            if (languages != null && !languages.contains(language)) {
                return;
            }

            int sentenceId = DelimitedRows.parseId(source, lineNumber, row.get(0));
            languageIndex.computeIfAbsent(language, key -> new LinkedHashSet<>()).add(sentenceId);
            sentences.put(sentenceId, row.get(2));

            if (details != null) {
                String username = NULL_MARKER.equals(row.get(3)) ? null : row.get(3);
                details.put(sentenceId, new SentenceDetails(
                        username,
                        parseDate(row.get(4), lineNumber),
                        parseDate(row.get(5), lineNumber)));
            }
        }

        private LocalDateTime parseDate(String value, int lineNumber) {
            if (NULL_MARKER.equals(value)) {
                return null;
            }
            try {
                return LocalDateTime.parse(value, DATE_FORMAT);
            } catch (DateTimeParseException ex) {
                throw new InvalidFileException(source, lineNumber, "invalid date '" + value + "'", ex);
            }
        }

        SentenceReader finish() {
            Map<String, Set<Integer>> frozenIndex = new LinkedHashMap<>();
            languageIndex.forEach((language, ids) -> frozenIndex.put(language, Collections.unmodifiableSet(ids)));
            LOG.info("Loaded {} of {} sentences from {} ({})", sentences.size(), rowsRead, source,
                    details != null ? "detailed" : "basic");
            return new SentenceReader(source, sentences, frozenIndex, details);
        }
    }
}
