package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.InvalidFileException;
import com.example.tatoeba.index.InvalidIdException;
import com.example.tatoeba.index.words.ReadingResolver;
import com.example.tatoeba.index.words.TanakaWord;
import com.example.tatoeba.index.words.WordGrammarParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the Sentence-Dictionary linking file ({@code jpn_indices.csv}): Japanese sentence id,
 * id of the linked meaning, and the sentence in Tanaka corpus word notation.
 *
 * <p>Sentences are parsed as they are loaded; readings missing from the annotation are completed
 * from the configured dictionary.</p>
 *
 * @see <a href="http://www.edrdg.org/wiki/index.php/Sentence-Dictionary_Linking">Sentence-Dictionary Linking</a>
 */
public final class IndexReader implements TatoebaReader<List<TanakaWord>> {

    private static final Logger LOG = LoggerFactory.getLogger(IndexReader.class);

    private final String source;
    private final Map<Integer, List<TanakaWord>> sentences;
    private final Map<Integer, Integer> links;

    private IndexReader(String source, Map<Integer, List<TanakaWord>> sentences, Map<Integer, Integer> links) {
        this.source = source;
        this.sentences = Collections.unmodifiableMap(sentences);
        this.links = Collections.unmodifiableMap(links);
    }

    public static IndexReader load(Path path) {
        return load(path, CorpusOptions.defaults());
    }

    public static IndexReader load(Path path, CorpusOptions options) {
        Loader loader = new Loader(path.toString(), options);
        DelimitedRows.read(path, loader::accept);
        return loader.finish();
    }

    public static IndexReader read(Reader source, String sourceName, CorpusOptions options) {
        Loader loader = new Loader(sourceName, options);
        DelimitedRows.read(source, sourceName, loader::accept);
        return loader.finish();
    }

    /**
     * @throws InvalidIdException when the sentence was not loaded
     */
    public List<TanakaWord> words(int sentenceId) {
        List<TanakaWord> words = sentences.get(sentenceId);
        if (words == null) {
            throw new InvalidIdException(sentenceId, "Sentence ID " + sentenceId + " not found");
        }
        return words;
    }

    /**
     * @return id of the sentence this one is linked to by the annotation file, usually its English
     * translation
     * @throws InvalidIdException when the sentence was not loaded
     */
    public int link(int sentenceId) {
        Integer meaningId = links.get(sentenceId);
        if (meaningId == null) {
            throw new InvalidIdException(sentenceId, "Sentence ID " + sentenceId + " not found");
        }
        return meaningId;
    }

    @Override
    public List<TanakaWord> get(int sentenceId) {
        return words(sentenceId);
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
        return "IndexReader(jpn_indices='" + source + "')";
    }

    private static final class Loader {
        private final String source;
        private final CorpusOptions options;
        private final WordGrammarParser parser;
        private final ReadingResolver resolver;
        private final Map<Integer, List<TanakaWord>> sentences = new LinkedHashMap<>();
        private final Map<Integer, Integer> links = new LinkedHashMap<>();
        private int wordsParsed;

        Loader(String source, CorpusOptions options) {
            this.source = source;
            this.options = Objects.requireNonNull(options, "options");
            this.parser = new WordGrammarParser(options.sentenceSplitter());
            this.resolver = new ReadingResolver(options.dictionary());
        }

        void accept(int lineNumber, List<String> row) {
            if (row.size() != 3) {
                throw new InvalidFileException(source, lineNumber,
                        "index files must have 3 columns, found " + row.size());
            }
            if (!options.rowFilter().test(row)) {
                LOG.debug("Row filter skipped line {} of {}", lineNumber, source);
                return;
            }
            int sentenceId = DelimitedRows.parseId(source, lineNumber, row.get(0));
            Set<Integer> subset = options.annotationSentenceIds();
            if (subset != null && !subset.contains(sentenceId)) {
                return;
            }
            int meaningId = DelimitedRows.parseId(source, lineNumber, row.get(1));

            List<TanakaWord> words = resolver.resolve(parser.parseSentence(row.get(2)));
            wordsParsed += words.size();
            links.put(sentenceId, meaningId);
            sentences.put(sentenceId, words);
        }

        IndexReader finish() {
            LOG.info("Loaded {} annotated sentences ({} words) from {}{}", sentences.size(), wordsParsed, source,
                    resolver.isEnabled() ? " with dictionary readings" : "");
            return new IndexReader(source, sentences, links);
        }
    }
}
