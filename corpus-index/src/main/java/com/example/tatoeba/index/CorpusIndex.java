package com.example.tatoeba.index;

import com.example.tatoeba.index.reader.CorpusOptions;
import com.example.tatoeba.index.reader.IndexReader;
import com.example.tatoeba.index.reader.LinksReader;
import com.example.tatoeba.index.reader.SentenceDetails;
import com.example.tatoeba.index.reader.SentenceReader;
import com.example.tatoeba.index.words.TanakaWord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only lookups over a loaded Tatoeba corpus: sentences, their translation groups and, when
 * an index file was given, the annotated words of Japanese sentences.
 *
 * <p>Everything is read eagerly by {@link #load}. Either the whole corpus loads or an exception
 * is thrown; once built the index never changes and may be shared between threads.</p>
 */
public final class CorpusIndex {

    private final SentenceReader sentences;
    private final LinksReader links;
    private final IndexReader annotations;

    private CorpusIndex(SentenceReader sentences, LinksReader links, IndexReader annotations) {
        this.sentences = Objects.requireNonNull(sentences, "sentences");
        this.links = Objects.requireNonNull(links, "links");
        this.annotations = annotations;
    }

    /**
     * Loads a corpus.
     *
     * @param sentencesFile {@code sentences.csv} or {@code sentences_detailed.csv}
     * @param linksFile     {@code links.csv}
     * @param indicesFile   {@code jpn_indices.csv}, or {@code null} to skip word annotations
     * @param options       loading options
     * @throws InvalidFileException   when a row is malformed
     * @throws EntryGrammarException  when an annotated word cannot be decoded
     * @throws CorpusException        when a file cannot be read
     */
    public static CorpusIndex load(Path sentencesFile, Path linksFile, Path indicesFile, CorpusOptions options) {
        Objects.requireNonNull(options, "options");
        SentenceReader sentences = SentenceReader.load(sentencesFile, options);
        LinksReader links = LinksReader.load(linksFile, options);
        IndexReader annotations = indicesFile == null ? null : IndexReader.load(indicesFile, options);
        return new CorpusIndex(sentences, links, annotations);
    }

    public String sentenceText(int sentenceId) {
        return sentences.sentence(sentenceId);
    }

    public String language(int sentenceId) {
        return sentences.language(sentenceId);
    }

    public SentenceDetails details(int sentenceId) {
        return sentences.details(sentenceId);
    }

    public Set<Integer> group(int sentenceId) {
        return links.group(sentenceId);
    }

    public List<Set<Integer>> groups() {
        return links.groups();
    }

    public List<TanakaWord> annotatedWords(int sentenceId) {
        return requireAnnotations().words(sentenceId);
    }

    public int linkedMeaning(int sentenceId) {
        return requireAnnotations().link(sentenceId);
    }

    public Set<Integer> sentenceIds() {
        return sentences.ids();
    }

    public boolean hasSentence(int sentenceId) {
        return sentences.containsId(sentenceId);
    }

    public boolean hasGroup(int sentenceId) {
        return links.containsId(sentenceId);
    }

    public boolean hasAnnotation(int sentenceId) {
        return annotations != null && annotations.containsId(sentenceId);
    }

    public boolean hasDetails() {
        return sentences.hasDetails();
    }

    public boolean hasAnnotations() {
        return annotations != null;
    }

    public LinksReader links() {
        return links;
    }

    private IndexReader requireAnnotations() {
        if (annotations == null) {
            throw new MissingDataException("No sentence index file was loaded");
        }
        return annotations;
    }

    @Override
    public String toString() {
        return "CorpusIndex(" + sentences + ", " + links
                + (annotations != null ? ", " + annotations : "") + ")";
    }
}
