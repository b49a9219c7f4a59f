package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.dictionary.Dictionary;
import com.example.tatoeba.index.links.GroupingStrategy;
import com.example.tatoeba.index.links.LinkFilter;
import com.example.tatoeba.index.links.LinkFilterMode;
import com.example.tatoeba.index.words.WordGrammarParser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Loading options shared by the corpus readers.
 */
public final class CorpusOptions {

    public static final Set<String> DEFAULT_LANGUAGES = Collections.unmodifiableSet(
            new LinkedHashSet<>(List.of("jpn", "eng")));

    private static final CorpusOptions DEFAULTS = builder().build();

    private final Set<String> languages;
    private final Set<Integer> linkSentenceIds;
    private final LinkFilterMode linkFilterMode;
    private final GroupingStrategy groupingStrategy;
    private final Set<Integer> annotationSentenceIds;
    private final Dictionary dictionary;
    private final Predicate<List<String>> rowFilter;
    private final Function<String, List<String>> sentenceSplitter;

    private CorpusOptions(Builder builder) {
        this.languages = copyOrNull(builder.languages);
        this.linkSentenceIds = copyOrNull(builder.linkSentenceIds);
        this.linkFilterMode = builder.linkFilterMode;
        this.groupingStrategy = builder.groupingStrategy;
        this.annotationSentenceIds = copyOrNull(builder.annotationSentenceIds);
        this.dictionary = builder.dictionary;
        this.rowFilter = builder.rowFilter;
        this.sentenceSplitter = builder.sentenceSplitter;
    }

    public static CorpusOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return languages kept by the sentence reader, or {@code null} when all are kept
     */
    public Set<String> languages() {
        return languages;
    }

    public Set<Integer> linkSentenceIds() {
        return linkSentenceIds;
    }

    public LinkFilterMode linkFilterMode() {
        return linkFilterMode;
    }

    public LinkFilter linkFilter() {
        return LinkFilter.of(linkSentenceIds, linkFilterMode);
    }

    public GroupingStrategy groupingStrategy() {
        return groupingStrategy;
    }

    public Set<Integer> annotationSentenceIds() {
        return annotationSentenceIds;
    }

    /**
     * @return dictionary used to complete readings, or {@code null}
     */
    public Dictionary dictionary() {
        return dictionary;
    }

    /**
     * @return predicate deciding which raw rows are kept; rows it rejects are skipped
     */
    public Predicate<List<String>> rowFilter() {
        return rowFilter;
    }

    public Function<String, List<String>> sentenceSplitter() {
        return sentenceSplitter;
    }

    private static <T> Set<T> copyOrNull(Set<T> values) {
        return values == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static final class Builder {
        private Set<String> languages = DEFAULT_LANGUAGES;
        private Set<Integer> linkSentenceIds;
        private LinkFilterMode linkFilterMode = LinkFilterMode.BOTH;
        private GroupingStrategy groupingStrategy = GroupingStrategy.GREEDY;
        private Set<Integer> annotationSentenceIds;
        private Dictionary dictionary;
        private Predicate<List<String>> rowFilter = row -> true;
        private Function<String, List<String>> sentenceSplitter = WordGrammarParser.SPACE_SPLITTER;

        private Builder() {
        }

        /**
         * @param languages three letter language codes to keep, or {@code null} for all
         */
        public Builder languages(Set<String> languages) {
            this.languages = languages;
            return this;
        }

        public Builder languages(String... languages) {
            return languages(new LinkedHashSet<>(List.of(languages)));
        }

        public Builder allLanguages() {
            this.languages = null;
            return this;
        }

        public Builder linkSentenceIds(Set<Integer> sentenceIds) {
            this.linkSentenceIds = sentenceIds;
            return this;
        }

        public Builder linkFilterMode(LinkFilterMode mode) {
            this.linkFilterMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code mode} is not a known filter mode
         */
        public Builder linkFilterMode(String mode) {
            return linkFilterMode(LinkFilterMode.fromString(mode));
        }

        public Builder groupingStrategy(GroupingStrategy strategy) {
            this.groupingStrategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder annotationSentenceIds(Set<Integer> sentenceIds) {
            this.annotationSentenceIds = sentenceIds;
            return this;
        }

        public Builder dictionary(Dictionary dictionary) {
            this.dictionary = dictionary;
            return this;
        }

        public Builder rowFilter(Predicate<List<String>> rowFilter) {
            this.rowFilter = Objects.requireNonNull(rowFilter, "rowFilter");
            return this;
        }

        public Builder sentenceSplitter(Function<String, List<String>> sentenceSplitter) {
            this.sentenceSplitter = Objects.requireNonNull(sentenceSplitter, "sentenceSplitter");
            return this;
        }

        public CorpusOptions build() {
            return new CorpusOptions(this);
        }
    }
}
