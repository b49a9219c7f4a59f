package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.InvalidFileException;
import com.example.tatoeba.index.InvalidIdException;
import com.example.tatoeba.index.links.LinkFilter;
import com.example.tatoeba.index.links.LinkFilterMode;
import com.example.tatoeba.index.links.LinkGraphBuilder;
import com.example.tatoeba.index.links.TranslationGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a Tatoeba {@code links.csv} export and groups linked sentences into translation groups.
 */
public final class LinksReader implements TatoebaReader<Set<Integer>> {

    private static final Logger LOG = LoggerFactory.getLogger(LinksReader.class);

    private final String source;
    private final LinkFilter filter;
    private final TranslationGroups groups;

    private LinksReader(String source, LinkFilter filter, TranslationGroups groups) {
        this.source = source;
        this.filter = filter;
        this.groups = groups;
    }

    public static LinksReader load(Path path) {
        return load(path, CorpusOptions.defaults());
    }

    public static LinksReader load(Path path, CorpusOptions options) {
        Loader loader = new Loader(path.toString(), options);
        DelimitedRows.read(path, loader::accept);
        return loader.finish();
    }

    public static LinksReader read(Reader source, String sourceName, CorpusOptions options) {
        Loader loader = new Loader(sourceName, options);
        DelimitedRows.read(source, sourceName, loader::accept);
        return loader.finish();
    }

    /**
     * @return the translation group holding {@code sentenceId}; every member returns the same set
     * @throws InvalidIdException when the sentence is in no group
     */
    public Set<Integer> group(int sentenceId) {
        Set<Integer> group = groups.groupOf(sentenceId);
        if (group == null) {
            throw new InvalidIdException(sentenceId, "Could not find sentence ID " + sentenceId + " in any groups");
        }
        return group;
    }

    public List<Set<Integer>> groups() {
        return groups.groups();
    }

    public LinkFilterMode filterMode() {
        return filter.mode();
    }

    /**
     * @return the sentence id allow-list, or {@code null} when links were not filtered
     */
    public Set<Integer> sentenceIdSubset() {
        return filter.sentenceIds();
    }

    @Override
    public Set<Integer> get(int sentenceId) {
        return group(sentenceId);
    }

    @Override
    public boolean containsId(int sentenceId) {
        return groups.contains(sentenceId);
    }

    @Override
    public Set<Integer> ids() {
        return groups.sentenceIds();
    }

    @Override
    public int size() {
        return groups.size();
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "LinksReader(links='" + source + "')";
    }

    private static final class Loader {
        private final String source;
        private final CorpusOptions options;
        private final LinkFilter filter;
        private final LinkGraphBuilder builder;

        Loader(String source, CorpusOptions options) {
            this.source = source;
            this.options = Objects.requireNonNull(options, "options");
            this.filter = options.linkFilter();
            this.builder = new LinkGraphBuilder(filter, options.groupingStrategy());
        }

        void accept(int lineNumber, List<String> row) {
            if (row.size() != 2) {
                throw new InvalidFileException(source, lineNumber,
                        "links files must have 2 columns, found " + row.size());
            }
            if (!options.rowFilter().test(row)) {
                LOG.debug("Row filter skipped line {} of {}", lineNumber, source);
                return;
            }
            int sentenceId = DelimitedRows.parseId(source, lineNumber, row.get(0));
            int translationId = DelimitedRows.parseId(source, lineNumber, row.get(1));
            builder.add(sentenceId, translationId);
        }

        LinksReader finish() {
            TranslationGroups groups = builder.build();
            LOG.info("Kept {} of {} links from {}, {} groups covering {} sentences",
                    builder.linksKept(), builder.linksSeen(), source, groups.groups().size(), groups.size());
            return new LinksReader(source, filter, groups);
        }
    }
}
