package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.InvalidFileException;
import com.example.tatoeba.index.InvalidIdException;
import com.example.tatoeba.index.SampleData;
import com.example.tatoeba.index.links.LinkFilterMode;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LinksReaderTest {

    private static final Set<Integer> SUBSET = Set.of(6381, 82526, 258289, 192227, 508870);

    @Test
    void groupsEveryLinkedSentence() {
        LinksReader reader = LinksReader.load(SampleData.LINKS);

        assertEquals(29, reader.size());
        assertEquals(Set.of(6381, 156245, 258289, 817971), reader.group(6381));
        assertEquals(Set.of(62093, 224758, 723598, 2031040, 2031042), reader.group(2031042));
        assertSame(reader.group(6381), reader.group(817971));
        assertEquals(reader.group(29390), reader.get(192227));
        assertEquals(LinkFilterMode.BOTH, reader.filterMode());
        assertNull(reader.sentenceIdSubset());
    }

    @Test
    void bothEndpointsMustBeInSubset() {
        LinksReader reader = LinksReader.load(SampleData.LINKS, subsetOptions("both"));

        assertEquals(Set.of(6381, 258289), reader.group(6381));
        assertEquals(Set.of(82526, 508870), reader.group(508870));
        assertEquals(SUBSET, reader.sentenceIdSubset());

        InvalidIdException ex = assertThrows(InvalidIdException.class, () -> reader.group(192227));
        assertEquals("Could not find sentence ID 192227 in any groups", ex.getMessage());
    }

    @Test
    void sentenceEndpointInSubset() {
        LinksReader reader = LinksReader.load(SampleData.LINKS, subsetOptions("sent_id"));

        assertEquals(LinkFilterMode.SENTENCE_ID, reader.filterMode());
        assertEquals(Set.of(6381, 156245, 258289, 817971), reader.group(6381));
        assertEquals(Set.of(82526, 321190, 508870), reader.group(82526));
        assertEquals(Set.of(29390, 192227), reader.group(29390));
    }

    @Test
    void translationEndpointInSubset() {
        LinksReader reader = LinksReader.load(SampleData.LINKS, subsetOptions("trans_id"));

        assertEquals(Set.of(6381, 156245, 258289), reader.group(6381));
        assertEquals(Set.of(82526, 321190, 508870), reader.group(82526));
        assertEquals(Set.of(29390, 192227), reader.group(29390));
    }

    @Test
    void groupsListFollowsFileOrder() {
        CorpusOptions options = CorpusOptions.builder()
                .linkSentenceIds(Set.of(6381, 156245, 29390, 192227))
                .build();

        LinksReader reader = LinksReader.load(SampleData.LINKS, options);

        assertEquals(List.of(Set.of(6381, 156245), Set.of(29390, 192227)), reader.groups());
    }

    @Test
    void rowFilterSkipsLinks() {
        CorpusOptions options = CorpusOptions.builder()
                .rowFilter(row -> !row.contains("817971"))
                .build();

        LinksReader reader = LinksReader.load(SampleData.LINKS, options);

        assertEquals(28, reader.size());
        assertEquals(Set.of(6381, 156245, 258289), reader.group(6381));
    }

    @Test
    void rejectsRowsWithoutTwoColumns() {
        InvalidFileException ex = assertThrows(InvalidFileException.class, () -> LinksReader.read(
                new StringReader("1\t2\n1\t2\t3\n"), "links.csv", CorpusOptions.defaults()));

        assertEquals(2, ex.getLineNumber());
    }

    @Test
    void rejectsNonNumericIds() {
        assertThrows(InvalidFileException.class, () -> LinksReader.read(
                new StringReader("1\ttwo\n"), "links.csv", CorpusOptions.defaults()));
    }

    @Test
    void describesItsSource() {
        LinksReader reader = LinksReader.read(new StringReader("1\t2\n"), "links.csv", CorpusOptions.defaults());

        assertEquals("LinksReader(links='links.csv')", reader.toString());
    }

    private static CorpusOptions subsetOptions(String mode) {
        return CorpusOptions.builder()
                .linkSentenceIds(SUBSET)
                .linkFilterMode(mode)
                .build();
    }
}
