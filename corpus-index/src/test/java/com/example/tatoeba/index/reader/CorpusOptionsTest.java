package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.links.GroupingStrategy;
import com.example.tatoeba.index.links.LinkFilterMode;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorpusOptionsTest {

    @Test
    void defaultsKeepJapaneseAndEnglishAndEveryLink() {
        CorpusOptions options = CorpusOptions.defaults();

        assertEquals(Set.of("jpn", "eng"), options.languages());
        assertNull(options.linkSentenceIds());
        assertEquals(LinkFilterMode.BOTH, options.linkFilterMode());
        assertEquals(GroupingStrategy.GREEDY, options.groupingStrategy());
        assertNull(options.annotationSentenceIds());
        assertNull(options.dictionary());
        assertTrue(options.rowFilter().test(List.of("1", "eng", "One.")));
        assertTrue(options.linkFilter().accepts(1, 2));
    }

    @Test
    void linkSettingsFeedTheLinkFilter() {
        CorpusOptions options = CorpusOptions.builder()
                .linkSentenceIds(Set.of(6381))
                .linkFilterMode("trans_id")
                .build();

        assertEquals(Set.of(6381), options.linkSentenceIds());
        assertEquals(LinkFilterMode.TRANSLATION_ID, options.linkFilterMode());
        assertEquals(LinkFilterMode.TRANSLATION_ID, options.linkFilter().mode());
        assertTrue(options.linkFilter().accepts(9999, 6381));
        assertFalse(options.linkFilter().accepts(6381, 9999));
    }

    @Test
    void builtOptionsDoNotSeeLaterChanges() {
        Set<Integer> ids = new HashSet<>(Set.of(1, 2));
        CorpusOptions options = CorpusOptions.builder().linkSentenceIds(ids).build();

        ids.add(3);

        assertEquals(Set.of(1, 2), options.linkSentenceIds());
        assertThrows(UnsupportedOperationException.class, () -> options.linkSentenceIds().add(4));
    }

    @Test
    void unknownFilterModeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CorpusOptions.builder().linkFilterMode("banana"));
    }

    @Test
    void allLanguagesDisablesLanguageFilter() {
        assertNull(CorpusOptions.builder().allLanguages().build().languages());
    }
}
