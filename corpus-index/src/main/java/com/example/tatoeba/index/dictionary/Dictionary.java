package com.example.tatoeba.index.dictionary;

import java.util.Optional;

/**
 * Headword to readings lookup used to complete word annotations.
 */
@FunctionalInterface
public interface Dictionary {

    /**
     * @param headword dictionary citation form
     * @return the entry for the headword, or empty when the dictionary does not know it
     */
    Optional<DictionaryEntry> lookup(String headword);
}
