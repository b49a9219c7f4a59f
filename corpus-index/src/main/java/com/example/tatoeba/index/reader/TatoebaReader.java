package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.InvalidIdException;

import java.util.Set;

/**
 * Read-only, id keyed view over one loaded Tatoeba file.
 *
 * @param <V> value stored per sentence id
 */
public interface TatoebaReader<V> {

    /**
     * @throws InvalidIdException when {@code sentenceId} was not loaded
     */
    V get(int sentenceId);

    boolean containsId(int sentenceId);

    /**
     * @return unmodifiable view of the loaded ids
     */
    Set<Integer> ids();

    int size();

    /**
     * @return file path or caller supplied name the data was read from
     */
    String source();
}
