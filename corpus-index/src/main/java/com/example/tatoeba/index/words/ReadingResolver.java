package com.example.tatoeba.index.words;

import com.example.tatoeba.index.dictionary.Dictionary;
import com.example.tatoeba.index.dictionary.DictionaryEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fills in readings the annotation left out, using the senses of a dictionary entry.
 *
 * <p>A reading is only added when it can be chosen unambiguously: either the word names a sense
 * within range, or every sense of the entry shares one reading. A reading identical to the
 * headword (kana-only words) is never added.</p>
 */
public final class ReadingResolver {

    private final Dictionary dictionary;

    /**
     * @param dictionary dictionary to consult; {@code null} disables resolution
     */
    public ReadingResolver(Dictionary dictionary) {
        this.dictionary = dictionary;
    }

    public boolean isEnabled() {
        return dictionary != null;
    }

    public List<TanakaWord> resolve(List<TanakaWord> sentence) {
        if (dictionary == null) {
            return sentence;
        }
        List<TanakaWord> resolved = new ArrayList<>(sentence.size());
        for (TanakaWord word : sentence) {
            resolved.add(resolve(word));
        }
        return Collections.unmodifiableList(resolved);
    }

    public TanakaWord resolve(TanakaWord word) {
        if (dictionary == null || word.hasReading()) {
            return word;
        }
        Optional<DictionaryEntry> entry = dictionary.lookup(word.headword());
        if (entry.isEmpty()) {
            return word;
        }
        String candidate = chooseReading(word.sense(), entry.get().readings());
        if (candidate == null || candidate.equals(word.headword())) {
            return word;
        }
        return word.withReading(candidate);
    }

    private String chooseReading(Integer sense, List<String> readings) {
        if (sense != null && sense >= 1 && sense <= readings.size()) {
            return readings.get(sense - 1);
        }
        Set<String> distinct = new LinkedHashSet<>(readings);
        if (distinct.size() == 1) {
            return distinct.iterator().next();
        }
        return null;
    }
}
