package com.example.tatoeba.index.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Readings of one headword, ordered by sense. Index 0 holds the reading of sense 1.
 */
public final class DictionaryEntry {

    private final String headword;
    private final List<String> readings;

    public DictionaryEntry(String headword, List<String> readings) {
        this.headword = Objects.requireNonNull(headword, "headword");
        this.readings = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(readings, "readings")));
    }

    public String headword() {
        return headword;
    }

    public List<String> readings() {
        return readings;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DictionaryEntry)) {
            return false;
        }
        DictionaryEntry that = (DictionaryEntry) other;
        return headword.equals(that.headword) && readings.equals(that.readings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headword, readings);
    }

    @Override
    public String toString() {
        return headword + " " + readings;
    }
}
