package com.example.tatoeba.index.dictionary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map backed dictionary, typically filled from an already parsed EDICT file.
 */
public final class InMemoryDictionary implements Dictionary {

    private final Map<String, DictionaryEntry> entries;

    private InMemoryDictionary(Map<String, DictionaryEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static InMemoryDictionary of(Collection<DictionaryEntry> entries) {
        Builder builder = builder();
        for (DictionaryEntry entry : entries) {
            builder.add(entry);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<DictionaryEntry> lookup(String headword) {
        if (headword == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(headword));
    }

    public Collection<DictionaryEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {
        private final Map<String, List<String>> readings = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Appends senses to a headword. Repeated calls for the same headword add further senses.
         */
        public Builder add(String headword, String... senseReadings) {
            Objects.requireNonNull(headword, "headword");
            readings.computeIfAbsent(headword, key -> new ArrayList<>()).addAll(Arrays.asList(senseReadings));
            return this;
        }

        public Builder add(DictionaryEntry entry) {
            readings.computeIfAbsent(entry.headword(), key -> new ArrayList<>()).addAll(entry.readings());
            return this;
        }

        public InMemoryDictionary build() {
            Map<String, DictionaryEntry> entries = new LinkedHashMap<>();
            readings.forEach((headword, values) -> entries.put(headword, new DictionaryEntry(headword, values)));
            return new InMemoryDictionary(entries);
        }
    }
}
