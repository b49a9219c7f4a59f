package com.example.tatoeba.index.links;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable translation groups. All members of a group share the same {@link Set} instance.
 */
public final class TranslationGroups {

    private final Map<Integer, Set<Integer>> bySentence;
    private final List<Set<Integer>> groups;

    private TranslationGroups(Map<Integer, Set<Integer>> bySentence, List<Set<Integer>> groups) {
        this.bySentence = Collections.unmodifiableMap(bySentence);
        this.groups = Collections.unmodifiableList(groups);
    }

    static TranslationGroups freeze(Map<Integer, Integer> assignment, Map<Integer, Set<Integer>> groups) {
        Map<Integer, Set<Integer>> frozenById = new HashMap<>();
        List<Set<Integer>> frozen = new ArrayList<>(groups.size());
        for (Map.Entry<Integer, Set<Integer>> group : groups.entrySet()) {
            Set<Integer> members = Collections.unmodifiableSet(new LinkedHashSet<>(group.getValue()));
            frozenById.put(group.getKey(), members);
            frozen.add(members);
        }
        Map<Integer, Set<Integer>> bySentence = new HashMap<>();
        assignment.forEach((sentenceId, groupId) -> bySentence.put(sentenceId, frozenById.get(groupId)));
        return new TranslationGroups(bySentence, frozen);
    }

    /**
     * @return the group of {@code sentenceId}, or {@code null} when it has none
     */
    public Set<Integer> groupOf(int sentenceId) {
        return bySentence.get(sentenceId);
    }

    public boolean contains(int sentenceId) {
        return bySentence.containsKey(sentenceId);
    }

    public Set<Integer> sentenceIds() {
        return bySentence.keySet();
    }

    public List<Set<Integer>> groups() {
        return groups;
    }

    /**
     * @return number of grouped sentence ids
     */
    public int size() {
        return bySentence.size();
    }
}
