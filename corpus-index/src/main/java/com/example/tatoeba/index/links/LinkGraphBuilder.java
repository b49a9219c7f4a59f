package com.example.tatoeba.index.links;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds translation groups from a stream of sentence/translation links.
 *
 * <p>Every id seen so far is assigned to exactly one group. Groups only grow while links are
 * added; {@link #build()} freezes them.</p>
 */
public final class LinkGraphBuilder {

    private final LinkFilter filter;
    private final GroupingStrategy strategy;

    private final Map<Integer, Integer> assignment = new HashMap<>();
    private final Map<Integer, Set<Integer>> groups = new LinkedHashMap<>();
    private int nextGroupId;
    private int linksSeen;
    private int linksKept;

    public LinkGraphBuilder() {
        this(LinkFilter.acceptAll(), GroupingStrategy.GREEDY);
    }

    public LinkGraphBuilder(LinkFilter filter, GroupingStrategy strategy) {
        this.filter = Objects.requireNonNull(filter, "filter");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Adds one link.
     *
     * @return {@code false} when the filter dropped the link
     */
    public boolean add(int sentenceId, int translationId) {
        linksSeen++;
        if (!filter.accepts(sentenceId, translationId)) {
            return false;
        }
        linksKept++;

        Integer sentenceGroup = assignment.get(sentenceId);
        Integer translationGroup = assignment.get(translationId);
        if (sentenceGroup != null) {
            if (translationGroup != null && !translationGroup.equals(sentenceGroup)
                    && strategy == GroupingStrategy.MERGING) {
                merge(sentenceGroup, translationGroup);
            } else {
                join(sentenceGroup, translationId);
            }
        } else if (translationGroup != null) {
            join(translationGroup, sentenceId);
        } else {
            int groupId = nextGroupId++;
            Set<Integer> members = new LinkedHashSet<>();
            members.add(sentenceId);
            members.add(translationId);
            groups.put(groupId, members);
            assignment.put(sentenceId, groupId);
            assignment.put(translationId, groupId);
        }
        return true;
    }

    private void join(int groupId, int sentenceId) {
        groups.get(groupId).add(sentenceId);
        assignment.put(sentenceId, groupId);
    }

    private void merge(int first, int second) {
        Set<Integer> firstMembers = groups.get(first);
        Set<Integer> secondMembers = groups.get(second);
        int target = firstMembers.size() >= secondMembers.size() ? first : second;
        int source = target == first ? second : first;
        Set<Integer> moved = groups.remove(source);
        groups.get(target).addAll(moved);
        for (Integer id : moved) {
            assignment.put(id, target);
        }
    }

    /**
     * @return group id currently holding {@code sentenceId}, or {@code null}
     */
    public Integer groupIdOf(int sentenceId) {
        return assignment.get(sentenceId);
    }

    public int linksSeen() {
        return linksSeen;
    }

    public int linksKept() {
        return linksKept;
    }

    public TranslationGroups build() {
        return TranslationGroups.freeze(assignment, groups);
    }
}
