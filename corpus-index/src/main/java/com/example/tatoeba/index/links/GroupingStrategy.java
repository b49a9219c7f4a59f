package com.example.tatoeba.index.links;

/**
 * How {@link LinkGraphBuilder} handles a link whose endpoints already belong to two different
 * groups.
 */
public enum GroupingStrategy {

    /**
     * Single pass without merging: the link joins the group of its sentence id and the
     * translation's earlier group is left as it was. Correct when the links of each sentence are
     * contiguous, as in the Tatoeba exports.
     */
    GREEDY,

    /**
     * Merges the two groups, so the result is always the connected components of the links.
     */
    MERGING
}
