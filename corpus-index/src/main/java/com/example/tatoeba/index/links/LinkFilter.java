package com.example.tatoeba.index.links;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which links take part in grouping. Without an allow-list every link is kept,
 * whatever the mode.
 */
public final class LinkFilter {

    private static final LinkFilter ACCEPT_ALL = new LinkFilter(null, LinkFilterMode.BOTH);

    private final Set<Integer> sentenceIds;
    private final LinkFilterMode mode;

    private LinkFilter(Set<Integer> sentenceIds, LinkFilterMode mode) {
        this.sentenceIds = sentenceIds == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(sentenceIds));
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public static LinkFilter acceptAll() {
        return ACCEPT_ALL;
    }

    /**
     * @param sentenceIds allow-list, or {@code null} to keep every link
     * @param mode        endpoints that are checked against the allow-list
     */
    public static LinkFilter of(Set<Integer> sentenceIds, LinkFilterMode mode) {
        return new LinkFilter(sentenceIds, mode);
    }

    public boolean accepts(int sentenceId, int translationId) {
        if (sentenceIds == null) {
            return true;
        }
        if (mode.checksSentence() && !sentenceIds.contains(sentenceId)) {
            return false;
        }
        return !mode.checksTranslation() || sentenceIds.contains(translationId);
    }

    public LinkFilterMode mode() {
        return mode;
    }

    /**
     * @return the allow-list, or {@code null} when links are not filtered
     */
    public Set<Integer> sentenceIds() {
        return sentenceIds;
    }
}
