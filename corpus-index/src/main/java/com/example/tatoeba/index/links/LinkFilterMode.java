package com.example.tatoeba.index.links;

import java.util.Locale;

/**
 * Which endpoint of a link must belong to the sentence id allow-list for the link to be kept.
 */
public enum LinkFilterMode {

    /** Only the sentence id (first column) is checked. */
    SENTENCE_ID("sentence_id", true, false),

    /** Only the translation id (second column) is checked. */
    TRANSLATION_ID("translation_id", false, true),

    /** Both endpoints must be on the allow-list. */
    BOTH("both", true, true);

    private final String configName;
    private final boolean checksSentence;
    private final boolean checksTranslation;

    LinkFilterMode(String configName, boolean checksSentence, boolean checksTranslation) {
        this.configName = configName;
        this.checksSentence = checksSentence;
        this.checksTranslation = checksTranslation;
    }

    public String configName() {
        return configName;
    }

    boolean checksSentence() {
        return checksSentence;
    }

    boolean checksTranslation() {
        return checksTranslation;
    }

    /**
     * Parses a configuration string. Accepts {@code sentence_id}, {@code translation_id} and
     * {@code both}, plus the short forms {@code sent_id} and {@code trans_id}, ignoring case.
     *
     * @throws IllegalArgumentException if {@code value} is {@code null} or not a known mode
     */
    public static LinkFilterMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Link filter mode cannot be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sentence_id":
            case "sent_id":
                return SENTENCE_ID;
            case "translation_id":
            case "trans_id":
                return TRANSLATION_ID;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("Invalid link filter mode: " + value);
        }
    }
}
