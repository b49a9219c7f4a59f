package com.example.tatoeba.index.words;

import com.example.tatoeba.index.EntryGrammarException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes sentences of the Sentence-Dictionary linking format ({@code jpn_indices}) into
 * {@link TanakaWord} lists.
 *
 * <p>Each whitespace separated word follows
 * {@code headword(reading)[sense]{display}~} where everything after the headword is optional
 * and a trailing verification marker such as {@code |1} is ignored.</p>
 */
public final class WordGrammarParser {

    private static final Pattern WORD_PATTERN = Pattern.compile(
            "(?<headword>[^(\\[{|~]+)"
                    + "(?:\\((?<reading>[^)]+)\\))?"
                    + "(?:\\[(?<sense>\\p{Nd}+)\\])?"
                    + "(?:\\{(?<display>[^}]+)\\})?"
                    + "(?<example>~)?"
                    + "(?:\\p{Nd}+)?");

    /** Splits on single spaces, keeping empty pieces so that the parser can skip them. */
    public static final Function<String, List<String>> SPACE_SPLITTER =
            text -> Arrays.asList(text.split(" ", -1));

    private final Function<String, List<String>> splitter;

    public WordGrammarParser() {
        this(SPACE_SPLITTER);
    }

    public WordGrammarParser(Function<String, List<String>> splitter) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
    }

    /**
     * Parses an annotated sentence.
     *
     * @param text sentence in Tanaka corpus notation
     * @return immutable list of words in sentence order
     * @throws EntryGrammarException when a non-empty word does not start with a headword
     */
    public List<TanakaWord> parseSentence(String text) {
        Objects.requireNonNull(text, "text");
        List<TanakaWord> words = new ArrayList<>();
        for (String token : splitter.apply(text)) {
            if (token == null || token.isEmpty()) {
                continue;
            }
            words.add(parseWord(token, text));
        }
        return Collections.unmodifiableList(words);
    }

    /**
     * Parses a single word. The sentence is only used for diagnostics.
     */
    public TanakaWord parseWord(String token, String sentence) {
        Matcher matcher = WORD_PATTERN.matcher(token);
        if (!matcher.lookingAt()) {
            throw new EntryGrammarException(token, sentence);
        }
        Integer sense = null;
        String senseGroup = matcher.group("sense");
        if (senseGroup != null) {
            try {
                sense = Integer.valueOf(senseGroup);
            } catch (NumberFormatException ex) {
                throw new EntryGrammarException(token, sentence, ex);
            }
        }
        return new TanakaWord(
                matcher.group("headword"),
                matcher.group("reading"),
                sense,
                matcher.group("display"),
                matcher.group("example") != null);
    }
}
