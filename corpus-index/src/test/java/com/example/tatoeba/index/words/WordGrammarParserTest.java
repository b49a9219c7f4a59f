package com.example.tatoeba.index.words;

import com.example.tatoeba.index.EntryGrammarException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WordGrammarParserTest {

    private final WordGrammarParser parser = new WordGrammarParser();

    @Test
    void parsesReadingAndSense() {
        List<TanakaWord> words = parser.parseSentence("彼(かれ)[1] は");

        assertEquals(2, words.size());
        TanakaWord first = words.get(0);
        assertEquals("彼", first.headword());
        assertEquals("かれ", first.reading());
        assertEquals(Integer.valueOf(1), first.sense());
        assertNull(first.display());
        assertFalse(first.isExample());
        assertEquals(TanakaWord.of("は"), words.get(1));
    }

    @Test
    void parsesEveryFieldInOrder() {
        TanakaWord word = parser.parseWord("立て(たて)[02]{たて}~", "立て(たて)[02]{たて}~");

        assertEquals("立て", word.headword());
        assertEquals("たて", word.reading());
        assertEquals(Integer.valueOf(2), word.sense());
        assertEquals("たて", word.display());
        assertTrue(word.isExample());
    }

    @Test
    void plainHeadwordLeavesOptionalFieldsUnset() {
        TanakaWord word = parser.parseWord("英語", "英語");

        assertNull(word.reading());
        assertNull(word.sense());
        assertNull(word.display());
        assertFalse(word.isExample());
        assertEquals("英語", word.toString());
        assertEquals("英語", word.resolveDisplay());
    }

    @Test
    void ignoresVerificationMarkerAfterWord() {
        List<TanakaWord> words = parser.parseSentence("彼女(かのじょ) は|1 散歩[01]~2");

        assertEquals(new TanakaWord("彼女", "かのじょ", null, null, false), words.get(0));
        assertEquals(TanakaWord.of("は"), words.get(1));
        assertEquals(new TanakaWord("散歩", null, 1, null, true), words.get(2));
    }

    @Test
    void acceptsFullWidthSenseDigits() {
        TanakaWord word = parser.parseWord("語[１]", "語[１]");

        assertEquals("語", word.headword());
        assertEquals(Integer.valueOf(1), word.sense());
        assertEquals("語[1]", word.toString());
    }

    @Test
    void skipsEmptyTokens() {
        List<TanakaWord> words = parser.parseSentence(" 彼  は ");

        assertEquals(List.of(TanakaWord.of("彼"), TanakaWord.of("は")), words);
    }

    @Test
    void rejectsWordWithoutHeadword() {
        String sentence = "彼 (かれ) は";

        EntryGrammarException ex = assertThrows(EntryGrammarException.class, () -> parser.parseSentence(sentence));

        assertEquals("(かれ)", ex.getToken());
        assertEquals(sentence, ex.getSentence());
        assertTrue(ex.getMessage().contains(sentence));
    }

    @Test
    void rejectsSenseThatDoesNotFitAnInteger() {
        assertThrows(EntryGrammarException.class, () -> parser.parseSentence("語[99999999999]"));
    }

    @Test
    void usesConfiguredSplitter() {
        WordGrammarParser slashParser = new WordGrammarParser(text -> Arrays.asList(text.split("/")));

        List<TanakaWord> words = slashParser.parseSentence("時(とき)/大学");

        assertEquals(2, words.size());
        assertEquals("とき", words.get(0).reading());
        assertEquals("大学", words.get(1).headword());
    }
}
