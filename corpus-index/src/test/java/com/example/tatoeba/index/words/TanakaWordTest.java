package com.example.tatoeba.index.words;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TanakaWordTest {

    @Test
    void missingDisplayEqualsDisplayOfHeadword() {
        TanakaWord implicit = new TanakaWord("は", null, null, null, false);
        TanakaWord explicit = new TanakaWord("は", null, null, "は", false);

        assertEquals(implicit, explicit);
        assertEquals(implicit.hashCode(), explicit.hashCode());
        assertNull(implicit.display());
    }

    @Test
    void exampleMarkerIsPartOfEquality() {
        assertNotEquals(new TanakaWord("時間", null, null, null, true), TanakaWord.of("時間"));
    }

    @Test
    void rendersAnnotationSyntax() {
        assertEquals("為る(する){し}", new TanakaWord("為る", "する", null, "し", false).toString());
        assertEquals("立て(たて)[2]{たて}~", new TanakaWord("立て", "たて", 2, "たて", true).toString());
        assertEquals("食う[7]", new TanakaWord("食う", null, 7, null, false).toString());
    }

    @Test
    void senseZeroIsNotRendered() {
        TanakaWord word = new WordGrammarParser().parseWord("語[0]", "語[0]");

        assertEquals(Integer.valueOf(0), word.sense());
        assertEquals("語", word.toString());
    }

    @Test
    void withReadingKeepsOtherFields() {
        TanakaWord word = new TanakaWord("其の", null, 1, "その", false).withReading("その");

        assertEquals(new TanakaWord("其の", "その", 1, "その", false), word);
    }
}
