package com.example.tatoeba.index.links;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LinkFilterModeTest {

    @Test
    void parsesLongAndShortNames() {
        assertEquals(LinkFilterMode.SENTENCE_ID, LinkFilterMode.fromString("sentence_id"));
        assertEquals(LinkFilterMode.SENTENCE_ID, LinkFilterMode.fromString("sent_id"));
        assertEquals(LinkFilterMode.TRANSLATION_ID, LinkFilterMode.fromString("translation_id"));
        assertEquals(LinkFilterMode.TRANSLATION_ID, LinkFilterMode.fromString("trans_id"));
        assertEquals(LinkFilterMode.BOTH, LinkFilterMode.fromString(" Both "));
    }

    @Test
    void rejectsUnknownMode() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> LinkFilterMode.fromString("banana"));
        assertEquals("Invalid link filter mode: banana", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> LinkFilterMode.fromString(null));
    }

    @Test
    void configNameRoundTrips() {
        for (LinkFilterMode mode : LinkFilterMode.values()) {
            assertEquals(mode, LinkFilterMode.fromString(mode.configName()));
        }
    }
}
