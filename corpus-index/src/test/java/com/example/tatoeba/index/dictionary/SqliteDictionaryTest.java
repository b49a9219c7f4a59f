package com.example.tatoeba.index.dictionary;

import com.example.tatoeba.index.CorpusException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteDictionaryTest {

    @TempDir
    Path tempDir;

    @Test
    void writtenEntriesCanBeLookedUpInSenseOrder() throws Exception {
        Path database = tempDir.resolve("nested").resolve("edict.db");
        int rows = SqliteDictionary.write(database, List.of(
                new DictionaryEntry("彼", List.of("かれ", "あれ")),
                new DictionaryEntry("英語", List.of("えいご"))));

        assertEquals(3, rows);
        try (SqliteDictionary dictionary = SqliteDictionary.open(database)) {
            assertEquals(Optional.of(new DictionaryEntry("彼", List.of("かれ", "あれ"))), dictionary.lookup("彼"));
            assertEquals(List.of("えいご"), dictionary.lookup("英語").get().readings());
            assertTrue(dictionary.lookup("数学").isEmpty());
            assertTrue(dictionary.lookup("").isEmpty());
        }
    }

    @Test
    void rewritingReplacesPreviousContent() throws Exception {
        Path database = tempDir.resolve("edict.db");
        SqliteDictionary.write(database, List.of(new DictionaryEntry("時", List.of("とき"))));
        SqliteDictionary.write(database, List.of(new DictionaryEntry("時間", List.of("じかん"))));

        try (SqliteDictionary dictionary = SqliteDictionary.open(database)) {
            assertTrue(dictionary.lookup("時").isEmpty());
            assertEquals(List.of("じかん"), dictionary.lookup("時間").get().readings());
        }
    }

    @Test
    void readsTablesWrittenByOtherTools() throws Exception {
        Path database = tempDir.resolve("external.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE dictionary_readings (headword TEXT, sense INTEGER, reading TEXT)");
            statement.executeUpdate("INSERT INTO dictionary_readings (headword, sense, reading) VALUES\n"
                    + "('立て', 2, 'だて'),\n"
                    + "('立て', 1, 'たて')");
        }

        try (SqliteDictionary dictionary = SqliteDictionary.open(database)) {
            Optional<DictionaryEntry> first = dictionary.lookup("立て");
            assertEquals(List.of("たて", "だて"), first.get().readings());
            assertSame(first, dictionary.lookup("立て"));
        }
    }

    @Test
    void closedDictionaryRejectsLookups() throws Exception {
        Path database = tempDir.resolve("edict.db");
        SqliteDictionary.write(database, List.of(new DictionaryEntry("英語", List.of("えいご"))));

        SqliteDictionary dictionary = SqliteDictionary.open(database);
        assertEquals(List.of("えいご"), dictionary.lookup("英語").get().readings());
        dictionary.close();

        assertThrows(CorpusException.class, () -> dictionary.lookup("英語"));
    }

    @Test
    void missingFileIsReported() {
        CorpusException ex = assertThrows(CorpusException.class,
                () -> SqliteDictionary.open(tempDir.resolve("missing.db")));
        assertTrue(ex.getMessage().startsWith("Dictionary file not found"));
    }
}
