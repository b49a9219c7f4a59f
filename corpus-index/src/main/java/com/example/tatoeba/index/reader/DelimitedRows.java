package com.example.tatoeba.index.reader;

import com.example.tatoeba.index.CorpusException;
import com.example.tatoeba.index.InvalidFileException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tab separated row iteration over Tatoeba export files. Fields are not quoted in these exports,
 * so a tab is always a column break.
 */
final class DelimitedRows {

    private static final char DELIMITER = '\t';

    @FunctionalInterface
    interface RowHandler {
        void handle(int lineNumber, List<String> row);
    }

    private DelimitedRows() {
    }

    static void read(Path path, RowHandler handler) {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            read(reader, path.toString(), handler);
        } catch (IOException ex) {
            throw new CorpusException("Failed to read " + path.toAbsolutePath(), ex);
        }
    }

    /**
     * Reads every row of {@code source}. The reader is not closed.
     */
    static void read(Reader source, String sourceName, RowHandler handler) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(handler, "handler");
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        try {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                    line = line.substring(1);
                }
                handler.handle(lineNumber, split(line));
            }
        } catch (IOException ex) {
            throw new CorpusException("Failed to read " + sourceName, ex);
        }
    }

    static List<String> split(String line) {
        if (line.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(line.split(String.valueOf(DELIMITER), -1)));
    }

    /**
     * Parses a sentence id column.
     *
     * @throws InvalidFileException when the value is not an integer
     */
    static int parseId(String source, int lineNumber, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidFileException(source, lineNumber, "invalid sentence id '" + value + "'", ex);
        }
    }
}
