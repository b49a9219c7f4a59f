package com.example.tatoeba.index;

/**
 * Thrown when a source row has the wrong shape, such as an unexpected column count or a
 * non-numeric sentence id. Aborts the whole load.
 */
public class InvalidFileException extends CorpusException {

    private final String source;
    private final int lineNumber;

    public InvalidFileException(String source, int lineNumber, String message) {
        super(format(source, lineNumber, message));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public InvalidFileException(String source, int lineNumber, String message, Throwable cause) {
        super(format(source, lineNumber, message), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return 1-based line number of the offending row
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(String source, int lineNumber, String message) {
        return "Invalid file " + source + " (line " + lineNumber + "): " + message;
    }
}
