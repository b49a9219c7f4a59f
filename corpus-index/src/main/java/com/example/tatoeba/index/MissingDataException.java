package com.example.tatoeba.index;

/**
 * Thrown when the requested information was never loaded, for example sentence details from a
 * three-column sentences file.
 */
public class MissingDataException extends CorpusException {
    public MissingDataException(String message) {
        super(message);
    }
}
