package com.example.tatoeba.index;

/**
 * Base exception for failures while loading or querying a Tatoeba corpus index.
 */
public class CorpusException extends RuntimeException {
    public CorpusException(String message) {
        super(message);
    }

    public CorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
