package com.example.tatoeba.index;

/**
 * Thrown by lookups when a sentence id is not part of the loaded data.
 */
public class InvalidIdException extends CorpusException {

    private final int sentenceId;

    public InvalidIdException(int sentenceId, String message) {
        super(message);
        this.sentenceId = sentenceId;
    }

    public int getSentenceId() {
        return sentenceId;
    }
}
