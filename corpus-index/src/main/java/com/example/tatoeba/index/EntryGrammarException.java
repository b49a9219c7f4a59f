package com.example.tatoeba.index;

/**
 * Thrown when a word of an annotated sentence cannot be decoded.
 */
public class EntryGrammarException extends CorpusException {

    private final String token;
    private final String sentence;

    public EntryGrammarException(String token, String sentence) {
        super("Could not interpret word " + token + " in sentence:\n" + sentence);
        this.token = token;
        this.sentence = sentence;
    }

    public EntryGrammarException(String token, String sentence, Throwable cause) {
        super("Could not interpret word " + token + " in sentence:\n" + sentence, cause);
        this.token = token;
        this.sentence = sentence;
    }

    public String getToken() {
        return token;
    }

    public String getSentence() {
        return sentence;
    }
}
