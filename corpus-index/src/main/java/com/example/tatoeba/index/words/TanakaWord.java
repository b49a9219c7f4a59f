package com.example.tatoeba.index.words;

import java.util.Objects;

/**
 * One annotated word of a Tanaka corpus sentence.
 *
 * <p>Only the headword is mandatory. When no display form is given the headword is shown, and
 * that resolved form is what equality compares. The {@code example} marker is part of equality
 * even though it describes the occurrence rather than the word.</p>
 */
public final class TanakaWord {

    private final String headword;
    private final String reading;
    private final Integer sense;
    private final String display;
    private final boolean example;

    public TanakaWord(String headword, String reading, Integer sense, String display, boolean example) {
        this.headword = Objects.requireNonNull(headword, "headword");
        this.reading = reading;
        this.sense = sense;
        this.display = display;
        this.example = example;
    }

    public static TanakaWord of(String headword) {
        return new TanakaWord(headword, null, null, null, false);
    }

    public String headword() {
        return headword;
    }

    public String reading() {
        return reading;
    }

    /**
     * @return 1-based index into the dictionary senses of the headword, or {@code null}
     */
    public Integer sense() {
        return sense;
    }

    /**
     * @return the display form exactly as annotated, or {@code null}
     */
    public String display() {
        return display;
    }

    public String resolveDisplay() {
        return display != null ? display : headword;
    }

    public boolean isExample() {
        return example;
    }

    public boolean hasReading() {
        return reading != null;
    }

    public TanakaWord withReading(String newReading) {
        return new TanakaWord(headword, newReading, sense, display, example);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TanakaWord)) {
            return false;
        }
        TanakaWord that = (TanakaWord) other;
        return example == that.example
                && headword.equals(that.headword)
                && Objects.equals(sense, that.sense)
                && Objects.equals(reading, that.reading)
                && resolveDisplay().equals(that.resolveDisplay());
    }

    @Override
    public int hashCode() {
        return Objects.hash(headword, reading, sense, resolveDisplay(), example);
    }

    /**
     * Renders the word back into the annotation syntax, e.g. {@code 為る(する){し}}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(headword);
        if (reading != null && !reading.isEmpty()) {
            builder.append('(').append(reading).append(')');
        }
        if (sense != null && sense > 0) {
            builder.append('[').append(sense).append(']');
        }
        if (display != null && !display.isEmpty()) {
            builder.append('{').append(display).append('}');
        }
        if (example) {
            builder.append('~');
        }
        return builder.toString();
    }
}
