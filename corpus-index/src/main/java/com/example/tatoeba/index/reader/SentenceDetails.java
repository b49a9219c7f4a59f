package com.example.tatoeba.index.reader;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Extra columns of the detailed sentences export. Each part is {@code null} when the export
 * holds {@code \N}.
 */
public final class SentenceDetails {

    private final String username;
    private final LocalDateTime dateAdded;
    private final LocalDateTime dateModified;

    public SentenceDetails(String username, LocalDateTime dateAdded, LocalDateTime dateModified) {
        this.username = username;
        this.dateAdded = dateAdded;
        this.dateModified = dateModified;
    }

    public String username() {
        return username;
    }

    public LocalDateTime dateAdded() {
        return dateAdded;
    }

    public LocalDateTime dateModified() {
        return dateModified;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SentenceDetails)) {
            return false;
        }
        SentenceDetails that = (SentenceDetails) other;
        return Objects.equals(username, that.username)
                && Objects.equals(dateAdded, that.dateAdded)
                && Objects.equals(dateModified, that.dateModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, dateAdded, dateModified);
    }

    @Override
    public String toString() {
        return "(" + username + ", " + dateAdded + ", " + dateModified + ")";
    }
}
