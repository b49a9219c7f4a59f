package com.example.tatoeba.index;

import com.example.tatoeba.index.reader.SentenceDetails;
import com.example.tatoeba.index.reader.SentenceReader;
import com.example.tatoeba.index.words.TanakaWord;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * JSON view of a {@link CorpusIndex}, one object per sentence.
 */
public class CorpusQueryService {

    private final CorpusIndex index;
    private final ConcurrentMap<Integer, JsonObject> sentenceCache = new ConcurrentHashMap<>();

    public CorpusQueryService(CorpusIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Describes a sentence. Parts the corpus does not have for this sentence are left out.
     *
     * @throws InvalidIdException when the sentence was not loaded
     */
    public JsonObject describe(int sentenceId) {
        if (!index.hasSentence(sentenceId)) {
            throw new InvalidIdException(sentenceId, "Could not find sentence with ID " + sentenceId);
        }
        return sentenceCache.computeIfAbsent(sentenceId, this::computeDescription).deepCopy();
    }

    private JsonObject computeDescription(int sentenceId) {
        JsonObject payload = new JsonObject();
        payload.addProperty("id", sentenceId);
        payload.addProperty("language", index.language(sentenceId));
        payload.addProperty("text", index.sentenceText(sentenceId));

        if (index.hasDetails()) {
            payload.add("details", toJson(index.details(sentenceId)));
        }
        if (index.hasGroup(sentenceId)) {
            List<Integer> members = new ArrayList<>(index.group(sentenceId));
            Collections.sort(members);
            JsonArray group = new JsonArray();
            members.forEach(group::add);
            payload.add("group", group);
        }
        if (index.hasAnnotation(sentenceId)) {
            payload.addProperty("link", index.linkedMeaning(sentenceId));
            JsonArray words = new JsonArray();
            for (TanakaWord word : index.annotatedWords(sentenceId)) {
                words.add(toJson(word));
            }
            payload.add("words", words);
        }
        return payload;
    }

    static JsonObject toJson(TanakaWord word) {
        JsonObject object = new JsonObject();
        object.addProperty("headword", word.headword());
        if (word.reading() != null) {
            object.addProperty("reading", word.reading());
        }
        if (word.sense() != null) {
            object.addProperty("sense", word.sense());
        }
        object.addProperty("display", word.resolveDisplay());
        object.addProperty("example", word.isExample());
        return object;
    }

    static JsonObject toJson(SentenceDetails details) {
        JsonObject object = new JsonObject();
        if (details.username() != null) {
            object.addProperty("username", details.username());
        }
        addDate(object, "date_added", details.dateAdded());
        addDate(object, "date_modified", details.dateModified());
        return object;
    }

    private static void addDate(JsonObject object, String name, LocalDateTime value) {
        if (value != null) {
            object.addProperty(name, SentenceReader.DATE_FORMAT.format(value));
        }
    }
}
