package com.dataiku.trello2clubhouse;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Collections2;
import com.google.common.io.Files;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Exported cards on disk, so the import can be run, and re-run, separately from the export.
 */
public class CardStore {

    public static final String DEFAULT_EXPORT_FILE = "trello-export.json";

    private final File file;

    public CardStore(File file) {
        this.file = file;
    }

    public File getFile() {
        return file;
    }

    public void write(List<Card> cards) throws IOException {
        Files.createParentDirs(file.getAbsoluteFile());
        try (BufferedWriter writer = Files.newWriter(file, StandardCharsets.UTF_8)) {
            GsonHelper.GSON_PRETTY.toJson(cards, writer);
        }
    }

    public List<Card> read() throws IOException {
        try (BufferedReader reader = Files.newReader(file, StandardCharsets.UTF_8)) {
            List<Card> cards = GsonHelper.GSON.fromJson(reader, new TypeToken<List<Card>>() {}.getType());
            List<Card> result = new ArrayList<>();
            if (cards != null) {
                for (Card card : cards) {
                    if (card != null) {
                        result.add(withoutNulls(card));
                    }
                }
            }
            return result;
        } catch (JsonParseException e) {
            throw new IOException("Invalid export file " + file, e);
        }
    }

    /**
     * Empty collections may be written as {@code null}, which Gson assigns over the field defaults.
     */
    @VisibleForTesting
    static Card withoutNulls(Card card) {
        card.labels = card.labels == null ? new ArrayList<>() : new ArrayList<>(Collections2.filter(card.labels, Objects::nonNull));
        card.ownerIds = card.ownerIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(Collections2.filter(card.ownerIds, Objects::nonNull));
        card.comments = card.comments == null ? new ArrayList<>() : new ArrayList<>(Collections2.filter(card.comments, Objects::nonNull));
        card.tasks = card.tasks == null ? new ArrayList<>() : new ArrayList<>(Collections2.filter(card.tasks, Objects::nonNull));
        Map<String, String> attachments = new LinkedHashMap<>();
        if (card.attachments != null) {
            card.attachments.forEach((name, url) -> {
                if (name != null && url != null) {
                    attachments.put(name, url);
                }
            });
        }
        card.attachments = attachments;
        return card;
    }
}
