package com.dataiku.trello2clubhouse.trello;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.dataiku.trello2clubhouse.GsonHelper;
import com.dataiku.trello2clubhouse.http.JsonHttp;
import com.google.common.base.Joiner;
import com.google.gson.reflect.TypeToken;

/**
 * REST implementation against {@code https://api.trello.com/1}.
 */
public class TrelloImpl implements Trello {

    public static final String API_URL = "https://api.trello.com/1";
    private static final int ACTIONS_LIMIT = 1000;

    private final String apiUrl;
    private final String apiKey;
    private final String token;
    private final JsonHttp http;

    public TrelloImpl(String apiKey, String token) {
        this(API_URL, apiKey, token, null);
    }

    public TrelloImpl(String apiUrl, String apiKey, String token, HttpClient httpClient) {
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.token = token;
        this.http = new JsonHttp(httpClient, GsonHelper.GSON);
    }

    @Override
    public List<TrelloCard> getCardsByBoard(String boardId) throws IOException {
        return get("/boards/" + boardId + "/cards", new TypeToken<List<TrelloCard>>() {}.getType(), "filter=open");
    }

    @Override
    public List<TrelloList> getListsByBoard(String boardId) throws IOException {
        return get("/boards/" + boardId + "/lists", new TypeToken<List<TrelloList>>() {}.getType());
    }

    @Override
    public List<TrelloMember> getMembersByBoard(String boardId) throws IOException {
        return get("/boards/" + boardId + "/members", new TypeToken<List<TrelloMember>>() {}.getType(), "fields=username,fullName");
    }

    @Override
    public List<TrelloAction> getActionsByCard(String cardId) throws IOException {
        String filter = Joiner.on(',').join(TrelloAction.CREATE_CARD, TrelloAction.COMMENT_CARD);
        return get("/cards/" + cardId + "/actions", new TypeToken<List<TrelloAction>>() {}.getType(), "filter=" + filter, "limit=" + ACTIONS_LIMIT);
    }

    @Override
    public List<TrelloChecklist> getChecklistByCard(String cardId) throws IOException {
        return get("/cards/" + cardId + "/checklists", new TypeToken<List<TrelloChecklist>>() {}.getType());
    }

    @Override
    public List<TrelloCard.Attachment> getAttachmentsByCard(String cardId) throws IOException {
        return get("/cards/" + cardId + "/attachments", new TypeToken<List<TrelloCard.Attachment>>() {}.getType());
    }

    @Override
    public byte[] downloadAttachment(TrelloCard.Attachment attachment) throws IOException {
        URI uri = URI.create(attachment.getUrl());
        // Files uploaded to Trello are only served with the OAuth header.
        return http.sendForBytes(http.newRequest(uri)
                .header("Authorization", "OAuth oauth_consumer_key=\"" + apiKey + "\", oauth_token=\"" + token + "\"")
                .GET()
                .build());
    }

    private <T> List<T> get(String path, Type type, String... params) throws IOException {
        List<String> query = new ArrayList<>();
        for (String param : params) {
            query.add(param);
        }
        query.add("key=" + encode(apiKey));
        query.add("token=" + encode(token));
        URI uri = URI.create(apiUrl + path + "?" + Joiner.on('&').join(query));
        List<T> result = http.send(http.newRequest(uri).header("Accept", "application/json").GET().build(), type);
        return result == null ? new ArrayList<>() : result;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
