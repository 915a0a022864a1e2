package com.dataiku.trello2clubhouse.dropbox;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.dataiku.trello2clubhouse.GsonHelper;
import com.dataiku.trello2clubhouse.http.JsonHttp;

/**
 * Dropbox API v2 over HTTP, authenticated with a long lived access token.
 */
public class DropboxImpl implements Dropbox {

    public static final String API_URL = "https://api.dropboxapi.com/2";
    public static final String CONTENT_URL = "https://content.dropboxapi.com/2";

    private final String apiUrl;
    private final String contentUrl;
    private final String token;
    private final JsonHttp http;

    public DropboxImpl(String token) {
        this(API_URL, CONTENT_URL, token, null);
    }

    public DropboxImpl(String apiUrl, String contentUrl, String token, HttpClient httpClient) {
        this.apiUrl = apiUrl;
        this.contentUrl = contentUrl;
        this.token = token;
        this.http = new JsonHttp(httpClient, GsonHelper.GSON);
    }

    @Override
    public FileMetadata upload(UploadInput input) throws IOException {
        HttpRequest request = http.newRequest(URI.create(contentUrl + "/files/upload"))
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/octet-stream")
                .header("Dropbox-API-Arg", http.getGson().toJson(input))
                .POST(HttpRequest.BodyPublishers.ofByteArray(input.content == null ? new byte[0] : input.content))
                .build();
        return http.send(request, FileMetadata.class);
    }

    @Override
    public List<SharedLink> listSharedLinks(String path) throws IOException {
        Map<String, Object> body = new HashMap<>();
        body.put("path", path);
        body.put("direct_only", true);
        SharedLink.SharedLinks links = http.send(rpc("/sharing/list_shared_links", body), SharedLink.SharedLinks.class);
        return links == null || links.links == null ? new ArrayList<>() : links.links;
    }

    @Override
    public SharedLink createSharedLink(String path) throws IOException {
        Map<String, Object> body = new HashMap<>();
        body.put("path", path);
        SharedLink link = http.send(rpc("/sharing/create_shared_link_with_settings", body), SharedLink.class);
        if (link == null || link.url == null) {
            throw new IOException("No shared link returned for " + path);
        }
        return link;
    }

    private HttpRequest rpc(String endpoint, Object body) {
        return http.newRequest(URI.create(apiUrl + endpoint))
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .POST(http.jsonBody(body))
                .build();
    }
}
