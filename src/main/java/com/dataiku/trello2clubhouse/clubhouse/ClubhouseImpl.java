package com.dataiku.trello2clubhouse.clubhouse;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

import com.dataiku.trello2clubhouse.GsonHelper;
import com.dataiku.trello2clubhouse.http.JsonHttp;
import com.google.gson.reflect.TypeToken;

public class ClubhouseImpl implements Clubhouse {

    public static final String API_URL = "https://api.clubhouse.io/api/v3";

    private final String apiUrl;
    private final String token;
    private final JsonHttp http;

    public ClubhouseImpl(String token) {
        this(API_URL, token, null);
    }

    public ClubhouseImpl(String apiUrl, String token, HttpClient httpClient) {
        this.apiUrl = apiUrl;
        this.token = token;
        this.http = new JsonHttp(httpClient, GsonHelper.GSON);
    }

    @Override
    public List<Project> listProjects() throws IOException {
        return list("/projects", new TypeToken<List<Project>>() {}.getType());
    }

    @Override
    public List<Workflow> listWorkflows() throws IOException {
        return list("/workflows", new TypeToken<List<Workflow>>() {}.getType());
    }

    @Override
    public List<Member> listMembers() throws IOException {
        return list("/members", new TypeToken<List<Member>>() {}.getType());
    }

    @Override
    public List<Story> listStories(long projectId) throws IOException {
        return list("/projects/" + projectId + "/stories", new TypeToken<List<Story>>() {}.getType());
    }

    @Override
    public void deleteStory(long storyId) throws IOException {
        http.send(request("/stories/" + storyId).DELETE().build(), null);
    }

    @Override
    public Story createStory(CreateStoryParams params) throws IOException {
        return http.send(request("/stories").POST(http.jsonBody(params)).build(), Story.class);
    }

    @Override
    public LinkedFile createLinkedFile(CreateLinkedFileParams params) throws IOException {
        return http.send(request("/linked-files").POST(http.jsonBody(params)).build(), LinkedFile.class);
    }

    private <T> List<T> list(String path, Type type) throws IOException {
        List<T> result = http.send(request(path).GET().build(), type);
        return result == null ? new ArrayList<>() : result;
    }

    private HttpRequest.Builder request(String path) {
        return http.newRequest(URI.create(apiUrl + path))
                .header("Clubhouse-Token", token)
                .header("Content-Type", "application/json");
    }
}
