package com.dataiku.trello2clubhouse.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Thin JSON layer over {@link HttpClient} shared by the Trello, Dropbox and Clubhouse clients.
 */
public class JsonHttp {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.http");

    private final HttpClient httpClient;
    private final Gson gson;

    public JsonHttp(HttpClient httpClient, Gson gson) {
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build();
        this.gson = Preconditions.checkNotNull(gson);
    }

    public Gson getGson() {
        return gson;
    }

    public HttpRequest.Builder newRequest(URI uri) {
        return HttpRequest.newBuilder().uri(uri).timeout(DEFAULT_TIMEOUT);
    }

    public HttpRequest.BodyPublisher jsonBody(Object body) {
        return HttpRequest.BodyPublishers.ofString(gson.toJson(body));
    }

    /**
     * Sends the request and binds the JSON answer to {@code type}. A {@code null} type discards the body.
     */
    public <T> T send(HttpRequest request, Type type) throws IOException {
        HttpResponse<String> response = execute(request, HttpResponse.BodyHandlers.ofString());
        if (type == null || response.body() == null || response.body().isEmpty()) {
            return null;
        }
        try {
            return gson.fromJson(response.body(), type);
        } catch (JsonParseException e) {
            throw new IOException("Unexpected answer from " + request.method() + " " + request.uri(), e);
        }
    }

    public byte[] sendForBytes(HttpRequest request) throws IOException {
        return execute(request, HttpResponse.BodyHandlers.ofByteArray()).body();
    }

    private <T> HttpResponse<T> execute(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException {
        logger.fine(() -> request.method() + " " + request.uri());
        HttpResponse<T> response;
        try {
            response = httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + request.uri());
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            Object body = response.body();
            String details = body instanceof String ? (String) body : "";
            logger.log(Level.FINE, "{0} {1} answered {2}", new Object[]{request.method(), request.uri(), status});
            throw new ApiException(status, request.method() + " " + request.uri().getPath() + " failed with status " + status + (details.isEmpty() ? "" : ": " + details));
        }
        return response;
    }
}
