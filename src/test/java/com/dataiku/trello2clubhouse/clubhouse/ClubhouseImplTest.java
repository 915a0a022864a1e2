package com.dataiku.trello2clubhouse.clubhouse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dataiku.trello2clubhouse.http.ApiException;

@ExtendWith(MockitoExtension.class)
public class ClubhouseImplTest {

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpResponse<Object> response;

    private ClubhouseImpl clubhouse;

    @BeforeEach
    void setUp() throws Exception {
        clubhouse = new ClubhouseImpl("https://clubhouse.test/api/v3", "secret", httpClient);
        doReturn(response).when(httpClient).send(any(), any());
    }

    @Test
    void shouldListStoriesOfProject() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("[{\"id\": 12, \"name\": \"Fix login bug\", \"project_id\": 7, \"external_id\": \"https://trello.com/c/abcd1234\"}]");

        List<Story> stories = clubhouse.listStories(7);

        assertEquals(1, stories.size());
        assertEquals(12, stories.get(0).id);
        assertEquals(7L, stories.get(0).project_id.longValue());
        HttpRequest request = sentRequest();
        assertEquals("GET", request.method());
        assertEquals("https://clubhouse.test/api/v3/projects/7/stories", request.uri().toString());
        assertEquals("secret", request.headers().firstValue("Clubhouse-Token").orElse(null));
    }

    @Test
    void shouldParseMembers() throws Exception {
        UUID id = UUID.randomUUID();
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("[{\"id\": \"" + id + "\", \"profile\": {\"mention_name\": \"alice\", \"name\": \"Alice Martin\", \"deactivated\": false}}]");

        List<Member> members = clubhouse.listMembers();

        assertEquals(id, members.get(0).id);
        assertEquals("alice", members.get(0).profile.mention_name);
    }

    @Test
    void shouldDeleteStory() throws Exception {
        when(response.statusCode()).thenReturn(204);

        clubhouse.deleteStory(12);

        HttpRequest request = sentRequest();
        assertEquals("DELETE", request.method());
        assertEquals("/api/v3/stories/12", request.uri().getPath());
    }

    @Test
    void shouldReportRejectedStory() throws Exception {
        when(response.statusCode()).thenReturn(422);
        when(response.body()).thenReturn("{\"message\": \"name is too long\"}");

        CreateStoryParams params = new CreateStoryParams();
        params.name = "Fix login bug";
        ApiException e = assertThrows(ApiException.class, () -> clubhouse.createStory(params));

        assertEquals(422, e.getStatus());
        assertEquals("POST", sentRequest().method());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }
}
