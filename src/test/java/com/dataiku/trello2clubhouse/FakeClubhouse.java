package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.dataiku.trello2clubhouse.clubhouse.Clubhouse;
import com.dataiku.trello2clubhouse.clubhouse.CreateLinkedFileParams;
import com.dataiku.trello2clubhouse.clubhouse.CreateStoryParams;
import com.dataiku.trello2clubhouse.clubhouse.LinkedFile;
import com.dataiku.trello2clubhouse.clubhouse.Member;
import com.dataiku.trello2clubhouse.clubhouse.Project;
import com.dataiku.trello2clubhouse.clubhouse.Story;
import com.dataiku.trello2clubhouse.clubhouse.Workflow;

class FakeClubhouse implements Clubhouse {
    final List<Project> projects = new ArrayList<>();
    final List<Workflow> workflows = new ArrayList<>();
    final List<Member> members = new ArrayList<>();
    final Map<Long, Story> stories = new LinkedHashMap<>();
    final List<CreateStoryParams> createdStories = new ArrayList<>();
    final List<CreateLinkedFileParams> linkedFiles = new ArrayList<>();
    final List<Long> deletedStories = new ArrayList<>();
    final Set<String> failingStoryNames = new HashSet<>();
    final Set<Long> failingDeletes = new HashSet<>();
    final Set<String> failingLinkedFileUrls = new HashSet<>();
    boolean failListing;
    private long nextId = 100;

    @Override
    public List<Project> listProjects() {
        return new ArrayList<>(projects);
    }

    @Override
    public List<Workflow> listWorkflows() {
        return new ArrayList<>(workflows);
    }

    @Override
    public List<Member> listMembers() {
        return new ArrayList<>(members);
    }

    @Override
    public List<Story> listStories(long projectId) throws IOException {
        if (failListing) {
            throw new IOException("503 Service Unavailable");
        }
        List<Story> result = new ArrayList<>();
        for (Story story : stories.values()) {
            if (story.project_id != null && story.project_id == projectId) {
                result.add(story);
            }
        }
        return result;
    }

    @Override
    public void deleteStory(long storyId) throws IOException {
        if (failingDeletes.contains(storyId)) {
            throw new IOException("403 Forbidden");
        }
        if (stories.remove(storyId) == null) {
            throw new IOException("404 Not Found");
        }
        deletedStories.add(storyId);
    }

    @Override
    public Story createStory(CreateStoryParams params) throws IOException {
        if (failingStoryNames.contains(params.name)) {
            throw new IOException("422 Unprocessable Entity");
        }
        createdStories.add(params);
        Story story = new Story(nextId++, params.name, params.project_id);
        stories.put(story.id, story);
        return story;
    }

    @Override
    public LinkedFile createLinkedFile(CreateLinkedFileParams params) throws IOException {
        if (failingLinkedFileUrls.contains(params.url)) {
            throw new IOException("400 Bad Request");
        }
        linkedFiles.add(params);
        return new LinkedFile(nextId++, params.name, params.url);
    }

    List<String> storyNames() {
        List<String> names = new ArrayList<>();
        for (Story story : stories.values()) {
            names.add(story.name);
        }
        return names;
    }
}
