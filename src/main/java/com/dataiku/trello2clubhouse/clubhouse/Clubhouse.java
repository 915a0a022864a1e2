package com.dataiku.trello2clubhouse.clubhouse;

import java.io.IOException;
import java.util.List;

/**
 * The part of the Clubhouse v3 API the import needs.
 */
public interface Clubhouse {

    List<Project> listProjects() throws IOException;

    List<Workflow> listWorkflows() throws IOException;

    List<Member> listMembers() throws IOException;

    List<Story> listStories(long projectId) throws IOException;

    void deleteStory(long storyId) throws IOException;

    Story createStory(CreateStoryParams params) throws IOException;

    LinkedFile createLinkedFile(CreateLinkedFileParams params) throws IOException;
}
