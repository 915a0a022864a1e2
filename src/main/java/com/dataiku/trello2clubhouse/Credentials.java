package com.dataiku.trello2clubhouse;

/**
 * Content of {@code credentials.json}. Never committed.
 */
public class Credentials {
    public String trelloApiKey;
    public String trelloToken;
    public String clubhouseToken;
    public String dropboxToken;
}
