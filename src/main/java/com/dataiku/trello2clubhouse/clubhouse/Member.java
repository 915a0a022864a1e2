package com.dataiku.trello2clubhouse.clubhouse;

import java.util.UUID;

public class Member {
    public UUID id;
    public Boolean disabled;
    public Profile profile = new Profile();

    public Member() {
    }

    public Member(UUID id, String mentionName, String name) {
        this.id = id;
        this.profile.mention_name = mentionName;
        this.profile.name = name;
    }
}
