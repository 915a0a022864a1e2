package com.dataiku.trello2clubhouse.clubhouse;

public class Profile {
    public String name;
    public String mention_name;
    public String email_address;
    public Boolean deactivated;
}
