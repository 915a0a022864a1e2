package com.dataiku.trello2clubhouse.clubhouse;

public class CreateLabelParams {
    public String name;
    public String color;

    public CreateLabelParams() {
    }

    public CreateLabelParams(String name) {
        this.name = name;
    }

    public CreateLabelParams(String name, String color) {
        this.name = name;
        this.color = color;
    }
}
