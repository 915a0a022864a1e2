package com.dataiku.trello2clubhouse;

import java.util.Objects;

/**
 * One checklist item. The checklist it came from only survives as the description prefix.
 */
public class Task {
    public boolean completed;
    public String description;

    public Task() {
    }

    public Task(boolean completed, String description) {
        this.completed = completed;
        this.description = description;
    }

    public static Task fromChecklistItem(String checklistName, String itemName, boolean completed) {
        return new Task(completed, checklistName + " - " + itemName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Task)) {
            return false;
        }
        Task task = (Task) o;
        return completed == task.completed && Objects.equals(description, task.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(completed, description);
    }

    @Override
    public String toString() {
        return (completed ? "[x] " : "[ ] ") + description;
    }
}
