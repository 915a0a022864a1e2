package com.dataiku.trello2clubhouse;

public class AttachmentFailure {

    public enum Stage {
        DOWNLOAD,
        UPLOAD,
        SHARE
    }

    private final String attachmentName;
    private final Stage stage;
    private final Exception cause;

    public AttachmentFailure(String attachmentName, Stage stage, Exception cause) {
        this.attachmentName = attachmentName;
        this.stage = stage;
        this.cause = cause;
    }

    public String getAttachmentName() {
        return attachmentName;
    }

    public Stage getStage() {
        return stage;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return stage + " failed for " + attachmentName + ": " + cause.getMessage();
    }
}
