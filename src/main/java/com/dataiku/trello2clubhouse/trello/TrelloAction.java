package com.dataiku.trello2clubhouse.trello;

/**
 * Entry of a card action history.
 */
public class TrelloAction {

    public static final String CREATE_CARD = "createCard";
    public static final String COMMENT_CARD = "commentCard";

    private String id;
    private String type;
    private String date;
    private Data data;
    private TrelloMember memberCreator;

    public TrelloAction() {
    }

    public TrelloAction(String type, String date, String text, TrelloMember memberCreator) {
        this.type = type;
        this.date = date;
        this.data = new Data(text);
        this.memberCreator = memberCreator;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getDate() {
        return date;
    }

    public Data getData() {
        return data == null ? new Data(null) : data;
    }

    public TrelloMember getMemberCreator() {
        return memberCreator;
    }

    public static class Data {
        private String text;

        public Data() {
        }

        public Data(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }
}
