package com.dataiku.trello2clubhouse.trello;

import java.io.IOException;
import java.util.List;

/**
 * Read access to a Trello board.
 */
public interface Trello {

    List<TrelloCard> getCardsByBoard(String boardId) throws IOException;

    List<TrelloList> getListsByBoard(String boardId) throws IOException;

    List<TrelloMember> getMembersByBoard(String boardId) throws IOException;

    /**
     * Creation and comment actions of a card, most recent first as Trello returns them.
     */
    List<TrelloAction> getActionsByCard(String cardId) throws IOException;

    List<TrelloChecklist> getChecklistByCard(String cardId) throws IOException;

    List<TrelloCard.Attachment> getAttachmentsByCard(String cardId) throws IOException;

    byte[] downloadAttachment(TrelloCard.Attachment attachment) throws IOException;
}
