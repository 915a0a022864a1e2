package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.dataiku.trello2clubhouse.trello.Trello;
import com.dataiku.trello2clubhouse.trello.TrelloAction;
import com.dataiku.trello2clubhouse.trello.TrelloCard;
import com.dataiku.trello2clubhouse.trello.TrelloChecklist;
import com.dataiku.trello2clubhouse.trello.TrelloMember;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

/**
 * Builds a {@link Card} out of a Trello card, its action history, checklists and attachments.
 *
 * <p>Never fails on a single card: a sub resource that cannot be fetched is logged and left empty, a date that
 * cannot be parsed is left absent.
 */
public class CardNormalizer {

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.normalizer");
    private static final DateTimeFormatter TRELLO_DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Comparator<Double> BY_POSITION = Comparator.nullsLast(Comparator.naturalOrder());

    private final Trello trello;
    private final AttachmentRelocator relocator;

    /**
     * @param relocator {@code null} to leave attachments out
     */
    public CardNormalizer(Trello trello, AttachmentRelocator relocator) {
        this.trello = trello;
        this.relocator = relocator;
    }

    public Card normalize(TrelloCard trelloCard) {
        Card card = new Card();
        card.name = trelloCard.getName();
        card.description = Strings.nullToEmpty(trelloCard.getDesc());
        card.labels = flattenLabels(trelloCard);
        card.dueDate = parseDateOrNull(trelloCard.getDue());
        card.ownerIds = new LinkedHashSet<>(trelloCard.getIdMembers());
        card.position = trelloCard.getPos();
        card.sourceUrl = trelloCard.getShortUrl();

        CardHistory history = CardHistory.fold(fetchActions(trelloCard));
        card.creatorId = history.creatorId;
        card.createdAt = history.createdAt;
        card.comments = history.comments;
        if (history.creationEvents == 0) {
            logger.fine(() -> "No creation event for card " + trelloCard.getName() + ", creator left empty");
        }

        card.tasks = flattenChecklists(fetchChecklists(trelloCard));

        if (relocator != null) {
            RelocationResult relocation = relocator.relocate(trelloCard, fetchAttachments(trelloCard));
            card.attachments.putAll(relocation.getSharedLinks());
        }
        return card;
    }

    private List<TrelloAction> fetchActions(TrelloCard card) {
        try {
            return trello.getActionsByCard(card.getId());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Error querying the actions of card " + card.getName() + ", ignoring...", e);
            return new ArrayList<>();
        }
    }

    private List<TrelloChecklist> fetchChecklists(TrelloCard card) {
        try {
            return trello.getChecklistByCard(card.getId());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Error querying the checklists of card " + card.getName() + ", ignoring...", e);
            return new ArrayList<>();
        }
    }

    private List<TrelloCard.Attachment> fetchAttachments(TrelloCard card) {
        try {
            return trello.getAttachmentsByCard(card.getId());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Error querying the attachments of card " + card.getName() + ", ignoring...", e);
            return new ArrayList<>();
        }
    }

    @VisibleForTesting
    static List<String> flattenLabels(TrelloCard card) {
        List<String> labels = new ArrayList<>();
        for (TrelloCard.Label label : card.getLabels()) {
            labels.add(label.getName());
        }
        return labels;
    }

    @VisibleForTesting
    static List<Task> flattenChecklists(List<TrelloChecklist> checklists) {
        List<TrelloChecklist> sortedChecklists = new ArrayList<>(checklists);
        sortedChecklists.sort(Comparator.comparing(TrelloChecklist::getPos, BY_POSITION));

        List<Task> tasks = new ArrayList<>();
        for (TrelloChecklist checklist : sortedChecklists) {
            checklist.getCheckItems().stream()
                    .sorted(Comparator.comparing(TrelloChecklist.CheckItem::getPos, BY_POSITION))
                    .forEachOrdered(item -> tasks.add(Task.fromChecklistItem(checklist.getName(), item.getName(),
                            TrelloChecklist.CheckItem.STATE_COMPLETE.equals(item.getState()))));
        }
        return tasks;
    }

    @VisibleForTesting
    static Instant parseDateOrNull(String date) {
        if (Strings.isNullOrEmpty(date)) {
            return null;
        }
        try {
            return LocalDateTime.parse(date, TRELLO_DATE_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.fine(() -> "Ignoring unparseable date " + date);
            return null;
        }
    }

    /**
     * Creator and comments found in an action history. The last creation event wins.
     */
    @VisibleForTesting
    static class CardHistory {
        String creatorId;
        Instant createdAt;
        int creationEvents;
        final List<Comment> comments = new ArrayList<>();

        static CardHistory fold(List<TrelloAction> actions) {
            CardHistory history = new CardHistory();
            for (TrelloAction action : actions) {
                history.accept(action);
            }
            return history;
        }

        private void accept(TrelloAction action) {
            TrelloMember author = action.getMemberCreator();
            if (TrelloAction.COMMENT_CARD.equals(action.getType())) {
                String text = action.getData().getText();
                // Edited comments may come back empty
                if (!Strings.isNullOrEmpty(text)) {
                    comments.add(new Comment(text,
                            author == null ? null : author.getId(),
                            author == null ? null : author.getFullName(),
                            parseDateOrNull(action.getDate())));
                }
            } else if (TrelloAction.CREATE_CARD.equals(action.getType())) {
                creationEvents++;
                creatorId = author == null ? null : author.getId();
                createdAt = parseDateOrNull(action.getDate());
            }
        }
    }
}
