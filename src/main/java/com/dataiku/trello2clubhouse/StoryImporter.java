package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.dataiku.trello2clubhouse.clubhouse.Clubhouse;
import com.dataiku.trello2clubhouse.clubhouse.CreateCommentParams;
import com.dataiku.trello2clubhouse.clubhouse.CreateLabelParams;
import com.dataiku.trello2clubhouse.clubhouse.CreateLinkedFileParams;
import com.dataiku.trello2clubhouse.clubhouse.CreateStoryParams;
import com.dataiku.trello2clubhouse.clubhouse.CreateTaskParams;
import com.dataiku.trello2clubhouse.clubhouse.LinkedFile;
import com.dataiku.trello2clubhouse.clubhouse.Story;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

/**
 * Creates one Clubhouse story per card.
 *
 * <p>Stories of the project carrying the same name as a card are deleted first so that running the import again
 * replaces the stories of the previous run. A card that cannot be imported is reported and the next card is processed.
 * The duplicate check and the creation hold a lock per Clubhouse project.
 */
public class StoryImporter {

    public static final String OUTPUT_FORMAT = "%-40s %-17s %s%n";

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.importer");
    private static final ConcurrentMap<Long, Object> PROJECT_LOCKS = new ConcurrentHashMap<>();

    private final Clubhouse clubhouse;
    private final ImportSettings settings;
    private final UserMap userMap;
    private final PrintStream out;
    private final Clock clock;

    public StoryImporter(Clubhouse clubhouse, ImportSettings settings, UserMap userMap, PrintStream out) {
        this(clubhouse, settings, userMap, out, Clock.systemUTC());
    }

    public StoryImporter(Clubhouse clubhouse, ImportSettings settings, UserMap userMap, PrintStream out, Clock clock) {
        this.clubhouse = clubhouse;
        this.settings = settings;
        this.userMap = userMap;
        this.out = out;
        this.clock = clock;
    }

    public ImportReport importCards(List<Card> cards) {
        logger.info("Importing " + cards.size() + " Trello cards into Clubhouse project " + settings.getProject().name + "...");
        out.printf(OUTPUT_FORMAT + "%n", "Trello Card Link", "Import Status", "Error/Story ID");

        ImportReport report = new ImportReport();
        synchronized (PROJECT_LOCKS.computeIfAbsent(settings.getProject().id, id -> new Object())) {
            ExistingStories existingStories = listExistingStories();
            for (Card card : cards) {
                ImportResult result = importCard(card, existingStories);
                out.print(result.statusLine());
                report.add(result);
            }
        }
        logger.info(report.summary());
        return report;
    }

    private ExistingStories listExistingStories() {
        try {
            return new ExistingStories(clubhouse.listStories(settings.getProject().id));
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Cannot list the stories of project " + settings.getProject().name + ", existing stories will not be replaced", e);
            return new ExistingStories(new ArrayList<>());
        }
    }

    private ImportResult importCard(Card card, ExistingStories existingStories) {
        ImportResult result = new ImportResult(card);
        result.moveTo(ImportState.DUPLICATE_CHECK);
        deleteMatchingStories(card, existingStories, result);
        result.moveTo(result.getDeletedStoryIds().isEmpty() ? ImportState.NO_MATCH : ImportState.DELETED);

        try {
            CreateStoryParams params = buildStory(card, createLinkedFiles(card));
            result.moveTo(ImportState.SUBMITTED);
            Story story = clubhouse.createStory(params);
            if (story == null) {
                throw new IOException("Clubhouse returned no story");
            }
            existingStories.created(story);
            result.succeeded(story.id);
            logger.fine(() -> "Imported card " + card + " as story " + story.id);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to import card " + card, e);
            result.failed(e);
        }
        return result;
    }

    private void deleteMatchingStories(Card card, ExistingStories existingStories, ImportResult result) {
        Iterator<Story> it = existingStories.stories.iterator();
        while (it.hasNext()) {
            Story story = it.next();
            if (card.name == null || !card.name.equals(story.name)) {
                continue;
            }
            if (existingStories.createdByThisRun.contains(story.id)) {
                logger.warning("Story " + story.id + " imported earlier in this run has the same name as card " + card + ", keeping both");
                continue;
            }
            try {
                clubhouse.deleteStory(story.id);
                it.remove();
                result.deleted(story.id);
                logger.info("Deleted story " + story.id + " matching card " + card);
            } catch (IOException | RuntimeException e) {
                logger.log(Level.WARNING, "Failed to delete story " + story.id + " matching card " + card, e);
            }
        }
    }

    private List<Long> createLinkedFiles(Card card) {
        List<Long> ids = new ArrayList<>();
        for (Map.Entry<String, String> attachment : card.attachments.entrySet()) {
            CreateLinkedFileParams params = new CreateLinkedFileParams();
            params.name = attachment.getKey();
            params.type = CreateLinkedFileParams.TYPE_DROPBOX;
            params.url = attachment.getValue();
            params.uploader_id = settings.getImportMemberId();
            try {
                LinkedFile linkedFile = clubhouse.createLinkedFile(params);
                ids.add(linkedFile.id);
            } catch (IOException | RuntimeException e) {
                logger.log(Level.WARNING, "Failed to create linked file for card " + card + ", Dropbox link: " + attachment.getValue(), e);
            }
        }
        return ids;
    }

    @VisibleForTesting
    CreateStoryParams buildStory(Card card, List<Long> linkedFileIds) {
        CreateStoryParams params = new CreateStoryParams();
        params.project_id = settings.getProject().id;
        params.workflow_state_id = settings.getWorkflowState().id;
        params.story_type = settings.getStoryType();
        params.requested_by_id = Optional.ofNullable(userMap.getClubhouseId(card.creatorId)).orElse(settings.getImportMemberId());
        params.owner_ids = mapOwners(card);

        params.name = card.name;
        params.description = Strings.nullToEmpty(card.description);
        params.deadline = card.dueDate;
        params.created_at = card.createdAt;
        params.external_id = card.sourceUrl;

        for (String label : card.labels) {
            params.labels.add(new CreateLabelParams(label));
        }
        for (Task task : card.tasks) {
            params.tasks.add(new CreateTaskParams(task.completed, task.description));
        }
        params.comments = buildComments(card);
        params.linked_file_ids = linkedFileIds;
        return params;
    }

    private List<UUID> mapOwners(Card card) {
        Set<UUID> owners = new LinkedHashSet<>();
        for (String owner : card.ownerIds) {
            Optional<UUID> clubhouseId = userMap.lookup(owner);
            if (clubhouseId.isPresent()) {
                owners.add(clubhouseId.get());
            } else {
                logger.fine(() -> "No Clubhouse member for Trello member " + owner + ", dropped from the owners of " + card);
            }
        }
        return new ArrayList<>(owners);
    }

    private List<CreateCommentParams> buildComments(Card card) {
        List<CreateCommentParams> comments = new ArrayList<>();
        for (Comment comment : card.comments) {
            CreateCommentParams createComment = new CreateCommentParams();
            createComment.created_at = comment.createdAt;
            createComment.author_id = userMap.lookup(comment.authorSourceId).orElse(null);
            String text = comment.text;
            if (createComment.author_id == null && !Strings.isNullOrEmpty(comment.authorDisplayName)) {
                text = "**" + comment.authorDisplayName + ":** " + text;
            }
            createComment.text = text;
            comments.add(createComment);
        }

        if (settings.isAddCommentWithTrelloLink()) {
            CreateCommentParams linkComment = new CreateCommentParams();
            linkComment.created_at = Instant.now(clock);
            linkComment.text = "Card imported from Trello: " + card.sourceUrl;
            comments.add(linkComment);
        }
        return comments;
    }

    /**
     * Stories of the project listed once per run, kept in step with what the run deletes and creates.
     */
    private static class ExistingStories {
        private final List<Story> stories;
        private final Set<Long> createdByThisRun = new HashSet<>();

        ExistingStories(List<Story> stories) {
            this.stories = new ArrayList<>(stories);
        }

        void created(Story story) {
            stories.add(story);
            createdByThisRun.add(story.id);
        }
    }
}
