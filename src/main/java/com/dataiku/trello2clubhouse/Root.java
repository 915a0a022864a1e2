package com.dataiku.trello2clubhouse;

import static com.dataiku.trello2clubhouse.LogConfigurator.configureLogger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import com.dataiku.trello2clubhouse.clubhouse.Clubhouse;
import com.dataiku.trello2clubhouse.clubhouse.ClubhouseImpl;
import com.dataiku.trello2clubhouse.clubhouse.Member;
import com.dataiku.trello2clubhouse.clubhouse.Project;
import com.dataiku.trello2clubhouse.clubhouse.WorkflowState;
import com.dataiku.trello2clubhouse.dropbox.DropboxImpl;
import com.dataiku.trello2clubhouse.trello.Trello;
import com.dataiku.trello2clubhouse.trello.TrelloImpl;
import com.dataiku.trello2clubhouse.trello.TrelloMember;
import com.google.common.base.Strings;
import com.google.common.io.Files;

/**
 * Migrates a Trello board into a Clubhouse project.
 *
 * <p>Usage: {@code Root [export|import|migrate]}, {@code migrate} being the default. Reads {@code credentials.json}
 * and {@code trello-migration.json} from the working directory and exits with status 1 when a card failed.
 */
public class Root {

    enum Mode {
        EXPORT,
        IMPORT,
        MIGRATE
    }

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse");

    public static void main(String[] args) throws IOException {
        configureLogger(logger);
        Mode mode;
        try {
            mode = args.length == 0 ? Mode.MIGRATE : Mode.valueOf(args[0].toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Usage: Root [export|import|migrate]");
            System.exit(2);
            return;
        }

        logger.info("Starting " + mode.name().toLowerCase(Locale.ROOT) + "...");
        Credentials credentials = loadJson("credentials.json", Credentials.class);
        MigrationParams params = loadJson("trello-migration.json", MigrationParams.class);
        boolean success = run(mode, credentials, params);
        logger.info("Done.");
        if (!success) {
            System.exit(1);
        }
    }

    static boolean run(Mode mode, Credentials credentials, MigrationParams params) throws IOException {
        CardStore store = new CardStore(new File(params.exportFile));
        Trello trello = Strings.isNullOrEmpty(credentials.trelloApiKey) ? null : new TrelloImpl(credentials.trelloApiKey, credentials.trelloToken);

        List<Card> cards;
        if (mode == Mode.IMPORT) {
            cards = store.read();
            logger.info("Read " + cards.size() + " cards from " + store.getFile());
        } else {
            params.validateExport();
            cards = export(trello, credentials, params);
            store.write(cards);
            logger.info("Wrote " + cards.size() + " cards to " + store.getFile());
        }

        if (mode == Mode.EXPORT) {
            return true;
        }
        params.validate();
        Clubhouse clubhouse = new ClubhouseImpl(credentials.clubhouseToken);
        ImportReport report = importCards(clubhouse, trello, params, cards);
        return !report.hasFailures();
    }

    private static List<Card> export(Trello trello, Credentials credentials, MigrationParams params) throws IOException {
        if (trello == null) {
            throw new IllegalArgumentException("Missing Trello credentials");
        }
        AttachmentRelocator relocator = null;
        if (params.processAttachments) {
            if (Strings.isNullOrEmpty(credentials.dropboxToken)) {
                throw new IllegalArgumentException("Missing Dropbox token, required to process attachments");
            }
            relocator = new AttachmentRelocator(trello, new DropboxImpl(credentials.dropboxToken), params.relocationSettings());
        }
        BoardExporter exporter = new BoardExporter(trello, new CardNormalizer(trello, relocator));
        return exporter.export(params.trelloBoard, params.trelloLists, params.threads);
    }

    private static ImportReport importCards(Clubhouse clubhouse, Trello trello, MigrationParams params, List<Card> cards) throws IOException {
        Project project = MigrationHelpers.getProject(clubhouse, params.clubhouseProject);
        WorkflowState state = MigrationHelpers.getStoryState(clubhouse, project, params.clubhouseWorkflowState);
        List<Member> members = clubhouse.listMembers();
        Member importMember = MigrationHelpers.getMember(members, params.importMember);

        List<TrelloMember> trelloMembers = new ArrayList<>();
        if (trello != null && !Strings.isNullOrEmpty(params.trelloBoard)) {
            trelloMembers = trello.getMembersByBoard(params.trelloBoard);
        } else {
            logger.warning("No Trello board to read members from, stories will be requested by " + params.importMember);
        }
        UserMap userMap = new TrelloUserMapping(members, params.usersMapping).buildUserMap(trelloMembers, importMember.id);

        ImportSettings settings = new ImportSettings(project, state, params.clubhouseStoryType, importMember.id, params.addCommentWithTrelloLink);
        return new StoryImporter(clubhouse, settings, userMap, System.out).importCards(cards);
    }

    private static <T> T loadJson(String fileName, Class<T> type) throws IOException {
        try (BufferedReader bufferedReader = Files.newReader(new File(fileName), StandardCharsets.UTF_8)) {
            T result = GsonHelper.GSON.fromJson(bufferedReader, type);
            if (result == null) {
                throw new IOException("Empty configuration file " + fileName);
            }
            return result;
        }
    }
}
