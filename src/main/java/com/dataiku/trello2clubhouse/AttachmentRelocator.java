package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.dataiku.trello2clubhouse.dropbox.Dropbox;
import com.dataiku.trello2clubhouse.dropbox.FileMetadata;
import com.dataiku.trello2clubhouse.dropbox.SharedLink;
import com.dataiku.trello2clubhouse.dropbox.UploadInput;
import com.dataiku.trello2clubhouse.trello.Trello;
import com.dataiku.trello2clubhouse.trello.TrelloCard;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

/**
 * Copies Trello attachments to Dropbox and shares them.
 *
 * <p>Files land on {@code <folder>/<list id>/<card id>/<index>_<name>} and are overwritten by later runs. An existing
 * shared link on that path is reused instead of creating a new one. A failing attachment is reported in the
 * {@link RelocationResult} and skipped, the other attachments of the card are still processed.
 */
public class AttachmentRelocator {

    public static final String DEFAULT_FOLDER = "/trello";

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.relocator");
    private static final Pattern UNSAFE_FILE_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9_.]+");
    private static final DateTimeFormatter CLIENT_MODIFIED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final Trello trello;
    private final Dropbox dropbox;
    private final RelocationSettings settings;
    private final Clock clock;

    public AttachmentRelocator(Trello trello, Dropbox dropbox, RelocationSettings settings) {
        this(trello, dropbox, settings, Clock.systemUTC());
    }

    public AttachmentRelocator(Trello trello, Dropbox dropbox, RelocationSettings settings, Clock clock) {
        this.trello = trello;
        this.dropbox = dropbox;
        this.settings = settings;
        this.clock = clock;
    }

    public RelocationResult relocate(TrelloCard card, List<TrelloCard.Attachment> attachments) {
        RelocationResult result = new RelocationResult();
        for (int i = 0; i < attachments.size(); i++) {
            TrelloCard.Attachment attachment = attachments.get(i);
            String name = sanitizeFileName(attachment.getName());
            String path = storagePath(card, i, name);

            byte[] content;
            try {
                content = trello.downloadAttachment(attachment);
            } catch (IOException | RuntimeException e) {
                fail(result, card, new AttachmentFailure(name, AttachmentFailure.Stage.DOWNLOAD, e));
                continue;
            }

            FileMetadata uploaded;
            try {
                uploaded = dropbox.upload(uploadInput(path, content));
            } catch (IOException | RuntimeException e) {
                fail(result, card, new AttachmentFailure(name, AttachmentFailure.Stage.UPLOAD, e));
                continue;
            }

            String uploadedPath = uploaded == null || uploaded.pathDisplay == null ? path : uploaded.pathDisplay;
            try {
                SharedLink link = resolveSharedLink(uploadedPath);
                if (result.getSharedLinks().containsKey(name)) {
                    logger.warning("Attachment name " + name + " used twice on card " + card.getName() + ", keeping the last one");
                }
                result.addSharedLink(name, link.url);
            } catch (IOException | RuntimeException e) {
                fail(result, card, new AttachmentFailure(name, AttachmentFailure.Stage.SHARE, e));
            }
        }
        return result;
    }

    private UploadInput uploadInput(String path, byte[] content) {
        UploadInput input = new UploadInput(path, content);
        input.mode = UploadInput.MODE_OVERWRITE;
        input.autorename = false;
        input.mute = true;
        input.clientModified = CLIENT_MODIFIED_FORMAT.format(ZonedDateTime.now(clock.withZone(settings.getClientModifiedZone())));
        return input;
    }

    private SharedLink resolveSharedLink(String path) throws IOException {
        try {
            List<SharedLink> links = dropbox.listSharedLinks(path);
            if (!links.isEmpty()) {
                logger.fine(() -> "Reusing shared link of " + path);
                return links.get(0);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot list shared links of " + path + ", creating a new one", e);
        }
        return dropbox.createSharedLink(path);
    }

    private static void fail(RelocationResult result, TrelloCard card, AttachmentFailure failure) {
        logger.log(Level.WARNING, "Skipping attachment of card " + card.getName() + ": " + failure, failure.getCause());
        result.addFailure(failure);
    }

    @VisibleForTesting
    String storagePath(TrelloCard card, int index, String safeName) {
        return settings.getFolder() + "/" + card.getIdList() + "/" + card.getId() + "/" + index + "_" + safeName;
    }

    @VisibleForTesting
    static String sanitizeFileName(String name) {
        if (Strings.isNullOrEmpty(name)) {
            return "attachment";
        }
        return UNSAFE_FILE_NAME_CHARS.matcher(name).replaceAll("_");
    }
}
