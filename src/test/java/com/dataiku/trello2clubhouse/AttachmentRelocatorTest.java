package com.dataiku.trello2clubhouse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.dataiku.trello2clubhouse.dropbox.SharedLink;
import com.dataiku.trello2clubhouse.dropbox.UploadInput;
import com.dataiku.trello2clubhouse.trello.TrelloCard;

public class AttachmentRelocatorTest {

    private static final TrelloCard CARD = new TrelloCard("card1", "list1", "Fix login bug");

    private FakeTrello trello;
    private FakeDropbox dropbox;
    private AttachmentRelocator relocator;

    @BeforeEach
    void setUp() {
        trello = new FakeTrello();
        dropbox = new FakeDropbox();
        relocator = new AttachmentRelocator(trello, dropbox, new RelocationSettings("/trello", ZoneId.of("America/Boise")),
                Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldSanitizeFileNames() {
        assertEquals("My_File_1.png", AttachmentRelocator.sanitizeFileName("My File #1.png"));
        assertEquals("already_safe.v2.tar", AttachmentRelocator.sanitizeFileName("already_safe.v2.tar"));
        assertEquals("r_sum_.pdf", AttachmentRelocator.sanitizeFileName("résumé.pdf"));
        assertEquals("a_b", AttachmentRelocator.sanitizeFileName("a / - b"));
        assertEquals("attachment", AttachmentRelocator.sanitizeFileName(null));
    }

    @Test
    void shouldUploadOnDeterministicPath() {
        RelocationResult result = relocator.relocate(CARD, Arrays.asList(
                attachment("a1", "My File #1.png"),
                attachment("a2", "notes.txt")));

        assertFalse(result.hasFailures());
        assertEquals(Arrays.asList("/trello/list1/card1/0_My_File_1.png", "/trello/list1/card1/1_notes.txt"), new ArrayList<>(dropbox.files.keySet()));
        assertEquals("/trello/list1/card1/3_x.png", relocator.storagePath(CARD, 3, "x.png"));
    }

    @Test
    void shouldOverwriteWithClientModifiedDate() {
        relocator.relocate(CARD, Collections.singletonList(attachment("a1", "logs.txt")));

        UploadInput upload = dropbox.uploads.get(0);
        assertEquals(UploadInput.MODE_OVERWRITE, upload.mode);
        assertFalse(upload.autorename);
        assertTrue(upload.mute);
        assertEquals("2024-03-05T07:07:09Z", upload.clientModified);
    }

    @Test
    void shouldReuseSharedLinkOnSecondRun() {
        List<TrelloCard.Attachment> attachments = Arrays.asList(attachment("a1", "design.pdf"), attachment("a2", "mockup.png"));

        RelocationResult first = relocator.relocate(CARD, attachments);
        RelocationResult second = relocator.relocate(CARD, attachments);

        assertEquals(first.getSharedLinks(), second.getSharedLinks());
        assertEquals(2, dropbox.createdLinks);
        assertEquals(2, dropbox.files.size());
    }

    @Test
    void shouldReuseExistingSharedLink() {
        List<SharedLink> existing = new ArrayList<>();
        existing.add(new SharedLink("https://www.dropbox.com/s/existing/design.pdf?dl=0", "/trello/list1/card1/0_design.pdf", null));
        dropbox.links.put("/trello/list1/card1/0_design.pdf", existing);

        RelocationResult result = relocator.relocate(CARD, Collections.singletonList(attachment("a1", "design.pdf")));

        assertEquals("https://www.dropbox.com/s/existing/design.pdf?dl=0", result.getSharedLinks().get("design.pdf"));
        assertEquals(0, dropbox.createdLinks);
    }

    @Test
    void shouldCreateLinkWhenListingFails() {
        dropbox.failListing = true;

        RelocationResult result = relocator.relocate(CARD, Collections.singletonList(attachment("a1", "design.pdf")));

        assertEquals(1, result.getSharedLinks().size());
        assertEquals(1, dropbox.createdLinks);
    }

    @Test
    void shouldSkipAttachmentThatCannotBeDownloaded() {
        TrelloCard.Attachment broken = attachment("a1", "broken.png");
        trello.failingDownloads.add(broken.getUrl());

        RelocationResult result = relocator.relocate(CARD, Arrays.asList(broken, attachment("a2", "fine.png")));

        assertEquals(Collections.singletonList("fine.png"), new ArrayList<>(result.getSharedLinks().keySet()));
        assertEquals(1, result.getFailures().size());
        assertEquals(AttachmentFailure.Stage.DOWNLOAD, result.getFailures().get(0).getStage());
        assertEquals("broken.png", result.getFailures().get(0).getAttachmentName());
        assertEquals(Collections.singletonList("/trello/list1/card1/1_fine.png"), new ArrayList<>(dropbox.files.keySet()));
    }

    @Test
    void shouldSkipAttachmentThatCannotBeUploaded() {
        dropbox.failingUploads.add("/trello/list1/card1/0_big.iso");

        RelocationResult result = relocator.relocate(CARD, Arrays.asList(attachment("a1", "big.iso"), attachment("a2", "small.txt")));

        assertEquals(Collections.singletonList("small.txt"), new ArrayList<>(result.getSharedLinks().keySet()));
        assertEquals(AttachmentFailure.Stage.UPLOAD, result.getFailures().get(0).getStage());
    }

    @Test
    void shouldOmitAttachmentThatCannotBeShared() {
        dropbox.failingShares.add("/trello/list1/card1/0_secret.txt");

        RelocationResult result = relocator.relocate(CARD, Arrays.asList(attachment("a1", "secret.txt"), attachment("a2", "public.txt")));

        assertEquals(Collections.singletonList("public.txt"), new ArrayList<>(result.getSharedLinks().keySet()));
        assertEquals(AttachmentFailure.Stage.SHARE, result.getFailures().get(0).getStage());
        assertTrue(dropbox.files.containsKey("/trello/list1/card1/0_secret.txt"));
    }

    private static TrelloCard.Attachment attachment(String id, String name) {
        return new TrelloCard.Attachment(id, name, "https://trello.com/1/cards/card1/attachments/" + id + "/download");
    }
}
