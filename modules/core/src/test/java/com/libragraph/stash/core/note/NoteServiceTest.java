package com.libragraph.stash.core.note;

import com.libragraph.stash.core.access.AccessDeniedException;
import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.core.dao.NoteRecord;
import com.libragraph.stash.core.dao.StoredObjectDao;
import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.core.storage.ObjectRejectedException;
import com.libragraph.stash.core.test.StashTestFixture;
import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.List;

import static com.libragraph.stash.core.test.StashTestFixture.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoteServiceTest {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    @TempDir
    Path root;

    private static NoteAttachment attachment(String name, String text) {
        return new NoteAttachment(name, new ByteArrayInputStream(utf8(text)));
    }

    private static NoteDraft draft(String title, String visibility, String content, List<String> tags,
                                   NoteAttachment... attachments) {
        return new NoteDraft(title, "subject", visibility, content, tags, List.of(attachments));
    }

    private List<StoredObjectRecord> objectsOf(StashTestFixture f, long noteId) {
        return f.jdbi.withHandle(h -> h.attach(StoredObjectDao.class).findByGroupingRef(noteId, ALICE));
    }

    private StoredObjectRecord contentOf(StashTestFixture f, long noteId) {
        return objectsOf(f, noteId).stream()
                .filter(o -> o.kind() == ObjectKind.CONTENT)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void shouldCreateNoteWithContentTagsAndAttachments() {
        var f = StashTestFixture.create(root);

        NoteView view = f.notes.create(ALICE, draft("Groceries", "public", "# Milk\n\n- eggs",
                List.of("  food ", "", "food", "x".repeat(80)),
                attachment("list.txt", "bread"))).await().indefinitely();

        assertThat(view.note().title()).isEqualTo("Groceries");
        assertThat(view.note().visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(view.tags()).containsExactly("food", "x".repeat(50));
        assertThat(view.contentObjectId()).isNotNull();
        assertThat(view.attachments()).singleElement()
                .satisfies(a -> {
                    assertThat(a.logicalName()).isEqualTo("list.txt");
                    assertThat(a.size()).isEqualTo(5L);
                });

        List<StoredObjectRecord> objects = objectsOf(f, view.note().id());
        assertThat(objects).extracting(StoredObjectRecord::kind)
                .containsExactlyInAnyOrder(ObjectKind.CONTENT, ObjectKind.ATTACHMENT);
        assertThat(objects).allSatisfy(o -> assertThat(o.visibility()).isEqualTo(Visibility.PUBLIC));
        assertThat(f.fileCount()).isEqualTo(2);
    }

    @Test
    void shouldReadContentThroughVerifiedReader() {
        var f = StashTestFixture.create(root);
        long id = f.notes.create(ALICE, draft("Café notes", null, "Crème brûlée ☕", List.of()))
                .await().indefinitely().note().id();

        assertThat(f.notes.readContent(id, ALICE).await().indefinitely()).isEqualTo("Crème brûlée ☕");
        assertThatThrownBy(() -> f.notes.readContent(id, BOB).await().indefinitely())
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void shouldRejectBlankTitle() {
        var f = StashTestFixture.create(root);
        assertThatThrownBy(() -> f.notes.create(ALICE, draft("  ", null, "x", List.of())).await().indefinitely())
                .isInstanceOf(ObjectRejectedException.class)
                .extracting(e -> ((ObjectRejectedException) e).reason())
                .isEqualTo(ObjectRejectedException.Reason.INVALID_INPUT);
        assertThat(f.fileCount()).isZero();
    }

    @Test
    void shouldRejectTitleAndSubjectWiderThanTheirColumns() {
        var f = StashTestFixture.create(root);
        String longTitle = "t".repeat(NoteService.MAX_TITLE + 1);
        String longSubject = "s".repeat(NoteService.MAX_SUBJECT + 1);

        assertThatThrownBy(() -> f.notes.create(ALICE, draft(longTitle, null, "x", List.of())).await().indefinitely())
                .extracting(e -> ((ObjectRejectedException) e).reason())
                .isEqualTo(ObjectRejectedException.Reason.INVALID_INPUT);
        assertThatThrownBy(() -> f.notes.create(ALICE,
                new NoteDraft("t", longSubject, null, "x", List.of(), List.of())).await().indefinitely())
                .extracting(e -> ((ObjectRejectedException) e).reason())
                .isEqualTo(ObjectRejectedException.Reason.INVALID_INPUT);
        assertThat(f.fileCount()).isZero();

        long id = f.notes.create(ALICE, draft("t", null, "x", List.of())).await().indefinitely().note().id();
        assertThatThrownBy(() -> f.notes.update(id, ALICE,
                new NoteUpdate(null, longSubject, null, null, null, null)).await().indefinitely())
                .isInstanceOf(ObjectRejectedException.class);
        assertThat(f.notes.get(id, ALICE).await().indefinitely().note().subject()).isEqualTo("subject");

        String widest = "t".repeat(NoteService.MAX_TITLE);
        NoteView wide = f.notes.create(ALICE, draft(widest, null, "x", List.of())).await().indefinitely();
        assertThat(contentOf(f, wide.note().id()).logicalName()).isEqualTo(widest + ".md");
    }

    @Test
    void shouldNameBodyAfterTitleAndFollowRenames() throws Exception {
        var f = StashTestFixture.create(root);
        long id = f.notes.create(ALICE, draft("Recipes", "public", "# soup", List.of()))
                .await().indefinitely().note().id();
        assertThat(contentOf(f, id).logicalName()).isEqualTo("Recipes.md");

        f.notes.update(id, ALICE, new NoteUpdate("Dinner", null, null, null, null, null)).await().indefinitely();

        StoredObjectRecord body = contentOf(f, id);
        assertThat(body.logicalName()).isEqualTo("Dinner.md");
        assertThat(f.notes.readContent(id, BOB).await().indefinitely()).isEqualTo("# soup");
        try (var download = f.objects.download(body.id(), BOB).await().indefinitely()) {
            assertThat(download.headers()).containsEntry("Content-Disposition", "attachment; filename=\"Dinner.md\"");
        }

        f.notes.update(id, ALICE, new NoteUpdate("Supper", null, null, "# stew", null, null)).await().indefinitely();
        assertThat(contentOf(f, id).logicalName()).isEqualTo("Supper.md");
        assertThat(f.fileCount()).isEqualTo(1);
    }

    @Test
    void shouldRemoveEveryWrittenFileWhenAnAttachmentIsRejected() {
        var f = StashTestFixture.create(root);
        NoteAttachment binary = new NoteAttachment("blob.txt", new ByteArrayInputStream(new byte[]{0, 1, 2, 3}));

        assertThatThrownBy(() -> f.notes.create(ALICE, draft("t", null, "body", List.of(),
                attachment("ok.txt", "fine"), binary)).await().indefinitely())
                .isInstanceOf(ObjectRejectedException.class);
        assertThat(f.fileCount()).isZero();
        assertThat(f.notes.list(ALICE, null, 10, 0).collect().asList().await().indefinitely()).isEmpty();
    }

    @Test
    void shouldRejectDisallowedAttachmentExtensionUpFront() {
        var f = StashTestFixture.create(root);
        assertThatThrownBy(() -> f.notes.create(ALICE, draft("t", null, "body", List.of(),
                attachment("virus.exe", "MZ"))).await().indefinitely())
                .isInstanceOf(ObjectRejectedException.class)
                .extracting(e -> ((ObjectRejectedException) e).reason())
                .isEqualTo(ObjectRejectedException.Reason.EXTENSION_NOT_ALLOWED);
        assertThat(f.fileCount()).isZero();
    }

    @Test
    void shouldApplyQuotaAcrossAllNoteObjects() {
        var f = StashTestFixture.create(StashSettings.defaults(root).withMaxOwnerBytes(10));
        assertThatThrownBy(() -> f.notes.create(ALICE, draft("t", null, "123456", List.of(),
                attachment("a.txt", "12345"))).await().indefinitely())
                .extracting(e -> ((ObjectRejectedException) e).reason())
                .isEqualTo(ObjectRejectedException.Reason.QUOTA_EXCEEDED);
        assertThat(f.fileCount()).isZero();
    }

    @Test
    void shouldHidePrivateNotesFromOthers() {
        var f = StashTestFixture.create(root);
        long priv = f.notes.create(ALICE, draft("mine", "private", "x", List.of())).await().indefinitely().note().id();
        long pub = f.notes.create(ALICE, draft("ours", "public", "y", List.of())).await().indefinitely().note().id();

        assertThatThrownBy(() -> f.notes.get(priv, BOB).await().indefinitely())
                .isInstanceOf(AccessDeniedException.class);
        assertThat(f.notes.get(pub, BOB).await().indefinitely().note().title()).isEqualTo("ours");
        assertThat(f.notes.get(priv, ALICE).await().indefinitely().note().title()).isEqualTo("mine");
        assertThatThrownBy(() -> f.notes.get(999L, ALICE).await().indefinitely())
                .isInstanceOf(NoteNotFoundException.class);
    }

    @Test
    void shouldReplaceContentAndRemoveOldFile() {
        var f = StashTestFixture.create(root);
        NoteView created = f.notes.create(ALICE, draft("t", null, "first", List.of("a"))).await().indefinitely();
        long id = created.note().id();

        NoteView updated = f.notes.update(id, ALICE, new NoteUpdate("renamed", null, "public", "second",
                List.of("b", "c"), List.of(attachment("more.md", "# more")))).await().indefinitely();

        assertThat(updated.note().title()).isEqualTo("renamed");
        assertThat(updated.note().subject()).isEqualTo("subject");
        assertThat(updated.note().visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(updated.tags()).containsExactly("b", "c");
        assertThat(updated.contentObjectId()).isNotEqualTo(created.contentObjectId());
        assertThat(updated.attachments()).extracting(NoteView.AttachmentSummary::logicalName)
                .containsExactly("more.md");
        assertThat(f.notes.readContent(id, BOB).await().indefinitely()).isEqualTo("second");
        assertThat(objectsOf(f, id)).allSatisfy(o -> assertThat(o.visibility()).isEqualTo(Visibility.PUBLIC));
        assertThat(f.fileCount()).isEqualTo(2);
    }

    @Test
    void shouldKeepUntouchedFieldsOnPartialUpdate() {
        var f = StashTestFixture.create(root);
        long id = f.notes.create(ALICE, draft("t", "unlisted", "body", List.of("keep")))
                .await().indefinitely().note().id();

        NoteView updated = f.notes.update(id, ALICE, new NoteUpdate(null, "new subject", null, null, null, null))
                .await().indefinitely();

        assertThat(updated.note().title()).isEqualTo("t");
        assertThat(updated.note().subject()).isEqualTo("new subject");
        assertThat(updated.note().visibility()).isEqualTo(Visibility.UNLISTED);
        assertThat(updated.tags()).containsExactly("keep");
        assertThat(f.notes.readContent(id, ALICE).await().indefinitely()).isEqualTo("body");
    }

    @Test
    void shouldOnlyLetOwnerUpdateOrDelete() {
        var f = StashTestFixture.create(root);
        long id = f.notes.create(ALICE, draft("t", "public", "body", List.of())).await().indefinitely().note().id();

        assertThatThrownBy(() -> f.notes.update(id, BOB, NoteUpdate.content("hijacked")).await().indefinitely())
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> f.notes.delete(id, BOB).await().indefinitely())
                .isInstanceOf(AccessDeniedException.class);
        assertThat(f.notes.readContent(id, ALICE).await().indefinitely()).isEqualTo("body");
    }

    @Test
    void shouldDeleteNoteWithItsObjectsAndFiles() {
        var f = StashTestFixture.create(root);
        long id = f.notes.create(ALICE, draft("t", null, "body", List.of("x"),
                attachment("a.txt", "a"), attachment("b.txt", "b"))).await().indefinitely().note().id();
        assertThat(f.fileCount()).isEqualTo(3);

        f.notes.delete(id, ALICE).await().indefinitely();

        assertThat(f.fileCount()).isZero();
        assertThat(objectsOf(f, id)).isEmpty();
        assertThatThrownBy(() -> f.notes.get(id, ALICE).await().indefinitely())
                .isInstanceOf(NoteNotFoundException.class);
    }

    @Test
    void shouldListOwnerNotesWithVisibilityFilterAndPaging() {
        var f = StashTestFixture.create(root);
        for (int i = 0; i < 5; i++) {
            f.notes.create(ALICE, draft("n" + i, i % 2 == 0 ? "public" : "private", "", List.of()))
                    .await().indefinitely();
        }
        f.notes.create(BOB, draft("bob", "public", "", List.of())).await().indefinitely();

        assertThat(f.notes.list(ALICE, null, 10, 0).collect().asList().await().indefinitely()).hasSize(5);
        assertThat(f.notes.list(ALICE, Visibility.PUBLIC, 10, 0).collect().asList().await().indefinitely())
                .extracting(NoteRecord::title)
                .containsExactlyInAnyOrder("n0", "n2", "n4");
        assertThat(f.notes.list(ALICE, null, 2, 4).collect().asList().await().indefinitely()).hasSize(1);
    }

    @Test
    void shouldSearchPublicNotesByTitleOrTag() {
        var f = StashTestFixture.create(root);
        f.notes.create(ALICE, draft("Java Streams", "public", "", List.of("programming"))).await().indefinitely();
        f.notes.create(ALICE, draft("Soup", "public", "", List.of("JAVA-island"))).await().indefinitely();
        f.notes.create(ALICE, draft("Secret java", "private", "", List.of())).await().indefinitely();
        f.notes.create(BOB, draft("100% done", "public", "", List.of())).await().indefinitely();

        assertThat(f.notes.searchPublic("java", 10, 0).collect().asList().await().indefinitely())
                .extracting(NoteRecord::title)
                .containsExactlyInAnyOrder("Java Streams", "Soup");
        assertThat(f.notes.searchPublic("%", 10, 0).collect().asList().await().indefinitely())
                .extracting(NoteRecord::title)
                .containsExactly("100% done");
        assertThat(f.notes.searchPublic("   ", 10, 0).collect().asList().await().indefinitely()).isEmpty();
    }

    @Test
    void shouldNormalizeTags() {
        assertThat(NoteTags.normalize(null)).isEmpty();
        assertThat(NoteTags.normalize(java.util.Arrays.asList(" a ", null, "", "a", "b")))
                .containsExactly("a", "b");
        assertThat(NoteTags.normalize(List.of("y".repeat(49) + " z"))).containsExactly("y".repeat(49));
    }
}
