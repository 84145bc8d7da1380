package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.model.FileEntry;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.StoredFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IndexDiffer Tests")
class IndexDifferTest {

    private static final OwnerRef OWNER = OwnerRef.user("acct-1");

    private static FileEntry file(final String path, final long size) {
        final String name = path.substring(path.lastIndexOf('/') + 1);
        return new FileEntry(path, name, size, FilesystemScanner.contentTypeOf(name), false, 1000L);
    }

    private static FileEntry dir(final String path) {
        final String name = path.substring(path.lastIndexOf('/') + 1);
        return new FileEntry(path, name, 0L, "", true, 1000L);
    }

    private static StoredFile record(final OwnerRef owner, final FileEntry entry) {
        return StoredFile.fromEntry(owner, entry, 5L);
    }

    @Test
    @DisplayName("Empty inputs give an empty diff")
    void emptyInputs() {
        final IndexDiff diff = IndexDiffer.diff(OWNER, List.of(), List.of());

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.unchanged()).isZero();
    }

    @Test
    @DisplayName("Every path lands in exactly one of missing, stale, orphaned or unchanged")
    void classifiesEveryPath() {
        // Given
        final List<FileEntry> onDisk = List.of(file("same.txt", 10), file("new.txt", 5), file("grown.txt", 200));
        final List<StoredFile> inIndex = List.of(
                record(OWNER, file("same.txt", 10)),
                record(OWNER, file("grown.txt", 100)),
                record(OWNER, file("deleted.txt", 1)));

        // When
        final IndexDiff diff = IndexDiffer.diff(OWNER, onDisk, inIndex);

        // Then
        assertThat(diff.missing()).extracting(FileEntry::path).containsExactly("new.txt");
        assertThat(diff.stale()).singleElement().satisfies(stale -> {
            assertThat(stale.entry().size()).isEqualTo(200L);
            assertThat(stale.record().size()).isEqualTo(100L);
        });
        assertThat(diff.orphaned()).extracting(StoredFile::path).containsExactly("deleted.txt");
        assertThat(diff.unchanged()).isEqualTo(1);
    }

    @Test
    @DisplayName("Only the modification time differs: unchanged")
    void timestampDoesNotMatter() {
        final FileEntry onDisk = file("a.txt", 10);
        final StoredFile indexed = new StoredFile(OWNER, "a.txt", "a.txt", "", 10, onDisk.contentType(),
                false, 1L, 2L);

        final IndexDiff diff = IndexDiffer.diff(OWNER, List.of(onDisk), List.of(indexed));

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.unchanged()).isEqualTo(1);
    }

    @Test
    @DisplayName("Content type and kind changes make a record stale")
    void contentTypeAndKindAreCompared() {
        final StoredFile wrongType = new StoredFile(OWNER, "a.txt", "a.txt", "", 10, "application/octet-stream",
                false, 0L, 0L);
        final StoredFile wasFile = record(OWNER, file("folder", 0));

        final IndexDiff diff = IndexDiffer.diff(OWNER, List.of(file("a.txt", 10), dir("folder")),
                List.of(wrongType, wasFile));

        assertThat(diff.stale()).extracting(s -> s.entry().path()).containsExactly("a.txt", "folder");
    }

    @Test
    @DisplayName("Missing entries come parents first, orphans children first")
    void ordering() {
        final List<FileEntry> onDisk = List.of(file("x/y/deep.txt", 1), dir("x/y"), dir("x"));
        final List<StoredFile> inIndex = List.of(
                record(OWNER, dir("old")),
                record(OWNER, file("old/z/file.txt", 1)),
                record(OWNER, dir("old/z")));

        final IndexDiff diff = IndexDiffer.diff(OWNER, onDisk, inIndex);

        assertThat(diff.missing()).extracting(FileEntry::path).containsExactly("x", "x/y", "x/y/deep.txt");
        assertThat(diff.orphaned()).extracting(StoredFile::path).containsExactly("old/z/file.txt", "old/z", "old");
    }

    @Test
    @DisplayName("Records of another owner with the same path never match")
    void ownerIsPartOfTheKey() {
        final OwnerRef other = OwnerRef.organization(7);

        final IndexDiff diff = IndexDiffer.diff(OWNER, List.of(file("a.txt", 1)),
                List.of(record(other, file("a.txt", 1))));

        assertThat(diff.missing()).hasSize(1);
        assertThat(diff.orphaned()).extracting(StoredFile::owner).containsExactly(other);
    }
}
