package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.model.FileEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilesystemScanner Tests")
class FilesystemScannerTest {

    @TempDir
    Path root;

    private final FilesystemScanner scanner = new FilesystemScanner();
    private final List<IndexSyncError> errors = new ArrayList<>();

    private List<FileEntry> scanAll(final Path dir) {
        try (final Stream<FileEntry> entries = scanner.scan(dir, errors::add, new CancellationToken())) {
            return entries.toList();
        }
    }

    @Test
    @DisplayName("Directories come before their children, siblings in name order")
    void depthFirstOrder() throws IOException {
        Files.createDirectories(root.resolve("b/c"));
        Files.write(root.resolve("b/c/d.txt"), new byte[3]);
        Files.write(root.resolve("a.txt"), new byte[7]);
        Files.write(root.resolve("b/e.pdf"), new byte[1]);

        final List<FileEntry> entries = scanAll(root);

        assertThat(entries).extracting(FileEntry::path)
                .containsExactly("a.txt", "b", "b/c", "b/c/d.txt", "b/e.pdf");
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Entries carry size, content type, kind and parent path")
    void entryMetadata() throws IOException {
        Files.createDirectories(root.resolve("docs"));
        Files.write(root.resolve("docs/report.pdf"), new byte[42]);
        Files.write(root.resolve("docs/data.unknownext"), new byte[2]);

        final List<FileEntry> entries = scanAll(root);

        assertThat(entries).filteredOn(FileEntry::directory).singleElement().satisfies(dir -> {
            assertThat(dir.path()).isEqualTo("docs");
            assertThat(dir.size()).isZero();
            assertThat(dir.contentType()).isEmpty();
            assertThat(dir.parentPath()).isEmpty();
        });
        assertThat(entries).filteredOn(e -> e.name().equals("report.pdf")).singleElement().satisfies(pdf -> {
            assertThat(pdf.size()).isEqualTo(42L);
            assertThat(pdf.contentType()).isEqualTo("application/pdf");
            assertThat(pdf.parentPath()).isEqualTo("docs");
        });
        assertThat(entries).filteredOn(e -> e.name().equals("data.unknownext")).singleElement()
                .extracting(FileEntry::contentType).isEqualTo("");
    }

    @Test
    @DisplayName("A missing root is an empty scan without errors")
    void missingRoot() {
        assertThat(scanAll(root.resolve("nope"))).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("A root that is a file is reported as SCAN_FAILED")
    void rootIsFile() throws IOException {
        final Path file = Files.write(root.resolve("file"), new byte[1]);

        assertThat(scanAll(file)).isEmpty();
        assertThat(errors).extracting(IndexSyncError::code).containsExactly(SyncErrorCode.SCAN_FAILED);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("Symbolic links are not followed and not reported")
    void symlinksAreSkipped() throws IOException {
        final Path outside = Files.createDirectories(root.resolve("outside"));
        Files.write(outside.resolve("secret.txt"), new byte[5]);
        final Path storage = Files.createDirectories(root.resolve("storage"));
        Files.write(storage.resolve("real.txt"), new byte[1]);
        Files.createSymbolicLink(storage.resolve("link"), outside);

        assertThat(scanAll(storage)).extracting(FileEntry::path).containsExactly("real.txt");
    }

    @Test
    @DisplayName("Directories are only opened when the stream reaches them")
    void lazyWalk() throws IOException {
        Files.createDirectories(root.resolve("a"));
        Files.write(root.resolve("a/one.txt"), new byte[1]);
        Files.createDirectories(root.resolve("z"));

        try (final Stream<FileEntry> entries = scanner.scan(root, errors::add, new CancellationToken())) {
            final Iterator<FileEntry> iterator = entries.iterator();
            assertThat(iterator.next().path()).isEqualTo("a");

            // Created after the walk started but before the stream reached it
            Files.write(root.resolve("z/late.txt"), new byte[1]);

            final List<String> rest = new ArrayList<>();
            iterator.forEachRemaining(e -> rest.add(e.path()));
            assertThat(rest).containsExactly("a/one.txt", "z", "z/late.txt");
        }
    }

    @Test
    @DisplayName("Cancellation ends the stream")
    void cancellation() throws IOException {
        for (int i = 0; i < 5; i++) {
            Files.write(root.resolve("f" + i), new byte[1]);
        }
        final CancellationToken token = new CancellationToken();

        final List<FileEntry> seen = new ArrayList<>();
        try (final Stream<FileEntry> entries = scanner.scan(root, errors::add, token)) {
            entries.forEach(entry -> {
                seen.add(entry);
                if (seen.size() == 2) {
                    token.cancel();
                }
            });
        }

        assertThat(seen).hasSize(2);
    }

    @Test
    @DisplayName("A directory that cannot be listed is reported, kept as an entry, and the walk continues")
    void unlistableDirectory() throws IOException {
        Files.createDirectories(root.resolve("b"));
        Files.write(root.resolve("a.txt"), new byte[1]);
        Files.write(root.resolve("b/hidden.txt"), new byte[1]);
        Files.write(root.resolve("c.txt"), new byte[1]);
        final FilesystemScanner failing = new FilesystemScanner() {
            @Override
            protected List<Path> listDirectory(final Path directory) throws IOException {
                if (directory.equals(root.resolve("b"))) {
                    throw new AccessDeniedException(directory.toString());
                }
                return super.listDirectory(directory);
            }
        };

        final List<FileEntry> entries;
        try (final Stream<FileEntry> stream = failing.scan(root, errors::add, new CancellationToken())) {
            entries = stream.toList();
        }

        assertThat(entries).extracting(FileEntry::path).containsExactly("a.txt", "b", "c.txt");
        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(SyncErrorCode.SCAN_FAILED);
            assertThat(error.path()).isEqualTo("b");
        });
    }

    @Test
    @DisplayName("A file whose attributes cannot be read is reported and skipped, its siblings are not")
    void unreadableAttributes() throws IOException {
        Files.write(root.resolve("a.txt"), new byte[1]);
        Files.write(root.resolve("b.txt"), new byte[2]);
        Files.write(root.resolve("c.txt"), new byte[3]);
        final FilesystemScanner failing = new FilesystemScanner() {
            @Override
            protected BasicFileAttributes readAttributes(final Path path) throws IOException {
                if (path.equals(root.resolve("b.txt"))) {
                    throw new AccessDeniedException(path.toString());
                }
                return super.readAttributes(path);
            }
        };

        final List<FileEntry> entries;
        try (final Stream<FileEntry> stream = failing.scan(root, errors::add, new CancellationToken())) {
            entries = stream.toList();
        }

        assertThat(entries).extracting(FileEntry::path).containsExactly("a.txt", "c.txt");
        assertThat(errors).extracting(IndexSyncError::path).containsExactly("b.txt");
    }

    @Test
    @DisplayName("A root that cannot be listed is reported with an empty path")
    void unlistableRoot() throws IOException {
        Files.write(root.resolve("a.txt"), new byte[1]);
        final FilesystemScanner failing = new FilesystemScanner() {
            @Override
            protected List<Path> listDirectory(final Path directory) throws IOException {
                throw new AccessDeniedException(directory.toString());
            }
        };

        final List<FileEntry> entries;
        try (final Stream<FileEntry> stream = failing.scan(root, errors::add, new CancellationToken())) {
            entries = stream.toList();
        }

        assertThat(entries).isEmpty();
        assertThat(errors).extracting(IndexSyncError::path).containsExactly("");
    }

    @Test
    @DisplayName("Relative paths always use forward slashes")
    void relativePath() {
        assertThat(FilesystemScanner.relativePath(root, root.resolve("a").resolve("b").resolve("c.txt")))
                .isEqualTo("a/b/c.txt");
    }
}
