package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.model.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks one owner's storage root and produces a lazy sequence of {@link FileEntry}.
 * <p>
 * The walk is depth-first; every directory is reported before its children and is only
 * opened when the stream reaches it. Symbolic links are neither followed nor reported.
 * Paths whose attributes cannot be read, and directories that cannot be listed, are reported
 * to the error sink as {@code SCAN_FAILED} and the walk continues with the next sibling.
 * A directory that cannot be listed is still reported itself; its children are not.
 * The scanner never writes to the filesystem and keeps no state between scans.
 */
public class FilesystemScanner {

    private static final Logger logger = LoggerFactory.getLogger(FilesystemScanner.class);

    /**
     * Scan the tree below {@code root}. A missing root yields an empty stream.
     *
     * @param root      owner storage root
     * @param errorSink receives one entry per path that could not be read
     * @param token     checked before every item; a cancelled token ends the stream
     */
    public Stream<FileEntry> scan(final Path root, final Consumer<IndexSyncError> errorSink,
                                  final CancellationToken token) {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            logger.debug("Storage root {} does not exist, nothing to scan", root);
            return Stream.empty();
        }
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            errorSink.accept(new IndexSyncError("", SyncErrorCode.SCAN_FAILED,
                    "Storage root is not a directory: " + root));
            return Stream.empty();
        }

        final Iterator<FileEntry> walker = new TreeWalker(root, errorSink, token);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Content type guessed from the file name, empty when unknown.
     */
    public static String contentTypeOf(final String fileName) {
        final String guessed = URLConnection.guessContentTypeFromName(fileName);
        return guessed == null ? "" : guessed;
    }

    /**
     * Sorted children of {@code directory}.
     */
    protected List<Path> listDirectory(final Path directory) throws IOException {
        try (final Stream<Path> children = Files.list(directory)) {
            return children.sorted().toList();
        } catch (final UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Attributes of {@code path} without following links.
     */
    protected BasicFileAttributes readAttributes(final Path path) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    }

    static String relativePath(final Path root, final Path path) {
        final Path relative = root.relativize(path);
        final StringBuilder result = new StringBuilder();
        for (final Path segment : relative) {
            if (!result.isEmpty()) {
                result.append('/');
            }
            result.append(segment);
        }
        return result.toString();
    }

    private final class TreeWalker implements Iterator<FileEntry> {

        private final Path root;
        private final Consumer<IndexSyncError> errorSink;
        private final CancellationToken token;

        // One iterator per open directory, innermost on top
        private final Deque<Iterator<Path>> openDirectories = new ArrayDeque<>();
        private Path directoryToOpen;
        private FileEntry next;

        TreeWalker(final Path root, final Consumer<IndexSyncError> errorSink, final CancellationToken token) {
            this.root = root;
            this.errorSink = errorSink;
            this.token = token;
            this.directoryToOpen = root;
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (token.isCancelled()) {
                    return false;
                }
                if (directoryToOpen != null) {
                    final Path directory = directoryToOpen;
                    directoryToOpen = null;
                    openDirectories.push(listChildren(directory));
                    continue;
                }
                final Iterator<Path> current = openDirectories.peek();
                if (current == null) {
                    return false;
                }
                if (!current.hasNext()) {
                    openDirectories.pop();
                    continue;
                }
                next = toEntry(current.next());
            }
            return true;
        }

        @Override
        public FileEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final FileEntry result = next;
            next = null;
            return result;
        }

        private Iterator<Path> listChildren(final Path directory) {
            try {
                return listDirectory(directory).iterator();
            } catch (final IOException e) {
                logger.warn("Cannot list directory {}", directory, e);
                errorSink.accept(new IndexSyncError(relativePath(root, directory), SyncErrorCode.SCAN_FAILED,
                        "Cannot list directory: " + e.getMessage()));
                return Collections.emptyIterator();
            }
        }

        private FileEntry toEntry(final Path path) {
            final String relative = relativePath(root, path);
            final BasicFileAttributes attributes;
            try {
                attributes = readAttributes(path);
            } catch (final IOException e) {
                logger.warn("Cannot read attributes of {}", path, e);
                errorSink.accept(new IndexSyncError(relative, SyncErrorCode.SCAN_FAILED,
                        "Cannot read attributes: " + e.getMessage()));
                return null;
            }

            final String name = path.getFileName().toString();
            final long modifiedAt = attributes.lastModifiedTime().toMillis();

            if (attributes.isSymbolicLink()) {
                logger.debug("Skipping symbolic link {}", path);
                return null;
            }
            if (attributes.isDirectory()) {
                directoryToOpen = path;
                return new FileEntry(relative, name, 0L, "", true, modifiedAt);
            }
            if (!attributes.isRegularFile()) {
                logger.debug("Skipping special file {}", path);
                return null;
            }
            return new FileEntry(relative, name, attributes.size(), contentTypeOf(name), false, modifiedAt);
        }
    }
}
