package com.ganesh.store.blob;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem area holding one payload file per Item, named exactly by the Item ID.
 */
public class BlobStore {
    private static final Logger logger = LoggerFactory.getLogger(BlobStore.class);

    private static final CharMatcher ILLEGAL_ID_CHARS = CharMatcher.anyOf("/\\").or(CharMatcher.javaIsoControl());

    private final Path directory;

    /**
     * @param directory The blob directory. It must exist.
     */
    public BlobStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Creates the blob for an ID and copies the whole stream into it. A leftover file under the
     * same ID is truncated. Both the source and the new file are closed before this method
     * returns, whatever the outcome.
     *
     * @param id     The Item ID.
     * @param source The payload.
     * @return The number of bytes written.
     * @throws IOException if the file cannot be created or the copy fails.
     */
    public long write(String id, InputStream source) throws IOException {
        Path file = resolve(id);
        try (InputStream in = source;
             OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                     StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            long written = ByteStreams.copy(in, out);
            logger.debug("Wrote {} bytes to blob {}", written, id);
            return written;
        }
    }

    /**
     * Opens a blob for reading. The caller closes the stream.
     *
     * @param id The Item ID.
     * @return A stream over the blob contents.
     * @throws java.nio.file.NoSuchFileException if there is no blob for the ID.
     * @throws IOException if the file cannot be opened.
     */
    public InputStream open(String id) throws IOException {
        return Files.newInputStream(resolve(id));
    }

    /**
     * @param id The Item ID.
     * @return {@code true} if the blob was removed, {@code false} if there was none.
     * @throws IOException if the file exists but cannot be removed.
     */
    public boolean delete(String id) throws IOException {
        return Files.deleteIfExists(resolve(id));
    }

    public boolean exists(String id) {
        return Files.isRegularFile(resolve(id));
    }

    /**
     * @return The IDs of all blobs currently on disk.
     * @throws IOException if the directory cannot be listed.
     */
    public List<String> listIds() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toList());
        }
    }

    private Path resolve(String id) {
        Preconditions.checkArgument(id != null && !id.isEmpty() && ILLEGAL_ID_CHARS.matchesNoneOf(id)
                && !id.equals(".") && !id.equals(".."), "Invalid blob ID: %s", id);
        return directory.resolve(id);
    }
}
