package ai.sessionkeeper.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class AtomicWrites {
    private static final Logger logger = LogManager.getLogger(AtomicWrites.class);

    /** Suffix of the temporary files created next to a target while it is being rewritten. */
    public static final String TEMP_SUFFIX = ".tmp";

    /**
     * Invoked after the temporary file is fully written and flushed, immediately before it is moved over the
     * target. Tests use it to simulate a process dying between the two steps.
     */
    @FunctionalInterface
    public interface MoveBarrier {
        MoveBarrier NONE = (tempFile, target) -> {};

        void beforeMove(Path tempFile, Path target) throws IOException;
    }

    private AtomicWrites() {}

    /**
     * Overwrites the content of a file with the provided text data.
     *
     * @see #atomicOverwrite(Path, byte[], MoveBarrier)
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        atomicOverwrite(targetPath, content.getBytes(StandardCharsets.UTF_8), MoveBarrier.NONE);
    }

    /**
     * Overwrites the content of a file with the provided bytes.
     *
     * <p>The new content is written to a temporary file in the same directory as the target and forced to disk,
     * then moved over the target atomically. If the file system cannot move atomically it falls back to a plain
     * replacing move. The target is never truncated in place, so a reader sees either the old or the new file.
     *
     * @param targetPath the file to overwrite; its parent directories are created when missing
     * @param content the bytes to write
     * @param barrier callback run between the flush and the move
     * @throws IOException if writing or moving fails; the temporary file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, byte[] content, MoveBarrier barrier) throws IOException {
        moveIntoPlace(writeTemp(targetPath, content), targetPath, barrier);
    }

    /**
     * First half of {@link #atomicOverwrite(Path, byte[], MoveBarrier)}: writes {@code content} to a new temporary
     * file next to {@code targetPath} and forces it to disk.
     *
     * @return the temporary file
     * @throws IOException if writing fails; the temporary file is removed in that case
     */
    public static Path writeTemp(Path targetPath, byte[] content) throws IOException {
        Path dir = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tempFile = Files.createTempFile(dir, targetPath.getFileName() + ".", TEMP_SUFFIX);
        try (var channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
        return tempFile;
    }

    /**
     * Second half of {@link #atomicOverwrite(Path, byte[], MoveBarrier)}: runs the barrier, then moves
     * {@code tempFile} over {@code targetPath}.
     *
     * @throws IOException if the barrier or the move fails; the temporary file is removed in that case
     */
    public static void moveIntoPlace(Path tempFile, Path targetPath, MoveBarrier barrier) throws IOException {
        try {
            barrier.beforeMove(tempFile, targetPath);
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to plain move", targetPath);
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /** Atomically saves a Properties object to a file, creating parent directories as needed. */
    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        var writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(path, writer.toString());
    }

    /**
     * Restricts a file to owner read/write (rw-------). Best effort: file systems without POSIX attributes are
     * skipped and failures are logged.
     */
    public static void restrictToOwner(Path path) {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (IOException | UnsupportedOperationException e) {
            logger.warn("Failed to set owner-only permissions on {}: {}", path, e.getMessage());
        }
    }
}
