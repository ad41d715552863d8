package org.pyken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Writes artifacts so that a reader sees either the old file or the complete
 * new one: content goes to a temporary file in the target directory, is forced
 * to disk and then moved over the target.
 */
final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private ArtifactWriter() {
    }

    /**
     * @throws ArtifactWriteException if any step fails; the temporary file is removed
     */
    static void write(Path target, String content) {
        Path temp = null;
        try {
            Path directory = target.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                                                        StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new ArtifactWriteException(target, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not remove temporary file {}", temp, e);
                }
            }
        }
    }

    /**
     * Delete the artifact an earlier run left at {@code target}.
     *
     * @return whether there was one
     * @throws ArtifactWriteException if it exists and cannot be deleted
     */
    static boolean remove(Path target) {
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to remove stale artifact " + target + ": " + e.getMessage(),
                                             target, e);
        }
    }
}
