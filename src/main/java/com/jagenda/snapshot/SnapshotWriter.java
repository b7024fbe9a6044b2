package com.jagenda.snapshot;

import com.jagenda.avl.BalancedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes an index to a snapshot file: pre-order {@code key|value} lines, UTF-8 encoded.
 * The file is written next to the target and moved into place, so a failed
 * save never leaves a partial snapshot behind.
 */
public class SnapshotWriter {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotWriter.class);

    /**
     * Writes the index to the specified path, replacing any existing file.
     * Nothing is written when a record cannot be represented in the line format.
     *
     * @param index The index to save
     * @param path The path to write to
     * @throws IOException if there's an error writing the file
     */
    public void write(BalancedIndex index, Path path) throws IOException {
        StringWriter text = new StringWriter();
        index.serialize(text);
        byte[] payload = text.toString().getBytes(StandardCharsets.UTF_8);

        Path target = path.toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), target.getFileName() + ".", ".tmp");
            Files.write(temp, payload);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            IOException failure = new IOException("Unable to write to file: " + path, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
        logger.info("Saved {} records to {} ({} bytes)", index.count(), path, payload.length);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
