package com.jagenda.snapshot;

import com.jagenda.avl.BalancedIndex;
import com.jagenda.storage.MalformedRecordException;
import com.jagenda.storage.RecordLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Loads snapshot files into an index. Every line is inserted, so the
 * index ends up with the file's contents merged over what it already held.
 */
public class SnapshotReader {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotReader.class);

    private final SnapshotConfig config;

    public SnapshotReader() {
        this(SnapshotConfig.defaults());
    }

    public SnapshotReader(SnapshotConfig config) {
        this.config = config;
    }

    /**
     * Reads the file at the specified path into the index.
     *
     * @param path The path to read from
     * @param index The index receiving the records
     * @return {@link LoadResult.Status#FILE_NOT_FOUND} when there is no such file, otherwise the load counts
     * @throws MalformedRecordException if the file is not valid UTF-8, or a line is malformed
     *         and the policy is FAIL; the index is then left unchanged
     * @throws IOException if the file cannot be read
     */
    public LoadResult read(Path path, BalancedIndex index) throws IOException {
        byte[] payload;
        try {
            payload = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            logger.info("No snapshot at {}", path);
            return LoadResult.fileNotFound(path);
        }

        String text = decode(payload, path);
        int before = index.count();
        RecordLines.ParsedLines parsed = index.deserialize(new StringReader(text), config.getMalformedLinePolicy());
        int added = index.count() - before;

        logger.info("Loaded {} records from {} ({} new, {} lines skipped)",
            parsed.getRecords().size(), path, added, parsed.getSkippedLines());
        return LoadResult.loaded(path, parsed.getRecords().size(), added, parsed.getSkippedLines());
    }

    // Invalid byte sequences are an error, not U+FFFD
    private static String decode(byte[] payload, Path path) throws MalformedRecordException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedRecordException("Not valid UTF-8 text: " + path, e);
        }
    }
}
