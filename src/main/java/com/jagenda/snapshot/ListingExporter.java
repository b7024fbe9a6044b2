package com.jagenda.snapshot;

import com.jagenda.storage.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a human-readable listing of records, one {@code key | value} per line
 * under a title line. Listings are for reading, not for loading back.
 */
public class ListingExporter {
    private static final Logger logger = LoggerFactory.getLogger(ListingExporter.class);

    private final SnapshotConfig config;

    public ListingExporter() {
        this(SnapshotConfig.defaults());
    }

    public ListingExporter(SnapshotConfig config) {
        this.config = config;
    }

    /**
     * @param records Records in the order they should be listed
     * @param path Destination file, replaced if it exists
     * @return Number of records written
     * @throws IOException if there's an error writing the file
     */
    public int export(Iterable<Record> records, Path path) throws IOException {
        int written = 0;
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("=== " + config.getListingTitle() + " ===");
            out.write('\n');
            out.write('\n');
            for (Record record : records) {
                out.write(record.getKey() + " | " + record.getValue());
                out.write('\n');
                written++;
            }
        }
        logger.info("Exported {} records to {}", written, path);
        return written;
    }
}
