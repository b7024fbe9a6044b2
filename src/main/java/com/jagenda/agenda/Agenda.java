package com.jagenda.agenda;

import com.jagenda.avl.BalancedIndex;
import com.jagenda.snapshot.ListingExporter;
import com.jagenda.snapshot.LoadResult;
import com.jagenda.snapshot.SnapshotConfig;
import com.jagenda.snapshot.SnapshotReader;
import com.jagenda.snapshot.SnapshotWriter;
import com.jagenda.storage.MalformedRecordException;
import com.jagenda.storage.Record;
import com.jagenda.storage.RecordLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Agenda is a phone book on top of a {@link BalancedIndex}: names are keys,
 * phone numbers are values. Storage failures come back as {@link StoreOutcome}s
 * carrying a message for the user instead of exceptions.
 */
public class Agenda {
    private static final Logger logger = LoggerFactory.getLogger(Agenda.class);

    private final BalancedIndex index;
    private final SnapshotWriter writer;
    private final SnapshotReader reader;
    private final ListingExporter exporter;

    public Agenda() {
        this(SnapshotConfig.defaults());
    }

    public Agenda(SnapshotConfig config) {
        this.index = new BalancedIndex();
        this.writer = new SnapshotWriter();
        this.reader = new SnapshotReader(config);
        this.exporter = new ListingExporter(config);
    }

    /**
     * Adds a contact, or replaces the phone number of an existing one.
     */
    public StoreOutcome add(String name, String phone) {
        String trimmedName = name == null ? "" : name.trim();
        String trimmedPhone = phone == null ? "" : phone.trim();
        if (trimmedName.isEmpty() || trimmedPhone.isEmpty()) {
            return StoreOutcome.failure("Name and phone are both required");
        }
        if (!RecordLines.isRepresentable(trimmedName) || !RecordLines.isRepresentable(trimmedPhone)) {
            return StoreOutcome.failure(
                "Name and phone must not contain '" + RecordLines.SEPARATOR + "' or line breaks");
        }
        boolean existed = index.read(trimmedName).isPresent();
        index.write(trimmedName, trimmedPhone);
        return StoreOutcome.success(existed
            ? "Contact '" + trimmedName + "' updated"
            : "Contact '" + trimmedName + "' added");
    }

    public Optional<Record> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return index.read(name.trim());
    }

    public StoreOutcome remove(String name) {
        if (name == null || name.isBlank()) {
            return StoreOutcome.failure("Name is required");
        }
        String trimmed = name.trim();
        if (index.delete(trimmed)) {
            return StoreOutcome.success("Contact '" + trimmed + "' removed");
        }
        return StoreOutcome.failure("Contact '" + trimmed + "' not found");
    }

    /**
     * @return Every contact in alphabetical order
     */
    public List<Record> list() {
        List<Record> contacts = new ArrayList<>(index.count());
        for (Record record : index.entries()) {
            contacts.add(record);
        }
        return contacts;
    }

    public AgendaStats stats() {
        return new AgendaStats(index.count(), index.height(), index.getRotationCount());
    }

    /**
     * Removes every contact and resets the rotation counter.
     */
    public void clearAll() {
        index.clear();
    }

    public StoreOutcome save(Path path) {
        try {
            writer.write(index, path);
            return StoreOutcome.success("Saved " + index.count() + " contacts to '" + path + "'");
        } catch (MalformedRecordException e) {
            logger.warn("Cannot save to {}: {}", path, e.getMessage());
            return StoreOutcome.failure("Cannot save: " + e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to save to {}", path, e);
            return StoreOutcome.failure("Failed to save '" + path + "': " + e.getMessage());
        }
    }

    public StoreOutcome load(Path path) {
        try {
            LoadResult result = reader.read(path, index);
            if (!result.isLoaded()) {
                return StoreOutcome.failure("File '" + path + "' not found");
            }
            String message = result.getRecordsAdded() + " contacts loaded from '" + path + "'";
            if (result.getLinesSkipped() > 0) {
                message += " (" + result.getLinesSkipped() + " invalid lines skipped)";
            }
            return StoreOutcome.success(message);
        } catch (MalformedRecordException e) {
            logger.warn("Invalid snapshot {}: {}", path, e.getMessage());
            return StoreOutcome.failure("Invalid file '" + path + "': " + e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to load {}", path, e);
            return StoreOutcome.failure("Failed to load '" + path + "': " + e.getMessage());
        }
    }

    /**
     * Writes a readable listing of all contacts.
     */
    public StoreOutcome export(Path path) {
        if (index.count() == 0) {
            return StoreOutcome.failure("No contacts to export");
        }
        try {
            int written = exporter.export(index.entries(), path);
            return StoreOutcome.success("Exported " + written + " contacts to '" + path + "'");
        } catch (IOException e) {
            logger.error("Failed to export to {}", path, e);
            return StoreOutcome.failure("Failed to export '" + path + "': " + e.getMessage());
        }
    }
}
