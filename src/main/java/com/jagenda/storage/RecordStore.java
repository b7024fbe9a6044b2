package com.jagenda.storage;

import java.util.Optional;

/**
 * Core interface for keyed record stores.
 * Keys are unique and compared lexicographically (case-sensitive).
 */
public interface RecordStore {
    /**
     * Writes a record. An existing key has its value replaced.
     *
     * @param key The record key
     * @param value The record value
     */
    void write(String key, String value);

    /**
     * Reads a record by its key.
     *
     * @param key The record key
     * @return Optional containing the record if found, empty otherwise
     */
    Optional<Record> read(String key);

    /**
     * Deletes a record by its key. Deleting an absent key leaves the store unchanged.
     *
     * @param key The record key
     * @return true if a record was removed
     */
    boolean delete(String key);

    /**
     * Returns all records in ascending key order. Each call to
     * {@code iterator()} starts a fresh walk over the current contents.
     *
     * @return Iterable over the records
     */
    Iterable<Record> entries();

    /**
     * @return Number of records currently stored
     */
    int count();

    /**
     * Removes every record.
     */
    void clear();
}
