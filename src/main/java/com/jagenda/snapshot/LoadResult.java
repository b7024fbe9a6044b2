package com.jagenda.snapshot;

import java.nio.file.Path;

/**
 * Outcome of loading a snapshot file into an index.
 */
public class LoadResult {
    public enum Status {
        LOADED,
        FILE_NOT_FOUND
    }

    private final Status status;
    private final Path path;
    private final int recordsRead;
    private final int recordsAdded;
    private final int linesSkipped;

    private LoadResult(Status status, Path path, int recordsRead, int recordsAdded, int linesSkipped) {
        this.status = status;
        this.path = path;
        this.recordsRead = recordsRead;
        this.recordsAdded = recordsAdded;
        this.linesSkipped = linesSkipped;
    }

    static LoadResult loaded(Path path, int recordsRead, int recordsAdded, int linesSkipped) {
        return new LoadResult(Status.LOADED, path, recordsRead, recordsAdded, linesSkipped);
    }

    static LoadResult fileNotFound(Path path) {
        return new LoadResult(Status.FILE_NOT_FOUND, path, 0, 0, 0);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return Number of well-formed lines applied to the index
     */
    public int getRecordsRead() {
        return recordsRead;
    }

    /**
     * @return Growth of the index; lines that overwrote an existing key do not count
     */
    public int getRecordsAdded() {
        return recordsAdded;
    }

    public int getLinesSkipped() {
        return linesSkipped;
    }

    @Override
    public String toString() {
        return "LoadResult{" + status + ", path=" + path + ", read=" + recordsRead
            + ", added=" + recordsAdded + ", skipped=" + linesSkipped + "}";
    }
}
