package com.jagenda.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-oriented text format for records: one {@code key|value} per line.
 * Lines are stripped before parsing and blank lines are ignored.
 */
public final class RecordLines {
    private static final Logger logger = LoggerFactory.getLogger(RecordLines.class);

    public static final char SEPARATOR = '|';

    private RecordLines() {
    }

    /**
     * Formats a record as a single line, without the trailing newline.
     *
     * @param record The record to format
     * @return The formatted line
     * @throws MalformedRecordException if the key or value contains the separator or a line break
     */
    public static String format(Record record) throws MalformedRecordException {
        checkRepresentable("key", record.getKey());
        checkRepresentable("value", record.getValue());
        return record.getKey() + SEPARATOR + record.getValue();
    }

    /**
     * Parses one stripped, non-blank line.
     *
     * @param line The line content
     * @param lineNumber 1-based position, used in error messages
     * @return The parsed record
     * @throws MalformedRecordException if the line does not hold exactly two fields
     */
    public static Record parse(String line, int lineNumber) throws MalformedRecordException {
        int separator = line.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new MalformedRecordException("missing '" + SEPARATOR + "' separator", lineNumber);
        }
        if (line.indexOf(SEPARATOR, separator + 1) >= 0) {
            throw new MalformedRecordException("more than one '" + SEPARATOR + "' separator", lineNumber);
        }
        return new Record(line.substring(0, separator), line.substring(separator + 1));
    }

    /**
     * Reads every line of the input.
     * With {@link MalformedLinePolicy#FAIL} the first bad line aborts the read;
     * with {@link MalformedLinePolicy#SKIP} it is logged and counted.
     *
     * @param reader The input
     * @param policy Handling of unparseable lines
     * @return The records in input order plus the number of skipped lines
     * @throws IOException If reading fails, or a line is malformed under FAIL
     */
    public static ParsedLines parseAll(BufferedReader reader, MalformedLinePolicy policy) throws IOException {
        List<Record> records = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 0;
        String raw;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                records.add(parse(line, lineNumber));
            } catch (MalformedRecordException e) {
                if (policy == MalformedLinePolicy.FAIL) {
                    throw e;
                }
                skipped++;
                logger.warn("Skipping malformed record: {}", e.getMessage());
            }
        }
        return new ParsedLines(records, skipped);
    }

    /**
     * @return true if the text holds no separator and no line break
     */
    public static boolean isRepresentable(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == SEPARATOR || c == '\n' || c == '\r') {
                return false;
            }
        }
        return true;
    }

    private static void checkRepresentable(String field, String text) throws MalformedRecordException {
        if (!isRepresentable(text)) {
            throw new MalformedRecordException(
                "Cannot store " + field + " '" + text + "': contains '" + SEPARATOR + "' or a line break");
        }
    }

    /**
     * Result of {@link #parseAll}.
     */
    public static final class ParsedLines {
        private final List<Record> records;
        private final int skippedLines;

        ParsedLines(List<Record> records, int skippedLines) {
            this.records = Collections.unmodifiableList(records);
            this.skippedLines = skippedLines;
        }

        public List<Record> getRecords() {
            return records;
        }

        public int getSkippedLines() {
            return skippedLines;
        }
    }
}
