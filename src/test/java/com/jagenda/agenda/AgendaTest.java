package com.jagenda.agenda;

import com.jagenda.storage.Record;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

public class AgendaTest {

    @TempDir
    Path tempDir;

    private Agenda agenda;

    @BeforeEach
    public void setUp() {
        agenda = new Agenda();
    }

    @Test
    public void shouldAddFindAndUpdateContacts() {
        StoreOutcome added = agenda.add("  Alice ", " 555-0100 ");
        StoreOutcome updated = agenda.add("Alice", "555-0199");

        assertTrue(added.isSuccess());
        assertThat(added.getMessage()).contains("added");
        assertTrue(updated.isSuccess());
        assertThat(updated.getMessage()).contains("updated");

        Optional<Record> contact = agenda.find("Alice");
        assertTrue(contact.isPresent(), "Contact should be found");
        assertEquals("555-0199", contact.get().getValue());
        assertEquals(1, agenda.stats().getContacts());
    }

    @Test
    public void shouldRejectIncompleteOrUnstorableInput() {
        assertFalse(agenda.add("", "555").isSuccess());
        assertFalse(agenda.add("Alice", "   ").isSuccess());
        assertFalse(agenda.add(null, "555").isSuccess());
        assertFalse(agenda.add("A|B", "555").isSuccess());
        assertFalse(agenda.add("A\nB", "1").isSuccess());
        assertFalse(agenda.add("Alice", "555\r0100").isSuccess());
        assertEquals(0, agenda.stats().getContacts());
        assertTrue(agenda.find(" ").isEmpty());
    }

    @Test
    public void removeReportsMissingContacts() {
        agenda.add("Alice", "1");

        assertTrue(agenda.remove("Alice").isSuccess());
        StoreOutcome missing = agenda.remove("Alice");

        assertFalse(missing.isSuccess());
        assertThat(missing.getMessage()).contains("not found");
    }

    @Test
    public void removeTreatsBlankNameAsUsageError() {
        agenda.add("Alice", "1");

        StoreOutcome nullName = agenda.remove(null);
        StoreOutcome blankName = agenda.remove("  ");

        assertFalse(nullName.isSuccess());
        assertEquals("Name is required", nullName.getMessage());
        assertFalse(blankName.isSuccess());
        assertEquals("Name is required", blankName.getMessage());
        assertEquals(1, agenda.stats().getContacts());
    }

    @Test
    public void rejectedLineBreakKeepsAgendaSavable() {
        agenda.add("Alice", "1");
        agenda.add("A\nB", "2");

        assertTrue(agenda.save(tempDir.resolve("agenda.txt")).isSuccess());
        assertEquals(1, agenda.stats().getContacts());
    }

    @Test
    public void loadReportsNonUtf8FileAsInvalid() throws IOException {
        Path file = tempDir.resolve("latin1.txt");
        Files.write(file, new byte[] {'J', 'o', (byte) 0xE9, '|', '5', '\n'});

        StoreOutcome outcome = agenda.load(file);

        assertFalse(outcome.isSuccess());
        assertThat(outcome.getMessage()).contains("Invalid file").contains("Not valid UTF-8");
        assertEquals(0, agenda.stats().getContacts());
    }

    @Test
    public void listIsAlphabetical() {
        agenda.add("Carol", "3");
        agenda.add("Alice", "1");
        agenda.add("Bob", "2");

        assertThat(agenda.list()).extracting(Record::getKey).containsExactly("Alice", "Bob", "Carol");
    }

    @Test
    public void statsReflectTreeShape() {
        agenda.add("C", "3");
        agenda.add("B", "2");
        agenda.add("A", "1");

        AgendaStats stats = agenda.stats();

        assertEquals(3, stats.getContacts());
        assertEquals(2, stats.getHeight());
        assertEquals(1, stats.getRotations());
    }

    @Test
    public void clearAllResetsContactsAndRotations() {
        agenda.add("C", "3");
        agenda.add("B", "2");
        agenda.add("A", "1");

        agenda.clearAll();

        AgendaStats stats = agenda.stats();
        assertEquals(0, stats.getContacts());
        assertEquals(0, stats.getHeight());
        assertEquals(0, stats.getRotations());
    }

    @Test
    public void saveThenLoadIntoFreshAgenda() {
        agenda.add("Alice", "555-0100");
        agenda.add("Bob", "555-0200");
        Path file = tempDir.resolve("agenda.txt");

        StoreOutcome saved = agenda.save(file);
        Agenda restored = new Agenda();
        StoreOutcome loaded = restored.load(file);

        assertTrue(saved.isSuccess());
        assertTrue(loaded.isSuccess());
        assertThat(loaded.getMessage()).startsWith("2 contacts loaded");
        assertEquals(agenda.list(), restored.list());
    }

    @Test
    public void loadDistinguishesMissingFromInvalid() throws IOException {
        StoreOutcome missing = agenda.load(tempDir.resolve("absent.txt"));
        Path broken = tempDir.resolve("broken.txt");
        Files.writeString(broken, "Alice|1\nno-separator\n", StandardCharsets.UTF_8);
        StoreOutcome invalid = agenda.load(broken);

        assertFalse(missing.isSuccess());
        assertThat(missing.getMessage()).contains("not found");
        assertFalse(invalid.isSuccess());
        assertThat(invalid.getMessage()).contains("Invalid file").contains("Line 2");
        assertEquals(0, agenda.stats().getContacts());
    }

    @Test
    public void saveFailureIsReported() {
        agenda.add("Alice", "1");

        StoreOutcome outcome = agenda.save(tempDir.resolve("no-such-dir").resolve("agenda.txt"));

        assertFalse(outcome.isSuccess());
        assertThat(outcome.getMessage()).startsWith("Failed to save");
    }

    @Test
    public void exportWritesListingAndRefusesEmptyAgenda() throws IOException {
        Path file = tempDir.resolve("contact_list.txt");
        assertFalse(agenda.export(file).isSuccess());
        assertFalse(Files.exists(file));

        agenda.add("Bob", "2");
        agenda.add("Alice", "1");
        StoreOutcome outcome = agenda.export(file);

        assertTrue(outcome.isSuccess());
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .containsExactly("=== PHONE BOOK ===", "", "Alice | 1", "Bob | 2");
    }
}
