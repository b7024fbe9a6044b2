package com.jagenda.examples;

import com.jagenda.agenda.Agenda;
import com.jagenda.agenda.AgendaStats;
import com.jagenda.agenda.StoreOutcome;
import com.jagenda.snapshot.SnapshotConfig;
import com.jagenda.storage.Record;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * A line-oriented console for an {@link Agenda}.
 *
 * <pre>
 *   add Alice|555-0100     find Alice     remove Alice
 *   list    stats    save [path]    load [path]    export [path]
 *   clear   help     quit
 * </pre>
 */
public class AgendaShell {
    public static final String DEFAULT_SNAPSHOT = "agenda.txt";
    public static final String DEFAULT_LISTING = "contact_list.txt";

    private final Agenda agenda;
    private final Path defaultSnapshot;

    public AgendaShell(Agenda agenda, Path defaultSnapshot) {
        this.agenda = agenda;
        this.defaultSnapshot = defaultSnapshot;
    }

    public static void main(String[] args) throws IOException {
        Path snapshot = Paths.get(System.getProperty("jagenda.file", DEFAULT_SNAPSHOT));
        Agenda agenda = new Agenda(SnapshotConfig.defaults());

        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        AgendaShell shell = new AgendaShell(agenda, snapshot);
        if (Files.exists(snapshot)) {
            out.println(agenda.load(snapshot));
        }
        shell.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);
    }

    /**
     * Executes commands until "quit" or end of input.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        out.println("Phone book ready. Type 'help' for commands.");
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line.trim(), out)) {
                break;
            }
        }
        out.flush();
    }

    /**
     * @return false when the shell should stop
     */
    boolean execute(String line, PrintWriter out) {
        if (line.isEmpty()) {
            return true;
        }
        int space = line.indexOf(' ');
        String command = (space < 0 ? line : line.substring(0, space)).toLowerCase();
        String argument = space < 0 ? "" : line.substring(space + 1).trim();

        switch (command) {
            case "add" -> add(argument, out);
            case "find" -> find(argument, out);
            case "remove" -> out.println(agenda.remove(argument));
            case "list" -> list(out);
            case "stats" -> stats(out);
            case "save" -> out.println(agenda.save(pathOr(argument, defaultSnapshot)));
            case "load" -> out.println(agenda.load(pathOr(argument, defaultSnapshot)));
            case "export" -> out.println(agenda.export(pathOr(argument, Paths.get(DEFAULT_LISTING))));
            case "clear" -> {
                agenda.clearAll();
                out.println(StoreOutcome.success("All contacts removed"));
            }
            case "help" -> help(out);
            case "quit", "exit" -> {
                return false;
            }
            default -> out.println("Unknown command '" + command + "'. Type 'help' for commands.");
        }
        return true;
    }

    private void add(String argument, PrintWriter out) {
        int separator = argument.indexOf('|');
        if (separator < 0) {
            out.println(StoreOutcome.failure("Usage: add <name>|<phone>"));
            return;
        }
        out.println(agenda.add(argument.substring(0, separator), argument.substring(separator + 1)));
    }

    private void find(String name, PrintWriter out) {
        if (name.isEmpty()) {
            out.println(StoreOutcome.failure("Usage: find <name>"));
            return;
        }
        Optional<Record> contact = agenda.find(name);
        if (contact.isPresent()) {
            out.println(contact.get().getKey() + ": " + contact.get().getValue());
        } else {
            out.println("Contact '" + name + "' not found");
        }
    }

    private void list(PrintWriter out) {
        List<Record> contacts = agenda.list();
        if (contacts.isEmpty()) {
            out.println("(no contacts)");
            return;
        }
        for (Record contact : contacts) {
            out.println(contact.getKey() + " | " + contact.getValue());
        }
    }

    private void stats(PrintWriter out) {
        AgendaStats stats = agenda.stats();
        out.println("Contacts: " + stats.getContacts());
        out.println("Tree height: " + stats.getHeight());
        out.println("Rotations: " + stats.getRotations());
    }

    private static void help(PrintWriter out) {
        out.println("add <name>|<phone>  add or update a contact");
        out.println("find <name>         look a contact up");
        out.println("remove <name>       delete a contact");
        out.println("list                all contacts in alphabetical order");
        out.println("stats               contact count, tree height and rotations");
        out.println("save [path]         write the agenda file (default " + DEFAULT_SNAPSHOT + ")");
        out.println("load [path]         merge an agenda file into the current contacts");
        out.println("export [path]       write a readable listing (default " + DEFAULT_LISTING + ")");
        out.println("clear               remove every contact");
        out.println("quit                leave");
    }

    private static Path pathOr(String argument, Path fallback) {
        return argument.isEmpty() ? fallback : Paths.get(argument);
    }
}
