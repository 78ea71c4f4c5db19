package tmengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

/**
 * Loads machine definitions from the CSV layout:
 * name / states / input alphabet / tape alphabet / start / accept / reject,
 * then one {@code state,read,next,write,L|R} row per transition.
 */
public final class MachineParser {

    private static final Logger log = LoggerFactory.getLogger(MachineParser.class);

    private static final int HEADER_ROWS = 7;
    private static final int TRANSITION_FIELDS = 5;

    private MachineParser() {}

    public static MachineDefinition parseFromCsv(File file) {
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            MachineDefinition def = parse(r);
            log.info("Loaded machine '{}' from {} ({} transitions)", def.name, file, def.transitions.size());
            return def;
        } catch (IOException ex) {
            throw new MachineFormatException("Failed to load: " + ex.getMessage(), ex);
        }
    }

    public static MachineDefinition parseFromText(String csv) {
        try {
            return parse(new StringReader(csv == null ? "" : csv));
        } catch (IOException ex) {
            // StringReader does not throw
            throw new UncheckedIOException(ex);
        }
    }

    public static MachineDefinition parse(Reader reader) throws IOException {
        List<List<String>> rows = readRows(reader);
        if (rows.size() < HEADER_ROWS) {
            throw new MachineFormatException("Expected at least " + HEADER_ROWS
                    + " header rows (name, states, input alphabet, tape alphabet, start, accept, reject), got " + rows.size());
        }

        String name = firstField(rows, 0, "machine name");
        Set<String> states = fieldSet(rows.get(1));
        if (states.isEmpty()) throw new MachineFormatException(2, "no states declared");
        Set<String> sigma = fieldSet(rows.get(2));
        Set<String> gamma = fieldSet(rows.get(3));
        String start = firstField(rows, 4, "start state");
        String accept = firstField(rows, 5, "accept state");
        String reject = firstField(rows, 6, "reject state");

        requireDeclared(states, start, 5, "start state");
        requireDeclared(states, accept, 6, "accept state");
        requireDeclared(states, reject, 7, "reject state");
        if (accept.equals(reject)) {
            throw new MachineFormatException(7, "reject state must differ from accept state (" + accept + ")");
        }

        List<TransitionRow> transitions = new ArrayList<>();
        for (int i = HEADER_ROWS; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (isBlank(row)) continue;
            transitions.add(toTransition(row, i + 1, states));
        }

        MachineDefinition def = new MachineDefinition(name, states, sigma, gamma, start, accept, reject, transitions);
        warnOnAlphabet(def);
        return def;
    }

    // ---------- Rows ----------

    private static TransitionRow toTransition(List<String> row, int rowNo, Set<String> states) {
        if (row.size() != TRANSITION_FIELDS) {
            throw new MachineFormatException(rowNo, "transition needs " + TRANSITION_FIELDS
                    + " fields (state, read, next, write, direction), got " + row.size());
        }
        for (int f = 0; f < TRANSITION_FIELDS; f++) {
            if (row.get(f).isEmpty()) throw new MachineFormatException(rowNo, "empty field " + (f + 1));
        }
        String from = row.get(0);
        String to = row.get(2);
        requireDeclared(states, from, rowNo, "state");
        requireDeclared(states, to, rowNo, "next state");

        Direction dir;
        try {
            dir = Direction.parse(row.get(4));
        } catch (IllegalArgumentException ex) {
            throw new MachineFormatException(rowNo, ex.getMessage());
        }
        return new TransitionRow(from, row.get(1), to, row.get(3), dir);
    }

    private static void warnOnAlphabet(MachineDefinition def) {
        for (String s : def.inputAlphabet) {
            if (!def.tapeAlphabet.contains(s)) {
                log.warn("Machine '{}': input symbol '{}' is missing from the tape alphabet", def.name, s);
            }
        }
        for (TransitionRow t : def.transitions) {
            for (String s : List.of(t.readSymbol(), t.writeSymbol())) {
                if (!s.equals(Configuration.BLANK) && !def.tapeAlphabet.contains(s)) {
                    log.warn("Machine '{}': symbol '{}' in {} is not in the tape alphabet", def.name, s, t);
                }
            }
        }
    }

    private static String firstField(List<List<String>> rows, int index, String what) {
        List<String> row = rows.get(index);
        if (row.isEmpty() || row.get(0).isEmpty()) {
            throw new MachineFormatException(index + 1, "missing " + what);
        }
        return row.get(0);
    }

    private static void requireDeclared(Set<String> states, String state, int rowNo, String what) {
        if (!states.contains(state)) {
            throw new MachineFormatException(rowNo, what + " '" + state + "' is not a declared state");
        }
    }

    private static Set<String> fieldSet(List<String> row) {
        Set<String> out = new LinkedHashSet<>();
        for (String f : row) if (!f.isEmpty()) out.add(f);
        return out;
    }

    private static boolean isBlank(List<String> row) {
        for (String f : row) if (!f.isEmpty()) return false;
        return true;
    }

    // ---------- CSV ----------

    /** Comma-separated records, double-quote quoting with "" escapes; fields are trimmed. */
    static List<List<String>> readRows(Reader in) throws IOException {
        Reader reader = in.markSupported() ? in : new BufferedReader(in);
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean any = false;

        int c;
        while ((c = reader.read()) != -1) {
            char ch = (char) c;
            if (quoted) {
                if (ch == '"') {
                    reader.mark(1);
                    int n = reader.read();
                    if (n == '"') {
                        cur.append('"');
                    } else {
                        quoted = false;
                        if (n != -1) reader.reset();
                    }
                } else {
                    cur.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"' -> { quoted = true; any = true; }
                case ',' -> { row.add(cur.toString().trim()); cur.setLength(0); any = true; }
                case '\r' -> { }
                case '\n' -> {
                    if (any || cur.length() > 0) row.add(cur.toString().trim());
                    rows.add(row);
                    row = new ArrayList<>();
                    cur.setLength(0);
                    any = false;
                }
                default -> { cur.append(ch); any = true; }
            }
        }
        if (quoted) throw new MachineFormatException(rows.size() + 1, "unterminated quoted field");
        if (any || cur.length() > 0) {
            row.add(cur.toString().trim());
            rows.add(row);
        }
        return rows;
    }
}
