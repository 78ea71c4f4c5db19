package console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tmengine.*;

import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;


public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_ACCEPTED = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_EXHAUSTED = 2;
    static final int EXIT_ERROR = 3;

    private final Scanner sc;
    private final PrintStream out;
    private final RunHistory history = new RunHistory();
    private final int defaultMaxDepth;
    private final int defaultMaxTransitions;

    private MachineDefinition currentMachine = null;
    private TransitionTable currentTable = null;

    App(InputStream in, PrintStream out) {
        this.sc = new Scanner(in);
        this.out = out;
        this.defaultMaxDepth = Integer.getInteger("tm.maxDepth", RunLimits.DEFAULT_MAX_DEPTH);
        this.defaultMaxTransitions = Integer.getInteger("tm.maxTransitions", RunLimits.DEFAULT_MAX_TRANSITIONS);
    }

    public static void main(String[] args) {
        if (args.length > 0) {
            System.exit(runOnce(args, System.out));
        }
        new App(System.in, System.out).loop();
    }

    /** Non-interactive mode: {@code <machine.csv> <input> [maxDepth] [maxTransitions]}. */
    static int runOnce(String[] args, PrintStream out) {
        if (args.length < 2 || args.length > 4) {
            out.println("Usage: tm-console <machine.csv> <input> [maxDepth] [maxTransitions]");
            return EXIT_ERROR;
        }
        try {
            int maxDepth = args.length > 2 ? Integer.parseInt(args[2].trim())
                    : Integer.getInteger("tm.maxDepth", RunLimits.DEFAULT_MAX_DEPTH);
            int maxTransitions = args.length > 3 ? Integer.parseInt(args[3].trim())
                    : Integer.getInteger("tm.maxTransitions", RunLimits.DEFAULT_MAX_TRANSITIONS);
            MachineDefinition m = MachineParser.parseFromCsv(new File(args[0]));
            Outcome o = Runner.run(m, args[1], maxDepth, maxTransitions);
            out.println(TraceReporter.render(o));
            return switch (o.verdict) {
                case ACCEPTED -> EXIT_ACCEPTED;
                case REJECTED -> EXIT_REJECTED;
                case EXHAUSTED -> EXIT_EXHAUSTED;
            };
        } catch (NumberFormatException ex) {
            out.println("Error: limits must be whole numbers (" + ex.getMessage() + ")");
            return EXIT_ERROR;
        } catch (IllegalArgumentException ex) {
            out.println("Error: " + ex.getMessage());
            return EXIT_ERROR;
        }
    }

    void loop() {
        out.println("TM-Emulator (Console)");
        while (true) {
            printMenu();
            Integer choice = readInt("Choose [1-6]: ");
            if (choice == null) return;
            switch (choice) {
                case 1 -> cmdLoadCsv();
                case 2 -> cmdShowMachine();
                case 3 -> cmdRun();
                case 4 -> cmdStep();
                case 5 -> cmdHistory();
                case 6 -> { out.println("Bye!"); return; }
                default -> out.println("Invalid choice. Please select 1..6.");
            }
        }
    }

    private void printMenu() {
        out.println();
        out.println("(1) Load machine CSV");
        out.println("(2) Show machine");
        out.println("(3) Run input");
        out.println("(4) Step through a run");
        out.println("(5) Show history");
        out.println("(6) Exit");
    }


    private void cmdLoadCsv() {
        String path = readLine("Enter the Turing machine file name: ");
        if (path == null) return;

        try {
            MachineDefinition m = MachineParser.parseFromCsv(new File(path.trim()));
            currentMachine = m;
            currentTable = TransitionTable.of(m);
            out.println("OK: machine \"" + m.name + "\" loaded (" + currentTable.size() + " transitions).");
        } catch (IllegalArgumentException ex) {
            log.debug("Load of {} failed", path, ex);
            out.println("Error: " + ex.getMessage());
            if (currentMachine != null) {
                out.println("Keeping previous machine \"" + currentMachine.name + "\" loaded.");
            }
        }
    }

    private void cmdShowMachine() {
        if (currentMachine == null) {
            out.println("No machine loaded.");
            return;
        }
        out.println();
        for (String line : currentMachine.describe()) out.println(line);
        out.println("Distinct (state, symbol) keys: " + currentTable.keys());
    }

    private void cmdRun() {
        if (currentMachine == null) {
            out.println("No machine loaded.");
            return;
        }
        String input = readLine("Enter the input string: ");
        if (input == null) return;
        RunLimits limits = readLimits();
        if (limits == null) return;

        Outcome o = Runner.run(currentMachine, currentTable, input, limits);
        out.println(TraceReporter.render(o));
        history.add(currentMachine.name, input, limits, o);
    }

    private void cmdStep() {
        if (currentMachine == null) {
            out.println("No machine loaded.");
            return;
        }
        String input = readLine("Enter the input string: ");
        if (input == null) return;
        RunLimits limits = readLimits();
        if (limits == null) return;

        Explorer explorer = new Explorer(currentMachine, currentTable, input, limits);
        printSnapshot(explorer.snapshot());
        while (!explorer.halted()) {
            String cmd = readLine("[Enter]=next level, r=resume, q=abandon: ");
            if (cmd == null || cmd.trim().equalsIgnoreCase("q")) {
                out.println("Run abandoned at level " + explorer.snapshot().level + ".");
                return;
            }
            if (cmd.trim().equalsIgnoreCase("r")) {
                explorer.resume();
            } else {
                Explorer.Snapshot s = explorer.step();
                if (!s.halted) {
                    printSnapshot(s);
                    for (Configuration c : explorer.tree().lastLevel()) out.println("  " + c);
                }
            }
        }
        Outcome o = explorer.outcome().orElseThrow();
        out.println(TraceReporter.render(o));
        history.add(currentMachine.name, input, limits, o);
    }

    private void cmdHistory() {
        if (history.isEmpty()) {
            out.println("No runs yet.");
            return;
        }
        for (RunHistory.Entry e : history.all()) out.println(e.formatLine());
    }

    // ---------- Small helpers ----------

    private void printSnapshot(Explorer.Snapshot s) {
        out.println("Level " + s.level + ": " + s.width + " configuration(s), " + s.transitions + " transition(s) so far");
    }

    private RunLimits readLimits() {
        Integer depth = readIntOrDefault("Enter max depth (default " + defaultMaxDepth + "): ", defaultMaxDepth);
        if (depth == null) return null;
        Integer budget = readIntOrDefault("Enter max transitions (default " + defaultMaxTransitions + "): ", defaultMaxTransitions);
        if (budget == null) return null;
        return new RunLimits(depth, budget);
    }

    private Integer readIntOrDefault(String prompt, int def) {
        while (true) {
            String s = readLine(prompt);
            if (s == null) return null;
            if (s.isBlank()) return def;
            try {
                int v = Integer.parseInt(s.trim());
                if (v >= 0) return v;
                out.println("Please enter a non-negative number.");
            } catch (NumberFormatException ignore) {
                out.println("Please enter a non-negative number.");
            }
        }
    }

    private Integer readInt(String prompt) {
        while (true) {
            String s = readLine(prompt);
            if (s == null) return null;
            try { return Integer.parseInt(s.trim()); }
            catch (NumberFormatException ignore) { out.println("Please enter a number."); }
        }
    }

    /** Null once stdin is exhausted. */
    private String readLine(String prompt) {
        out.print(prompt);
        return sc.hasNextLine() ? sc.nextLine() : null;
    }
}
