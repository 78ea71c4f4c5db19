package tmengine;

import java.util.ArrayList;
import java.util.List;

/** Renders outcomes as plain text, one line per list element. */
public final class TraceReporter {

    private TraceReporter() {}

    public static String render(Outcome outcome) {
        return String.join(System.lineSeparator(), lines(outcome));
    }

    public static List<String> lines(Outcome outcome) {
        List<String> out = new ArrayList<>();
        out.add(summary(outcome));
        switch (outcome.verdict) {
            case ACCEPTED -> {
                for (int level = 0; level <= outcome.depth; level++) {
                    for (Configuration c : outcome.tree.level(level)) {
                        out.add("Level " + level + ": " + c);
                    }
                }
                // the root is not counted as explored
                out.add("Configurations explored: " + (outcome.tree.countUpTo(outcome.depth) - 1));
            }
            case REJECTED -> out.add("Reason: " + outcome.rejectionCause.description + ".");
            case EXHAUSTED -> out.add("Levels explored: " + outcome.tree.size()
                    + ", transitions applied: " + outcome.transitions + ".");
        }
        return out;
    }

    /** First line of the report. */
    public static String summary(Outcome outcome) {
        return switch (outcome.verdict) {
            case ACCEPTED -> "String accepted in " + outcome.depth + " transitions.";
            case REJECTED -> "String rejected in " + outcome.depth + " transitions.";
            case EXHAUSTED -> switch (outcome.exhaustionReason) {
                case TRANSITION_BUDGET_EXCEEDED -> "Execution stopped after " + outcome.limit + " transitions.";
                case MAX_DEPTH_REACHED -> "Execution stopped after reaching max depth of " + outcome.limit + ".";
                case NO_VALID_PATHS -> "No valid paths found. Machine halted. Levels explored: " + outcome.tree.size();
            };
        };
    }
}
