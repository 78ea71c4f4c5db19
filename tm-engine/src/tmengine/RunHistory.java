package tmengine;

import java.util.*;

public final class RunHistory {
    public static final class Entry {
        public final int runNo;
        public final String machine;
        public final String input;
        public final int maxDepth;
        public final int maxTransitions;
        public final Outcome.Verdict verdict;
        public final int depth;
        public final int transitions;
        public final String summary;
        Entry(int runNo, String machine, String input, RunLimits limits, Outcome outcome) {
            this.runNo = runNo; this.machine = machine; this.input = input;
            this.maxDepth = limits.maxDepth(); this.maxTransitions = limits.maxTransitions();
            this.verdict = outcome.verdict; this.depth = outcome.depth; this.transitions = outcome.transitions;
            this.summary = TraceReporter.summary(outcome);
        }

        public String formatLine() {
            return String.format("#%d %-12s input=\"%s\" depth<=%d budget=%d -> %s",
                    runNo, machine, input, maxDepth, maxTransitions, summary);
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public synchronized Entry add(String machine, String input, RunLimits limits, Outcome outcome) {
        Entry e = new Entry(entries.size() + 1, machine, input, limits, outcome);
        entries.add(e);
        return e;
    }

    public synchronized List<Entry> all() { return List.copyOf(entries); }

    public synchronized boolean isEmpty() { return entries.isEmpty(); }
}
