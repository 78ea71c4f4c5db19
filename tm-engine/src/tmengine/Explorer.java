package tmengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Breadth-first exploration of one run, one level per {@link #step()}.
 * Owns the configuration tree and the transition counter of that run; not thread-safe.
 */
public final class Explorer {

    private static final Logger log = LoggerFactory.getLogger(Explorer.class);

    public static final class Snapshot {
        public final int level;
        public final int transitions;
        public final int width;
        public final boolean halted;
        public final Outcome outcome;
        Snapshot(int level, int transitions, int width, boolean halted, Outcome outcome) {
            this.level = level; this.transitions = transitions; this.width = width;
            this.halted = halted; this.outcome = outcome;
        }
    }

    private final MachineDefinition machine;
    private final TransitionTable table;
    private final RunLimits limits;
    private final ConfigurationTree tree;

    private int transitions = 0;
    private Outcome outcome = null;

    public Explorer(MachineDefinition machine, String input, RunLimits limits) {
        this(machine, tableFor(machine), input, limits);
    }

    private static TransitionTable tableFor(MachineDefinition machine) {
        if (machine == null) throw new IllegalArgumentException("Machine is null");
        return TransitionTable.of(machine);
    }

    public Explorer(MachineDefinition machine, TransitionTable table, String input, RunLimits limits) {
        if (machine == null) throw new IllegalArgumentException("Machine is null");
        if (input == null) throw new IllegalArgumentException("Input is null");
        this.machine = machine;
        this.table = Objects.requireNonNull(table, "table");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.tree = new ConfigurationTree(Configuration.initial(machine.startState, input));
    }

    public MachineDefinition machine() { return machine; }
    public RunLimits limits() { return limits; }
    public ConfigurationTree tree() { return tree; }
    public boolean halted() { return outcome != null; }
    public Optional<Outcome> outcome() { return Optional.ofNullable(outcome); }

    public Snapshot snapshot() {
        return new Snapshot(tree.lastIndex(), transitions, tree.lastLevel().size(), halted(), outcome);
    }

    /** Expands the last level. Once halted, returns the same halted snapshot. */
    public Snapshot step() {
        if (halted()) return snapshot();

        if (transitions >= limits.maxTransitions()) {
            return halt(Outcome.exhausted(ExhaustionReason.NO_VALID_PATHS, limits.maxTransitions(), tree, transitions));
        }

        int levelIndex = tree.lastIndex();
        List<Configuration> next = new ArrayList<>();

        for (Configuration c : tree.lastLevel()) {
            if (c.state().equals(machine.acceptState)) {
                // siblings already queued for the next level are dropped
                return halt(Outcome.accepted(levelIndex, tree, transitions));
            }
            if (c.state().equals(machine.rejectState)) continue;

            String head = c.headSymbol();
            transitions++;
            if (transitions > limits.maxTransitions()) {
                // the move that crossed the budget is never applied
                transitions = limits.maxTransitions();
                return halt(Outcome.exhausted(ExhaustionReason.TRANSITION_BUDGET_EXCEEDED,
                        limits.maxTransitions(), tree, transitions));
            }

            List<Transition> moves = table.lookup(c.state(), head);
            if (moves.isEmpty()) {
                next.add(c.withState(machine.rejectState));
                continue;
            }
            for (Transition t : moves) next.add(c.apply(t));
        }

        if (next.isEmpty()) {
            return halt(Outcome.rejected(levelIndex, RejectionCause.NO_SUCCESSORS, tree, transitions));
        }
        tree.append(next);
        log.debug("Level {}: {} configurations, {} transitions so far", tree.lastIndex(), next.size(), transitions);

        if (allRejecting(next)) {
            return halt(Outcome.rejected(tree.lastIndex(), RejectionCause.ALL_BRANCHES_REJECTED, tree, transitions));
        }
        if (tree.size() > limits.maxDepth()) {
            return halt(Outcome.exhausted(ExhaustionReason.MAX_DEPTH_REACHED, limits.maxDepth(), tree, transitions));
        }
        return snapshot();
    }

    /** Steps until halted. */
    public Outcome resume() {
        while (!halted()) step();
        return outcome;
    }

    private boolean allRejecting(List<Configuration> level) {
        for (Configuration c : level) {
            if (!c.state().equals(machine.rejectState)) return false;
        }
        return true;
    }

    private Snapshot halt(Outcome o) {
        outcome = o;
        log.debug("Run of '{}' halted: {} after {} transitions", machine.name, o, transitions);
        return snapshot();
    }
}
