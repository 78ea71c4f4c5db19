package tmengine;

public final class Runner {

    private Runner() {}

    /** Explores the machine breadth-first on the given input until it accepts, rejects or runs out of budget. */
    public static Outcome run(MachineDefinition machine, String input, int maxDepth, int maxTransitions) {
        return run(machine, input, new RunLimits(maxDepth, maxTransitions));
    }

    public static Outcome run(MachineDefinition machine, String input, RunLimits limits) {
        return new Explorer(machine, input, limits).resume();
    }

    public static Outcome run(MachineDefinition machine, TransitionTable table, String input, RunLimits limits) {
        return new Explorer(machine, table, input, limits).resume();
    }

    /** Runs and renders the textual report. */
    public static String report(MachineDefinition machine, String input, int maxDepth, int maxTransitions) {
        return TraceReporter.render(run(machine, input, maxDepth, maxTransitions));
    }
}
