package tmengine;

import java.util.*;

public final class MachineDefinition {

    public final String name;
    public final Set<String> states;
    public final Set<String> inputAlphabet;
    public final Set<String> tapeAlphabet;
    public final String startState;
    public final String acceptState;
    public final String rejectState;
    public final List<TransitionRow> transitions;

    public MachineDefinition(String name,
                             Collection<String> states,
                             Collection<String> inputAlphabet,
                             Collection<String> tapeAlphabet,
                             String startState,
                             String acceptState,
                             String rejectState,
                             List<TransitionRow> transitions) {
        this.name = (name == null || name.isBlank()) ? "(unnamed)" : name;
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.inputAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(inputAlphabet));
        this.tapeAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(tapeAlphabet));
        this.startState = Objects.requireNonNull(startState, "startState");
        this.acceptState = Objects.requireNonNull(acceptState, "acceptState");
        this.rejectState = Objects.requireNonNull(rejectState, "rejectState");
        this.transitions = List.copyOf(transitions);
    }

    public boolean isHalting(String state) {
        return acceptState.equals(state) || rejectState.equals(state);
    }

    /** Human-readable listing used by the console "show machine" command. */
    public List<String> describe() {
        List<String> out = new ArrayList<>();
        out.add("Machine: " + name);
        out.add("States: " + String.join(", ", states));
        out.add("Input alphabet: " + String.join(", ", inputAlphabet));
        out.add("Tape alphabet: " + String.join(", ", tapeAlphabet));
        out.add("Start: " + startState + "  |  Accept: " + acceptState + "  |  Reject: " + rejectState);
        out.add("Transitions (" + transitions.size() + "):");
        int i = 1;
        for (TransitionRow row : transitions) out.add("  " + row.formatLine(i++));
        return out;
    }

    @Override public String toString() {
        return "MachineDefinition[" + name + ", " + states.size() + " states, "
                + transitions.size() + " transitions]";
    }
}
