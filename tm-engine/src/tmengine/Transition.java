package tmengine;

/** One move of the transition relation: next state, symbol written, head direction. */
public record Transition(String toState, String write, Direction direction) {

    public Transition {
        if (toState == null || write == null || direction == null) {
            throw new IllegalArgumentException("Transition fields must not be null");
        }
    }

    @Override public String toString() {
        return "(" + toState + ", " + write + ", " + direction + ")";
    }
}
