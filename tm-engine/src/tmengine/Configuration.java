package tmengine;

import java.util.*;

/**
 * One point of the search: tape left of the head, current state, tape from the head rightwards.
 * The head reads the first cell of the right tape; an empty right tape reads as {@link #BLANK}.
 * Instances never change, sibling branches share their parent.
 */
public final class Configuration {

    public static final String BLANK = "_";

    private final List<String> left;
    private final String state;
    private final List<String> right;

    private Configuration(List<String> left, String state, List<String> right) {
        this.left = left;
        this.state = state;
        this.right = right;
    }

    public static Configuration of(List<String> left, String state, List<String> right) {
        return new Configuration(List.copyOf(left), Objects.requireNonNull(state, "state"), List.copyOf(right));
    }

    /** Root configuration: empty left tape, head on the first input symbol. */
    public static Configuration initial(String startState, String input) {
        return of(List.of(), startState, symbolsOf(input));
    }

    /** Splits a tape string into one symbol per code point. */
    public static List<String> symbolsOf(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> out.add(new String(Character.toChars(cp))));
        return out;
    }

    public String state() { return state; }
    public List<String> leftTape() { return left; }
    public List<String> rightTape() { return right; }

    public String headSymbol() {
        return right.isEmpty() ? BLANK : right.get(0);
    }

    public Configuration withState(String newState) {
        return new Configuration(left, Objects.requireNonNull(newState, "state"), right);
    }

    /** Writes at the head, shifts the head one cell, enters the move's state. */
    public Configuration apply(Transition t) {
        Deque<String> l = new ArrayDeque<>(left);
        Deque<String> r = new ArrayDeque<>(right);

        if (!r.isEmpty()) r.pollFirst();
        r.addFirst(t.write());

        switch (t.direction()) {
            case LEFT -> r.addFirst(l.isEmpty() ? BLANK : l.pollLast());
            case RIGHT -> {
                l.addLast(r.pollFirst());
                if (r.isEmpty()) r.addLast(BLANK);
            }
        }
        return new Configuration(List.copyOf(l), t.toState(), List.copyOf(r));
    }

    public String leftString() { return String.join("", left); }
    public String rightString() { return String.join("", right); }

    /** Rendered as {@code [left, state, right]}. */
    @Override public String toString() {
        return "[" + leftString() + ", " + state + ", " + rightString() + "]";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration c)) return false;
        return state.equals(c.state) && left.equals(c.left) && right.equals(c.right);
    }

    @Override public int hashCode() { return Objects.hash(left, state, right); }
}
