package tmengine;

/** A decoded transition row: (currentState, readSymbol) -> (newState, writeSymbol, direction). */
public record TransitionRow(String currentState, String readSymbol,
                            String newState, String writeSymbol, Direction direction) {

    public Transition move() { return new Transition(newState, writeSymbol, direction); }

    public String formatLine(int number) {
        return String.format("#%d  d(%s, %s) -> (%s, %s, %s)",
                number, currentState, readSymbol, newState, writeSymbol, direction);
    }
}
