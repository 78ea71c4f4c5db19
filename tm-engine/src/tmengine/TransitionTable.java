package tmengine;

import java.util.*;

/**
 * Immutable (state, symbol) -> moves lookup, built once per machine.
 * Moves for a key keep the order of their rows in the definition.
 */
public final class TransitionTable {

    private final Map<Key, List<Transition>> moves;
    private final int size;

    private TransitionTable(Map<Key, List<Transition>> moves, int size) {
        this.moves = moves;
        this.size = size;
    }

    public static TransitionTable of(MachineDefinition definition) {
        return of(definition.transitions);
    }

    public static TransitionTable of(List<TransitionRow> rows) {
        Map<Key, List<Transition>> building = new HashMap<>();
        for (TransitionRow row : rows) {
            building.computeIfAbsent(new Key(row.currentState(), row.readSymbol()), k -> new ArrayList<>())
                    .add(row.move());
        }
        Map<Key, List<Transition>> frozen = new HashMap<>();
        for (var e : building.entrySet()) frozen.put(e.getKey(), List.copyOf(e.getValue()));
        return new TransitionTable(Collections.unmodifiableMap(frozen), rows.size());
    }

    /** Empty when no move is defined for the pair. */
    public List<Transition> lookup(String state, String symbol) {
        return moves.getOrDefault(new Key(state, symbol), List.of());
    }

    public int size() { return size; }

    public int keys() { return moves.size(); }

    private record Key(String state, String symbol) {}
}
