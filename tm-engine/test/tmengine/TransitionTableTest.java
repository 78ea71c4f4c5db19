package tmengine;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TransitionTableTest {
    @Test
    void testLookupKeepsRowOrder() {
        final var table = TransitionTable.of(Machines.containsBb());
        assertThat(table.lookup("q0", "b")).containsExactly(
                new Transition("q0", "b", Direction.RIGHT),
                new Transition("q1", "b", Direction.RIGHT));
    }

    @Test
    void testAbsentKeyIsEmptyNotError() {
        final var table = TransitionTable.of(Machines.containsBb());
        assertThat(table.lookup("q1", "a")).isEmpty();
        assertThat(table.lookup("nowhere", "b")).isEmpty();
    }

    @Test
    void testSizeAndKeys() {
        final var table = TransitionTable.of(Machines.containsBb());
        assertThat(table.size()).isEqualTo(5);
        assertThat(table.keys()).isEqualTo(4);
    }

    @Test
    void testEmptyTable() {
        final var table = TransitionTable.of(List.of());
        assertThat(table.size()).isZero();
        assertThat(table.lookup("q0", "0")).isEmpty();
    }

    @Test
    void testLookupResultIsImmutable() {
        final var table = TransitionTable.of(Machines.anbn());
        final var moves = table.lookup("q0", "0");
        assertThat(catchThrowable(() -> moves.add(new Transition("q0", "0", Direction.LEFT))))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
