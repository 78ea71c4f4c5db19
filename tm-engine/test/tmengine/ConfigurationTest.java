package tmengine;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConfigurationTest {
    private static Configuration abcd() {
        return Configuration.of(List.of("a", "b"), "q", List.of("c", "d"));
    }

    @Test
    void testInitialSplitsInputIntoSymbols() {
        final var c = Configuration.initial("q0", "0011");
        assertThat(c.leftTape()).isEmpty();
        assertThat(c.state()).isEqualTo("q0");
        assertThat(c.rightTape()).containsExactly("0", "0", "1", "1");
        assertThat(c.headSymbol()).isEqualTo("0");
    }

    @Test
    void testEmptyRightTapeReadsBlank() {
        final var c = Configuration.initial("q0", "");
        assertThat(c.rightTape()).isEmpty();
        assertThat(c.headSymbol()).isEqualTo(Configuration.BLANK);
    }

    @Test
    void testWriteAndMoveRight() {
        final var next = abcd().apply(new Transition("p", "X", Direction.RIGHT));
        assertThat(next.leftTape()).containsExactly("a", "b", "X");
        assertThat(next.rightTape()).containsExactly("d");
        assertThat(next.state()).isEqualTo("p");
    }

    @Test
    void testWriteAndMoveLeft() {
        final var next = abcd().apply(new Transition("p", "X", Direction.LEFT));
        assertThat(next.leftTape()).containsExactly("a");
        assertThat(next.rightTape()).containsExactly("b", "X", "d");
    }

    @Test
    void testMoveLeftOffMaterializedTapeInsertsBlank() {
        final var c = Configuration.initial("q", "1");
        final var next = c.apply(new Transition("q", "0", Direction.LEFT));
        assertThat(next.leftTape()).isEmpty();
        assertThat(next.rightTape()).containsExactly("_", "0");
        assertThat(next.headSymbol()).isEqualTo("_");
    }

    @Test
    void testMoveRightPastEndAppendsBlank() {
        final var c = Configuration.initial("q", "");
        final var next = c.apply(new Transition("q", "1", Direction.RIGHT));
        assertThat(next.leftTape()).containsExactly("1");
        assertThat(next.rightTape()).containsExactly("_");
        assertThat(next.headSymbol()).isEqualTo("_");
    }

    @Test
    void testLeftThenRightRestoresTapeExceptWrittenCell() {
        final var start = abcd();
        final var back = start
                .apply(new Transition("q", "X", Direction.LEFT))
                .apply(new Transition("q", "b", Direction.RIGHT));
        assertThat(back.leftTape()).isEqualTo(start.leftTape());
        assertThat(back.rightTape()).containsExactly("X", "d");
    }

    @Test
    void testRightThenLeftRestoresTapeExceptWrittenCell() {
        final var start = abcd();
        final var back = start
                .apply(new Transition("q", "X", Direction.RIGHT))
                .apply(new Transition("q", "d", Direction.LEFT));
        assertThat(back.leftTape()).isEqualTo(start.leftTape());
        assertThat(back.rightTape()).containsExactly("X", "d");
    }

    @Test
    void testApplyNeverMutatesParent() {
        final var parent = abcd();
        parent.apply(new Transition("p", "X", Direction.RIGHT));
        parent.apply(new Transition("p", "Y", Direction.LEFT));
        assertThat(parent).isEqualTo(abcd());
        assertThat(catchThrowable(() -> parent.rightTape().add("e")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testWithStateKeepsTapes() {
        final var r = abcd().withState("qrej");
        assertThat(r.state()).isEqualTo("qrej");
        assertThat(r.leftTape()).isEqualTo(abcd().leftTape());
        assertThat(r.rightTape()).isEqualTo(abcd().rightTape());
    }

    @Test
    void testToString() {
        assertThat(abcd().toString()).isEqualTo("[ab, q, cd]");
        assertThat(Configuration.initial("q0", "").toString()).isEqualTo("[, q0, ]");
    }
}
