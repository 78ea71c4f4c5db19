package tmengine;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class TraceReporterTest {
    @Test
    void testAcceptedListsEveryLevelUpToAcceptance() {
        final var outcome = Runner.run(Machines.containsBb(), "abba", 100, 1000);
        assertThat(TraceReporter.lines(outcome)).containsExactly(
                "String accepted in 3 transitions.",
                "Level 0: [, q0, abba]",
                "Level 1: [a, q0, bba]",
                "Level 2: [ab, q0, ba]",
                "Level 2: [ab, q1, ba]",
                "Level 3: [abb, q0, a]",
                "Level 3: [abb, q1, a]",
                "Level 3: [abb, qacc, a]",
                "Configurations explored: 6");
    }

    @Test
    void testAcceptedAtDepthZero() {
        final var machine = MachineParser.parseFromText("m\nqa,qr\n\n_\nqa\nqa\nqr\n");
        final var lines = TraceReporter.lines(Runner.run(machine, "", 10, 10));
        assertThat(lines).containsExactly(
                "String accepted in 0 transitions.",
                "Level 0: [, qa, ]",
                "Configurations explored: 0");
    }

    @Test
    void testRejected() {
        final var outcome = Runner.run(Machines.containsBb(), "abab", 100, 1000);
        assertThat(TraceReporter.lines(outcome)).containsExactly(
                "String rejected in 5 transitions.",
                "Reason: every branch reached the reject state.");
    }

    @Test
    void testExhaustedByDepth() {
        final var outcome = Runner.run(Machines.blankWalker(), "", 3, 1000);
        assertThat(TraceReporter.lines(outcome)).containsExactly(
                "Execution stopped after reaching max depth of 3.",
                "Levels explored: 4, transitions applied: 7.");
    }

    @Test
    void testExhaustedByBudget() {
        final var outcome = Runner.run(Machines.containsBb(), "bbbbbb", 100, 2);
        assertThat(TraceReporter.summary(outcome)).isEqualTo("Execution stopped after 2 transitions.");
    }

    @Test
    void testExhaustedWithoutValidPaths() {
        final var outcome = Runner.run(Machines.anbn(), "0011", 100, 0);
        assertThat(TraceReporter.summary(outcome)).isEqualTo("No valid paths found. Machine halted. Levels explored: 1");
    }

    @Test
    void testBudgetSpentAtLevelBoundaryHasNoValidPaths() {
        final var outcome = Runner.run(Machines.containsBb(), "abba", 100, 2);
        assertThat(TraceReporter.lines(outcome)).containsExactly(
                "No valid paths found. Machine halted. Levels explored: 3",
                "Levels explored: 3, transitions applied: 2.");
    }

    @Test
    void testRenderJoinsLines() {
        final var outcome = Runner.run(Machines.noMoves(), "1", 100, 1000);
        assertThat(TraceReporter.render(outcome)).isEqualTo(
                "String rejected in 1 transitions." + System.lineSeparator()
                        + "Reason: every branch reached the reject state.");
    }
}
