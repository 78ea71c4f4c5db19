package tmengine;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class ExplorerTest {
    @Test
    void testInitialSnapshot() {
        final var explorer = new Explorer(Machines.anbn(), "0011", RunLimits.defaults());
        final var s = explorer.snapshot();
        assertThat(s.level).isZero();
        assertThat(s.transitions).isZero();
        assertThat(s.width).isEqualTo(1);
        assertThat(s.halted).isFalse();
        assertThat(s.outcome).isNull();
        assertThat(explorer.outcome()).isEmpty();
    }

    @Test
    void testEachStepAddsOneLevel() {
        final var explorer = new Explorer(Machines.containsBb(), "abba", RunLimits.defaults());
        assertThat(explorer.step().level).isEqualTo(1);
        final var s = explorer.step();
        assertThat(s.level).isEqualTo(2);
        assertThat(s.width).isEqualTo(2);
        assertThat(s.transitions).isEqualTo(2);
        assertThat(s.halted).isFalse();
    }

    @Test
    void testAcceptanceIsDetectedWhenScanningTheLevel() {
        final var explorer = new Explorer(Machines.containsBb(), "abba", RunLimits.defaults());
        explorer.step();
        explorer.step();
        explorer.step();
        assertThat(explorer.halted()).isFalse();
        final var s = explorer.step();
        assertThat(s.halted).isTrue();
        assertThat(s.level).isEqualTo(3);
        assertThat(s.outcome.isAccepted()).isTrue();
        assertThat(explorer.tree().size()).isEqualTo(4);
    }

    @Test
    void testStepAfterHaltIsStable() {
        final var explorer = new Explorer(Machines.noMoves(), "0", RunLimits.defaults());
        final var halted = explorer.step();
        assertThat(halted.halted).isTrue();
        final var again = explorer.step();
        assertThat(again.halted).isTrue();
        assertThat(again.outcome).isSameAs(halted.outcome);
        assertThat(again.level).isEqualTo(halted.level);
        assertThat(again.transitions).isEqualTo(halted.transitions);
    }

    @Test
    void testSteppingMatchesOneShotRun() {
        final var machine = Machines.anbn();
        final var explorer = new Explorer(machine, "000111", RunLimits.defaults());
        int steps = 0;
        while (!explorer.step().halted) steps++;
        final var stepped = explorer.outcome().orElseThrow();
        final var oneShot = Runner.run(machine, "000111", RunLimits.defaults());
        assertThat(stepped.verdict).isEqualTo(oneShot.verdict);
        assertThat(stepped.depth).isEqualTo(oneShot.depth);
        assertThat(stepped.transitions).isEqualTo(oneShot.transitions);
        assertThat(steps).isEqualTo(oneShot.depth);
    }

    @Test
    void testResumeReturnsOutcome() {
        final var explorer = new Explorer(Machines.anbn(), "01", RunLimits.defaults());
        final var outcome = explorer.resume();
        assertThat(outcome.isAccepted()).isTrue();
        assertThat(explorer.resume()).isSameAs(outcome);
    }

    @Test
    void testSharedTableAcrossRuns() {
        final var machine = Machines.containsBb();
        final var table = TransitionTable.of(machine);
        assertThat(Runner.run(machine, table, "bb", RunLimits.defaults()).isAccepted()).isTrue();
        assertThat(Runner.run(machine, table, "ab", RunLimits.defaults()).isRejected()).isTrue();
    }

    @Test
    void testNullMachineIsRejectedBeforeBuildingTable() {
        assertThat(catchThrowable(() -> new Explorer(null, "0", RunLimits.defaults())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Machine is null");
    }
}
