package tmengine;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class RunHistoryTest {
    @Test
    void testEntriesAreNumberedInOrder() {
        final var history = new RunHistory();
        assertThat(history.isEmpty()).isTrue();
        final var limits = new RunLimits(50, 500);
        history.add("anbn", "0011", limits, Runner.run(Machines.anbn(), "0011", limits));
        history.add("anbn", "010", limits, Runner.run(Machines.anbn(), "010", limits));

        final var all = history.all();
        assertThat(all).hasSize(2);
        assertThat(all.get(0).runNo).isEqualTo(1);
        assertThat(all.get(0).verdict).isEqualTo(Outcome.Verdict.ACCEPTED);
        assertThat(all.get(0).depth).isEqualTo(9);
        assertThat(all.get(0).maxDepth).isEqualTo(50);
        assertThat(all.get(1).runNo).isEqualTo(2);
        assertThat(all.get(1).summary).isEqualTo("String rejected in 5 transitions.");
        assertThat(all.get(1).formatLine()).contains("input=\"010\"").endsWith("String rejected in 5 transitions.");
    }

    @Test
    void testAllIsASnapshot() {
        final var history = new RunHistory();
        final var before = history.all();
        history.add("m", "", RunLimits.defaults(), Runner.run(Machines.anbn(), "", RunLimits.defaults()));
        assertThat(before).isEmpty();
        assertThat(history.all()).hasSize(1);
    }
}
