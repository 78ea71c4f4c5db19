package server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tmengine.*;

import java.util.*;

public final class EngineFacadeImpl implements EngineFacade {

    private static final Logger log = LoggerFactory.getLogger(EngineFacadeImpl.class);

    private final MachineStore machines;
    private final RunManager runs;

    public EngineFacadeImpl(MachineStore machines, RunManager runs) {
        this.machines = machines;
        this.runs = runs;
    }

    @Override
    public MachineInfo loadMachine(String csvText) {
        if (csvText == null || csvText.isBlank()) {
            throw new IllegalArgumentException("Missing machine CSV");
        }
        MachineStore.Stored s = machines.put(MachineParser.parseFromText(csvText));
        log.info("Stored machine '{}' as {} ({} transitions)", s.machine.name, s.id, s.machine.transitions.size());
        return toInfo(s);
    }

    @Override
    public List<MachineInfo> machines() {
        List<MachineInfo> out = new ArrayList<>();
        for (MachineStore.Stored s : machines.list()) out.add(toInfo(s));
        return out;
    }

    @Override
    public RunResult run(String machineId, String input, RunLimits limits) {
        MachineStore.Stored s = requireMachine(machineId);
        String in = input == null ? "" : input;

        Outcome o = Runner.run(s.machine, s.table, in, limits);
        runs.record(s.machine.name, in, limits, o);
        log.info("Run of '{}' on \"{}\": {}", s.machine.name, in, o);

        List<List<String>> levels = new ArrayList<>(o.tree.size());
        for (List<Configuration> level : o.tree.levels()) levels.add(render(level));

        return new RunResult(s.id, o.verdict.name(), o.depth, o.transitions,
                TraceReporter.summary(o), TraceReporter.lines(o), levels);
    }

    @Override
    public DebugState startDebug(String machineId, String input, RunLimits limits) {
        MachineStore.Stored s = requireMachine(machineId);
        String in = input == null ? "" : input;
        Explorer explorer = new Explorer(s.machine, s.table, in, limits);
        RunManager.Session session = runs.register(s.machine.name, in, explorer);
        log.debug("Debug session {} started for '{}'", session.id, s.machine.name);
        synchronized (session) {
            return toState(session);
        }
    }

    @Override
    public DebugState status(String runId) {
        RunManager.Session s = runs.find(runId);
        if (s == null) return unknown(runId);
        synchronized (s) {
            return toState(s);
        }
    }

    @Override
    public DebugState step(String runId) {
        RunManager.Session s = runs.find(runId);
        if (s == null) return unknown(runId);
        synchronized (s) {
            s.explorer.step();
            runs.recordIfHalted(s);
            return toState(s);
        }
    }

    @Override
    public DebugState resume(String runId) {
        RunManager.Session s = runs.find(runId);
        if (s == null) return unknown(runId);
        synchronized (s) {
            s.explorer.resume();
            runs.recordIfHalted(s);
            return toState(s);
        }
    }

    @Override
    public DebugState stop(String runId) {
        RunManager.Session s = runs.stop(runId);
        if (s == null) return unknown(runId);
        synchronized (s) {
            DebugState last = toState(s);
            log.debug("Debug session {} stopped at level {}", runId, last.level());
            return new DebugState(last.runId(), last.level(), last.transitions(), last.width(), true,
                    last.verdict(), last.summary(), last.frontier());
        }
    }

    @Override
    public List<HistoryRow> history() {
        List<HistoryRow> out = new ArrayList<>();
        for (RunHistory.Entry e : runs.history()) {
            out.add(new HistoryRow(e.runNo, e.machine, e.input, e.maxDepth, e.maxTransitions,
                    e.verdict.name(), e.depth, e.transitions, e.summary));
        }
        return out;
    }

    // ---------- Small helpers ----------

    private MachineStore.Stored requireMachine(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Missing machineId");
        MachineStore.Stored s = machines.find(id);
        if (s == null) throw new IllegalArgumentException("Unknown machine: " + id);
        return s;
    }

    private static MachineInfo toInfo(MachineStore.Stored s) {
        MachineDefinition m = s.machine;
        return new MachineInfo(s.id, m.name, new ArrayList<>(m.states),
                m.startState, m.acceptState, m.rejectState, m.transitions.size());
    }

    private static DebugState toState(RunManager.Session s) {
        Explorer.Snapshot snap = s.explorer.snapshot();
        Outcome o = snap.outcome;
        return new DebugState(s.id, snap.level, snap.transitions, snap.width, snap.halted,
                o == null ? null : o.verdict.name(),
                o == null ? null : TraceReporter.summary(o),
                render(s.explorer.tree().lastLevel()));
    }

    private static DebugState unknown(String runId) {
        return new DebugState(runId, -1, 0, 0, true, null, null, List.of());
    }

    private static List<String> render(List<Configuration> level) {
        List<String> out = new ArrayList<>(level.size());
        for (Configuration c : level) out.add(c.toString());
        return out;
    }
}
