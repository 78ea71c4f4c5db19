package server.core;

import tmengine.RunLimits;

import java.util.List;

/** What the servlets may ask of the engine. One instance is shared through the servlet context. */
public interface EngineFacade {
    MachineInfo loadMachine(String csvText);
    List<MachineInfo> machines();

    RunResult run(String machineId, String input, RunLimits limits);

    DebugState startDebug(String machineId, String input, RunLimits limits);
    DebugState status(String runId);
    DebugState step(String runId);
    DebugState resume(String runId);
    /** Releases the session. Later calls for the same id answer as for an unknown id. */
    DebugState stop(String runId);

    List<HistoryRow> history();

    record RunResult(String machineId, String verdict, int depth, int transitions,
                     String summary, List<String> report, List<List<String>> levels) {}

    /** {@code verdict} and {@code summary} stay null until the session halts. */
    record DebugState(String runId, int level, int transitions, int width, boolean halted,
                      String verdict, String summary, List<String> frontier) {}

    record HistoryRow(int runNo, String machine, String input, int maxDepth, int maxTransitions,
                      String verdict, int depth, int transitions, String summary) {}
}
