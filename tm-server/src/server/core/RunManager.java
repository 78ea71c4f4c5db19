package server.core;

import tmengine.Explorer;
import tmengine.Outcome;
import tmengine.RunHistory;
import tmengine.RunLimits;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps live debug sessions and the shared run history. */
public final class RunManager {

    /** A debug run. Callers step the explorer only while holding the session's monitor. */
    public static final class Session {
        public final String id;
        public final String machineName;
        public final String input;
        public final Explorer explorer;
        private boolean recorded = false;
        Session(String id, String machineName, String input, Explorer explorer) {
            this.id = id; this.machineName = machineName; this.input = input; this.explorer = explorer;
        }
    }

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final RunHistory history = new RunHistory();

    public Session register(String machineName, String input, Explorer explorer) {
        Session s = new Session(UUID.randomUUID().toString(), machineName, input, explorer);
        sessions.put(s.id, s);
        return s;
    }

    /** Null for unknown ids. */
    public Session find(String runId) {
        return runId == null ? null : sessions.get(runId);
    }

    /** Forgets the session; returns it, or null when the id was unknown. */
    public Session stop(String runId) {
        return runId == null ? null : sessions.remove(runId);
    }

    public RunHistory.Entry record(String machineName, String input, RunLimits limits, Outcome outcome) {
        return history.add(machineName, input, limits, outcome);
    }

    /** Records a halted session once; later calls are no-ops. Call with the session's monitor held. */
    public void recordIfHalted(Session s) {
        if (s.recorded || !s.explorer.halted()) return;
        history.add(s.machineName, s.input, s.explorer.limits(), s.explorer.outcome().orElseThrow());
        s.recorded = true;
    }

    public List<RunHistory.Entry> history() { return history.all(); }
}
