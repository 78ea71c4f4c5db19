package server.core;

import tmengine.MachineDefinition;
import tmengine.TransitionTable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Uploaded machines keyed by a generated id; each keeps its prebuilt transition table. */
public final class MachineStore {

    private static final MachineStore INSTANCE = new MachineStore();
    public static MachineStore get() { return INSTANCE; }

    public static final class Stored {
        public final String id;
        public final MachineDefinition machine;
        public final TransitionTable table;
        public final long uploadedAt;
        Stored(String id, MachineDefinition machine, long uploadedAt) {
            this.id = id;
            this.machine = machine;
            this.table = TransitionTable.of(machine);
            this.uploadedAt = uploadedAt;
        }
    }

    private final Map<String, Stored> byId = new ConcurrentHashMap<>();

    public MachineStore() {}

    public Stored put(MachineDefinition m) {
        Stored s = new Stored(UUID.randomUUID().toString(), Objects.requireNonNull(m, "machine"),
                System.currentTimeMillis());
        byId.put(s.id, s);
        return s;
    }

    /** Null when no machine has that id. */
    public Stored find(String id) {
        return id == null ? null : byId.get(id);
    }

    /** Oldest upload first. */
    public List<Stored> list() {
        List<Stored> out = new ArrayList<>(byId.values());
        out.sort(Comparator.comparingLong((Stored s) -> s.uploadedAt).thenComparing(s -> s.id));
        return out;
    }
}
