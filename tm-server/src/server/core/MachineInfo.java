package server.core;

import java.util.List;

public record MachineInfo(String id, String name, List<String> states,
                          String startState, String acceptState, String rejectState,
                          int transitions) {}
