package tmengine;

import java.util.*;

/** Append-only list of BFS levels; level i holds everything reachable in exactly i moves. */
public final class ConfigurationTree {

    private final List<List<Configuration>> levels = new ArrayList<>();

    public ConfigurationTree(Configuration root) {
        levels.add(List.of(Objects.requireNonNull(root, "root")));
    }

    void append(List<Configuration> level) {
        if (level.isEmpty()) throw new IllegalArgumentException("Cannot append an empty level");
        levels.add(List.copyOf(level));
    }

    /** Number of levels, i.e. last level index + 1. */
    public int size() { return levels.size(); }

    public int lastIndex() { return levels.size() - 1; }

    public List<Configuration> level(int index) { return levels.get(index); }

    public List<Configuration> lastLevel() { return levels.get(levels.size() - 1); }

    public List<List<Configuration>> levels() { return Collections.unmodifiableList(levels); }

    /** Total configurations in levels 0..upTo inclusive. */
    public int countUpTo(int upTo) {
        int n = 0;
        for (int i = 0; i <= upTo && i < levels.size(); i++) n += levels.get(i).size();
        return n;
    }
}
