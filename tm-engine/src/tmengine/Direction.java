package tmengine;

import java.util.Locale;

public enum Direction {
    LEFT("L"), RIGHT("R");

    private final String code;

    Direction(String code) { this.code = code; }

    public String code() { return code; }

    /** Accepts "L" / "R" in any case. */
    public static Direction parse(String token) {
        if (token == null) throw new IllegalArgumentException("Missing direction");
        String t = token.trim().toUpperCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.code.equals(t)) return d;
        }
        throw new IllegalArgumentException("Bad direction: " + token.trim() + " (expected L or R)");
    }

    @Override public String toString() { return code; }
}
