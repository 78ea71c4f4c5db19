package tmengine;

public enum ExhaustionReason {
    TRANSITION_BUDGET_EXCEEDED("transition budget exceeded"),
    MAX_DEPTH_REACHED("max depth reached"),
    NO_VALID_PATHS("no valid paths / transition budget reached");

    public final String description;

    ExhaustionReason(String description) { this.description = description; }
}
