package tmengine;

/** Why a run ended in rejection; the two causes stay distinct. */
public enum RejectionCause {
    NO_SUCCESSORS("no configuration on the frontier produced a successor"),
    ALL_BRANCHES_REJECTED("every branch reached the reject state");

    public final String description;

    RejectionCause(String description) { this.description = description; }
}
