package tmengine;

import java.util.Objects;

/**
 * Terminal result of a run. Exactly one of {@link RejectionCause} / {@link ExhaustionReason}
 * is set for REJECTED / EXHAUSTED; both are null for ACCEPTED.
 */
public final class Outcome {

    public enum Verdict { ACCEPTED, REJECTED, EXHAUSTED }

    public final Verdict verdict;
    /** Level index of acceptance or rejection; last level index for exhaustion. */
    public final int depth;
    public final ConfigurationTree tree;
    public final RejectionCause rejectionCause;
    public final ExhaustionReason exhaustionReason;
    /** The limit that stopped the run (EXHAUSTED only, otherwise -1). */
    public final int limit;
    /** Transition applications counted when the run halted. */
    public final int transitions;

    private Outcome(Verdict verdict, int depth, ConfigurationTree tree,
                    RejectionCause rejectionCause, ExhaustionReason exhaustionReason,
                    int limit, int transitions) {
        this.verdict = verdict;
        this.depth = depth;
        this.tree = Objects.requireNonNull(tree, "tree");
        this.rejectionCause = rejectionCause;
        this.exhaustionReason = exhaustionReason;
        this.limit = limit;
        this.transitions = transitions;
    }

    public static Outcome accepted(int depth, ConfigurationTree tree, int transitions) {
        return new Outcome(Verdict.ACCEPTED, depth, tree, null, null, -1, transitions);
    }

    public static Outcome rejected(int depth, RejectionCause cause, ConfigurationTree tree, int transitions) {
        return new Outcome(Verdict.REJECTED, depth, tree, Objects.requireNonNull(cause), null, -1, transitions);
    }

    public static Outcome exhausted(ExhaustionReason reason, int limit, ConfigurationTree tree, int transitions) {
        return new Outcome(Verdict.EXHAUSTED, tree.lastIndex(), tree, null,
                Objects.requireNonNull(reason), limit, transitions);
    }

    public boolean isAccepted() { return verdict == Verdict.ACCEPTED; }
    public boolean isRejected() { return verdict == Verdict.REJECTED; }
    public boolean isExhausted() { return verdict == Verdict.EXHAUSTED; }

    @Override public String toString() {
        return switch (verdict) {
            case ACCEPTED -> "Accepted(" + depth + ")";
            case REJECTED -> "Rejected(" + depth + ", " + rejectionCause + ")";
            case EXHAUSTED -> "Exhausted(" + exhaustionReason.description + ", limit=" + limit + ")";
        };
    }
}
