package dumb.sequent;

import static java.util.Objects.requireNonNull;

/**
 * A rule could not be applied. The proof tree is left exactly as it was.
 */
public class RuleException extends Exception {

    private final Reason reason;

    public RuleException(Reason reason, String message) {
        super(message);
        this.reason = requireNonNull(reason);
    }

    public RuleException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = requireNonNull(reason);
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }

    public enum Reason {
        /** The selected formula does not have the shape the rule needs, or an argument is missing. */
        PRECONDITION_FAILED,
        /** No formula at the given index, or the rule does not work on that side. */
        NO_MATCHING_FORMULA,
        /** Substitution would capture a variable assigned by a program. */
        INVALID_SUBSTITUTION,
        CONTRACTION_NO_DUPLICATE,
        TEMPLATE_PARSE_FAILED,
        /** The node already has children or is closed. */
        NODE_NOT_OPEN,
        UNKNOWN_NODE,
        UNKNOWN_RULE
    }
}
