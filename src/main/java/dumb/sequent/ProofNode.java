package dumb.sequent;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One sequent in a proof. Children are owned by their parent; the parent link is for navigation
 * only. Nodes are created and expanded by {@link ProofSession}, which keeps {@link #status()} in
 * step with the children.
 */
public class ProofNode {

    public final int id;
    public final Sequent sequent;
    @Nullable
    private final ProofNode parent;
    private final List<ProofNode> children = new ArrayList<>();
    @Nullable
    private Application application;
    private Status status = Status.OPEN;

    ProofNode(int id, Sequent sequent, @Nullable ProofNode parent) {
        this.id = id;
        this.sequent = requireNonNull(sequent);
        this.parent = parent;
    }

    void expand(Application application, List<ProofNode> premises) {
        if (this.application != null) throw new IllegalStateException("Node " + id + " is already expanded");
        this.application = requireNonNull(application);
        children.addAll(premises);
    }

    /** Re-derives the status from the children; true if it changed. */
    boolean recompute() {
        var closed = application != null
                && children.size() == application.premises()
                && children.stream().allMatch(ProofNode::isClosed);
        var next = closed ? Status.CLOSED : Status.OPEN;
        var changed = next != status;
        status = next;
        return changed;
    }

    public Optional<ProofNode> parent() {
        return Optional.ofNullable(parent);
    }

    public List<ProofNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Application> application() {
        return Optional.ofNullable(application);
    }

    public Status status() {
        return status;
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    /** Not yet expanded by any rule. */
    public boolean isOpenLeaf() {
        return application == null;
    }

    public int depth() {
        return parent == null ? 0 : parent.depth() + 1;
    }

    @Override
    public String toString() {
        return "#" + id + (isClosed() ? " ✔ " : " ") + sequent;
    }

    public enum Status {OPEN, CLOSED}

    /**
     * The rule that expanded a node: label, selected side and formula index, the printed extra
     * argument and how many premises the rule produced.
     */
    public record Application(String rule, @Nullable Side side, int index, @Nullable String argument, int premises) {
        public Application {
            requireNonNull(rule);
        }

        @Override
        public String toString() {
            var where = side == null || index < 0 ? "" : " " + side + ' ' + index;
            return rule + where + (argument == null ? "" : " [" + argument + ']');
        }
    }
}
