package dumb.sequent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class ProofTree {

    public final ProofNode root;

    ProofTree(ProofNode root) {
        this.root = requireNonNull(root);
    }

    public ProofNode.Status status() {
        return root.status();
    }

    public Optional<ProofNode> find(int id) {
        return nodes().stream().filter(n -> n.id == id).findFirst();
    }

    /** All nodes, depth first. */
    public List<ProofNode> nodes() {
        var out = new ArrayList<ProofNode>();
        collect(root, out);
        return out;
    }

    /** Leaves still waiting for a rule. */
    public List<ProofNode> openLeaves() {
        return nodes().stream().filter(n -> n.isOpenLeaf() && !n.isClosed()).toList();
    }

    private static void collect(ProofNode n, List<ProofNode> out) {
        out.add(n);
        n.children().forEach(c -> collect(c, out));
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var n : nodes()) {
            sb.append("  ".repeat(n.depth())).append(n);
            n.application().ifPresent(a -> sb.append("   by ").append(a));
            sb.append('\n');
        }
        return sb.toString();
    }
}
