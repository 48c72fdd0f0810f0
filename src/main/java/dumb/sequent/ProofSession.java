package dumb.sequent;

import dumb.sequent.SequentParser.ParseException;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.sequent.RuleException.Reason.*;
import static dumb.sequent.util.Log.message;
import static dumb.sequent.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * One interactive proof: owns the tree, the fresh-name counter and the registered rule templates.
 * Not thread-safe; a session has a single writer.
 */
public class ProofSession {

    private final FreshNames names;
    private final Map<String, RuleTemplate> templates = new LinkedHashMap<>();
    private final Map<Integer, ProofNode> nodes = new HashMap<>();
    @Nullable
    private ProofTree tree;
    private int nextId;

    public ProofSession() {
        this(new FreshNames());
    }

    public ProofSession(Configuration config) {
        this(new FreshNames(config.freshSeparator()));
    }

    public ProofSession(FreshNames names) {
        this.names = requireNonNull(names);
    }

    public ProofTree start(String text) throws ParseException {
        return start(SequentParser.parseSequent(text));
    }

    /** Discards any previous proof and starts a new one at {@code goal}. */
    public ProofTree start(Sequent goal) {
        names.reset();
        nodes.clear();
        nextId = 0;
        var root = newNode(goal, null);
        tree = new ProofTree(root);
        message("Started proof of " + goal);
        return tree;
    }

    public ProofTree tree() {
        if (tree == null) throw new IllegalStateException("No proof started");
        return tree;
    }

    public boolean started() {
        return tree != null;
    }

    public ProofNode.Status status() {
        return tree().status();
    }

    public ProofNode node(int id) throws RuleException {
        var n = nodes.get(id);
        if (n == null) throw new RuleException(UNKNOWN_NODE, "No node " + id);
        return n;
    }

    public Derivation export() {
        return Derivation.of(tree().root);
    }

    /**
     * Applies a rule to an open leaf. On success the premises become children of the node and
     * closure is recomputed up to the root; on failure nothing changes.
     */
    public List<ProofNode> apply(int nodeId, RuleSpec spec) throws RuleException {
        var node = node(nodeId);
        if (!node.isOpenLeaf())
            throw new RuleException(NODE_NOT_OPEN, "Node " + nodeId + " was already expanded by " + node.application().orElseThrow().rule());
        var premises = Rules.apply(node.sequent, spec, names);
        if (premises.size() != spec.premises())
            throw new IllegalStateException(spec.label() + " produced " + premises.size() + " premise(s), expected " + spec.premises());
        var children = premises.stream().map(p -> newNode(p, node)).toList();
        node.expand(new ProofNode.Application(spec.label(), spec.effectiveSide(), spec.index(), spec.argument(), spec.premises()), children);
        for (var n = Optional.of(node); n.isPresent(); n = n.get().parent())
            if (!n.get().recompute()) break;
        message("Applied " + spec.label() + " to #" + nodeId + ", " + children.size() + " premise(s)"
                + (node.isClosed() ? ", branch closed" : ""));
        if (tree().status() == ProofNode.Status.CLOSED) message("Proof complete");
        return children;
    }

    /**
     * Command-surface variant: the rule is looked up by label, alias or template name and the
     * argument is parsed as the rule requires.
     */
    public List<ProofNode> apply(int nodeId, String ruleName, @Nullable Side side, int index, @Nullable String argument)
            throws RuleException, ParseException {
        return apply(nodeId, spec(ruleName, side, index, argument));
    }

    public RuleSpec spec(String ruleName, @Nullable Side side, int index, @Nullable String argument)
            throws RuleException, ParseException {
        var template = templates.get(ruleName);
        if (template != null) return RuleSpec.custom(template, side != null ? side : template.side(), index);
        var rule = Rule.byName(ruleName).orElseThrow(() -> new RuleException(UNKNOWN_RULE, "Unknown rule " + ruleName));
        var spec = new RuleSpec(rule, side != null ? side : rule.side, index, null, null, null);
        var arg = argument == null || argument.isBlank() ? null : argument.trim();
        if (arg == null) return spec;
        return switch (rule.argument) {
            case TERM -> spec.withTerm(SequentParser.parseTerm(arg));
            case FORMULA -> spec.withFormula(SequentParser.parseFormula(arg));
            case NONE -> {
                warning(rule.label + " takes no argument, ignoring '" + arg + "'");
                yield spec;
            }
        };
    }

    public void register(RuleTemplate template) {
        if (templates.put(template.name(), template) != null) message("Replaced rule template " + template.name());
    }

    public void registerAll(Collection<RuleTemplate> list) {
        list.forEach(this::register);
    }

    public List<RuleTemplate> templates() {
        return List.copyOf(templates.values());
    }

    private ProofNode newNode(Sequent sequent, @Nullable ProofNode parent) {
        var n = new ProofNode(nextId++, sequent, parent);
        nodes.put(n.id, n);
        return n;
    }
}
