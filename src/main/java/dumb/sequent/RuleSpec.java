package dumb.sequent;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A request to apply one rule: the rule, the side and index of the selected formula ({@code -1}
 * when none is selected) and the optional instantiation term, formula argument (invariant,
 * lemma, weakening formula) or template.
 */
public record RuleSpec(Rule rule, @Nullable Side side, int index, @Nullable Term term, @Nullable Formula formula,
                       @Nullable RuleTemplate template) {

    public RuleSpec {
        requireNonNull(rule);
        if (rule == Rule.CUSTOM && template == null)
            throw new IllegalArgumentException("Custom rule application needs a template");
    }

    public static RuleSpec of(Rule rule) {
        return new RuleSpec(rule, rule.side, -1, null, null, null);
    }

    public static RuleSpec of(Rule rule, @Nullable Side side, int index) {
        return new RuleSpec(rule, side, index, null, null, null);
    }

    public static RuleSpec custom(RuleTemplate template, Side side, int index) {
        return new RuleSpec(Rule.CUSTOM, side, index, null, null, template);
    }

    public RuleSpec withTerm(Term term) {
        return new RuleSpec(rule, side, index, requireNonNull(term), formula, template);
    }

    public RuleSpec withFormula(Formula formula) {
        return new RuleSpec(rule, side, index, term, requireNonNull(formula), template);
    }

    /** Side as given, falling back to the only side the rule works on. */
    @Nullable
    public Side effectiveSide() {
        return side != null ? side : rule.side;
    }

    public String label() {
        return template != null ? template.name() : rule.label;
    }

    /** Number of premises the rule yields, taken from the template for custom rules. */
    public int premises() {
        return template != null ? template.arity().premises : rule.premises;
    }

    /** Printable form of the extra argument, if any. */
    @Nullable
    public String argument() {
        if (term != null) return term.toString();
        if (formula != null) return formula.toString();
        return null;
    }
}
