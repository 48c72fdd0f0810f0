package dumb.sequent;

import dumb.sequent.Formula.Box;

import java.util.List;

import static dumb.sequent.RuleException.Reason.*;

/**
 * The rule engine: pure transformations from a sequent to its premises. An empty result means the
 * sequent is closed by an axiom. Nothing here mutates a proof tree; the only state touched is the
 * session's {@link FreshNames}.
 */
public enum Rules {
    ;

    public static List<Sequent> apply(Sequent s, RuleSpec spec, FreshNames names) throws RuleException {
        return switch (spec.rule()) {
            case ID -> identity(s, spec);
            case FALSE_L -> axiom(s, spec, Formula.FALSE);
            case TRUE_R -> axiom(s, spec, Formula.TRUE);

            case AND_L -> {
                var a = expect(target(s, spec), Formula.And.class, spec);
                yield List.of(rest(s, spec).plus(Side.LHS, a.left(), a.right()));
            }
            case AND_R -> {
                var a = expect(target(s, spec), Formula.And.class, spec);
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.RHS, a.left()), rest.plus(Side.RHS, a.right()));
            }
            case OR_L -> {
                var o = expect(target(s, spec), Formula.Or.class, spec);
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.LHS, o.left()), rest.plus(Side.LHS, o.right()));
            }
            case OR_R -> {
                var o = expect(target(s, spec), Formula.Or.class, spec);
                yield List.of(rest(s, spec).plus(Side.RHS, o.left(), o.right()));
            }
            case IMP_L -> {
                var i = expect(target(s, spec), Formula.Implies.class, spec);
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.RHS, i.left()), rest.plus(Side.LHS, i.right()));
            }
            case IMP_R -> {
                var i = expect(target(s, spec), Formula.Implies.class, spec);
                yield List.of(rest(s, spec).plus(Side.LHS, i.left()).plus(Side.RHS, i.right()));
            }
            case NOT_L -> {
                var n = expect(target(s, spec), Formula.Not.class, spec);
                yield List.of(rest(s, spec).plus(Side.RHS, n.inner()));
            }
            case NOT_R -> {
                var n = expect(target(s, spec), Formula.Not.class, spec);
                yield List.of(rest(s, spec).plus(Side.LHS, n.inner()));
            }
            case IFF_L -> {
                var i = expect(target(s, spec), Formula.Iff.class, spec);
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.LHS, i.left(), i.right()), rest.plus(Side.RHS, i.left(), i.right()));
            }
            case IFF_R -> {
                var i = expect(target(s, spec), Formula.Iff.class, spec);
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.RHS, new Formula.Implies(i.left(), i.right())),
                        rest.plus(Side.RHS, new Formula.Implies(i.right(), i.left())));
            }

            case FORALL_R -> {
                var q = expect(target(s, spec), Formula.Forall.class, spec);
                var c = names.fresh(q.var().name(), s);
                yield List.of(rest(s, spec).plus(Side.RHS, Subst.rename(q.body(), q.var(), c)));
            }
            case EXISTS_L -> {
                var q = expect(target(s, spec), Formula.Exists.class, spec);
                var c = names.fresh(q.var().name(), s);
                yield List.of(rest(s, spec).plus(Side.LHS, Subst.rename(q.body(), q.var(), c)));
            }
            case FORALL_L -> {
                var q = expect(target(s, spec), Formula.Forall.class, spec);
                yield List.of(s.plus(Side.LHS, instantiate(q, spec)));
            }
            case EXISTS_R -> {
                var q = expect(target(s, spec), Formula.Exists.class, spec);
                yield List.of(s.plus(Side.RHS, instantiate(q, spec)));
            }

            case SKIP_L, SKIP_R -> {
                var b = box(target(s, spec), Program.Skip.class, spec);
                yield List.of(rest(s, spec).plus(spec.effectiveSide(), b.body()));
            }
            case SEQ_L, SEQ_R -> {
                var b = box(target(s, spec), Program.Seq.class, spec);
                var seq = (Program.Seq) b.program();
                yield List.of(rest(s, spec).plus(spec.effectiveSide(), new Box(seq.first(), new Box(seq.second(), b.body()))));
            }
            case CHOICE_L -> {
                var b = box(target(s, spec), Program.Choice.class, spec);
                var c = (Program.Choice) b.program();
                yield List.of(rest(s, spec).plus(Side.LHS, new Box(c.left(), b.body()), new Box(c.right(), b.body())));
            }
            case CHOICE_R -> {
                var b = box(target(s, spec), Program.Choice.class, spec);
                var c = (Program.Choice) b.program();
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.RHS, new Box(c.left(), b.body())), rest.plus(Side.RHS, new Box(c.right(), b.body())));
            }
            case STAR_UNFOLD -> {
                var b = box(target(s, spec), Program.Star.class, spec);
                var star = (Program.Star) b.program();
                var rest = rest(s, spec);
                var side = spec.effectiveSide();
                yield List.of(rest.plus(side, b.body()), rest.plus(side, new Box(star.body(), b)));
            }
            case IF_R -> {
                var b = box(target(s, spec), Program.If.class, spec);
                var i = (Program.If) b.program();
                var rest = rest(s, spec);
                yield List.of(
                        rest.plus(Side.LHS, i.condition()).plus(Side.RHS, new Box(i.then(), b.body())),
                        rest.plus(Side.LHS, Formula.not(i.condition())).plus(Side.RHS, new Box(i.otherwise(), b.body())));
            }
            case WHILE_UNFOLD -> {
                var b = box(target(s, spec), Program.While.class, spec);
                var w = (Program.While) b.program();
                var rest = rest(s, spec);
                yield List.of(
                        rest.plus(Side.LHS, Formula.not(w.condition())).plus(Side.RHS, b.body()),
                        rest.plus(Side.LHS, w.condition()).plus(Side.RHS, new Box(w.body(), b)));
            }
            case WHILE_INV -> whileInvariant(s, spec);
            case FOR_R -> forLoop(s, spec);
            case ASSIGN_L, ASSIGN_R -> assignment(s, spec, names);
            case TEST_L -> {
                var b = box(target(s, spec), Program.Test.class, spec);
                var t = (Program.Test) b.program();
                var rest = rest(s, spec);
                yield List.of(rest.plus(Side.RHS, t.condition()), rest.plus(Side.LHS, b.body()));
            }
            case TEST_R -> {
                var b = box(target(s, spec), Program.Test.class, spec);
                var t = (Program.Test) b.program();
                yield List.of(rest(s, spec).plus(Side.LHS, t.condition()).plus(Side.RHS, b.body()));
            }

            case WEAK_L, WEAK_R -> List.of(s.plus(side(spec), formulaArgument(spec, "formula to add")));
            case CONTRACT_L, CONTRACT_R -> contraction(s, spec);
            case CUT -> {
                var lemma = formulaArgument(spec, "lemma");
                yield List.of(s.plus(Side.RHS, lemma), s.plus(Side.LHS, lemma));
            }
            case CUSTOM -> TemplateRules.apply(s, spec);
        };
    }

    /** The selected formula, after checking the side is one the rule works on and the index exists. */
    static Formula target(Sequent s, RuleSpec spec) throws RuleException {
        var side = spec.effectiveSide();
        if (side == null)
            throw new RuleException(NO_MATCHING_FORMULA, spec.label() + " needs a selected formula");
        if (!spec.rule().accepts(side))
            throw new RuleException(NO_MATCHING_FORMULA, spec.label() + " does not apply on the " + side);
        var list = s.side(side);
        if (spec.index() < 0 || spec.index() >= list.size())
            throw new RuleException(NO_MATCHING_FORMULA, "No formula at index " + spec.index() + " on the " + side);
        return list.get(spec.index());
    }

    /** Side for rules that need no selected formula. */
    static Side side(RuleSpec spec) throws RuleException {
        var side = spec.effectiveSide();
        if (side == null || !spec.rule().accepts(side))
            throw new RuleException(NO_MATCHING_FORMULA, spec.label() + " does not apply on the " + side);
        return side;
    }

    /** The sequent without the selected formula. */
    static Sequent rest(Sequent s, RuleSpec spec) {
        return s.without(spec.effectiveSide(), spec.index());
    }

    private static <T extends Formula> T expect(Formula f, Class<T> type, RuleSpec spec) throws RuleException {
        if (!type.isInstance(f))
            throw new RuleException(PRECONDITION_FAILED, spec.label() + " expects " + type.getSimpleName() + ", not " + f);
        return type.cast(f);
    }

    private static Box box(Formula f, Class<? extends Program> type, RuleSpec spec) throws RuleException {
        if (!(f instanceof Box b) || !type.isInstance(b.program()))
            throw new RuleException(PRECONDITION_FAILED, spec.label() + " expects [" + type.getSimpleName() + "]P, not " + f);
        return b;
    }

    private static List<Sequent> identity(Sequent s, RuleSpec spec) throws RuleException {
        if (spec.index() >= 0) {
            var f = target(s, spec);
            if (s.side(spec.effectiveSide().other()).contains(f)) return List.of();
            throw new RuleException(PRECONDITION_FAILED, f + " does not occur on the " + spec.effectiveSide().other());
        }
        if (s.lhs().stream().anyMatch(s.rhs()::contains)) return List.of();
        throw new RuleException(PRECONDITION_FAILED, "No formula occurs on both sides");
    }

    private static List<Sequent> axiom(Sequent s, RuleSpec spec, Formula constant) throws RuleException {
        var present = spec.index() >= 0 ? target(s, spec).equals(constant) : s.side(spec.rule().side).contains(constant);
        if (present) return List.of();
        throw new RuleException(PRECONDITION_FAILED, spec.label() + " needs " + constant + " on the " + spec.rule().side);
    }

    private static Formula instantiate(Formula.Quantified q, RuleSpec spec) throws RuleException {
        var t = spec.term();
        if (t == null) throw new RuleException(PRECONDITION_FAILED, spec.label() + " needs an instantiation term");
        try {
            return Subst.substitute(q.body(), q.var(), t);
        } catch (Subst.InadmissibleException e) {
            throw new RuleException(INVALID_SUBSTITUTION, e.getMessage(), e);
        }
    }

    private static Formula formulaArgument(RuleSpec spec, String what) throws RuleException {
        var f = spec.formula();
        if (f == null) throw new RuleException(PRECONDITION_FAILED, spec.label() + " needs a " + what);
        return f;
    }

    private static List<Sequent> whileInvariant(Sequent s, RuleSpec spec) throws RuleException {
        var b = box(target(s, spec), Program.While.class, spec);
        var w = (Program.While) b.program();
        var inv = spec.formula() != null ? spec.formula() : w.invariant();
        if (inv == null)
            throw new RuleException(PRECONDITION_FAILED, spec.label() + " needs an invariant, the loop declares none");
        var init = rest(s, spec).plus(Side.RHS, inv);
        var preserve = new Sequent(List.of(inv, w.condition()), List.of(new Box(w.body(), inv)));
        var exit = new Sequent(List.of(inv, Formula.not(w.condition())), List.of(b.body()));
        return List.of(init, preserve, exit);
    }

    private static List<Sequent> forLoop(Sequent s, RuleSpec spec) throws RuleException {
        var f = target(s, spec);
        if (f instanceof Box b) {
            var loop = b.program() instanceof Program.For fl ? Program.desugar(fl) : b.program();
            if (loop instanceof Program.Seq seq && isDesugaredFor(seq))
                return List.of(rest(s, spec).plus(Side.RHS, new Box(seq.first(), new Box(seq.second(), b.body()))));
        }
        throw new RuleException(PRECONDITION_FAILED, spec.label() + " expects a for-loop, not " + f);
    }

    /** {@code i := lo; while i < hi do {body; i := i + 1}}, exactly as the parser expands it. */
    private static boolean isDesugaredFor(Program.Seq seq) {
        if (!(seq.first() instanceof Program.Assign init)
                || !(seq.second() instanceof Program.While w)
                || !(w.condition() instanceof Formula.Atomic cond) || !cond.predicate().equals("<") || cond.args().size() != 2
                || !(w.body() instanceof Program.Seq step))
            return false;
        var expanded = Program.desugar(new Program.For(init.var(), init.value(), cond.args().get(1), step.first()));
        return expanded.equals(seq);
    }

    /**
     * {@code [x:=e]P} becomes {@code P[x:=e]}. When a program inside P assigns x or a variable of e,
     * a fresh x' is introduced instead, with {@code x' = e} on the left and P renamed to x'.
     */
    private static List<Sequent> assignment(Sequent s, RuleSpec spec, FreshNames names) throws RuleException {
        var b = box(target(s, spec), Program.Assign.class, spec);
        var a = (Program.Assign) b.program();
        var rest = rest(s, spec);
        var side = spec.effectiveSide();
        if (Subst.admissible(List.of(b.body()), a.var(), a.value()))
            return List.of(rest.plus(side, Subst.substitute(b.body(), a.var(), a.value())));
        var x = names.fresh(a.var().name(), s);
        return List.of(rest.plus(Side.LHS, new Formula.Equals(x, a.value())).plus(side, Subst.rename(b.body(), a.var(), x)));
    }

    private static List<Sequent> contraction(Sequent s, RuleSpec spec) throws RuleException {
        var side = side(spec);
        var list = s.side(side);
        if (spec.index() >= 0) {
            var f = target(s, spec);
            for (var j = 0; j < list.size(); j++)
                if (j != spec.index() && list.get(j).equals(f)) return List.of(s.without(side, spec.index()));
            throw new RuleException(CONTRACTION_NO_DUPLICATE, f + " occurs only once on the " + side);
        }
        for (var i = 0; i < list.size(); i++)
            for (var j = i + 1; j < list.size(); j++)
                if (list.get(i).equals(list.get(j))) return List.of(s.without(side, j));
        throw new RuleException(CONTRACTION_NO_DUPLICATE, "No duplicate formula on the " + side);
    }
}
