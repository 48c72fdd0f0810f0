package dumb.sequent;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Capture-avoiding substitution, uniform renaming and variable collection over the AST.
 */
public enum Subst {
    ;

    public static Set<Term.Var> freeVars(Sequent s) {
        var vars = new HashSet<Term.Var>();
        s.lhs().forEach(f -> vars.addAll(freeVars(f)));
        s.rhs().forEach(f -> vars.addAll(freeVars(f)));
        return vars;
    }

    public static Set<Term.Var> freeVars(Formula f) {
        var vars = new HashSet<Term.Var>();
        collect(f, vars, false);
        return vars;
    }

    /** Every variable mentioned anywhere, bound or free. */
    public static Set<Term.Var> occurring(Sequent s) {
        var vars = new HashSet<Term.Var>();
        s.lhs().forEach(f -> collect(f, vars, true));
        s.rhs().forEach(f -> collect(f, vars, true));
        return vars;
    }

    public static Set<Term.Var> occurring(Formula f) {
        var vars = new HashSet<Term.Var>();
        collect(f, vars, true);
        return vars;
    }

    /** Variables a program mentions, assignment targets included. */
    public static Set<Term.Var> vars(Program p) {
        var vars = new HashSet<Term.Var>();
        collect(p, vars, true);
        return vars;
    }

    /** Variables a program may assign. */
    public static Set<Term.Var> boundVars(Program p) {
        var vars = new HashSet<Term.Var>();
        collectAssigned(p, vars);
        return vars;
    }

    private static void collect(Formula f, Set<Term.Var> out, boolean withBound) {
        if (f instanceof Formula.Atomic a) a.args().forEach(t -> out.addAll(t.vars()));
        else if (f instanceof Formula.Equals e) {
            out.addAll(e.left().vars());
            out.addAll(e.right().vars());
        } else if (f instanceof Formula.Not n) collect(n.inner(), out, withBound);
        else if (f instanceof Formula.Binary b) {
            collect(b.left(), out, withBound);
            collect(b.right(), out, withBound);
        } else if (f instanceof Formula.Quantified q) {
            var inner = new HashSet<Term.Var>();
            collect(q.body(), inner, withBound);
            if (withBound) inner.add(q.var());
            else inner.remove(q.var());
            out.addAll(inner);
        } else if (f instanceof Formula.Box b) {
            collect(b.program(), out, withBound);
            collect(b.body(), out, withBound);
        }
    }

    private static void collect(Program p, Set<Term.Var> out, boolean withBound) {
        if (p instanceof Program.Assign a) {
            out.add(a.var());
            out.addAll(a.value().vars());
        } else if (p instanceof Program.Test t) collect(t.condition(), out, withBound);
        else if (p instanceof Program.Seq s) {
            collect(s.first(), out, withBound);
            collect(s.second(), out, withBound);
        } else if (p instanceof Program.Choice c) {
            collect(c.left(), out, withBound);
            collect(c.right(), out, withBound);
        } else if (p instanceof Program.Star s) collect(s.body(), out, withBound);
        else if (p instanceof Program.If i) {
            collect(i.condition(), out, withBound);
            collect(i.then(), out, withBound);
            collect(i.otherwise(), out, withBound);
        } else if (p instanceof Program.While w) {
            collect(w.condition(), out, withBound);
            collect(w.body(), out, withBound);
            if (w.invariant() != null) collect(w.invariant(), out, withBound);
        } else if (p instanceof Program.For f) {
            out.add(f.var());
            out.addAll(f.lo().vars());
            out.addAll(f.hi().vars());
            collect(f.body(), out, withBound);
        }
    }

    private static void collectAssigned(Program p, Set<Term.Var> out) {
        if (p instanceof Program.Assign a) out.add(a.var());
        else if (p instanceof Program.Seq s) {
            collectAssigned(s.first(), out);
            collectAssigned(s.second(), out);
        } else if (p instanceof Program.Choice c) {
            collectAssigned(c.left(), out);
            collectAssigned(c.right(), out);
        } else if (p instanceof Program.Star s) collectAssigned(s.body(), out);
        else if (p instanceof Program.If i) {
            collectAssigned(i.then(), out);
            collectAssigned(i.otherwise(), out);
        } else if (p instanceof Program.While w) collectAssigned(w.body(), out);
        else if (p instanceof Program.For f) {
            out.add(f.var());
            collectAssigned(f.body(), out);
        }
    }

    public static Term substitute(Term t, Term.Var x, Term replacement) {
        if (t instanceof Term.Var v) return v.equals(x) ? replacement : v;
        if (t instanceof Term.Fn f)
            return new Term.Fn(f.name(), f.args().stream().map(a -> substitute(a, x, replacement)).toList());
        return t;
    }

    /**
     * Replaces the free occurrences of {@code x} by {@code replacement}, renaming quantified
     * variables that would capture it.
     *
     * @throws InadmissibleException if inside a box modality an occurrence of {@code x} is reached after a
     *                               variable of the replacement was reassigned, or after {@code x} was assigned on
     *                               some paths only
     */
    public static Formula substitute(Formula f, Term.Var x, Term replacement) {
        if (f instanceof Formula.Atomic a)
            return new Formula.Atomic(a.predicate(), a.args().stream().map(t -> substitute(t, x, replacement)).toList());
        if (f instanceof Formula.Equals e)
            return new Formula.Equals(substitute(e.left(), x, replacement), substitute(e.right(), x, replacement));
        if (f instanceof Formula.Not n) return new Formula.Not(substitute(n.inner(), x, replacement));
        if (f instanceof Formula.Binary b)
            return binary(b, substitute(b.left(), x, replacement), substitute(b.right(), x, replacement));
        if (f instanceof Formula.Quantified q) {
            if (q.var().equals(x) || !freeVars(q.body()).contains(x)) return q;
            if (replacement.vars().contains(q.var())) {
                var avoid = occurring(q.body());
                avoid.addAll(replacement.vars());
                avoid.add(x);
                var renamed = primed(q.var(), avoid);
                return q.with(renamed, substitute(rename(q.body(), q.var(), renamed), x, replacement));
            }
            return q.with(q.var(), substitute(q.body(), x, replacement));
        }
        if (f instanceof Formula.Box b) {
            if (!freeVars(b).contains(x)) return b;
            var assigned = boundVars(b.program());
            if (!assigned.contains(x) && replacement.vars().stream().noneMatch(assigned::contains))
                return new Formula.Box(substitute(b.program(), x, replacement), substitute(b.body(), x, replacement));
            var walk = new Walk(x, replacement);
            var program = walk.program(b.program());
            return new Formula.Box(program, walk.formula(b.body()));
        }
        return f;
    }

    /** Only called when the program assigns neither x nor a variable of the replacement. */
    private static Program substitute(Program p, Term.Var x, Term r) {
        if (p instanceof Program.Assign a) return new Program.Assign(a.var(), substitute(a.value(), x, r));
        if (p instanceof Program.Test t) return new Program.Test(substitute(t.condition(), x, r));
        if (p instanceof Program.Seq s) return new Program.Seq(substitute(s.first(), x, r), substitute(s.second(), x, r));
        if (p instanceof Program.Choice c)
            return new Program.Choice(substitute(c.left(), x, r), substitute(c.right(), x, r));
        if (p instanceof Program.Star s) return new Program.Star(substitute(s.body(), x, r));
        if (p instanceof Program.If i)
            return new Program.If(substitute(i.condition(), x, r), substitute(i.then(), x, r), substitute(i.otherwise(), x, r));
        if (p instanceof Program.While w)
            return new Program.While(substitute(w.condition(), x, r), substitute(w.body(), x, r),
                    w.invariant() == null ? null : substitute(w.invariant(), x, r));
        if (p instanceof Program.For f)
            return new Program.For(f.var(), substitute(f.lo(), x, r), substitute(f.hi(), x, r), substitute(f.body(), x, r));
        return p;
    }

    /**
     * Renames every occurrence of {@code from} to {@code to}, assignment targets included, up to
     * quantifiers that rebind {@code from}. {@code to} must not occur in {@code f}.
     */
    public static Formula rename(Formula f, Term.Var from, Term.Var to) {
        if (f instanceof Formula.Atomic a)
            return new Formula.Atomic(a.predicate(), a.args().stream().map(t -> substitute(t, from, to)).toList());
        if (f instanceof Formula.Equals e)
            return new Formula.Equals(substitute(e.left(), from, to), substitute(e.right(), from, to));
        if (f instanceof Formula.Not n) return new Formula.Not(rename(n.inner(), from, to));
        if (f instanceof Formula.Binary b) return binary(b, rename(b.left(), from, to), rename(b.right(), from, to));
        if (f instanceof Formula.Quantified q)
            return q.var().equals(from) ? q : q.with(q.var(), rename(q.body(), from, to));
        if (f instanceof Formula.Box b) return new Formula.Box(rename(b.program(), from, to), rename(b.body(), from, to));
        return f;
    }

    private static Program rename(Program p, Term.Var from, Term.Var to) {
        if (p instanceof Program.Assign a)
            return new Program.Assign(a.var().equals(from) ? to : a.var(), substitute(a.value(), from, to));
        if (p instanceof Program.Test t) return new Program.Test(rename(t.condition(), from, to));
        if (p instanceof Program.Seq s) return new Program.Seq(rename(s.first(), from, to), rename(s.second(), from, to));
        if (p instanceof Program.Choice c)
            return new Program.Choice(rename(c.left(), from, to), rename(c.right(), from, to));
        if (p instanceof Program.Star s) return new Program.Star(rename(s.body(), from, to));
        if (p instanceof Program.If i)
            return new Program.If(rename(i.condition(), from, to), rename(i.then(), from, to), rename(i.otherwise(), from, to));
        if (p instanceof Program.While w)
            return new Program.While(rename(w.condition(), from, to), rename(w.body(), from, to),
                    w.invariant() == null ? null : rename(w.invariant(), from, to));
        if (p instanceof Program.For f)
            return new Program.For(f.var().equals(from) ? to : f.var(), substitute(f.lo(), from, to),
                    substitute(f.hi(), from, to), rename(f.body(), from, to));
        return p;
    }

    static Formula binary(Formula.Binary b, Formula left, Formula right) {
        if (b instanceof Formula.And) return new Formula.And(left, right);
        if (b instanceof Formula.Or) return new Formula.Or(left, right);
        if (b instanceof Formula.Implies) return new Formula.Implies(left, right);
        return new Formula.Iff(left, right);
    }

    private static Term.Var primed(Term.Var v, Set<Term.Var> avoid) {
        var candidate = new Term.Var(v.name() + '\'');
        while (avoid.contains(candidate)) candidate = new Term.Var(candidate.name() + '\'');
        return candidate;
    }

    /** True if {@code x} may be replaced by {@code replacement} everywhere in {@code formulas}. */
    public static boolean admissible(List<Formula> formulas, Term.Var x, Term replacement) {
        try {
            formulas.forEach(f -> substitute(f, x, replacement));
            return true;
        } catch (InadmissibleException e) {
            return false;
        }
    }

    private enum Bound {FREE, BOUND, MIXED}

    /**
     * Substitution through a program in execution order. Occurrences of x after a definite
     * assignment to x are left alone. An occurrence reached after x was assigned on some paths only,
     * or after a variable of the replacement may have been reassigned, cannot be substituted.
     */
    private static final class Walk {
        private final Term.Var x;
        private final Term replacement;
        private final Set<Term.Var> replacementVars;
        private Bound bound = Bound.FREE;
        private boolean clash;

        Walk(Term.Var x, Term replacement) {
            this.x = x;
            this.replacement = replacement;
            this.replacementVars = replacement.vars();
        }

        private record Flow(Bound bound, boolean clash) {
            Flow join(Flow o) {
                return new Flow(bound == o.bound ? bound : Bound.MIXED, clash || o.clash);
            }
        }

        private Flow flow() {
            return new Flow(bound, clash);
        }

        private void flow(Flow f) {
            bound = f.bound();
            clash = f.clash();
        }

        /** True if the occurrences of x here are to be replaced. */
        private boolean live(boolean occurs, Object where) {
            if (!occurs || bound == Bound.BOUND) return false;
            if (bound == Bound.MIXED)
                throw new InadmissibleException(x + " is assigned on some paths only before " + where);
            if (clash)
                throw new InadmissibleException(x + " := " + replacement + " would be captured in " + where);
            return true;
        }

        Term term(Term t) {
            return live(t.vars().contains(x), t) ? substitute(t, x, replacement) : t;
        }

        Formula formula(Formula f) {
            return live(freeVars(f).contains(x), f) ? substitute(f, x, replacement) : f;
        }

        private void assign(Term.Var v) {
            if (v.equals(x)) bound = Bound.BOUND;
            if (replacementVars.contains(v)) clash = true;
        }

        Program program(Program p) {
            if (p instanceof Program.Assign a) {
                var value = term(a.value());
                assign(a.var());
                return new Program.Assign(a.var(), value);
            }
            if (p instanceof Program.Test t) return new Program.Test(formula(t.condition()));
            if (p instanceof Program.Seq s) {
                var first = program(s.first());
                return new Program.Seq(first, program(s.second()));
            }
            if (p instanceof Program.Choice c) {
                var entry = flow();
                var left = program(c.left());
                var afterLeft = flow();
                flow(entry);
                var right = program(c.right());
                flow(afterLeft.join(flow()));
                return new Program.Choice(left, right);
            }
            if (p instanceof Program.If i) {
                var condition = formula(i.condition());
                var entry = flow();
                var then = program(i.then());
                var afterThen = flow();
                flow(entry);
                var otherwise = program(i.otherwise());
                flow(afterThen.join(flow()));
                return new Program.If(condition, then, otherwise);
            }
            if (p instanceof Program.Star s) {
                var head = loopHead(s.body());
                var body = program(s.body());
                flow(head);
                return new Program.Star(body);
            }
            if (p instanceof Program.While w) {
                var head = loopHead(w.body());
                var condition = formula(w.condition());
                var invariant = w.invariant() == null ? null : formula(w.invariant());
                var body = program(w.body());
                flow(head);
                return new Program.While(condition, body, invariant);
            }
            if (p instanceof Program.For f) {
                var lo = term(f.lo());
                assign(f.var());
                var head = loopHead(f.body());
                var hi = term(f.hi());
                var body = program(f.body());
                flow(head);
                return new Program.For(f.var(), lo, hi, body);
            }
            return p;
        }

        /** The state at the head of a loop: the entry state joined with the state after any number of iterations. */
        private Flow loopHead(Program body) {
            var head = flow();
            while (true) {
                program(body);
                var next = head.join(flow());
                flow(next);
                if (next.equals(head)) return head;
                head = next;
            }
        }
    }

    /** A substitution that would change the meaning of a box modality. */
    public static class InadmissibleException extends RuntimeException {
        public InadmissibleException(String message) {
            super(message);
        }
    }
}
